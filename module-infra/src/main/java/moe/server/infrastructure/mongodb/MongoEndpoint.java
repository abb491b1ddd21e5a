package moe.server.infrastructure.mongodb;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.ServerAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import moe.server.global.error.exception.InvalidConfigurationException;

/**
 * Where the shared connection points, resolved from {@code moe.mongodb.url} and {@code
 * moe.mongodb.port}.
 *
 * <ul>
 *   <li>{@code mongodb://h1,h2:27018}: hosts without a port get the configured port, hosts with
 *       one keep it
 *   <li>{@code mongodb+srv://cluster}: used as is, SRV records carry the ports
 *   <li>{@code localhost}: bare host name combined with the configured port
 * </ul>
 *
 * @param connectionString parsed URL, {@code null} for a bare host name
 * @param hosts seed addresses, empty for SRV
 */
public record MongoEndpoint(ConnectionString connectionString, List<ServerAddress> hosts) {

  private static final String SCHEME = "mongodb://";
  private static final String SRV_SCHEME = "mongodb+srv://";

  public MongoEndpoint {
    hosts = List.copyOf(hosts);
  }

  public static MongoEndpoint resolve(String url, int port) {
    if (url == null || url.isBlank()) {
      throw new InvalidConfigurationException("moe.mongodb.url must not be blank");
    }
    if (port < 1 || port > 65535) {
      throw new InvalidConfigurationException("moe.mongodb.port out of range: " + port);
    }
    String trimmed = url.trim();
    try {
      if (!trimmed.startsWith(SCHEME) && !trimmed.startsWith(SRV_SCHEME)) {
        return new MongoEndpoint(null, List.of(toAddress(trimmed, port)));
      }
      ConnectionString connectionString = new ConnectionString(trimmed);
      if (connectionString.isSrvProtocol()) {
        return new MongoEndpoint(connectionString, List.of());
      }
      List<ServerAddress> hosts =
          connectionString.getHosts().stream().map(host -> toAddress(host, port)).toList();
      return new MongoEndpoint(connectionString, hosts);
    } catch (IllegalArgumentException | MongoException e) {
      throw new InvalidConfigurationException("malformed moe.mongodb.url", e);
    }
  }

  public boolean isSrv() {
    return connectionString != null && connectionString.isSrvProtocol();
  }

  public MongoClientSettings toSettings(Duration serverSelectionTimeout) {
    MongoClientSettings.Builder builder = MongoClientSettings.builder();
    if (connectionString != null) {
      builder.applyConnectionString(connectionString);
    }
    builder.applyToClusterSettings(
        cluster -> {
          if (!isSrv()) {
            cluster.hosts(hosts);
          }
          cluster.serverSelectionTimeout(serverSelectionTimeout.toMillis(), TimeUnit.MILLISECONDS);
        });
    return builder.build();
  }

  /** Host list for logs and display. Never contains credentials. */
  public String describe() {
    if (isSrv()) {
      return "[" + SRV_SCHEME + connectionString.getHosts().get(0) + "]";
    }
    return hosts.toString();
  }

  @Override
  public String toString() {
    return "MongoEndpoint" + describe();
  }

  private static ServerAddress toAddress(String host, int port) {
    return hasExplicitPort(host) ? new ServerAddress(host) : new ServerAddress(host, port);
  }

  private static boolean hasExplicitPort(String host) {
    if (host.startsWith("[")) {
      return host.contains("]:");
    }
    int colon = host.indexOf(':');
    return colon > 0 && colon == host.lastIndexOf(':');
  }
}
