package moe.server.infrastructure.mongodb;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import moe.server.global.error.exception.InvalidConfigurationException;
import moe.server.global.error.exception.MongoConnectionException;
import org.bson.Document;

/**
 * Builds the shared {@link MongoConnection}.
 *
 * <p>The variant is fixed here, once: {@link DisplayableMongoConnection} while the debug toolbar
 * is on, {@link PlainMongoConnection} otherwise.
 *
 * <p>With {@code verify-on-startup} the server is pinged before the connection is handed out. A
 * failed ping closes the client and throws {@link MongoConnectionException}; startup aborts and
 * nothing retries.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoConnectionFactory {

  static final String PING_DATABASE = "admin";

  private final Function<MongoClientSettings, MongoClient> clientCreator;

  public MongoConnectionFactory() {
    this(MongoClients::create);
  }

  public MongoConnection create(MongoBindingProperties properties, boolean displayable) {
    if (properties.getPort() == null) {
      throw new InvalidConfigurationException("moe.mongodb.port is required");
    }
    MongoEndpoint endpoint = MongoEndpoint.resolve(properties.getUrl(), properties.getPort());
    MongoClient client =
        clientCreator.apply(endpoint.toSettings(properties.getServerSelectionTimeout()));

    if (properties.isVerifyOnStartup()) {
      verify(client, endpoint);
    }

    MongoConnection connection =
        displayable
            ? new DisplayableMongoConnection(client, endpoint)
            : new PlainMongoConnection(client, endpoint);
    log.info(
        "[MongoDB] Shared connection ready: {} (verified={}, displayable={})",
        endpoint.describe(),
        properties.isVerifyOnStartup(),
        displayable);
    return connection;
  }

  private void verify(MongoClient client, MongoEndpoint endpoint) {
    try {
      client.getDatabase(PING_DATABASE).runCommand(new Document("ping", 1));
    } catch (MongoException e) {
      log.error("[MongoDB] Startup ping failed for {}", endpoint.describe(), e);
      client.close();
      throw new MongoConnectionException(endpoint.describe(), e);
    }
  }
}
