package moe.server.infrastructure.mongodb;

import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

@Slf4j
abstract class AbstractMongoConnection implements MongoConnection {

  private final MongoClient client;
  private final MongoEndpoint endpoint;

  AbstractMongoConnection(MongoClient client, MongoEndpoint endpoint) {
    this.client = Objects.requireNonNull(client, "client");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
  }

  @Override
  public MongoClient client() {
    return client;
  }

  @Override
  public List<ServerAddress> hosts() {
    return endpoint.hosts();
  }

  MongoEndpoint endpoint() {
    return endpoint;
  }

  @Override
  public void close() {
    log.info("[MongoDB] Closing shared connection to {}", endpoint.describe());
    client.close();
  }

  @Override
  public String toString() {
    return "MongoConnection" + endpoint.describe();
  }
}
