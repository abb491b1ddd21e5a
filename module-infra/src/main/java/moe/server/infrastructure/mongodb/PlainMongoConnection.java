package moe.server.infrastructure.mongodb;

import com.mongodb.client.MongoClient;
import java.util.Optional;

public final class PlainMongoConnection extends AbstractMongoConnection {

  PlainMongoConnection(MongoClient client, MongoEndpoint endpoint) {
    super(client, endpoint);
  }

  @Override
  public Optional<String> render() {
    return Optional.empty();
  }
}
