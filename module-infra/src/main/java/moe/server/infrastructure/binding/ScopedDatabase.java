package moe.server.infrastructure.binding;

import com.mongodb.client.MongoDatabase;
import java.util.Objects;
import moe.server.global.error.exception.InvalidConfigurationException;
import moe.server.infrastructure.mongodb.MongoConnection;

/**
 * The database handle a request sees: one logical database of the shared connection.
 *
 * @param connection the shared connection, borrowed
 * @param name logical database name
 * @param database handle for {@code name}
 */
public record ScopedDatabase(MongoConnection connection, String name, MongoDatabase database) {

  public ScopedDatabase {
    Objects.requireNonNull(connection, "connection");
    Objects.requireNonNull(database, "database");
  }

  public static ScopedDatabase of(MongoConnection connection, String name) {
    if (name == null || name.isBlank()) {
      throw new InvalidConfigurationException("moe.mongodb.db-name must not be blank");
    }
    return new ScopedDatabase(connection, name, connection.database(name));
  }
}
