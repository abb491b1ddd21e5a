package moe.server.infrastructure.mongodb;

import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import java.util.List;
import java.util.Optional;

/**
 * The process-wide MongoDB connection.
 *
 * <p>Created once at startup by {@link MongoConnectionFactory} and shared read-only by every
 * request. Two variants exist, picked once from configuration:
 *
 * <ul>
 *   <li>{@link PlainMongoConnection}: no display rendering
 *   <li>{@link DisplayableMongoConnection}: {@link #render()} yields an HTML fragment for the debug
 *       toolbar
 * </ul>
 *
 * <p>Reads and writes behave identically on both variants. Request code borrows the connection
 * and must never {@link #close()} it; the application context closes it on shutdown.
 */
public interface MongoConnection extends AutoCloseable {

  MongoClient client();

  /** Seed hosts as resolved from configuration. Empty for {@code mongodb+srv://} endpoints. */
  List<ServerAddress> hosts();

  default MongoDatabase database(String name) {
    return client().getDatabase(name);
  }

  /**
   * Display rendering of this connection's identity.
   *
   * @return the rendering, or empty when the debug toolbar is off
   */
  Optional<String> render();

  @Override
  void close();
}
