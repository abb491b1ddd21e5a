package moe.server.infrastructure.mongodb;

import com.mongodb.MongoException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Exposes the shared connection under {@code /actuator/health} as {@code mongoConnection}.
 *
 * <p>Pings the request database. The debug rendering is added as a detail when the displayable
 * variant is active.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoConnectionHealthIndicator implements HealthIndicator {

  private final MongoConnection connection;
  private final String dbName;

  @Override
  public Health health() {
    final Health.Builder builder = ping();
    builder.withDetail("database", dbName).withDetail("connection", connection.toString());
    connection.render().ifPresent(display -> builder.withDetail("display", display));
    return builder.build();
  }

  private Health.Builder ping() {
    try {
      connection.database(dbName).runCommand(new Document("ping", 1));
      return Health.up().withDetail("status", "connected");
    } catch (MongoException e) {
      log.warn("[MongoDB] Health check failed: {}", e.getMessage());
      return Health.down(e).withDetail("status", "disconnected");
    }
  }
}
