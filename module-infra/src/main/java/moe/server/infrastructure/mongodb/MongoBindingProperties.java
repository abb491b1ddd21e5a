package moe.server.infrastructure.mongodb;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * {@code moe.mongodb.*} settings.
 *
 * <p>Bound only when {@code moe.use-mongo} is {@code "true"}; a missing or malformed value then
 * fails startup.
 *
 * <pre>
 * moe:
 *   use-mongo: "true"
 *   mongodb:
 *     url: mongodb://localhost
 *     port: 27017
 *     db-name: moe
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "moe.mongodb")
public class MongoBindingProperties {

  @NotBlank(message = "moe.mongodb.url is required when moe.use-mongo is true")
  private String url;

  @NotNull(message = "moe.mongodb.port is required when moe.use-mongo is true")
  @Min(1)
  @Max(65535)
  private Integer port;

  /** Logical database exposed on every request. */
  @NotBlank(message = "moe.mongodb.db-name is required when moe.use-mongo is true")
  private String dbName;

  /** Ping the server before startup completes. */
  private boolean verifyOnStartup = true;

  @NotNull private Duration serverSelectionTimeout = Duration.ofSeconds(10);
}
