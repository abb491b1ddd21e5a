package moe.server.infrastructure.mongodb;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** {@code moe.debug-toolbar.enabled}: selects the displayable connection variant. */
@Getter
@Setter
@ConfigurationProperties(prefix = "moe.debug-toolbar")
public class DebugToolbarProperties {

  private boolean enabled = false;
}
