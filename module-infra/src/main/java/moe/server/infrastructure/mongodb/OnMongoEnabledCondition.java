package moe.server.infrastructure.mongodb;

import org.springframework.boot.autoconfigure.condition.ConditionMessage;
import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Matches only when {@code moe.use-mongo} is exactly {@code "true"}.
 *
 * <p>{@code @ConditionalOnProperty} compares case-insensitively; {@code "TRUE"} must not enable
 * the binding.
 */
public class OnMongoEnabledCondition extends SpringBootCondition {

  public static final String PROPERTY = "moe.use-mongo";

  @Override
  public ConditionOutcome getMatchOutcome(
      ConditionContext context, AnnotatedTypeMetadata metadata) {
    String value = context.getEnvironment().getProperty(PROPERTY);
    ConditionMessage.Builder message = ConditionMessage.forCondition("MongoDB request binding");
    if ("true".equals(value)) {
      return ConditionOutcome.match(message.because(PROPERTY + " is 'true'"));
    }
    return ConditionOutcome.noMatch(message.because(PROPERTY + " is '" + value + "'"));
  }
}
