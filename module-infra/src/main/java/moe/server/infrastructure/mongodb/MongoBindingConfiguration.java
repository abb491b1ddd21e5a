package moe.server.infrastructure.mongodb;

import lombok.extern.slf4j.Slf4j;
import moe.server.infrastructure.binding.MongoRequestBinder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * MongoDB request binding.
 *
 * <h3>Activation</h3>
 *
 * Only when {@code moe.use-mongo} is exactly {@code "true"} ({@link OnMongoEnabledCondition}).
 * Otherwise no connection is created, no binder is registered and requests carry no database.
 *
 * <h3>Assembly</h3>
 *
 * <ol>
 *   <li>bind and validate {@code moe.mongodb.*}
 *   <li>create the single shared {@link MongoConnection}
 *   <li>hand that connection to the {@link MongoRequestBinder} constructor and register the binder
 *       ahead of dispatch for every path
 * </ol>
 *
 * Any failure here aborts startup.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@Conditional(OnMongoEnabledCondition.class)
@EnableConfigurationProperties({MongoBindingProperties.class, DebugToolbarProperties.class})
public class MongoBindingConfiguration {

  /** Runs right after the container's own highest-precedence filters. */
  public static final int BINDER_ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

  @Bean
  @ConditionalOnMissingBean
  public MongoConnectionFactory mongoConnectionFactory() {
    return new MongoConnectionFactory();
  }

  @Bean
  public MongoConnection sharedMongoConnection(
      MongoConnectionFactory factory,
      MongoBindingProperties properties,
      DebugToolbarProperties debugToolbar) {
    return factory.create(properties, debugToolbar.isEnabled());
  }

  @Bean
  public FilterRegistrationBean<MongoRequestBinder> mongoRequestBinderRegistration(
      MongoConnection sharedMongoConnection, MongoBindingProperties properties) {
    MongoRequestBinder binder =
        new MongoRequestBinder(sharedMongoConnection, properties.getDbName());
    FilterRegistrationBean<MongoRequestBinder> registration = new FilterRegistrationBean<>(binder);
    registration.setName("mongoRequestBinder");
    registration.setOrder(BINDER_ORDER);
    registration.addUrlPatterns("/*");

    log.info(
        "[Binder] Requests bind database '{}' of {}",
        properties.getDbName(),
        sharedMongoConnection);
    return registration;
  }

  @Bean
  public MongoConnectionHealthIndicator mongoConnectionHealthIndicator(
      MongoConnection sharedMongoConnection, MongoBindingProperties properties) {
    return new MongoConnectionHealthIndicator(sharedMongoConnection, properties.getDbName());
  }
}
