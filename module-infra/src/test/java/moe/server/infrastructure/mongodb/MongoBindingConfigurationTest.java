package moe.server.infrastructure.mongodb;

import static org.assertj.core.api.Assertions.assertThat;

import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClients;
import java.util.concurrent.atomic.AtomicInteger;
import moe.server.global.error.exception.MongoConnectionException;
import moe.server.infrastructure.binding.MongoRequestBinder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.web.servlet.FilterRegistrationBean;

/**
 * Conditional wiring of the request binding.
 *
 * <p>Startup ping is off so no MongoDB server is needed; the driver connects lazily.
 */
class MongoBindingConfigurationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(MongoBindingConfiguration.class)
          .withPropertyValues(
              "moe.mongodb.url=mongodb://h",
              "moe.mongodb.port=27017",
              "moe.mongodb.db-name=moe",
              "moe.mongodb.verify-on-startup=false");

  @Nested
  @DisplayName("use-mongo = true")
  class Enabled {

    @Test
    @DisplayName("one shared connection, handed to the binder")
    void bindsSharedConnection() {
      contextRunner
          .withPropertyValues("moe.use-mongo=true")
          .run(
              context -> {
                assertThat(context).hasSingleBean(MongoConnection.class);
                MongoConnection connection = context.getBean(MongoConnection.class);
                assertThat(connection).isInstanceOf(PlainMongoConnection.class);
                assertThat(connection.hosts()).containsExactly(new ServerAddress("h", 27017));

                FilterRegistrationBean<?> registration =
                    context.getBean("mongoRequestBinderRegistration", FilterRegistrationBean.class);
                assertThat(registration.getOrder())
                    .isEqualTo(MongoBindingConfiguration.BINDER_ORDER);
                assertThat(registration.getUrlPatterns()).containsExactly("/*");

                MongoRequestBinder binder = (MongoRequestBinder) registration.getFilter();
                assertThat(binder.scopedDatabase().connection()).isSameAs(connection);
                assertThat(binder.scopedDatabase().name()).isEqualTo("moe");
                assertThat(binder.scopedDatabase().database().getName()).isEqualTo("moe");
              });
    }

    @Test
    @DisplayName("connection factory runs exactly once")
    void createsOnce() {
      AtomicInteger created = new AtomicInteger();
      MongoConnectionFactory countingFactory =
          new MongoConnectionFactory(
              settings -> {
                created.incrementAndGet();
                return MongoClients.create(settings);
              });

      contextRunner
          .withPropertyValues("moe.use-mongo=true")
          .withBean(MongoConnectionFactory.class, () -> countingFactory)
          .run(
              context -> {
                context.getBean(MongoConnection.class);
                context.getBean(MongoConnectionHealthIndicator.class);
                assertThat(created).hasValue(1);
              });
    }

    @Test
    @DisplayName("debug toolbar selects the displayable variant")
    void debugToolbar() {
      contextRunner
          .withPropertyValues("moe.use-mongo=true", "moe.debug-toolbar.enabled=true")
          .run(
              context -> {
                MongoConnection connection = context.getBean(MongoConnection.class);
                assertThat(connection).isInstanceOf(DisplayableMongoConnection.class);
                assertThat(connection.render()).hasValueSatisfying(
                    display -> assertThat(display).contains("MongoDB:"));
              });
    }

    @Test
    @DisplayName("malformed port aborts startup")
    void malformedPort() {
      contextRunner
          .withPropertyValues("moe.use-mongo=true", "moe.mongodb.port=abc")
          .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("missing db-name aborts startup")
    void missingDbName() {
      contextRunner
          .withPropertyValues("moe.use-mongo=true", "moe.mongodb.db-name=")
          .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("unreachable server aborts startup when the ping is on")
    void unreachableServer() {
      contextRunner
          .withPropertyValues(
              "moe.use-mongo=true",
              "moe.mongodb.url=mongodb://127.0.0.1",
              "moe.mongodb.port=1",
              "moe.mongodb.verify-on-startup=true",
              "moe.mongodb.server-selection-timeout=200ms")
          .run(
              context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .hasStackTraceContaining(MongoConnectionException.class.getName());
              });
    }
  }

  @ParameterizedTest(name = "use-mongo = ''{0}''")
  @ValueSource(strings = {"false", "TRUE", "yes", ""})
  @DisplayName("anything but 'true' leaves binding off")
  void disabled(String flag) {
    contextRunner
        .withPropertyValues("moe.use-mongo=" + flag)
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              assertThat(context).doesNotHaveBean(MongoConnection.class);
              assertThat(context).doesNotHaveBean(FilterRegistrationBean.class);
            });
  }

  @Test
  @DisplayName("missing flag leaves binding off")
  void missingFlag() {
    contextRunner.run(
        context -> {
          assertThat(context).doesNotHaveBean(MongoConnection.class);
          assertThat(context).doesNotHaveBean(MongoConnectionFactory.class);
        });
  }
}
