package moe.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/**
 * MOE web service.
 *
 * <p>Boot's own MongoDB client is excluded: the only client in the process is the shared one from
 * {@code MongoBindingConfiguration}, and only when {@code moe.use-mongo} is {@code "true"}.
 */
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
public class MoeApplication {

  public static void main(String[] args) {
    SpringApplication.run(MoeApplication.class, args);
  }
}
