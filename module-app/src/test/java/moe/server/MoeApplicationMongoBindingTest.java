package moe.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.mongodb.ServerAddress;
import moe.server.infrastructure.binding.RequestDatabase;
import moe.server.infrastructure.binding.ScopedDatabase;
import moe.server.infrastructure.mongodb.DisplayableMongoConnection;
import moe.server.infrastructure.mongodb.MongoConnection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Binding on, debug toolbar on.
 *
 * <p>The startup ping is off; the driver connects lazily, so no server at {@code h} is needed. The
 * health ping times out after 500ms and reports DOWN, details included.
 */
@SpringBootTest(
    properties = {
      "moe.use-mongo=true",
      "moe.mongodb.url=mongodb://h",
      "moe.mongodb.port=27017",
      "moe.mongodb.db-name=moe",
      "moe.mongodb.verify-on-startup=false",
      "moe.mongodb.server-selection-timeout=500ms",
      "moe.debug-toolbar.enabled=true"
    })
@AutoConfigureMockMvc
class MoeApplicationMongoBindingTest {

  @Autowired private MockMvc mockMvc;

  @Autowired private ApplicationContext context;

  @Autowired private MongoConnection sharedConnection;

  @Test
  @DisplayName("one connection, bound to h:27017")
  void singleConnection() {
    assertThat(context.getBeanNamesForType(MongoConnection.class)).hasSize(1);
    assertThat(sharedConnection.hosts()).containsExactly(new ServerAddress("h", 27017));
  }

  @Test
  @DisplayName("every request exposes the moe database of the same connection")
  void sameHandleAcrossRequests() throws Exception {
    ScopedDatabase first = boundDatabase("/");
    ScopedDatabase second = boundDatabase("/docs");
    ScopedDatabase third = boundDatabase("/gp/ei");

    assertThat(first.connection()).isSameAs(sharedConnection);
    assertThat(first.name()).isEqualTo("moe");
    assertThat(first.database().getName()).isEqualTo("moe");
    assertThat(second).isSameAs(first);
    assertThat(third).isSameAs(first);
  }

  @Test
  @DisplayName("debug toolbar shows the connection on pages")
  void debugFooter() throws Exception {
    assertThat(sharedConnection).isInstanceOf(DisplayableMongoConnection.class);

    mockMvc
        .perform(get("/about"))
        .andExpect(status().isOk())
        .andExpect(content().string(containsString("class=\"debug-toolbar\"")))
        .andExpect(content().string(containsString("MongoDB: <b>")));
  }

  @Test
  @DisplayName("health reports the connection and its rendering")
  void healthComponent() throws Exception {
    mockMvc
        .perform(get("/actuator/health"))
        .andExpect(jsonPath("$.components.mongoConnection.details.database").value("moe"))
        .andExpect(
            jsonPath("$.components.mongoConnection.details.display")
                .value(containsString("MongoDB: <b>")));
  }

  private ScopedDatabase boundDatabase(String path) throws Exception {
    return RequestDatabase.require(mockMvc.perform(get(path)).andReturn().getRequest());
  }
}
