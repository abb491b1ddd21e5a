package moe.server.route;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import moe.server.global.error.exception.InvalidConfigurationException;
import moe.server.infrastructure.mongodb.MongoConnection;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * Static HTML pages for {@code home}, {@code docs} and {@code about}.
 *
 * <p>Pages load from {@code classpath:pages/<route>.html} at startup; a missing page fails
 * startup. While the debug toolbar is on, each page gets a footer with the shared connection's
 * rendering.
 */
@Slf4j
@Component
public class PageRouteHandler implements RouteHandler {

  static final String PAGE_LOCATION = "pages/";
  static final String DEBUG_TOOLBAR_CLASS = "debug-toolbar";

  private static final List<String> PAGE_ROUTES =
      List.of(MoeRoutes.HOME, MoeRoutes.DOCS, MoeRoutes.ABOUT);
  private static final MediaType TEXT_HTML_UTF8 =
      new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8);

  private final Map<String, String> pages;
  private final ObjectProvider<MongoConnection> sharedConnection;

  public PageRouteHandler(ObjectProvider<MongoConnection> sharedConnection) {
    this.sharedConnection = sharedConnection;
    this.pages = loadPages();
  }

  @Override
  public boolean supports(String routeName) {
    return pages.containsKey(routeName);
  }

  @Override
  public ServerResponse handle(RouteEntry route, ServerRequest request) {
    String page = pages.get(route.name());
    String body = debugFooter().map(footer -> page.replace("</body>", footer)).orElse(page);
    return ServerResponse.ok().contentType(TEXT_HTML_UTF8).body(body);
  }

  private Optional<String> debugFooter() {
    return Optional.ofNullable(sharedConnection.getIfAvailable())
        .flatMap(MongoConnection::render)
        .map(
            display ->
                "<div class=\"" + DEBUG_TOOLBAR_CLASS + "\">" + display + "</div>\n</body>");
  }

  private static Map<String, String> loadPages() {
    Map<String, String> loaded = new LinkedHashMap<>();
    for (String route : PAGE_ROUTES) {
      ClassPathResource resource = new ClassPathResource(PAGE_LOCATION + route + ".html");
      if (!resource.exists()) {
        throw new InvalidConfigurationException("missing page resource " + resource.getPath());
      }
      try (InputStream in = resource.getInputStream()) {
        loaded.put(route, StreamUtils.copyToString(in, StandardCharsets.UTF_8));
      } catch (IOException e) {
        throw new InvalidConfigurationException(
            "unreadable page resource " + resource.getPath(), e);
      }
    }
    log.debug("[Routes] Loaded pages {}", loaded.keySet());
    return Map.copyOf(loaded);
  }
}
