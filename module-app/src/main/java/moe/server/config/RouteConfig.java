package moe.server.config;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import moe.server.global.error.dto.ErrorResponse;
import moe.server.global.error.exception.BaseException;
import moe.server.global.error.exception.RouteNotAttachedException;
import moe.server.route.MoeRoutes;
import moe.server.route.RouteEntry;
import moe.server.route.RouteHandler;
import moe.server.route.RouteTable;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.HandlerFunction;
import org.springframework.web.servlet.function.RequestPredicate;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * Registers the route table with Spring MVC.
 *
 * <p>Each entry is matched through {@link RouteTable#resolve} (exact, case-sensitive, any method)
 * and bound to the first {@link RouteHandler} supporting its name. Static assets are served by Spring MVC under {@code
 * /static/**} ({@code spring.mvc.static-path-pattern}).
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class RouteConfig {

  @Bean
  public RouteTable routeTable() {
    return MoeRoutes.table();
  }

  @Bean
  public RouterFunction<ServerResponse> moeRouter(
      RouteTable routeTable, ObjectProvider<RouteHandler> routeHandlers) {
    List<RouteHandler> handlers = routeHandlers.orderedStream().toList();
    RouterFunctions.Builder builder = RouterFunctions.route();

    for (RouteEntry entry : routeTable.entries()) {
      builder.route(resolvesTo(routeTable, entry), handlerFor(entry, handlers));
    }
    log.info("[Routes] Registered {} routes", routeTable.size());

    return builder.onError(BaseException.class, (e, request) -> toErrorResponse((BaseException) e))
        .build();
  }

  /** Matches when the table itself resolves the request path to {@code entry}. */
  static RequestPredicate resolvesTo(RouteTable routeTable, RouteEntry entry) {
    return request ->
        routeTable
            .resolve(request.requestPath().pathWithinApplication().value())
            .filter(entry::equals)
            .isPresent();
  }

  private static HandlerFunction<ServerResponse> handlerFor(
      RouteEntry entry, List<RouteHandler> handlers) {
    for (RouteHandler handler : handlers) {
      if (handler.supports(entry.name())) {
        log.info(
            "[Routes] {} -> {} ({})",
            entry.name(),
            entry.path(),
            handler.getClass().getSimpleName());
        return request -> handler.handle(entry, request);
      }
    }
    log.info("[Routes] {} -> {} (not attached)", entry.name(), entry.path());
    return request -> {
      throw new RouteNotAttachedException(entry.name());
    };
  }

  private static ServerResponse toErrorResponse(BaseException e) {
    log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    return ServerResponse.status(e.getErrorCode().getStatus())
        .contentType(MediaType.APPLICATION_JSON)
        .body(ErrorResponse.of(e));
  }
}
