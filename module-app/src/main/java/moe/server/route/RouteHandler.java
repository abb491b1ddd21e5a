package moe.server.route;

import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * Serves one or more named routes.
 *
 * <p>{@code RouteConfig} attaches each table entry to the first handler that supports its name.
 * Entries nobody supports answer 501.
 */
public interface RouteHandler {

  boolean supports(String routeName);

  ServerResponse handle(RouteEntry route, ServerRequest request) throws Exception;
}
