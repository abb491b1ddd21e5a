package moe.server.route;

import moe.server.global.error.exception.InvalidConfigurationException;

/**
 * One named route.
 *
 * @param name logical endpoint name, e.g. {@code gp_ei}
 * @param path literal URL path, e.g. {@code /gp/ei}
 */
public record RouteEntry(String name, String path) {

  public RouteEntry {
    if (name == null || name.isBlank()) {
      throw new InvalidConfigurationException("route name must not be blank");
    }
    if (path == null || !path.startsWith("/")) {
      throw new InvalidConfigurationException("route '" + name + "' path must start with '/'");
    }
  }
}
