package moe.server.route;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import moe.server.global.error.exception.RouteCollisionException;
import moe.server.global.error.exception.RouteNotFoundException;

/**
 * Fixed name-to-path table, built once at startup.
 *
 * <p>Lookups are exact and case-sensitive. A duplicate name or path fails the build.
 */
public final class RouteTable {

  private final Map<String, RouteEntry> byName;
  private final Map<String, RouteEntry> byPath;

  private RouteTable(Map<String, RouteEntry> byName, Map<String, RouteEntry> byPath) {
    this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
    this.byPath = Map.copyOf(byPath);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Entries in registration order. */
  public List<RouteEntry> entries() {
    return List.copyOf(byName.values());
  }

  /** Path to entry. The router dispatches every request through this lookup. */
  public Optional<RouteEntry> resolve(String path) {
    return Optional.ofNullable(byPath.get(path));
  }

  /**
   * Name to path, for building links to a route.
   *
   * @throws RouteNotFoundException if no route carries {@code name}
   */
  public String pathOf(String name) {
    RouteEntry entry = byName.get(name);
    if (entry == null) {
      throw new RouteNotFoundException(name);
    }
    return entry.path();
  }

  public int size() {
    return byName.size();
  }

  public static final class Builder {

    private final Map<String, RouteEntry> byName = new LinkedHashMap<>();
    private final Map<String, RouteEntry> byPath = new LinkedHashMap<>();

    private Builder() {}

    public Builder add(String name, String path) {
      RouteEntry entry = new RouteEntry(name, path);
      if (byName.containsKey(name)) {
        throw new RouteCollisionException("name '" + name + "' registered twice");
      }
      RouteEntry samePath = byPath.get(path);
      if (samePath != null) {
        throw new RouteCollisionException(
            "path '" + path + "' claimed by '" + samePath.name() + "' and '" + name + "'");
      }
      byName.put(name, entry);
      byPath.put(path, entry);
      return this;
    }

    public RouteTable build() {
      return new RouteTable(byName, byPath);
    }
  }
}
