package moe.server.infrastructure.binding;

import jakarta.servlet.ServletRequest;
import java.util.Optional;
import moe.server.global.error.exception.DatabaseNotBoundException;

/** Per-request accessor for the database bound by {@link MongoRequestBinder}. */
public final class RequestDatabase {

  public static final String ATTRIBUTE = RequestDatabase.class.getName() + ".DB";

  private RequestDatabase() {}

  public static Optional<ScopedDatabase> find(ServletRequest request) {
    return Optional.ofNullable((ScopedDatabase) request.getAttribute(ATTRIBUTE));
  }

  /**
   * @throws DatabaseNotBoundException when binding is disabled
   */
  public static ScopedDatabase require(ServletRequest request) {
    return find(request).orElseThrow(DatabaseNotBoundException::new);
  }

  static void bind(ServletRequest request, ScopedDatabase database) {
    request.setAttribute(ATTRIBUTE, database);
  }
}
