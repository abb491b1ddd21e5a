package moe.server.infrastructure.binding;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import moe.server.infrastructure.mongodb.MongoConnection;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the shared connection's logical database onto every request before dispatch.
 *
 * <p>The {@link ScopedDatabase} is resolved once here and the same instance is set on every
 * request, so handlers never reconnect. The filter only adds the {@link RequestDatabase#ATTRIBUTE}
 * attribute.
 *
 * <p>Not a {@code @Component}: {@code MongoBindingConfiguration} registers it only when binding is
 * enabled.
 */
@Slf4j
public class MongoRequestBinder extends OncePerRequestFilter {

  private final ScopedDatabase scopedDatabase;

  public MongoRequestBinder(MongoConnection connection, String dbName) {
    this.scopedDatabase = ScopedDatabase.of(connection, dbName);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    RequestDatabase.bind(request, scopedDatabase);
    log.debug(
        "[Binder] {} {} -> db '{}'",
        request.getMethod(),
        request.getRequestURI(),
        scopedDatabase.name());

    filterChain.doFilter(request, response);
  }

  public ScopedDatabase scopedDatabase() {
    return scopedDatabase;
  }
}
