package moe.server.global.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Configuration / routing (C) ===
  INVALID_CONFIGURATION("C001", "Invalid configuration: %s", HttpStatus.INTERNAL_SERVER_ERROR),
  ROUTE_NOT_FOUND("C002", "No route registered for '%s'", HttpStatus.NOT_FOUND),
  ROUTE_COLLISION("C003", "Route collision: %s", HttpStatus.INTERNAL_SERVER_ERROR),

  // === Server (S) ===
  INTERNAL_SERVER_ERROR("S001", "Internal server error.", HttpStatus.INTERNAL_SERVER_ERROR),
  DATABASE_CONNECTION_FAILURE(
      "S002", "Could not connect to MongoDB at %s", HttpStatus.SERVICE_UNAVAILABLE),
  ROUTE_NOT_ATTACHED("S003", "No handler attached to route '%s'", HttpStatus.NOT_IMPLEMENTED),
  DATABASE_NOT_BOUND(
      "S004", "No database is bound to this request", HttpStatus.SERVICE_UNAVAILABLE);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
