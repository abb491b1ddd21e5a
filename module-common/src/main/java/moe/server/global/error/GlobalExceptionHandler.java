package moe.server.global.error;

import lombok.extern.slf4j.Slf4j;
import moe.server.global.error.dto.ErrorResponse;
import moe.server.global.error.exception.BaseException;
import moe.server.global.error.exception.RouteNotFoundException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /** Business exceptions keep their formatted message. */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    return ErrorResponse.toResponseEntity(e);
  }

  /** Paths outside the route table and the static prefix. */
  @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class})
  protected ResponseEntity<ErrorResponse> handleNoRoute(Exception e) {
    String path =
        e instanceof NoHandlerFoundException nhf
            ? nhf.getRequestURL()
            : ((NoResourceFoundException) e).getResourcePath();
    log.debug("No route for {}", path);
    return ErrorResponse.toResponseEntity(new RouteNotFoundException(path));
  }

  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);

    // 500 hides the detail; the stack trace is in the log
    return ErrorResponse.toResponseEntity(CommonErrorCode.INTERNAL_SERVER_ERROR);
  }
}
