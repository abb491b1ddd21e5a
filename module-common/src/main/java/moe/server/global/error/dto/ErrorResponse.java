package moe.server.global.error.dto;

import java.time.LocalDateTime;
import lombok.Builder;
import moe.server.global.error.ErrorCode;
import moe.server.global.error.exception.BaseException;
import org.springframework.http.ResponseEntity;

public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

  @Builder
  public ErrorResponse {}

  /** Business exception: carries the formatted message (route name, hosts, ...). */
  public static ErrorResponse of(BaseException e) {
    return of(e.getErrorCode(), e.getMessage());
  }

  /** Bare code: the template is used as is, details stay in the log. */
  public static ErrorResponse of(ErrorCode errorCode) {
    return of(errorCode, errorCode.getMessage());
  }

  public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
    return ResponseEntity.status(e.getErrorCode().getStatus()).body(of(e));
  }

  public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
    return ResponseEntity.status(errorCode.getStatus()).body(of(errorCode));
  }

  private static ErrorResponse of(ErrorCode errorCode, String message) {
    return ErrorResponse.builder()
        .status(errorCode.getStatus().value())
        .code(errorCode.getCode())
        .message(message)
        .timestamp(LocalDateTime.now())
        .build();
  }
}
