package moe.server.global.error.exception;

import moe.server.global.error.CommonErrorCode;

/** A required setting is missing or malformed. Thrown during startup only. */
public class InvalidConfigurationException extends BaseException {

  public InvalidConfigurationException(String detail) {
    super(CommonErrorCode.INVALID_CONFIGURATION, detail);
  }

  public InvalidConfigurationException(String detail, Throwable cause) {
    super(CommonErrorCode.INVALID_CONFIGURATION, cause, detail);
  }
}
