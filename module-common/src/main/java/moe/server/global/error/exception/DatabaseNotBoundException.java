package moe.server.global.error.exception;

import moe.server.global.error.CommonErrorCode;

public class DatabaseNotBoundException extends BaseException {

  public DatabaseNotBoundException() {
    super(CommonErrorCode.DATABASE_NOT_BOUND);
  }
}
