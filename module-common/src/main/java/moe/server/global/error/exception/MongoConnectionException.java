package moe.server.global.error.exception;

import moe.server.global.error.CommonErrorCode;

/** Establishing the shared MongoDB connection failed. There is no retry. */
public class MongoConnectionException extends BaseException {

  public MongoConnectionException(String hosts, Throwable cause) {
    super(CommonErrorCode.DATABASE_CONNECTION_FAILURE, cause, hosts);
  }
}
