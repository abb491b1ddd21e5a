package moe.server.global.error.exception;

import moe.server.global.error.CommonErrorCode;

public class RouteCollisionException extends BaseException {

  public RouteCollisionException(String detail) {
    super(CommonErrorCode.ROUTE_COLLISION, detail);
  }
}
