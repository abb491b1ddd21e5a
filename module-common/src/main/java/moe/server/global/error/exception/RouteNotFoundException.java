package moe.server.global.error.exception;

import moe.server.global.error.CommonErrorCode;

public class RouteNotFoundException extends BaseException {

  public RouteNotFoundException(String nameOrPath) {
    super(CommonErrorCode.ROUTE_NOT_FOUND, nameOrPath);
  }
}
