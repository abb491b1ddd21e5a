package moe.server.global.error.exception;

import moe.server.global.error.CommonErrorCode;

/** The route exists in the table but nothing in this process serves it. */
public class RouteNotAttachedException extends BaseException {

  public RouteNotAttachedException(String routeName) {
    super(CommonErrorCode.ROUTE_NOT_ATTACHED, routeName);
  }
}
