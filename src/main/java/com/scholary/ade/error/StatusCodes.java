package com.scholary.ade.error;

/** HTTP status codes the parse API documents. */
public final class StatusCodes {

  public static final int OK = 200;
  public static final int PARTIAL_CONTENT = 206;
  public static final int BAD_REQUEST = 400;
  public static final int UNAUTHORIZED = 401;
  public static final int PAYMENT_REQUIRED = 402;
  public static final int UNPROCESSABLE_ENTITY = 422;
  public static final int TOO_MANY_REQUESTS = 429;
  public static final int INTERNAL_SERVER_ERROR = 500;
  public static final int GATEWAY_TIMEOUT = 504;

  private StatusCodes() {}

  public static boolean isSuccess(int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }
}
