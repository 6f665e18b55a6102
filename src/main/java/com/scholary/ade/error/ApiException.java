package com.scholary.ade.error;

/**
 * Thrown when the parse API rejects a request with a non-2xx status.
 *
 * <p>The predicates let callers branch on the failure category without comparing raw status codes,
 * e.g. retry on {@link #isRateLimited()} or {@link #isServerError()}.
 */
public class ApiException extends AdeException {

  private final int statusCode;
  private final String errorMessage;
  private final ErrorDetail detail;

  public ApiException(int statusCode, String errorMessage, ErrorDetail detail) {
    super(format(statusCode, errorMessage, detail));
    this.statusCode = statusCode;
    this.errorMessage = errorMessage;
    this.detail = detail == null ? ErrorDetail.absent() : detail;
  }

  private static String format(int statusCode, String errorMessage, ErrorDetail detail) {
    if (detail != null && detail.isPresent()) {
      return String.format(
          "Landing AI API error (status %d): %s - %s", statusCode, errorMessage, detail);
    }
    return String.format("Landing AI API error (status %d): %s", statusCode, errorMessage);
  }

  public int getStatusCode() {
    return statusCode;
  }

  /** Human-readable message for the status code, without the detail. */
  public String getErrorMessage() {
    return errorMessage;
  }

  public ErrorDetail getDetail() {
    return detail;
  }

  public boolean isUnauthorized() {
    return statusCode == StatusCodes.UNAUTHORIZED;
  }

  public boolean isPaymentRequired() {
    return statusCode == StatusCodes.PAYMENT_REQUIRED;
  }

  public boolean isRateLimited() {
    return statusCode == StatusCodes.TOO_MANY_REQUESTS;
  }

  public boolean isBadRequest() {
    return statusCode == StatusCodes.BAD_REQUEST;
  }

  /**
   * True for any 422 response, including those whose body did not match the structured validation
   * shape (those are raised as {@link ValidationErrorsException} instead).
   */
  public boolean isValidationError() {
    return statusCode == StatusCodes.UNPROCESSABLE_ENTITY;
  }

  public boolean isServerError() {
    return statusCode >= StatusCodes.INTERNAL_SERVER_ERROR;
  }

  public boolean isTimeout() {
    return statusCode == StatusCodes.GATEWAY_TIMEOUT;
  }

  /**
   * True for 206. A 206 is a success status and never reaches the classifier, so this only holds
   * for exceptions constructed directly.
   */
  public boolean isPartialContent() {
    return statusCode == StatusCodes.PARTIAL_CONTENT;
  }
}
