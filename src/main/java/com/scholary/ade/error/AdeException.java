package com.scholary.ade.error;

/**
 * Base exception for all parse client failures.
 *
 * <p>Unchecked, like other remote-service failures in this codebase: callers decide whether to
 * retry, and most failures (bad credentials, conflicting inputs) cannot be fixed by retrying.
 */
public class AdeException extends RuntimeException {

  public AdeException(String message) {
    super(message);
  }

  public AdeException(String message, Throwable cause) {
    super(message, cause);
  }
}
