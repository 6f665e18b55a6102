package com.scholary.ade.error;

/**
 * Thrown when the request could not be completed at the transport level.
 *
 * <p>Covers local file read failures, connection and DNS errors, request timeouts and
 * cancellation of the {@code ParseContext}. The underlying cause is always attached.
 */
public class TransportException extends AdeException {

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
