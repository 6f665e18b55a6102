package com.scholary.ade.error;

/** Thrown when a successful response body is not the expected JSON. */
public class DecodingException extends AdeException {

  public DecodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
