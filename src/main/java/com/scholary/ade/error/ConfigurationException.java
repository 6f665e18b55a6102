package com.scholary.ade.error;

/**
 * Thrown when a parse request is misconfigured by the caller.
 *
 * <p>Detected before any network call, e.g. both a document URL and a file were supplied.
 */
public class ConfigurationException extends AdeException {

  public ConfigurationException(String message) {
    super(message);
  }
}
