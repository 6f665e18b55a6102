package com.scholary.ade.error;

import java.util.List;

/**
 * Thrown for a 422 response whose body lists structured validation failures.
 *
 * <p>The message names the first failure only; {@link #getErrors()} has all of them.
 */
public class ValidationErrorsException extends AdeException {

  private final List<ValidationError> errors;

  public ValidationErrorsException(List<ValidationError> errors) {
    super(format(errors));
    this.errors = errors == null ? List.of() : List.copyOf(errors);
  }

  private static String format(List<ValidationError> errors) {
    if (errors == null || errors.isEmpty()) {
      return "validation error";
    }
    return "validation error: " + errors.get(0).message();
  }

  public List<ValidationError> getErrors() {
    return errors;
  }
}
