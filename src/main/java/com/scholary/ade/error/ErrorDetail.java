package com.scholary.ade.error;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The optional "detail" carried by an {@link ApiException}.
 *
 * <p>Either absent, plain text (a JSON string detail, or the raw body when it was not JSON), or an
 * arbitrary JSON value the client does not interpret.
 */
public record ErrorDetail(Kind kind, String text, JsonNode value) {

  private static final ErrorDetail ABSENT = new ErrorDetail(Kind.ABSENT, null, null);

  public enum Kind {
    ABSENT,
    TEXT,
    STRUCTURED
  }

  public static ErrorDetail absent() {
    return ABSENT;
  }

  public static ErrorDetail text(String text) {
    return new ErrorDetail(Kind.TEXT, text, null);
  }

  public static ErrorDetail structured(JsonNode value) {
    return new ErrorDetail(Kind.STRUCTURED, null, value);
  }

  /**
   * Build a detail from a parsed JSON value: strings become text, anything else stays structured.
   */
  public static ErrorDetail fromJson(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return ABSENT;
    }
    if (node.isTextual()) {
      return text(node.asText());
    }
    return structured(node);
  }

  public boolean isPresent() {
    return kind != Kind.ABSENT;
  }

  @Override
  public String toString() {
    if (kind == Kind.TEXT) {
      return text;
    }
    if (kind == Kind.STRUCTURED) {
      return value.toString();
    }
    return "";
  }
}
