package com.scholary.ade.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Predicate;

/**
 * Maps a non-2xx response to the exception the caller sees.
 *
 * <p>A 422 whose body is the structured validation shape ({@code {"detail": [{loc, msg, type}]}})
 * becomes a {@link ValidationErrorsException}. Everything else becomes an {@link ApiException}
 * with a fixed message for the status code and whatever "detail" the body carried.
 */
public class ErrorClassifier {

  private static final TypeReference<List<ValidationError>> VALIDATION_ERRORS =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;
  private final ObjectReader bodyReader;

  public ErrorClassifier(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.bodyReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /**
   * Classify an error response.
   *
   * @param statusCode the HTTP status code (expected outside 200-299)
   * @param body the raw response body, possibly empty
   * @return the exception to throw
   */
  public AdeException classify(int statusCode, byte[] body) {
    String text = body == null ? "" : new String(body, StandardCharsets.UTF_8);
    JsonNode json = readJson(text);

    if (statusCode == StatusCodes.UNPROCESSABLE_ENTITY) {
      List<ValidationError> errors = readValidationErrors(json);
      if (errors != null) {
        return new ValidationErrorsException(errors);
      }
    }

    ErrorDetail detail;
    if (json != null && json.isObject()) {
      detail = ErrorDetail.fromJson(json.get("detail"));
    } else {
      detail = ErrorDetail.text(text);
    }
    return new ApiException(statusCode, messageFor(statusCode), detail);
  }

  /** Returns null when the body is not a single JSON document. */
  private JsonNode readJson(String text) {
    try {
      return bodyReader.readTree(text);
    } catch (JsonProcessingException e) {
      return null;
    }
  }

  /** Returns null unless the body has a "detail" array of validation records. */
  private List<ValidationError> readValidationErrors(JsonNode json) {
    if (json == null || !json.isObject()) {
      return null;
    }
    JsonNode detail = json.get("detail");
    if (detail == null || !detail.isArray()) {
      return null;
    }
    for (JsonNode item : detail) {
      if (!isValidationItem(item)) {
        return null;
      }
    }
    return objectMapper.convertValue(detail, VALIDATION_ERRORS);
  }

  /** An object whose "msg" and "type" are strings and whose "loc" is an array, when present. */
  private static boolean isValidationItem(JsonNode item) {
    if (!item.isObject()) {
      return false;
    }
    return hasType(item.get("loc"), JsonNode::isArray)
        && hasType(item.get("msg"), JsonNode::isTextual)
        && hasType(item.get("type"), JsonNode::isTextual);
  }

  private static boolean hasType(JsonNode field, Predicate<JsonNode> check) {
    return field == null || field.isNull() || check.test(field);
  }

  /** Human-readable message for common status codes. */
  public static String messageFor(int statusCode) {
    switch (statusCode) {
      case StatusCodes.BAD_REQUEST:
        return "Bad request: Invalid request parameters";
      case StatusCodes.UNAUTHORIZED:
        return "Unauthorized: Invalid or missing API key";
      case StatusCodes.PAYMENT_REQUIRED:
        return "Payment required: Insufficient credits";
      case StatusCodes.UNPROCESSABLE_ENTITY:
        return "Unprocessable entity: Input validation failed";
      case StatusCodes.TOO_MANY_REQUESTS:
        return "Too many requests: Rate limit exceeded";
      case StatusCodes.INTERNAL_SERVER_ERROR:
        return "Internal server error: Failed to process document";
      case StatusCodes.GATEWAY_TIMEOUT:
        return "Gateway timeout: Request processing exceeded time limit";
      default:
        return String.format("API request failed with status %d", statusCode);
    }
  }
}
