package com.scholary.ade.error;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A single field-level validation failure reported by the API.
 *
 * @param location path to the offending field; segments are JSON strings or integers
 * @param message the failure message
 * @param type the failure type, e.g. "value_error"
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidationError(
    @JsonProperty("loc") List<JsonNode> location,
    @JsonProperty("msg") String message,
    @JsonProperty("type") String type) {

  public ValidationError {
    location = location == null ? List.of() : List.copyOf(location);
  }

  /** The location rendered as a dotted path, e.g. "body.pages.0". */
  public String locationPath() {
    return location.stream().map(JsonNode::asText).collect(Collectors.joining("."));
  }
}
