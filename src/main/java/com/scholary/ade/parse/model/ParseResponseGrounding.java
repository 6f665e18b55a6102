package com.scholary.ade.parse.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Optional;

/**
 * Grounding entry from the response-level grounding map.
 *
 * <p>Same as {@link ParseGrounding} plus the structural role of the box. The raw type string is
 * kept so values added by the service later still decode.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParseResponseGrounding(ParseGroundingBox box, int page, String type) {

  public Optional<GroundingType> groundingType() {
    return GroundingType.fromValue(type);
  }
}
