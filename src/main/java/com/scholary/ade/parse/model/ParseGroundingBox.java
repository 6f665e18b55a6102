package com.scholary.ade.parse.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Bounding box in page-relative coordinates, each in [0, 1].
 *
 * <p>Values are taken as the service reports them; they are not validated here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParseGroundingBox(double left, double top, double right, double bottom) {

  public double width() {
    return right - left;
  }

  public double height() {
    return bottom - top;
  }
}
