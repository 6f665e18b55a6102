package com.scholary.ade.parse;

/** How the service should split the parsed document. */
public enum SplitType {
  PAGE("page");

  private final String value;

  SplitType(String value) {
    this.value = value;
  }

  /** Value sent in the "split" form field. */
  public String value() {
    return value;
  }
}
