package com.scholary.ade.region;

/**
 * API region hosting the parse service.
 *
 * <p>Each region maps to a fixed base URL. Unknown tags fall back to {@link #US}, so resolving a
 * base URL never fails.
 */
public enum Region {
  US("us", "https://api.va.landing.ai"),
  EU("eu", "https://api.va.eu-west-1.landing.ai");

  private final String tag;
  private final String baseUrl;

  Region(String tag, String baseUrl) {
    this.tag = tag;
    this.baseUrl = baseUrl;
  }

  public String tag() {
    return tag;
  }

  public String baseUrl() {
    return baseUrl;
  }

  /**
   * Resolve a region from its tag.
   *
   * @param tag the region tag, e.g. "us" or "eu" (case-insensitive)
   * @return the matching region, or {@link #US} for null, blank or unknown tags
   */
  public static Region fromTag(String tag) {
    if (tag == null || tag.isBlank()) {
      return US;
    }
    for (Region region : values()) {
      if (region.tag.equalsIgnoreCase(tag.trim())) {
        return region;
      }
    }
    return US;
  }

  /** Base URL for a region tag; unknown tags resolve to the US endpoint. */
  public static String baseUrlFor(String tag) {
    return fromTag(tag).baseUrl();
  }

  @Override
  public String toString() {
    return tag;
  }
}
