package com.scholary.ade.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.ade.region.Region;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Configures an {@link AdeClient} at construction time.
 *
 * <p>Options are applied in the order given, so a later option wins. In particular {@link
 * #region(Region)} also resets the base URL: {@code region(EU), baseUrl(x)} ends with {@code x},
 * while {@code baseUrl(x), region(EU)} ends with the EU URL.
 */
@FunctionalInterface
public interface ClientOption {

  void apply(AdeClient.Settings settings);

  /** Use the given region and its base URL. Null means {@link Region#US}. */
  static ClientOption region(Region region) {
    return settings -> {
      Region resolved = region == null ? Region.US : region;
      settings.region(resolved).baseUrl(resolved.baseUrl());
    };
  }

  /** Send requests to a custom base URL, e.g. a proxy or a test server. */
  static ClientOption baseUrl(String baseUrl) {
    return settings -> settings.baseUrl(baseUrl);
  }

  /** Replace the default HTTP client. */
  static ClientOption httpClient(HttpClient httpClient) {
    return settings -> settings.httpClient(httpClient);
  }

  /**
   * Timeout for each parse request. {@link Duration#ZERO} means no timeout.
   *
   * @throws IllegalArgumentException if the timeout is null or negative
   */
  static ClientOption timeout(Duration timeout) {
    AdeClient.Settings.checkTimeout(timeout);
    return settings -> settings.timeout(timeout);
  }

  static ClientOption objectMapper(ObjectMapper objectMapper) {
    return settings -> settings.objectMapper(objectMapper);
  }
}
