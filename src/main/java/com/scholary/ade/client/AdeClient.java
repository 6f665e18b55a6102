package com.scholary.ade.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.ade.error.ErrorClassifier;
import com.scholary.ade.parse.ParseContext;
import com.scholary.ade.parse.ParseRequestBuilder;
import com.scholary.ade.region.Region;
import java.net.http.HttpClient;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the Landing AI ADE parse API.
 *
 * <p>Holds the credential, endpoint and HTTP transport. It has no per-request state, so one
 * instance can be shared by many threads; each call gets its own {@link ParseRequestBuilder}:
 *
 * <pre>{@code
 * AdeClient client = AdeClient.create(apiKey, ClientOption.region(Region.EU));
 * ParseResponse response = client.parse().withFile("invoice.pdf").withPageSplit().execute();
 * }</pre>
 *
 * <p>Nothing is sent over the network at construction and the API key is not checked; a bad key
 * shows up as an {@code ApiException} with {@code isUnauthorized()} on the first call.
 */
public final class AdeClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(AdeClient.class);

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

  private final String apiKey;
  private final String baseUrl;
  private final HttpClient httpClient;
  private final Region region;
  private final Duration timeout;
  private final ObjectMapper objectMapper;
  private final ErrorClassifier errorClassifier;

  private AdeClient(String apiKey, Settings settings) {
    this.apiKey = apiKey;
    this.region = settings.region;
    this.baseUrl = settings.baseUrl != null ? settings.baseUrl : settings.region.baseUrl();
    this.httpClient = settings.httpClient;
    this.timeout = settings.timeout;
    this.objectMapper = settings.objectMapper;
    this.errorClassifier = new ErrorClassifier(objectMapper);
  }

  /**
   * Create a client.
   *
   * @param apiKey the API key, sent as a bearer token
   * @param options options applied in order
   * @return the client
   */
  public static AdeClient create(String apiKey, ClientOption... options) {
    Settings settings = new Settings();
    for (ClientOption option : options) {
      option.apply(settings);
    }
    AdeClient client = new AdeClient(apiKey, settings);
    LOGGER.info(
        "Initialized ADE client: baseUrl={}, region={}, timeout={}s",
        client.baseUrl,
        client.region,
        client.timeout.toSeconds());
    return client;
  }

  /** True when requests carry a timeout; a zero timeout means none. */
  public boolean hasTimeout() {
    return !timeout.isZero();
  }

  /** Start a parse request bound to the given context. */
  public ParseRequestBuilder parse(ParseContext context) {
    return new ParseRequestBuilder(this, context);
  }

  /** Start a parse request with a background context (no deadline). */
  public ParseRequestBuilder parse() {
    return parse(ParseContext.background());
  }

  public String getApiKey() {
    return apiKey;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public HttpClient getHttpClient() {
    return httpClient;
  }

  public Region getRegion() {
    return region;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public ObjectMapper getObjectMapper() {
    return objectMapper;
  }

  public ErrorClassifier getErrorClassifier() {
    return errorClassifier;
  }

  /** Mutable settings that {@link ClientOption}s write to before the client is built. */
  public static final class Settings {

    private Region region = Region.US;
    private String baseUrl;
    private HttpClient httpClient;
    private Duration timeout = DEFAULT_TIMEOUT;
    private ObjectMapper objectMapper;

    Settings() {
      this.httpClient = HttpClient.newBuilder().connectTimeout(DEFAULT_CONNECT_TIMEOUT).build();
      this.objectMapper =
          new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Settings region(Region region) {
      this.region = region;
      return this;
    }

    public Settings baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Settings httpClient(HttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    public Settings timeout(Duration timeout) {
      checkTimeout(timeout);
      this.timeout = timeout;
      return this;
    }

    static void checkTimeout(Duration timeout) {
      if (timeout == null || timeout.isNegative()) {
        throw new IllegalArgumentException("timeout must be zero or positive: " + timeout);
      }
    }

    public Settings objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }
  }
}
