package com.scholary.ade.parse;

import com.scholary.ade.client.AdeClient;
import com.scholary.ade.error.AdeException;
import com.scholary.ade.error.ConfigurationException;
import com.scholary.ade.error.DecodingException;
import com.scholary.ade.error.StatusCodes;
import com.scholary.ade.error.TransportException;
import com.scholary.ade.logging.ParseEventLogger;
import com.scholary.ade.parse.model.ParseResponse;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and executes one call to the parse endpoint.
 *
 * <p>Exactly one document source must be set: a URL ({@link #withUrl}), a local file ({@link
 * #withFile}) or in-memory content ({@link #withFileData}). If both a file path and in-memory
 * content are set, the in-memory content is sent.
 *
 * <p>Builders are cheap and single-use. They are not thread-safe. Calling {@link #execute()} again
 * repeats the same request.
 */
public class ParseRequestBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParseRequestBuilder.class);

  static final String PARSE_PATH = "/v1/ade/parse";
  static final String FIELD_DOCUMENT_URL = "document_url";
  static final String FIELD_DOCUMENT = "document";
  static final String FIELD_MODEL = "model";
  static final String FIELD_SPLIT = "split";

  private static final String OCTET_STREAM = "application/octet-stream";

  private final AdeClient client;
  private final ParseContext context;
  private final ParseEventLogger eventLogger = new ParseEventLogger(LOGGER);

  private String model;
  private String documentUrl;
  private Path filePath;
  private byte[] fileData;
  private String fileName;
  private SplitType split;

  public ParseRequestBuilder(AdeClient client, ParseContext context) {
    this.client = client;
    this.context = context == null ? ParseContext.background() : context;
  }

  /**
   * Model to parse with, e.g. "dpt-2-latest" or "dpt-2-mini-latest". The service validates the
   * name.
   */
  public ParseRequestBuilder withModel(String model) {
    this.model = model;
    return this;
  }

  /** Parse a document the service fetches from this URL. */
  public ParseRequestBuilder withUrl(String documentUrl) {
    this.documentUrl = documentUrl;
    return this;
  }

  /** Upload a local file; its base name is sent as the filename. */
  public ParseRequestBuilder withFile(Path filePath) {
    this.filePath = filePath;
    return this;
  }

  /** Upload a local file. A null or empty path leaves the file source unset. */
  public ParseRequestBuilder withFile(String filePath) {
    return withFile(filePath == null || filePath.isEmpty() ? null : Path.of(filePath));
  }

  /** Upload in-memory content under the given filename. */
  public ParseRequestBuilder withFileData(byte[] data, String filename) {
    this.fileData = data;
    this.fileName = filename;
    return this;
  }

  public ParseRequestBuilder withSplit(SplitType split) {
    this.split = split;
    return this;
  }

  public ParseRequestBuilder withPageSplit() {
    return withSplit(SplitType.PAGE);
  }

  /**
   * Send the request and decode the response.
   *
   * <p>Makes a single attempt. Rate limiting and server errors are thrown for the caller to retry.
   *
   * @return the parsed document
   * @throws ConfigurationException if no document source, or both a URL and a file, were set
   * @throws TransportException if the file cannot be read, the request fails on the network, or
   *     the context is cancelled or past its deadline
   * @throws com.scholary.ade.error.ApiException if the service returns a non-2xx status
   * @throws com.scholary.ade.error.ValidationErrorsException if the service returns 422 with
   *     field-level validation errors
   * @throws DecodingException if a 2xx body is not a valid parse response
   */
  public ParseResponse execute() {
    validate();

    HttpRequest request = buildRequest();
    eventLogger.logParseStarted(describeSource(), model, split == null ? null : split.value());

    long startNanos = System.nanoTime();
    HttpResponse<byte[]> response = send(request);
    int statusCode = response.statusCode();
    byte[] body = response.body();

    if (!StatusCodes.isSuccess(statusCode)) {
      throw failed(statusCode, client.getErrorClassifier().classify(statusCode, body));
    }

    ParseResponse parsed = decode(body);
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    if (parsed.metadata() != null) {
      eventLogger.logParseCompleted(
          parsed.metadata().jobId(),
          parsed.metadata().pageCount(),
          parsed.chunks().size(),
          parsed.metadata().durationMs(),
          parsed.metadata().creditUsage(),
          elapsedMs);
    }
    return parsed;
  }

  private void validate() {
    boolean hasFile = filePath != null || fileData != null;
    if (documentUrl != null && hasFile) {
      throw new ConfigurationException("cannot provide both document URL and file");
    }
    if (documentUrl == null && !hasFile) {
      throw new ConfigurationException("must provide either document URL or file");
    }
  }

  HttpRequest buildRequest() {
    MultipartBody body = new MultipartBody();

    if (documentUrl != null) {
      body.addField(FIELD_DOCUMENT_URL, documentUrl);
    } else {
      DocumentPayload payload = resolvePayload();
      body.addFile(FIELD_DOCUMENT, payload.filename(), OCTET_STREAM, payload.content());
    }
    if (model != null) {
      body.addField(FIELD_MODEL, model);
    }
    if (split != null) {
      body.addField(FIELD_SPLIT, split.value());
    }

    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(client.getBaseUrl() + PARSE_PATH))
            .header("Authorization", "Bearer " + client.getApiKey())
            .header("Content-Type", body.contentType())
            .POST(HttpRequest.BodyPublishers.ofByteArray(body.build()));
    if (client.hasTimeout()) {
      builder.timeout(client.getTimeout());
    }
    return builder.build();
  }

  private DocumentPayload resolvePayload() {
    if (fileData != null) {
      return new DocumentPayload(fileName == null ? "" : fileName, fileData);
    }
    try {
      byte[] content = Files.readAllBytes(filePath);
      Path name = filePath.getFileName();
      return new DocumentPayload(name == null ? filePath.toString() : name.toString(), content);
    } catch (IOException e) {
      throw failed(null, new TransportException("Failed to read file: " + filePath, e));
    }
  }

  private HttpResponse<byte[]> send(HttpRequest request) {
    if (context.isCancelled()) {
      throw failed(
          null,
          new TransportException(
              "Parse request cancelled", new CancellationException("context cancelled")));
    }
    if (context.isExpired()) {
      throw failed(
          null,
          new TransportException(
              "Parse request deadline exceeded",
              new TimeoutException("context deadline exceeded")));
    }

    LOGGER.debug("Sending parse request to {}", request.uri());

    CompletableFuture<HttpResponse<byte[]>> future =
        client.getHttpClient().sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
    if (!context.bind(future)) {
      throw failed(
          null,
          new TransportException(
              "Parse request cancelled", new CancellationException("context cancelled")));
    }

    try {
      Optional<Duration> remaining = context.remaining();
      if (remaining.isPresent()) {
        return future.get(remaining.get().toNanos(), TimeUnit.NANOSECONDS);
      }
      return future.get();
    } catch (CancellationException e) {
      throw failed(null, new TransportException("Parse request cancelled", e));
    } catch (TimeoutException e) {
      future.cancel(true);
      throw failed(null, new TransportException("Parse request deadline exceeded", e));
    } catch (ExecutionException e) {
      throw failed(null, new TransportException("Failed to execute parse request", e.getCause()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw failed(null, new TransportException("Parse request interrupted", e));
    } finally {
      context.unbind(future);
    }
  }

  private ParseResponse decode(byte[] body) {
    ParseResponse parsed;
    try {
      parsed = client.getObjectMapper().readValue(body, ParseResponse.class);
    } catch (IOException e) {
      throw failed(null, new DecodingException("Failed to parse response: " + e.getMessage(), e));
    }
    if (parsed == null) {
      throw failed(
          null, new DecodingException("Failed to parse response: empty JSON document", null));
    }
    return parsed;
  }

  private AdeException failed(Integer statusCode, AdeException error) {
    eventLogger.logParseFailed(statusCode, error.getClass().getSimpleName(), error.getMessage());
    return error;
  }

  private String describeSource() {
    if (documentUrl != null) {
      return "url";
    }
    return fileData != null ? "data:" + fileName : "file:" + filePath.getFileName();
  }

  private record DocumentPayload(String filename, byte[] content) {}
}
