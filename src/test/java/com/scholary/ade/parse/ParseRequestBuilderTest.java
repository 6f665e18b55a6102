package com.scholary.ade.parse;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.anyUrl;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matching;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.verification.LoggedRequest;
import com.scholary.ade.client.AdeClient;
import com.scholary.ade.client.ClientOption;
import com.scholary.ade.error.ApiException;
import com.scholary.ade.error.ConfigurationException;
import com.scholary.ade.error.DecodingException;
import com.scholary.ade.error.TransportException;
import com.scholary.ade.error.ValidationErrorsException;
import com.scholary.ade.parse.model.ParseResponse;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** End-to-end tests for ParseRequestBuilder against a WireMock stub of the parse endpoint. */
class ParseRequestBuilderTest {

  private static final String PARSE_PATH = "/v1/ade/parse";

  private WireMockServer wireMockServer;
  private AdeClient client;

  @TempDir Path tempDir;

  @BeforeEach
  void setUp() {
    wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
    wireMockServer.start();
    client = AdeClient.create("test-key", ClientOption.baseUrl(wireMockServer.baseUrl()));
  }

  @AfterEach
  void tearDown() {
    if (wireMockServer != null) {
      wireMockServer.stop();
    }
  }

  private static String fixture() throws IOException {
    try (InputStream in =
        ParseRequestBuilderTest.class.getResourceAsStream("/fixtures/parse-response.json")) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private void stubResponse(int status, String body) {
    wireMockServer.stubFor(
        post(urlEqualTo(PARSE_PATH))
            .willReturn(
                aResponse()
                    .withStatus(status)
                    .withHeader("Content-Type", "application/json")
                    .withBody(body)));
  }

  private void stubDelayedResponse(int delayMs) throws IOException {
    wireMockServer.stubFor(
        post(urlEqualTo(PARSE_PATH))
            .willReturn(aResponse().withStatus(200).withBody(fixture()).withFixedDelay(delayMs)));
  }

  private String recordedBody() {
    List<LoggedRequest> requests = wireMockServer.findAll(postRequestedFor(urlEqualTo(PARSE_PATH)));
    assertThat(requests).hasSize(1);
    return requests.get(0).getBodyAsString();
  }

  @Test
  void execute_withUrl_shouldPostMultipartWithBearerToken() throws Exception {
    stubResponse(200, fixture());

    ParseResponse response =
        client
            .parse()
            .withUrl("https://example.com/report.pdf")
            .withModel("dpt-2-latest")
            .withPageSplit()
            .execute();

    assertThat(response.chunks()).hasSize(3);
    assertThat(response.splits()).hasSize(2);
    assertThat(response.metadata().jobId()).isEqualTo("job-abc123");

    wireMockServer.verify(
        postRequestedFor(urlEqualTo(PARSE_PATH))
            .withHeader("Authorization", equalTo("Bearer test-key"))
            .withHeader("Content-Type", matching("multipart/form-data; boundary=.+")));
    String body = recordedBody();
    assertThat(body)
        .contains("name=\"document_url\"\r\n\r\nhttps://example.com/report.pdf\r\n")
        .contains("name=\"model\"\r\n\r\ndpt-2-latest\r\n")
        .contains("name=\"split\"\r\n\r\npage\r\n")
        .doesNotContain("name=\"document\"");
  }

  @Test
  void execute_withFileData_shouldUseSuppliedFilename() throws Exception {
    stubResponse(200, fixture());

    byte[] content = "%PDF-1.7 data".getBytes(StandardCharsets.UTF_8);
    client.parse().withFileData(content, "scan.pdf").execute();

    String body = recordedBody();
    assertThat(body)
        .contains("Content-Disposition: form-data; name=\"document\"; filename=\"scan.pdf\"")
        .contains("Content-Type: application/octet-stream")
        .contains("%PDF-1.7 data")
        .doesNotContain("name=\"model\"")
        .doesNotContain("name=\"split\"");
  }

  @Test
  void execute_withFilePath_shouldSendBaseName() throws Exception {
    stubResponse(200, fixture());
    Path nested = Files.createDirectories(tempDir.resolve("inbox").resolve("2024"));
    Path file = Files.writeString(nested.resolve("invoice.pdf"), "invoice bytes");

    client.parse().withFile(file).execute();

    String body = recordedBody();
    assertThat(body)
        .contains("name=\"document\"; filename=\"invoice.pdf\"")
        .contains("invoice bytes")
        .doesNotContain("inbox");
  }

  @Test
  void execute_withFilePathAndData_shouldPreferData() throws Exception {
    stubResponse(200, fixture());
    Path file = Files.writeString(tempDir.resolve("on-disk.pdf"), "disk bytes");

    client
        .parse()
        .withFile(file.toString())
        .withFileData(new byte[] {'m', 'e', 'm'}, "memory.pdf")
        .execute();

    String body = recordedBody();
    assertThat(body).contains("filename=\"memory.pdf\"").doesNotContain("disk bytes");
  }

  @Test
  void execute_withUrlAndFile_shouldFailWithoutCallingApi() {
    ParseRequestBuilder request =
        client.parse().withUrl("https://example.com/a.pdf").withFileData(new byte[1], "a.pdf");

    assertThatThrownBy(request::execute)
        .isInstanceOf(ConfigurationException.class)
        .hasMessage("cannot provide both document URL and file");
    wireMockServer.verify(0, postRequestedFor(anyUrl()));
  }

  @Test
  void execute_withUrlAndFilePath_shouldFail() {
    ParseRequestBuilder request =
        client.parse().withUrl("https://example.com/a.pdf").withFile("a.pdf");

    assertThatThrownBy(request::execute)
        .isInstanceOf(ConfigurationException.class)
        .hasMessage("cannot provide both document URL and file");
  }

  @Test
  void execute_withoutSource_shouldFail() {
    assertThatThrownBy(() -> client.parse().withModel("dpt-2-latest").execute())
        .isInstanceOf(ConfigurationException.class)
        .hasMessage("must provide either document URL or file");
    wireMockServer.verify(0, postRequestedFor(anyUrl()));
  }

  @Test
  void execute_withUrlAndEmptyFilePath_shouldSendUrl() throws Exception {
    stubResponse(200, fixture());

    ParseResponse response =
        client.parse().withUrl("https://example.com/a.pdf").withFile("").execute();

    assertThat(response.metadata().jobId()).isEqualTo("job-abc123");
    assertThat(recordedBody())
        .contains("name=\"document_url\"\r\n\r\nhttps://example.com/a.pdf\r\n")
        .doesNotContain("name=\"document\"");
  }

  @Test
  void execute_withOnlyEmptyFilePath_shouldFailAsMissingSource() {
    assertThatThrownBy(() -> client.parse().withFile("").execute())
        .isInstanceOf(ConfigurationException.class)
        .hasMessage("must provide either document URL or file");
    wireMockServer.verify(0, postRequestedFor(anyUrl()));
  }

  @Test
  void execute_withMissingFile_shouldWrapIoFailure() {
    Path missing = tempDir.resolve("nonexistent.pdf");

    assertThatThrownBy(() -> client.parse().withFile(missing).execute())
        .isInstanceOf(TransportException.class)
        .hasMessageContaining("Failed to read file")
        .hasCauseInstanceOf(IOException.class);
    wireMockServer.verify(0, postRequestedFor(anyUrl()));
  }

  @Test
  void execute_on401_shouldThrowUnauthorizedApiException() {
    stubResponse(401, "{\"detail\":\"Invalid API key\"}");

    assertThatThrownBy(() -> client.parse().withUrl("https://example.com/a.pdf").execute())
        .isInstanceOfSatisfying(
            ApiException.class,
            e -> {
              assertThat(e.getStatusCode()).isEqualTo(401);
              assertThat(e.isUnauthorized()).isTrue();
              assertThat(e.isBadRequest()).isFalse();
            });
  }

  @Test
  void execute_on422ValidationBody_shouldThrowValidationErrors() {
    stubResponse(
        422,
        "{\"detail\":[{\"loc\":[\"body\",\"model\"],\"msg\":\"bad model\",\"type\":\"value_error\"}]}");

    assertThatThrownBy(
            () -> client.parse().withUrl("https://example.com/a.pdf").withModel("nope").execute())
        .isInstanceOf(ValidationErrorsException.class)
        .hasMessage("validation error: bad model");
  }

  @Test
  void execute_on429_shouldNotRetry() {
    stubResponse(429, "{\"detail\":\"slow down\"}");

    assertThatThrownBy(() -> client.parse().withUrl("https://example.com/a.pdf").execute())
        .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.isRateLimited()).isTrue());
    wireMockServer.verify(1, postRequestedFor(urlEqualTo(PARSE_PATH)));
  }

  @Test
  void execute_on504_shouldBeTimeoutAndServerError() {
    stubResponse(504, "upstream timed out");

    assertThatThrownBy(() -> client.parse().withUrl("https://example.com/a.pdf").execute())
        .isInstanceOfSatisfying(
            ApiException.class,
            e -> {
              assertThat(e.isTimeout()).isTrue();
              assertThat(e.isServerError()).isTrue();
              assertThat(e.getDetail().text()).isEqualTo("upstream timed out");
            });
  }

  @Test
  void execute_withMalformedSuccessBody_shouldThrowDecodingException() {
    stubResponse(200, "{\"markdown\": ");

    assertThatThrownBy(() -> client.parse().withUrl("https://example.com/a.pdf").execute())
        .isInstanceOf(DecodingException.class)
        .hasMessageStartingWith("Failed to parse response");
  }

  @Test
  void execute_twice_shouldRepeatTheRequest() throws Exception {
    stubResponse(200, fixture());
    ParseRequestBuilder request = client.parse().withUrl("https://example.com/a.pdf");

    request.execute();
    request.execute();

    wireMockServer.verify(2, postRequestedFor(urlEqualTo(PARSE_PATH)));
  }

  @Test
  void execute_withCancelledContext_shouldFailBeforeSending() {
    ParseContext context = ParseContext.background();
    context.cancel();

    assertThatThrownBy(() -> client.parse(context).withUrl("https://example.com/a.pdf").execute())
        .isInstanceOf(TransportException.class)
        .hasCauseInstanceOf(CancellationException.class);
    wireMockServer.verify(0, postRequestedFor(anyUrl()));
  }

  @Test
  void execute_cancelledMidCall_shouldAbortWithTransportException() throws Exception {
    stubDelayedResponse(3000);
    ParseContext context = ParseContext.background();
    ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    try {
      scheduler.schedule(context::cancel, 200, TimeUnit.MILLISECONDS);
      long start = System.nanoTime();

      assertThatThrownBy(
              () -> client.parse(context).withUrl("https://example.com/a.pdf").execute())
          .isInstanceOf(TransportException.class)
          .isNotInstanceOf(DecodingException.class)
          .hasCauseInstanceOf(CancellationException.class);
      assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
    } finally {
      scheduler.shutdownNow();
    }
  }

  @Test
  void execute_pastContextDeadline_shouldAbortWithTransportException() throws Exception {
    stubDelayedResponse(3000);
    ParseContext context = ParseContext.withTimeout(Duration.ofMillis(300));

    assertThatThrownBy(() -> client.parse(context).withUrl("https://example.com/a.pdf").execute())
        .isInstanceOf(TransportException.class)
        .hasMessageContaining("deadline exceeded")
        .hasCauseInstanceOf(TimeoutException.class);
  }

  @Test
  void execute_pastClientTimeout_shouldWrapHttpTimeout() throws Exception {
    stubDelayedResponse(3000);
    AdeClient impatient =
        AdeClient.create(
            "test-key",
            ClientOption.baseUrl(wireMockServer.baseUrl()),
            ClientOption.timeout(Duration.ofMillis(300)));

    assertThatThrownBy(() -> impatient.parse().withUrl("https://example.com/a.pdf").execute())
        .isInstanceOf(TransportException.class)
        .hasCauseInstanceOf(HttpTimeoutException.class);
  }

  @Test
  void execute_withZeroClientTimeout_shouldSendWithoutTimeout() throws Exception {
    stubResponse(200, fixture());
    AdeClient unbounded =
        AdeClient.create(
            "test-key",
            ClientOption.baseUrl(wireMockServer.baseUrl()),
            ClientOption.timeout(Duration.ZERO));

    ParseResponse response = unbounded.parse().withUrl("https://example.com/a.pdf").execute();

    assertThat(response.chunks()).hasSize(3);
    wireMockServer.verify(1, postRequestedFor(urlEqualTo(PARSE_PATH)));
  }

  @Test
  void execute_whenServerUnreachable_shouldThrowTransportException() {
    AdeClient unreachable =
        AdeClient.create("test-key", ClientOption.baseUrl("http://localhost:1"));

    assertThatThrownBy(() -> unreachable.parse().withUrl("https://example.com/a.pdf").execute())
        .isInstanceOf(TransportException.class)
        .hasCauseInstanceOf(IOException.class);
  }
}
