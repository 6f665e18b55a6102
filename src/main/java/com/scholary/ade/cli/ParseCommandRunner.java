package com.scholary.ade.cli;

import com.scholary.ade.client.AdeClient;
import com.scholary.ade.error.AdeException;
import com.scholary.ade.error.ApiException;
import com.scholary.ade.error.ValidationError;
import com.scholary.ade.error.ValidationErrorsException;
import com.scholary.ade.parse.ParseContext;
import com.scholary.ade.parse.ParseRequestBuilder;
import com.scholary.ade.parse.SplitType;
import com.scholary.ade.parse.model.ParseMetadata;
import com.scholary.ade.parse.model.ParseResponse;
import com.scholary.ade.parse.model.ParseSplit;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Parses one document from the command line.
 *
 * <pre>
 * java -jar ade-client.jar --file=report.pdf --model=dpt-2-latest --split=page
 * java -jar ade-client.jar --url=https://example.com/report.pdf --timeout-seconds=120
 * </pre>
 *
 * <p>Without --file or --url it only prints usage.
 */
@Component
public class ParseCommandRunner implements ApplicationRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParseCommandRunner.class);

  private static final int MARKDOWN_PREVIEW_CHARS = 100;
  private static final Duration DEFAULT_DEADLINE = Duration.ofMinutes(5);

  private final AdeClient client;

  public ParseCommandRunner(AdeClient client) {
    this.client = client;
  }

  @Override
  public void run(ApplicationArguments args) {
    String file = option(args, "file");
    String url = option(args, "url");
    if (file == null && url == null) {
      logUsage();
      return;
    }

    Duration deadline = deadline(option(args, "timeout-seconds"));
    if (deadline == null) {
      logUsage();
      return;
    }

    ParseRequestBuilder request = client.parse(ParseContext.withTimeout(deadline));
    if (file != null) {
      request.withFile(file);
    }
    if (url != null) {
      request.withUrl(url);
    }
    String model = option(args, "model");
    if (model != null) {
      request.withModel(model);
    }
    if ("page".equalsIgnoreCase(option(args, "split"))) {
      request.withSplit(SplitType.PAGE);
    }

    try {
      report(request.execute());
    } catch (ApiException e) {
      LOGGER.error("API error (status {}): {}", e.getStatusCode(), e.getErrorMessage());
      if (e.isUnauthorized()) {
        LOGGER.error("  -> Invalid API key");
      } else if (e.isPaymentRequired()) {
        LOGGER.error("  -> Insufficient credits");
      } else if (e.isRateLimited()) {
        LOGGER.error("  -> Rate limit exceeded, retry later");
      } else if (e.isServerError()) {
        LOGGER.error("  -> Server error, retry later");
      }
    } catch (ValidationErrorsException e) {
      LOGGER.error("Validation error: {}", e.getMessage());
      for (ValidationError error : e.getErrors()) {
        LOGGER.error("  {} ({}): {}", error.locationPath(), error.type(), error.message());
      }
    } catch (AdeException e) {
      LOGGER.error("Parse failed: {}", e.getMessage(), e);
    }
  }

  void report(ParseResponse response) {
    ParseMetadata metadata = response.metadata();
    if (metadata != null) {
      LOGGER.info("Parsed {} pages in {} ms", metadata.pageCount(), metadata.durationMs());
      LOGGER.info("Credit usage: {}", String.format("%.2f", metadata.creditUsage()));
      if (metadata.version() != null) {
        LOGGER.info("Model version: {}", metadata.version());
      }
      if (metadata.hasFailedPages()) {
        LOGGER.warn("Failed pages: {}", metadata.failedPages());
      }
    }
    LOGGER.info("Number of chunks: {}", response.chunks().size());

    List<ParseSplit> splits = response.splits();
    if (!splits.isEmpty()) {
      LOGGER.info("Number of splits: {}", splits.size());
      for (int i = 0; i < splits.size(); i++) {
        ParseSplit split = splits.get(i);
        LOGGER.info("  Split {}: pages {}, {} chunks", i, split.pages(), split.chunks().size());
      }
    }

    String markdown = response.markdown() == null ? "" : response.markdown();
    LOGGER.info(
        "Markdown preview: {}...",
        markdown.substring(0, Math.min(MARKDOWN_PREVIEW_CHARS, markdown.length())));
  }

  /** Returns null when the value is not a positive number of seconds. */
  private static Duration deadline(String timeoutSeconds) {
    if (timeoutSeconds == null) {
      return DEFAULT_DEADLINE;
    }
    try {
      long seconds = Long.parseLong(timeoutSeconds.trim());
      if (seconds > 0) {
        return Duration.ofSeconds(seconds);
      }
    } catch (NumberFormatException e) {
      LOGGER.debug("Rejected --timeout-seconds value: {}", timeoutSeconds, e);
    }
    LOGGER.error("Invalid --timeout-seconds value: {}", timeoutSeconds);
    return null;
  }

  private static void logUsage() {
    LOGGER.info(
        "Usage: --file=<path> | --url=<document url> [--model=<model>] [--split=page]"
            + " [--timeout-seconds=<n>]");
  }

  private static String option(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return null;
    }
    return values.get(values.size() - 1);
  }
}
