package com.scholary.ade.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured logging of parse calls with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets its fields in the MDC for the duration of one log statement, so log shippers
 * can index them (event_type, job_id, status_code, ...).
 */
public class ParseEventLogger {

  private final Logger logger;

  public ParseEventLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log parse request dispatch. */
  public void logParseStarted(String source, String model, String split) {
    try {
      MDC.put("event_type", "parse_started");
      MDC.put("source", source);
      if (model != null) {
        MDC.put("model", model);
      }
      if (split != null) {
        MDC.put("split", split);
      }

      logger.debug("Parse started: source={}, model={}, split={}", source, model, split);
    } finally {
      clearEventFields();
    }
  }

  /** Log a successful parse. */
  public void logParseCompleted(
      String jobId,
      int pageCount,
      int chunkCount,
      int durationMs,
      double creditUsage,
      long elapsedMs) {
    try {
      MDC.put("event_type", "parse_completed");
      if (jobId != null) {
        MDC.put("job_id", jobId);
      }
      MDC.put("page_count", String.valueOf(pageCount));
      MDC.put("chunk_count", String.valueOf(chunkCount));
      MDC.put("duration_ms", String.valueOf(durationMs));
      MDC.put("credit_usage", String.valueOf(creditUsage));
      MDC.put("elapsed_ms", String.valueOf(elapsedMs));

      logger.info(
          "Parse completed: jobId={}, pages={}, chunks={}, serverDuration={}ms, credits={},"
              + " elapsed={}ms",
          jobId,
          pageCount,
          chunkCount,
          durationMs,
          creditUsage,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /**
   * Log a failed parse. Debug level only: the failure is thrown to the caller, who decides how
   * loud it should be.
   */
  public void logParseFailed(Integer statusCode, String errorType, String message) {
    try {
      MDC.put("event_type", "parse_failed");
      if (statusCode != null) {
        MDC.put("status_code", String.valueOf(statusCode));
      }
      MDC.put("error_type", errorType);

      logger.debug(
          "Parse failed: status={}, error={}, message={}", statusCode, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("source");
    MDC.remove("model");
    MDC.remove("split");
    MDC.remove("job_id");
    MDC.remove("page_count");
    MDC.remove("chunk_count");
    MDC.remove("duration_ms");
    MDC.remove("credit_usage");
    MDC.remove("elapsed_ms");
    MDC.remove("status_code");
    MDC.remove("error_type");
  }
}
