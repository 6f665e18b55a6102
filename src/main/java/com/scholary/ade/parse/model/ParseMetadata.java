package com.scholary.ade.parse.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Metadata about a parse job.
 *
 * @param filename the name of the parsed document
 * @param orgId organization id, may be null
 * @param pageCount number of pages
 * @param durationMs server-side processing time
 * @param creditUsage credits charged
 * @param jobId job identifier, useful when contacting support
 * @param version model version used, may be null
 * @param failedPages pages that could not be processed; empty on full success
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParseMetadata(
    String filename,
    @JsonProperty("org_id") String orgId,
    @JsonProperty("page_count") int pageCount,
    @JsonProperty("duration_ms") int durationMs,
    @JsonProperty("credit_usage") double creditUsage,
    @JsonProperty("job_id") String jobId,
    String version,
    @JsonProperty("failed_pages") List<Integer> failedPages) {

  public ParseMetadata {
    failedPages = failedPages == null ? List.of() : List.copyOf(failedPages);
  }

  public boolean hasFailedPages() {
    return !failedPages.isEmpty();
  }
}
