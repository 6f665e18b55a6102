package com.scholary.ade.parse.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A page-scoped section of the document, returned when splitting is requested.
 *
 * <p>{@code chunks} holds chunk ids; resolve them with {@link ParseResponse#chunksOf(ParseSplit)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParseSplit(
    @JsonProperty("class") String splitClass,
    String identifier,
    List<Integer> pages,
    String markdown,
    List<String> chunks) {

  public ParseSplit {
    pages = pages == null ? List.of() : List.copyOf(pages);
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
  }
}
