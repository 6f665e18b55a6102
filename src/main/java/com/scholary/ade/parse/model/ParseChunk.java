package com.scholary.ade.parse.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Optional;

/**
 * One extracted content unit (paragraph, table, figure, ...).
 *
 * @param markdown the chunk content
 * @param type the chunk type as sent by the service, see {@link ChunkType}
 * @param id identifier, unique within a response
 * @param grounding where the chunk sits in the source document
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParseChunk(String markdown, String type, String id, ParseGrounding grounding) {

  public Optional<ChunkType> chunkType() {
    return ChunkType.fromValue(type);
  }

  public boolean isType(ChunkType chunkType) {
    return chunkType.value().equals(type);
  }
}
