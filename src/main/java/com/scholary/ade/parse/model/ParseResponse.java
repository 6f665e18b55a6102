package com.scholary.ade.parse.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Decoded result of a parse call.
 *
 * <p>Chunks are in document order. Splits are empty unless splitting was requested. The grounding
 * map is keyed by grounding id and has no defined order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParseResponse(
    String markdown,
    List<ParseChunk> chunks,
    List<ParseSplit> splits,
    Map<String, ParseResponseGrounding> grounding,
    ParseMetadata metadata) {

  public ParseResponse {
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
    splits = splits == null ? List.of() : List.copyOf(splits);
    grounding = grounding == null ? Map.of() : Map.copyOf(grounding);
  }

  public Optional<ParseChunk> findChunk(String id) {
    return chunks.stream().filter(chunk -> Objects.equals(chunk.id(), id)).findFirst();
  }

  public List<ParseChunk> chunksOfType(ChunkType type) {
    return chunks.stream().filter(chunk -> chunk.isType(type)).toList();
  }

  /** Chunks referenced by a split, in the split's order. Unknown ids are skipped. */
  public List<ParseChunk> chunksOf(ParseSplit split) {
    Map<String, ParseChunk> byId =
        chunks.stream()
            .collect(Collectors.toMap(ParseChunk::id, Function.identity(), (first, dup) -> first));
    return split.chunks().stream().map(byId::get).filter(Objects::nonNull).toList();
  }
}
