package com.scholary.ade.parse.model;

import java.util.Optional;

/** Kind of content a {@link ParseChunk} holds. */
public enum ChunkType {
  TEXT("text"),
  TABLE("table"),
  MARGINALIA("marginalia"),
  FIGURE("figure"),
  LOGO("logo"),
  CARD("card"),
  ATTESTATION("attestation"),
  SCAN_CODE("scan_code");

  private final String value;

  ChunkType(String value) {
    this.value = value;
  }

  /** Wire value, e.g. "scan_code". */
  public String value() {
    return value;
  }

  public static Optional<ChunkType> fromValue(String value) {
    for (ChunkType type : values()) {
      if (type.value.equals(value)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
