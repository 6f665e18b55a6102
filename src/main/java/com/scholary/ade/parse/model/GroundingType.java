package com.scholary.ade.parse.model;

import java.util.Optional;

/**
 * Structural role of a response-level grounding box.
 *
 * <p>The "chunk*" values locate whole chunks; {@link #TABLE} and {@link #TABLE_CELL} locate table
 * structure inside a chunk.
 */
public enum GroundingType {
  CHUNK_LOGO("chunkLogo"),
  CHUNK_CARD("chunkCard"),
  CHUNK_ATTESTATION("chunkAttestation"),
  CHUNK_SCAN_CODE("chunkScanCode"),
  CHUNK_FORM("chunkForm"),
  CHUNK_TABLE("chunkTable"),
  CHUNK_FIGURE("chunkFigure"),
  CHUNK_TEXT("chunkText"),
  CHUNK_MARGINALIA("chunkMarginalia"),
  CHUNK_TITLE("chunkTitle"),
  CHUNK_PAGE_HEADER("chunkPageHeader"),
  CHUNK_PAGE_FOOTER("chunkPageFooter"),
  CHUNK_PAGE_NUMBER("chunkPageNumber"),
  CHUNK_KEY_VALUE("chunkKeyValue"),
  TABLE("table"),
  TABLE_CELL("tableCell");

  private final String value;

  GroundingType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static Optional<GroundingType> fromValue(String value) {
    for (GroundingType type : values()) {
      if (type.value.equals(value)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
