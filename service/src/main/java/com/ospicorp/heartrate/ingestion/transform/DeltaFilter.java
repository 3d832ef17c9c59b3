package com.ospicorp.heartrate.ingestion.transform;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/** Keeps only records strictly newer than a stream's watermark. */
public final class DeltaFilter {

  private DeltaFilter() {
  }

  public static <T extends CanonicalRecord> List<T> filterNew(List<T> records, OffsetDateTime watermark) {
    if (watermark == null) {
      return records;
    }
    return records.stream()
        .filter(row -> row.timestamp().isAfter(watermark))
        .toList();
  }

  /**
   * Interprets a zone-less timestamp in the watermark's offset, or in
   * {@code fallback} when the stream has no watermark yet.
   */
  public static OffsetDateTime alignToWatermark(LocalDateTime naive, OffsetDateTime watermark, ZoneOffset fallback) {
    return naive.atOffset(watermark == null ? fallback : watermark.getOffset());
  }
}
