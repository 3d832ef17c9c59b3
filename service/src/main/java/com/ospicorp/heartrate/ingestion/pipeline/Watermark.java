package com.ospicorp.heartrate.ingestion.pipeline;

import com.ospicorp.heartrate.ingestion.model.Stream;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/** Last persisted timestamp of one stream for one entity; null when the stream has no rows. */
public record Watermark(Stream stream, String entityId, OffsetDateTime lastTimestamp) {

  public boolean hasData() {
    return lastTimestamp != null;
  }

  public LocalDate nextDate(ZoneOffset offset) {
    return lastTimestamp.withOffsetSameInstant(offset).toLocalDate().plusDays(1);
  }
}
