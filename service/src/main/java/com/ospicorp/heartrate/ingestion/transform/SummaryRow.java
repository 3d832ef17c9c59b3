package com.ospicorp.heartrate.ingestion.transform;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;

/** Daily summary row; zone payloads are serialized JSON text bound as jsonb. */
public record SummaryRow(
    OffsetDateTime timestamp,
    Integer restingHeartRate,
    String heartRateZones,
    String customHeartRateZones,
    String entityId
) implements CanonicalRecord {

  @Override
  public List<Object> columnValues() {
    return Arrays.asList(timestamp, restingHeartRate, heartRateZones, customHeartRateZones, entityId);
  }
}
