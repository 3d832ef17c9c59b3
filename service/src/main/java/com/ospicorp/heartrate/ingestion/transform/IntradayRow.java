package com.ospicorp.heartrate.ingestion.transform;

import java.time.OffsetDateTime;
import java.util.List;

public record IntradayRow(OffsetDateTime timestamp, double value, String entityId) implements CanonicalRecord {

  @Override
  public List<Object> columnValues() {
    return List.of(timestamp, value, entityId);
  }
}
