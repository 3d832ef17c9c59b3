package com.ospicorp.heartrate.ingestion.transform;

import java.time.OffsetDateTime;
import java.util.List;

/** A row ready for persistence, exposing its values in the stream's column order. */
public interface CanonicalRecord {

  OffsetDateTime timestamp();

  String entityId();

  List<Object> columnValues();
}
