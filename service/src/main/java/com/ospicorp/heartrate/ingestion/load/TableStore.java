package com.ospicorp.heartrate.ingestion.load;

import com.ospicorp.heartrate.ingestion.model.Stream;
import com.ospicorp.heartrate.ingestion.transform.CanonicalRecord;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/** Persistence operations the ingestion pipeline needs from the time-series store. */
public interface TableStore {

  /**
   * Verifies the store is reachable and the stream's table has the expected
   * columns.
   *
   * @throws StoreNotReadyException when either check fails
   */
  void checkReady(Stream stream);

  Optional<OffsetDateTime> lastTimestamp(Stream stream, String entityId);

  long countRows(Stream stream, String entityId);

  /** Writes all rows in one transaction; any failure rolls the whole batch back. */
  void writeBatch(Stream stream, List<? extends CanonicalRecord> batch, boolean upsert);
}
