package com.ospicorp.heartrate.ingestion.load;

import com.ospicorp.heartrate.ingestion.model.Stream;
import com.ospicorp.heartrate.ingestion.transform.CanonicalRecord;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

/**
 * Writes records in fixed-size batches, one transaction each. The first failed
 * batch ends the call; batches committed before it stay committed.
 */
public class BatchLoader implements StreamLoader {

  private static final Logger log = LoggerFactory.getLogger(BatchLoader.class);

  private final TableStore store;
  private final int batchSize;

  public BatchLoader(TableStore store, int batchSize) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    this.store = store;
    this.batchSize = batchSize;
  }

  @Override
  public LoadResult load(Stream stream, List<? extends CanonicalRecord> records, boolean upsert) {
    if (records.isEmpty()) {
      log.warn("No {} records to load", stream.name());
      return LoadResult.empty();
    }
    int total = records.size();
    int batches = (total + batchSize - 1) / batchSize;
    log.info("Loading {} records into {} in {} batch(es) of up to {} ({})",
        total, stream.name(), batches, batchSize, upsert ? "upsert" : "insert");
    int written = 0;
    int processed = 0;
    for (int from = 0; from < total; from += batchSize) {
      List<? extends CanonicalRecord> batch = records.subList(from, Math.min(from + batchSize, total));
      int batchNumber = from / batchSize + 1;
      try {
        store.writeBatch(stream, batch, upsert);
      } catch (DataAccessException | TransactionException ex) {
        log.error("Batch {}/{} for {} failed and was rolled back: {}",
            batchNumber, batches, stream.name(), ex.getMessage());
        return new LoadResult(false, total, written, processed, 1);
      }
      processed++;
      written += batch.size();
      log.debug("Progress for {}: {}/{} records", stream.name(), written, total);
    }
    log.info("Loaded {} records into {}", written, stream.name());
    return new LoadResult(true, total, written, processed, 0);
  }

  @Override
  public boolean verify(Stream stream, String entityId, long expectedMinCount) {
    try {
      long count = store.countRows(stream, entityId);
      if (count >= expectedMinCount) {
        log.info("Verification passed for {}: {} rows for {} (expected at least {})",
            stream.name(), count, entityId, expectedMinCount);
        return true;
      }
      log.warn("Verification mismatch for {}: {} rows for {}, expected at least {}",
          stream.name(), count, entityId, expectedMinCount);
      return false;
    } catch (DataAccessException ex) {
      log.error("Verification query for {} failed: {}", stream.name(), ex.getMessage());
      return false;
    }
  }
}
