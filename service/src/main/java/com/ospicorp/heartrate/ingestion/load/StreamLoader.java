package com.ospicorp.heartrate.ingestion.load;

import com.ospicorp.heartrate.ingestion.model.Stream;
import com.ospicorp.heartrate.ingestion.transform.CanonicalRecord;
import java.util.List;

public interface StreamLoader {

  LoadResult load(Stream stream, List<? extends CanonicalRecord> records, boolean upsert);

  /** Returns whether the stored row count for the entity is at least {@code expectedMinCount}. */
  boolean verify(Stream stream, String entityId, long expectedMinCount);
}
