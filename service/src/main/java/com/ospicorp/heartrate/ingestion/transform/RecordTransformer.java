package com.ospicorp.heartrate.ingestion.transform;

import com.ospicorp.heartrate.ingestion.extract.CandidateRecord;
import com.ospicorp.heartrate.ingestion.model.Stream;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Canonicalizes candidates of one stream. {@link #transform} never throws: a
 * record that cannot be canonicalized is counted as invalid and dropped.
 * Zone-less source times are stamped in the offset of the stream's watermark.
 */
public interface RecordTransformer {

  Stream stream();

  Optional<CanonicalRecord> transform(CandidateRecord candidate, OffsetDateTime watermark, TransformStats stats);

  default Optional<CanonicalRecord> transform(CandidateRecord candidate, TransformStats stats) {
    return transform(candidate, null, stats);
  }

  default List<CanonicalRecord> transformAll(List<CandidateRecord> candidates, TransformStats stats) {
    return transformAll(candidates, null, stats);
  }

  default List<CanonicalRecord> transformAll(List<CandidateRecord> candidates, OffsetDateTime watermark,
      TransformStats stats) {
    List<CanonicalRecord> rows = new ArrayList<>(candidates.size());
    for (CandidateRecord candidate : candidates) {
      stats.recordSeen();
      Optional<CanonicalRecord> row = transform(candidate, watermark, stats);
      if (row.isPresent()) {
        stats.recordValid();
        rows.add(row.get());
      }
    }
    return rows;
  }
}
