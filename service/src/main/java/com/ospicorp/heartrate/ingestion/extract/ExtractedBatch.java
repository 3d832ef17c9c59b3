package com.ospicorp.heartrate.ingestion.extract;

import com.ospicorp.heartrate.ingestion.model.Stream;
import java.util.List;

public record ExtractedBatch(Stream stream, List<CandidateRecord> records) {

  public ExtractedBatch {
    records = List.copyOf(records);
  }
}
