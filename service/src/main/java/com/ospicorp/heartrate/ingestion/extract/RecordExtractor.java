package com.ospicorp.heartrate.ingestion.extract;

import java.time.LocalDate;
import java.util.List;

/**
 * Turns the upstream payload of one date into candidate records grouped by
 * destination stream. Failures are logged and produce an empty list; an
 * extractor never throws for a single bad date.
 */
public interface RecordExtractor {

  String name();

  List<ExtractedBatch> extract(LocalDate date);
}
