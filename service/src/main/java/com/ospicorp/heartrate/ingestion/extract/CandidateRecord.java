package com.ospicorp.heartrate.ingestion.extract;

import java.time.LocalDate;

/** A record as extracted from a day payload, still in upstream vocabulary. */
public interface CandidateRecord {

  LocalDate date();

  String entityId();
}
