package com.ospicorp.heartrate.ingestion.extract;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;

/** Daily summary with opaque payloads; any of the nodes may be null. */
public record DailySummary(
    LocalDate date,
    JsonNode restingHeartRate,
    JsonNode heartRateZones,
    JsonNode customHeartRateZones,
    String entityId
) implements CandidateRecord {}
