package com.ospicorp.heartrate.ingestion.pipeline;

import com.ospicorp.heartrate.ingestion.source.PerturbationPolicy;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Validated ingestion configuration. Construction fails with
 * {@link IllegalStateException} so a bad setting stops start-up before any I/O.
 */
public record IngestionSettings(
    String entityId,
    int batchSize,
    int summaryBatchSize,
    LocalDate startDate,
    LocalDate endDate,
    boolean deltaMode,
    boolean upsertMode,
    long dataSeed,
    Path cacheDir,
    int sampleIntervalSeconds,
    PerturbationPolicy intradayPerturbation,
    ZoneOffset zoneOffset
) {

  public IngestionSettings {
    if (entityId == null || entityId.isBlank()) {
      throw new IllegalStateException("Missing required setting ingestion.entity-id (USER_ID)");
    }
    if (batchSize < 1) {
      throw new IllegalStateException("ingestion.batch-size must be positive, was " + batchSize);
    }
    if (summaryBatchSize < 1) {
      throw new IllegalStateException("ingestion.summary-batch-size must be positive, was " + summaryBatchSize);
    }
    if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
      throw new IllegalStateException("ingestion.start-date " + startDate + " is after ingestion.end-date " + endDate);
    }
    if (cacheDir == null) {
      throw new IllegalStateException("Missing required setting ingestion.cache-dir (CACHE_DIR)");
    }
    if (intradayPerturbation == null) {
      intradayPerturbation = PerturbationPolicy.JITTER;
    }
    if (zoneOffset == null) {
      zoneOffset = ZoneOffset.UTC;
    }
    entityId = entityId.trim();
  }

  /**
   * Parses a configured date, keeping only the date part of values such as
   * {@code 2024-01-05 10:00:00} or {@code 2024-01-05T10:00}. Blank means unset.
   */
  public static LocalDate parseDate(String key, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String datePart = value.trim().split("[T ]", 2)[0];
    try {
      return LocalDate.parse(datePart);
    } catch (DateTimeParseException ex) {
      throw new IllegalStateException("Invalid date for " + key + ": '" + value + "'", ex);
    }
  }
}
