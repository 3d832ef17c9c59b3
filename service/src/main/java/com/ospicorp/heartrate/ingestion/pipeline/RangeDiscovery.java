package com.ospicorp.heartrate.ingestion.pipeline;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the dates a run processes. The earliest day after any stream's
 * watermark wins so lagging streams catch up; explicit start and end dates
 * override discovery.
 */
public class RangeDiscovery {

  private static final Logger log = LoggerFactory.getLogger(RangeDiscovery.class);

  static final int DEFAULT_LOOKBACK_DAYS = 30;

  private final Clock clock;

  public RangeDiscovery(Clock clock) {
    this.clock = clock;
  }

  public DateRange determine(Collection<Watermark> watermarks, LocalDate configuredStart, LocalDate configuredEnd) {
    LocalDate today = LocalDate.now(clock);
    if (configuredStart != null && configuredEnd != null) {
      log.info("Using configured date range {} to {}", configuredStart, configuredEnd);
      return new DateRange(configuredStart, configuredEnd);
    }
    ZoneOffset offset = clock.getZone().getRules().getOffset(clock.instant());
    LocalDate earliest = null;
    boolean anyData = false;
    for (Watermark watermark : watermarks) {
      if (!watermark.hasData()) {
        log.info("No existing {} data for {}", watermark.stream().name(), watermark.entityId());
        continue;
      }
      anyData = true;
      LocalDate next = watermark.nextDate(offset);
      if (next.isAfter(today)) {
        log.info("Next date {} for {} is in the future, skipping", next, watermark.stream().name());
        continue;
      }
      log.info("Next date for {} is {}", watermark.stream().name(), next);
      if (earliest == null || next.isBefore(earliest)) {
        earliest = next;
      }
    }
    if (earliest != null) {
      return new DateRange(earliest, today);
    }
    if (anyData) {
      log.info("All streams are up to date; re-checking {}", today);
      return new DateRange(today, today);
    }
    if (configuredStart != null) {
      log.info("No existing data, starting from configured date {}", configuredStart);
      return new DateRange(configuredStart, today);
    }
    LocalDate fallback = today.minusDays(DEFAULT_LOOKBACK_DAYS);
    log.info("No existing data, starting {} days back at {}", DEFAULT_LOOKBACK_DAYS, fallback);
    return new DateRange(fallback, today);
  }
}
