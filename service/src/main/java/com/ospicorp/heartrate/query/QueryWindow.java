package com.ospicorp.heartrate.query;

import java.time.Duration;
import java.time.OffsetDateTime;

/** Requested time range plus an optional output interval (null keeps native rows). */
public record QueryWindow(OffsetDateTime start, OffsetDateTime end, OutputInterval interval) {

  public QueryWindow {
    if (!start.isBefore(end)) {
      throw new IllegalArgumentException("start must be before end");
    }
  }

  public Duration span() {
    return Duration.between(start, end);
  }
}
