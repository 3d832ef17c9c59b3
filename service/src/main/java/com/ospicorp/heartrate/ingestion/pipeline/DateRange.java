package com.ospicorp.heartrate.ingestion.pipeline;

import java.time.LocalDate;
import java.util.List;

/** Inclusive range of calendar dates; empty when start is after end. */
public record DateRange(LocalDate start, LocalDate end) {

  public boolean isEmpty() {
    return start.isAfter(end);
  }

  public List<LocalDate> dates() {
    if (isEmpty()) {
      return List.of();
    }
    return start.datesUntil(end.plusDays(1)).toList();
  }

  @Override
  public String toString() {
    return start + " to " + end;
  }
}
