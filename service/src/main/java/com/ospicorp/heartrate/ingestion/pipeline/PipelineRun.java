package com.ospicorp.heartrate.ingestion.pipeline;

import java.time.Duration;

public record PipelineRun(
    PipelineState state,
    DateRange range,
    long recordsProcessed,
    long recordsLoaded,
    long invalidRecords,
    long missingValuesFilled,
    int daysProcessed,
    Duration extractionTime,
    Duration transformationTime,
    Duration loadingTime,
    Duration totalTime
) {

  public boolean success() {
    return state == PipelineState.COMPLETED;
  }

  public RunOutcome outcome() {
    if (!success()) {
      return RunOutcome.FAILED;
    }
    return recordsLoaded > 0 ? RunOutcome.LOADED : RunOutcome.NO_NEW_DATA;
  }
}
