package com.ospicorp.heartrate.ingestion.pipeline;

public enum PipelineState {
  IDLE,
  PREFLIGHT_CHECKED,
  RANGE_DETERMINED,
  RUNNING,
  COMPLETED,
  FAILED
}
