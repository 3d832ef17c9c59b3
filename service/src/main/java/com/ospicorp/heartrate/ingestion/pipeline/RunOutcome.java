package com.ospicorp.heartrate.ingestion.pipeline;

/** Process exit status of an ingestion run. */
public enum RunOutcome {
  LOADED(0),
  NO_NEW_DATA(2),
  FAILED(1);

  private final int exitCode;

  RunOutcome(int exitCode) {
    this.exitCode = exitCode;
  }

  public int exitCode() {
    return exitCode;
  }
}
