package com.ospicorp.heartrate.ingestion.transform;

/** Per-run transformation counters. Not thread-safe; one instance per run. */
public class TransformStats {

  private long total;
  private long valid;
  private long invalid;
  private long missingValuesFilled;

  void recordSeen() {
    total++;
  }

  void recordValid() {
    valid++;
  }

  public void recordInvalid() {
    invalid++;
  }

  public void recordMissingValueFilled() {
    missingValuesFilled++;
  }

  public long total() {
    return total;
  }

  public long valid() {
    return valid;
  }

  public long invalid() {
    return invalid;
  }

  public long missingValuesFilled() {
    return missingValuesFilled;
  }
}
