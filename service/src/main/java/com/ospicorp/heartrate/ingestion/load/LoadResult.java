package com.ospicorp.heartrate.ingestion.load;

public record LoadResult(
    boolean success,
    int attempted,
    int written,
    int batchesProcessed,
    int batchesFailed
) {

  public static LoadResult empty() {
    return new LoadResult(true, 0, 0, 0, 0);
  }
}
