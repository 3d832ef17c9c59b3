package com.ospicorp.heartrate.query;

import java.util.Arrays;
import java.util.Optional;

/** Bucket widths a caller may request for re-aggregation. */
public enum OutputInterval {
  SECOND("1s", "1 second"),
  MINUTE("1m", "1 minute"),
  HOUR("1h", "1 hour"),
  DAY("1d", "1 day");

  private final String token;
  private final String bucketWidth;

  OutputInterval(String token, String bucketWidth) {
    this.token = token;
    this.bucketWidth = bucketWidth;
  }

  public String token() {
    return token;
  }

  public String bucketWidth() {
    return bucketWidth;
  }

  public static Optional<OutputInterval> fromToken(String token) {
    if (token == null) {
      return Optional.empty();
    }
    String normalized = token.trim();
    return Arrays.stream(values())
        .filter(interval -> interval.token.equals(normalized))
        .findFirst();
  }
}
