package com.ospicorp.heartrate.query;

/** Storage granularities, finest first, with the table and columns that hold each. */
public enum Granularity {
  RAW("activities_heart_intraday", "timestamp", "value", "raw", "Raw heart rate data (per second)"),
  MINUTE("activities_heart_intraday_1m", "minute", "avg_heart_rate", "1m", "1-minute aggregated heart rate data"),
  HOUR("activities_heart_intraday_1h", "hour", "avg_heart_rate", "1h", "1-hour aggregated heart rate data"),
  DAY("activities_heart_intraday_1d", "day", "avg_heart_rate", "1d", "1-day aggregated heart rate data");

  private final String table;
  private final String timeColumn;
  private final String valueColumn;
  private final String token;
  private final String description;

  Granularity(String table, String timeColumn, String valueColumn, String token, String description) {
    this.table = table;
    this.timeColumn = timeColumn;
    this.valueColumn = valueColumn;
    this.token = token;
    this.description = description;
  }

  public String table() {
    return table;
  }

  public String timeColumn() {
    return timeColumn;
  }

  public String valueColumn() {
    return valueColumn;
  }

  public String token() {
    return token;
  }

  public String description() {
    return description;
  }
}
