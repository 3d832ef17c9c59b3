package com.ospicorp.heartrate.ingestion.model;

import java.util.List;

public final class Streams {

  public static final String TIMESTAMP = "timestamp";
  public static final String USER_ID = "user_id";

  public static final Stream INTRADAY = new Stream(
      "activities_heart_intraday",
      List.of(
          Column.required(TIMESTAMP, ColumnType.TIMESTAMPTZ),
          Column.required("value", ColumnType.DOUBLE),
          Column.required(USER_ID, ColumnType.TEXT)),
      List.of(TIMESTAMP, USER_ID),
      TIMESTAMP,
      USER_ID);

  public static final Stream SUMMARY = new Stream(
      "activities_heart_summary",
      List.of(
          Column.required(TIMESTAMP, ColumnType.TIMESTAMPTZ),
          Column.optional("resting_heart_rate", ColumnType.INTEGER),
          Column.optional("heart_rate_zones", ColumnType.JSONB),
          Column.optional("custom_heart_rate_zones", ColumnType.JSONB),
          Column.required(USER_ID, ColumnType.TEXT)),
      List.of(TIMESTAMP, USER_ID),
      TIMESTAMP,
      USER_ID);

  private Streams() {
  }
}
