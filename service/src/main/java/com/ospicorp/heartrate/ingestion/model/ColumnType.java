package com.ospicorp.heartrate.ingestion.model;

/**
 * SQL column types used by ingestion streams, with the name reported by
 * {@code information_schema.columns.data_type} and the JDBC bind placeholder.
 */
public enum ColumnType {
  TIMESTAMPTZ("timestamp with time zone", "?"),
  DOUBLE("double precision", "?"),
  INTEGER("integer", "?"),
  JSONB("jsonb", "?::jsonb"),
  TEXT("text", "?");

  private final String informationSchemaType;
  private final String placeholder;

  ColumnType(String informationSchemaType, String placeholder) {
    this.informationSchemaType = informationSchemaType;
    this.placeholder = placeholder;
  }

  public String informationSchemaType() {
    return informationSchemaType;
  }

  public String placeholder() {
    return placeholder;
  }
}
