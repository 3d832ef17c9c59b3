package com.ospicorp.heartrate.ingestion.model;

import java.util.List;
import java.util.Set;

/**
 * A named destination table: its ordered columns, the composite primary key
 * enforced by the store, and which columns hold the timestamp and the entity.
 * Re-ingesting a primary key overwrites the existing row.
 */
public record Stream(
    String name,
    List<Column> columns,
    List<String> primaryKey,
    String timestampColumn,
    String entityColumn
) {

  public Stream {
    columns = List.copyOf(columns);
    primaryKey = List.copyOf(primaryKey);
    Set<String> names = Set.copyOf(columns.stream().map(Column::name).toList());
    if (!names.containsAll(primaryKey)) {
      throw new IllegalArgumentException("Primary key of " + name + " references unknown columns: " + primaryKey);
    }
    if (!primaryKey.contains(timestampColumn) || !primaryKey.contains(entityColumn)) {
      throw new IllegalArgumentException("Primary key of " + name + " must include timestamp and entity columns");
    }
  }

  public List<String> columnNames() {
    return columns.stream().map(Column::name).toList();
  }

  public List<String> nonKeyColumns() {
    return columns.stream()
        .map(Column::name)
        .filter(column -> !primaryKey.contains(column))
        .toList();
  }
}
