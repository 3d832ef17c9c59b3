package com.ospicorp.heartrate.ingestion.load;

import com.ospicorp.heartrate.ingestion.model.Column;
import com.ospicorp.heartrate.ingestion.model.Stream;
import com.ospicorp.heartrate.ingestion.transform.CanonicalRecord;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

public class JdbcTableStore implements TableStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcTableStore.class);

  private static final String COLUMNS_SQL = """
      SELECT column_name, data_type, is_nullable
      FROM information_schema.columns
      WHERE table_schema = current_schema() AND table_name = ?
      ORDER BY ordinal_position
      """;

  private final JdbcTemplate jdbc;
  private final TransactionTemplate transactions;

  public JdbcTableStore(JdbcTemplate jdbc, TransactionTemplate transactions) {
    this.jdbc = jdbc;
    this.transactions = transactions;
  }

  @Override
  public void checkReady(Stream stream) {
    Map<String, String[]> actual = new HashMap<>();
    try {
      jdbc.queryForObject("SELECT 1", Integer.class);
      jdbc.query(COLUMNS_SQL, rs -> {
        actual.put(rs.getString("column_name"),
            new String[] {rs.getString("data_type"), rs.getString("is_nullable")});
      }, stream.name());
    } catch (DataAccessException ex) {
      throw new StoreNotReadyException("Database is not reachable: " + ex.getMessage(), ex);
    }
    if (actual.isEmpty()) {
      throw new StoreNotReadyException("Table " + stream.name() + " does not exist");
    }
    for (Column column : stream.columns()) {
      String[] found = actual.get(column.name());
      if (found == null) {
        throw new StoreNotReadyException("Table " + stream.name() + " is missing column " + column.name());
      }
      if (!column.type().informationSchemaType().equalsIgnoreCase(found[0])) {
        throw new StoreNotReadyException("Column " + stream.name() + "." + column.name()
            + " has type " + found[0] + ", expected " + column.type().informationSchemaType());
      }
      if (!column.nullable() && "YES".equalsIgnoreCase(found[1])) {
        throw new StoreNotReadyException("Column " + stream.name() + "." + column.name() + " must be NOT NULL");
      }
    }
    log.info("Table {} verified with {} columns", stream.name(), stream.columns().size());
  }

  @Override
  public Optional<OffsetDateTime> lastTimestamp(Stream stream, String entityId) {
    String sql = "SELECT MAX(" + stream.timestampColumn() + ") FROM " + stream.name()
        + " WHERE " + stream.entityColumn() + " = ?";
    return Optional.ofNullable(jdbc.queryForObject(sql, OffsetDateTime.class, entityId));
  }

  @Override
  public long countRows(Stream stream, String entityId) {
    String sql = "SELECT COUNT(*) FROM " + stream.name() + " WHERE " + stream.entityColumn() + " = ?";
    Long count = jdbc.queryForObject(sql, Long.class, entityId);
    return count == null ? 0L : count;
  }

  @Override
  public void writeBatch(Stream stream, List<? extends CanonicalRecord> batch, boolean upsert) {
    if (batch.isEmpty()) {
      return;
    }
    String sql = insertSql(stream, upsert);
    List<Object[]> args = batch.stream()
        .map(row -> row.columnValues().toArray())
        .toList();
    transactions.executeWithoutResult(status -> jdbc.batchUpdate(sql, args));
  }

  static String insertSql(Stream stream, boolean upsert) {
    String placeholders = stream.columns().stream()
        .map(column -> column.type().placeholder())
        .collect(Collectors.joining(", "));
    StringBuilder sql = new StringBuilder()
        .append("INSERT INTO ").append(stream.name())
        .append(" (").append(String.join(", ", stream.columnNames())).append(")")
        .append(" VALUES (").append(placeholders).append(")");
    if (upsert) {
      sql.append(" ON CONFLICT (").append(String.join(", ", stream.primaryKey())).append(")");
      List<String> updatable = stream.nonKeyColumns();
      if (updatable.isEmpty()) {
        sql.append(" DO NOTHING");
      } else {
        sql.append(" DO UPDATE SET ").append(updatable.stream()
            .map(column -> column + " = EXCLUDED." + column)
            .collect(Collectors.joining(", ")));
      }
    }
    return sql.toString();
  }
}
