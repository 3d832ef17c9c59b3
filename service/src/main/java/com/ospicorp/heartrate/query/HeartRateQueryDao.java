package com.ospicorp.heartrate.query;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class HeartRateQueryDao {

  private final JdbcTemplate jdbc;

  public HeartRateQueryDao(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  public List<TimeSeriesPoint> fetch(TimeSeriesQuery query) {
    return jdbc.query(query.sql(), (rs, i) -> toPoint(rs), query.args().toArray());
  }

  public Optional<String> findDefaultUserId() {
    String sql = """
        SELECT DISTINCT user_id
        FROM activities_heart_intraday
        WHERE user_id IS NOT NULL AND user_id <> '' AND user_id <> 'default_user'
        ORDER BY user_id
        LIMIT 1
        """;
    return jdbc.queryForList(sql, String.class).stream().findFirst();
  }

  public List<UserSummary> listUsers() {
    String sql = """
        SELECT user_id, COUNT(*) AS record_count,
               MIN(timestamp) AS first_timestamp, MAX(timestamp) AS last_timestamp
        FROM activities_heart_intraday
        WHERE user_id IS NOT NULL AND user_id <> ''
        GROUP BY user_id
        ORDER BY user_id
        """;
    return jdbc.query(sql, (rs, i) -> new UserSummary(
        rs.getString("user_id"),
        rs.getLong("record_count"),
        rs.getObject("first_timestamp", OffsetDateTime.class),
        rs.getObject("last_timestamp", OffsetDateTime.class)));
  }

  public boolean ping() {
    Integer one = jdbc.queryForObject("SELECT 1", Integer.class);
    return one != null && one == 1;
  }

  private static TimeSeriesPoint toPoint(ResultSet rs) throws SQLException {
    BigDecimal value = rs.getBigDecimal("value");
    return new TimeSeriesPoint(
        rs.getObject("bucket", OffsetDateTime.class),
        value == null ? null : value.doubleValue(),
        rs.getString("user_id"));
  }
}
