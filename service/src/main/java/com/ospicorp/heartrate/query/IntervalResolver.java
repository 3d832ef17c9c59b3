package com.ospicorp.heartrate.query;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Picks the coarsest storage granularity that still suits a requested span and
 * builds the SQL that reads it. With an explicit output interval the rows are
 * re-bucketed with {@code time_bucket}; averaging an aggregate source at a finer
 * interval averages already averaged values.
 */
public class IntervalResolver {

  private final Duration rawBelow;
  private final Duration minuteUpTo;
  private final Duration hourUpTo;

  public IntervalResolver(Duration rawBelow, Duration minuteUpTo, Duration hourUpTo) {
    if (rawBelow.compareTo(minuteUpTo) > 0 || minuteUpTo.compareTo(hourUpTo) > 0) {
      throw new IllegalArgumentException("Resolution thresholds must be ordered finest to coarsest");
    }
    this.rawBelow = rawBelow;
    this.minuteUpTo = minuteUpTo;
    this.hourUpTo = hourUpTo;
  }

  public static IntervalResolver withDefaults() {
    return new IntervalResolver(Duration.ofMinutes(2), Duration.ofHours(2), Duration.ofDays(7));
  }

  public Granularity resolveSource(OffsetDateTime start, OffsetDateTime end) {
    Duration span = Duration.between(start, end);
    if (span.compareTo(rawBelow) < 0) {
      return Granularity.RAW;
    }
    if (span.compareTo(minuteUpTo) <= 0) {
      return Granularity.MINUTE;
    }
    if (span.compareTo(hourUpTo) <= 0) {
      return Granularity.HOUR;
    }
    return Granularity.DAY;
  }

  public QueryResolution resolve(QueryWindow window) {
    return new QueryResolution(resolveSource(window.start(), window.end()), window.interval());
  }

  public TimeSeriesQuery buildQuery(QueryResolution resolution, QueryWindow window, String entityId) {
    String time = resolution.timeColumn();
    String value = resolution.valueColumn();
    String where = " WHERE " + time + " >= ? AND " + time + " <= ? AND user_id = ? AND " + value + " IS NOT NULL";
    String sql;
    if (resolution.rebucketed()) {
      sql = "SELECT time_bucket(INTERVAL '" + resolution.outputInterval().bucketWidth() + "', " + time + ") AS bucket, "
          + "ROUND(AVG(" + value + ")::numeric, 2) AS value, user_id"
          + " FROM " + resolution.table()
          + where
          + " GROUP BY bucket, user_id ORDER BY bucket";
    } else {
      sql = "SELECT " + time + " AS bucket, ROUND(" + value + "::numeric, 2) AS value, user_id"
          + " FROM " + resolution.table()
          + where
          + " ORDER BY " + time;
    }
    return new TimeSeriesQuery(sql, List.of(window.start(), window.end(), entityId));
  }
}
