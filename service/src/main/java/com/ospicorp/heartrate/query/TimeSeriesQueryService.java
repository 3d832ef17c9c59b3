package com.ospicorp.heartrate.query;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class TimeSeriesQueryService {

  private static final Logger log = LoggerFactory.getLogger(TimeSeriesQueryService.class);

  private final IntervalResolver resolver;
  private final HeartRateQueryDao dao;
  private final String fallbackUserId;

  public TimeSeriesQueryService(IntervalResolver resolver,
      HeartRateQueryDao dao,
      @Value("${query.fallback-user-id:user1}") String fallbackUserId) {
    this.resolver = resolver;
    this.dao = dao;
    this.fallbackUserId = fallbackUserId;
  }

  public TimeSeriesResult getTimeSeries(QueryWindow window, String userId) {
    QueryResolution resolution = resolver.resolve(window);
    TimeSeriesQuery query = resolver.buildQuery(resolution, window, userId);
    List<TimeSeriesPoint> points = dao.fetch(query);
    log.debug("Fetched {} points for {} from {} at {}", points.size(), userId, resolution.table(), resolution.interval());
    return new TimeSeriesResult(points, QueryInfo.of(resolution));
  }

  public QueryInfo describe(QueryWindow window) {
    return QueryInfo.of(resolver.resolve(window));
  }

  /** First user with data other than the ingestion default, or the configured fallback. */
  public String defaultUserId() {
    try {
      return dao.findDefaultUserId().orElse(fallbackUserId);
    } catch (DataAccessException ex) {
      log.warn("Could not look up a default user, using {}: {}", fallbackUserId, ex.getMessage());
      return fallbackUserId;
    }
  }

  public List<UserSummary> listUsers() {
    return dao.listUsers();
  }

  public boolean databaseReachable() {
    try {
      return dao.ping();
    } catch (DataAccessException ex) {
      log.warn("Database health check failed: {}", ex.getMessage());
      return false;
    }
  }
}
