package com.ospicorp.heartrate.query;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one query per entity concurrently. A failing entity contributes an
 * empty series and never fails the whole call.
 */
@Service
public class FanoutQueryExecutor {

  private static final Logger log = LoggerFactory.getLogger(FanoutQueryExecutor.class);

  private final TimeSeriesQueryService queryService;
  private final Executor executor;

  public FanoutQueryExecutor(TimeSeriesQueryService queryService,
      @Qualifier("queryFanoutExecutor") Executor executor) {
    this.queryService = queryService;
    this.executor = executor;
  }

  public MultiEntityResult run(List<String> entityIds, QueryWindow window) {
    List<CompletableFuture<EntitySeries>> futures = entityIds.stream()
        .map(entityId -> CompletableFuture
            .supplyAsync(() -> EntitySeries.of(entityId, queryService.getTimeSeries(window, entityId).points()), executor)
            .exceptionally(ex -> {
              Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
              log.warn("Query for {} failed, returning empty series: {}", entityId, cause.getMessage());
              return EntitySeries.empty(entityId);
            }))
        .toList();
    List<EntitySeries> series = futures.stream().map(CompletableFuture::join).toList();
    return new MultiEntityResult(series, queryService.describe(window));
  }
}
