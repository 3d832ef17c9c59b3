package com.ospicorp.heartrate.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class FanoutQueryExecutorTest {

  private static final OffsetDateTime START = OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
  private static final QueryWindow WINDOW = new QueryWindow(START, START.plusDays(1), null);
  private static final QueryInfo INFO = new QueryInfo("activities_heart_intraday_1h", "1-hour aggregated heart rate data", "1h");

  private final ExecutorService pool = Executors.newFixedThreadPool(3);

  @AfterEach
  void shutdown() {
    pool.shutdownNow();
  }

  private static TimeSeriesResult result(String user, double... values) {
    List<TimeSeriesPoint> points = new ArrayList<>();
    for (int i = 0; i < values.length; i++) {
      points.add(new TimeSeriesPoint(START.plusHours(i), values[i], user));
    }
    return new TimeSeriesResult(points, INFO);
  }

  @Test
  void failingEntityYieldsEmptySeriesWithoutFailingTheCall() {
    TimeSeriesQueryService service = mock(TimeSeriesQueryService.class);
    when(service.getTimeSeries(any(), eq("a"))).thenReturn(result("a", 70, 71));
    when(service.getTimeSeries(any(), eq("b"))).thenThrow(new DataAccessResourceFailureException("connection reset"));
    when(service.getTimeSeries(any(), eq("c"))).thenReturn(result("c", 80));
    when(service.describe(WINDOW)).thenReturn(INFO);

    MultiEntityResult result = new FanoutQueryExecutor(service, pool).run(List.of("a", "b", "c"), WINDOW);

    assertThat(result.series()).extracting(EntitySeries::userId).containsExactly("a", "b", "c");
    assertThat(result.series().get(0).count()).isEqualTo(2);
    assertThat(result.series().get(1)).isEqualTo(EntitySeries.empty("b"));
    assertThat(result.series().get(2).data()).extracting(TimeSeriesPoint::value).containsExactly(80.0);
    assertThat(result.queryInfo()).isEqualTo(INFO);
  }

  @Test
  void allEntitiesFailingStillReturnsOneEntryEach() {
    TimeSeriesQueryService service = mock(TimeSeriesQueryService.class);
    when(service.getTimeSeries(any(), any())).thenThrow(new IllegalStateException("boom"));
    when(service.describe(WINDOW)).thenReturn(INFO);

    MultiEntityResult result = new FanoutQueryExecutor(service, pool).run(List.of("a", "b"), WINDOW);

    assertThat(result.series()).allSatisfy(series -> assertThat(series.count()).isZero());
  }
}
