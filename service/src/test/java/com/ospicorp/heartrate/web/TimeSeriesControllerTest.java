package com.ospicorp.heartrate.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.heartrate.config.SecurityConfig;
import com.ospicorp.heartrate.query.EntitySeries;
import com.ospicorp.heartrate.query.FanoutQueryExecutor;
import com.ospicorp.heartrate.query.MultiEntityResult;
import com.ospicorp.heartrate.query.QueryInfo;
import com.ospicorp.heartrate.query.QueryWindow;
import com.ospicorp.heartrate.query.TimeSeriesPoint;
import com.ospicorp.heartrate.query.TimeSeriesQueryService;
import com.ospicorp.heartrate.query.TimeSeriesResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = {TimeSeriesController.class, RootController.class})
@Import({SecurityConfig.class, TimeSeriesControllerTest.FixedClock.class})
class TimeSeriesControllerTest {

  private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
  private static final OffsetDateTime T0 = OffsetDateTime.of(2024, 3, 1, 0, 0, 0, 0, ZoneOffset.UTC);
  private static final QueryInfo HOURLY =
      new QueryInfo("activities_heart_intraday_1h", "1-hour aggregated heart rate data", "1h");

  @TestConfiguration
  static class FixedClock {
    @Bean
    Clock clock() {
      return Clock.fixed(NOW, ZoneOffset.UTC);
    }
  }

  @Autowired
  private MockMvc mvc;

  @MockBean
  private TimeSeriesQueryService queryService;

  @MockBean
  private FanoutQueryExecutor fanout;

  private void stubSeries(String user) {
    when(queryService.getTimeSeries(any(), eq(user))).thenReturn(new TimeSeriesResult(List.of(
        new TimeSeriesPoint(T0, 71.5, user),
        new TimeSeriesPoint(T0.plusHours(1), 74.25, user)), HOURLY));
  }

  @Test
  void returnsPointsWithQueryMetadata() throws Exception {
    stubSeries("user1");

    mvc.perform(get("/timeseries")
            .param("start_date", "2024-03-01T00:00:00Z")
            .param("end_date", "2024-03-03T00:00:00Z")
            .param("user_id", "user1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.length()").value(2))
        .andExpect(jsonPath("$.data[0].user_id").value("user1"))
        .andExpect(jsonPath("$.data[0].value").value(71.5))
        .andExpect(jsonPath("$.data[0].timestamp").value("2024-03-01T00:00:00Z"))
        .andExpect(jsonPath("$.metadata.query_info.table_used").value("activities_heart_intraday_1h"))
        .andExpect(jsonPath("$.metadata.query_info.interval").value("1h"));
  }

  @Test
  void defaultsToLastSevenDaysAndFirstAvailableUser() throws Exception {
    when(queryService.defaultUserId()).thenReturn("alice");
    stubSeries("alice");

    mvc.perform(get("/timeseries")).andExpect(status().isOk());

    ArgumentCaptor<QueryWindow> window = ArgumentCaptor.forClass(QueryWindow.class);
    verify(queryService).getTimeSeries(window.capture(), eq("alice"));
    assertThat(window.getValue().end().toInstant()).isEqualTo(NOW);
    assertThat(window.getValue().span()).isEqualTo(Duration.ofDays(7));
    assertThat(window.getValue().interval()).isNull();
  }

  @Test
  void acceptsPlainDatesAndExplicitInterval() throws Exception {
    stubSeries("user1");

    mvc.perform(get("/timeseries")
            .param("start_date", "2024-03-01")
            .param("end_date", "2024-03-02 12:00:00")
            .param("user_id", "user1")
            .param("interval", "1m"))
        .andExpect(status().isOk());

    ArgumentCaptor<QueryWindow> window = ArgumentCaptor.forClass(QueryWindow.class);
    verify(queryService).getTimeSeries(window.capture(), eq("user1"));
    assertThat(window.getValue().start()).isEqualTo(T0);
    assertThat(window.getValue().span()).isEqualTo(Duration.ofHours(36));
    assertThat(window.getValue().interval().token()).isEqualTo("1m");
  }

  @Test
  void offsetWhosePlusArrivedAsSpaceIsKept() throws Exception {
    stubSeries("user1");

    mvc.perform(get("/timeseries")
            .param("start_date", "2024-03-01 02:00:00 02:00")
            .param("end_date", "2024-03-01T12:00:00+02:00")
            .param("user_id", "user1"))
        .andExpect(status().isOk());

    ArgumentCaptor<QueryWindow> window = ArgumentCaptor.forClass(QueryWindow.class);
    verify(queryService).getTimeSeries(window.capture(), eq("user1"));
    assertThat(window.getValue().start().toInstant()).isEqualTo(T0.toInstant());
    assertThat(window.getValue().start().getOffset()).isEqualTo(ZoneOffset.ofHours(2));
    assertThat(window.getValue().span()).isEqualTo(Duration.ofHours(10));
  }

  @Test
  void startNotBeforeEndIsRejected() throws Exception {
    mvc.perform(get("/timeseries")
            .param("start_date", "2024-03-02T00:00:00Z")
            .param("end_date", "2024-03-01T00:00:00Z"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(2002))
        .andExpect(jsonPath("$.path").value("/timeseries"));
    verify(queryService, never()).getTimeSeries(any(), any());
  }

  @Test
  void rangeAboveYearIsRejected() throws Exception {
    mvc.perform(get("/timeseries")
            .param("start_date", "2022-01-01")
            .param("end_date", "2023-06-01"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(2003));
  }

  @Test
  void invalidIntervalDateAndFormatAreRejected() throws Exception {
    mvc.perform(get("/timeseries").param("interval", "5m"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(2004));
    mvc.perform(get("/timeseries").param("start_date", "yesterday"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(2001));
    mvc.perform(get("/timeseries").param("format", "xml"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(2005));
  }

  @Test
  void csvFormatWritesHeaderAndRows() throws Exception {
    stubSeries("user1");

    String body = mvc.perform(get("/timeseries")
            .param("start_date", "2024-03-01T00:00:00Z")
            .param("end_date", "2024-03-02T00:00:00Z")
            .param("user_id", "user1")
            .param("format", "csv"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith("text/csv"))
        .andReturn().getResponse().getContentAsString();

    assertThat(body.lines().toList()).containsExactly(
        "timestamp,value,user_id",
        "2024-03-01T00:00:00Z,71.5,user1",
        "2024-03-01T01:00:00Z,74.25,user1");
  }

  @Test
  void multiUserUsesDefaultListAndReturnsSeriesPerUser() throws Exception {
    when(fanout.run(eq(List.of("user1", "user2")), any())).thenReturn(new MultiEntityResult(List.of(
        EntitySeries.of("user1", List.of(new TimeSeriesPoint(T0, 70.0, "user1"))),
        EntitySeries.empty("user2")), HOURLY));

    mvc.perform(get("/multi-user/timeseries"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data[0].user_id").value("user1"))
        .andExpect(jsonPath("$.data[0].count").value(1))
        .andExpect(jsonPath("$.data[1].count").value(0))
        .andExpect(jsonPath("$.data[1].data.length()").value(0))
        .andExpect(jsonPath("$.metadata.query_info.table_used").value("activities_heart_intraday_1h"));
  }

  @Test
  void multiUserLimitsUsersAndRange() throws Exception {
    mvc.perform(get("/multi-user/timeseries").param("user_ids", "a,b,c,d,e,f"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(2006));
    mvc.perform(get("/multi-user/timeseries").param("user_ids", " , "))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(2007));
    mvc.perform(get("/multi-user/timeseries")
            .param("user_ids", "a")
            .param("start_date", "2023-01-01")
            .param("end_date", "2023-12-01"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value(2003));
  }

  @Test
  void unexpectedFailureHidesDetails() throws Exception {
    when(queryService.getTimeSeries(any(), eq("user1"))).thenThrow(new IllegalStateException("pool exhausted"));

    mvc.perform(get("/timeseries").param("user_id", "user1"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.detail").value("Internal server error"))
        .andExpect(jsonPath("$.title").value("Internal Server Error"));
  }

  @Test
  void healthReportsUnreachableDatabase() throws Exception {
    when(queryService.databaseReachable()).thenReturn(false);

    mvc.perform(get("/health"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.status").value("unhealthy"));
  }

  @Test
  void requestIdIsEchoed() throws Exception {
    when(queryService.databaseReachable()).thenReturn(true);

    mvc.perform(get("/health").header("X-Request-Id", "req-42"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Request-Id", "req-42"));
  }
}
