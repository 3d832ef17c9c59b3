package com.ospicorp.heartrate.ingestion.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.heartrate.ingestion.model.Streams;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class RangeDiscoveryTest {

  private static final LocalDate TODAY = LocalDate.of(2024, 3, 10);
  private final RangeDiscovery discovery =
      new RangeDiscovery(Clock.fixed(Instant.parse("2024-03-10T15:00:00Z"), ZoneOffset.UTC));

  private static Watermark intraday(LocalDate lastDay) {
    return new Watermark(Streams.INTRADAY, "user1",
        lastDay == null ? null : OffsetDateTime.of(lastDay.atTime(23, 59, 59), ZoneOffset.UTC));
  }

  private static Watermark summary(LocalDate lastDay) {
    return new Watermark(Streams.SUMMARY, "user1",
        lastDay == null ? null : OffsetDateTime.of(lastDay.atStartOfDay(), ZoneOffset.UTC));
  }

  @Test
  void earliestNextDateAcrossStreamsWins() {
    LocalDate dayN = LocalDate.of(2024, 3, 6);

    DateRange range = discovery.determine(List.of(intraday(dayN), summary(dayN.minusDays(3))), null, null);

    assertThat(range.start()).isEqualTo(dayN.minusDays(2));
    assertThat(range.end()).isEqualTo(TODAY);
  }

  @Test
  void noDataFallsBackToThirtyDaysAgo() {
    DateRange range = discovery.determine(List.of(intraday(null), summary(null)), null, null);

    assertThat(range).isEqualTo(new DateRange(TODAY.minusDays(30), TODAY));
  }

  @Test
  void noDataUsesConfiguredStartWhenPresent() {
    DateRange range = discovery.determine(List.of(intraday(null)), LocalDate.of(2024, 2, 1), null);

    assertThat(range).isEqualTo(new DateRange(LocalDate.of(2024, 2, 1), TODAY));
  }

  @Test
  void explicitStartAndEndOverrideWatermarks() {
    DateRange range = discovery.determine(List.of(intraday(LocalDate.of(2024, 3, 1))),
        LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 3));

    assertThat(range).isEqualTo(new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 3)));
    assertThat(range.dates()).hasSize(3);
  }

  @Test
  void futureCandidatesAreSkipped() {
    DateRange range = discovery.determine(
        List.of(intraday(LocalDate.of(2024, 3, 12)), summary(LocalDate.of(2024, 3, 7))), null, null);

    assertThat(range.start()).isEqualTo(LocalDate.of(2024, 3, 8));
  }

  @Test
  void upToDateStreamsRecheckToday() {
    DateRange range = discovery.determine(List.of(intraday(TODAY), summary(TODAY)), null, null);

    assertThat(range).isEqualTo(new DateRange(TODAY, TODAY));
  }

  @Test
  void rangeStartingAfterEndIsEmpty() {
    DateRange range = new DateRange(TODAY.plusDays(1), TODAY);

    assertThat(range.isEmpty()).isTrue();
    assertThat(range.dates()).isEmpty();
  }
}
