package com.ospicorp.heartrate.ingestion.load;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.heartrate.ingestion.model.Streams;
import com.ospicorp.heartrate.ingestion.transform.IntradayRow;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class BatchLoaderTest {

  private static List<IntradayRow> rows(int count, double value) {
    OffsetDateTime start = OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
    return IntStream.range(0, count)
        .mapToObj(i -> new IntradayRow(start.plusSeconds(i), value, "user1"))
        .toList();
  }

  @Test
  void splitsRecordsIntoBatchesOfConfiguredSize() {
    InMemoryTableStore store = new InMemoryTableStore();

    LoadResult result = new BatchLoader(store, 2).load(Streams.INTRADAY, rows(5, 70.0), true);

    assertThat(result.success()).isTrue();
    assertThat(result.written()).isEqualTo(5);
    assertThat(result.batchesProcessed()).isEqualTo(3);
    assertThat(store.batchSizes()).containsExactly(2, 2, 1);
  }

  @Test
  void failedBatchStopsTheCallAndKeepsEarlierBatches() {
    InMemoryTableStore store = new InMemoryTableStore().failOnWriteCall(2);

    LoadResult result = new BatchLoader(store, 2).load(Streams.INTRADAY, rows(6, 70.0), true);

    assertThat(result.success()).isFalse();
    assertThat(result.written()).isEqualTo(2);
    assertThat(result.batchesProcessed()).isEqualTo(1);
    assertThat(result.batchesFailed()).isEqualTo(1);
    assertThat(store.rows(Streams.INTRADAY.name())).hasSize(2);
  }

  @Test
  void upsertOverwritesExistingKeys() {
    InMemoryTableStore store = new InMemoryTableStore();
    BatchLoader loader = new BatchLoader(store, 10);

    loader.load(Streams.INTRADAY, rows(3, 70.0), true);
    loader.load(Streams.INTRADAY, rows(3, 75.0), true);

    assertThat(store.rows(Streams.INTRADAY.name()))
        .hasSize(3)
        .allSatisfy(row -> assertThat(((IntradayRow) row).value()).isEqualTo(75.0));
  }

  @Test
  void insertModeFailsOnDuplicateKeyAndRollsBackTheBatch() {
    InMemoryTableStore store = new InMemoryTableStore();
    BatchLoader loader = new BatchLoader(store, 10);
    loader.load(Streams.INTRADAY, rows(1, 70.0), false);

    LoadResult result = loader.load(Streams.INTRADAY, rows(3, 71.0), false);

    assertThat(result.success()).isFalse();
    assertThat(store.rows(Streams.INTRADAY.name())).hasSize(1);
  }

  @Test
  void emptyInputIsASuccessfulNoOp() {
    InMemoryTableStore store = new InMemoryTableStore();

    LoadResult result = new BatchLoader(store, 10).load(Streams.INTRADAY, List.of(), true);

    assertThat(result).isEqualTo(LoadResult.empty());
    assertThat(store.batchSizes()).isEmpty();
  }

  @Test
  void verifyComparesStoredCountWithExpectedMinimum() {
    InMemoryTableStore store = new InMemoryTableStore();
    BatchLoader loader = new BatchLoader(store, 10);
    loader.load(Streams.INTRADAY, rows(4, 70.0), true);

    assertThat(loader.verify(Streams.INTRADAY, "user1", 4)).isTrue();
    assertThat(loader.verify(Streams.INTRADAY, "user1", 5)).isFalse();
    assertThat(loader.verify(Streams.INTRADAY, "someone-else", 1)).isFalse();
  }

  @Test
  void rejectsNonPositiveBatchSize() {
    assertThatThrownBy(() -> new BatchLoader(new InMemoryTableStore(), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
