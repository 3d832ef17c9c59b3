package com.ospicorp.heartrate.ingestion.pipeline;

import com.ospicorp.heartrate.ingestion.extract.ExtractedBatch;
import com.ospicorp.heartrate.ingestion.extract.RecordExtractor;
import com.ospicorp.heartrate.ingestion.load.LoadResult;
import com.ospicorp.heartrate.ingestion.load.StoreNotReadyException;
import com.ospicorp.heartrate.ingestion.load.TableStore;
import com.ospicorp.heartrate.ingestion.model.Stream;
import com.ospicorp.heartrate.ingestion.transform.CanonicalRecord;
import com.ospicorp.heartrate.ingestion.transform.DeltaFilter;
import com.ospicorp.heartrate.ingestion.transform.TransformStats;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one ingestion run: preflight, date-range discovery, then
 * extract, transform and load for every day in the range. A failed load stops
 * the run; days committed before it stay committed. Runs on one thread; not
 * safe for concurrent {@link #run()} calls.
 */
public class PipelineOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

  private final List<RecordExtractor> extractors;
  private final Map<String, StreamRegistration> registrations;
  private final TableStore store;
  private final RangeDiscovery rangeDiscovery;
  private final IngestionSettings settings;

  private volatile PipelineState state = PipelineState.IDLE;

  public PipelineOrchestrator(List<RecordExtractor> extractors,
      List<StreamRegistration> registrations,
      TableStore store,
      RangeDiscovery rangeDiscovery,
      IngestionSettings settings) {
    this.extractors = List.copyOf(extractors);
    this.registrations = new LinkedHashMap<>();
    for (StreamRegistration registration : registrations) {
      this.registrations.put(registration.stream().name(), registration);
    }
    this.store = store;
    this.rangeDiscovery = rangeDiscovery;
    this.settings = settings;
  }

  public PipelineState state() {
    return state;
  }

  public PipelineRun run() {
    RunTracker tracker = new RunTracker();
    state = PipelineState.IDLE;
    log.info("Starting heart rate ingestion for {} (delta mode {}, upsert mode {})",
        settings.entityId(), settings.deltaMode(), settings.upsertMode());
    try {
      if (!preflight()) {
        return finish(PipelineState.FAILED, tracker);
      }
      state = PipelineState.PREFLIGHT_CHECKED;

      Map<String, Watermark> watermarks = readWatermarks();
      tracker.range = rangeDiscovery.determine(watermarks.values(), settings.startDate(), settings.endDate());
      state = PipelineState.RANGE_DETERMINED;
      log.info("Processing data for {}", tracker.range);

      state = PipelineState.RUNNING;
      for (LocalDate date : tracker.range.dates()) {
        if (!processDay(date, watermarks, tracker)) {
          return finish(PipelineState.FAILED, tracker);
        }
        tracker.daysProcessed++;
      }
      if (tracker.recordsProcessed == 0) {
        log.warn("No records were extracted for {}", tracker.range);
      } else if (tracker.recordsLoaded == 0) {
        log.info("No new data to load; all streams are up to date");
      }
      return finish(PipelineState.COMPLETED, tracker);
    } catch (RuntimeException ex) {
      log.error("Pipeline execution error: {}", ex.getMessage(), ex);
      return finish(PipelineState.FAILED, tracker);
    }
  }

  private boolean preflight() {
    for (StreamRegistration registration : registrations.values()) {
      try {
        store.checkReady(registration.stream());
      } catch (StoreNotReadyException ex) {
        log.error("Preflight failed for {}: {}", registration.stream().name(), ex.getMessage());
        return false;
      }
    }
    log.info("Preflight passed for {} stream(s)", registrations.size());
    return true;
  }

  private Map<String, Watermark> readWatermarks() {
    Map<String, Watermark> watermarks = new LinkedHashMap<>();
    for (StreamRegistration registration : registrations.values()) {
      Stream stream = registration.stream();
      // the store reports instants in its own offset; express them in the configured one
      Watermark watermark = new Watermark(stream, settings.entityId(), store.lastTimestamp(stream, settings.entityId())
          .map(timestamp -> timestamp.withOffsetSameInstant(settings.zoneOffset()))
          .orElse(null));
      if (watermark.hasData()) {
        log.info("Latest {} timestamp for {}: {}", stream.name(), settings.entityId(), watermark.lastTimestamp());
      }
      watermarks.put(stream.name(), watermark);
    }
    return watermarks;
  }

  private boolean processDay(LocalDate date, Map<String, Watermark> watermarks, RunTracker tracker) {
    log.info("Processing {}", date);

    long started = System.nanoTime();
    List<ExtractedBatch> extracted = new ArrayList<>();
    for (RecordExtractor extractor : extractors) {
      extracted.addAll(extractor.extract(date));
    }
    tracker.extraction = tracker.extraction.plusNanos(System.nanoTime() - started);

    started = System.nanoTime();
    Map<StreamRegistration, List<CanonicalRecord>> pending = new LinkedHashMap<>();
    for (ExtractedBatch batch : extracted) {
      StreamRegistration registration = registrations.get(batch.stream().name());
      if (registration == null) {
        log.warn("No transformer registered for stream {}, skipping {} records",
            batch.stream().name(), batch.records().size());
        continue;
      }
      tracker.recordsProcessed += batch.records().size();
      Watermark watermark = watermarks.get(batch.stream().name());
      OffsetDateTime lastTimestamp = watermark == null ? null : watermark.lastTimestamp();
      List<CanonicalRecord> rows = registration.transformer()
          .transformAll(batch.records(), lastTimestamp, tracker.transformStats);
      if (settings.deltaMode()) {
        int before = rows.size();
        rows = DeltaFilter.filterNew(rows, lastTimestamp);
        if (rows.size() < before) {
          log.info("Delta filter kept {} of {} {} records for {}", rows.size(), before, batch.stream().name(), date);
        }
      }
      if (rows.isEmpty()) {
        log.info("No new {} records for {}", batch.stream().name(), date);
        continue;
      }
      pending.computeIfAbsent(registration, key -> new ArrayList<>()).addAll(rows);
    }
    tracker.transformation = tracker.transformation.plusNanos(System.nanoTime() - started);

    started = System.nanoTime();
    try {
      for (Map.Entry<StreamRegistration, List<CanonicalRecord>> entry : pending.entrySet()) {
        StreamRegistration registration = entry.getKey();
        Stream stream = registration.stream();
        LoadResult result = registration.loader().load(stream, entry.getValue(), settings.upsertMode());
        tracker.recordsLoaded += result.written();
        if (!result.success()) {
          log.error("Loading {} failed for {} after {} of {} records", stream.name(), date,
              result.written(), result.attempted());
          return false;
        }
        long loadedForStream = tracker.loadedByStream.merge(stream.name(), (long) result.written(), Long::sum);
        registration.loader().verify(stream, settings.entityId(), loadedForStream);
      }
    } finally {
      tracker.loading = tracker.loading.plusNanos(System.nanoTime() - started);
    }
    return true;
  }

  private PipelineRun finish(PipelineState terminal, RunTracker tracker) {
    state = terminal;
    PipelineRun run = tracker.toRun(terminal);
    if (terminal == PipelineState.COMPLETED) {
      log.info("Pipeline completed: {} days, {} records processed, {} loaded, {} invalid, {} missing values filled in {} ms",
          run.daysProcessed(), run.recordsProcessed(), run.recordsLoaded(), run.invalidRecords(),
          run.missingValuesFilled(), run.totalTime().toMillis());
    } else {
      log.error("Pipeline failed after {} days, {} records loaded", run.daysProcessed(), run.recordsLoaded());
    }
    return run;
  }

  private static final class RunTracker {
    private final long startedAt = System.nanoTime();
    private final TransformStats transformStats = new TransformStats();
    private final Map<String, Long> loadedByStream = new HashMap<>();
    private DateRange range;
    private long recordsProcessed;
    private long recordsLoaded;
    private int daysProcessed;
    private Duration extraction = Duration.ZERO;
    private Duration transformation = Duration.ZERO;
    private Duration loading = Duration.ZERO;

    private PipelineRun toRun(PipelineState terminal) {
      return new PipelineRun(terminal, range, recordsProcessed, recordsLoaded,
          transformStats.invalid(), transformStats.missingValuesFilled(), daysProcessed,
          extraction, transformation, loading, Duration.ofNanos(System.nanoTime() - startedAt));
    }
  }
}
