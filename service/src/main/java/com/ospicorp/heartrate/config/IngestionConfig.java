package com.ospicorp.heartrate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.heartrate.ingestion.extract.IntradayExtractor;
import com.ospicorp.heartrate.ingestion.extract.RecordExtractor;
import com.ospicorp.heartrate.ingestion.extract.SummaryExtractor;
import com.ospicorp.heartrate.ingestion.load.BatchLoader;
import com.ospicorp.heartrate.ingestion.load.JdbcTableStore;
import com.ospicorp.heartrate.ingestion.load.TableStore;
import com.ospicorp.heartrate.ingestion.model.Streams;
import com.ospicorp.heartrate.ingestion.pipeline.IngestionSettings;
import com.ospicorp.heartrate.ingestion.pipeline.PipelineOrchestrator;
import com.ospicorp.heartrate.ingestion.pipeline.RangeDiscovery;
import com.ospicorp.heartrate.ingestion.pipeline.StreamRegistration;
import com.ospicorp.heartrate.ingestion.source.CacheReplaySource;
import com.ospicorp.heartrate.ingestion.source.DaySampleGenerator;
import com.ospicorp.heartrate.ingestion.source.PerturbationPolicy;
import com.ospicorp.heartrate.ingestion.transform.IntradayTransformer;
import com.ospicorp.heartrate.ingestion.transform.SummaryTransformer;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/** Wires the ingestion pipeline from {@code ingestion.*} properties. */
@Configuration
public class IngestionConfig {

  @Bean
  IngestionSettings ingestionSettings(
      @Value("${ingestion.entity-id:default_user}") String entityId,
      @Value("${ingestion.batch-size:10000}") int batchSize,
      @Value("${ingestion.summary-batch-size:1}") int summaryBatchSize,
      @Value("${ingestion.start-date:}") String startDate,
      @Value("${ingestion.end-date:}") String endDate,
      @Value("${ingestion.delta-mode:true}") boolean deltaMode,
      @Value("${ingestion.upsert-mode:true}") boolean upsertMode,
      @Value("${ingestion.data-seed:0}") long dataSeed,
      @Value("${ingestion.cache-dir:./cache}") String cacheDir,
      @Value("${ingestion.sample-interval-seconds:1}") int sampleIntervalSeconds,
      @Value("${ingestion.intraday-perturbation:jitter}") String perturbation,
      @Value("${timeseries.zone-offset:Z}") ZoneOffset zoneOffset) {
    return new IngestionSettings(entityId, batchSize, summaryBatchSize,
        IngestionSettings.parseDate("ingestion.start-date", startDate),
        IngestionSettings.parseDate("ingestion.end-date", endDate),
        deltaMode, upsertMode, dataSeed, Path.of(cacheDir), sampleIntervalSeconds,
        PerturbationPolicy.parse(perturbation), zoneOffset);
  }

  @Bean
  CacheReplaySource cacheReplaySource(IngestionSettings settings, ObjectMapper mapper,
      @Value("${ingestion.regenerate-cache:true}") boolean regenerateCache) {
    DaySampleGenerator generator = regenerateCache
        ? new DaySampleGenerator(mapper, DaySampleGenerator.DEFAULT_SEED, CacheReplaySource.DEFAULT_CYCLE_LENGTH,
            settings.sampleIntervalSeconds(), CacheReplaySource.DEFAULT_BASE_DATE)
        : null;
    return new CacheReplaySource(settings.cacheDir().resolve(CacheReplaySource.CACHE_FILE_NAME), mapper, generator);
  }

  @Bean
  TableStore tableStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
    return new JdbcTableStore(jdbcTemplate, transactionTemplate);
  }

  @Bean
  PipelineOrchestrator pipelineOrchestrator(IngestionSettings settings, CacheReplaySource source,
      TableStore tableStore, ObjectMapper mapper, Clock clock) {
    List<RecordExtractor> extractors = List.of(
        new IntradayExtractor(source, settings.entityId(), settings.intradayPerturbation().forSeed(settings.dataSeed())),
        new SummaryExtractor(source, settings.entityId(), settings.dataSeed()));
    List<StreamRegistration> registrations = List.of(
        new StreamRegistration(Streams.INTRADAY,
            new IntradayTransformer(settings.zoneOffset()),
            new BatchLoader(tableStore, settings.batchSize())),
        new StreamRegistration(Streams.SUMMARY,
            new SummaryTransformer(mapper, settings.zoneOffset()),
            new BatchLoader(tableStore, settings.summaryBatchSize())));
    return new PipelineOrchestrator(extractors, registrations, tableStore, new RangeDiscovery(clock), settings);
  }
}
