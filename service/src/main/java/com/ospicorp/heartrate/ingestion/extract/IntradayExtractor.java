package com.ospicorp.heartrate.ingestion.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.heartrate.ingestion.model.Streams;
import com.ospicorp.heartrate.ingestion.source.CacheReplaySource;
import com.ospicorp.heartrate.ingestion.source.DayRecord;
import com.ospicorp.heartrate.ingestion.source.Perturbation;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class IntradayExtractor implements RecordExtractor {

  private static final Logger log = LoggerFactory.getLogger(IntradayExtractor.class);

  private final CacheReplaySource source;
  private final String entityId;
  private final Perturbation perturbation;

  public IntradayExtractor(CacheReplaySource source, String entityId, Perturbation perturbation) {
    this.source = source;
    this.entityId = entityId;
    this.perturbation = perturbation;
  }

  @Override
  public String name() {
    return "heart-rate-intraday";
  }

  @Override
  public List<ExtractedBatch> extract(LocalDate date) {
    try {
      Optional<DayRecord> dayRecord = source.getDayRecord(date);
      if (dayRecord.isEmpty()) {
        log.warn("No intraday heart rate data available for {}", date);
        return List.of();
      }
      List<CandidateRecord> samples = flatten(dayRecord.get().payload(), date);
      if (samples.isEmpty()) {
        log.warn("Day record {} for {} has no intraday samples", dayRecord.get().shift(), date);
        return List.of();
      }
      log.info("Extracted {} intraday heart rate records for {}", samples.size(), date);
      return List.of(new ExtractedBatch(Streams.INTRADAY, samples));
    } catch (RuntimeException ex) {
      log.error("Error extracting intraday heart rate data for {}: {}", date, ex.getMessage(), ex);
      return List.of();
    }
  }

  private List<CandidateRecord> flatten(JsonNode payload, LocalDate date) {
    JsonNode dataset = payload.path("heart_rate_day").path(0)
        .path("activities-heart-intraday").path("dataset");
    if (!dataset.isArray()) {
      return List.of();
    }
    List<String> times = new ArrayList<>();
    List<JsonNode> values = new ArrayList<>();
    for (JsonNode item : dataset) {
      String time = item.path("time").asText("");
      JsonNode value = item.get("value");
      if (time.isEmpty() || value == null || value.isNull()) {
        continue;
      }
      times.add(time);
      values.add(value);
    }
    List<JsonNode> perturbed = perturbation.apply(values);
    List<CandidateRecord> samples = new ArrayList<>(times.size());
    for (int i = 0; i < times.size(); i++) {
      samples.add(new IntradaySample(date, times.get(i), perturbed.get(i), entityId));
    }
    return samples;
  }
}
