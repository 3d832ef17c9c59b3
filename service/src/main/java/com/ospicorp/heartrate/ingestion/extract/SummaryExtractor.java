package com.ospicorp.heartrate.ingestion.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ospicorp.heartrate.ingestion.model.Streams;
import com.ospicorp.heartrate.ingestion.source.CacheReplaySource;
import com.ospicorp.heartrate.ingestion.source.DayRecord;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits exactly one daily summary per date. When the replay source has no day
 * record a placeholder is synthesized from the data seed and the date, so the
 * same run configuration always yields the same placeholder.
 */
public class SummaryExtractor implements RecordExtractor {

  private static final Logger log = LoggerFactory.getLogger(SummaryExtractor.class);

  private final CacheReplaySource source;
  private final String entityId;
  private final long dataSeed;

  public SummaryExtractor(CacheReplaySource source, String entityId, long dataSeed) {
    this.source = source;
    this.entityId = entityId;
    this.dataSeed = dataSeed;
  }

  @Override
  public String name() {
    return "heart-rate-summary";
  }

  @Override
  public List<ExtractedBatch> extract(LocalDate date) {
    try {
      Optional<DayRecord> dayRecord = source.getDayRecord(date);
      if (dayRecord.isEmpty()) {
        log.warn("No cached summary data for {}; synthesizing placeholder", date);
        return List.of(new ExtractedBatch(Streams.SUMMARY, List.of(placeholder(date))));
      }
      JsonNode value = dayRecord.get().payload().path("heart_rate_day").path(0)
          .path("activities-heart").path(0).path("value");
      if (!value.isObject()) {
        log.warn("Day record {} for {} has no heart rate summary", dayRecord.get().shift(), date);
        return List.of();
      }
      DailySummary summary = new DailySummary(date,
          value.get("restingHeartRate"),
          value.get("heartRateZones"),
          value.get("customHeartRateZones"),
          entityId);
      log.info("Extracted heart rate summary for {}", date);
      return List.of(new ExtractedBatch(Streams.SUMMARY, List.of(summary)));
    } catch (RuntimeException ex) {
      log.error("Error extracting heart rate summary for {}: {}", date, ex.getMessage(), ex);
      return List.of();
    }
  }

  DailySummary placeholder(LocalDate date) {
    Random random = new Random(dataSeed * 31 + date.toEpochDay());
    JsonNodeFactory nodes = JsonNodeFactory.instance;
    ObjectNode zones = nodes.objectNode();
    zones.set("outOfRange", zone(nodes, 30, 91, 1000 + random.nextInt(201)));
    zones.set("fatBurn", zone(nodes, 91, 127, 100 + random.nextInt(101)));
    zones.set("cardio", zone(nodes, 127, 154, 20 + random.nextInt(41)));
    zones.set("peak", zone(nodes, 154, 220, random.nextInt(21)));
    ArrayNode custom = nodes.arrayNode();
    int resting = 60 + random.nextInt(21);
    return new DailySummary(date, IntNode.valueOf(resting), zones, custom, entityId);
  }

  private static ObjectNode zone(JsonNodeFactory nodes, int min, int max, int minutes) {
    ObjectNode zone = nodes.objectNode();
    zone.put("min", min);
    zone.put("max", max);
    zone.put("minutes", minutes);
    return zone;
  }
}
