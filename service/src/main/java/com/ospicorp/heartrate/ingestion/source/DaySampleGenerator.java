package com.ospicorp.heartrate.ingestion.source;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a deterministic synthetic replay cache shaped like the upstream
 * heart-rate export: per day an {@code activities-heart} summary and an
 * {@code activities-heart-intraday} dataset sampled every
 * {@code sampleIntervalSeconds}.
 */
public class DaySampleGenerator {

  private static final Logger log = LoggerFactory.getLogger(DaySampleGenerator.class);
  private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");
  private static final int SECONDS_PER_DAY = 86_400;

  public static final long DEFAULT_SEED = 100L;

  private final ObjectMapper mapper;
  private final long seed;
  private final int days;
  private final int sampleIntervalSeconds;
  private final LocalDate firstDate;

  public DaySampleGenerator(ObjectMapper mapper, long seed, int days, int sampleIntervalSeconds, LocalDate firstDate) {
    if (days < 1) {
      throw new IllegalArgumentException("days must be positive");
    }
    if (sampleIntervalSeconds < 1 || sampleIntervalSeconds > SECONDS_PER_DAY) {
      throw new IllegalArgumentException("sampleIntervalSeconds must be between 1 and " + SECONDS_PER_DAY);
    }
    this.mapper = mapper;
    this.seed = seed;
    this.days = days;
    this.sampleIntervalSeconds = sampleIntervalSeconds;
    this.firstDate = firstDate;
  }

  public int days() {
    return days;
  }

  public void writeCache(Path target) throws IOException {
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path staging = target.resolveSibling(target.getFileName() + ".tmp");
    Random random = new Random(seed);
    try (JsonGenerator json = mapper.getFactory().createGenerator(staging.toFile(), JsonEncoding.UTF8)) {
      json.writeStartArray();
      for (int day = 0; day < days; day++) {
        writeDay(json, firstDate.plusDays(day), random);
      }
      json.writeEndArray();
    }
    Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING);
    log.info("Wrote {} day samples at {}s resolution to {}", days, sampleIntervalSeconds, target);
  }

  private void writeDay(JsonGenerator json, LocalDate date, Random random) throws IOException {
    int resting = 58 + random.nextInt(13);
    json.writeStartObject();
    json.writeArrayFieldStart("heart_rate_day");
    json.writeStartObject();

    json.writeArrayFieldStart("activities-heart");
    json.writeStartObject();
    json.writeStringField("dateTime", date.toString());
    json.writeObjectFieldStart("value");
    json.writeArrayFieldStart("customHeartRateZones");
    json.writeEndArray();
    writeZones(json, resting, random);
    json.writeNumberField("restingHeartRate", resting);
    json.writeEndObject();
    json.writeEndObject();
    json.writeEndArray();

    json.writeObjectFieldStart("activities-heart-intraday");
    json.writeArrayFieldStart("dataset");
    for (int second = 0; second < SECONDS_PER_DAY; second += sampleIntervalSeconds) {
      json.writeStartObject();
      json.writeStringField("time", LocalTime.ofSecondOfDay(second).format(TIME_FORMAT));
      json.writeNumberField("value", heartRate(second, resting, random));
      json.writeEndObject();
    }
    json.writeEndArray();
    json.writeNumberField("datasetInterval", sampleIntervalSeconds);
    json.writeStringField("datasetType", "second");
    json.writeEndObject();

    json.writeEndObject();
    json.writeEndArray();
    json.writeEndObject();
  }

  private void writeZones(JsonGenerator json, int resting, Random random) throws IOException {
    int maxHeartRate = 190;
    int[] bounds = {30, resting + 40, resting + 70, resting + 95, maxHeartRate};
    String[] names = {"Out of Range", "Fat Burn", "Cardio", "Peak"};
    int[] minutes = {1100 + random.nextInt(200), 60 + random.nextInt(120), 5 + random.nextInt(40), random.nextInt(10)};
    json.writeArrayFieldStart("heartRateZones");
    for (int i = 0; i < names.length; i++) {
      json.writeStartObject();
      json.writeNumberField("min", bounds[i]);
      json.writeNumberField("max", bounds[i + 1]);
      json.writeNumberField("minutes", minutes[i]);
      json.writeStringField("name", names[i]);
      json.writeEndObject();
    }
    json.writeEndArray();
  }

  private static int heartRate(int secondOfDay, int resting, Random random) {
    double hour = secondOfDay / 3600.0;
    double base;
    if (hour < 6.0) {
      base = resting - 4;
    } else if (hour < 22.0) {
      base = resting + 18 + 10 * Math.sin((hour - 6.0) / 16.0 * Math.PI);
    } else {
      base = resting + 4;
    }
    if (hour >= 17.0 && hour < 18.0) {
      base += 45;
    }
    double noisy = base + random.nextGaussian() * 3.0;
    return (int) Math.round(Math.max(40, Math.min(190, noisy)));
  }
}
