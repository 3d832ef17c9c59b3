package com.ospicorp.heartrate.ingestion.source;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves one day of upstream payload per calendar date by replaying a fixed
 * cache of day samples cyclically. The cache is a JSON array; only the entry
 * at the computed shift is materialized, and the last one read is kept so the
 * extractors of one date share a single pass over the file.
 */
public class CacheReplaySource {

  private static final Logger log = LoggerFactory.getLogger(CacheReplaySource.class);

  public static final String CACHE_FILE_NAME = "heart_rate_cache.json";
  public static final LocalDate DEFAULT_BASE_DATE = LocalDate.of(2024, 1, 1);
  public static final int DEFAULT_CYCLE_LENGTH = 30;

  private final Path cacheFile;
  private final LocalDate baseDate;
  private final int cycleLength;
  private final DaySampleGenerator generator;
  private final ObjectMapper mapper;
  private volatile DayRecord lastRead;

  public CacheReplaySource(Path cacheFile, ObjectMapper mapper, DaySampleGenerator generator) {
    this(cacheFile, DEFAULT_BASE_DATE, DEFAULT_CYCLE_LENGTH, mapper, generator);
  }

  public CacheReplaySource(Path cacheFile,
      LocalDate baseDate,
      int cycleLength,
      ObjectMapper mapper,
      DaySampleGenerator generator) {
    if (cycleLength < 1) {
      throw new IllegalArgumentException("cycleLength must be positive");
    }
    this.cacheFile = cacheFile;
    this.baseDate = baseDate;
    this.cycleLength = cycleLength;
    this.mapper = mapper;
    this.generator = generator;
  }

  public int shift(LocalDate date) {
    long days = ChronoUnit.DAYS.between(baseDate, date);
    return (int) Math.floorMod(days, (long) cycleLength);
  }

  public Optional<DayRecord> getDayRecord(LocalDate date) {
    int shift = shift(date);
    DayRecord cached = lastRead;
    if (cached != null && cached.shift() == shift) {
      return Optional.of(new DayRecord(date, shift, cached.payload()));
    }
    if (!ensureCache()) {
      return Optional.empty();
    }
    try (JsonParser parser = mapper.getFactory().createParser(cacheFile.toFile())) {
      if (parser.nextToken() != JsonToken.START_ARRAY) {
        log.error("Cache {} does not contain a JSON array", cacheFile);
        return Optional.empty();
      }
      int index = 0;
      JsonToken token;
      while ((token = parser.nextToken()) != null && token != JsonToken.END_ARRAY) {
        if (index == shift) {
          JsonNode payload = mapper.readTree(parser);
          log.debug("Read day record {} for {} from {}", shift, date, cacheFile);
          DayRecord record = new DayRecord(date, shift, payload);
          lastRead = record;
          return Optional.of(record);
        }
        parser.skipChildren();
        index++;
      }
      log.warn("Cache {} holds {} day records, nothing at shift {} for {}", cacheFile, index, shift, date);
      return Optional.empty();
    } catch (IOException ex) {
      log.error("Unable to read day record {} for {} from {}: {}", shift, date, cacheFile, ex.getMessage());
      return Optional.empty();
    }
  }

  private synchronized boolean ensureCache() {
    if (Files.isRegularFile(cacheFile)) {
      return true;
    }
    if (generator == null) {
      log.error("Cache file {} is missing and regeneration is not configured", cacheFile);
      return false;
    }
    log.info("Cache file {} is missing; regenerating {} day samples", cacheFile, generator.days());
    try {
      generator.writeCache(cacheFile);
      return true;
    } catch (IOException | RuntimeException ex) {
      log.error("Cache regeneration into {} failed: {}", cacheFile, ex.getMessage(), ex);
      return false;
    }
  }
}
