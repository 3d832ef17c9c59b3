package com.ospicorp.heartrate.ingestion.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.heartrate.ingestion.extract.CandidateRecord;
import com.ospicorp.heartrate.ingestion.extract.DailySummary;
import com.ospicorp.heartrate.ingestion.model.Stream;
import com.ospicorp.heartrate.ingestion.model.Streams;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Daily summaries are stamped at midnight of their date, in the watermark's
 * offset when there is one. Resting heart rate is
 * coerced to an integer or left null; empty zone payloads are stored as null.
 */
public class SummaryTransformer implements RecordTransformer {

  private static final Logger log = LoggerFactory.getLogger(SummaryTransformer.class);

  private final ObjectMapper mapper;
  private final ZoneOffset offset;

  public SummaryTransformer(ObjectMapper mapper, ZoneOffset offset) {
    this.mapper = mapper;
    this.offset = offset;
  }

  @Override
  public Stream stream() {
    return Streams.SUMMARY;
  }

  @Override
  public Optional<CanonicalRecord> transform(CandidateRecord candidate, OffsetDateTime watermark,
      TransformStats stats) {
    if (!(candidate instanceof DailySummary summary) || summary.date() == null
        || !StringUtils.hasText(summary.entityId())) {
      stats.recordInvalid();
      log.debug("Rejected summary record {}", candidate);
      return Optional.empty();
    }
    return Optional.of(new SummaryRow(
        DeltaFilter.alignToWatermark(summary.date().atStartOfDay(), watermark, offset),
        restingHeartRate(summary.restingHeartRate(), stats),
        toJson(summary.heartRateZones()),
        toJson(summary.customHeartRateZones()),
        summary.entityId()));
  }

  private static Integer restingHeartRate(JsonNode node, TransformStats stats) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (node.isNumber()) {
      return node.intValue();
    }
    if (node.isTextual()) {
      try {
        return (int) Double.parseDouble(node.asText().trim());
      } catch (NumberFormatException ex) {
        log.debug("Unparsable resting heart rate '{}'", node.asText());
      }
    }
    stats.recordMissingValueFilled();
    return null;
  }

  private String toJson(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode() || node.isEmpty()) {
      return null;
    }
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      log.warn("Unable to serialize zone payload: {}", ex.getMessage());
      return null;
    }
  }
}
