package com.ospicorp.heartrate.ingestion.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.heartrate.ingestion.extract.CandidateRecord;
import com.ospicorp.heartrate.ingestion.extract.IntradaySample;
import com.ospicorp.heartrate.ingestion.model.Stream;
import com.ospicorp.heartrate.ingestion.model.Streams;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

public class IntradayTransformer implements RecordTransformer {

  private static final Logger log = LoggerFactory.getLogger(IntradayTransformer.class);

  static final double FILL_VALUE = 0.0;

  private final ZoneOffset offset;

  public IntradayTransformer(ZoneOffset offset) {
    this.offset = offset;
  }

  @Override
  public Stream stream() {
    return Streams.INTRADAY;
  }

  @Override
  public Optional<CanonicalRecord> transform(CandidateRecord candidate, OffsetDateTime watermark,
      TransformStats stats) {
    if (!(candidate instanceof IntradaySample sample)) {
      return reject(stats, "unexpected candidate type " + typeName(candidate));
    }
    if (sample.date() == null || !StringUtils.hasText(sample.time())) {
      return reject(stats, "missing date or time");
    }
    if (!StringUtils.hasText(sample.entityId())) {
      return reject(stats, "missing entity id");
    }
    if (sample.value() == null || sample.value().isNull() || sample.value().isMissingNode()) {
      return reject(stats, "missing value at " + sample.date() + " " + sample.time());
    }
    LocalTime time;
    try {
      time = LocalTime.parse(sample.time().trim());
    } catch (DateTimeParseException ex) {
      return reject(stats, "unparsable time '" + sample.time() + "'");
    }
    double value = coerce(sample.value(), stats);
    OffsetDateTime timestamp = DeltaFilter.alignToWatermark(LocalDateTime.of(sample.date(), time), watermark, offset);
    return Optional.of(new IntradayRow(timestamp, value, sample.entityId()));
  }

  private static double coerce(JsonNode node, TransformStats stats) {
    double value;
    if (node.isNumber()) {
      value = node.asDouble();
    } else if (node.isTextual()) {
      try {
        value = Double.parseDouble(node.asText().trim());
      } catch (NumberFormatException ex) {
        value = Double.NaN;
      }
    } else {
      value = Double.NaN;
    }
    if (!Double.isFinite(value)) {
      stats.recordMissingValueFilled();
      return FILL_VALUE;
    }
    return value;
  }

  private static Optional<CanonicalRecord> reject(TransformStats stats, String reason) {
    stats.recordInvalid();
    log.debug("Rejected intraday record: {}", reason);
    return Optional.empty();
  }

  private static String typeName(Object candidate) {
    return candidate == null ? "null" : candidate.getClass().getSimpleName();
  }
}
