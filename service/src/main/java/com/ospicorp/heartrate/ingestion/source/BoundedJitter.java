package com.ospicorp.heartrate.ingestion.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Adds uniform noise in [-5, +5] bpm to every numeric value, clamped to
 * [50, 200] and rounded to two decimals. Non-numeric values pass through but
 * still consume a draw so the sequence stays aligned with the sample index.
 */
public final class BoundedJitter implements Perturbation {

  static final double AMPLITUDE = 5.0;
  static final double MIN_BPM = 50.0;
  static final double MAX_BPM = 200.0;

  private final long seed;

  public BoundedJitter(long seed) {
    this.seed = seed;
  }

  @Override
  public List<JsonNode> apply(List<JsonNode> values) {
    if (seed == 0) {
      return values;
    }
    Random random = new Random(seed);
    List<JsonNode> jittered = new ArrayList<>(values.size());
    for (JsonNode value : values) {
      double variation = -AMPLITUDE + 2 * AMPLITUDE * random.nextDouble();
      if (value != null && value.isNumber()) {
        double adjusted = Math.max(MIN_BPM, Math.min(MAX_BPM, value.asDouble() + variation));
        jittered.add(DoubleNode.valueOf(Math.round(adjusted * 100.0) / 100.0));
      } else {
        jittered.add(value);
      }
    }
    return jittered;
  }
}
