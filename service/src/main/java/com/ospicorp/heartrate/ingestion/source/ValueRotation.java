package com.ospicorp.heartrate.ingestion.source;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/** Rotates values by {@code seed mod size} positions; timestamps keep their order. */
public final class ValueRotation implements Perturbation {

  private final long seed;

  public ValueRotation(long seed) {
    this.seed = seed;
  }

  @Override
  public List<JsonNode> apply(List<JsonNode> values) {
    int size = values.size();
    if (seed == 0 || size < 2) {
      return values;
    }
    int offset = (int) Math.floorMod(seed, (long) size);
    List<JsonNode> rotated = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      rotated.add(values.get((i + offset) % size));
    }
    return rotated;
  }
}
