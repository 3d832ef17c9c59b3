package com.ospicorp.heartrate.ingestion.source;

import java.util.Locale;

public enum PerturbationPolicy {
  ROTATE,
  JITTER;

  public Perturbation forSeed(long seed) {
    if (seed == 0) {
      return Perturbation.none();
    }
    return switch (this) {
      case ROTATE -> new ValueRotation(seed);
      case JITTER -> new BoundedJitter(seed);
    };
  }

  public static PerturbationPolicy parse(String value) {
    if (value == null || value.isBlank()) {
      return JITTER;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalStateException("Unknown perturbation policy '" + value + "', expected rotate or jitter", ex);
    }
  }
}
