package com.ospicorp.heartrate.ingestion.source;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Reproducible alteration of the values of one day of samples. Implementations
 * return a list of the same size and leave the input untouched; a zero seed
 * means no perturbation.
 */
public interface Perturbation {

  List<JsonNode> apply(List<JsonNode> values);

  static Perturbation none() {
    return values -> values;
  }
}
