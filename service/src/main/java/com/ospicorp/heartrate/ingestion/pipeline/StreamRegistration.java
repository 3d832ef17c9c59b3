package com.ospicorp.heartrate.ingestion.pipeline;

import com.ospicorp.heartrate.ingestion.load.StreamLoader;
import com.ospicorp.heartrate.ingestion.model.Stream;
import com.ospicorp.heartrate.ingestion.transform.RecordTransformer;

/** Binds a stream to the transformer and loader that handle its records. */
public record StreamRegistration(Stream stream, RecordTransformer transformer, StreamLoader loader) {

  public StreamRegistration {
    if (!transformer.stream().name().equals(stream.name())) {
      throw new IllegalArgumentException("Transformer for " + transformer.stream().name()
          + " registered for stream " + stream.name());
    }
  }
}
