package com.ospicorp.heartrate.web;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.util.Collection;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * Writes a collection of records as CSV with a header row derived from the
 * first element's properties. Timestamps are written as ISO-8601 text.
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Collection<?>> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");

  private final CsvMapper mapper = CsvMapper.builder()
      .addModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
      .build();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  @NonNull
  protected Collection<?> readInternal(@NonNull Class<? extends Collection<?>> clazz,
      @NonNull HttpInputMessage inputMessage) throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Collection<?> rows, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    Object sample = rows.stream().filter(row -> row != null).findFirst().orElse(null);
    if (sample == null) {
      return;
    }
    CsvSchema schema = mapper.schemaFor(sample.getClass()).withHeader();
    try (SequenceWriter writer = mapper.writer(schema).writeValues(outputMessage.getBody())) {
      for (Object row : rows) {
        if (row != null) {
          writer.write(row);
        }
      }
    }
  }
}
