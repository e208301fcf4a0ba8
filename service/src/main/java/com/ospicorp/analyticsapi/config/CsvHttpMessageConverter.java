package com.ospicorp.analyticsapi.config;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * Reads a {@code text/csv} body with a header row into records (one {@code Map} per row, cell
 * values as strings) and writes collections of beans or records as CSV. Record columns follow
 * the first row's keys.
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Object> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");
  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.findAndRegisterModules();
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  @NonNull
  protected Object readInternal(@NonNull Class<?> clazz, @NonNull HttpInputMessage inputMessage)
      throws IOException, HttpMessageNotReadableException {
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    List<Map<String, Object>> records = new ArrayList<>();
    try (MappingIterator<Map<String, String>> rows = mapper
        .readerForMapOf(String.class)
        .with(schema)
        .readValues(inputMessage.getBody())) {
      while (rows.hasNext()) {
        records.add(new LinkedHashMap<>(rows.next()));
      }
    } catch (RuntimeException ex) {
      throw new HttpMessageNotReadableException("Malformed CSV body: " + ex.getMessage(), ex,
          inputMessage);
    }
    return records;
  }

  @Override
  protected void writeInternal(@NonNull Object object, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    Collection<?> rows = (Collection<?>) object;
    Object sample = rows.stream().filter(Objects::nonNull).findFirst().orElse(null);
    if (sample == null) {
      outputMessage.getBody().flush();
      return;
    }
    CsvSchema schema = sample instanceof Map<?, ?> first
        ? headerOf(first)
        : mapper.schemaFor(sample.getClass()).withHeader();
    var writer = mapper.writer(schema).writeValues(outputMessage.getBody());
    for (Object row : rows) {
      if (row != null) {
        writer.write(row);
      }
    }
    writer.flush();
  }

  private static CsvSchema headerOf(Map<?, ?> record) {
    CsvSchema.Builder builder = CsvSchema.builder();
    for (Object key : record.keySet()) {
      builder.addColumn(String.valueOf(key));
    }
    return builder.build().withHeader();
  }
}
