package com.ospicorp.analyticsapi.dataset.service;

import com.ospicorp.analyticsapi.dataset.model.CategoricalColumn;
import com.ospicorp.analyticsapi.dataset.model.Column;
import com.ospicorp.analyticsapi.dataset.model.DatetimeColumn;
import com.ospicorp.analyticsapi.dataset.model.NumericColumn;
import com.ospicorp.analyticsapi.dataset.model.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns raw records into a {@link Table}. Each column is typed on its own, all or nothing:
 * numeric if every present value parses as a number, else datetime if every present value
 * parses as a timestamp, else categorical with the original values.
 */
public final class SchemaInferencer {
  private SchemaInferencer() {
  }

  public static Table infer(List<Map<String, Object>> records) {
    if (records == null || records.isEmpty()) {
      return Table.empty();
    }
    Set<String> fields = new LinkedHashSet<>();
    for (Map<String, Object> record : records) {
      if (record != null) {
        fields.addAll(record.keySet());
      }
    }

    List<Column> columns = new ArrayList<>(fields.size());
    for (String field : fields) {
      List<Object> raw = new ArrayList<>(records.size());
      for (Map<String, Object> record : records) {
        Object value = record == null ? null : record.get(field);
        raw.add(ValueParsers.isMissing(value) ? null : value);
      }
      columns.add(inferColumn(field, raw));
    }
    return new Table(columns, records.size());
  }

  static Column inferColumn(String name, List<Object> raw) {
    List<Double> numbers = parseAll(raw, ValueParsers::parseNumeric);
    if (numbers != null) {
      return new NumericColumn(name, numbers);
    }
    List<Instant> instants = parseAll(raw, ValueParsers::parseDatetime);
    if (instants != null) {
      return new DatetimeColumn(name, instants);
    }
    return new CategoricalColumn(name, raw);
  }

  private static <T> List<T> parseAll(List<Object> raw, Function<Object, T> parser) {
    List<T> out = new ArrayList<>(raw.size());
    for (Object value : raw) {
      if (value == null) {
        out.add(null);
        continue;
      }
      T parsed = parser.apply(value);
      if (parsed == null) {
        return null;
      }
      out.add(parsed);
    }
    return out;
  }
}
