package com.ospicorp.analyticsapi.dataset.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed view of an uploaded dataset. Row {@code i} of every column is the caller's original
 * record {@code i}; computations that drop rows keep those identifiers instead of re-indexing.
 */
public record Table(List<Column> columns, int rowCount) {

  private static final Table EMPTY = new Table(List.of(), 0);

  public Table {
    columns = List.copyOf(columns);
    if (rowCount < 0) {
      throw new IllegalArgumentException("rowCount must not be negative");
    }
    for (Column column : columns) {
      if (column.size() != rowCount) {
        throw new IllegalArgumentException("Column '" + column.name() + "' has " + column.size()
            + " values, expected " + rowCount);
      }
    }
  }

  public static Table empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return rowCount == 0 || columns.isEmpty();
  }

  public int columnCount() {
    return columns.size();
  }

  public Optional<Column> column(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return columns.stream().filter(c -> c.name().equals(name)).findFirst();
  }

  public List<String> columnNames() {
    return columns.stream().map(Column::name).toList();
  }

  public List<NumericColumn> numericColumns() {
    List<NumericColumn> out = new ArrayList<>();
    for (Column column : columns) {
      if (column instanceof NumericColumn numeric) {
        out.add(numeric);
      }
    }
    return out;
  }

  public List<DatetimeColumn> datetimeColumns() {
    List<DatetimeColumn> out = new ArrayList<>();
    for (Column column : columns) {
      if (column instanceof DatetimeColumn datetime) {
        out.add(datetime);
      }
    }
    return out;
  }

  public long countOf(ColumnType type) {
    return columns.stream().filter(c -> c.type() == type).count();
  }

  public Map<String, Object> row(int row) {
    Map<String, Object> record = new LinkedHashMap<>();
    for (Column column : columns) {
      record.put(column.name(), column.value(row));
    }
    return record;
  }

  /** Typed values back as records; missing values are present as {@code null} entries. */
  public List<Map<String, Object>> toRecords() {
    List<Map<String, Object>> records = new ArrayList<>(rowCount);
    for (int row = 0; row < rowCount; row++) {
      records.add(row(row));
    }
    return records;
  }
}
