package com.ospicorp.analyticsapi.analytics.service;

import com.ospicorp.analyticsapi.analytics.model.CleaningResult;
import com.ospicorp.analyticsapi.analytics.model.MissingValuePolicy;
import com.ospicorp.analyticsapi.dataset.model.CategoricalColumn;
import com.ospicorp.analyticsapi.dataset.model.Column;
import com.ospicorp.analyticsapi.dataset.model.ColumnType;
import com.ospicorp.analyticsapi.dataset.model.DatetimeColumn;
import com.ospicorp.analyticsapi.dataset.model.NumericColumn;
import com.ospicorp.analyticsapi.dataset.model.Table;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Removes repeated rows and handles missing cells on an inferred table. Column types never
 * change; output rows are re-numbered from zero.
 */
@Service
public class CleaningService {
  static final String UNKNOWN = "Unknown";

  private static final Logger log = LoggerFactory.getLogger(CleaningService.class);

  private final Clock clock;

  public CleaningService() {
    this(Clock.systemUTC());
  }

  CleaningService(Clock clock) {
    this.clock = clock;
  }

  public CleaningResult clean(Table table, boolean removeDuplicates, MissingValuePolicy missing) {
    if (table.isEmpty()) {
      return new CleaningResult(table, 0, 0, 0, List.of("No rows to clean"));
    }
    List<String> steps = new ArrayList<>();

    List<Integer> rows = new ArrayList<>(table.rowCount());
    Set<Map<String, Object>> seen = new HashSet<>();
    for (int row = 0; row < table.rowCount(); row++) {
      if (!removeDuplicates || seen.add(table.row(row))) {
        rows.add(row);
      }
    }
    int removed = table.rowCount() - rows.size();
    if (removeDuplicates) {
      steps.add(removed > 0 ? "Removed " + removed + " duplicate records" : "No duplicates found");
    }

    int missingCells = countMissing(table, rows);
    int filled = 0;
    int dropped = 0;
    switch (missing) {
      case DROP -> {
        List<Integer> complete = new ArrayList<>(rows.size());
        for (int row : rows) {
          if (table.columns().stream().noneMatch(c -> c.isMissing(row))) {
            complete.add(row);
          }
        }
        dropped = rows.size() - complete.size();
        rows = complete;
        steps.add(dropped > 0
            ? "Dropped " + dropped + " rows with missing values"
            : "No missing values found");
      }
      case FILL -> {
        filled = missingCells;
        steps.add(filled > 0 ? "Filled " + filled + " missing values" : "No missing values found");
      }
      case KEEP -> steps.add(missingCells > 0
          ? "Kept " + missingCells + " missing values"
          : "No missing values found");
    }

    Instant now = clock.instant();
    List<Column> columns = new ArrayList<>(table.columnCount());
    for (Column column : table.columns()) {
      columns.add(select(column, rows, missing == MissingValuePolicy.FILL, now));
    }
    steps.add(String.format("Typed %d numeric, %d datetime and %d categorical columns",
        table.countOf(ColumnType.NUMERIC), table.countOf(ColumnType.DATETIME),
        table.countOf(ColumnType.CATEGORICAL)));

    log.debug("Cleaned {} rows into {} (duplicates={}, filled={}, dropped={})",
        table.rowCount(), rows.size(), removed, filled, dropped);
    return new CleaningResult(new Table(columns, rows.size()), removed, filled, dropped, steps);
  }

  private static int countMissing(Table table, List<Integer> rows) {
    int missing = 0;
    for (Column column : table.columns()) {
      for (int row : rows) {
        if (column.isMissing(row)) {
          missing++;
        }
      }
    }
    return missing;
  }

  private static Column select(Column column, List<Integer> rows, boolean fill, Instant now) {
    if (column instanceof NumericColumn numeric) {
      List<Double> values = new ArrayList<>(rows.size());
      for (int row : rows) {
        Double value = numeric.value(row);
        values.add(value == null && fill ? Double.valueOf(0d) : value);
      }
      return new NumericColumn(column.name(), values);
    }
    if (column instanceof DatetimeColumn datetime) {
      List<Instant> values = new ArrayList<>(rows.size());
      for (int row : rows) {
        Instant value = datetime.value(row);
        values.add(value == null && fill ? now : value);
      }
      return new DatetimeColumn(column.name(), values);
    }
    List<Object> values = new ArrayList<>(rows.size());
    for (int row : rows) {
      Object value = column.value(row);
      values.add(value == null && fill ? UNKNOWN : value);
    }
    return new CategoricalColumn(column.name(), values);
  }
}
