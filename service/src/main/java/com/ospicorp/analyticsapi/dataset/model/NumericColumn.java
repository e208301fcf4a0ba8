package com.ospicorp.analyticsapi.dataset.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public record NumericColumn(String name, List<Double> values) implements Column {

  public NumericColumn {
    Objects.requireNonNull(name, "name");
    values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  @Override
  public ColumnType type() {
    return ColumnType.NUMERIC;
  }

  @Override
  public int size() {
    return values.size();
  }

  @Override
  public Double value(int row) {
    return values.get(row);
  }

  /** Non-missing values in row order. */
  public double[] presentValues() {
    return values.stream()
        .filter(Objects::nonNull)
        .mapToDouble(Double::doubleValue)
        .toArray();
  }
}
