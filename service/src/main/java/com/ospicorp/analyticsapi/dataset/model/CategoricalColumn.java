package com.ospicorp.analyticsapi.dataset.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public record CategoricalColumn(String name, List<Object> values) implements Column {

  public CategoricalColumn {
    Objects.requireNonNull(name, "name");
    values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  @Override
  public ColumnType type() {
    return ColumnType.CATEGORICAL;
  }

  @Override
  public int size() {
    return values.size();
  }

  @Override
  public Object value(int row) {
    return values.get(row);
  }
}
