package com.ospicorp.analyticsapi.dataset.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public record DatetimeColumn(String name, List<Instant> values) implements Column {

  public DatetimeColumn {
    Objects.requireNonNull(name, "name");
    values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  @Override
  public ColumnType type() {
    return ColumnType.DATETIME;
  }

  @Override
  public int size() {
    return values.size();
  }

  @Override
  public Instant value(int row) {
    return values.get(row);
  }
}
