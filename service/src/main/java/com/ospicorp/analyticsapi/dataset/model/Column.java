package com.ospicorp.analyticsapi.dataset.model;

/**
 * A named, row-aligned sequence of values of one {@link ColumnType}. A {@code null} entry is a
 * missing value.
 */
public interface Column {

  String name();

  ColumnType type();

  int size();

  Object value(int row);

  default boolean isMissing(int row) {
    return value(row) == null;
  }

  default int missingCount() {
    int missing = 0;
    for (int row = 0; row < size(); row++) {
      if (isMissing(row)) {
        missing++;
      }
    }
    return missing;
  }
}
