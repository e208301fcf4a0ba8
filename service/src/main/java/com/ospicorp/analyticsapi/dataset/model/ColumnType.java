package com.ospicorp.analyticsapi.dataset.model;

import java.util.Locale;

public enum ColumnType {
  NUMERIC,
  DATETIME,
  CATEGORICAL;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
