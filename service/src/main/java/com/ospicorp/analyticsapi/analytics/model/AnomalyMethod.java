package com.ospicorp.analyticsapi.analytics.model;

import java.util.Locale;

public enum AnomalyMethod {
  ISOLATION_FOREST,
  Z_SCORE;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
