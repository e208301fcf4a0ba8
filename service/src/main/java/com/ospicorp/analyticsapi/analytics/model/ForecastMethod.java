package com.ospicorp.analyticsapi.analytics.model;

import java.util.Locale;

public enum ForecastMethod {
  ARIMA,
  MOVING_AVERAGE;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
