package com.ospicorp.analyticsapi.analytics.model;

import java.util.List;

public record ForecastResult(List<Double> values, int steps, ForecastMethod method,
    String message) {

  public static final String MISSING_TARGET = "No data or missing target.";

  public ForecastResult {
    values = List.copyOf(values);
  }

  public static ForecastResult of(List<Double> values, ForecastMethod method) {
    return new ForecastResult(values, values.size(), method, null);
  }

  public static ForecastResult rejected(String message) {
    return new ForecastResult(List.of(), 0, null, message);
  }

  public boolean isRejected() {
    return message != null;
  }
}
