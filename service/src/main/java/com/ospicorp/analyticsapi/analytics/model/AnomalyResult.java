package com.ospicorp.analyticsapi.analytics.model;

import java.util.List;

/** Anomalous rows by their position in the caller's original input. */
public record AnomalyResult(List<Integer> rowIds, AnomalyMethod method) {

  public AnomalyResult {
    rowIds = List.copyOf(rowIds);
  }

  public static AnomalyResult none() {
    return new AnomalyResult(List.of(), null);
  }
}
