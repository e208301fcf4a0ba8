package com.ospicorp.analyticsapi.analytics.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single finding. {@code metrics} keeps the unrounded values behind {@code text}, so a caller
 * can check the rendered numbers independently.
 */
public record Insight(InsightType type, List<String> columns, Map<String, Double> metrics,
    String text) {

  public Insight {
    columns = List.copyOf(columns);
    metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
  }

  public Double metric(String name) {
    return metrics.get(name);
  }
}
