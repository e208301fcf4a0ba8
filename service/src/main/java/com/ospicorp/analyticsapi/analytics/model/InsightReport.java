package com.ospicorp.analyticsapi.analytics.model;

import java.util.List;

public record InsightReport(int rowCount, int columnCount, List<Insight> insights) {

  public InsightReport {
    insights = List.copyOf(insights);
  }

  public static InsightReport empty() {
    return new InsightReport(0, 0, List.of());
  }

  public List<String> texts() {
    return insights.stream().map(Insight::text).toList();
  }
}
