package com.ospicorp.analyticsapi.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record InsightsResponse(
    @JsonProperty("row_count") int rowCount,
    @JsonProperty("column_count") int columnCount,
    List<String> insights
) {

  public static InsightsResponse from(InsightReport report) {
    return new InsightsResponse(report.rowCount(), report.columnCount(), report.texts());
  }
}
