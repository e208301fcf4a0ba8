package com.ospicorp.analyticsapi.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnomalyResponse(List<Integer> anomalies, String method) {

  public static AnomalyResponse from(AnomalyResult result) {
    return new AnomalyResponse(result.rowIds(),
        result.method() == null ? null : result.method().code());
  }
}
