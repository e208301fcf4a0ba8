package com.ospicorp.analyticsapi.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastResponse(List<Double> forecast, Integer steps, String method,
    String message) {

  public static ForecastResponse from(ForecastResult result) {
    if (result.isRejected()) {
      return new ForecastResponse(List.of(), null, null, result.message());
    }
    return new ForecastResponse(result.values(), result.steps(), result.method().code(), null);
  }
}
