package com.ospicorp.analyticsapi.analytics.service;

/**
 * A forecasting strategy over an ordered series. Implementations throw
 * {@link ModelingException} (or any runtime exception) when they cannot serve the input.
 */
@FunctionalInterface
public interface ForecastModel {

  double[] forecast(double[] series, int steps);
}
