package com.ospicorp.analyticsapi.analytics.service;

import java.util.Arrays;

/**
 * Flat projection of the last simple moving average. The window is a quarter of the series,
 * clamped to [2, 5]; when no full window fits, the last observation is projected instead.
 */
public final class MovingAverageForecaster implements ForecastModel {
  static final int MIN_WINDOW = 2;
  static final int MAX_WINDOW = 5;

  @Override
  public double[] forecast(double[] series, int steps) {
    if (series.length == 0) {
      throw new IllegalArgumentException("series must not be empty");
    }
    int window = window(series.length);
    double last = series.length >= window
        ? mean(series, series.length - window, series.length)
        : series[series.length - 1];
    double[] out = new double[steps];
    Arrays.fill(out, last);
    return out;
  }

  static int window(int points) {
    if (points < 2) {
      return MIN_WINDOW;
    }
    return Math.min(MAX_WINDOW, Math.max(MIN_WINDOW, points / 4));
  }

  private static double mean(double[] values, int from, int to) {
    double sum = 0d;
    for (int i = from; i < to; i++) {
      sum += values[i];
    }
    return sum / (to - from);
  }
}
