package com.ospicorp.analyticsapi.analytics.service;

import org.apache.commons.math3.stat.StatUtils;

/** Flags a row when any of its columns lies more than three population deviations from the mean. */
public final class ZScoreDetector implements AnomalyModel {
  static final double THRESHOLD = 3d;
  static final double EPSILON = 1e-9;

  @Override
  public boolean[] classify(double[][] rows) {
    boolean[] anomalous = new boolean[rows.length];
    if (rows.length == 0) {
      return anomalous;
    }
    int width = rows[0].length;
    for (int j = 0; j < width; j++) {
      double[] column = new double[rows.length];
      for (int i = 0; i < rows.length; i++) {
        column[i] = rows[i][j];
      }
      double mean = StatUtils.mean(column);
      double std = Statistics.populationStd(column);
      for (int i = 0; i < rows.length; i++) {
        if (Math.abs((column[i] - mean) / (std + EPSILON)) > THRESHOLD) {
          anomalous[i] = true;
        }
      }
    }
    return anomalous;
  }
}
