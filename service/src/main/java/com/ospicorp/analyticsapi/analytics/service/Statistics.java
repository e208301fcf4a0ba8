package com.ospicorp.analyticsapi.analytics.service;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/** Thin wrappers over commons-math with the conventions used by the analytics endpoints. */
public final class Statistics {
  private Statistics() {
  }

  public record Summary(double mean, double median, double std, double min, double max) {}

  public record Quartiles(double q1, double q3) {

    public double iqr() {
      return q3 - q1;
    }

    public double lowerFence() {
      return q1 - 1.5 * iqr();
    }

    public double upperFence() {
      return q3 + 1.5 * iqr();
    }
  }

  /** Mean, median, population standard deviation, min and max; values must not be empty. */
  public static Summary summarize(double[] values) {
    if (values.length == 0) {
      throw new IllegalArgumentException("values must not be empty");
    }
    DescriptiveStatistics stats = new DescriptiveStatistics(values);
    return new Summary(
        stats.getMean(),
        stats.getPercentile(50),
        Math.sqrt(stats.getPopulationVariance()),
        stats.getMin(),
        stats.getMax());
  }

  public static double populationStd(double[] values) {
    return Math.sqrt(new DescriptiveStatistics(values).getPopulationVariance());
  }

  /** Q1 and Q3 with linear interpolation between order statistics (R-7). */
  public static Quartiles quartiles(double[] values) {
    Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
    percentile.setData(values);
    return new Quartiles(percentile.evaluate(25d), percentile.evaluate(75d));
  }

  /** Pearson correlation, or {@code NaN} when it is undefined for the input. */
  public static double pearson(double[] x, double[] y) {
    if (x.length != y.length || x.length < 2) {
      return Double.NaN;
    }
    return new PearsonsCorrelation().correlation(x, y);
  }
}
