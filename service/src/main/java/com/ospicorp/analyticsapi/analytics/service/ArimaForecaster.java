package com.ospicorp.analyticsapi.analytics.service;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;

/**
 * ARIMA(1,1,1) without a constant term. The series is differenced once and the ARMA(1,1)
 * coefficients are estimated by conditional sum of squares. Both coefficients are kept inside
 * (-1, 1) through a {@code tanh} reparametrisation, so the fitted model is stationary and
 * invertible.
 */
public class ArimaForecaster implements ForecastModel {
  public static final int MIN_OBSERVATIONS = 8;
  private static final int MAX_EVALUATIONS = 5_000;

  @Override
  public double[] forecast(double[] series, int steps) {
    if (series.length < MIN_OBSERVATIONS) {
      throw new ModelingException("ARIMA(1,1,1) needs at least " + MIN_OBSERVATIONS
          + " observations, got " + series.length);
    }
    for (double v : series) {
      if (!Double.isFinite(v)) {
        throw new ModelingException("Series contains non-finite values");
      }
    }
    double[] diff = new double[series.length - 1];
    for (int i = 1; i < series.length; i++) {
      diff[i - 1] = series[i] - series[i - 1];
    }

    Fit fit = fit(diff);
    double[] residuals = residuals(diff, fit.phi(), fit.theta());

    double[] out = new double[steps];
    double level = series[series.length - 1];
    double nextDiff = fit.phi() * diff[diff.length - 1]
        + fit.theta() * residuals[residuals.length - 1];
    for (int h = 0; h < steps; h++) {
      level += nextDiff;
      out[h] = level;
      nextDiff = fit.phi() * nextDiff;
    }
    for (double v : out) {
      if (!Double.isFinite(v)) {
        throw new ModelingException("ARIMA(1,1,1) produced a non-finite forecast");
      }
    }
    return out;
  }

  record Fit(double phi, double theta, double sse) {}

  Fit fit(double[] diff) {
    MultivariateFunction sse = params -> {
      double[] e = residuals(diff, Math.tanh(params[0]), Math.tanh(params[1]));
      double sum = 0d;
      for (int t = 1; t < e.length; t++) {
        sum += e[t] * e[t];
      }
      return sum;
    };
    try {
      PointValuePair optimum = new SimplexOptimizer(1e-10, 1e-12).optimize(
          new MaxEval(MAX_EVALUATIONS),
          new ObjectiveFunction(sse),
          GoalType.MINIMIZE,
          new InitialGuess(new double[] {0d, 0d}),
          new NelderMeadSimplex(2));
      double[] point = optimum.getPoint();
      if (!Double.isFinite(optimum.getValue())) {
        throw new ModelingException("ARIMA(1,1,1) fit did not converge to a finite error");
      }
      return new Fit(Math.tanh(point[0]), Math.tanh(point[1]), optimum.getValue());
    } catch (MathIllegalStateException ex) {
      throw new ModelingException("ARIMA(1,1,1) fit failed: " + ex.getMessage(), ex);
    }
  }

  /** One-step residuals of the ARMA(1,1) recursion, with the first residual fixed at zero. */
  static double[] residuals(double[] diff, double phi, double theta) {
    double[] e = new double[diff.length];
    for (int t = 1; t < diff.length; t++) {
      e[t] = diff[t] - phi * diff[t - 1] - theta * e[t - 1];
    }
    return e;
  }
}
