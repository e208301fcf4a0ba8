package com.ospicorp.analyticsapi.analytics.service;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class MovingAverageForecasterTest {

  private final MovingAverageForecaster forecaster = new MovingAverageForecaster();

  @Test
  void windowIsQuarterOfSeriesClampedToTwoAndFive() {
    assertEquals(2, MovingAverageForecaster.window(0));
    assertEquals(2, MovingAverageForecaster.window(1));
    assertEquals(2, MovingAverageForecaster.window(7));
    assertEquals(3, MovingAverageForecaster.window(12));
    assertEquals(5, MovingAverageForecaster.window(40));
  }

  @Test
  void projectsLastFullWindowMean() {
    double[] series = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12};

    double[] out = forecaster.forecast(series, 12);

    assertEquals(12, out.length);
    for (double v : out) {
      assertEquals(11d, v);
    }
  }

  @Test
  void singleObservationIsRepeated() {
    assertArrayEquals(new double[] {4d, 4d, 4d}, forecaster.forecast(new double[] {4d}, 3));
  }

  @Test
  void emptySeriesIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> forecaster.forecast(new double[0], 12));
  }
}
