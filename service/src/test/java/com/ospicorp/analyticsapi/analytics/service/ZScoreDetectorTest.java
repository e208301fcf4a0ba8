package com.ospicorp.analyticsapi.analytics.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ZScoreDetectorTest {

  private final ZScoreDetector detector = new ZScoreDetector();

  @Test
  void anyColumnBeyondThreeDeviationsFlagsRow() {
    double[][] rows = new double[12][];
    for (int i = 0; i < 12; i++) {
      rows[i] = new double[] {5, i % 2};
    }
    rows[4] = new double[] {5000, 0};

    assertThat(detector.classify(rows)).containsExactly(
        false, false, false, false, true, false, false, false, false, false, false, false);
  }

  @Test
  void constantColumnFlagsNothing() {
    double[][] rows = {{7}, {7}, {7}};

    assertThat(detector.classify(rows)).containsOnly(false);
  }

  @Test
  void emptyInputHasNoFlags() {
    assertThat(detector.classify(new double[0][])).isEmpty();
  }
}
