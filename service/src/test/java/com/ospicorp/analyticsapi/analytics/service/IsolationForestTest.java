package com.ospicorp.analyticsapi.analytics.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class IsolationForestTest {

  @Test
  void averagePathLengthOfBinarySearchTree() {
    assertThat(IsolationForest.averagePathLength(1)).isZero();
    assertThat(IsolationForest.averagePathLength(2)).isEqualTo(1d);
    assertThat(IsolationForest.averagePathLength(256)).isCloseTo(10.2448, within(1e-3));
  }

  @Test
  void scoresAreReproducible() {
    double[][] rows = {{1, 10}, {2, 11}, {1.5, 10.5}, {2.5, 9.5}, {30, -40}, {1.8, 10.1}};

    assertThat(new IsolationForest().score(rows)).containsExactly(new IsolationForest().score(rows));
  }

  @Test
  void flagsPointFarFromClusterInTwoDimensions() {
    double[][] rows = new double[31][];
    for (int i = 0; i < 30; i++) {
      rows[i] = new double[] {10 + (i % 5) * 0.1, 20 + (i % 3) * 0.1};
    }
    rows[30] = new double[] {80, -50};

    boolean[] flags = new IsolationForest().classify(rows);

    assertThat(flags[30]).isTrue();
  }

  @Test
  void identicalRowsScoreOneHalf() {
    double[][] rows = {{3, 3}, {3, 3}, {3, 3}, {3, 3}};

    double[] scores = new IsolationForest().score(rows);

    for (double score : scores) {
      assertThat(score).isCloseTo(0.5d, within(1e-9));
    }
  }

  @Test
  void needsAtLeastTwoRows() {
    assertThatThrownBy(() -> new IsolationForest().score(new double[][] {{1d}}))
        .isInstanceOf(ModelingException.class);
  }
}
