package com.ospicorp.analyticsapi.analytics.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class StatisticsTest {

  @Test
  void summaryUsesPopulationDeviation() {
    Statistics.Summary summary = Statistics.summarize(new double[] {2, 4, 4, 4, 5, 5, 7, 9});

    assertThat(summary.mean()).isEqualTo(5d);
    assertThat(summary.median()).isEqualTo(4.5d);
    assertThat(summary.std()).isEqualTo(2d);
    assertThat(summary.min()).isEqualTo(2d);
    assertThat(summary.max()).isEqualTo(9d);
  }

  @Test
  void quartilesInterpolateBetweenOrderStatistics() {
    Statistics.Quartiles quartiles = Statistics.quartiles(new double[] {4, 1, 3, 2});

    assertThat(quartiles.q1()).isEqualTo(1.75d);
    assertThat(quartiles.q3()).isEqualTo(3.25d);
    assertThat(quartiles.lowerFence()).isEqualTo(-0.5d);
    assertThat(quartiles.upperFence()).isEqualTo(5.5d);
  }

  @Test
  void pearsonIsUndefinedForConstantOrShortInput() {
    assertThat(Statistics.pearson(new double[] {1, 2, 3}, new double[] {5, 5, 5})).isNaN();
    assertThat(Statistics.pearson(new double[] {1}, new double[] {2})).isNaN();
    assertThat(Statistics.pearson(new double[] {1, 2, 3}, new double[] {3, 2, 1}))
        .isCloseTo(-1d, within(1e-12));
  }
}
