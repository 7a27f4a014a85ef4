/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

public class MetricAggregationTest {
  private final MetricSummaryState state =
      MetricSummaryState.of(
          new double[] {2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0},
          new long[] {0, 1, 2, 3, 4, 5, 6, 7});

  @Test
  public void testApply() {
    assertThat(MetricAggregation.MIN.apply(state)).isEqualTo(2.0);
    assertThat(MetricAggregation.MAX.apply(state)).isEqualTo(9.0);
    assertThat(MetricAggregation.AVG.apply(state)).isEqualTo(5.0);
    assertThat(MetricAggregation.LAST.apply(state)).isEqualTo(9.0);
    assertThat(MetricAggregation.VARIANCE.apply(state)).isCloseTo(4.0, within(1e-9));
  }

  @Test
  public void testVarianceOfNothingIsNaN() {
    assertThat(MetricAggregation.VARIANCE.apply(MetricSummaryState.empty())).isNaN();
  }

  @Test
  public void testFromValue() {
    assertThat(MetricAggregation.fromValue(" avg ")).isEqualTo(MetricAggregation.AVG);
    assertThat(MetricAggregation.fromValue("Variance")).isEqualTo(MetricAggregation.VARIANCE);
    assertThatThrownBy(() -> MetricAggregation.fromValue("median"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
