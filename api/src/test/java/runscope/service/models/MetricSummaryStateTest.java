/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

public class MetricSummaryStateTest {

  @Test
  public void testSplitBatchesMergeToSameState() {
    // Given
    double[] values = {0.5, 2.0, 1.5, 0.25, 3.0};
    long[] steps = {0, 1, 2, 3, 4};

    // When
    MetricSummaryState whole = MetricSummaryState.of(values, steps);
    MetricSummaryState left =
        MetricSummaryState.of(new double[] {0.5, 2.0}, new long[] {0, 1});
    MetricSummaryState right =
        MetricSummaryState.of(new double[] {1.5, 0.25, 3.0}, new long[] {2, 3, 4});

    // Then
    MetricSummaryState merged = right.merge(left);
    assertThat(merged.min()).isEqualTo(whole.min()).isEqualTo(0.25);
    assertThat(merged.max()).isEqualTo(whole.max()).isEqualTo(3.0);
    assertThat(merged.count()).isEqualTo(5L);
    assertThat(merged.sum()).isCloseTo(whole.sum(), within(1e-12));
    assertThat(merged.sumSq()).isCloseTo(whole.sumSq(), within(1e-12));
    assertThat(merged.lastValue()).isEqualTo(3.0);
    assertThat(merged.lastStep()).isEqualTo(4L);
    assertThat(left.merge(right)).isEqualTo(merged);
  }

  @Test
  public void testAverageOverBatches() {
    // loss logged as [0.5, 1.5] then [1.0]
    MetricSummaryState state =
        MetricSummaryState.of(new double[] {0.5, 1.5}, new long[] {0, 1})
            .merge(MetricSummaryState.of(1.0, 2));

    assertThat(MetricAggregation.AVG.apply(state)).isEqualTo(1.0);
    assertThat(MetricAggregation.LAST.apply(state)).isEqualTo(1.0);
  }

  @Test
  public void testLastPrefersHigherStepThenHigherValue() {
    MetricSummaryState early = MetricSummaryState.of(9.0, 1);
    MetricSummaryState late = MetricSummaryState.of(2.0, 5);
    MetricSummaryState tie = MetricSummaryState.of(7.0, 5);

    assertThat(early.merge(late).lastValue()).isEqualTo(2.0);
    assertThat(late.merge(early).lastValue()).isEqualTo(2.0);
    assertThat(late.merge(tie).lastValue()).isEqualTo(7.0);
    assertThat(tie.merge(late).lastValue()).isEqualTo(7.0);
  }

  @Test
  public void testEmptyIsIdentity() {
    MetricSummaryState state = MetricSummaryState.of(4.0, 3);

    assertThat(MetricSummaryState.empty().merge(state)).isEqualTo(state);
    assertThat(state.merge(MetricSummaryState.empty())).isEqualTo(state);
    assertThat(MetricSummaryState.empty().mean()).isNaN();
  }
}
