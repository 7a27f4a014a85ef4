/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import lombok.NonNull;

/**
 * Partial aggregate of one metric of one run: the in-memory counterpart of a row of {@code
 * mlop_metric_summaries}. {@link #merge} is associative and commutative, so states built from any
 * split of the raw values merge into the same result.
 */
public record MetricSummaryState(
    double min, double max, double sum, long count, double lastValue, long lastStep, double sumSq) {

  /** Step recorded when the step behind {@code lastValue} is not known, e.g. read back from SQL. */
  public static final long UNKNOWN_STEP = -1L;

  private static final MetricSummaryState EMPTY =
      new MetricSummaryState(
          Double.POSITIVE_INFINITY,
          Double.NEGATIVE_INFINITY,
          0d,
          0L,
          Double.NaN,
          UNKNOWN_STEP,
          0d);

  public static MetricSummaryState empty() {
    return EMPTY;
  }

  public static MetricSummaryState of(final double value, final long step) {
    return new MetricSummaryState(value, value, value, 1L, value, step, value * value);
  }

  /** Builds the state of a batch of values; {@code steps[i]} is the step of {@code values[i]}. */
  public static MetricSummaryState of(@NonNull final double[] values, @NonNull final long[] steps) {
    if (values.length != steps.length) {
      throw new IllegalArgumentException("values and steps differ in length");
    }
    MetricSummaryState state = EMPTY;
    for (int i = 0; i < values.length; i++) {
      state = state.merge(of(values[i], steps[i]));
    }
    return state;
  }

  public MetricSummaryState merge(@NonNull final MetricSummaryState other) {
    final boolean keepOwnLast;
    if (lastStep != other.lastStep) {
      keepOwnLast = lastStep > other.lastStep;
    } else {
      keepOwnLast = Double.compare(lastValue, other.lastValue) >= 0;
    }
    return new MetricSummaryState(
        Math.min(min, other.min),
        Math.max(max, other.max),
        sum + other.sum,
        count + other.count,
        keepOwnLast ? lastValue : other.lastValue,
        keepOwnLast ? lastStep : other.lastStep,
        sumSq + other.sumSq);
  }

  public double mean() {
    return count == 0 ? Double.NaN : sum / count;
  }
}
