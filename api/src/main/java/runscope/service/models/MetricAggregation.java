/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;
import lombok.NonNull;

/**
 * Aggregations over a metric's values for one run. Each aggregation is computed by merging the
 * partial states of {@code mlop_metric_summaries} at query time ({@link #sqlExpression()}) or, in
 * memory, from a {@link MetricSummaryState} ({@link #apply(MetricSummaryState)}).
 */
public enum MetricAggregation {
  MIN("min(min_value)"),
  MAX("max(max_value)"),
  AVG("sum(sum_value) / sum(count_value)"),
  LAST("argMaxMerge(last_value)"),
  /** Population variance, E[X^2] - E[X]^2. Loses precision when values are large. */
  VARIANCE(
      "(sum(sum_sq_value) / sum(count_value)) - pow(sum(sum_value) / sum(count_value), 2)");

  private final String sqlExpression;

  MetricAggregation(final String sqlExpression) {
    this.sqlExpression = sqlExpression;
  }

  /** Expression merging the summary columns of a grouped query into this aggregate. */
  public String sqlExpression() {
    return sqlExpression;
  }

  public double apply(@NonNull final MetricSummaryState state) {
    switch (this) {
      case MIN:
        return state.min();
      case MAX:
        return state.max();
      case AVG:
        return state.mean();
      case LAST:
        return state.lastValue();
      case VARIANCE:
        return state.count() == 0
            ? Double.NaN
            : (state.sumSq() / state.count()) - Math.pow(state.mean(), 2);
      default:
        throw new IllegalStateException("Unhandled aggregation: " + this);
    }
  }

  @JsonCreator
  public static MetricAggregation fromValue(@NonNull final String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
