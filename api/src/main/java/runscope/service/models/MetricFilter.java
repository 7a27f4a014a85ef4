/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;
import lombok.NonNull;

/** A filter on the aggregate of one metric; values are parsed as numbers at query time. */
public record MetricFilter(
    @NonNull String logName,
    @NonNull MetricAggregation aggregation,
    @NonNull String operator,
    @Nullable List<String> values) {

  public MetricFilter {
    values = values == null ? ImmutableList.of() : ImmutableList.copyOf(values);
  }

  public static MetricFilter of(
      String logName, MetricAggregation aggregation, String operator, String... values) {
    return new MetricFilter(logName, aggregation, operator, ImmutableList.copyOf(values));
  }
}
