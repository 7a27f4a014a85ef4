/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import javax.annotation.Nullable;
import lombok.NonNull;

/**
 * Custom ordering of a run listing. {@code aggregation} is only read for metric sorts, where it
 * defaults to {@link MetricAggregation#LAST}.
 */
public record SortSpec(
    @NonNull String field,
    @NonNull SortSource source,
    @NonNull SortDirection direction,
    @Nullable MetricAggregation aggregation) {

  public static SortSpec system(String field, SortDirection direction) {
    return new SortSpec(field, SortSource.SYSTEM, direction, null);
  }

  public static SortSpec config(String key, SortDirection direction) {
    return new SortSpec(key, SortSource.CONFIG, direction, null);
  }

  public static SortSpec metric(
      String logName, MetricAggregation aggregation, SortDirection direction) {
    return new SortSpec(logName, SortSource.METRIC, direction, aggregation);
  }

  public MetricAggregation aggregationOrDefault() {
    return aggregation == null ? MetricAggregation.LAST : aggregation;
  }
}
