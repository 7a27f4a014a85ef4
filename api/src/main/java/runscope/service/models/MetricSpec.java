/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import lombok.NonNull;

public record MetricSpec(@NonNull String logName, @NonNull MetricAggregation aggregation) {

  /** Key of this metric in summary result maps, for example {@code loss|AVG}. */
  public String key() {
    return logName + "|" + aggregation.name();
  }
}
