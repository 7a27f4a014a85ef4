/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.NonNull;
import runscope.db.models.RunRow;

/**
 * A page of runs with the continuation token of the strategy that produced it. At most one token
 * is set; all are null on the last page.
 *
 * @param metricSortValues sort value per run id, only filled for metric sorts
 */
public record RunPage(
    @NonNull List<RunRow> runs,
    @Nullable Long nextCursor,
    @Nullable String sortCursor,
    @Nullable Integer nextOffset,
    @NonNull Map<Long, Double> metricSortValues) {

  public static RunPage empty() {
    return new RunPage(ImmutableList.of(), null, null, null, ImmutableMap.of());
  }

  public static RunPage withCursor(List<RunRow> runs, @Nullable Long nextCursor) {
    return new RunPage(runs, nextCursor, null, null, ImmutableMap.of());
  }

  public static RunPage withSortCursor(List<RunRow> runs, @Nullable String sortCursor) {
    return new RunPage(runs, null, sortCursor, null, ImmutableMap.of());
  }

  public static RunPage withOffset(List<RunRow> runs, @Nullable Integer nextOffset) {
    return new RunPage(runs, null, null, nextOffset, ImmutableMap.of());
  }
}
