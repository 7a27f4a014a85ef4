/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

/** How a listing is ordered and continued; chosen once per request from its sort. */
public enum PaginationStrategy {
  /** Newest first, continued by the id of the last run. */
  DEFAULT,
  /** Keyset over a run column and id, continued by {@code "<value>::<id>"}. */
  SYSTEM_COLUMN,
  /** Ordered by a flattened config or metadata value, continued by offset. */
  FIELD,
  /** Ordered by a metric aggregate from the columnar store, continued by offset. */
  METRIC;

  public static PaginationStrategy of(final SortSpec sort) {
    if (sort == null) {
      return DEFAULT;
    }
    switch (sort.source()) {
      case SYSTEM:
        return SYSTEM_COLUMN;
      case CONFIG:
      case SYSTEM_METADATA:
        return FIELD;
      case METRIC:
        return METRIC;
      default:
        throw new IllegalArgumentException("Unknown sort source: " + sort.source());
    }
  }
}
