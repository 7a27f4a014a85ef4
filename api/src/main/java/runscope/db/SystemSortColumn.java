/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db;

import java.util.Optional;
import java.util.function.Function;
import lombok.Getter;
import runscope.db.models.RunRow;

/** Run columns a listing can be ordered by with keyset pagination. */
public enum SystemSortColumn {
  NAME("name", "r.name", false, RunRow::getName),
  STATUS("status", "r.status::text", false, run -> run.getStatus().name()),
  CREATED_AT("createdAt", "r.created_at", true, run -> run.getCreatedAt().toString()),
  UPDATED_AT("updatedAt", "r.updated_at", true, run -> run.getUpdatedAt().toString()),
  /** Runs whose status never changed sort by creation time. */
  STATUS_UPDATED(
      "statusUpdated",
      "COALESCE(r.status_updated_at, r.created_at)",
      true,
      run -> run.getStatusUpdatedAt().orElse(run.getCreatedAt()).toString());

  @Getter private final String field;
  @Getter private final String expression;
  private final boolean timestamp;
  private final Function<RunRow, String> cursorValue;

  SystemSortColumn(
      final String field,
      final String expression,
      final boolean timestamp,
      final Function<RunRow, String> cursorValue) {
    this.field = field;
    this.expression = expression;
    this.timestamp = timestamp;
    this.cursorValue = cursorValue;
  }

  public static Optional<SystemSortColumn> fromField(final String field) {
    for (final SystemSortColumn column : values()) {
      if (column.field.equals(field)) {
        return Optional.of(column);
      }
    }
    return Optional.empty();
  }

  /** Placeholder for a cursor value compared against {@link #getExpression()}. */
  String valuePlaceholder() {
    return timestamp ? "?::timestamptz" : "?";
  }

  /** The value of this column for the run, as it is written into a sort cursor. */
  public String cursorValue(final RunRow run) {
    return cursorValue.apply(run);
  }
}
