/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db;

import static runscope.db.sql.FilterValue.text;
import static runscope.db.sql.FilterValue.texts;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import runscope.common.models.RunStatus;
import runscope.db.sql.SqlFragment;
import runscope.service.models.SystemFilter;

/**
 * Conditions on run columns. Every method returns an empty optional when the filter cannot be
 * expressed (unknown field, unsupported operator, missing value); the caller skips those.
 */
@Slf4j
public final class SystemFilterConditions {
  public static final String CREATOR_NAME = "creator.name";

  private SystemFilterConditions() {}

  public static Optional<SqlFragment> build(@NonNull final SystemFilter filter) {
    final Optional<FilterOperator> operator = FilterOperator.fromLabel(filter.operator());
    if (operator.isEmpty()) {
      log.warn("Dropping filter on '{}': unknown operator '{}'", filter.field(), filter.operator());
      return Optional.empty();
    }
    final Optional<SqlFragment> condition;
    switch (filter.field()) {
      case "name":
        condition = textCondition("r.name", operator.get(), filter.values());
        break;
      case "notes":
        condition = notesCondition(operator.get(), filter.values());
        break;
      case CREATOR_NAME:
        condition = textCondition("u.name", operator.get(), filter.values());
        break;
      case "status":
        condition = statusCondition(operator.get(), filter.values());
        break;
      case "tags":
        condition = tagsCondition(operator.get(), filter.values());
        break;
      default:
        condition = Optional.empty();
    }
    if (condition.isEmpty()) {
      log.warn(
          "Dropping filter on '{}' with operator '{}' and values {}",
          filter.field(),
          filter.operator(),
          filter.values());
    }
    return condition;
  }

  /** Whether the filter reads the creator's user row and so needs the users join. */
  public static boolean needsCreatorJoin(@NonNull final SystemFilter filter) {
    return CREATOR_NAME.equals(filter.field());
  }

  /**
   * Text operators on a nullable column. Negations match rows where the column is null, rendered as
   * {@code (col IS NULL OR NOT (positive))}.
   */
  static Optional<SqlFragment> textCondition(
      final String column, final FilterOperator operator, final List<String> values) {
    if (values.isEmpty() || values.get(0) == null) {
      return Optional.empty();
    }
    final Optional<SqlFragment> positive = positiveText(column, operator.positive(), values.get(0));
    if (!operator.isNegated()) {
      return positive;
    }
    return positive.map(p -> p.wrap("(" + column + " IS NULL OR NOT (", "))"));
  }

  static Optional<SqlFragment> positiveText(
      final String column, final FilterOperator operator, final String value) {
    switch (operator) {
      case CONTAINS:
        return Optional.of(SqlFragment.of(column + " ILIKE '%' || ? || '%'", text(value)));
      case IS:
        return Optional.of(SqlFragment.of(column + " = ?", text(value)));
      case STARTS_WITH:
        return Optional.of(SqlFragment.of(column + " ILIKE ? || '%'", text(value)));
      case ENDS_WITH:
        return Optional.of(SqlFragment.of(column + " ILIKE '%' || ?", text(value)));
      case REGEX:
        return Optional.of(SqlFragment.of(column + " ~ ?", text(value)));
      default:
        return Optional.empty();
    }
  }

  private static Optional<SqlFragment> notesCondition(
      final FilterOperator operator, final List<String> values) {
    switch (operator) {
      case EXISTS:
        return Optional.of(SqlFragment.of("(r.notes IS NOT NULL AND r.notes <> '')"));
      case NOT_EXISTS:
        return Optional.of(SqlFragment.of("(r.notes IS NULL OR r.notes = '')"));
      default:
        return textCondition("r.notes", operator, values);
    }
  }

  private static Optional<SqlFragment> statusCondition(
      final FilterOperator operator, final List<String> values) {
    final ImmutableList.Builder<String> statuses = ImmutableList.builder();
    for (final String value : values) {
      final Optional<RunStatus> status = RunStatus.fromString(value);
      if (status.isPresent()) {
        statuses.add(status.get().name());
      } else {
        log.warn("Ignoring unknown run status '{}'", value);
      }
    }
    final List<String> valid = statuses.build();
    if (valid.isEmpty()) {
      return Optional.empty();
    }
    switch (operator) {
      case IS:
        return Optional.of(SqlFragment.of("r.status = ?::run_status", text(valid.get(0))));
      case IS_NOT:
        return Optional.of(SqlFragment.of("r.status <> ?::run_status", text(valid.get(0))));
      case IS_ANY_OF:
        return Optional.of(SqlFragment.of("r.status = ANY(?::run_status[])", texts(valid)));
      case IS_NONE_OF:
        return Optional.of(SqlFragment.of("r.status <> ALL(?::run_status[])", texts(valid)));
      default:
        return Optional.empty();
    }
  }

  private static Optional<SqlFragment> tagsCondition(
      final FilterOperator operator, final List<String> values) {
    if (values.isEmpty()) {
      return Optional.empty();
    }
    switch (operator) {
      case INCLUDE:
        return Optional.of(SqlFragment.of("? = ANY(r.tags)", text(values.get(0))));
      case EXCLUDE:
        return Optional.of(SqlFragment.of("NOT (? = ANY(r.tags))", text(values.get(0))));
      case INCLUDE_ANY_OF:
        return Optional.of(SqlFragment.of("r.tags && ?::text[]", texts(values)));
      case INCLUDE_ALL_OF:
        return Optional.of(SqlFragment.of("r.tags @> ?::text[]", texts(values)));
      case EXCLUDE_IF_ALL:
        return Optional.of(SqlFragment.of("NOT (r.tags @> ?::text[])", texts(values)));
      case EXCLUDE_IF_ANY_OF:
        return Optional.of(SqlFragment.of("NOT (r.tags && ?::text[])", texts(values)));
      default:
        return Optional.empty();
    }
  }
}
