/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db;

import static runscope.db.sql.FilterValue.number;
import static runscope.db.sql.FilterValue.text;
import static runscope.db.sql.FilterValue.texts;

import com.google.common.primitives.Doubles;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import runscope.db.sql.SqlFragment;
import runscope.service.models.FieldFilter;

/**
 * Conditions on flattened config and system metadata values, expressed as correlated subqueries on
 * {@code run_field_values}. A negated operator renders {@code NOT EXISTS} around the positive
 * condition, so runs that lack the key match it.
 */
@Slf4j
public final class FieldFilterConditions {
  private FieldFilterConditions() {}

  /**
   * Builds the condition for one filter.
   *
   * @param alias table alias of the subquery, distinct per filter of a statement
   */
  public static Optional<SqlFragment> build(
      @NonNull final FieldFilter filter, @NonNull final String alias) {
    final Optional<FilterOperator> parsed = FilterOperator.fromLabel(filter.operator());
    if (parsed.isEmpty()) {
      log.warn("Dropping filter on '{}': unknown operator '{}'", filter.key(), filter.operator());
      return Optional.empty();
    }
    final FilterOperator operator = parsed.get();
    final SqlFragment scope =
        SqlFragment.of(
            "SELECT 1 FROM run_field_values "
                + alias
                + " WHERE "
                + alias
                + ".run_id = r.id AND "
                + alias
                + ".source = ? AND "
                + alias
                + ".key = ?",
            text(filter.source().getValue()),
            text(filter.key()));

    if (operator.positive() == FilterOperator.EXISTS) {
      return Optional.of(scope.wrap(operator.isNegated() ? "NOT EXISTS (" : "EXISTS (", ")"));
    }
    final Optional<SqlFragment> value = valueCondition(alias, filter, operator.positive());
    if (value.isEmpty()) {
      log.warn(
          "Dropping filter on '{}' ({}) with operator '{}' and values {}",
          filter.key(),
          filter.dataType().getValue(),
          filter.operator(),
          filter.values());
      return Optional.empty();
    }
    return Optional.of(
        SqlFragment.join(" AND ", scope, value.get().wrap("(", ")"))
            .wrap(operator.isNegated() ? "NOT EXISTS (" : "EXISTS (", ")"));
  }

  /** The positive value condition for the filter's data type, or empty if not expressible. */
  static Optional<SqlFragment> valueCondition(
      final String alias, final FieldFilter filter, final FilterOperator positive) {
    final List<String> values = filter.values();
    switch (filter.dataType()) {
      case TEXT:
        if (values.isEmpty()) {
          return Optional.empty();
        }
        return SystemFilterConditions.positiveText(alias + ".text_value", positive, values.get(0));
      case NUMBER:
        return numberCondition(alias + ".numeric_value", positive, values);
      case DATE:
        return dateCondition(alias + ".text_value", positive, values);
      case OPTION:
        return optionCondition(alias + ".text_value", positive, values);
      default:
        return Optional.empty();
    }
  }

  private static Optional<SqlFragment> numberCondition(
      final String column, final FilterOperator operator, final List<String> values) {
    final Double first = parse(values, 0);
    if (first == null) {
      return Optional.empty();
    }
    switch (operator) {
      case IS:
        return Optional.of(SqlFragment.of(column + " = ?", number(first)));
      case GREATER_THAN:
        return Optional.of(SqlFragment.of(column + " > ?", number(first)));
      case LESS_THAN:
        return Optional.of(SqlFragment.of(column + " < ?", number(first)));
      case GREATER_THAN_OR_EQUAL:
        return Optional.of(SqlFragment.of(column + " >= ?", number(first)));
      case LESS_THAN_OR_EQUAL:
        return Optional.of(SqlFragment.of(column + " <= ?", number(first)));
      case BETWEEN:
        final Double second = parse(values, 1);
        if (second == null) {
          return Optional.empty();
        }
        return Optional.of(
            SqlFragment.of(column + " BETWEEN ? AND ?", number(first), number(second)));
      default:
        return Optional.empty();
    }
  }

  /** Dates are stored as ISO-8601 text, which orders lexically. */
  private static Optional<SqlFragment> dateCondition(
      final String column, final FilterOperator operator, final List<String> values) {
    if (values.isEmpty()) {
      return Optional.empty();
    }
    switch (operator) {
      case BEFORE:
        return Optional.of(SqlFragment.of(column + " < ?", text(values.get(0))));
      case AFTER:
        return Optional.of(SqlFragment.of(column + " > ?", text(values.get(0))));
      case BETWEEN:
        if (values.size() < 2) {
          return Optional.empty();
        }
        return Optional.of(
            SqlFragment.of(
                column + " >= ? AND " + column + " <= ?",
                text(values.get(0)),
                text(values.get(1))));
      default:
        return Optional.empty();
    }
  }

  private static Optional<SqlFragment> optionCondition(
      final String column, final FilterOperator operator, final List<String> values) {
    if (values.isEmpty()) {
      return Optional.empty();
    }
    switch (operator) {
      case IS:
        return Optional.of(SqlFragment.of(column + " = ?", text(values.get(0))));
      case IS_ANY_OF:
        return Optional.of(SqlFragment.of(column + " = ANY(?::text[])", texts(values)));
      default:
        return Optional.empty();
    }
  }

  @Nullable
  private static Double parse(final List<String> values, final int index) {
    if (values.size() <= index) {
      return null;
    }
    final Double parsed = Doubles.tryParse(values.get(index).trim());
    return parsed == null || parsed.isNaN() ? null : parsed;
  }
}
