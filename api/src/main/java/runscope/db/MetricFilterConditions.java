/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db;

import static runscope.db.sql.FilterValue.number;

import com.google.common.primitives.Doubles;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.NonNull;
import runscope.db.sql.SqlFragment;
import runscope.service.models.MetricFilter;

/** HAVING conditions on a metric aggregate of {@code mlop_metric_summaries}. */
public final class MetricFilterConditions {
  private MetricFilterConditions() {}

  /**
   * Returns the HAVING condition of the filter, or empty when its operator is not a comparison or
   * its values are not numbers.
   */
  public static Optional<SqlFragment> having(@NonNull final MetricFilter filter) {
    final Optional<FilterOperator> operator = FilterOperator.fromLabel(filter.operator());
    final Double first = parse(filter.values(), 0);
    if (operator.isEmpty() || first == null) {
      return Optional.empty();
    }
    final String aggregate = filter.aggregation().sqlExpression();
    switch (operator.get()) {
      case IS:
        return Optional.of(SqlFragment.of(aggregate + " = ?", number(first)));
      case IS_NOT:
        return Optional.of(SqlFragment.of(aggregate + " != ?", number(first)));
      case GREATER_THAN:
        return Optional.of(SqlFragment.of(aggregate + " > ?", number(first)));
      case LESS_THAN:
        return Optional.of(SqlFragment.of(aggregate + " < ?", number(first)));
      case GREATER_THAN_OR_EQUAL:
        return Optional.of(SqlFragment.of(aggregate + " >= ?", number(first)));
      case LESS_THAN_OR_EQUAL:
        return Optional.of(SqlFragment.of(aggregate + " <= ?", number(first)));
      case BETWEEN:
      case NOT_BETWEEN:
        final Double second = parse(filter.values(), 1);
        if (second == null) {
          return Optional.empty();
        }
        final String keyword =
            operator.get() == FilterOperator.BETWEEN ? " BETWEEN " : " NOT BETWEEN ";
        return Optional.of(
            SqlFragment.of(aggregate + keyword + "? AND ?", number(first), number(second)));
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
