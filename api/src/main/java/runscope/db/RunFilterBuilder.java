/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db;

import static runscope.db.sql.FilterValue.id;
import static runscope.db.sql.FilterValue.ids;
import static runscope.db.sql.FilterValue.text;
import static runscope.db.sql.FilterValue.texts;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import runscope.common.models.RunStatus;
import runscope.db.sql.SqlFragment;
import runscope.service.models.DateFilter;
import runscope.service.models.FieldFilter;
import runscope.service.models.SystemFilter;

/**
 * Renders a {@link RunFilter} into a WHERE condition over {@code runs r}. Listing, counting and
 * search all go through this class, so a filter means the same thing on every path.
 */
@Slf4j
public final class RunFilterBuilder {
  private RunFilterBuilder() {}

  public static RunFilterClause build(@NonNull final RunFilter filter) {
    final List<SqlFragment> conditions = new ArrayList<>();
    conditions.add(SqlFragment.of("r.organization_id = ?", text(filter.getOrganizationId())));

    boolean needsProjectJoin = false;
    if (filter.getProjectId() != null) {
      conditions.add(SqlFragment.of("r.project_id = ?", id(filter.getProjectId())));
    } else if (filter.getProjectName() != null) {
      conditions.add(SqlFragment.of("p.name = ?", text(filter.getProjectName())));
      needsProjectJoin = true;
    }

    if (filter.getSearch() != null && !filter.getSearch().isBlank()) {
      conditions.add(
          SqlFragment.of("r.name ILIKE '%' || ? || '%'", text(filter.getSearch().trim())));
    }
    if (!filter.getTags().isEmpty()) {
      conditions.add(SqlFragment.of("r.tags && ?::text[]", texts(filter.getTags())));
    }
    statusCondition(filter.getStatuses()).ifPresent(conditions::add);
    for (final DateFilter dateFilter : filter.getDateFilters()) {
      dateCondition(dateFilter).ifPresent(conditions::add);
    }

    final List<FieldFilter> fieldFilters = filter.getFieldFilters();
    for (int i = 0; i < fieldFilters.size(); i++) {
      FieldFilterConditions.build(fieldFilters.get(i), "fv" + i).ifPresent(conditions::add);
    }

    boolean needsCreatorJoin = false;
    for (final SystemFilter systemFilter : filter.getSystemFilters()) {
      final Optional<SqlFragment> condition = SystemFilterConditions.build(systemFilter);
      if (condition.isPresent()) {
        conditions.add(condition.get());
        needsCreatorJoin |= SystemFilterConditions.needsCreatorJoin(systemFilter);
      }
    }

    if (filter.getRestrictToIds() != null) {
      conditions.add(SqlFragment.of("r.id = ANY(?::bigint[])", ids(filter.getRestrictToIds())));
    }
    return new RunFilterClause(
        SqlFragment.join(" AND ", conditions), needsProjectJoin, needsCreatorJoin);
  }

  private static Optional<SqlFragment> statusCondition(final List<String> statuses) {
    if (statuses.isEmpty()) {
      return Optional.empty();
    }
    final ImmutableList.Builder<String> valid = ImmutableList.builder();
    for (final String status : statuses) {
      RunStatus.fromString(status)
          .ifPresentOrElse(
              s -> valid.add(s.name()), () -> log.warn("Ignoring unknown run status '{}'", status));
    }
    final List<String> values = valid.build();
    if (values.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(SqlFragment.of("r.status = ANY(?::run_status[])", texts(values)));
  }

  static Optional<SqlFragment> dateCondition(final DateFilter filter) {
    final String column = dateColumn(filter);
    final Optional<FilterOperator> operator = FilterOperator.fromLabel(filter.operator());
    if (operator.isEmpty()) {
      log.warn("Dropping date filter with unknown operator '{}'", filter.operator());
      return Optional.empty();
    }
    switch (operator.get()) {
      case BEFORE:
        return Optional.of(SqlFragment.of(column + " < ?::timestamptz", text(filter.value())));
      case AFTER:
        return Optional.of(SqlFragment.of(column + " > ?::timestamptz", text(filter.value())));
      case BETWEEN:
        if (filter.value2() == null) {
          log.warn("Dropping 'between' filter on {} without an upper bound", filter.field());
          return Optional.empty();
        }
        return Optional.of(
            SqlFragment.of(
                column + " >= ?::timestamptz AND " + column + " <= ?::timestamptz",
                text(filter.value()),
                text(filter.value2())));
      default:
        log.warn("Dropping date filter with unsupported operator '{}'", filter.operator());
        return Optional.empty();
    }
  }

  private static String dateColumn(final DateFilter filter) {
    switch (filter.field()) {
      case CREATED_AT:
        return "r.created_at";
      case UPDATED_AT:
        return "r.updated_at";
      case STATUS_UPDATED:
        return "r.status_updated_at";
      default:
        throw new IllegalArgumentException("Unknown date field: " + filter.field());
    }
  }
}
