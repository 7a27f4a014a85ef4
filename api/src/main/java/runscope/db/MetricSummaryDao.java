/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db;

import static runscope.db.sql.FilterValue.id;
import static runscope.db.sql.FilterValue.ids;
import static runscope.db.sql.FilterValue.text;
import static runscope.db.sql.FilterValue.texts;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.jdbi.v3.core.Jdbi;
import runscope.db.mappers.MetricSortRowMapper;
import runscope.db.mappers.MetricSummaryRowMapper;
import runscope.db.models.MetricSortRow;
import runscope.db.models.MetricSummaryRow;
import runscope.db.sql.ListBinding;
import runscope.db.sql.RenderedSql;
import runscope.db.sql.SqlBuilder;
import runscope.db.sql.SqlFragment;
import runscope.service.models.MetricFilter;
import runscope.service.models.MetricNameMatch;
import runscope.service.models.MetricSpec;
import runscope.service.models.SortDirection;

/**
 * Aggregate queries over {@code mlop_metric_summaries} in ClickHouse. Rows hold partial states per
 * (tenant, project, run, metric); every query merges them with {@code GROUP BY}.
 */
@Slf4j
public class MetricSummaryDao {
  static final String TABLE = "mlop_metric_summaries";

  private final Jdbi jdbi;

  public MetricSummaryDao(@NonNull final Jdbi jdbi) {
    this.jdbi = jdbi;
  }

  /**
   * Summaries of the requested metrics for the given runs, keyed by run id and then by {@link
   * MetricSpec#key()}. Runs without a metric have no entry for it.
   */
  public Map<Long, Map<String, Double>> findSummaries(
      @NonNull final MetricScope scope,
      @NonNull final Collection<Long> runIds,
      @NonNull final Collection<MetricSpec> specs) {
    if (runIds.isEmpty() || specs.isEmpty()) {
      return ImmutableMap.of();
    }
    final Set<String> logNames = new LinkedHashSet<>();
    specs.forEach(spec -> logNames.add(spec.logName()));

    final RenderedSql sql =
        new SqlBuilder()
            .append(
                "SELECT runId, logName,"
                    + " min(min_value) AS merged_min,"
                    + " max(max_value) AS merged_max,"
                    + " sum(sum_value) AS merged_sum,"
                    + " sum(count_value) AS merged_count,"
                    + " argMaxMerge(last_value) AS merged_last,"
                    + " sum(sum_sq_value) AS merged_sum_sq"
                    + " FROM "
                    + TABLE
                    + " WHERE ")
            .append(scope.condition())
            .append(
                " AND logName IN (?) AND runId IN (?) GROUP BY runId, logName",
                texts(logNames),
                ids(runIds))
            .render(ListBinding.EXPANDED);

    final List<MetricSummaryRow> rows =
        jdbi.withHandle(
            handle ->
                sql.bind(handle.createQuery(sql.sql()))
                    .map(new MetricSummaryRowMapper())
                    .list());

    final Map<Long, Map<String, Double>> summaries = new HashMap<>();
    for (final MetricSummaryRow row : rows) {
      for (final MetricSpec spec : specs) {
        if (spec.logName().equals(row.logName())) {
          summaries
              .computeIfAbsent(row.runId(), runId -> new HashMap<>())
              .put(spec.key(), spec.aggregation().apply(row.state()));
        }
      }
    }
    return summaries;
  }

  /**
   * Distinct metric names of the project, ordered by name.
   *
   * @param runIds when not empty, only metrics logged by these runs
   */
  public List<String> findDistinctMetricNames(
      @NonNull final MetricScope scope,
      @Nullable final String search,
      @NonNull final MetricNameMatch match,
      @NonNull final Collection<Long> runIds,
      final int limit) {
    final SqlBuilder builder =
        new SqlBuilder()
            .append("SELECT DISTINCT logName FROM " + TABLE + " WHERE ")
            .append(scope.condition());
    if (search != null && !search.isBlank()) {
      switch (match) {
        case PREFIX:
          builder.append(" AND startsWith(logName, ?)", text(search.trim()));
          break;
        case SUBSTRING:
          builder.append(" AND positionCaseInsensitive(logName, ?) > 0", text(search.trim()));
          break;
        case REGEX:
          builder.append(" AND match(logName, ?)", text(search.trim()));
          break;
        default:
          throw new IllegalArgumentException("Unknown match mode: " + match);
      }
    }
    if (!runIds.isEmpty()) {
      builder.append(" AND runId IN (?)", ids(runIds));
    }
    builder.append(" ORDER BY logName LIMIT ?", id(limit));
    final RenderedSql sql = builder.render(ListBinding.EXPANDED);
    return jdbi.withHandle(
        handle -> sql.bind(handle.createQuery(sql.sql())).mapTo(String.class).list());
  }

  /**
   * Runs whose aggregates satisfy every filter. Filters that cannot be expressed are dropped; when
   * all of them are, the result is empty, meaning no metric restriction applies.
   *
   * @param candidates when not empty, only these runs are considered
   */
  public Optional<Set<Long>> findRunIdsMatching(
      @NonNull final MetricScope scope,
      @NonNull final List<MetricFilter> filters,
      @NonNull final Collection<Long> candidates) {
    final Optional<SqlFragment> intersection = intersection(scope, filters, candidates);
    if (intersection.isEmpty()) {
      return Optional.empty();
    }
    final RenderedSql sql =
        new SqlBuilder().append(intersection.get()).render(ListBinding.EXPANDED);
    final List<Long> runIds =
        jdbi.withHandle(
            handle -> sql.bind(handle.createQuery(sql.sql())).mapTo(Long.class).list());
    return Optional.of(ImmutableSet.copyOf(runIds));
  }

  /**
   * A page of runs ordered by one metric aggregate, ties broken by run id.
   *
   * @param candidates when not empty, only these runs are considered
   * @param filters additional metric filters every returned run satisfies
   */
  public List<MetricSortRow> findSortedRunIds(
      @NonNull final MetricScope scope,
      @NonNull final MetricSpec sort,
      @NonNull final SortDirection direction,
      @NonNull final Collection<Long> candidates,
      @NonNull final List<MetricFilter> filters,
      final int limit,
      final int offset) {
    final SqlBuilder builder =
        new SqlBuilder()
            .append("SELECT runId, " + sort.aggregation().sqlExpression() + " AS sort_value")
            .append(" FROM " + TABLE + " WHERE ")
            .append(scope.condition())
            .append(" AND logName = ?", text(sort.logName()));
    if (!candidates.isEmpty()) {
      builder.append(" AND runId IN (?)", ids(candidates));
    }
    intersection(scope, filters, candidates)
        .ifPresent(
            matching ->
                builder.append(matching.wrap(" AND runId IN (SELECT runId FROM (", "))")));
    builder.append(
        " GROUP BY runId ORDER BY sort_value "
            + direction.sql()
            + ", runId "
            + direction.sql()
            + " LIMIT ? OFFSET ?",
        id(limit),
        id(offset));
    final RenderedSql sql = builder.render(ListBinding.EXPANDED);
    return jdbi.withHandle(
        handle -> sql.bind(handle.createQuery(sql.sql())).map(new MetricSortRowMapper()).list());
  }

  /** One grouped HAVING subquery per expressible filter, joined with INTERSECT. */
  private static Optional<SqlFragment> intersection(
      final MetricScope scope,
      final List<MetricFilter> filters,
      final Collection<Long> candidates) {
    final List<SqlFragment> subqueries = new ArrayList<>();
    for (final MetricFilter filter : filters) {
      final Optional<SqlFragment> having = MetricFilterConditions.having(filter);
      if (having.isEmpty()) {
        log.warn(
            "Dropping metric filter on '{}' {} with operator '{}' and values {}",
            filter.logName(),
            filter.aggregation(),
            filter.operator(),
            filter.values());
        continue;
      }
      final List<SqlFragment> parts = new ArrayList<>();
      parts.add(SqlFragment.of("SELECT runId FROM " + TABLE + " WHERE"));
      parts.add(scope.condition());
      parts.add(SqlFragment.of("AND logName = ?", text(filter.logName())));
      if (!candidates.isEmpty()) {
        parts.add(SqlFragment.of("AND runId IN (?)", ids(candidates)));
      }
      parts.add(SqlFragment.of("GROUP BY runId HAVING"));
      parts.add(having.get());
      subqueries.add(SqlFragment.join(" ", parts));
    }
    if (subqueries.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(SqlFragment.join(" INTERSECT ", subqueries));
  }

  /** Tenant and project a metric query is restricted to. */
  public record MetricScope(@NonNull String organizationId, @NonNull String projectName) {
    SqlFragment condition() {
      return SqlFragment.of(
          "tenantId = ? AND projectName = ?", text(organizationId), text(projectName));
    }
  }
}
