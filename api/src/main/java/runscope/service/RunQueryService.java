/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import runscope.common.RunIdCodec;
import runscope.common.models.FieldSource;
import runscope.db.FieldValueDao;
import runscope.db.MetricSummaryDao;
import runscope.db.MetricSummaryDao.MetricScope;
import runscope.db.RunDao;
import runscope.db.RunFilter;
import runscope.db.RunFilterBuilder;
import runscope.db.RunSearchDao;
import runscope.db.SystemSortColumn;
import runscope.db.models.ColumnKeyRow;
import runscope.db.models.FieldValueRow;
import runscope.db.models.MetricSortRow;
import runscope.db.models.RunRow;
import runscope.service.exceptions.InvalidPageTokenException;
import runscope.service.exceptions.RunNotFoundException;
import runscope.service.models.MetricNameMatch;
import runscope.service.models.MetricSpec;
import runscope.service.models.PageDirection;
import runscope.service.models.PaginationStrategy;
import runscope.service.models.RunPage;
import runscope.service.models.RunQuery;
import runscope.service.models.SortCursor;
import runscope.service.models.SortSpec;

/**
 * Plans and runs listings of runs across the relational store and the metric store.
 *
 * <p>A listing picks one {@link PaginationStrategy} from its sort. Relational filters are rendered
 * by {@link RunFilterBuilder}; a search is resolved to run ids first and then stands in for every
 * other relational filter. Metric filters are resolved in the metric store and applied as an id
 * restriction, and an empty metric match ends the request without touching the relational store.
 */
@Slf4j
public class RunQueryService {
  private final RunDao runDao;
  private final RunSearchDao runSearchDao;
  private final FieldValueDao fieldValueDao;
  private final MetricSummaryDao metricSummaryDao;
  private final RunIdCodec runIdCodec;
  private final RunQueryCache cache;
  private final RunQueryConfig config;

  public RunQueryService(
      @NonNull final RunDao runDao,
      @NonNull final RunSearchDao runSearchDao,
      @NonNull final FieldValueDao fieldValueDao,
      @NonNull final MetricSummaryDao metricSummaryDao,
      @NonNull final RunIdCodec runIdCodec,
      @NonNull final RunQueryCache cache,
      @NonNull final RunQueryConfig config) {
    this.runDao = runDao;
    this.runSearchDao = runSearchDao;
    this.fieldValueDao = fieldValueDao;
    this.metricSummaryDao = metricSummaryDao;
    this.runIdCodec = runIdCodec;
    this.cache = cache;
    this.config = config;
  }

  public RunPage listRuns(@NonNull final RunQuery query) {
    final Optional<Long> projectId =
        runDao.findProjectId(query.getOrganizationId(), query.getProjectName());
    if (projectId.isEmpty()) {
      log.debug(
          "Project '{}' not found in organization {}",
          query.getProjectName(),
          query.getOrganizationId());
      return RunPage.empty();
    }
    final PaginationStrategy strategy = strategyOf(query);
    checkTokens(strategy, query);
    final int limit = Math.max(1, Math.min(query.getLimit(), config.getMaxPageSize()));

    final RunFilter scope = RunFilter.forProject(query.getOrganizationId(), projectId.get());
    final Optional<RunFilter> filter = resolveFilter(query, scope, strategy);
    if (filter.isEmpty()) {
      return RunPage.empty();
    }
    log.debug("Listing runs of project {} with strategy {}", projectId.get(), strategy);

    switch (strategy) {
      case DEFAULT:
        return listByCreatedAt(query, projectId.get(), filter.get(), limit);
      case SYSTEM_COLUMN:
        return listBySystemColumn(query, filter.get(), limit);
      case FIELD:
        return listByFieldValue(query, filter.get(), limit);
      case METRIC:
        return listByMetric(query, filter.get(), limit);
      default:
        throw new IllegalStateException("Unhandled strategy: " + strategy);
    }
  }

  /** Counts the runs a listing with the same filters would return across all its pages. */
  public long countRuns(@NonNull final RunQuery query) {
    final RunFilter scope =
        RunFilter.builder()
            .organizationId(query.getOrganizationId())
            .projectName(query.getProjectName())
            .build();
    final Optional<RunFilter> filter = resolveFilter(query, scope, PaginationStrategy.DEFAULT);
    if (filter.isEmpty()) {
      return 0L;
    }
    return runSearchDao.countRuns(RunFilterBuilder.build(filter.get()));
  }

  /**
   * Looks up one run by its external token.
   *
   * @throws runscope.service.exceptions.InvalidRunIdException if the token does not decode
   * @throws RunNotFoundException if no run of the organization has the decoded id
   */
  public RunRow getRun(@NonNull final String organizationId, @NonNull final String runToken) {
    final long runId = runIdCodec.decode(runToken);
    return runDao
        .findRun(organizationId, runId)
        .map(this::withEncodedId)
        .orElseThrow(() -> new RunNotFoundException(runToken));
  }

  /** Requested aggregates of the given runs, keyed by run id and {@link MetricSpec#key()}. */
  public Map<Long, Map<String, Double>> getMetricSummaries(
      @NonNull final String organizationId,
      @NonNull final String projectName,
      @NonNull final Collection<Long> runIds,
      @NonNull final List<MetricSpec> specs) {
    if (runIds.isEmpty() || specs.isEmpty()) {
      return ImmutableMap.of();
    }
    final String key =
        RunQueryCache.key(
            "metricSummaries",
            organizationId,
            projectName,
            new TreeSet<>(runIds),
            specs.stream().map(MetricSpec::key).sorted().collect(Collectors.toList()));
    return cache
        .getOrLoad(
            key,
            cacheTtl(),
            CachedSummaries.class,
            () ->
                CachedSummaries.of(
                    metricSummaryDao.findSummaries(
                        new MetricScope(organizationId, projectName), runIds, specs)))
        .byRun();
  }

  /**
   * Metric names logged in the project. Scoping to runs lifts the result cap, since the result is
   * bounded by those runs.
   */
  public List<String> distinctMetricNames(
      @NonNull final String organizationId,
      @NonNull final String projectName,
      @Nullable final String search,
      @NonNull final MetricNameMatch match,
      @NonNull final Collection<Long> runIds) {
    final int limit =
        runIds.isEmpty() ? config.getMetricNameLimit() : config.getScopedMetricNameLimit();
    final String key =
        RunQueryCache.key(
            "distinctMetricNames",
            organizationId,
            projectName,
            search,
            match,
            new TreeSet<>(runIds));
    return cache
        .getOrLoad(
            key,
            cacheTtl(),
            CachedNames.class,
            () ->
                new CachedNames(
                    ImmutableList.copyOf(
                        metricSummaryDao.findDistinctMetricNames(
                            new MetricScope(organizationId, projectName),
                            search,
                            match,
                            runIds,
                            limit))))
        .names();
  }

  public List<ColumnKeyRow> distinctColumnKeys(
      @NonNull final String organizationId,
      @NonNull final String projectName,
      @Nullable final String search) {
    return runDao
        .findProjectId(organizationId, projectName)
        .map(
            projectId ->
                fieldValueDao.findColumnKeys(
                    organizationId, projectId, search, config.getColumnKeyLimit()))
        .orElse(ImmutableList.of());
  }

  public List<String> distinctTags(
      @NonNull final String organizationId, @NonNull final String projectName) {
    return runDao
        .findProjectId(organizationId, projectName)
        .map(projectId -> runDao.findDistinctTags(organizationId, projectId))
        .orElse(ImmutableList.of());
  }

  /** Indexed field values of the given runs, keyed by run token. */
  public Map<String, List<FieldValueRow>> getFieldValues(
      @NonNull final String organizationId, @NonNull final Collection<String> runTokens) {
    if (runTokens.isEmpty()) {
      return ImmutableMap.of();
    }
    final Set<Long> runIds = new TreeSet<>();
    runTokens.forEach(token -> runIds.add(runIdCodec.decode(token)));
    final Map<String, List<FieldValueRow>> values = new LinkedHashMap<>();
    for (final FieldValueRow row : fieldValueDao.findFieldValues(organizationId, runIds)) {
      values.computeIfAbsent(runIdCodec.encode(row.runId()), token -> new ArrayList<>()).add(row);
    }
    return values;
  }

  /**
   * Resolves the relational part of a query into a filter. Returns empty when the result is known
   * to be empty: a search without matches or a metric match without runs.
   */
  private Optional<RunFilter> resolveFilter(
      final RunQuery query, final RunFilter scope, final PaginationStrategy strategy) {
    final RunFilter.RunFilterBuilder relational =
        scope.toBuilder()
            .tags(query.getTags())
            .statuses(query.getStatuses())
            .dateFilters(query.getDateFilters())
            .fieldFilters(query.getFieldFilters())
            .systemFilters(query.getSystemFilters());

    RunFilter filter;
    if (query.getSearch().isPresent()) {
      final List<Long> matches =
          runSearchDao.findRunIds(
              RunFilterBuilder.build(relational.search(query.getSearch().get()).build()));
      log.debug("Search '{}' matched {} runs", query.getSearch().get(), matches.size());
      if (matches.isEmpty()) {
        return Optional.empty();
      }
      filter = scope.toBuilder().restrictToIds(ImmutableSet.copyOf(matches)).build();
    } else {
      filter = relational.build();
    }

    if (query.hasMetricFilters() && strategy != PaginationStrategy.METRIC) {
      final Collection<Long> candidates =
          filter.getRestrictToIds() == null ? ImmutableSet.of() : filter.getRestrictToIds();
      final Optional<Set<Long>> matched =
          metricSummaryDao.findRunIdsMatching(
              metricScope(query), query.getMetricFilters(), candidates);
      if (matched.isPresent()) {
        final Set<Long> restricted =
            filter.getRestrictToIds() == null
                ? matched.get()
                : Sets.intersection(filter.getRestrictToIds(), matched.get());
        log.debug("Metric filters matched {} runs", restricted.size());
        if (restricted.isEmpty()) {
          return Optional.empty();
        }
        filter = filter.toBuilder().restrictToIds(ImmutableSet.copyOf(restricted)).build();
      }
    }
    return Optional.of(filter);
  }

  private RunPage listByCreatedAt(
      final RunQuery query, final long projectId, final RunFilter filter, final int limit) {
    final Long cursor = query.getCursor();
    final boolean backward = cursor != null && query.getDirection() == PageDirection.BACKWARD;
    final List<RunRow> rows;
    if (filter.hasConditions()) {
      rows =
          runSearchDao.findRunsByCreatedAt(
              RunFilterBuilder.build(filter),
              cursor,
              backward ? PageDirection.BACKWARD : PageDirection.FORWARD,
              limit + 1);
    } else if (cursor == null) {
      rows = runDao.findLatestRuns(query.getOrganizationId(), projectId, limit + 1);
    } else if (backward) {
      rows = runDao.findRunsAfter(query.getOrganizationId(), projectId, cursor, limit + 1);
    } else {
      rows = runDao.findRunsBefore(query.getOrganizationId(), projectId, cursor, limit + 1);
    }

    final List<RunRow> page = firstPage(rows, limit);
    final Long nextCursor = rows.size() > limit ? page.get(page.size() - 1).getId() : null;
    return RunPage.withCursor(backward ? Lists.reverse(page) : page, nextCursor);
  }

  private RunPage listBySystemColumn(
      final RunQuery query, final RunFilter filter, final int limit) {
    final SortSpec sort = query.getSort().orElseThrow();
    final SystemSortColumn column = SystemSortColumn.fromField(sort.field()).orElseThrow();
    final SortCursor after =
        query.getSortCursor() == null ? null : SortCursor.parse(query.getSortCursor());
    final List<RunRow> rows =
        runSearchDao.findRunsBySystemColumn(
            RunFilterBuilder.build(filter), column, sort.direction(), after, limit + 1);

    final List<RunRow> page = firstPage(rows, limit);
    String sortCursor = null;
    if (rows.size() > limit) {
      final RunRow last = page.get(page.size() - 1);
      sortCursor = new SortCursor(column.cursorValue(last), last.getId()).encode();
    }
    return RunPage.withSortCursor(page, sortCursor);
  }

  private RunPage listByFieldValue(final RunQuery query, final RunFilter filter, final int limit) {
    final SortSpec sort = query.getSort().orElseThrow();
    final FieldSource source = sort.source().fieldSource().orElseThrow();
    final int offset = offsetOf(query);
    final List<RunRow> rows =
        runSearchDao.findRunsByFieldValue(
            RunFilterBuilder.build(filter),
            source,
            sort.field(),
            sort.direction(),
            offset,
            limit + 1);
    return RunPage.withOffset(firstPage(rows, limit), nextOffset(rows.size(), offset, limit));
  }

  /**
   * Sorts by a metric aggregate in three sequential steps: relational candidates (unrestricted
   * when there are no relational conditions), a sorted page of ids from the metric store, then
   * hydration of those ids reordered to the metric store's order.
   */
  private RunPage listByMetric(final RunQuery query, final RunFilter filter, final int limit) {
    final SortSpec sort = query.getSort().orElseThrow();
    Collection<Long> candidates = ImmutableSet.of();
    if (filter.hasConditions()) {
      candidates = runSearchDao.findRunIds(RunFilterBuilder.build(filter));
      log.debug("Metric sort over {} candidate runs", candidates.size());
      if (candidates.isEmpty()) {
        return RunPage.empty();
      }
    }

    final int offset = offsetOf(query);
    final List<MetricSortRow> sorted =
        metricSummaryDao.findSortedRunIds(
            metricScope(query),
            new MetricSpec(sort.field(), sort.aggregationOrDefault()),
            sort.direction(),
            candidates,
            query.getMetricFilters(),
            limit + 1,
            offset);
    if (sorted.isEmpty()) {
      return RunPage.empty();
    }

    final List<MetricSortRow> pageIds = sorted.subList(0, Math.min(limit, sorted.size()));
    final Map<Long, RunRow> runsById =
        runSearchDao
            .findRunsByIds(
                query.getOrganizationId(),
                pageIds.stream().map(MetricSortRow::runId).collect(Collectors.toList()))
            .stream()
            .collect(Collectors.toMap(RunRow::getId, Function.identity()));

    final List<RunRow> page = new ArrayList<>(pageIds.size());
    final Map<Long, Double> sortValues = new HashMap<>();
    for (final MetricSortRow row : pageIds) {
      final RunRow run = runsById.get(row.runId());
      if (run == null) {
        log.debug("Run {} has metrics but no relational row; skipping", row.runId());
        continue;
      }
      page.add(withEncodedId(run));
      sortValues.put(row.runId(), row.sortValue());
    }
    return new RunPage(
        page,
        null,
        null,
        nextOffset(sorted.size(), offset, limit),
        ImmutableMap.copyOf(sortValues));
  }

  private PaginationStrategy strategyOf(final RunQuery query) {
    final Optional<SortSpec> sort = query.getSort();
    final PaginationStrategy strategy = PaginationStrategy.of(sort.orElse(null));
    if (strategy == PaginationStrategy.SYSTEM_COLUMN
        && SystemSortColumn.fromField(sort.get().field()).isEmpty()) {
      log.debug("Unknown sort column '{}'; using the default order", sort.get().field());
      return PaginationStrategy.DEFAULT;
    }
    return strategy;
  }

  /** Rejects continuation tokens issued by another strategy. */
  private static void checkTokens(final PaginationStrategy strategy, final RunQuery query) {
    final boolean offsetStrategy =
        strategy == PaginationStrategy.FIELD || strategy == PaginationStrategy.METRIC;
    if (query.getCursor() != null && strategy != PaginationStrategy.DEFAULT) {
      throw new InvalidPageTokenException("A cursor only continues the default ordering");
    }
    if (query.getSortCursor() != null && strategy != PaginationStrategy.SYSTEM_COLUMN) {
      throw new InvalidPageTokenException("A sort cursor only continues a system column sort");
    }
    if (query.getOffset() != null && !offsetStrategy) {
      throw new InvalidPageTokenException("An offset only continues a field or metric sort");
    }
    if (query.getOffset() != null && query.getOffset() < 0) {
      throw new InvalidPageTokenException("Negative offset: " + query.getOffset());
    }
  }

  private int offsetOf(final RunQuery query) {
    return query.getOffset() == null ? 0 : Math.min(query.getOffset(), config.getMaxOffset());
  }

  /** Offset of the next page, or null on the last page or once past the offset ceiling. */
  @Nullable
  private Integer nextOffset(final int fetched, final int offset, final int limit) {
    final int next = offset + limit;
    return fetched > limit && next <= config.getMaxOffset() ? next : null;
  }

  private List<RunRow> firstPage(final List<RunRow> rows, final int limit) {
    return rows.stream()
        .limit(limit)
        .map(this::withEncodedId)
        .collect(ImmutableList.toImmutableList());
  }

  private RunRow withEncodedId(final RunRow run) {
    return run.withEncodedId(runIdCodec.encode(run.getId()));
  }

  private static MetricScope metricScope(final RunQuery query) {
    return new MetricScope(query.getOrganizationId(), query.getProjectName());
  }

  private Duration cacheTtl() {
    return Duration.ofSeconds(config.getCacheTtlSeconds());
  }

  /** Metric summaries as held in the cache; shared by every reader, so immutable all the way. */
  private record CachedSummaries(ImmutableMap<Long, Map<String, Double>> byRun) {
    static CachedSummaries of(final Map<Long, Map<String, Double>> summaries) {
      final ImmutableMap.Builder<Long, Map<String, Double>> byRun = ImmutableMap.builder();
      summaries.forEach((runId, values) -> byRun.put(runId, ImmutableMap.copyOf(values)));
      return new CachedSummaries(byRun.build());
    }
  }

  private record CachedNames(ImmutableList<String> names) {}
}
