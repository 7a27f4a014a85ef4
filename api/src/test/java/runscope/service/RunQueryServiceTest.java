/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import runscope.common.RunIdCodec;
import runscope.common.models.FieldSource;
import runscope.common.models.RunStatus;
import runscope.db.FieldValueDao;
import runscope.db.MetricSummaryDao;
import runscope.db.RunDao;
import runscope.db.RunFilterClause;
import runscope.db.RunSearchDao;
import runscope.db.SystemSortColumn;
import runscope.db.models.FieldValueRow;
import runscope.db.models.MetricSortRow;
import runscope.db.models.RunRow;
import runscope.service.exceptions.InvalidPageTokenException;
import runscope.service.exceptions.RunNotFoundException;
import runscope.service.models.MetricAggregation;
import runscope.service.models.MetricFilter;
import runscope.service.models.MetricNameMatch;
import runscope.service.models.MetricSpec;
import runscope.service.models.PageDirection;
import runscope.service.models.RunPage;
import runscope.service.models.RunQuery;
import runscope.service.models.SortCursor;
import runscope.service.models.SortDirection;
import runscope.service.models.SortSpec;

public class RunQueryServiceTest {
  private static final String ORG = "org-1";
  private static final String PROJECT = "vision";
  private static final long PROJECT_ID = 1L;
  private static final Instant EPOCH = Instant.parse("2024-01-01T00:00:00Z");

  private RunDao runDao;
  private RunSearchDao runSearchDao;
  private FieldValueDao fieldValueDao;
  private MetricSummaryDao metricSummaryDao;
  private RunQueryConfig config;
  private RunIdCodec codec;
  private RunQueryService service;

  @BeforeEach
  public void setUp() {
    runDao = mock(RunDao.class);
    runSearchDao = mock(RunSearchDao.class);
    fieldValueDao = mock(FieldValueDao.class);
    metricSummaryDao = mock(MetricSummaryDao.class);
    config = new RunQueryConfig();
    codec =
        new RunIdCodec(RunQueryConfig.DEFAULT_ID_ALPHABET, RunQueryConfig.DEFAULT_ID_MIN_LENGTH);
    service = newService(RunQueryCache.NOOP);
    when(runDao.findProjectId(ORG, PROJECT)).thenReturn(Optional.of(PROJECT_ID));
  }

  private RunQueryService newService(RunQueryCache cache) {
    return new RunQueryService(
        runDao, runSearchDao, fieldValueDao, metricSummaryDao, codec, cache, config);
  }

  private static RunQuery.RunQueryBuilder query() {
    return RunQuery.builder().organizationId(ORG).projectName(PROJECT);
  }

  private static RunRow run(long id) {
    return RunRow.builder()
        .id(id)
        .organizationId(ORG)
        .projectId(PROJECT_ID)
        .name("run-" + id)
        .status(RunStatus.COMPLETED)
        .tags(ImmutableList.of())
        .config(JsonNodeFactory.instance.objectNode())
        .systemMetadata(JsonNodeFactory.instance.objectNode())
        .createdAt(EPOCH.plusSeconds(id))
        .updatedAt(EPOCH.plusSeconds(id))
        .build();
  }

  private static List<Long> ids(RunPage page) {
    return page.runs().stream().map(RunRow::getId).collect(Collectors.toList());
  }

  @Test
  public void testUnknownProjectReturnsEmptyPage() {
    RunPage page = service.listRuns(query().projectName("missing").build());

    assertThat(page.runs()).isEmpty();
    assertThat(page.nextCursor()).isNull();
    verify(runDao, never()).findLatestRuns(anyString(), anyLong(), anyInt());
  }

  @Test
  public void testDefaultListingFetchesOneExtraRow() {
    // Given
    when(runDao.findLatestRuns(ORG, PROJECT_ID, 3))
        .thenReturn(ImmutableList.of(run(3), run(2), run(1)));

    // When
    RunPage page = service.listRuns(query().limit(2).build());

    // Then
    assertThat(ids(page)).containsExactly(3L, 2L);
    assertThat(page.nextCursor()).isEqualTo(2L);
    assertThat(page.runs().get(0).getEncodedId()).isEqualTo(codec.encode(3L));
  }

  @Test
  public void testLastDefaultPageHasNoCursor() {
    when(runDao.findRunsBefore(ORG, PROJECT_ID, 2L, 3)).thenReturn(ImmutableList.of(run(1)));

    RunPage page = service.listRuns(query().limit(2).cursor(2L).build());

    assertThat(ids(page)).containsExactly(1L);
    assertThat(page.nextCursor()).isNull();
  }

  @Test
  public void testBackwardPageIsShownNewestFirst() {
    // Given
    when(runDao.findRunsAfter(ORG, PROJECT_ID, 5L, 3))
        .thenReturn(ImmutableList.of(run(6), run(7), run(8)));

    // When
    RunPage page =
        service.listRuns(query().limit(2).cursor(5L).direction(PageDirection.BACKWARD).build());

    // Then
    assertThat(ids(page)).containsExactly(7L, 6L);
    assertThat(page.nextCursor()).isEqualTo(7L);
  }

  @Test
  public void testLimitIsClamped() {
    service.listRuns(query().limit(1000).build());
    service.listRuns(query().limit(0).build());

    verify(runDao).findLatestRuns(ORG, PROJECT_ID, config.getMaxPageSize() + 1);
    verify(runDao).findLatestRuns(ORG, PROJECT_ID, 2);
  }

  @Test
  public void testSearchResolvesIdsBeforeListing() {
    // Given
    when(runSearchDao.findRunIds(any())).thenReturn(ImmutableList.of(5L, 6L));
    when(runSearchDao.findRunsByCreatedAt(any(), isNull(), eq(PageDirection.FORWARD), eq(11)))
        .thenReturn(ImmutableList.of(run(6), run(5)));

    // When
    RunPage page = service.listRuns(query().search(" net ").tag("baseline").build());

    // Then
    ArgumentCaptor<RunFilterClause> searchClause = ArgumentCaptor.forClass(RunFilterClause.class);
    verify(runSearchDao).findRunIds(searchClause.capture());
    assertThat(searchClause.getValue().where().sql()).contains("ILIKE").contains("r.tags &&");

    ArgumentCaptor<RunFilterClause> listClause = ArgumentCaptor.forClass(RunFilterClause.class);
    verify(runSearchDao)
        .findRunsByCreatedAt(listClause.capture(), isNull(), eq(PageDirection.FORWARD), eq(11));
    assertThat(listClause.getValue().where().sql())
        .contains("r.id = ANY(?::bigint[])")
        .doesNotContain("ILIKE")
        .doesNotContain("r.tags");
    assertThat(ids(page)).containsExactly(6L, 5L);
  }

  @Test
  public void testSearchWithoutMatchesReturnsEmptyPage() {
    when(runSearchDao.findRunIds(any())).thenReturn(ImmutableList.of());

    RunPage page = service.listRuns(query().search("nothing").build());

    assertThat(page.runs()).isEmpty();
    verify(runSearchDao, never()).findRunsByCreatedAt(any(), any(), any(), anyInt());
  }

  @Test
  public void testMetricFilterWithoutMatchesSkipsHydration() {
    // Given
    when(metricSummaryDao.findRunIdsMatching(any(), anyList(), anyCollection()))
        .thenReturn(Optional.of(ImmutableSet.of()));

    // When
    RunPage page =
        service.listRuns(
            query()
                .metricFilter(MetricFilter.of("loss", MetricAggregation.MIN, "<", "0.1"))
                .build());

    // Then
    assertThat(page.runs()).isEmpty();
    verify(runDao, never()).findLatestRuns(anyString(), anyLong(), anyInt());
    verify(runSearchDao, never()).findRunsByCreatedAt(any(), any(), any(), anyInt());
    verify(runSearchDao, never()).findRunsByIds(anyString(), anyCollection());
  }

  @Test
  public void testDroppedMetricFiltersDoNotRestrict() {
    when(metricSummaryDao.findRunIdsMatching(any(), anyList(), anyCollection()))
        .thenReturn(Optional.empty());
    when(runDao.findLatestRuns(ORG, PROJECT_ID, 11)).thenReturn(ImmutableList.of(run(1)));

    RunPage page =
        service.listRuns(
            query()
                .metricFilter(MetricFilter.of("loss", MetricAggregation.MIN, "sounds like", "x"))
                .build());

    assertThat(ids(page)).containsExactly(1L);
  }

  @Test
  public void testMetricMatchesIntersectSearchMatches() {
    // Given
    when(runSearchDao.findRunIds(any())).thenReturn(ImmutableList.of(1L, 2L));
    when(metricSummaryDao.findRunIdsMatching(any(), anyList(), anyCollection()))
        .thenReturn(Optional.of(ImmutableSet.of(2L, 3L)));
    when(runSearchDao.findRunsByCreatedAt(any(), isNull(), any(), anyInt()))
        .thenReturn(ImmutableList.of(run(2)));

    // When
    service.listRuns(
        query()
            .search("run")
            .metricFilter(MetricFilter.of("loss", MetricAggregation.LAST, ">", "0"))
            .build());

    // Then
    ArgumentCaptor<RunFilterClause> clause = ArgumentCaptor.forClass(RunFilterClause.class);
    verify(runSearchDao).findRunsByCreatedAt(clause.capture(), isNull(), any(), anyInt());
    assertThat(clause.getValue().where().params())
        .anySatisfy(value -> assertThat(value.toString()).contains("[2]"));
  }

  @Test
  public void testSystemColumnSortEmitsSortCursor() {
    // Given
    when(runSearchDao.findRunsBySystemColumn(
            any(), eq(SystemSortColumn.NAME), eq(SortDirection.ASC), isNull(), eq(3)))
        .thenReturn(ImmutableList.of(run(1), run(2), run(3)));

    // When
    RunPage page =
        service.listRuns(query().limit(2).sort(SortSpec.system("name", SortDirection.ASC)).build());

    // Then
    assertThat(ids(page)).containsExactly(1L, 2L);
    assertThat(page.sortCursor()).isEqualTo("run-2::2");
    assertThat(page.nextCursor()).isNull();
  }

  @Test
  public void testSystemColumnSortContinuesFromSortCursor() {
    service.listRuns(
        query()
            .limit(2)
            .sort(SortSpec.system("name", SortDirection.ASC))
            .sortCursor("run::with::colons::7")
            .build());

    verify(runSearchDao)
        .findRunsBySystemColumn(
            any(),
            eq(SystemSortColumn.NAME),
            eq(SortDirection.ASC),
            eq(new SortCursor("run::with::colons", 7L)),
            eq(3));
  }

  @Test
  public void testUnknownSystemColumnFallsBackToDefaultOrder() {
    service.listRuns(query().sort(SortSpec.system("color", SortDirection.ASC)).build());

    verify(runDao).findLatestRuns(ORG, PROJECT_ID, 11);
  }

  @Test
  public void testFieldSortStopsAtOffsetCeiling() {
    // Given
    config.setMaxOffset(10);
    when(runSearchDao.findRunsByFieldValue(
            any(), eq(FieldSource.CONFIG), eq("lr"), eq(SortDirection.DESC), anyInt(), eq(6)))
        .thenReturn(ImmutableList.of(run(1), run(2), run(3), run(4), run(5), run(6)));
    SortSpec sort = SortSpec.config("lr", SortDirection.DESC);

    // When
    RunPage first = service.listRuns(query().limit(5).sort(sort).build());
    RunPage capped = service.listRuns(query().limit(5).sort(sort).offset(8).build());
    service.listRuns(query().limit(5).sort(sort).offset(50).build());

    // Then
    assertThat(first.nextOffset()).isEqualTo(5);
    assertThat(first.runs()).hasSize(5);
    assertThat(capped.nextOffset()).isNull();
    verify(runSearchDao)
        .findRunsByFieldValue(
            any(), eq(FieldSource.CONFIG), eq("lr"), eq(SortDirection.DESC), eq(10), eq(6));
  }

  @Test
  public void testMetricSortHydratesInMetricOrder() {
    // Given
    MetricSpec spec = new MetricSpec("loss", MetricAggregation.MIN);
    when(metricSummaryDao.findSortedRunIds(
            any(), eq(spec), eq(SortDirection.ASC), anyCollection(), anyList(), eq(3), eq(0)))
        .thenReturn(
            ImmutableList.of(
                new MetricSortRow(3L, 0.1),
                new MetricSortRow(1L, 0.2),
                new MetricSortRow(2L, 0.3)));
    when(runSearchDao.findRunsByIds(eq(ORG), anyCollection()))
        .thenReturn(ImmutableList.of(run(1), run(3)));

    // When
    RunPage page =
        service.listRuns(
            query()
                .limit(2)
                .sort(SortSpec.metric("loss", MetricAggregation.MIN, SortDirection.ASC))
                .build());

    // Then
    assertThat(ids(page)).containsExactly(3L, 1L);
    assertThat(page.nextOffset()).isEqualTo(2);
    assertThat(page.metricSortValues()).containsEntry(3L, 0.1).containsEntry(1L, 0.2);
    verify(runSearchDao, never()).findRunIds(any());
  }

  @Test
  public void testMetricSortWithFiltersAndNoCandidatesIsEmpty() {
    when(runSearchDao.findRunIds(any())).thenReturn(ImmutableList.of());

    RunPage page =
        service.listRuns(
            query()
                .status("running")
                .sort(SortSpec.metric("loss", MetricAggregation.AVG, SortDirection.DESC))
                .build());

    assertThat(page.runs()).isEmpty();
    verify(metricSummaryDao, never())
        .findSortedRunIds(any(), any(), any(), anyCollection(), anyList(), anyInt(), anyInt());
  }

  @Test
  public void testTokensOfAnotherStrategyAreRejected() {
    SortSpec metricSort = SortSpec.metric("loss", MetricAggregation.LAST, SortDirection.ASC);

    assertThatThrownBy(() -> service.listRuns(query().cursor(4L).sort(metricSort).build()))
        .isInstanceOf(InvalidPageTokenException.class);
    assertThatThrownBy(() -> service.listRuns(query().offset(10).build()))
        .isInstanceOf(InvalidPageTokenException.class);
    assertThatThrownBy(() -> service.listRuns(query().sortCursor("a::1").build()))
        .isInstanceOf(InvalidPageTokenException.class);
    assertThatThrownBy(() -> service.listRuns(query().sort(metricSort).offset(-1).build()))
        .isInstanceOf(InvalidPageTokenException.class);
  }

  @Test
  public void testCountRunsScopesByProjectName() {
    when(runSearchDao.countRuns(any())).thenReturn(4L);

    long count = service.countRuns(query().status("failed").build());

    ArgumentCaptor<RunFilterClause> clause = ArgumentCaptor.forClass(RunFilterClause.class);
    verify(runSearchDao).countRuns(clause.capture());
    assertThat(count).isEqualTo(4L);
    assertThat(clause.getValue().needsProjectJoin()).isTrue();
  }

  @Test
  public void testGetRun() {
    when(runDao.findRun(ORG, 42L)).thenReturn(Optional.of(run(42)));

    RunRow found = service.getRun(ORG, codec.encode(42L));

    assertThat(found.getId()).isEqualTo(42L);
    assertThat(found.getEncodedId()).isEqualTo(codec.encode(42L));
    assertThatThrownBy(() -> service.getRun(ORG, codec.encode(43L)))
        .isInstanceOf(RunNotFoundException.class);
  }

  @Test
  public void testGetFieldValuesKeyedByToken() {
    when(fieldValueDao.findFieldValues(eq(ORG), anyCollection()))
        .thenReturn(
            ImmutableList.of(
                new FieldValueRow(1L, ORG, PROJECT_ID, "config", "lr", "0.1", 0.1),
                new FieldValueRow(1L, ORG, PROJECT_ID, "config", "opt", "adam", null)));

    Map<String, List<FieldValueRow>> values =
        service.getFieldValues(ORG, ImmutableList.of(codec.encode(1L)));

    assertThat(values).containsOnlyKeys(codec.encode(1L));
    assertThat(values.get(codec.encode(1L))).hasSize(2);
  }

  @Test
  public void testDistinctMetricNamesLimitDependsOnScope() {
    service.distinctMetricNames(ORG, PROJECT, null, MetricNameMatch.SUBSTRING, ImmutableList.of());
    service.distinctMetricNames(ORG, PROJECT, "lo", MetricNameMatch.PREFIX, ImmutableList.of(1L));

    verify(metricSummaryDao)
        .findDistinctMetricNames(
            any(),
            isNull(),
            eq(MetricNameMatch.SUBSTRING),
            anyCollection(),
            eq(config.getMetricNameLimit()));
    verify(metricSummaryDao)
        .findDistinctMetricNames(
            any(),
            eq("lo"),
            eq(MetricNameMatch.PREFIX),
            anyCollection(),
            eq(config.getScopedMetricNameLimit()));
  }

  @Test
  public void testMetricSummariesAreCached() {
    // Given
    service = newService(new LocalRunQueryCache(100));
    List<MetricSpec> specs = ImmutableList.of(new MetricSpec("loss", MetricAggregation.AVG));
    when(metricSummaryDao.findSummaries(any(), anyCollection(), anyList()))
        .thenReturn(ImmutableMap.of(1L, ImmutableMap.of("loss|AVG", 1.0)));

    // When
    Map<Long, Map<String, Double>> first =
        service.getMetricSummaries(ORG, PROJECT, ImmutableList.of(2L, 1L), specs);
    Map<Long, Map<String, Double>> second =
        service.getMetricSummaries(ORG, PROJECT, ImmutableList.of(1L, 2L), specs);

    // Then
    assertThat(first).isEqualTo(second);
    verify(metricSummaryDao, times(1)).findSummaries(any(), anyCollection(), anyList());
    assertThat(service.getMetricSummaries(ORG, PROJECT, ImmutableList.of(), specs)).isEmpty();
  }

  @Test
  public void testCachedMetricSummariesCannotBeChangedByReaders() {
    // Given
    service = newService(new LocalRunQueryCache(100));
    List<MetricSpec> specs = ImmutableList.of(new MetricSpec("loss", MetricAggregation.AVG));
    Map<String, Double> loss = new HashMap<>();
    loss.put("loss|AVG", 1.0);
    Map<Long, Map<String, Double>> loaded = new HashMap<>();
    loaded.put(1L, loss);
    when(metricSummaryDao.findSummaries(any(), anyCollection(), anyList())).thenReturn(loaded);

    // When
    Map<Long, Map<String, Double>> first =
        service.getMetricSummaries(ORG, PROJECT, ImmutableList.of(1L), specs);
    loss.put("loss|AVG", 42.0);

    // Then
    assertThatThrownBy(() -> first.get(1L).put("loss|AVG", 99.0))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> first.put(2L, ImmutableMap.of()))
        .isInstanceOf(UnsupportedOperationException.class);
    Map<Long, Map<String, Double>> second =
        service.getMetricSummaries(ORG, PROJECT, ImmutableList.of(1L), specs);
    assertThat(second.get(1L)).containsEntry("loss|AVG", 1.0);
    verify(metricSummaryDao, times(1)).findSummaries(any(), anyCollection(), anyList());
  }

  @Test
  public void testCachedMetricNamesCannotBeChangedByReaders() {
    // Given
    service = newService(new LocalRunQueryCache(100));
    when(metricSummaryDao.findDistinctMetricNames(any(), any(), any(), anyCollection(), anyInt()))
        .thenReturn(new ArrayList<>(ImmutableList.of("acc", "loss")));

    // When
    List<String> first =
        service.distinctMetricNames(ORG, PROJECT, null, MetricNameMatch.PREFIX, ImmutableList.of());

    // Then
    assertThatThrownBy(() -> first.add("injected"))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThat(
            service.distinctMetricNames(
                ORG, PROJECT, null, MetricNameMatch.PREFIX, ImmutableList.of()))
        .containsExactly("acc", "loss");
  }
}
