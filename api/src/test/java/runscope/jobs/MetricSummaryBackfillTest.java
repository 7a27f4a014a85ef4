/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.jobs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static runscope.db.MetricTestUtils.insertMetric;
import static runscope.db.RunTestUtils.ORGANIZATION;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import runscope.db.MetricSummaryDao;
import runscope.db.MetricSummaryDao.MetricScope;
import runscope.jdbi.ClickHouseJdbiExtension;
import runscope.jdbi.JdbiUtils;
import runscope.service.models.MetricAggregation;
import runscope.service.models.MetricSpec;

@Tag("IntegrationTests")
@ExtendWith(ClickHouseJdbiExtension.class)
public class MetricSummaryBackfillTest {
  private static final MetricScope SCOPE = new MetricScope(ORGANIZATION, "vision");
  private static final List<MetricSpec> SPECS =
      List.of(
          new MetricSpec("loss", MetricAggregation.AVG),
          new MetricSpec("loss", MetricAggregation.LAST),
          new MetricSpec("loss", MetricAggregation.MAX));

  private static Jdbi clickhouse;
  private static MetricSummaryDao dao;

  @BeforeAll
  public static void setUpOnce(Jdbi jdbi) {
    clickhouse = jdbi;
    dao = new MetricSummaryDao(jdbi);
  }

  @BeforeEach
  public void setUp() {
    JdbiUtils.cleanMetrics(clickhouse);
    insertMetric(clickhouse, ORGANIZATION, "vision", 1, "loss", 0, 0.5, 1.5);
    insertMetric(clickhouse, ORGANIZATION, "vision", 1, "loss", 2, 1.0);
    insertMetric(clickhouse, ORGANIZATION, "vision", 2, "loss", 0, 3.0, Double.NaN);
    insertMetric(clickhouse, ORGANIZATION, "vision", 3, "loss", 0, 0.25);
  }

  private static long summaryRows() {
    return clickhouse.withHandle(
        handle ->
            handle
                .createQuery("SELECT COUNT(*) FROM mlop_metric_summaries")
                .mapTo(Long.class)
                .one());
  }

  private static long mergedCount(long runId) {
    return clickhouse.withHandle(
        handle ->
            handle
                .createQuery(
                    "SELECT sum(count_value) FROM mlop_metric_summaries WHERE runId = :runId")
                .bind("runId", runId)
                .mapTo(Long.class)
                .one());
  }

  @Test
  public void testRebuildsTruncatedSummaries() {
    // Given
    Map<Long, Map<String, Double>> expected =
        dao.findSummaries(SCOPE, List.of(1L, 2L, 3L), SPECS);
    clickhouse.useHandle(handle -> handle.execute("TRUNCATE TABLE mlop_metric_summaries"));
    assertThat(summaryRows()).isZero();

    // When
    long last = new MetricSummaryBackfill(clickhouse, 2).run(0L);

    // Then
    assertThat(last).isEqualTo(3L);
    Map<Long, Map<String, Double>> rebuilt = dao.findSummaries(SCOPE, List.of(1L, 2L, 3L), SPECS);
    assertThat(rebuilt).isEqualTo(expected);
    assertThat(rebuilt.get(1L).get("loss|AVG")).isCloseTo(1.0, within(1e-9));
    assertThat(rebuilt.get(2L).get("loss|LAST")).isEqualTo(3.0);
  }

  @Test
  public void testRebuildTwiceKeepsCounts() {
    // Given
    MetricSummaryBackfill backfill = new MetricSummaryBackfill(clickhouse, 10);

    // When
    backfill.run(0L);
    backfill.run(0L);

    // Then
    assertThat(mergedCount(1L)).isEqualTo(3L);
    assertThat(mergedCount(2L)).isEqualTo(1L);
    assertThat(summaryRows()).isEqualTo(3L);
  }

  @Test
  public void testResumesAfterCursor() {
    clickhouse.useHandle(handle -> handle.execute("TRUNCATE TABLE mlop_metric_summaries"));

    long last = new MetricSummaryBackfill(clickhouse, 10).run(2L);

    assertThat(last).isEqualTo(3L);
    assertThat(dao.findSummaries(SCOPE, List.of(1L, 2L, 3L), SPECS)).containsOnlyKeys(3L);
  }

  @Test
  public void testReportsLastRunOfEachBatch() {
    List<Long> progress = new ArrayList<>();

    long last = new MetricSummaryBackfill(clickhouse, 2).run(0L, progress::add);

    assertThat(last).isEqualTo(3L);
    assertThat(progress).containsExactly(2L, 3L);
  }
}
