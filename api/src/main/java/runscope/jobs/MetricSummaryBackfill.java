/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.jobs;

import static runscope.db.sql.FilterValue.id;
import static runscope.db.sql.FilterValue.ids;

import java.util.List;
import java.util.function.LongConsumer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.jdbi.v3.core.Jdbi;
import runscope.db.sql.ListBinding;
import runscope.db.sql.RenderedSql;
import runscope.db.sql.SqlBuilder;

/**
 * Rebuilds {@code mlop_metric_summaries} from the raw {@code mlop_metrics} rows, one batch of runs
 * at a time. A batch first drops the runs' summary rows, then inserts freshly merged states, so
 * rebuilding a batch twice leaves the same summaries.
 */
@Slf4j
public class MetricSummaryBackfill {
  private static final String INSERT_SUMMARIES_SQL =
      """
      INSERT INTO mlop_metric_summaries
      SELECT tenantId, projectName, runId, logName,
          min(value), max(value), sum(value),
          toUInt64(count()),
          argMaxState(value, step),
          sum(value * value)
      FROM mlop_metrics
      WHERE isFinite(value) AND runId IN (?)
      GROUP BY tenantId, projectName, runId, logName
      """;

  private final Jdbi jdbi;
  private final int batchSize;

  public MetricSummaryBackfill(@NonNull final Jdbi clickhouse, final int batchSize) {
    this.jdbi = clickhouse;
    this.batchSize = batchSize;
  }

  /**
   * Rebuilds the summaries of every run with an id greater than {@code afterRunId}.
   *
   * @return the id of the last run rebuilt, or {@code afterRunId} if there was none
   */
  public long run(final long afterRunId) {
    return run(afterRunId, runId -> {});
  }

  /**
   * Same as {@link #run(long)}; {@code progress} receives the last run id of each rebuilt batch.
   */
  public long run(final long afterRunId, @NonNull final LongConsumer progress) {
    long cursor = afterRunId;
    while (true) {
      final List<Long> runIds = nextRunIds(cursor);
      if (runIds.isEmpty()) {
        break;
      }
      rebuild(runIds);
      cursor = runIds.get(runIds.size() - 1);
      progress.accept(cursor);
      log.info("Rebuilt metric summaries of {} runs, up to run {}", runIds.size(), cursor);
      if (runIds.size() < batchSize) {
        break;
      }
    }
    return cursor;
  }

  void rebuild(final List<Long> runIds) {
    final RenderedSql delete =
        new SqlBuilder()
            .append("DELETE FROM mlop_metric_summaries WHERE runId IN (?)", ids(runIds))
            .render(ListBinding.EXPANDED);
    final RenderedSql insert =
        new SqlBuilder().append(INSERT_SUMMARIES_SQL, ids(runIds)).render(ListBinding.EXPANDED);
    jdbi.useHandle(
        handle -> {
          delete.bind(handle.createUpdate(delete.sql())).execute();
          insert.bind(handle.createUpdate(insert.sql())).execute();
        });
  }

  private List<Long> nextRunIds(final long afterRunId) {
    final RenderedSql sql =
        new SqlBuilder()
            .append(
                "SELECT DISTINCT runId FROM mlop_metrics WHERE runId > ? ORDER BY runId LIMIT ?",
                id(afterRunId),
                id(batchSize))
            .render(ListBinding.EXPANDED);
    return jdbi.withHandle(
        handle -> sql.bind(handle.createQuery(sql.sql())).mapTo(Long.class).list());
  }
}
