/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.jobs;

import com.google.common.util.concurrent.AbstractScheduledService;
import io.dropwizard.lifecycle.Managed;
import java.time.Duration;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * A job that rebuilds metric summaries of runs whose raw metrics landed before the summary view
 * existed. Each iteration resumes after the last batch it rebuilt.
 */
@Slf4j
public class MetricSummaryBackfillJob extends AbstractScheduledService implements Managed {

  private final MetricSummaryBackfill backfill;
  private final int frequencyMinutes;
  private final Scheduler fixedDelayScheduler;
  private volatile long cursor;

  public MetricSummaryBackfillJob(
      @NonNull final MetricSummaryBackfill backfill, @NonNull final BackfillConfig config) {
    this(backfill, config.getMetricSummaryFrequencyMinutes(), 0L);
  }

  public MetricSummaryBackfillJob(
      @NonNull final MetricSummaryBackfill backfill,
      final int frequencyMinutes,
      final long startAfterRunId) {
    this.backfill = backfill;
    this.frequencyMinutes = frequencyMinutes;
    this.cursor = startAfterRunId;
    this.fixedDelayScheduler =
        Scheduler.newFixedDelaySchedule(Duration.ZERO, Duration.ofMinutes(frequencyMinutes));
  }

  @Override
  protected Scheduler scheduler() {
    return fixedDelayScheduler;
  }

  @Override
  public void start() throws Exception {
    startAsync().awaitRunning();
    log.info("Metric summary rebuild job started. Running every {} minutes.", frequencyMinutes);
  }

  @Override
  protected void runOneIteration() {
    try {
      backfill.run(cursor, rebuilt -> cursor = rebuilt);
      log.info("Metric summary rebuild iteration done; runs rebuilt up to {}", cursor);
    } catch (Exception error) {
      log.error(
          "Metric summary rebuild failed after run {}. Will retry on next run.", cursor, error);
    }
  }

  @Override
  public void stop() throws Exception {
    log.info("Stopping metric summary rebuild job...");
    stopAsync().awaitTerminated();
  }

  /** Id of the last run whose summaries were rebuilt. */
  public long getCursor() {
    return cursor;
  }
}
