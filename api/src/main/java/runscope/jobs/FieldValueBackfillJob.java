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
 * A job that keeps the flattened field index complete by indexing runs it has not seen yet. Each
 * iteration resumes after the last run it indexed; a failed iteration is retried from the same
 * run on the next one.
 */
@Slf4j
public class FieldValueBackfillJob extends AbstractScheduledService implements Managed {

  private final FieldValueBackfill backfill;
  private final int batchSize;
  private final int frequencyMinutes;
  private final Scheduler fixedDelayScheduler;
  private volatile long cursor;

  public FieldValueBackfillJob(
      @NonNull final FieldValueBackfill backfill, @NonNull final BackfillConfig config) {
    this(backfill, config.getBatchSize(), config.getFrequencyMinutes(), 0L);
  }

  public FieldValueBackfillJob(
      @NonNull final FieldValueBackfill backfill,
      final int batchSize,
      final int frequencyMinutes,
      final long startAfterId) {
    this.backfill = backfill;
    this.batchSize = batchSize;
    this.frequencyMinutes = frequencyMinutes;
    this.cursor = startAfterId;
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
    log.info(
        "Field value backfill job started. Indexing {} runs per batch every {} minutes.",
        batchSize,
        frequencyMinutes);
  }

  @Override
  protected void runOneIteration() {
    try {
      backfill.run(cursor, batchSize, indexed -> cursor = indexed);
      log.info("Field value backfill iteration done; runs indexed up to {}", cursor);
    } catch (Exception error) {
      log.error("Field value backfill failed after run {}. Will retry on next run.", cursor, error);
    }
  }

  @Override
  public void stop() throws Exception {
    log.info("Stopping field value backfill job...");
    stopAsync().awaitTerminated();
  }

  /** Id of the last run indexed so far. */
  public long getCursor() {
    return cursor;
  }
}
