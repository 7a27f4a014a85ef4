/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.jobs;

import java.util.List;
import java.util.function.LongConsumer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import runscope.common.Utils;
import runscope.db.RunDao;
import runscope.db.models.RunBatchRow;
import runscope.service.FieldValueIndexWriter;

/**
 * Walks runs in ascending id order and re-indexes their fields. The walk stops at the first run
 * that fails, so resuming from the returned cursor neither skips nor repeats a run.
 */
@Slf4j
public class FieldValueBackfill {
  private final RunDao runDao;
  private final FieldValueIndexWriter writer;

  public FieldValueBackfill(
      @NonNull final RunDao runDao, @NonNull final FieldValueIndexWriter writer) {
    this.runDao = runDao;
    this.writer = writer;
  }

  /**
   * Indexes every run with an id greater than {@code afterId}, {@code batchSize} runs at a time.
   *
   * @param progress receives the id of each run once it is indexed
   * @return the id of the last run indexed, or {@code afterId} if there was none
   */
  public long run(final long afterId, final int batchSize, @NonNull final LongConsumer progress) {
    long cursor = afterId;
    int total = 0;
    while (true) {
      final List<RunBatchRow> batch = runDao.findRunBatch(cursor, batchSize);
      if (batch.isEmpty()) {
        break;
      }
      for (final RunBatchRow run : batch) {
        writer.index(
            run.organizationId(),
            run.projectId(),
            Utils.toJsonNode(run.config()),
            Utils.toJsonNode(run.systemMetadata()),
            run.id());
        cursor = run.id();
        progress.accept(cursor);
        total++;
      }
      log.info("Indexed fields of {} runs, up to run {}", total, cursor);
      if (batch.size() < batchSize) {
        break;
      }
    }
    return cursor;
  }
}
