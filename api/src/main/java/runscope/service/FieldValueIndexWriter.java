/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.jdbi.v3.core.Jdbi;
import runscope.common.JsonFlattener;
import runscope.common.models.FieldSource;
import runscope.common.models.FlattenedField;
import runscope.db.FieldValueDao;
import runscope.db.models.ColumnKeyRow;
import runscope.db.models.FieldValueRow;

/**
 * Maintains the flattened field index of runs: the per-project key registry and the per-run rows
 * of {@code run_field_values}.
 */
@Slf4j
public class FieldValueIndexWriter {

  private final Jdbi jdbi;
  private final Executor executor;

  public FieldValueIndexWriter(@NonNull final Jdbi jdbi, @NonNull final Executor executor) {
    this.jdbi = jdbi;
    this.executor = executor;
  }

  /**
   * Indexes the config and system metadata of a run. Keys are registered for the project; when
   * {@code runId} is given the run's indexed values are replaced in one transaction, so a failure
   * leaves the previous values in place. Does nothing when neither document has a leaf.
   *
   * @return the number of value rows written for the run
   */
  public int index(
      @NonNull final String organizationId,
      final long projectId,
      @Nullable final JsonNode config,
      @Nullable final JsonNode systemMetadata,
      @Nullable final Long runId) {
    final List<FlattenedField> configFields = JsonFlattener.flattenFields(config, true);
    final List<FlattenedField> metadataFields = JsonFlattener.flattenFields(systemMetadata, false);
    if (configFields.isEmpty() && metadataFields.isEmpty()) {
      log.debug("Nothing to index for run {} of project {}", runId, projectId);
      return 0;
    }

    final ImmutableList.Builder<ColumnKeyRow> keys = ImmutableList.builder();
    final ImmutableList.Builder<FieldValueRow> values = ImmutableList.builder();
    collect(organizationId, projectId, runId, FieldSource.CONFIG, configFields, keys, values);
    collect(
        organizationId,
        projectId,
        runId,
        FieldSource.SYSTEM_METADATA,
        metadataFields,
        keys,
        values);
    final List<FieldValueRow> rows = values.build();

    try {
      jdbi.useTransaction(
          handle -> {
            final FieldValueDao dao = handle.attach(FieldValueDao.class);
            dao.insertColumnKeys(keys.build());
            if (runId != null) {
              final int deleted = dao.deleteForRun(runId);
              dao.insertFieldValues(rows);
              log.debug(
                  "Replaced {} indexed values of run {} with {}", deleted, runId, rows.size());
            }
          });
    } catch (Exception e) {
      log.error("Failed to index fields of run {} in project {}", runId, projectId, e);
      throw e;
    }
    return runId == null ? 0 : rows.size();
  }

  /**
   * Runs {@link #index} on the executor. Failures never reach the caller, which is the run
   * ingestion path; {@link #index} logs the stack trace and this adds one summary line.
   */
  public CompletableFuture<Void> indexAsync(
      @NonNull final String organizationId,
      final long projectId,
      @Nullable final JsonNode config,
      @Nullable final JsonNode systemMetadata,
      @Nullable final Long runId) {
    return CompletableFuture.runAsync(
            () -> index(organizationId, projectId, config, systemMetadata, runId), executor)
        .exceptionally(
            error -> {
              log.warn(
                  "Field indexing of run {} failed; its index stays stale: {}",
                  runId,
                  error.toString());
              return null;
            });
  }

  private static void collect(
      final String organizationId,
      final long projectId,
      @Nullable final Long runId,
      final FieldSource source,
      final List<FlattenedField> fields,
      final ImmutableList.Builder<ColumnKeyRow> keys,
      final ImmutableList.Builder<FieldValueRow> values) {
    for (final FlattenedField field : fields) {
      keys.add(
          new ColumnKeyRow(
              organizationId,
              projectId,
              source.getValue(),
              field.key(),
              field.dataType().getValue()));
      if (runId != null) {
        values.add(
            new FieldValueRow(
                runId,
                organizationId,
                projectId,
                source.getValue(),
                field.key(),
                field.textValue(),
                field.numericValue()));
      }
    }
  }
}
