/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db.migrations;

import com.google.common.util.concurrent.MoreExecutors;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.api.MigrationVersion;
import org.flywaydb.core.api.migration.Context;
import org.flywaydb.core.api.migration.JavaMigration;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import runscope.db.RunDao;
import runscope.jobs.FieldValueBackfill;
import runscope.service.FieldValueIndexWriter;

/** Indexes the config and system metadata of runs created before the field index existed. */
@Slf4j
public class V4__BackfillRunFieldValues implements JavaMigration {

  public static final int DEFAULT_CHUNK_SIZE = 500;

  private static final String COUNT_RUNS_SQL = "SELECT COUNT(*) FROM runs";

  @Setter private Integer chunkSize = null;
  @Setter private Jdbi jdbi;

  public int getChunkSize() {
    return chunkSize != null ? chunkSize : DEFAULT_CHUNK_SIZE;
  }

  @Override
  public MigrationVersion getVersion() {
    return MigrationVersion.fromVersion("4");
  }

  @Override
  public void migrate(Context context) throws Exception {
    log.info("Starting migration to index fields of existing runs");

    if (context != null) {
      jdbi = Jdbi.create(context.getConnection());
    }
    jdbi.installPlugin(new SqlObjectPlugin()).installPlugin(new PostgresPlugin());

    final long runsCount =
        jdbi.withHandle(h -> h.createQuery(COUNT_RUNS_SQL).mapTo(Long.class).one());
    if (runsCount == 0) {
      log.info("Runs table is empty - no fields to index");
      return;
    }
    log.info("Indexing fields of {} runs, {} per chunk", runsCount, getChunkSize());

    final FieldValueBackfill backfill =
        new FieldValueBackfill(
            jdbi.onDemand(RunDao.class),
            new FieldValueIndexWriter(jdbi, MoreExecutors.directExecutor()));
    final long lastRunId = backfill.run(0L, getChunkSize(), runId -> {});

    log.info("Migration completed. Fields indexed up to run {}", lastRunId);
  }

  @Override
  public String getDescription() {
    return "Index config and system metadata of existing runs";
  }

  @Override
  public Integer getChecksum() {
    return null;
  }

  @Override
  public boolean canExecuteInTransaction() {
    return false;
  }
}
