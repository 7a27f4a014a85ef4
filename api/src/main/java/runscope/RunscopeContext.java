/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.dropwizard.lifecycle.Managed;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import runscope.common.RunIdCodec;
import runscope.db.ClickHouseSchema;
import runscope.db.FieldValueDao;
import runscope.db.MetricSummaryDao;
import runscope.db.RunDao;
import runscope.db.RunSearchDao;
import runscope.jobs.FieldValueBackfill;
import runscope.jobs.FieldValueBackfillJob;
import runscope.jobs.MetricSummaryBackfill;
import runscope.jobs.MetricSummaryBackfillJob;
import runscope.service.FieldValueIndexWriter;
import runscope.service.LocalRunQueryCache;
import runscope.service.RunQueryCache;
import runscope.service.RunQueryConfig;
import runscope.service.RunQueryService;

/** Wires stores, DAOs, services and jobs from a {@link RunscopeConfig}. */
@Slf4j
@Getter
public final class RunscopeContext implements Managed {
  public static final String[] MIGRATION_LOCATIONS = {
    "classpath:runscope/db/migration", "classpath:runscope/db/migrations"
  };

  private final Jdbi postgres;
  private final Jdbi clickhouse;
  private final RunQueryService runQueryService;
  private final FieldValueIndexWriter fieldValueIndexWriter;
  private final List<Managed> jobs;
  private final ExecutorService indexExecutor;

  private RunscopeContext(
      @NonNull final RunscopeConfig config, final Jdbi postgres, final Jdbi clickhouse) {
    this.postgres = postgres;
    this.clickhouse = clickhouse;

    final RunQueryConfig queryConfig = config.getRunQuery();
    final RunDao runDao = postgres.onDemand(RunDao.class);
    final RunQueryCache cache =
        queryConfig.isCacheEnabled()
            ? new LocalRunQueryCache(queryConfig.getCacheMaxEntries())
            : RunQueryCache.NOOP;
    this.runQueryService =
        new RunQueryService(
            runDao,
            new RunSearchDao(postgres),
            postgres.onDemand(FieldValueDao.class),
            new MetricSummaryDao(clickhouse),
            new RunIdCodec(queryConfig.getIdAlphabet(), queryConfig.getIdMinLength()),
            cache,
            queryConfig);

    this.indexExecutor =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat("field-index-%d").setDaemon(true).build());
    this.fieldValueIndexWriter = new FieldValueIndexWriter(postgres, indexExecutor);

    final ImmutableList.Builder<Managed> managed = ImmutableList.builder();
    if (config.getBackfill().hasBackfillSchedule()) {
      managed.add(
          new FieldValueBackfillJob(
              new FieldValueBackfill(runDao, fieldValueIndexWriter), config.getBackfill()));
    }
    if (config.getBackfill().hasMetricSummarySchedule()) {
      managed.add(
          new MetricSummaryBackfillJob(
              new MetricSummaryBackfill(clickhouse, config.getBackfill().getBatchSize()),
              config.getBackfill()));
    }
    this.jobs = managed.build();
  }

  /** Connects to both stores, migrating their schemas when configured to. */
  public static RunscopeContext create(@NonNull final RunscopeConfig config) {
    final DatabaseConfig pg = config.getPostgres();
    if (pg.isMigrateOnStartup()) {
      log.info("Migrating relational schema at {}", pg.getUrl());
      Flyway.configure()
          .dataSource(pg.getUrl(), pg.getUser(), pg.getPassword())
          .locations(MIGRATION_LOCATIONS)
          .load()
          .migrate();
    }
    final Jdbi postgres =
        Jdbi.create(pg.getUrl(), pg.getUser(), pg.getPassword())
            .installPlugin(new SqlObjectPlugin())
            .installPlugin(new PostgresPlugin());

    final DatabaseConfig ch = config.getClickhouse();
    final Jdbi clickhouse = Jdbi.create(ch.getUrl(), ch.getUser(), ch.getPassword());
    if (ch.isMigrateOnStartup()) {
      ClickHouseSchema.apply(clickhouse);
    }
    return new RunscopeContext(config, postgres, clickhouse);
  }

  @Override
  public void start() throws Exception {
    for (final Managed job : jobs) {
      job.start();
    }
  }

  @Override
  public void stop() throws Exception {
    for (final Managed job : jobs) {
      job.stop();
    }
    indexExecutor.shutdown();
  }
}
