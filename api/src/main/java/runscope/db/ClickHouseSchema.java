/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.jdbi.v3.core.Jdbi;

/**
 * Creates the ClickHouse tables the metric queries read. Each script holds one idempotent
 * statement, applied in order.
 */
@Slf4j
public final class ClickHouseSchema {
  static final List<String> SCRIPTS =
      ImmutableList.of(
          "runscope/clickhouse/001_mlop_metrics.sql",
          "runscope/clickhouse/002_mlop_metric_summaries.sql",
          "runscope/clickhouse/003_mlop_metric_summaries_mv.sql");

  private ClickHouseSchema() {}

  public static void apply(@NonNull final Jdbi jdbi) {
    jdbi.useHandle(
        handle -> {
          for (final String script : SCRIPTS) {
            log.info("Applying ClickHouse script {}", script);
            handle.execute(load(script));
          }
        });
  }

  static String load(final String script) {
    try {
      return Resources.toString(Resources.getResource(script), UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + script, e);
    }
  }
}
