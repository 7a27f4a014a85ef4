/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import runscope.service.RunQueryConfig;

public class RunscopeConfigTest {

  @Test
  public void testLoad() throws Exception {
    // Given
    RunscopeConfig config;
    try (InputStream in = getClass().getResourceAsStream("/runscope-test.yml")) {
      // When
      config = RunscopeConfig.load(in);
    }

    // Then
    assertThat(config.getPostgres().getUrl()).startsWith("jdbc:postgresql://");
    assertThat(config.getPostgres().isMigrateOnStartup()).isFalse();
    assertThat(config.getClickhouse().getPassword()).isNull();
    assertThat(config.getClickhouse().isMigrateOnStartup()).isTrue();
    assertThat(config.getRunQuery().getMaxPageSize()).isEqualTo(50);
    assertThat(config.getRunQuery().isCacheEnabled()).isFalse();
    assertThat(config.getRunQuery().getMaxOffset()).isEqualTo(RunQueryConfig.DEFAULT_MAX_OFFSET);
    assertThat(config.getBackfill().getBatchSize()).isEqualTo(100);
    assertThat(config.getBackfill().hasBackfillSchedule()).isTrue();
    assertThat(config.getBackfill().getMetricSummaryFrequencyMinutes()).isEqualTo(60);
    assertThat(config.getBackfill().hasMetricSummarySchedule()).isTrue();
  }

  @Test
  public void testStoresAreRequired() {
    InputStream in =
        new ByteArrayInputStream(
            "postgres:\n  url: jdbc:postgresql://db/x\n".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> RunscopeConfig.load(in))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("clickhouse");
  }

  @Test
  public void testDefaults() {
    RunscopeConfig config = new RunscopeConfig();

    assertThat(config.getRunQuery().getMaxPageSize()).isEqualTo(200);
    assertThat(config.getRunQuery().isCacheEnabled()).isTrue();
    assertThat(config.getBackfill().hasBackfillSchedule()).isFalse();
    assertThat(config.getBackfill().hasMetricSummarySchedule()).isFalse();
  }
}
