/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import runscope.jobs.BackfillConfig;
import runscope.service.RunQueryConfig;

/** Top level configuration, read from YAML. */
@NoArgsConstructor
@Getter
@Setter
public class RunscopeConfig {
  private static final ObjectMapper YAML =
      new ObjectMapper(new YAMLFactory())
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

  @Valid
  @NotNull
  @JsonProperty("postgres")
  private DatabaseConfig postgres;

  @Valid
  @NotNull
  @JsonProperty("clickhouse")
  private DatabaseConfig clickhouse;

  @Valid
  @JsonProperty("runQuery")
  private RunQueryConfig runQuery = new RunQueryConfig();

  @Valid
  @JsonProperty("backfill")
  private BackfillConfig backfill = new BackfillConfig();

  public static RunscopeConfig load(@NonNull final Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read configuration " + path, e);
    }
  }

  public static RunscopeConfig load(@NonNull final InputStream in) throws IOException {
    final RunscopeConfig config = YAML.readValue(in, RunscopeConfig.class);
    if (config.postgres == null || config.clickhouse == null) {
      throw new IllegalArgumentException("Both 'postgres' and 'clickhouse' must be configured");
    }
    return config;
  }
}
