/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JDBC connection settings of one store. */
@NoArgsConstructor
@Getter
@Setter
public class DatabaseConfig {
  @NotEmpty
  @JsonProperty("url")
  private String url;

  @Nullable
  @JsonProperty("user")
  private String user;

  @Nullable
  @JsonProperty("password")
  private String password;

  /** Whether to bring the schema up to date when the application starts. */
  @JsonProperty("migrateOnStartup")
  private boolean migrateOnStartup = true;

  public DatabaseConfig(
      final String url, @Nullable final String user, @Nullable final String password) {
    this.url = url;
    this.user = user;
    this.password = password;
  }
}
