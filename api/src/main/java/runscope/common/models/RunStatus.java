/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.common.models;

import java.util.Optional;
import javax.annotation.Nullable;

/** Lifecycle state of a run, mirrored by the {@code run_status} Postgres enum. */
public enum RunStatus {
  RUNNING,
  COMPLETED,
  FAILED,
  TERMINATED,
  CANCELLED;

  public static Optional<RunStatus> fromString(@Nullable final String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (RunStatus status : values()) {
      if (status.name().equalsIgnoreCase(value.trim())) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }
}
