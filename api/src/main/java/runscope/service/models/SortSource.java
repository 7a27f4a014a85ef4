/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;
import lombok.Getter;
import runscope.common.models.FieldSource;

public enum SortSource {
  SYSTEM("system"),
  CONFIG("config"),
  SYSTEM_METADATA("systemMetadata"),
  METRIC("metric");

  @Getter @JsonValue private final String value;

  SortSource(final String value) {
    this.value = value;
  }

  /** The flattened field source this sort reads from, if it sorts on a JSON field. */
  public Optional<FieldSource> fieldSource() {
    switch (this) {
      case CONFIG:
        return Optional.of(FieldSource.CONFIG);
      case SYSTEM_METADATA:
        return Optional.of(FieldSource.SYSTEM_METADATA);
      default:
        return Optional.empty();
    }
  }

  @JsonCreator
  public static SortSource fromValue(final String value) {
    for (final SortSource source : values()) {
      if (source.value.equals(value)) {
        return source;
      }
    }
    throw new IllegalArgumentException("Unknown sort source: " + value);
  }
}
