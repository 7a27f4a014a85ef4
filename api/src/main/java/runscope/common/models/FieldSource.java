/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.common.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.NonNull;

/** The run JSON document a flattened field was read from. */
public enum FieldSource {
  CONFIG("config"),
  SYSTEM_METADATA("systemMetadata");

  @Getter @JsonValue private final String value;

  FieldSource(final String value) {
    this.value = value;
  }

  @JsonCreator
  public static FieldSource fromValue(@NonNull final String value) {
    for (FieldSource source : values()) {
      if (source.value.equals(value)) {
        return source;
      }
    }
    throw new IllegalArgumentException("Unknown field source: " + value);
  }
}
