/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.common.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Getter;

/**
 * Value type of a flattened field. {@code TEXT}, {@code NUMBER} and {@code DATE} are inferred at
 * index time; {@code OPTION} only appears on filters, where it selects set-membership operators
 * over the text value.
 */
public enum FieldDataType {
  TEXT("text"),
  NUMBER("number"),
  DATE("date"),
  OPTION("option");

  @Getter @JsonValue private final String value;

  FieldDataType(final String value) {
    this.value = value;
  }

  public static Optional<FieldDataType> fromString(@Nullable final String value) {
    for (FieldDataType type : values()) {
      if (type.value.equals(value)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  @JsonCreator
  static FieldDataType fromJson(final String value) {
    return fromString(value)
        .orElseThrow(() -> new IllegalArgumentException("Unknown data type: " + value));
  }
}
