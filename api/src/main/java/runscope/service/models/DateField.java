/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

public enum DateField {
  CREATED_AT("createdAt"),
  UPDATED_AT("updatedAt"),
  STATUS_UPDATED("statusUpdated");

  @Getter @JsonValue private final String value;

  DateField(final String value) {
    this.value = value;
  }

  @JsonCreator
  public static DateField fromValue(final String value) {
    for (final DateField field : values()) {
      if (field.value.equals(value)) {
        return field;
      }
    }
    throw new IllegalArgumentException("Unknown date field: " + value);
  }
}
