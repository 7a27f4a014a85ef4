/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.common.models;

import com.fasterxml.jackson.databind.JsonNode;
import javax.annotation.Nullable;
import lombok.NonNull;
import runscope.common.Utils;

/** A leaf of a run JSON document addressed by its dot-joined path. */
public record FlattenedField(
    @NonNull String key, @NonNull JsonNode value, @NonNull FieldDataType dataType) {

  /** Textual form stored in {@code run_field_values.text_value}; {@code null} for JSON null. */
  @Nullable
  public String textValue() {
    if (value.isNull() || value.isMissingNode()) {
      return null;
    }
    if (value.isValueNode()) {
      return value.asText();
    }
    return Utils.toJson(value);
  }

  /** Parsed number stored in {@code run_field_values.numeric_value}, only for numeric leaves. */
  @Nullable
  public Double numericValue() {
    return dataType == FieldDataType.NUMBER ? value.doubleValue() : null;
  }
}
