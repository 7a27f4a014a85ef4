/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;
import lombok.NonNull;
import runscope.common.models.FieldDataType;
import runscope.common.models.FieldSource;

/** A filter on one flattened config or system metadata key. */
public record FieldFilter(
    @NonNull FieldSource source,
    @NonNull String key,
    @NonNull FieldDataType dataType,
    @NonNull String operator,
    @Nullable List<String> values) {

  public FieldFilter {
    values = values == null ? ImmutableList.of() : ImmutableList.copyOf(values);
  }

  public static FieldFilter of(
      FieldSource source, String key, FieldDataType dataType, String operator, String... values) {
    return new FieldFilter(source, key, dataType, operator, ImmutableList.copyOf(values));
  }
}
