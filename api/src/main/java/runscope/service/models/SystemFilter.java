/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;
import lombok.NonNull;

/**
 * A filter on a run column: {@code name}, {@code notes}, {@code status}, {@code tags} or {@code
 * creator.name}.
 */
public record SystemFilter(
    @NonNull String field, @NonNull String operator, @Nullable List<String> values) {

  public SystemFilter {
    values = values == null ? ImmutableList.of() : ImmutableList.copyOf(values);
  }

  public static SystemFilter of(String field, String operator, String... values) {
    return new SystemFilter(field, operator, ImmutableList.copyOf(values));
  }
}
