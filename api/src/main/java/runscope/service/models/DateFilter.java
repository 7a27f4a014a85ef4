/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import javax.annotation.Nullable;
import lombok.NonNull;

/**
 * A filter on a run timestamp. {@code before} and {@code after} are exclusive, {@code between} is
 * inclusive on both ends and requires {@code value2}.
 */
public record DateFilter(
    @NonNull DateField field,
    @NonNull String operator,
    @NonNull String value,
    @Nullable String value2) {

  public static DateFilter before(DateField field, String value) {
    return new DateFilter(field, "before", value, null);
  }

  public static DateFilter after(DateField field, String value) {
    return new DateFilter(field, "after", value, null);
  }

  public static DateFilter between(DateField field, String from, String to) {
    return new DateFilter(field, "between", from, to);
  }
}
