/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

public enum SortDirection {
  ASC,
  DESC;

  public String sql() {
    return name();
  }

  @JsonCreator
  public static SortDirection fromValue(final String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
