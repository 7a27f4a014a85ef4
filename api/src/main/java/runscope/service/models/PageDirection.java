/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/** Direction of cursor paging for the default, newest first, ordering. */
public enum PageDirection {
  FORWARD,
  BACKWARD;

  @JsonCreator
  public static PageDirection fromValue(final String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
