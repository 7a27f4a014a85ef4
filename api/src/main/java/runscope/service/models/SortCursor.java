/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import com.google.common.primitives.Longs;
import lombok.NonNull;
import runscope.service.exceptions.InvalidPageTokenException;

/**
 * Position after the last run of a keyset page, written as {@code "<value>::<id>"}. The value may
 * itself contain {@code ::}, so the token is split at the last separator.
 */
public record SortCursor(@NonNull String value, long id) {
  static final String SEPARATOR = "::";

  public static SortCursor parse(@NonNull final String token) {
    final int split = token.lastIndexOf(SEPARATOR);
    if (split < 0) {
      throw new InvalidPageTokenException("Malformed sort cursor: " + token);
    }
    final Long id = Longs.tryParse(token.substring(split + SEPARATOR.length()));
    if (id == null) {
      throw new InvalidPageTokenException("Malformed run id in sort cursor: " + token);
    }
    return new SortCursor(token.substring(0, split), id);
  }

  public String encode() {
    return value + SEPARATOR + id;
  }
}
