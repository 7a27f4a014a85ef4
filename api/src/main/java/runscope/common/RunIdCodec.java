/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.common;

import java.util.Collections;
import java.util.List;
import lombok.NonNull;
import org.sqids.Sqids;
import runscope.service.exceptions.InvalidRunIdException;

/**
 * Reversible encoding between internal numeric run ids and the short tokens exposed to clients.
 *
 * <p>Decoding only accepts the canonical token for a single id: anything that decodes to zero or
 * several numbers, or that re-encodes differently, is rejected with {@link
 * InvalidRunIdException}.
 */
public final class RunIdCodec {
  private final Sqids sqids;

  public RunIdCodec(@NonNull final String alphabet, final int minLength) {
    this.sqids = Sqids.builder().alphabet(alphabet).minLength(minLength).build();
  }

  public String encode(final long runId) {
    if (runId < 0) {
      throw new IllegalArgumentException("Run ids are non-negative: " + runId);
    }
    return sqids.encode(Collections.singletonList(runId));
  }

  public long decode(@NonNull final String token) {
    final String trimmed = token.trim();
    if (trimmed.isEmpty()) {
      throw new InvalidRunIdException(token);
    }
    final List<Long> decoded;
    try {
      decoded = sqids.decode(trimmed);
    } catch (IllegalArgumentException e) {
      throw new InvalidRunIdException(token, e);
    }
    if (decoded.size() != 1 || !sqids.encode(decoded).equals(trimmed)) {
      throw new InvalidRunIdException(token);
    }
    return decoded.get(0);
  }
}
