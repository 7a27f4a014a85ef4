/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.exceptions;

import lombok.Getter;

/** A client-supplied run token is malformed; distinct from a well-formed token with no run. */
public final class InvalidRunIdException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  @Getter private final String token;

  public InvalidRunIdException(final String token) {
    super(String.format("Invalid run identifier '%s'", token));
    this.token = token;
  }

  public InvalidRunIdException(final String token, final Throwable cause) {
    super(String.format("Invalid run identifier '%s'", token), cause);
    this.token = token;
  }
}
