/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.exceptions;

public final class RunNotFoundException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public RunNotFoundException(final String token) {
    super(String.format("Run '%s' not found", token));
  }
}
