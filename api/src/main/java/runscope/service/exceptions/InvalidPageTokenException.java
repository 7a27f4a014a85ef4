/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.exceptions;

/** A continuation token echoed back by a client does not have the shape its strategy issues. */
public final class InvalidPageTokenException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public InvalidPageTokenException(final String message) {
    super(message);
  }

  public InvalidPageTokenException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
