/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.errors;

/** Raised when a record value cannot be converted to a double. */
public class ValueCoercionException extends PivotException {
  public ValueCoercionException(String message) {
    super(message);
  }

  public ValueCoercionException(String message, Throwable cause) {
    super(message, cause);
  }
}
