/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.errors;

/**
 * Base type for failures raised by the pivot core. All of them abort the pivot; there is no
 * partial output.
 */
public class PivotException extends RuntimeException {
  public PivotException(String message) {
    super(message);
  }

  public PivotException(String message, Throwable cause) {
    super(message, cause);
  }
}
