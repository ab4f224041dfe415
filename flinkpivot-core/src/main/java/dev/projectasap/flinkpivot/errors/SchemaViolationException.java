/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.errors;

/**
 * Raised when the input relation is not an (index: string, key: string, value: numeric) triple,
 * or when the output schema cannot be assembled.
 */
public class SchemaViolationException extends PivotException {
  public SchemaViolationException(String message) {
    super(message);
  }

  public SchemaViolationException(String message, Throwable cause) {
    super(message, cause);
  }
}
