/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.errors;

/**
 * Raised by the basic pivot when the same (index, key) pair occurs more than once. Use the
 * aggregating pivot for inputs that may contain duplicates.
 */
public class DuplicatePivotKeyException extends PivotException {
  private final String index;
  private final String key;

  public DuplicatePivotKeyException(String index, String key) {
    super(
        "Duplicate entry for index '"
            + index
            + "' and key '"
            + key
            + "'; the basic pivot requires unique (index, key) pairs");
    this.index = index;
    this.key = key;
  }

  public String getIndex() {
    return index;
  }

  public String getKey() {
    return key;
  }
}
