/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.sources;

import org.apache.flink.api.common.functions.FilterFunction;

/** Drops blank lines and, when a header is known, every copy of the header line. */
public class DataLineFilter implements FilterFunction<String> {
  private final String headerLine;

  public DataLineFilter(String headerLine) {
    this.headerLine = headerLine;
  }

  @Override
  public boolean filter(String line) {
    if (line.trim().isEmpty()) {
      return false;
    }
    return headerLine == null || !headerLine.equals(line);
  }
}
