/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.pivot;

import dev.projectasap.flinkpivot.datamodel.PivotAccumulator;
import org.apache.flink.api.java.functions.KeySelector;

/** Partitions accumulators by the index they belong to. */
public class IndexKeySelector implements KeySelector<PivotAccumulator, String> {
  @Override
  public String getKey(PivotAccumulator acc) {
    return acc.index;
  }
}
