/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.pivot;

import dev.projectasap.flinkpivot.datamodel.PivotAccumulator;
import dev.projectasap.flinkpivot.errors.DuplicatePivotKeyException;
import java.util.Map;
import org.apache.flink.api.common.functions.ReduceFunction;

/**
 * Merge for the basic pivot: the union of two accumulators of the same index. A key present on
 * both sides means the input repeated an (index, key) pair, which fails the pivot.
 */
public class UniqueKeyMerge implements ReduceFunction<PivotAccumulator> {
  @Override
  public PivotAccumulator reduce(PivotAccumulator left, PivotAccumulator right) {
    PivotAccumulator merged = new PivotAccumulator(left.index);
    merged.values.putAll(left.values);

    for (Map.Entry<String, Double> entry : right.values.entrySet()) {
      if (merged.values.containsKey(entry.getKey())) {
        throw new DuplicatePivotKeyException(left.index, entry.getKey());
      }
      merged.values.put(entry.getKey(), entry.getValue());
    }

    return merged;
  }
}
