/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.pivot;

import dev.projectasap.flinkpivot.datamodel.PivotAccumulator;
import java.util.HashSet;
import java.util.Set;
import org.apache.flink.api.common.functions.ReduceFunction;

/**
 * Merge for the aggregating pivot. For every key on either side the merged value is {@code
 * combine(left.getOrDefault(key, zero), right.getOrDefault(key, zero))}.
 */
public class CombiningMerge implements ReduceFunction<PivotAccumulator> {
  private final Combiner combiner;

  public CombiningMerge(Combiner combiner) {
    this.combiner = combiner;
  }

  @Override
  public PivotAccumulator reduce(PivotAccumulator left, PivotAccumulator right) {
    PivotAccumulator merged = new PivotAccumulator(left.index);

    Set<String> keys = new HashSet<>(left.values.keySet());
    keys.addAll(right.values.keySet());
    double zero = combiner.getZero();
    for (String key : keys) {
      merged.values.put(
          key,
          combiner.combine(
              left.values.getOrDefault(key, zero), right.values.getOrDefault(key, zero)));
    }

    return merged;
  }

  public Combiner getCombiner() {
    return combiner;
  }
}
