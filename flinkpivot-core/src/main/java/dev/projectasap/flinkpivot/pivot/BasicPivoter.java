/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.pivot;

import dev.projectasap.flinkpivot.datamodel.PivotAccumulator;
import org.apache.flink.api.common.functions.ReduceFunction;

/**
 * Pivot without aggregation. Every (index, key) pair must occur at most once; a repeated pair
 * fails the pivot with a {@link dev.projectasap.flinkpivot.errors.DuplicatePivotKeyException}.
 */
public class BasicPivoter extends Pivoter {
  @Override
  protected ReduceFunction<PivotAccumulator> createMerge() {
    return new UniqueKeyMerge();
  }

  @Override
  protected String getName() {
    return "basic";
  }
}
