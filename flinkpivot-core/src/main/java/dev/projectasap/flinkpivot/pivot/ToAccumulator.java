/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.pivot;

import dev.projectasap.flinkpivot.datamodel.PivotAccumulator;
import dev.projectasap.flinkpivot.datamodel.PivotRecord;
import org.apache.flink.api.common.functions.MapFunction;

/** Wraps each validated record into a one-entry accumulator for its index. */
public class ToAccumulator implements MapFunction<PivotRecord, PivotAccumulator> {
  @Override
  public PivotAccumulator map(PivotRecord record) {
    return PivotAccumulator.of(record.validate());
  }
}
