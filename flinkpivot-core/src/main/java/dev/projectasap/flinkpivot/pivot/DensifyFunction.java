/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.pivot;

import dev.projectasap.flinkpivot.datamodel.PivotAccumulator;
import org.apache.flink.api.common.functions.MapFunction;
import org.apache.flink.types.Row;

/**
 * Turns a grouped accumulator into a fixed-width row: the index followed by one field per key of
 * the universe, in universe order. Keys never seen for the index become null.
 */
public class DensifyFunction implements MapFunction<PivotAccumulator, Row> {
  private final KeyUniverse keyUniverse;

  public DensifyFunction(KeyUniverse keyUniverse) {
    this.keyUniverse = keyUniverse;
  }

  @Override
  public Row map(PivotAccumulator acc) {
    Row row = new Row(keyUniverse.size() + 1);
    row.setField(0, acc.index);
    for (int i = 0; i < keyUniverse.size(); i++) {
      row.setField(i + 1, acc.get(keyUniverse.get(i)));
    }
    return row;
  }
}
