/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.datamodel;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-index accumulator. Holds the key to value mapping collected so far for one index. Created
 * as a singleton per record and folded together by a merge function while grouping; it never
 * leaves the pivot.
 */
public class PivotAccumulator {
  public String index;
  public Map<String, Double> values;

  public PivotAccumulator() {
    this.index = "";
    this.values = new HashMap<>();
  }

  public PivotAccumulator(String index) {
    this.index = index;
    this.values = new HashMap<>();
  }

  /**
   * Creates the accumulator holding a single record.
   *
   * @param record the record to wrap
   * @return a one-entry accumulator for the record's index
   */
  public static PivotAccumulator of(PivotRecord record) {
    PivotAccumulator acc = new PivotAccumulator(record.index);
    acc.values.put(record.key, record.value);
    return acc;
  }

  /** Returns the value for {@code key}, or null if the key was never seen for this index. */
  public Double get(String key) {
    return values.get(key);
  }

  public boolean contains(String key) {
    return values.containsKey(key);
  }

  public Set<String> getKeySet() {
    return values.keySet();
  }

  public int size() {
    return values.size();
  }

  @Override
  public String toString() {
    return "PivotAccumulator{index='" + index + "', values=" + values + '}';
  }
}
