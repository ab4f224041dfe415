/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.datamodel;

import dev.projectasap.flinkpivot.errors.SchemaViolationException;
import dev.projectasap.flinkpivot.errors.ValueCoercionException;
import java.util.Objects;

/**
 * A single narrow record: the index it is grouped by, the key that becomes an output column, and
 * its value. Used as the input unit of every pivot.
 */
public class PivotRecord {
  public String index;
  public String key;
  public Double value;

  /** Default constructor required for Flink POJO serialization. */
  public PivotRecord() {
    this.index = "";
    this.key = "";
    this.value = 0.0;
  }

  /**
   * Constructs a PivotRecord with specified values.
   *
   * @param index the grouping index
   * @param key the pivoted key
   * @param value the value
   */
  public PivotRecord(String index, String key, Double value) {
    this.index = index;
    this.key = key;
    this.value = value;
  }

  /**
   * Checks the record shape once at the pivot boundary.
   *
   * @return this record
   * @throws SchemaViolationException if the index or key is null
   * @throws ValueCoercionException if the value is null
   */
  public PivotRecord validate() {
    if (index == null) {
      throw new SchemaViolationException("Record has a null index: " + this);
    }
    if (key == null) {
      throw new SchemaViolationException("Record has a null key: " + this);
    }
    if (value == null) {
      throw new ValueCoercionException("Record has a null value: " + this);
    }
    return this;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PivotRecord)) {
      return false;
    }
    PivotRecord that = (PivotRecord) o;
    return Objects.equals(index, that.index)
        && Objects.equals(key, that.key)
        && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(index, key, value);
  }

  @Override
  public String toString() {
    return "PivotRecord{"
        + "index='"
        + index
        + '\''
        + ", key='"
        + key
        + '\''
        + ", value="
        + value
        + '}';
  }
}
