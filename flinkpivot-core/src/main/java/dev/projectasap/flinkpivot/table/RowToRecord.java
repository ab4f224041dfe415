/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.table;

import dev.projectasap.flinkpivot.datamodel.PivotRecord;
import dev.projectasap.flinkpivot.datamodel.Values;
import dev.projectasap.flinkpivot.errors.SchemaViolationException;
import org.apache.flink.api.common.functions.MapFunction;
import org.apache.flink.types.Row;

/** Converts a three-field row into a {@link PivotRecord}, coercing the value to a double. */
public class RowToRecord implements MapFunction<Row, PivotRecord> {
  @Override
  public PivotRecord map(Row row) {
    if (row.getArity() != 3) {
      throw new SchemaViolationException(
          "Expected a row with 3 fields (index, key, value) but got " + row.getArity());
    }
    Object index = row.getField(0);
    Object key = row.getField(1);
    if (index != null && !(index instanceof String)) {
      throw new SchemaViolationException("Index field must be a string: " + row);
    }
    if (key != null && !(key instanceof String)) {
      throw new SchemaViolationException("Key field must be a string: " + row);
    }
    PivotRecord record =
        new PivotRecord((String) index, (String) key, Values.toDouble(row.getField(2)));
    return record.validate();
  }
}
