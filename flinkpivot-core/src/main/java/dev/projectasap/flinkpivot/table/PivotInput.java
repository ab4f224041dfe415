/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.table;

import dev.projectasap.flinkpivot.datamodel.PivotRecord;
import dev.projectasap.flinkpivot.errors.SchemaViolationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.flink.api.common.typeinfo.BasicTypeInfo;
import org.apache.flink.api.common.typeinfo.NumericTypeInfo;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.java.typeutils.RowTypeInfo;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.types.Row;

/**
 * The relation handed to a pivot: a bounded stream of records plus the column names of the source
 * it came from, when it had any. The second column name is the default name of the output index
 * column.
 */
public final class PivotInput {
  private final DataStream<PivotRecord> records;
  private final List<String> columnNames;

  private PivotInput(DataStream<PivotRecord> records, List<String> columnNames) {
    this.records = records;
    this.columnNames = columnNames;
  }

  /** Wraps an unnamed record stream. The caller must name the index column when pivoting. */
  public static PivotInput fromRecords(DataStream<PivotRecord> records) {
    return new PivotInput(records, null);
  }

  /**
   * Wraps a record stream that came from a source with named columns.
   *
   * @param records the records
   * @param columnNames the three source column names, in index, key, value order
   * @throws SchemaViolationException if there are not exactly three non-empty names
   */
  public static PivotInput fromRecords(DataStream<PivotRecord> records, List<String> columnNames) {
    if (columnNames == null || columnNames.size() != 3) {
      throw new SchemaViolationException(
          "Expected exactly 3 column names (index, key, value) but got " + columnNames);
    }
    for (String name : columnNames) {
      if (name == null || name.isEmpty()) {
        throw new SchemaViolationException(
            "Column names must not be null or empty: " + columnNames);
      }
    }
    return new PivotInput(records, Collections.unmodifiableList(new ArrayList<>(columnNames)));
  }

  /**
   * Wraps a row stream. The row type must have exactly three fields: string index, string key,
   * and a numeric or string value. The type is checked here, before any pipeline is built.
   *
   * @param rows the input rows, typed with a {@link RowTypeInfo}
   * @return the input
   * @throws SchemaViolationException if the row type does not have the required shape
   */
  public static PivotInput fromRows(DataStream<Row> rows) {
    TypeInformation<Row> type = rows.getType();
    if (!(type instanceof RowTypeInfo)) {
      throw new SchemaViolationException(
          "Input rows must be typed with a RowTypeInfo, got " + type);
    }
    RowTypeInfo rowType = (RowTypeInfo) type;
    if (rowType.getArity() != 3) {
      throw new SchemaViolationException(
          "Input must have exactly 3 columns (index, key, value) but has "
              + rowType.getArity()
              + ": "
              + rowType);
    }
    String[] names = rowType.getFieldNames();
    requireString(rowType.getTypeAt(0), names[0]);
    requireString(rowType.getTypeAt(1), names[1]);
    TypeInformation<?> valueType = rowType.getTypeAt(2);
    if (!isValueType(valueType)) {
      throw new SchemaViolationException(
          "Value column '" + names[2] + "' must be numeric or string, got " + valueType);
    }

    DataStream<PivotRecord> records = rows.map(new RowToRecord()).name("row-to-record");
    return new PivotInput(records, Collections.unmodifiableList(Arrays.asList(names)));
  }

  private static void requireString(TypeInformation<?> type, String column) {
    if (!BasicTypeInfo.STRING_TYPE_INFO.equals(type)) {
      throw new SchemaViolationException(
          "Column '" + column + "' must be a string, got " + type);
    }
  }

  private static boolean isValueType(TypeInformation<?> type) {
    return type instanceof NumericTypeInfo
        || BasicTypeInfo.BIG_DEC_TYPE_INFO.equals(type)
        || BasicTypeInfo.BIG_INT_TYPE_INFO.equals(type)
        || BasicTypeInfo.STRING_TYPE_INFO.equals(type);
  }

  public DataStream<PivotRecord> getRecords() {
    return records;
  }

  /** Source column names, or null when the input had none. */
  public List<String> getColumnNames() {
    return columnNames;
  }

  public boolean hasColumnNames() {
    return columnNames != null;
  }
}
