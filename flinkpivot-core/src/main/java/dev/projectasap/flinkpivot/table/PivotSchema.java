/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.table;

import dev.projectasap.flinkpivot.errors.SchemaViolationException;
import dev.projectasap.flinkpivot.pivot.KeyUniverse;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.java.typeutils.RowTypeInfo;

/**
 * Column layout of a pivoted table: a non-null string index column followed by one nullable
 * double column per key of the universe, in universe order.
 */
public final class PivotSchema implements Serializable {
  private static final long serialVersionUID = 1L;

  private final List<ColumnSpec> columns;

  public PivotSchema(List<ColumnSpec> columns) {
    Set<String> seen = new HashSet<>();
    for (ColumnSpec column : columns) {
      if (!seen.add(column.getName())) {
        throw new SchemaViolationException(
            "Duplicate column name '" + column.getName() + "' in pivot schema");
      }
    }
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
  }

  /**
   * Builds the schema of a pivot over {@code keyUniverse}.
   *
   * @param indexColumn name of the index column
   * @param keyUniverse the keys that become columns
   * @return the schema
   * @throws SchemaViolationException if the index column name equals one of the keys
   */
  public static PivotSchema forPivot(String indexColumn, KeyUniverse keyUniverse) {
    List<ColumnSpec> columns = new ArrayList<>(keyUniverse.size() + 1);
    columns.add(new ColumnSpec(indexColumn, ColumnType.STRING, false));
    for (String key : keyUniverse.getKeys()) {
      columns.add(new ColumnSpec(key, ColumnType.DOUBLE, true));
    }
    return new PivotSchema(columns);
  }

  public List<ColumnSpec> getColumns() {
    return columns;
  }

  public ColumnSpec getColumn(int position) {
    return columns.get(position);
  }

  public String getIndexColumn() {
    return columns.get(0).getName();
  }

  public List<String> getColumnNames() {
    List<String> names = new ArrayList<>(columns.size());
    for (ColumnSpec column : columns) {
      names.add(column.getName());
    }
    return names;
  }

  public int size() {
    return columns.size();
  }

  /** Named Flink row type matching this schema, for typing the output stream. */
  public RowTypeInfo toRowTypeInfo() {
    TypeInformation<?>[] types = new TypeInformation<?>[columns.size()];
    String[] names = new String[columns.size()];
    for (int i = 0; i < columns.size(); i++) {
      types[i] = columns.get(i).getType().getTypeInfo();
      names[i] = columns.get(i).getName();
    }
    return new RowTypeInfo(types, names);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PivotSchema)) {
      return false;
    }
    return columns.equals(((PivotSchema) o).columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return "PivotSchema" + columns;
  }
}
