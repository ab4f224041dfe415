/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.table;

import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;

/** Column types a pivoted table can hold. */
public enum ColumnType {
  STRING(Types.STRING),
  DOUBLE(Types.DOUBLE);

  private final TypeInformation<?> typeInfo;

  ColumnType(TypeInformation<?> typeInfo) {
    this.typeInfo = typeInfo;
  }

  /** Flink type used for this column in the row type. */
  public TypeInformation<?> getTypeInfo() {
    return typeInfo;
  }
}
