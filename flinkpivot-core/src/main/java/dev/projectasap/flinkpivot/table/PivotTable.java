/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.table;

import dev.projectasap.flinkpivot.pivot.KeyUniverse;
import dev.projectasap.flinkpivot.utils.StreamCollector;
import java.util.List;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.types.Row;

/**
 * Result of a pivot: the output schema, the stream of dense rows typed by that schema, and the key
 * universe the columns were built from. Rows arrive in no particular order.
 */
public class PivotTable {
  private final PivotSchema schema;
  private final DataStream<Row> rows;
  private final KeyUniverse keyUniverse;

  public PivotTable(PivotSchema schema, DataStream<Row> rows, KeyUniverse keyUniverse) {
    this.schema = schema;
    this.rows = rows;
    this.keyUniverse = keyUniverse;
  }

  public PivotSchema getSchema() {
    return schema;
  }

  public DataStream<Row> getRows() {
    return rows;
  }

  /**
   * The universe used for the columns. Passing its keys to a later pivot reproduces the same
   * columns without another discovery pass.
   */
  public KeyUniverse getKeyUniverse() {
    return keyUniverse;
  }

  /**
   * Runs the pivot and collects all rows on the client. Needs a Flink executor on the classpath
   * ({@code flink-clients}, or a Flink cluster runtime).
   *
   * @return the output rows
   * @throws dev.projectasap.flinkpivot.errors.PivotException if the pivot failed
   */
  public List<Row> collect() {
    return StreamCollector.collect(rows, "Pivot");
  }
}
