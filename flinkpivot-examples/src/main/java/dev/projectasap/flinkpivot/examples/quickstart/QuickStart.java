/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.examples.quickstart;

import dev.projectasap.flinkpivot.datamodel.PivotRecord;
import dev.projectasap.flinkpivot.pivot.BasicPivoter;
import dev.projectasap.flinkpivot.table.PivotInput;
import dev.projectasap.flinkpivot.table.PivotTable;
import java.util.Arrays;
import org.apache.flink.api.common.RuntimeExecutionMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.types.Row;

/** Quick start example pivoting a small narrow table into one column per key. */
public class QuickStart {
  public static void main(String[] args) throws Exception {
    // The pivot needs a bounded input and a BATCH environment
    StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
    env.setRuntimeMode(RuntimeExecutionMode.BATCH);

    // Create a data stream with sample data
    DataStream<PivotRecord> records =
        env.fromElements(
            new PivotRecord("a", "x", 1.0),
            new PivotRecord("a", "y", 2.0),
            new PivotRecord("b", "x", 3.0));
    PivotInput input = PivotInput.fromRecords(records, Arrays.asList("row", "id", "value"));

    BasicPivoter pivoter = new BasicPivoter();

    // Explicit universe: columns come out in the given order
    PivotTable table = pivoter.pivot(input, "id", Arrays.asList("x", "y"));
    printTable(table);

    // Same data with the universe reversed
    table = pivoter.pivot(input, "id", Arrays.asList("y", "x"));
    printTable(table);

    // No universe: keys are discovered and sorted
    table = pivoter.pivot(input);
    printTable(table);
  }

  private static void printTable(PivotTable table) {
    System.out.println(table.getSchema().getColumnNames());
    for (Row row : table.collect()) {
      System.out.println(row);
    }
    System.out.println();
  }
}
