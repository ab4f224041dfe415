/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.examples.aggregating;

import dev.projectasap.flinkpivot.datamodel.PivotRecord;
import dev.projectasap.flinkpivot.pivot.AggregatingPivoter;
import dev.projectasap.flinkpivot.pivot.Combiner;
import dev.projectasap.flinkpivot.table.PivotInput;
import dev.projectasap.flinkpivot.table.PivotTable;
import java.util.Collections;
import org.apache.flink.api.common.RuntimeExecutionMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.types.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pivots repeated (index, key) pairs, folding their values with a combiner. Runs the default sum
 * and then the max combiner over the same input.
 */
public class AggregatingExample {
  private static final Logger LOG = LoggerFactory.getLogger(AggregatingExample.class);

  public static void main(String[] args) throws Exception {
    StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
    env.setRuntimeMode(RuntimeExecutionMode.BATCH);
    env.setParallelism(2);

    DataStream<PivotRecord> records =
        env.fromElements(
            new PivotRecord("a", "x", 1.0),
            new PivotRecord("a", "x", 4.0),
            new PivotRecord("b", "x", 2.5));
    PivotInput input = PivotInput.fromRecords(records);

    for (Combiner combiner : new Combiner[] {Combiner.sum(), Combiner.max()}) {
      PivotTable table =
          new AggregatingPivoter(combiner).pivot(input, "id", Collections.singletonList("x"));
      LOG.info("Combiner {}: columns {}", combiner.getName(), table.getSchema().getColumnNames());
      for (Row row : table.collect()) {
        LOG.info("{}", row);
      }
    }
  }
}
