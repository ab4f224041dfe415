/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.pivot;

import dev.projectasap.flinkpivot.datamodel.PivotAccumulator;
import dev.projectasap.flinkpivot.datamodel.PivotRecord;
import dev.projectasap.flinkpivot.table.PivotInput;
import dev.projectasap.flinkpivot.table.PivotSchema;
import dev.projectasap.flinkpivot.table.PivotTable;
import java.util.List;
import org.apache.flink.api.common.RuntimeExecutionMode;
import org.apache.flink.api.common.functions.ReduceFunction;
import org.apache.flink.configuration.ExecutionOptions;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.types.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wide pivot of a narrow (index, key, value) relation. Records are grouped by index, each group is
 * folded into one key to value map by the merge function of the subclass, and every map is
 * densified into a row with one column per key of the universe.
 *
 * <p>The grouping is a keyed reduce, which emits exactly one result per index only under BATCH
 * execution. The input must be bounded and the environment must not be forced into STREAMING
 * mode.
 */
public abstract class Pivoter {
  private static final Logger LOG = LoggerFactory.getLogger(Pivoter.class);

  /** Merge used to fold the accumulators of one index. Must be pure. */
  protected abstract ReduceFunction<PivotAccumulator> createMerge();

  /** Short name used for operator names and logging. */
  protected abstract String getName();

  /** Pivots with the index column named after the input's second column and discovered keys. */
  public PivotTable pivot(PivotInput input) {
    return pivot(input, null, null);
  }

  /** Pivots with discovered keys. */
  public PivotTable pivot(PivotInput input, String indexColumn) {
    return pivot(input, indexColumn, null);
  }

  /**
   * Pivots the input.
   *
   * @param input the relation to pivot
   * @param indexColumn name of the output index column; null to take the input's second column
   *     name
   * @param keyUniverse output keys in column order; null or empty to discover them from the data
   * @return the pivoted table; rows are computed when the table is collected or executed
   * @throws IllegalArgumentException if no index column name is given and the input is unnamed
   * @throws IllegalStateException if the environment runs in STREAMING mode
   * @throws dev.projectasap.flinkpivot.errors.SchemaViolationException if the output columns clash
   */
  public PivotTable pivot(PivotInput input, String indexColumn, List<String> keyUniverse) {
    DataStream<PivotRecord> records = input.getRecords();
    checkRuntimeMode(records);

    String indexName = resolveIndexColumn(input, indexColumn);
    KeyUniverse universe = KeyUniverse.resolve(records, keyUniverse);
    PivotSchema schema = PivotSchema.forPivot(indexName, universe);
    LOG.info(
        "Building {} pivot on index column '{}' with {} key columns{}",
        getName(),
        indexName,
        universe.size(),
        keyUniverse == null || keyUniverse.isEmpty() ? " (discovered)" : "");

    DataStream<Row> rows =
        records
            .map(new ToAccumulator())
            .name(getName() + "-to-accumulator")
            .keyBy(new IndexKeySelector())
            .reduce(createMerge())
            .name(getName() + "-merge")
            .map(new DensifyFunction(universe))
            .returns(schema.toRowTypeInfo())
            .name(getName() + "-densify");

    return new PivotTable(schema, rows, universe);
  }

  private static String resolveIndexColumn(PivotInput input, String indexColumn) {
    if (indexColumn != null && !indexColumn.isEmpty()) {
      return indexColumn;
    }
    if (input.hasColumnNames()) {
      return input.getColumnNames().get(1);
    }
    throw new IllegalArgumentException(
        "Index column name must be given for an input without column names");
  }

  private static void checkRuntimeMode(DataStream<?> records) {
    RuntimeExecutionMode mode =
        records.getExecutionEnvironment().getConfiguration().get(ExecutionOptions.RUNTIME_MODE);
    if (mode == RuntimeExecutionMode.STREAMING) {
      throw new IllegalStateException(
          "Pivot needs BATCH or AUTOMATIC runtime mode over a bounded input; "
              + "STREAMING mode emits partial rows for every update");
    }
  }
}
