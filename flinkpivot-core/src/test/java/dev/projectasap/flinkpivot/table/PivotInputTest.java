/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.table;

import static dev.projectasap.flinkpivot.utils.PivotTestUtils.batchEnv;
import static dev.projectasap.flinkpivot.utils.PivotTestUtils.byIndex;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import dev.projectasap.flinkpivot.datamodel.PivotRecord;
import dev.projectasap.flinkpivot.errors.SchemaViolationException;
import dev.projectasap.flinkpivot.errors.ValueCoercionException;
import dev.projectasap.flinkpivot.pivot.AggregatingPivoter;
import dev.projectasap.flinkpivot.pivot.BasicPivoter;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.api.java.typeutils.RowTypeInfo;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.types.Row;
import org.junit.Test;

public class PivotInputTest {
  private static DataStream<Row> rows(
      StreamExecutionEnvironment env, RowTypeInfo type, Row... rows) {
    return env.fromCollection(Arrays.asList(rows), type);
  }

  private static RowTypeInfo rowType(TypeInformation<?> valueType) {
    return new RowTypeInfo(
        new TypeInformation<?>[] {Types.STRING, Types.STRING, valueType},
        new String[] {"sample", "gene", "expression"});
  }

  @Test
  public void testRowsWithNamedColumns() {
    StreamExecutionEnvironment env = batchEnv(2);
    PivotInput input =
        PivotInput.fromRows(
            rows(
                env,
                rowType(Types.INT),
                Row.of("s1", "g1", 1),
                Row.of("s1", "g2", 2),
                Row.of("s2", "g1", 3)));

    assertEquals(Arrays.asList("sample", "gene", "expression"), input.getColumnNames());

    PivotTable table = new BasicPivoter().pivot(input);
    // index column defaults to the second input column name
    assertEquals(Arrays.asList("gene", "g1", "g2"), table.getSchema().getColumnNames());
    Map<String, List<Double>> result = byIndex(table.collect());
    assertEquals(Arrays.asList(1.0, 2.0), result.get("s1"));
    assertEquals(Arrays.asList(3.0, null), result.get("s2"));
  }

  @Test
  public void testStringValuesAreCoerced() {
    PivotInput input =
        PivotInput.fromRows(
            rows(
                batchEnv(1),
                rowType(Types.STRING),
                Row.of("s1", "g1", "1.5"),
                Row.of("s1", "g1", "2.5")));

    PivotTable table = new AggregatingPivoter().pivot(input, "id", Arrays.asList("g1"));
    assertEquals(Arrays.asList(4.0), byIndex(table.collect()).get("s1"));
  }

  @Test
  public void testUncoercibleValueAbortsThePivot() {
    PivotInput input =
        PivotInput.fromRows(
            rows(
                batchEnv(1),
                rowType(Types.STRING),
                Row.of("s1", "g1", "1.5"),
                Row.of("s2", "g1", "high")));
    try {
      new BasicPivoter().pivot(input, "id", Arrays.asList("g1")).collect();
      fail("Expected the non-numeric value to abort the pivot");
    } catch (ValueCoercionException e) {
      assertTrue(e.getMessage().contains("high"));
    }
  }

  @Test(expected = SchemaViolationException.class)
  public void testWrongArityIsRejectedBeforeRunning() {
    RowTypeInfo twoColumns =
        new RowTypeInfo(
            new TypeInformation<?>[] {Types.STRING, Types.DOUBLE}, new String[] {"id", "value"});
    PivotInput.fromRows(rows(batchEnv(1), twoColumns, Row.of("a", 1.0)));
  }

  @Test(expected = SchemaViolationException.class)
  public void testNonStringKeyColumnIsRejected() {
    RowTypeInfo intKey =
        new RowTypeInfo(
            new TypeInformation<?>[] {Types.STRING, Types.INT, Types.DOUBLE},
            new String[] {"id", "key", "value"});
    PivotInput.fromRows(rows(batchEnv(1), intKey, Row.of("a", 1, 1.0)));
  }

  @Test(expected = SchemaViolationException.class)
  public void testBooleanValueColumnIsRejected() {
    PivotInput.fromRows(rows(batchEnv(1), rowType(Types.BOOLEAN), Row.of("a", "x", true)));
  }

  @Test(expected = SchemaViolationException.class)
  public void testRecordInputNeedsThreeColumnNames() {
    PivotInput.fromRecords(
        batchEnv(1).fromElements(new PivotRecord()),
        Arrays.asList("only", "two"));
  }

  @Test(expected = SchemaViolationException.class)
  public void testNullColumnNameIsRejected() {
    PivotInput.fromRecords(
        batchEnv(1).fromElements(new PivotRecord()), Arrays.asList("row", null, "value"));
  }
}
