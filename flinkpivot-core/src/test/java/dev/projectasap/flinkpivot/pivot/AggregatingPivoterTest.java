/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.pivot;

import static dev.projectasap.flinkpivot.utils.PivotTestUtils.batchEnv;
import static dev.projectasap.flinkpivot.utils.PivotTestUtils.byIndex;
import static dev.projectasap.flinkpivot.utils.PivotTestUtils.record;
import static dev.projectasap.flinkpivot.utils.PivotTestUtils.records;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import dev.projectasap.flinkpivot.datamodel.PivotRecord;
import dev.projectasap.flinkpivot.errors.ValueCoercionException;
import dev.projectasap.flinkpivot.table.PivotInput;
import dev.projectasap.flinkpivot.table.PivotTable;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.Test;

public class AggregatingPivoterTest {
  @Test
  public void testDuplicatesAreSummedByDefault() {
    PivotInput input =
        PivotInput.fromRecords(
            records(batchEnv(2), record("a", "x", 1.0), record("a", "x", 4.0)));
    PivotTable table = new AggregatingPivoter().pivot(input, "id", Arrays.asList("x"));

    Map<String, List<Double>> rows = byIndex(table.collect());
    assertEquals(1, rows.size());
    assertEquals(Arrays.asList(5.0), rows.get("a"));
  }

  @Test(expected = ValueCoercionException.class)
  public void testNullValueFailsThePivot() {
    PivotInput input =
        PivotInput.fromRecords(
            records(batchEnv(2), new PivotRecord("a", "x", null), record("a", "x", 1.0)));
    new AggregatingPivoter().pivot(input, "id", Arrays.asList("x")).collect();
  }

  @Test
  public void testUniqueInputMatchesBasicPivot() {
    PivotRecord[] input = {record("a", "x", 1.0), record("a", "y", 2.0), record("b", "x", 3.0)};
    PivotTable aggregated =
        new AggregatingPivoter().pivot(PivotInput.fromRecords(records(batchEnv(2), input)), "id");
    PivotTable basic =
        new BasicPivoter().pivot(PivotInput.fromRecords(records(batchEnv(2), input)), "id");

    assertEquals(basic.getSchema(), aggregated.getSchema());
    assertEquals(byIndex(basic.collect()), byIndex(aggregated.collect()));
  }

  @Test
  public void testMaxCombinerWithMissingCells() {
    PivotInput input =
        PivotInput.fromRecords(
            records(
                batchEnv(3),
                record("a", "x", -5.0),
                record("a", "x", -2.0),
                record("a", "x", -9.0),
                record("b", "y", 1.0)));
    PivotTable table =
        new AggregatingPivoter(Combiner.max()).pivot(input, "id", Arrays.asList("x", "y"));

    Map<String, List<Double>> rows = byIndex(table.collect());
    assertEquals(Double.valueOf(-2.0), rows.get("a").get(0));
    assertNull(rows.get("a").get(1));
    assertNull(rows.get("b").get(0));
    assertEquals(Double.valueOf(1.0), rows.get("b").get(1));
  }

  @Test
  public void testResultIsIndependentOfParallelism() {
    Random random = new Random(7L);
    PivotRecord[] input = new PivotRecord[500];
    Map<String, Double> expected = new HashMap<>();
    for (int i = 0; i < input.length; i++) {
      String index = "i" + random.nextInt(20);
      String key = "k" + random.nextInt(6);
      // small integers keep the sums exact regardless of addition order
      double value = random.nextInt(100);
      input[i] = record(index, key, value);
      expected.merge(index + "/" + key, value, Double::sum);
    }

    Map<String, List<Double>> sequential = null;
    for (int parallelism : new int[] {1, 4}) {
      PivotTable table =
          new AggregatingPivoter()
              .pivot(PivotInput.fromRecords(records(batchEnv(parallelism), input)), "id");
      Map<String, List<Double>> rows = byIndex(table.collect());
      List<String> keys = table.getKeyUniverse().getKeys();

      for (Map.Entry<String, List<Double>> row : rows.entrySet()) {
        for (int k = 0; k < keys.size(); k++) {
          assertEquals(expected.get(row.getKey() + "/" + keys.get(k)), row.getValue().get(k));
        }
      }
      if (sequential == null) {
        sequential = rows;
      } else {
        assertEquals(sequential, rows);
      }
    }
  }

  @Test
  public void testCustomCombiner() {
    PivotInput input =
        PivotInput.fromRecords(
            records(
                batchEnv(2),
                record("a", "x", 2.0),
                record("a", "x", 3.0),
                record("a", "x", 4.0)));
    PivotTable table =
        new AggregatingPivoter(Combiner.of((left, right) -> left * right, 1.0))
            .pivot(input, "id", Arrays.asList("x"));
    assertEquals(Arrays.asList(24.0), byIndex(table.collect()).get("a"));
  }
}
