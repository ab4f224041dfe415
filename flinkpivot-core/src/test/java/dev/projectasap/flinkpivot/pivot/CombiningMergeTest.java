/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.pivot;

import static org.junit.Assert.assertEquals;

import dev.projectasap.flinkpivot.datamodel.PivotAccumulator;
import dev.projectasap.flinkpivot.datamodel.PivotRecord;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class CombiningMergeTest {
  private static PivotAccumulator single(String key, double value) {
    return PivotAccumulator.of(new PivotRecord("a", key, value));
  }

  @Test
  public void testValuesOfTheSameKeyAreSummed() {
    CombiningMerge merge = new CombiningMerge(Combiner.sum());
    PivotAccumulator merged = merge.reduce(single("x", 1.0), single("x", 4.0));
    assertEquals(Double.valueOf(5.0), merged.get("x"));
  }

  @Test
  public void testKeyOnOneSideIsCombinedWithZero() {
    CombiningMerge merge = new CombiningMerge(Combiner.max());
    PivotAccumulator merged = merge.reduce(single("x", -3.0), single("y", -7.0));
    assertEquals(Double.valueOf(-3.0), merged.get("x"));
    assertEquals(Double.valueOf(-7.0), merged.get("y"));
  }

  @Test
  public void testResultDoesNotDependOnMergeTreeShape() {
    CombiningMerge merge = new CombiningMerge(Combiner.sum());
    List<PivotAccumulator> parts = new ArrayList<>();
    double[] xs = {1.0, 2.0, 4.0, 8.0, 16.0, 32.0};
    for (int i = 0; i < xs.length; i++) {
      parts.add(single(i % 2 == 0 ? "x" : "y", xs[i]));
    }

    // left fold
    PivotAccumulator leftFold = parts.get(0);
    for (int i = 1; i < parts.size(); i++) {
      leftFold = merge.reduce(leftFold, parts.get(i));
    }

    // right fold
    PivotAccumulator rightFold = parts.get(parts.size() - 1);
    for (int i = parts.size() - 2; i >= 0; i--) {
      rightFold = merge.reduce(parts.get(i), rightFold);
    }

    // balanced tree
    PivotAccumulator tree =
        merge.reduce(
            merge.reduce(merge.reduce(parts.get(0), parts.get(1)), parts.get(2)),
            merge.reduce(parts.get(3), merge.reduce(parts.get(4), parts.get(5))));

    for (PivotAccumulator result : new PivotAccumulator[] {leftFold, rightFold, tree}) {
      assertEquals(Double.valueOf(1.0 + 4.0 + 16.0), result.get("x"));
      assertEquals(Double.valueOf(2.0 + 8.0 + 32.0), result.get("y"));
      assertEquals(2, result.size());
    }
  }
}
