/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.pivot;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;

import org.apache.flink.util.InstantiationUtil;
import org.junit.Test;

public class CombinerTest {
  @Test
  public void testZeroIsIdentityForBuiltIns() {
    for (Combiner combiner :
        new Combiner[] {Combiner.sum(), Combiner.product(), Combiner.min(), Combiner.max()}) {
      assertEquals(combiner.getName(), 3.5, combiner.combine(3.5, combiner.getZero()), 0.0);
      assertEquals(combiner.getName(), -2.0, combiner.combine(combiner.getZero(), -2.0), 0.0);
    }
  }

  @Test
  public void testBuiltInOperators() {
    assertEquals(5.0, Combiner.sum().combine(2.0, 3.0), 0.0);
    assertEquals(6.0, Combiner.product().combine(2.0, 3.0), 0.0);
    assertEquals(2.0, Combiner.min().combine(2.0, 3.0), 0.0);
    assertEquals(3.0, Combiner.max().combine(2.0, 3.0), 0.0);
  }

  @Test
  public void testNamedLookupIgnoresCase() {
    assertEquals("sum", Combiner.named("SUM").getName());
    assertEquals("max", Combiner.named(" max ").getName());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownNameIsRejected() {
    Combiner.named("median");
  }

  @Test
  public void testCustomCombinerSurvivesSerialization() throws Exception {
    Combiner custom = Combiner.of((left, right) -> Math.max(left, right) * 1.0, 0.0);
    Combiner copy = InstantiationUtil.clone(custom);
    assertNotSame(custom, copy);
    assertEquals(4.0, copy.combine(4.0, 1.0), 0.0);
  }

  @Test
  public void testEachCallGetsItsOwnInstance() {
    assertNotSame(Combiner.sum(), Combiner.sum());
  }
}
