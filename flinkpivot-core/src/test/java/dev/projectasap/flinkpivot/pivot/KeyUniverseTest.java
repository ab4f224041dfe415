/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.pivot;

import static dev.projectasap.flinkpivot.utils.PivotTestUtils.batchEnv;
import static dev.projectasap.flinkpivot.utils.PivotTestUtils.record;
import static dev.projectasap.flinkpivot.utils.PivotTestUtils.records;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.junit.Test;

public class KeyUniverseTest {
  @Test
  public void testExplicitKeysKeepCallerOrder() {
    KeyUniverse universe = KeyUniverse.of(Arrays.asList("y", "x", "w"));
    assertEquals(Arrays.asList("y", "x", "w"), universe.getKeys());
  }

  @Test
  public void testExplicitKeysAreDeduplicated() {
    KeyUniverse universe = KeyUniverse.of(Arrays.asList("y", "x", "y"));
    assertEquals(Arrays.asList("y", "x"), universe.getKeys());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNullKeyIsRejected() {
    KeyUniverse.of(Arrays.asList("x", null));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testKeysAreImmutable() {
    KeyUniverse.of(Arrays.asList("x")).getKeys().add("y");
  }

  @Test
  public void testDiscoverySortsDistinctKeys() {
    StreamExecutionEnvironment env = batchEnv(2);
    KeyUniverse universe =
        KeyUniverse.discover(
            records(
                env,
                record("a", "b", 1.0),
                record("a", "C", 1.0),
                record("b", "a", 1.0),
                record("c", "b", 1.0)));
    assertEquals(Arrays.asList("C", "a", "b"), universe.getKeys());
  }

  @Test
  public void testDiscoveryOnEmptyInput() {
    assertTrue(KeyUniverse.discover(records(batchEnv(1))).isEmpty());
  }

  @Test
  public void testEmptyExplicitListFallsBackToDiscovery() {
    StreamExecutionEnvironment env = batchEnv(1);
    KeyUniverse universe =
        KeyUniverse.resolve(
            records(env, record("a", "y", 1.0), record("a", "x", 1.0)), Collections.emptyList());
    assertEquals(Arrays.asList("x", "y"), universe.getKeys());
  }
}
