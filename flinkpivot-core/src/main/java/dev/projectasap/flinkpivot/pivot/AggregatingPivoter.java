/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.pivot;

import dev.projectasap.flinkpivot.datamodel.PivotAccumulator;
import java.util.Objects;
import org.apache.flink.api.common.functions.ReduceFunction;

/**
 * Pivot that resolves repeated (index, key) pairs with a {@link Combiner}. The result for a cell
 * is the fold of all its values under the combiner, whatever order the parallel reduce uses,
 * provided the combiner is associative and commutative.
 */
public class AggregatingPivoter extends Pivoter {
  private final Combiner combiner;

  /** Creates a pivoter that sums repeated values. */
  public AggregatingPivoter() {
    this(Combiner.sum());
  }

  public AggregatingPivoter(Combiner combiner) {
    this.combiner = Objects.requireNonNull(combiner, "combiner");
  }

  @Override
  protected ReduceFunction<PivotAccumulator> createMerge() {
    return new CombiningMerge(combiner);
  }

  @Override
  protected String getName() {
    return "aggregating";
  }

  public Combiner getCombiner() {
    return combiner;
  }
}
