/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.pivot;

import java.io.Serializable;

/**
 * Binary operator used to resolve duplicate (index, key) values. Implementations must be
 * associative and commutative: partial results are combined in whatever order and tree shape the
 * parallel reduce happens to use. This cannot be checked at runtime.
 */
@FunctionalInterface
public interface CombineFunction extends Serializable {
  double combine(double left, double right);
}
