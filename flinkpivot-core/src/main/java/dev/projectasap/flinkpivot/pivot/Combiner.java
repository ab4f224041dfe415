/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.pivot;

import java.io.Serializable;
import java.util.Objects;

/**
 * Immutable pairing of a {@link CombineFunction} with its identity element. A key missing on one
 * side of a merge contributes {@code zero}, so {@code function(x, zero)} must equal {@code x}.
 */
public final class Combiner implements Serializable {
  private static final long serialVersionUID = 1L;

  private final String name;
  private final CombineFunction function;
  private final double zero;

  private Combiner(String name, CombineFunction function, double zero) {
    this.name = name;
    this.function = Objects.requireNonNull(function, "function");
    this.zero = zero;
  }

  /** Addition with identity {@code 0.0}. The default for the aggregating pivot. */
  public static Combiner sum() {
    return new Combiner("sum", Double::sum, 0.0);
  }

  /** Multiplication with identity {@code 1.0}. */
  public static Combiner product() {
    return new Combiner("product", (left, right) -> left * right, 1.0);
  }

  /** Minimum with identity {@code +Infinity}. */
  public static Combiner min() {
    return new Combiner("min", Math::min, Double.POSITIVE_INFINITY);
  }

  /** Maximum with identity {@code -Infinity}. */
  public static Combiner max() {
    return new Combiner("max", Math::max, Double.NEGATIVE_INFINITY);
  }

  /**
   * Creates a combiner from a caller-supplied operator.
   *
   * @param function an associative and commutative operator
   * @param zero the identity element of {@code function}
   * @return the combiner
   */
  public static Combiner of(CombineFunction function, double zero) {
    return new Combiner("custom", function, zero);
  }

  /**
   * Resolves a built-in combiner by name, as used in job configuration files.
   *
   * @param name one of {@code sum}, {@code product}, {@code min}, {@code max}
   * @return the matching combiner
   * @throws IllegalArgumentException if the name is unknown
   */
  public static Combiner named(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Combiner name must not be null");
    }
    switch (name.trim().toLowerCase()) {
      case "sum":
        return sum();
      case "product":
        return product();
      case "min":
        return min();
      case "max":
        return max();
      default:
        throw new IllegalArgumentException(
            "Unknown combiner '" + name + "'; expected one of sum, product, min, max");
    }
  }

  public double combine(double left, double right) {
    return function.combine(left, right);
  }

  public double getZero() {
    return zero;
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return "Combiner{name='" + name + "', zero=" + zero + '}';
  }
}
