/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.datamodel;

import dev.projectasap.flinkpivot.errors.ValueCoercionException;

/** Coercion of raw input values to the double value domain of the pivot. */
public final class Values {
  private Values() {}

  /**
   * Converts a raw value to a double. Numbers are widened, strings are parsed.
   *
   * @param raw the value read from the input
   * @return the value as a double
   * @throws ValueCoercionException if the value is null, not a number, or an unparsable string
   */
  public static double toDouble(Object raw) {
    if (raw == null) {
      throw new ValueCoercionException("Cannot coerce null to a double value");
    }
    if (raw instanceof Number) {
      return ((Number) raw).doubleValue();
    }
    if (raw instanceof String) {
      String text = ((String) raw).trim();
      try {
        return Double.parseDouble(text);
      } catch (NumberFormatException e) {
        throw new ValueCoercionException("Cannot coerce '" + raw + "' to a double value", e);
      }
    }
    throw new ValueCoercionException(
        "Cannot coerce value of type " + raw.getClass().getName() + " to a double value");
  }
}
