/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.utils;

import java.io.Serializable;

/** Layout of CSV input files. */
public class InputConfig implements Serializable {
  public char delimiter = ',';
  public boolean header = true;
}
