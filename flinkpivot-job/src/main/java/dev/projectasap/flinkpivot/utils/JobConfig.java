/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.utils;

/** Configuration for the pivot job. Contains the pivot and input configurations. */
public class JobConfig {
  public PivotConfig pivotConfig = new PivotConfig();
  public InputConfig inputConfig = new InputConfig();
}
