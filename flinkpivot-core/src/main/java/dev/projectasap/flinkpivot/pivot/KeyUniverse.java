/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.pivot;

import dev.projectasap.flinkpivot.datamodel.PivotRecord;
import dev.projectasap.flinkpivot.utils.StreamCollector;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.flink.api.common.functions.MapFunction;
import org.apache.flink.api.common.functions.ReduceFunction;
import org.apache.flink.api.java.functions.KeySelector;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered set of keys that become the output columns of a pivot. Either supplied by the caller,
 * which fixes both membership and column order, or discovered by scanning the input and sorting
 * the distinct keys. Immutable; shipped to every densify task with the function that holds it.
 */
public final class KeyUniverse implements Serializable {
  private static final long serialVersionUID = 1L;
  private static final Logger LOG = LoggerFactory.getLogger(KeyUniverse.class);

  private final List<String> keys;

  private KeyUniverse(List<String> keys) {
    this.keys = Collections.unmodifiableList(new ArrayList<>(keys));
  }

  /**
   * Creates a universe from an explicit key list. Order is kept; repeated keys after the first
   * occurrence are dropped. Keys absent from the data produce all-null columns, and data keys
   * absent from the list are left out of the output.
   *
   * @param keys the keys in output column order
   * @return the universe
   * @throws IllegalArgumentException if the list or any key in it is null
   */
  public static KeyUniverse of(List<String> keys) {
    if (keys == null) {
      throw new IllegalArgumentException("Key list must not be null");
    }
    Set<String> distinct = new LinkedHashSet<>();
    for (String key : keys) {
      if (key == null) {
        throw new IllegalArgumentException("Key universe must not contain null keys");
      }
      if (!distinct.add(key)) {
        LOG.warn("Dropping repeated key '{}' from the key universe", key);
      }
    }
    return new KeyUniverse(new ArrayList<>(distinct));
  }

  /**
   * Scans the whole input for distinct keys and sorts them in ascending lexicographic order. Runs
   * as a separate Flink job and blocks until it finishes.
   *
   * @param records the bounded input relation
   * @return the discovered universe, empty for an empty input
   */
  public static KeyUniverse discover(DataStream<PivotRecord> records) {
    DataStream<String> distinctKeys =
        records
            .map(new KeyProjection())
            .name("project-key")
            .keyBy(new IdentitySelector())
            .reduce(new KeepFirst())
            .name("distinct-keys");

    List<String> collected = StreamCollector.collect(distinctKeys, "Pivot key discovery");
    List<String> sorted = new ArrayList<>(new LinkedHashSet<>(collected));
    Collections.sort(sorted);
    LOG.info("Discovered {} distinct keys", sorted.size());
    return new KeyUniverse(sorted);
  }

  /**
   * Uses the explicit list when one is given, otherwise discovers the keys. An empty explicit
   * list counts as not given.
   *
   * @param records the bounded input relation
   * @param explicitKeys the caller's key list, may be null
   * @return the resolved universe
   */
  public static KeyUniverse resolve(DataStream<PivotRecord> records, List<String> explicitKeys) {
    if (explicitKeys == null || explicitKeys.isEmpty()) {
      return discover(records);
    }
    return of(explicitKeys);
  }

  public List<String> getKeys() {
    return keys;
  }

  public String get(int position) {
    return keys.get(position);
  }

  public int size() {
    return keys.size();
  }

  public boolean isEmpty() {
    return keys.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof KeyUniverse)) {
      return false;
    }
    return keys.equals(((KeyUniverse) o).keys);
  }

  @Override
  public int hashCode() {
    return keys.hashCode();
  }

  @Override
  public String toString() {
    return "KeyUniverse" + keys;
  }

  private static class KeyProjection implements MapFunction<PivotRecord, String> {
    @Override
    public String map(PivotRecord record) {
      return record.validate().key;
    }
  }

  private static class IdentitySelector implements KeySelector<String, String> {
    @Override
    public String getKey(String key) {
      return key;
    }
  }

  private static class KeepFirst implements ReduceFunction<String> {
    @Override
    public String reduce(String first, String second) {
      return first;
    }
  }
}
