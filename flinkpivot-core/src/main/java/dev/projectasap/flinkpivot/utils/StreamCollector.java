/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.utils;

import dev.projectasap.flinkpivot.errors.PivotException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.util.CloseableIterator;
import org.apache.flink.util.ExceptionUtils;

/**
 * Runs a bounded stream to completion and brings its elements back to the client. Failures of the
 * Flink job are unwrapped so that pivot errors reach the caller as the exception that was thrown
 * inside the operator.
 */
public final class StreamCollector {
  private StreamCollector() {}

  /**
   * Executes the pipeline ending in {@code stream} and collects every element.
   *
   * @param stream the bounded stream to run
   * @param jobName name of the Flink job
   * @return all elements emitted by the stream, in arrival order
   * @throws PivotException the pivot error that failed the job, or a wrapper for any other failure
   */
  public static <T> List<T> collect(DataStream<T> stream, String jobName) {
    List<T> results = new ArrayList<>();
    try (CloseableIterator<T> iterator = stream.executeAndCollect(jobName)) {
      iterator.forEachRemaining(results::add);
    } catch (Exception e) {
      throw rethrow(jobName, e);
    }
    return results;
  }

  /**
   * Finds the first {@link PivotException} in the cause chain of a job failure.
   *
   * @param jobName name of the failed job, used in the wrapper message
   * @param failure the failure reported by Flink
   * @return the exception to throw
   */
  public static PivotException rethrow(String jobName, Throwable failure) {
    Optional<PivotException> cause = ExceptionUtils.findThrowable(failure, PivotException.class);
    if (cause.isPresent()) {
      return cause.get();
    }
    return new PivotException("Job '" + jobName + "' failed: " + failure.getMessage(), failure);
  }
}
