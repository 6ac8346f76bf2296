/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;


/**
 * The outcome of analyzing a directory of measurement results.
 */
public class BatchResult {
  private final int _processed;
  private final int _errored;

  public BatchResult(int processed, int errored) {
    _processed = processed;
    _errored = errored;
  }

  /**
   * @return Number of measurement result files analyzed and reported.
   */
  public int processed() {
    return _processed;
  }

  /**
   * @return Number of measurement result files that could not be analyzed.
   */
  public int errored() {
    return _errored;
  }

  @Override
  public String toString() {
    return String.format("{processed=%d, errored=%d}", _processed, _errored);
  }
}
