/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.probewatch.detector;

import java.util.Set;

/**
 * The interface for an anomaly type.
 */
public interface AnomalyType {

  /**
   * @return The name of the anomaly type as it appears in persisted reports, e.g. {@code latency_spike}.
   */
  String wireName();

  /**
   * @return Human readable description of the condition this anomaly type flags.
   */
  String description();

  /**
   * @return Names of the measurement techniques the anomaly type applies to.
   */
  Set<String> measurementTypes();

  /**
   * @return {@code true} if the anomaly type is derived from round-trip latency, {@code false} otherwise.
   */
  boolean latencyRelated();
}
