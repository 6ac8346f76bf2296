/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.probewatch.detector;

import java.util.Map;

/**
 * The interface for an anomaly.
 */
public interface Anomaly {

  /**
   * Get the type of anomaly.
   *
   * @return The type of anomaly.
   */
  AnomalyType anomalyType();

  /**
   * @return The severity of the anomaly.
   */
  AnomalySeverity severity();

  /**
   * Get the detection time of anomaly.
   *
   * @return The detection time of anomaly.
   */
  long detectionTimeMs();

  /**
   * @return An object that can be further used to encode into JSON to represent the anomaly.
   */
  Map<String, Object> getJsonStructure();
}
