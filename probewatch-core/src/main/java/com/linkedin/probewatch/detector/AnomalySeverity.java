/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.probewatch.detector;

import java.util.Locale;

/**
 * Severity of a detected anomaly.
 * <ul>
 *   <li>{@link #WARNING}: Degradation that does not prevent the target from being reached.</li>
 *   <li>{@link #CRITICAL}: The target could not be reached.</li>
 * </ul>
 */
public enum AnomalySeverity {
  WARNING, CRITICAL;

  /**
   * @return Lower case name used in persisted reports.
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
