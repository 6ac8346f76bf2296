/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.model;

import java.util.Locale;


/**
 * Measurement techniques understood by the detectors.
 */
public enum MeasurementType {
  PING, TRACEROUTE;

  /**
   * @return The name used in measurement results and reports.
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * @param wireName The measurement type of a result record.
   * @return The matching measurement type, or {@code null} if the given name is unknown or {@code null}.
   */
  public static MeasurementType fromWireName(String wireName) {
    if (wireName == null) {
      return null;
    }
    for (MeasurementType type : values()) {
      if (type.wireName().equals(wireName)) {
        return type;
      }
    }
    return null;
  }
}
