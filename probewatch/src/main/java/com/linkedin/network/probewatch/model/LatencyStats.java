/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.model;

import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;


public class LatencyStats {
  @SerializedName("avg")
  private Double _avg;
  @SerializedName("rtts")
  private List<Double> _rtts;

  private LatencyStats() {
  }

  public LatencyStats(Double avg, List<Double> rtts) {
    _avg = avg;
    _rtts = rtts;
  }

  /**
   * @return Average round trip time in milliseconds, {@code null} if no reply was received.
   */
  public Double avg() {
    return _avg;
  }

  /**
   * @return Round trip times of the individual pings in milliseconds, in order. Never {@code null}.
   */
  public List<Double> rtts() {
    return _rtts == null ? Collections.emptyList() : Collections.unmodifiableList(_rtts);
  }
}
