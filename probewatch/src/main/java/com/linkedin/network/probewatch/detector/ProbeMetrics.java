/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;

import java.util.Collections;
import java.util.List;


/**
 * The metrics of one probe. Used both for a single record of a measurement result and for the latest values of a probe
 * across all its records. Ping metrics are only set if a ping record was seen, hop metrics only if a traceroute record
 * was seen.
 */
public class ProbeMetrics {
  private final String _probeId;
  private String _target;
  private boolean _hasPing;
  private Double _latencyMs;
  private Double _lossPct;
  private double _jitterMs;
  private Double _distanceKm;
  private Double _latencyBaselineMs;
  private List<String> _hopIps;
  private List<String> _hopBaseline;

  ProbeMetrics(String probeId) {
    _probeId = probeId;
  }

  void setTarget(String target) {
    _target = target;
  }

  void setPing(Double latencyMs, Double lossPct, double jitterMs, Double distanceKm) {
    _hasPing = true;
    _latencyMs = latencyMs;
    _lossPct = lossPct;
    _jitterMs = jitterMs;
    _distanceKm = distanceKm;
  }

  void setLatencyBaselineMs(Double latencyBaselineMs) {
    _latencyBaselineMs = latencyBaselineMs;
  }

  void setHops(List<String> hopIps, List<String> hopBaseline) {
    _hopIps = Collections.unmodifiableList(hopIps);
    _hopBaseline = hopBaseline == null ? null : Collections.unmodifiableList(hopBaseline);
  }

  /**
   * Overwrite the metrics of this probe with those the given observation carries. Ping and hop metrics are replaced
   * independently, so a traceroute record keeps the ping metrics of an earlier ping record.
   *
   * @param observation Metrics of one record of this probe.
   */
  void mergeFrom(ProbeMetrics observation) {
    _target = observation._target;
    if (observation._hasPing) {
      setPing(observation._latencyMs, observation._lossPct, observation._jitterMs, observation._distanceKm);
      _latencyBaselineMs = observation._latencyBaselineMs;
    }
    if (observation._hopIps != null) {
      _hopIps = observation._hopIps;
      _hopBaseline = observation._hopBaseline;
    }
  }

  public String probeId() {
    return _probeId;
  }

  public String target() {
    return _target;
  }

  public boolean hasPing() {
    return _hasPing;
  }

  public boolean hasTraceroute() {
    return _hopIps != null;
  }

  public Double latencyMs() {
    return _latencyMs;
  }

  public Double lossPct() {
    return _lossPct;
  }

  public double jitterMs() {
    return _jitterMs;
  }

  public Double distanceKm() {
    return _distanceKm;
  }

  /**
   * @return The previous latency of this probe and target, {@code null} if unknown or adaptive baselines are disabled.
   */
  public Double latencyBaselineMs() {
    return _latencyBaselineMs;
  }

  public List<String> hopIps() {
    return _hopIps;
  }

  /**
   * @return The previous hop IPs of this probe and target, {@code null} if unknown.
   */
  public List<String> hopBaseline() {
    return _hopBaseline;
  }
}
