/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;


/**
 * The metrics of one measurement result, kept two ways:
 * <ul>
 *   <li>per probe, in the order the probes first appeared in the result, holding the values of the last record of each
 *   probe,</li>
 *   <li>per record, in record order, split into ping and traceroute observations.</li>
 * </ul>
 */
public class ProbeMetricSet {
  private final String _measurementId;
  private final Map<String, ProbeMetrics> _metricsByProbe;
  private final List<ProbeMetrics> _pingObservations;
  private final List<ProbeMetrics> _tracerouteObservations;

  public ProbeMetricSet(String measurementId) {
    _measurementId = measurementId;
    _metricsByProbe = new LinkedHashMap<>();
    _pingObservations = new ArrayList<>();
    _tracerouteObservations = new ArrayList<>();
  }

  public String measurementId() {
    return _measurementId;
  }

  /**
   * Add the metrics of one record. The record's values replace the ones an earlier record of the same probe set.
   *
   * @param observation Metrics of one record.
   */
  void add(ProbeMetrics observation) {
    _metricsByProbe.computeIfAbsent(observation.probeId(), ProbeMetrics::new).mergeFrom(observation);
    if (observation.hasPing()) {
      _pingObservations.add(observation);
    }
    if (observation.hasTraceroute()) {
      _tracerouteObservations.add(observation);
    }
  }

  /**
   * @param probeId Probe id.
   * @return Metrics of the probe, or {@code null} if the probe is not part of the measurement.
   */
  public ProbeMetrics metrics(String probeId) {
    return _metricsByProbe.get(probeId);
  }

  /**
   * @return Metrics of the probes that reported a ping record.
   */
  public List<ProbeMetrics> pingProbes() {
    return _metricsByProbe.values().stream().filter(ProbeMetrics::hasPing).collect(Collectors.toList());
  }

  /**
   * @return Metrics of every ping record, in record order.
   */
  public List<ProbeMetrics> pingObservations() {
    return Collections.unmodifiableList(_pingObservations);
  }

  /**
   * @return Metrics of every traceroute record, in record order.
   */
  public List<ProbeMetrics> tracerouteObservations() {
    return Collections.unmodifiableList(_tracerouteObservations);
  }

  /**
   * @return Latency of every probe that reported a ping record, {@code null} entries included.
   */
  public List<Double> latencies() {
    return pingProbes().stream().map(ProbeMetrics::latencyMs).collect(Collectors.toList());
  }

  /**
   * @return Packet loss of every probe that reported a ping record, {@code null} entries included.
   */
  public List<Double> losses() {
    return pingProbes().stream().map(ProbeMetrics::lossPct).collect(Collectors.toList());
  }

  public int size() {
    return _metricsByProbe.size();
  }
}
