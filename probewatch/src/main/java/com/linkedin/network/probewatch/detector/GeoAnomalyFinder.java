/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;

import com.linkedin.probewatch.detector.AnomalyFinder;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static com.linkedin.probewatch.stats.ProbeStatsUtils.isGeoAnomaly;


/**
 * Finds probes that are farther from the target than a peer, yet report a latency lower than the peer's latency by
 * more than a margin. Every ordered pair of probes is checked, so one probe may be reported once per nearer peer.
 */
public class GeoAnomalyFinder implements AnomalyFinder<ProbeAnalysisContext, ProbeAnomaly> {
  private final double _marginMs;

  /**
   * @param marginMs Latency margin in milliseconds.
   */
  public GeoAnomalyFinder(double marginMs) {
    _marginMs = marginMs;
  }

  @Override
  public Collection<ProbeAnomaly> anomalies(ProbeAnalysisContext context) {
    ProbeAnomalyFactory factory = context.anomalyFactory();
    List<ProbeMetrics> pingProbes = context.metrics().pingProbes();
    List<ProbeAnomaly> anomalies = new ArrayList<>();
    for (ProbeMetrics probe : pingProbes) {
      if (probe.latencyMs() == null) {
        continue;
      }
      for (ProbeMetrics peer : pingProbes) {
        if (peer == probe || peer.latencyMs() == null) {
          continue;
        }
        if (isGeoAnomaly(probe.distanceKm(), probe.latencyMs(), peer.distanceKm(), peer.latencyMs(), _marginMs)) {
          anomalies.add(factory.geoAnomaly(probe.probeId(), probe.target(), probe.latencyMs(), peer.latencyMs()));
        }
      }
    }
    return anomalies;
  }
}
