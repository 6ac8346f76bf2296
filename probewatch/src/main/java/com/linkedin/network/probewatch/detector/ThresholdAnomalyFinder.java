/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;

import com.linkedin.probewatch.detector.AnomalyFinder;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;


/**
 * Compares ping metrics against thresholds. Latency and packet loss are checked for every ping record, jitter once per
 * probe on its last ping record. All checks are independent and may fire together:
 * <ul>
 *   <li>latency above the static latency threshold,</li>
 *   <li>latency above the latency baseline times the spike multiplier, reported as a second latency spike even if the
 *   static threshold fired too,</li>
 *   <li>packet loss above the packet loss threshold,</li>
 *   <li>packet loss of exactly 100%, reported as an unreachable host,</li>
 *   <li>jitter above the jitter threshold.</li>
 * </ul>
 */
public class ThresholdAnomalyFinder implements AnomalyFinder<ProbeAnalysisContext, ProbeAnomaly> {
  public static final double TOTAL_LOSS_PCT = 100.0;
  private final double _latencySpikeMs;
  private final double _latencySpikeMultiplier;
  private final double _packetLossPct;
  private final double _jitterSpikeMs;

  public ThresholdAnomalyFinder(double latencySpikeMs, double latencySpikeMultiplier, double packetLossPct,
                                double jitterSpikeMs) {
    _latencySpikeMs = latencySpikeMs;
    _latencySpikeMultiplier = latencySpikeMultiplier;
    _packetLossPct = packetLossPct;
    _jitterSpikeMs = jitterSpikeMs;
  }

  @Override
  public Collection<ProbeAnomaly> anomalies(ProbeAnalysisContext context) {
    ProbeAnomalyFactory factory = context.anomalyFactory();
    List<ProbeAnomaly> anomalies = new ArrayList<>();
    for (ProbeMetrics observation : context.metrics().pingObservations()) {
      String probeId = observation.probeId();
      String target = observation.target();
      Double latency = observation.latencyMs();
      if (latency != null) {
        if (latency > _latencySpikeMs) {
          anomalies.add(factory.latencySpike(probeId, target, latency, _latencySpikeMs));
        }
        Double baseline = observation.latencyBaselineMs();
        if (baseline != null && latency > baseline * _latencySpikeMultiplier) {
          anomalies.add(factory.latencySpike(probeId, target, latency, baseline * _latencySpikeMultiplier));
        }
      }
      Double loss = observation.lossPct();
      if (loss != null) {
        if (loss > _packetLossPct) {
          anomalies.add(factory.packetLoss(probeId, target, loss, _packetLossPct));
        }
        if (loss == TOTAL_LOSS_PCT) {
          anomalies.add(factory.unreachableHost(probeId, target));
        }
      }
    }
    for (ProbeMetrics probe : context.metrics().pingProbes()) {
      if (probe.jitterMs() > _jitterSpikeMs) {
        anomalies.add(factory.jitterSpike(probe.probeId(), probe.target(), probe.jitterMs(), _jitterSpikeMs));
      }
    }
    return anomalies;
  }
}
