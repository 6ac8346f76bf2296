/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;

import com.linkedin.probewatch.detector.AnomalyFinder;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static com.linkedin.probewatch.stats.ProbeStatsUtils.isOutlier;


/**
 * Finds probes whose latency or packet loss is far above the mean reported by all probes of the same measurement. The
 * mean includes the probe itself, so a probe that is the only one reporting a value is never an outlier as long as the
 * outlier factor is at least one.
 * <p>
 * A loss outlier additionally requires the loss itself to exceed {@link #MIN_OUTLIER_LOSS_PCT}.
 */
public class OutlierProbeFinder implements AnomalyFinder<ProbeAnalysisContext, ProbeAnomaly> {
  public static final double MIN_OUTLIER_LOSS_PCT = 5.0;
  private final double _outlierFactor;

  /**
   * @param outlierFactor Multiplier applied to the mean of all probes.
   */
  public OutlierProbeFinder(double outlierFactor) {
    _outlierFactor = outlierFactor;
  }

  @Override
  public Collection<ProbeAnomaly> anomalies(ProbeAnalysisContext context) {
    ProbeMetricSet metricSet = context.metrics();
    ProbeAnomalyFactory factory = context.anomalyFactory();
    List<ProbeMetrics> pingProbes = metricSet.pingProbes();
    List<ProbeAnomaly> anomalies = new ArrayList<>();

    List<Double> latencies = metricSet.latencies();
    for (ProbeMetrics probe : pingProbes) {
      if (isOutlier(probe.latencyMs(), latencies, _outlierFactor)) {
        anomalies.add(factory.latencyOutlier(probe.probeId(), probe.target(), probe.latencyMs()));
      }
    }

    List<Double> losses = metricSet.losses();
    for (ProbeMetrics probe : pingProbes) {
      Double loss = probe.lossPct();
      if (isOutlier(loss, losses, _outlierFactor) && loss > MIN_OUTLIER_LOSS_PCT) {
        anomalies.add(factory.lossOutlier(probe.probeId(), probe.target(), loss));
      }
    }
    return anomalies;
  }
}
