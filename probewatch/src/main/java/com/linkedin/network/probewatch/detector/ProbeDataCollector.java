/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;

import com.linkedin.network.probewatch.model.LatencyStats;
import com.linkedin.network.probewatch.model.MeasurementResult;
import com.linkedin.network.probewatch.model.MeasurementType;
import com.linkedin.network.probewatch.model.ResultRecord;
import com.linkedin.network.probewatch.persisteddata.namespace.BaselinePersistedData;
import com.linkedin.probewatch.stats.ProbeStatsUtils;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.probewatch.common.utils.Utils.validateNotNull;


/**
 * Collects the per-probe metrics of a measurement result and exchanges them with the baselines: every ping latency
 * replaces the latency baseline of its probe and target (if adaptive baselines are enabled) and every traceroute path
 * replaces the hop baseline. The replaced baselines are kept in the collected metrics.
 */
public class ProbeDataCollector {
  private static final Logger LOG = LoggerFactory.getLogger(ProbeDataCollector.class);
  private final BaselinePersistedData _baselines;
  private final boolean _adaptiveBaselineEnabled;

  /**
   * @param baselines Latency and hop baselines.
   * @param adaptiveBaselineEnabled {@code true} to read and update latency baselines.
   */
  public ProbeDataCollector(BaselinePersistedData baselines, boolean adaptiveBaselineEnabled) {
    _baselines = validateNotNull(baselines, "Baselines cannot be null.");
    _adaptiveBaselineEnabled = adaptiveBaselineEnabled;
  }

  /**
   * Collect the metrics of the given measurement result. Every record is kept as an observation of its own, and a probe
   * with several records of one type exchanges its baselines once per record, in record order. Records without a probe
   * id are skipped. Records of an unknown measurement type only contribute the target of their probe.
   *
   * @param result Measurement result.
   * @return The collected metrics.
   */
  public ProbeMetricSet collect(MeasurementResult result) {
    ProbeMetricSet metricSet = new ProbeMetricSet(result.measurementId());
    int skipped = 0;
    for (ResultRecord record : result.results()) {
      if (record == null || record.probeId() == null) {
        skipped++;
        continue;
      }
      ProbeMetrics observation = new ProbeMetrics(record.probeId());
      String target = record.resolvedTarget();
      observation.setTarget(target);
      MeasurementType type = record.measurementType();
      if (type == MeasurementType.PING) {
        collectPing(record, target, observation);
      } else if (type == MeasurementType.TRACEROUTE) {
        collectTraceroute(record, target, observation);
      }
      metricSet.add(observation);
    }
    if (skipped > 0) {
      LOG.debug("Skipped {} records without probe id in measurement {}.", skipped, result.measurementId());
    }
    return metricSet;
  }

  private void collectPing(ResultRecord record, String target, ProbeMetrics metrics) {
    LatencyStats latencyStats = record.latencyStats();
    Double latencyMs = latencyStats == null ? null : latencyStats.avg();
    List<Double> rtts = latencyStats == null ? Collections.emptyList() : latencyStats.rtts();
    metrics.setPing(latencyMs, record.packetLossPercentage(), ProbeStatsUtils.jitter(rtts), record.distanceKm());
    if (_adaptiveBaselineEnabled) {
      metrics.setLatencyBaselineMs(_baselines.getAndUpdateLatency(record.probeId(), target, latencyMs));
    }
  }

  private void collectTraceroute(ResultRecord record, String target, ProbeMetrics metrics) {
    List<String> hopIps = record.hopIps();
    metrics.setHops(hopIps, _baselines.getAndUpdateHops(record.probeId(), target, hopIps));
  }
}
