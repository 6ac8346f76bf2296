/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch;

import com.linkedin.network.probewatch.config.ProbeWatchConfig;
import com.linkedin.network.probewatch.config.constants.PersistedDataConfig;
import com.linkedin.network.probewatch.detector.ProbeAnomaly;
import com.linkedin.network.probewatch.detector.ProbeAnomalyType;
import com.linkedin.network.probewatch.model.Hop;
import com.linkedin.network.probewatch.model.LatencyStats;
import com.linkedin.network.probewatch.model.MeasurementResult;
import com.linkedin.network.probewatch.model.ResultRecord;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;


/**
 * Builders of measurement results and configs shared by tests.
 */
public final class ProbeWatchTestUtils {
  public static final String TARGET = "8.8.8.8";
  public static final long NOW_MS = 1_700_000_000_123L;

  private ProbeWatchTestUtils() {

  }

  /**
   * @param overrides Config overrides, as alternating names and values.
   * @return A config keeping baselines in memory, with the given overrides.
   */
  public static ProbeWatchConfig config(Object... overrides) {
    Map<String, Object> props = new HashMap<>();
    props.put(PersistedDataConfig.PERSIST_METHOD_CONFIG, "memory");
    for (int i = 0; i < overrides.length; i += 2) {
      props.put((String) overrides[i], overrides[i + 1]);
    }
    return new ProbeWatchConfig(props);
  }

  public static ResultRecord ping(String probeId, Double avg, Double loss, Double distanceKm, Double... rtts) {
    return ResultRecord.ping(probeId, TARGET, new LatencyStats(avg, Arrays.asList(rtts)), loss, distanceKm);
  }

  public static ResultRecord ping(String probeId, Double avg, Double loss) {
    return ping(probeId, avg, loss, null);
  }

  public static ResultRecord traceroute(String probeId, String... hopIps) {
    List<Hop> hops = new ArrayList<>();
    for (String ip : hopIps) {
      hops.add(new Hop(ip));
    }
    return ResultRecord.traceroute(probeId, TARGET, hops);
  }

  public static MeasurementResult result(String measurementId, ResultRecord... records) {
    return new MeasurementResult(measurementId, Arrays.asList(records));
  }

  /**
   * @param anomalies Anomalies.
   * @param type Anomaly type.
   * @return The anomalies of the given type, in order.
   */
  public static List<ProbeAnomaly> ofType(Collection<ProbeAnomaly> anomalies, ProbeAnomalyType type) {
    return anomalies.stream().filter(a -> a.anomalyType() == type).collect(Collectors.toList());
  }
}
