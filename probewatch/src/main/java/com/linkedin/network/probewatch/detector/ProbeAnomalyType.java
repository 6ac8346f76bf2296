/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;

import com.linkedin.network.probewatch.model.MeasurementType;
import com.linkedin.probewatch.detector.AnomalyType;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;


/**
 * The catalog of anomaly types detected in probe measurements.
 *
 * <ul>
 *  <li>{@link #LATENCY_SPIKE}: Round trip time above a static threshold or a multiple of the latency baseline.</li>
 *  <li>{@link #PACKET_LOSS}: Packet loss above a threshold.</li>
 *  <li>{@link #UNREACHABLE_HOST}: Total packet loss, or a traceroute that does not end at the target.</li>
 *  <li>{@link #ROUTE_CHANGE}: Traceroute path differs from the hop baseline.</li>
 *  <li>{@link #PATH_FLAPPING}: Distinct paths within the recent traceroute observations.</li>
 *  <li>{@link #GEO_ANOMALY}: A farther probe reports much lower latency than a nearer one.</li>
 *  <li>{@link #JITTER_SPIKE}: High variation of round trip times.</li>
 *  <li>{@link #OUTLIER_PROBE_LATENCY}: A probe's latency is far above the mean of all probes.</li>
 *  <li>{@link #OUTLIER_PROBE_LOSS}: A probe's loss is far above the mean of all probes.</li>
 * </ul>
 */
public enum ProbeAnomalyType implements AnomalyType {
  LATENCY_SPIKE("RTT (Round Trip Time) exceeds a threshold (e.g., > 250 ms) or spikes suddenly",
                EnumSet.of(MeasurementType.PING), true),
  PACKET_LOSS("% of lost packets > threshold (e.g., 5–10%)", EnumSet.of(MeasurementType.PING), false),
  UNREACHABLE_HOST("100% packet loss, host not reachable, no ping replies",
                   EnumSet.of(MeasurementType.PING, MeasurementType.TRACEROUTE), false),
  ROUTE_CHANGE("Traceroute path is different than baseline path (hop IPs or count changed)",
               EnumSet.of(MeasurementType.TRACEROUTE), false),
  PATH_FLAPPING("Route changes frequently (e.g., unstable topology)", EnumSet.of(MeasurementType.TRACEROUTE), false),
  GEO_ANOMALY("Far probe suddenly has better latency than near one (suspicious routing)",
              EnumSet.of(MeasurementType.PING), true),
  JITTER_SPIKE("High variation in RTTs (instability, not necessarily high latency)",
               EnumSet.of(MeasurementType.PING), true),
  OUTLIER_PROBE_LATENCY("Only some probes report high delay (not the majority)", EnumSet.of(MeasurementType.PING), true),
  OUTLIER_PROBE_LOSS("Only some probes report high loss (not the majority)", EnumSet.of(MeasurementType.PING), false);

  private static final List<ProbeAnomalyType> CACHED_VALUES = List.of(values());
  private final String _description;
  private final Set<MeasurementType> _measurementTypes;
  private final boolean _latencyRelated;

  ProbeAnomalyType(String description, Set<MeasurementType> measurementTypes, boolean latencyRelated) {
    _description = description;
    _measurementTypes = Collections.unmodifiableSet(measurementTypes);
    _latencyRelated = latencyRelated;
  }

  @Override
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @Override
  public String description() {
    return _description;
  }

  @Override
  public Set<String> measurementTypes() {
    return _measurementTypes.stream().map(MeasurementType::wireName).collect(Collectors.toSet());
  }

  @Override
  public boolean latencyRelated() {
    return _latencyRelated;
  }

  /**
   * @param measurementType A measurement type.
   * @return {@code true} if this anomaly type can be detected in measurements of the given type.
   */
  public boolean appliesTo(MeasurementType measurementType) {
    return _measurementTypes.contains(measurementType);
  }

  /**
   * @param wireName The name of an anomaly type as it appears in reports.
   * @return The matching anomaly type, or {@code null} if there is none.
   */
  public static ProbeAnomalyType fromWireName(String wireName) {
    for (ProbeAnomalyType type : CACHED_VALUES) {
      if (type.wireName().equals(wireName)) {
        return type;
      }
    }
    return null;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<ProbeAnomalyType> cachedValues() {
    return CACHED_VALUES;
  }
}
