/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.model;

import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;


/**
 * The sample of one probe in one measurement pass. Ids are kept as strings whether the source wrote them as numbers or
 * strings.
 */
public class ResultRecord {
  @SerializedName("probe_id")
  private String _probeId;
  @SerializedName("target_address")
  private String _targetAddress;
  @SerializedName("target")
  private String _target;
  @SerializedName("measurement_type")
  private String _measurementType;
  @SerializedName("latency_stats")
  private LatencyStats _latencyStats;
  @SerializedName("packet_loss_percentage")
  private Double _packetLossPercentage;
  @SerializedName("distance_km")
  private Double _distanceKm;
  @SerializedName("hops")
  private List<Hop> _hops;

  private ResultRecord() {
  }

  private ResultRecord(String probeId, String targetAddress, String target, String measurementType) {
    _probeId = probeId;
    _targetAddress = targetAddress;
    _target = target;
    _measurementType = measurementType;
  }

  /**
   * Create a ping record.
   *
   * @param probeId Probe id.
   * @param targetAddress Target address.
   * @param latencyStats Latency statistics.
   * @param packetLossPercentage Packet loss in percent.
   * @param distanceKm Distance of the probe to the target, may be {@code null}.
   * @return A ping record.
   */
  public static ResultRecord ping(String probeId, String targetAddress, LatencyStats latencyStats,
                                  Double packetLossPercentage, Double distanceKm) {
    ResultRecord record = new ResultRecord(probeId, targetAddress, null, MeasurementType.PING.wireName());
    record._latencyStats = latencyStats;
    record._packetLossPercentage = packetLossPercentage;
    record._distanceKm = distanceKm;
    return record;
  }

  /**
   * Create a traceroute record.
   *
   * @param probeId Probe id.
   * @param targetAddress Target address.
   * @param hops Hops in order.
   * @return A traceroute record.
   */
  public static ResultRecord traceroute(String probeId, String targetAddress, List<Hop> hops) {
    ResultRecord record = new ResultRecord(probeId, targetAddress, null, MeasurementType.TRACEROUTE.wireName());
    record._hops = hops;
    return record;
  }

  public String probeId() {
    return _probeId;
  }

  /**
   * @return {@code target_address} if present, {@code target} otherwise.
   */
  public String resolvedTarget() {
    return _targetAddress != null ? _targetAddress : _target;
  }

  /**
   * @return The measurement type, or {@code null} if it is missing or unknown.
   */
  public MeasurementType measurementType() {
    return MeasurementType.fromWireName(_measurementType);
  }

  public LatencyStats latencyStats() {
    return _latencyStats;
  }

  public Double packetLossPercentage() {
    return _packetLossPercentage;
  }

  public Double distanceKm() {
    return _distanceKm;
  }

  /**
   * @return The addresses of the responding hops in order, hops without an address left out.
   */
  public List<String> hopIps() {
    if (_hops == null) {
      return Collections.emptyList();
    }
    return _hops.stream().filter(Objects::nonNull).map(Hop::ip).filter(ip -> ip != null && !ip.isEmpty())
                .collect(Collectors.toList());
  }
}
