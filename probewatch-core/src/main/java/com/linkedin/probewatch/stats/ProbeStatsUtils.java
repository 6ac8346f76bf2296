/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.probewatch.stats;

import java.util.Collection;
import java.util.Objects;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * A util class for the statistics used by probe anomaly detectors.
 */
public final class ProbeStatsUtils {

  private ProbeStatsUtils() {

  }

  /**
   * Jitter is the sample (bias-corrected) standard deviation of the round trip times of one ping measurement.
   *
   * @param rtts Round trip times in milliseconds, {@code null} entries are ignored.
   * @return Jitter in milliseconds, or {@code 0.0} if there are fewer than two samples.
   */
  public static double jitter(Collection<Double> rtts) {
    if (rtts == null) {
      return 0.0;
    }
    double[] samples = toArray(rtts);
    if (samples.length < 2) {
      return 0.0;
    }
    return new StandardDeviation(true).evaluate(samples);
  }

  /**
   * Check whether the given value is above the mean of all non-null peer values multiplied by the given factor.
   * The peer values are expected to contain the value itself.
   *
   * @param value The value to check, may be {@code null}.
   * @param peerValues Values reported by all peers, {@code null} entries are ignored.
   * @param factor The multiplier applied to the peer mean.
   * @return {@code true} if the value is an outlier, {@code false} if it is not or there is nothing to compare.
   */
  public static boolean isOutlier(Double value, Collection<Double> peerValues, double factor) {
    if (value == null) {
      return false;
    }
    double[] valid = toArray(peerValues);
    if (valid.length == 0) {
      return false;
    }
    return value > new Mean().evaluate(valid) * factor;
  }

  /**
   * A geo anomaly is a probe that is farther from the target than a peer, yet reports a latency lower than the
   * peer's latency by more than the given margin.
   *
   * @param distance Distance of the probe to the target in kilometers, may be {@code null}.
   * @param latency Latency of the probe in milliseconds.
   * @param peerDistance Distance of the peer to the target in kilometers, may be {@code null}.
   * @param peerLatency Latency of the peer in milliseconds.
   * @param marginMs Latency margin in milliseconds.
   * @return {@code true} if the latency of the probe is implausible compared to the peer.
   */
  public static boolean isGeoAnomaly(Double distance, double latency, Double peerDistance, double peerLatency, double marginMs) {
    return distance != null && peerDistance != null && distance > peerDistance && latency < peerLatency - marginMs;
  }

  private static double[] toArray(Collection<Double> values) {
    return values.stream().filter(Objects::nonNull).mapToDouble(Double::doubleValue).toArray();
  }
}
