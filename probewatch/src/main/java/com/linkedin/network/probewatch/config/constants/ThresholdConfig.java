/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.config.constants;

import com.linkedin.probewatch.common.config.ConfigDef;

import static com.linkedin.probewatch.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.probewatch.common.config.ConfigDef.Range.between;


/**
 * A class to keep ProbeWatch detection threshold configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CONFIGURATION FILES.
 */
public final class ThresholdConfig {
  public static final String CONFIG_SECTION = "thresholds";
  private static final String CONFIG_PREFIX = CONFIG_SECTION + ".";

  /**
   * <code>thresholds.latency_spike_ms</code>
   */
  public static final String LATENCY_SPIKE_MS_CONFIG = CONFIG_PREFIX + "latency_spike_ms";
  public static final double DEFAULT_LATENCY_SPIKE_MS = 250.0;
  public static final String LATENCY_SPIKE_MS_DOC = "The static average round trip time in milliseconds above which a "
      + "latency spike is reported for a probe.";

  /**
   * <code>thresholds.latency_spike_multiplier</code>
   */
  public static final String LATENCY_SPIKE_MULTIPLIER_CONFIG = CONFIG_PREFIX + "latency_spike_multiplier";
  public static final double DEFAULT_LATENCY_SPIKE_MULTIPLIER = 2.0;
  public static final String LATENCY_SPIKE_MULTIPLIER_DOC = "The multiplier applied to the latency baseline (the last "
      + "observed average round trip time of the same probe and target) above which an adaptive latency spike is reported.";

  /**
   * <code>thresholds.packet_loss_percentage</code>
   */
  public static final String PACKET_LOSS_PERCENTAGE_CONFIG = CONFIG_PREFIX + "packet_loss_percentage";
  public static final double DEFAULT_PACKET_LOSS_PERCENTAGE = 10.0;
  public static final String PACKET_LOSS_PERCENTAGE_DOC = "The packet loss percentage above which a packet loss anomaly "
      + "is reported for a probe.";

  /**
   * <code>thresholds.jitter_spike_ms</code>
   */
  public static final String JITTER_SPIKE_MS_CONFIG = CONFIG_PREFIX + "jitter_spike_ms";
  public static final double DEFAULT_JITTER_SPIKE_MS = 15.0;
  public static final String JITTER_SPIKE_MS_DOC = "The jitter (sample standard deviation of round trip times) in "
      + "milliseconds above which a jitter spike is reported.";

  /**
   * <code>thresholds.outlier_factor</code>
   */
  public static final String OUTLIER_FACTOR_CONFIG = CONFIG_PREFIX + "outlier_factor";
  public static final double DEFAULT_OUTLIER_FACTOR = 2.0;
  public static final String OUTLIER_FACTOR_DOC = "The multiplier applied to the mean value reported by all probes of a "
      + "measurement above which a single probe is considered an outlier.";

  /**
   * <code>thresholds.geo_anomaly_margin_ms</code>
   */
  public static final String GEO_ANOMALY_MARGIN_MS_CONFIG = CONFIG_PREFIX + "geo_anomaly_margin_ms";
  public static final double DEFAULT_GEO_ANOMALY_MARGIN_MS = 50.0;
  public static final String GEO_ANOMALY_MARGIN_MS_DOC = "The latency margin in milliseconds by which a farther probe "
      + "has to beat a nearer probe to be reported as a geo anomaly.";

  /**
   * <code>thresholds.path_flapping_window</code>
   */
  public static final String PATH_FLAPPING_WINDOW_CONFIG = CONFIG_PREFIX + "path_flapping_window";
  public static final int DEFAULT_PATH_FLAPPING_WINDOW = 3;
  public static final String PATH_FLAPPING_WINDOW_DOC = "The number of most recent traceroute paths of a probe and target "
      + "that are inspected for path flapping.";

  private ThresholdConfig() {
  }

  /**
   * Define configs for detection thresholds.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for detection thresholds.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(LATENCY_SPIKE_MS_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_LATENCY_SPIKE_MS,
                            atLeast(0),
                            ConfigDef.Importance.HIGH,
                            LATENCY_SPIKE_MS_DOC)
                    .define(LATENCY_SPIKE_MULTIPLIER_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_LATENCY_SPIKE_MULTIPLIER,
                            atLeast(0),
                            ConfigDef.Importance.HIGH,
                            LATENCY_SPIKE_MULTIPLIER_DOC)
                    .define(PACKET_LOSS_PERCENTAGE_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_PACKET_LOSS_PERCENTAGE,
                            between(0, 100),
                            ConfigDef.Importance.HIGH,
                            PACKET_LOSS_PERCENTAGE_DOC)
                    .define(JITTER_SPIKE_MS_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_JITTER_SPIKE_MS,
                            atLeast(0),
                            ConfigDef.Importance.MEDIUM,
                            JITTER_SPIKE_MS_DOC)
                    .define(OUTLIER_FACTOR_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_OUTLIER_FACTOR,
                            atLeast(0),
                            ConfigDef.Importance.MEDIUM,
                            OUTLIER_FACTOR_DOC)
                    .define(GEO_ANOMALY_MARGIN_MS_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_GEO_ANOMALY_MARGIN_MS,
                            atLeast(0),
                            ConfigDef.Importance.MEDIUM,
                            GEO_ANOMALY_MARGIN_MS_DOC)
                    .define(PATH_FLAPPING_WINDOW_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_PATH_FLAPPING_WINDOW,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            PATH_FLAPPING_WINDOW_DOC);
  }
}
