/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.config.constants;

import com.linkedin.probewatch.common.config.ConfigDef;


/**
 * A class to keep ProbeWatch detector toggles and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CONFIGURATION FILES.
 */
public final class DetectionConfig {
  public static final String CONFIG_SECTION = "detection";
  private static final String CONFIG_PREFIX = CONFIG_SECTION + ".";

  /**
   * <code>detection.enable_outlier_detection</code>
   */
  public static final String ENABLE_OUTLIER_DETECTION_CONFIG = CONFIG_PREFIX + "enable_outlier_detection";
  public static final boolean DEFAULT_ENABLE_OUTLIER_DETECTION = true;
  public static final String ENABLE_OUTLIER_DETECTION_DOC = "True to flag probes whose latency or loss is far above the "
      + "mean of all probes of the same measurement.";

  /**
   * <code>detection.enable_geo_anomaly_detection</code>
   */
  public static final String ENABLE_GEO_ANOMALY_DETECTION_CONFIG = CONFIG_PREFIX + "enable_geo_anomaly_detection";
  public static final boolean DEFAULT_ENABLE_GEO_ANOMALY_DETECTION = true;
  public static final String ENABLE_GEO_ANOMALY_DETECTION_DOC = "True to flag farther probes reporting implausibly better "
      + "latency than nearer probes.";

  /**
   * <code>detection.enable_adaptive_baseline</code>
   */
  public static final String ENABLE_ADAPTIVE_BASELINE_CONFIG = CONFIG_PREFIX + "enable_adaptive_baseline";
  public static final boolean DEFAULT_ENABLE_ADAPTIVE_BASELINE = true;
  public static final String ENABLE_ADAPTIVE_BASELINE_DOC = "True to keep a latency baseline per probe and target and to "
      + "flag latency above a multiple of it. When disabled, latency baselines are neither read nor written.";

  private DetectionConfig() {
  }

  /**
   * Define configs for detector toggles.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for detector toggles.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(ENABLE_OUTLIER_DETECTION_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_ENABLE_OUTLIER_DETECTION,
                            ConfigDef.Importance.MEDIUM,
                            ENABLE_OUTLIER_DETECTION_DOC)
                    .define(ENABLE_GEO_ANOMALY_DETECTION_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_ENABLE_GEO_ANOMALY_DETECTION,
                            ConfigDef.Importance.MEDIUM,
                            ENABLE_GEO_ANOMALY_DETECTION_DOC)
                    .define(ENABLE_ADAPTIVE_BASELINE_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_ENABLE_ADAPTIVE_BASELINE,
                            ConfigDef.Importance.MEDIUM,
                            ENABLE_ADAPTIVE_BASELINE_DOC);
  }
}
