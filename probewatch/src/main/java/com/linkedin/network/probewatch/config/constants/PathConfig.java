/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.config.constants;

import com.linkedin.probewatch.common.config.ConfigDef;


/**
 * A class to keep ProbeWatch directory configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CONFIGURATION FILES.
 */
public final class PathConfig {
  public static final String CONFIG_SECTION = "paths";
  private static final String CONFIG_PREFIX = CONFIG_SECTION + ".";

  /**
   * <code>paths.results_dir</code>
   */
  public static final String RESULTS_DIR_CONFIG = CONFIG_PREFIX + "results_dir";
  public static final String DEFAULT_RESULTS_DIR = "measurement_client/results/fetched_measurements";
  public static final String RESULTS_DIR_DOC = "The directory holding the fetched measurement_*_result.json files.";

  /**
   * <code>paths.events_dir</code>
   */
  public static final String EVENTS_DIR_CONFIG = CONFIG_PREFIX + "events_dir";
  public static final String DEFAULT_EVENTS_DIR = "event_manager/results";
  public static final String EVENTS_DIR_DOC = "The directory the anomaly report of each measurement is written to.";

  /**
   * <code>paths.baseline_dir</code>
   */
  public static final String BASELINE_DIR_CONFIG = CONFIG_PREFIX + "baseline_dir";
  public static final String DEFAULT_BASELINE_DIR = "event_manager/baseline";
  public static final String BASELINE_DIR_DOC = "The directory latency and traceroute baselines are persisted in when "
      + "baselines are persisted to files.";

  private PathConfig() {
  }

  /**
   * Define configs for directories.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for directories.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(RESULTS_DIR_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_RESULTS_DIR,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.HIGH,
                            RESULTS_DIR_DOC)
                    .define(EVENTS_DIR_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_EVENTS_DIR,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.HIGH,
                            EVENTS_DIR_DOC)
                    .define(BASELINE_DIR_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_BASELINE_DIR,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.HIGH,
                            BASELINE_DIR_DOC);
  }
}
