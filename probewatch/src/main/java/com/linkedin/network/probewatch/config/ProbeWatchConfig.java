/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.config;

import com.linkedin.network.probewatch.config.constants.DetectionConfig;
import com.linkedin.network.probewatch.config.constants.PathConfig;
import com.linkedin.network.probewatch.config.constants.PersistedDataConfig;
import com.linkedin.network.probewatch.config.constants.ThresholdConfig;
import com.linkedin.probewatch.common.config.AbstractConfig;
import com.linkedin.probewatch.common.config.ConfigDef;
import java.util.Collections;
import java.util.Map;


/**
 * The configuration class of ProbeWatch.
 */
public class ProbeWatchConfig extends AbstractConfig {
  private static final ConfigDef CONFIG;

  static {
    CONFIG = PersistedDataConfig.define(
        PathConfig.define(
            DetectionConfig.define(
                ThresholdConfig.define(new ConfigDef()))));
  }

  public ProbeWatchConfig(Map<?, ?> originals) {
    super(CONFIG, originals);
  }

  public ProbeWatchConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
  }

  /**
   * @return A configuration with every value set to its default.
   */
  public static ProbeWatchConfig defaults() {
    return new ProbeWatchConfig(Collections.emptyMap());
  }

  /**
   * @return The definition of all ProbeWatch configs.
   */
  public static ConfigDef definition() {
    return CONFIG;
  }
}
