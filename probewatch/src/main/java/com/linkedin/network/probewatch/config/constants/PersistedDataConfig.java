/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.network.probewatch.config.constants;

import com.linkedin.network.probewatch.persisteddata.PersistMethod;
import com.linkedin.probewatch.common.config.ConfigDef;


/**
 * A class to keep ProbeWatch persisted data configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CONFIGURATION FILES.
 */
public final class PersistedDataConfig {
  public static final String CONFIG_SECTION = "persist";
  private static final String CONFIG_PREFIX = CONFIG_SECTION + ".";

  /**
   * <code>persist.method</code>
   */
  public static final String PERSIST_METHOD_CONFIG = CONFIG_PREFIX + "method";
  public static final String DEFAULT_PERSIST_METHOD = "file";
  public static final String PERSIST_METHOD_DOC = "The method to use to store latency and traceroute baselines. The "
      + "available options are: " + PersistMethod.stringValues() + ". The default is \"" + DEFAULT_PERSIST_METHOD
      + "\", which keeps one JSON file per probe and target in the baseline directory. \"memory\" keeps baselines "
      + "only for the lifetime of the process.";

  private PersistedDataConfig() {
  }

  /**
   * Define persisted data configs.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the persisted data configs.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(PERSIST_METHOD_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_PERSIST_METHOD,
                            ConfigDef.ValidString.in(PersistMethod.stringValues().toArray(new String[0])),
                            ConfigDef.Importance.MEDIUM,
                            PERSIST_METHOD_DOC);
  }
}
