/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.probewatch.common.config;

/**
 * Thrown if the user supplies an invalid configuration
 */
public class ConfigException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String name, Object value) {
    this(name, value, null);
  }

  public ConfigException(String name, Object value, String message) {
    super("Invalid value " + value + " for configuration " + name + (message == null ? "" : ": " + message));
  }
}
