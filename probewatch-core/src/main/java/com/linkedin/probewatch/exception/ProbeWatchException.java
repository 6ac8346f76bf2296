/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.probewatch.exception;

/**
 * Thrown when a single unit of work (one measurement file, one report) cannot be processed.
 */
public class ProbeWatchException extends Exception {

  public ProbeWatchException(String message, Throwable cause) {
    super(message, cause);
  }

  public ProbeWatchException(String message) {
    super(message);
  }

  public ProbeWatchException(Throwable cause) {
    super(cause);
  }
}
