/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.model;

import com.google.gson.annotations.SerializedName;


/**
 * One hop of a traceroute. Only the responding address is used, other hop fields are ignored.
 */
public class Hop {
  @SerializedName("ip")
  private String _ip;

  private Hop() {
  }

  public Hop(String ip) {
    _ip = ip;
  }

  /**
   * @return The address of the hop, {@code null} if the hop did not respond.
   */
  public String ip() {
    return _ip;
  }
}
