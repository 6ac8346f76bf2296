/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.model;

import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;


/**
 * The fetched results of one measurement, as written by the measurement client.
 */
public class MeasurementResult {
  @SerializedName("measurement_id")
  private String _measurementId;
  @SerializedName("results")
  private List<ResultRecord> _results;

  private MeasurementResult() {
  }

  public MeasurementResult(String measurementId, List<ResultRecord> results) {
    _measurementId = measurementId;
    _results = results;
  }

  public String measurementId() {
    return _measurementId;
  }

  /**
   * @return Result records in order. Never {@code null}.
   */
  public List<ResultRecord> results() {
    return _results == null ? Collections.emptyList() : Collections.unmodifiableList(_results);
  }
}
