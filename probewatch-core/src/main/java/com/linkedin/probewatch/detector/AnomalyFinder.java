/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.probewatch.detector;

import java.util.Collection;


/**
 * An interface for rule groups that inspect the metrics of one analysis pass and report anomalies.
 *
 * @param <C> The analysis context holding the metrics and the per-pass state available to the finder.
 * @param <A> The type of anomalies reported by the finder.
 */
public interface AnomalyFinder<C, A extends Anomaly> {

  /**
   * Get the anomalies detected in the given analysis context. Finders are expected to be stateless across calls;
   * any state they depend on is provided by the context.
   *
   * @param context The context of the current analysis pass.
   * @return Anomalies detected in the given context, in detection order. Empty if none.
   */
  Collection<A> anomalies(C context);
}
