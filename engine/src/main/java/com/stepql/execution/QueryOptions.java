/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.stepql.execution;

import com.stepql.ContextConfiguration;
import com.stepql.GlobalConfiguration;

/**
 * Time range and tuning of one evaluation. Instant queries have {@code start == end}; their step is ignored.
 */
public class QueryOptions {
  private final long    start;
  private final long    end;
  private final long    step;
  private final int     stepsBatch;
  private final long    lookbackDelta;
  private final boolean concurrentOperators;
  private final String  operatorQueueImpl;
  private final long    operatorPollInterval;

  public QueryOptions(final long start, final long end, final long step, final int stepsBatch, final long lookbackDelta,
      final boolean concurrentOperators, final String operatorQueueImpl, final long operatorPollInterval) {
    this.start = start;
    this.end = end;
    // A STEP OF AT LEAST 1MS KEEPS THE STEP ARITHMETIC FINITE FOR INSTANT QUERIES
    this.step = Math.max(1, step);
    this.stepsBatch = Math.max(1, stepsBatch);
    this.lookbackDelta = lookbackDelta;
    this.concurrentOperators = concurrentOperators;
    this.operatorQueueImpl = operatorQueueImpl;
    this.operatorPollInterval = Math.max(1, operatorPollInterval);
  }

  public static QueryOptions fromConfiguration(final ContextConfiguration configuration, final long start, final long end,
      final long step) {
    final ContextConfiguration cfg = configuration != null ? configuration : new ContextConfiguration();
    return new QueryOptions(start, end, step,//
        cfg.getValueAsInteger(GlobalConfiguration.QUERY_STEPS_BATCH),//
        cfg.getValueAsLong(GlobalConfiguration.QUERY_LOOKBACK_DELTA),//
        cfg.getValueAsBoolean(GlobalConfiguration.QUERY_CONCURRENT_OPERATORS),//
        cfg.getValueAsString(GlobalConfiguration.QUERY_OPERATOR_QUEUE_IMPL),//
        cfg.getValueAsLong(GlobalConfiguration.QUERY_OPERATOR_POLL_INTERVAL));
  }

  /**
   * Defaults from {@link GlobalConfiguration}, for embedders and tests.
   */
  public static QueryOptions of(final long start, final long end, final long step) {
    return fromConfiguration(null, start, end, step);
  }

  public QueryOptions withStepsBatch(final int newStepsBatch) {
    return new QueryOptions(start, end, step, newStepsBatch, lookbackDelta, concurrentOperators, operatorQueueImpl,
        operatorPollInterval);
  }

  public QueryOptions withConcurrentOperators(final boolean enabled) {
    return new QueryOptions(start, end, step, stepsBatch, lookbackDelta, enabled, operatorQueueImpl, operatorPollInterval);
  }

  public long getStart() {
    return start;
  }

  public long getEnd() {
    return end;
  }

  public long getStep() {
    return step;
  }

  public int getStepsBatch() {
    return stepsBatch;
  }

  public long getLookbackDelta() {
    return lookbackDelta;
  }

  public boolean isConcurrentOperators() {
    return concurrentOperators;
  }

  public String getOperatorQueueImpl() {
    return operatorQueueImpl;
  }

  public long getOperatorPollInterval() {
    return operatorPollInterval;
  }

  public boolean isInstant() {
    return start == end;
  }

  public int getNumSteps() {
    if (end < start)
      return 0;
    return (int) ((end - start) / step + 1);
  }

  public long stepTime(final int stepIndex) {
    return start + stepIndex * step;
  }

  @Override
  public String toString() {
    return "QueryOptions{start=" + start + ", end=" + end + ", step=" + step + ", stepsBatch=" + stepsBatch + "}";
  }
}
