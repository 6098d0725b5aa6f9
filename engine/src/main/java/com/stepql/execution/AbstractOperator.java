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

import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import com.stepql.execution.model.VectorPool;
import com.stepql.utility.ComputeOnce;

import java.util.Collections;
import java.util.List;

/**
 * Base class for operators that own their pool and compute their series array once. Tracks the position in the step
 * range so subclasses only fill one batch at a time.
 */
public abstract class AbstractOperator implements VectorOperator {
  protected final QueryOptions              options;
  protected final VectorPool                pool;
  private final   ComputeOnce<List<Labels>> series = new ComputeOnce<>();
  protected       int                       currentStep;

  protected AbstractOperator(final QueryOptions options) {
    this.options = options;
    this.pool = new VectorPool(options.getStepsBatch());
  }

  @Override
  public final List<Labels> series(final QueryContext context) {
    return series.get(() -> Collections.unmodifiableList(loadSeries(context)));
  }

  /**
   * Computes the series array. Invoked at most once per operator.
   */
  protected abstract List<Labels> loadSeries(QueryContext context);

  @Override
  public VectorPool getPool() {
    return pool;
  }

  protected boolean isExhausted() {
    return currentStep >= options.getNumSteps();
  }

  /**
   * Allocates a batch with one empty step vector per step of the next pull and advances the step position.
   *
   * @return the batch, or {@code null} when every step has been produced
   */
  protected List<StepVector> nextEmptyBatch() {
    if (isExhausted())
      return null;
    final int steps = Math.min(options.getStepsBatch(), options.getNumSteps() - currentStep);
    final List<StepVector> batch = pool.getVectorBatch();
    for (int i = 0; i < steps; i++)
      batch.add(pool.getStepVector(options.stepTime(currentStep + i)));
    currentStep += steps;
    return batch;
  }

  @Override
  public String toString() {
    return describe();
  }
}
