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
package com.stepql.execution.model;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Free list of step vectors and of the batches that carry them. Each operator owns one pool: buffers obtained from a pool
 * go back to the same pool. The pool tolerates a consumer giving buffers back from another thread than the producer that
 * borrows them, which is the case across a concurrent operator boundary.
 */
public class VectorPool {
  private final ConcurrentLinkedDeque<List<StepVector>> batches = new ConcurrentLinkedDeque<>();
  private final ConcurrentLinkedDeque<StepVector>       vectors = new ConcurrentLinkedDeque<>();
  private final int                                     stepsBatch;
  private final AtomicLong                              allocated = new AtomicLong();

  public VectorPool(final int stepsBatch) {
    this.stepsBatch = Math.max(1, stepsBatch);
  }

  /**
   * @return an empty batch able to hold one step vector per step of a pull
   */
  public List<StepVector> getVectorBatch() {
    final List<StepVector> batch = batches.pollFirst();
    return batch != null ? batch : new ArrayList<>(stepsBatch);
  }

  /**
   * @return an empty step vector for timestamp {@code t}
   */
  public StepVector getStepVector(final long t) {
    final StepVector v = vectors.pollFirst();
    if (v == null) {
      allocated.incrementAndGet();
      return new StepVector(t);
    }
    v.reset(t);
    return v;
  }

  public void putStepVector(final StepVector vector) {
    if (vector != null)
      vectors.offerFirst(vector);
  }

  /**
   * Returns a whole batch, together with all its step vectors.
   */
  public void putVectors(final List<StepVector> batch) {
    if (batch == null)
      return;
    for (final StepVector v : batch)
      putStepVector(v);
    batch.clear();
    batches.offerFirst(batch);
  }

  public int getStepsBatch() {
    return stepsBatch;
  }

  /**
   * @return how many step vectors this pool has allocated so far. Stays flat once the pipeline reached steady state.
   */
  public long getAllocatedVectors() {
    return allocated.get();
  }
}
