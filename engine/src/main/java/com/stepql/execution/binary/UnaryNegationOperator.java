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
package com.stepql.execution.binary;

import com.stepql.execution.QueryContext;
import com.stepql.execution.VectorOperator;
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import com.stepql.execution.model.VectorPool;
import com.stepql.utility.ComputeOnce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Unary minus: negates every float sample in place and drops the metric name. Histogram samples are dropped.
 */
public class UnaryNegationOperator implements VectorOperator {
  private final VectorOperator            next;
  private final boolean                   scalar;
  private final ComputeOnce<List<Labels>> series = new ComputeOnce<>();

  public UnaryNegationOperator(final VectorOperator next, final boolean scalar) {
    this.next = next;
    this.scalar = scalar;
  }

  @Override
  public List<StepVector> next(final QueryContext context) {
    context.checkForCancellation();

    final List<StepVector> batch = next.next(context);
    if (batch == null)
      return null;
    for (final StepVector v : batch) {
      for (int i = 0; i < v.sampleCount(); i++)
        v.setSample(i, v.getSampleId(i), -v.getSample(i));
      v.truncateHistograms(0);
    }
    return batch;
  }

  @Override
  public List<Labels> series(final QueryContext context) {
    return series.get(() -> {
      if (scalar)
        return List.of(Labels.EMPTY);
      final List<Labels> input = next.series(context);
      final List<Labels> output = new ArrayList<>(input.size());
      for (final Labels l : input)
        output.add(l.dropMetricName());
      return Collections.unmodifiableList(output);
    });
  }

  @Override
  public VectorPool getPool() {
    return next.getPool();
  }

  @Override
  public String describe() {
    return "[unary] -";
  }

  @Override
  public List<VectorOperator> getChildren() {
    return List.of(next);
  }
}
