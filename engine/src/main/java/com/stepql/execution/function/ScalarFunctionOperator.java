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
package com.stepql.execution.function;

import com.stepql.execution.AbstractOperator;
import com.stepql.execution.QueryContext;
import com.stepql.execution.QueryOptions;
import com.stepql.execution.VectorOperator;
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;

import java.util.List;

/**
 * {@code scalar(v)}: the value of the step's only element when it is a float sample, NaN when the step is empty, has more than
 * one element or holds a histogram.
 */
public class ScalarFunctionOperator extends AbstractOperator {
  private final VectorOperator next;

  public ScalarFunctionOperator(final VectorOperator next, final QueryOptions options) {
    super(options);
    this.next = next;
  }

  @Override
  public List<StepVector> next(final QueryContext context) {
    context.checkForCancellation();

    final List<StepVector> in = next.next(context);
    if (in == null)
      return null;

    final List<StepVector> result = pool.getVectorBatch();
    for (final StepVector vector : in) {
      final StepVector out = pool.getStepVector(vector.getT());
      final boolean single = vector.sampleCount() == 1 && vector.histogramCount() == 0;
      out.appendSample(0, single ? vector.getSample(0) : Double.NaN);
      result.add(out);
    }
    next.getPool().putVectors(in);
    return result;
  }

  @Override
  protected List<Labels> loadSeries(final QueryContext context) {
    return List.of(Labels.EMPTY);
  }

  @Override
  public String describe() {
    return "[function] scalar";
  }

  @Override
  public List<VectorOperator> getChildren() {
    return List.of(next);
  }
}
