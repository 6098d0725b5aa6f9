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
package com.stepql.execution.scan;

import com.stepql.execution.QueryContext;
import com.stepql.execution.QueryOptions;
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import com.stepql.query.promql.ast.PromQLExpr.MatrixSelector;
import com.stepql.storage.Sample;
import com.stepql.storage.SeriesStorage;
import com.stepql.storage.StoredSeries;

import java.util.List;

/**
 * Range-vector selector fused with the range function consuming it: for every step {@code t} and series, applies the
 * function to the samples in {@code (t - offset - range, t - offset]}. Windows the function has no value for produce no
 * sample.
 */
public class MatrixSelectorOperator extends AbstractSelectorOperator {
  private final String        functionName;
  private final RangeFunction function;
  private final long          rangeMs;
  private final double        param;
  private final double[]      result = new double[1];
  private       int[]         windowStarts;
  private       int[]         windowEnds;

  public MatrixSelectorOperator(final SeriesStorage storage, final MatrixSelector matrix, final String functionName,
      final RangeFunction function, final double param, final QueryOptions options) {
    super(storage, matrix.selector(), options);
    this.functionName = functionName;
    this.function = function;
    this.rangeMs = matrix.rangeMs();
    this.param = param;
  }

  @Override
  protected long windowBefore() {
    return rangeMs;
  }

  @Override
  protected Labels outputLabels(final Labels labels) {
    return RangeFunctions.keepsMetricName(functionName) ? labels : labels.dropMetricName();
  }

  @Override
  public List<StepVector> next(final QueryContext context) {
    context.checkForCancellation();

    final List<StoredSeries> stored = data(context);
    if (windowStarts == null) {
      windowStarts = new int[stored.size()];
      windowEnds = new int[stored.size()];
    }

    final List<StepVector> batch = nextEmptyBatch();
    if (batch == null)
      return null;

    for (final StepVector vector : batch) {
      final long rangeEnd = vector.getT() - selector.offsetMs();
      final long rangeStart = rangeEnd - rangeMs;
      for (int i = 0; i < stored.size(); i++) {
        final List<Sample> samples = stored.get(i).samples();

        int end = windowEnds[i];
        while (end < samples.size() && samples.get(end).timestamp() <= rangeEnd)
          end++;
        windowEnds[i] = end;

        int start = windowStarts[i];
        while (start < end && samples.get(start).timestamp() <= rangeStart)
          start++;
        windowStarts[i] = start;

        if (start == end)
          continue;

        if (function.apply(samples, start, end, rangeStart, rangeEnd, param, result))
          vector.appendSample(i, result[0]);
        else if (RangeFunctions.keepsMetricName(functionName) && samples.get(end - 1).isHistogram())
          vector.appendHistogram(i, samples.get(end - 1).histogram());
      }
    }
    return batch;
  }

  @Override
  public String describe() {
    final String p = Double.isNaN(param) ? "" : param + ", ";
    return "[matrixSelector] " + functionName + "(" + p + new MatrixSelector(selector, rangeMs) + ")";
  }
}
