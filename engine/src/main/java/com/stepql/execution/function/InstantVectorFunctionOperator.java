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

import com.stepql.exception.QueryException;
import com.stepql.execution.QueryContext;
import com.stepql.execution.VectorOperator;
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import com.stepql.execution.model.VectorPool;
import com.stepql.query.promql.ast.PromQLExpr;
import com.stepql.query.promql.ast.PromQLExpr.FunctionCallExpr;
import com.stepql.query.promql.ast.ValueType;
import com.stepql.utility.ComputeOnce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * General instant-vector function: applies the function body to every sample of the vector argument, broadcasting the
 * scalar arguments of the step. Results replace the input values in place; invalid results are compacted away. Histogram
 * samples always turn into float samples or disappear.
 */
public class InstantVectorFunctionOperator implements VectorOperator {
  private final FunctionCallExpr          funcExpr;
  private final FunctionCall              call;
  private final VectorOperator            vectorOp;
  private final List<VectorOperator>      scalarOps;
  private final double[][]                scalarArgs;
  private final double[]                  result = new double[1];
  private final ComputeOnce<List<Labels>> series = new ComputeOnce<>();

  /**
   * @param nextOps one operator per argument of the call, in argument order
   *
   * @throws QueryException if the function is unknown or its vector argument has an unsupported type
   */
  public InstantVectorFunctionOperator(final FunctionCallExpr funcExpr, final List<VectorOperator> nextOps,
      final int stepsBatch) {
    this.funcExpr = funcExpr;
    this.call = InstantVectorFunctions.get(funcExpr.name());
    if (call == null)
      throw QueryException.unknownFunction(funcExpr.name());
    if (nextOps.isEmpty())
      throw QueryException.notImplemented(funcExpr);

    final int vectorIndex = vectorArgumentIndex(funcExpr.args());
    final ValueType vectorType = funcExpr.args().isEmpty() ? null : funcExpr.args().get(vectorIndex).type();
    if (vectorType != ValueType.VECTOR && vectorType != ValueType.SCALAR)
      throw QueryException.notImplemented(vectorType != null ? vectorType.getName() : funcExpr);

    this.vectorOp = nextOps.get(vectorIndex);
    final List<VectorOperator> scalars = new ArrayList<>(nextOps.size() - 1);
    for (int i = 0; i < nextOps.size(); i++)
      if (i != vectorIndex)
        scalars.add(nextOps.get(i));
    this.scalarOps = Collections.unmodifiableList(scalars);
    this.scalarArgs = new double[Math.max(1, stepsBatch)][scalars.size()];
  }

  /**
   * @return position of the first argument typed as instant vector, 0 if there is none
   */
  static int vectorArgumentIndex(final List<PromQLExpr> args) {
    for (int i = 0; i < args.size(); i++)
      if (args.get(i).type() == ValueType.VECTOR)
        return i;
    return 0;
  }

  @Override
  public List<StepVector> next(final QueryContext context) {
    context.checkForCancellation();

    final List<StepVector> vectors = vectorOp.next(context);
    if (vectors == null)
      return null;

    for (int j = 0; j < scalarOps.size(); j++) {
      final VectorOperator scalarOp = scalarOps.get(j);
      final List<StepVector> scalars = scalarOp.next(context);
      for (int i = 0; i < vectors.size() && i < scalarArgs.length; i++) {
        double v = Double.NaN;
        if (scalars != null && i < scalars.size() && scalars.get(i).sampleCount() > 0)
          v = scalars.get(i).getSample(0);
        scalarArgs[i][j] = v;
      }
      if (scalars != null)
        scalarOp.getPool().putVectors(scalars);
    }

    for (int i = 0; i < vectors.size(); i++) {
      final StepVector vector = vectors.get(i);
      final double[] args = scalarArgs[Math.min(i, scalarArgs.length - 1)];

      // FLOATS: COMPACT IN PLACE, THE WRITE POSITION NEVER PASSES THE READ POSITION
      int write = 0;
      for (int read = 0; read < vector.sampleCount(); read++) {
        if (call.call(vector.getSample(read), null, args, result))
          vector.setSample(write++, vector.getSampleId(read), result[0]);
      }
      vector.truncateSamples(write);

      // HISTOGRAMS: THE ORIGINAL SAMPLE IS ALWAYS REMOVED, A VALID RESULT BECOMES A FLOAT SAMPLE WITH THE SAME ID
      final int histograms = vector.histogramCount();
      for (int h = 0; h < histograms; h++) {
        if (call.call(Double.NaN, vector.getHistogram(h), args, result))
          vector.appendSample(vector.getHistogramId(h), result[0]);
      }
      vector.truncateHistograms(0);
    }
    return vectors;
  }

  @Override
  public List<Labels> series(final QueryContext context) {
    return series.get(() -> {
      if ("vector".equals(funcExpr.name()))
        return List.of(Labels.EMPTY);
      final List<Labels> input = vectorOp.series(context);
      final List<Labels> output = new ArrayList<>(input.size());
      for (final Labels l : input)
        output.add(l.dropMetricName());
      return Collections.unmodifiableList(output);
    });
  }

  @Override
  public VectorPool getPool() {
    return vectorOp.getPool();
  }

  @Override
  public String describe() {
    return "[function] " + funcExpr;
  }

  @Override
  public List<VectorOperator> getChildren() {
    final List<VectorOperator> children = new ArrayList<>(scalarOps.size() + 1);
    children.add(vectorOp);
    children.addAll(scalarOps);
    return children;
  }
}
