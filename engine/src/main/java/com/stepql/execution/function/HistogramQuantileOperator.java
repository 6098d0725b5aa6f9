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
import com.stepql.execution.model.Histogram;
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import com.stepql.utility.ComputeOnce;
import org.eclipse.collections.impl.list.mutable.primitive.DoubleArrayList;
import org.eclipse.collections.impl.map.mutable.primitive.ObjectIntHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * {@code histogram_quantile(φ, v)}. Classic bucket series are grouped by their labels without {@code le} and the metric
 * name; native histogram samples are evaluated on their own.
 */
public class HistogramQuantileOperator extends AbstractOperator {
  private static final List<String> BUCKET_LABELS = List.of("le", Labels.METRIC_NAME);

  private final VectorOperator         scalarOp;
  private final VectorOperator         vectorOp;
  private final ComputeOnce<BucketMap> bucketMap = new ComputeOnce<>();
  private       DoubleArrayList[]      upperBounds;
  private       DoubleArrayList[]      counts;
  private       double[]               nativeResult;

  /**
   * Output series plus, per input series, its output id and bucket upper bound (NaN for series to evaluate as native
   * histograms, -1 output id for series without a valid {@code le}).
   */
  private record BucketMap(List<Labels> outputs, int[] outputIds, double[] upperBounds) {
  }

  public HistogramQuantileOperator(final VectorOperator scalarOp, final VectorOperator vectorOp, final QueryOptions options) {
    super(options);
    this.scalarOp = scalarOp;
    this.vectorOp = vectorOp;
  }

  @Override
  public List<StepVector> next(final QueryContext context) {
    context.checkForCancellation();

    final List<StepVector> vectors = vectorOp.next(context);
    if (vectors == null)
      return null;
    final List<StepVector> scalars = scalarOp.next(context);

    final BucketMap map = bucketMap(context);
    final int outputs = map.outputs().size();
    if (upperBounds == null) {
      upperBounds = new DoubleArrayList[outputs];
      counts = new DoubleArrayList[outputs];
      for (int i = 0; i < outputs; i++) {
        upperBounds[i] = new DoubleArrayList();
        counts[i] = new DoubleArrayList();
      }
      nativeResult = new double[outputs];
    }

    final List<StepVector> result = pool.getVectorBatch();
    for (int i = 0; i < vectors.size(); i++) {
      final StepVector vector = vectors.get(i);
      final double q = scalars != null && i < scalars.size() && scalars.get(i).sampleCount() > 0 ?
          scalars.get(i).getSample(0) :
          Double.NaN;

      for (int o = 0; o < outputs; o++) {
        upperBounds[o].clear();
        counts[o].clear();
        nativeResult[o] = Double.NaN;
      }

      for (int s = 0; s < vector.sampleCount(); s++) {
        final int id = vector.getSampleId(s);
        final int out = map.outputIds()[id];
        if (out < 0 || Double.isNaN(map.upperBounds()[id]))
          continue;
        upperBounds[out].add(map.upperBounds()[id]);
        counts[out].add(vector.getSample(s));
      }

      boolean[] natives = null;
      for (int h = 0; h < vector.histogramCount(); h++) {
        final int out = map.outputIds()[vector.getHistogramId(h)];
        if (out < 0)
          continue;
        if (natives == null)
          natives = new boolean[outputs];
        natives[out] = true;
        nativeResult[out] = vector.getHistogram(h).quantile(q);
      }

      final StepVector outVector = pool.getStepVector(vector.getT());
      for (int o = 0; o < outputs; o++) {
        if (natives != null && natives[o])
          outVector.appendSample(o, nativeResult[o]);
        else if (!upperBounds[o].isEmpty())
          outVector.appendSample(o, bucketQuantile(q, upperBounds[o].toArray(), counts[o].toArray()));
      }
      result.add(outVector);
    }

    vectorOp.getPool().putVectors(vectors);
    if (scalars != null)
      scalarOp.getPool().putVectors(scalars);
    return result;
  }

  @Override
  protected List<Labels> loadSeries(final QueryContext context) {
    return bucketMap(context).outputs();
  }

  private BucketMap bucketMap(final QueryContext context) {
    return bucketMap.get(() -> {
      final List<Labels> input = vectorOp.series(context);
      final int[] outputIds = new int[input.size()];
      final double[] bounds = new double[input.size()];
      final List<Labels> outputs = new ArrayList<>();
      final ObjectIntHashMap<Labels> index = new ObjectIntHashMap<>();

      for (int i = 0; i < input.size(); i++) {
        final Labels labels = input.get(i);
        if (labels.has("le")) {
          final double le = parseBound(labels.get("le"));
          if (Double.isNaN(le)) {
            outputIds[i] = -1;
            continue;
          }
          bounds[i] = le;
        } else
          bounds[i] = Double.NaN;

        final Labels key = labels.without(BUCKET_LABELS);
        int out = index.getIfAbsent(key, -1);
        if (out < 0) {
          out = outputs.size();
          index.put(key, out);
          outputs.add(key);
        }
        outputIds[i] = out;
      }
      return new BucketMap(Collections.unmodifiableList(outputs), outputIds, bounds);
    });
  }

  static double parseBound(final String le) {
    try {
      return Double.parseDouble(le);
    } catch (final NumberFormatException e) {
      if ("+Inf".equals(le) || "Inf".equals(le))
        return Double.POSITIVE_INFINITY;
      return Double.NaN;
    }
  }

  /**
   * Quantile over cumulative buckets, interpolating linearly inside the bucket holding the rank. The bucket list must end
   * with {@code +Inf}; counts that decrease are treated as the previous count.
   *
   * @param upperBounds bucket upper bounds, in any order
   * @param counts      cumulative counts, aligned with {@code upperBounds}
   */
  static double bucketQuantile(final double q, final double[] upperBounds, final double[] counts) {
    if (Double.isNaN(q))
      return Double.NaN;
    if (q < 0)
      return Double.NEGATIVE_INFINITY;
    if (q > 1)
      return Double.POSITIVE_INFINITY;

    final Integer[] order = new Integer[upperBounds.length];
    for (int i = 0; i < order.length; i++)
      order[i] = i;
    Arrays.sort(order, (a, b) -> Double.compare(upperBounds[a], upperBounds[b]));

    // COALESCE BUCKETS WITH THE SAME UPPER BOUND
    final DoubleArrayList bounds = new DoubleArrayList(order.length);
    final DoubleArrayList cumulative = new DoubleArrayList(order.length);
    for (final int i : order) {
      final int last = bounds.size() - 1;
      if (last >= 0 && bounds.get(last) == upperBounds[i])
        cumulative.set(last, cumulative.get(last) + counts[i]);
      else {
        bounds.add(upperBounds[i]);
        cumulative.add(counts[i]);
      }
    }

    final int size = bounds.size();
    if (size == 0 || bounds.get(size - 1) != Double.POSITIVE_INFINITY)
      return Double.NaN;

    for (int i = 1; i < size; i++)
      if (cumulative.get(i) < cumulative.get(i - 1))
        cumulative.set(i, cumulative.get(i - 1));

    if (size < 2)
      return Double.NaN;
    final double observations = cumulative.get(size - 1);
    if (observations == 0)
      return Double.NaN;

    double rank = q * observations;
    int b = 0;
    while (b < size - 1 && cumulative.get(b) < rank)
      b++;

    if (b == size - 1)
      return bounds.get(size - 2);
    if (b == 0 && bounds.get(0) <= 0)
      return bounds.get(0);

    double bucketStart = 0;
    final double bucketEnd = bounds.get(b);
    double count = cumulative.get(b);
    if (b > 0) {
      bucketStart = bounds.get(b - 1);
      count -= cumulative.get(b - 1);
      rank -= cumulative.get(b - 1);
    }
    return bucketStart + (bucketEnd - bucketStart) * (rank / count);
  }

  @Override
  public String describe() {
    return "[histogramQuantile]";
  }

  @Override
  public List<VectorOperator> getChildren() {
    return List.of(scalarOp, vectorOp);
  }
}
