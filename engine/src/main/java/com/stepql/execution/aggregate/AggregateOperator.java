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
package com.stepql.execution.aggregate;

import com.stepql.exception.ErrorCode;
import com.stepql.exception.QueryException;
import com.stepql.execution.AbstractOperator;
import com.stepql.execution.QueryContext;
import com.stepql.execution.QueryOptions;
import com.stepql.execution.VectorOperator;
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import com.stepql.query.promql.ast.PromQLExpr.AggOp;
import com.stepql.utility.ComputeOnce;
import com.stepql.utility.MathUtils;
import org.eclipse.collections.impl.list.mutable.primitive.DoubleArrayList;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;
import org.eclipse.collections.impl.map.mutable.primitive.ObjectIntHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reduces the series of its input to groups of labels, per step. {@code topk} and {@code bottomk} select input samples and
 * keep the input series; every other operator emits one sample per group present in the step. Histogram samples are not
 * aggregated.
 */
public class AggregateOperator extends AbstractOperator {
  private final VectorOperator next;
  private final VectorOperator paramOp;
  private final AggOp          op;
  private final boolean        without;
  private final List<String>   grouping;

  private final ComputeOnce<GroupTable> groupsOnce = new ComputeOnce<>();

  // PER-STEP ACCUMULATORS, SIZED ON FIRST USE AND REUSED ACROSS STEPS
  private boolean[]         seen;
  private double[]          values;
  private double[]          compensations;
  private double[]          counts;
  private double[]          means;
  private DoubleArrayList[] groupValues;
  private IntArrayList[]    groupSamples;

  public AggregateOperator(final VectorOperator next, final VectorOperator paramOp, final AggOp op, final boolean without,
      final List<String> grouping, final QueryOptions options) {
    super(options);
    if (op == null)
      throw new QueryException(ErrorCode.INVALID_ARGUMENT, "Aggregation operator not specified");
    if (op.hasParam() && paramOp == null)
      throw new QueryException(ErrorCode.INVALID_ARGUMENT, "Aggregation '" + op.getName() + "' requires a parameter");
    this.next = next;
    this.paramOp = op.hasParam() ? paramOp : null;
    this.op = op;
    this.without = without;
    this.grouping = List.copyOf(grouping);
  }

  /**
   * Creates the operator from the name of the aggregation.
   *
   * @throws QueryException with {@link ErrorCode#INVALID_ARGUMENT} if the name is not a supported aggregation
   */
  public static AggregateOperator create(final VectorOperator next, final VectorOperator paramOp, final String opName,
      final boolean without, final List<String> grouping, final QueryOptions options) {
    final AggOp op = AggOp.fromName(opName);
    if (op == null)
      throw (QueryException) new QueryException(ErrorCode.INVALID_ARGUMENT, "Unsupported aggregation operator: " + opName)
          .addContext("operator", opName);
    return new AggregateOperator(next, paramOp, op, without, grouping, options);
  }

  /**
   * Group of every input series ({@code mapping}) and label set of every group ({@code groups}).
   */
  private record GroupTable(int[] mapping, List<Labels> groups) {
  }

  @Override
  protected List<Labels> loadSeries(final QueryContext context) {
    if (isSelection())
      return next.series(context);
    return groupTable(context).groups();
  }

  private boolean isSelection() {
    return op == AggOp.TOPK || op == AggOp.BOTTOMK;
  }

  /**
   * Maps every input series to the index of its group, computing the group label sets along the way.
   */
  private GroupTable groupTable(final QueryContext context) {
    return groupsOnce.get(() -> {
      final List<Labels> input = next.series(context);
      final Set<String> dropped = new HashSet<>(grouping);
      dropped.add(Labels.METRIC_NAME);

      final ObjectIntHashMap<Labels> index = new ObjectIntHashMap<>();
      final List<Labels> groupLabels = new ArrayList<>();
      final int[] mapping = new int[input.size()];
      for (int i = 0; i < input.size(); i++) {
        final Labels key = without ? input.get(i).without(dropped) : input.get(i).keep(grouping);
        int g = index.getIfAbsent(key, -1);
        if (g < 0) {
          g = groupLabels.size();
          index.put(key, g);
          groupLabels.add(key);
        }
        mapping[i] = g;
      }
      return new GroupTable(mapping, List.copyOf(groupLabels));
    });
  }

  @Override
  public List<StepVector> next(final QueryContext context) {
    context.checkForCancellation();

    final GroupTable table = groupTable(context);
    final int[] mapping = table.mapping();

    final List<StepVector> in = next.next(context);
    if (in == null)
      return null;

    List<StepVector> params = null;
    if (paramOp != null)
      params = paramOp.next(context);

    ensureCapacity(table.groups().size());

    final List<StepVector> result = pool.getVectorBatch();
    for (int i = 0; i < in.size(); i++) {
      final StepVector vector = in.get(i);
      final StepVector out = pool.getStepVector(vector.getT());
      final double param = scalarAt(params, i);
      if (isSelection())
        select(vector, out, mapping, param);
      else
        reduce(vector, out, mapping, param);
      result.add(out);
    }

    next.getPool().putVectors(in);
    if (params != null)
      paramOp.getPool().putVectors(params);
    return result;
  }

  static double scalarAt(final List<StepVector> batch, final int index) {
    if (batch == null || index >= batch.size())
      return Double.NaN;
    final StepVector v = batch.get(index);
    return v.sampleCount() > 0 ? v.getSample(0) : Double.NaN;
  }

  private void ensureCapacity(final int size) {
    if (seen != null && seen.length >= size)
      return;
    final int n = Math.max(1, size);
    seen = new boolean[n];
    values = new double[n];
    compensations = new double[n];
    counts = new double[n];
    means = new double[n];
    if (op == AggOp.QUANTILE) {
      groupValues = new DoubleArrayList[n];
      for (int i = 0; i < n; i++)
        groupValues[i] = new DoubleArrayList();
    }
    if (isSelection()) {
      groupSamples = new IntArrayList[n];
      for (int i = 0; i < n; i++)
        groupSamples[i] = new IntArrayList();
    }
  }

  private void reduce(final StepVector in, final StepVector out, final int[] mapping, final double param) {
    final int groupCount = seen.length;
    Arrays.fill(seen, false);

    for (int s = 0; s < in.sampleCount(); s++) {
      final int g = mapping[in.getSampleId(s)];
      final double v = in.getSample(s);
      if (!seen[g]) {
        seen[g] = true;
        values[g] = 0;
        compensations[g] = 0;
        counts[g] = 0;
        means[g] = 0;
        if (groupValues != null)
          groupValues[g].clear();
        switch (op) {
        case MIN:
        case MAX:
          values[g] = v;
          break;
        default:
          break;
        }
      }
      counts[g]++;
      switch (op) {
      case SUM:
        kahanAdd(g, v);
        break;
      case AVG:
        means[g] += (v - means[g]) / counts[g];
        break;
      case MIN:
        if (v < values[g] || Double.isNaN(values[g]))
          values[g] = v;
        break;
      case MAX:
        if (v > values[g] || Double.isNaN(values[g]))
          values[g] = v;
        break;
      case STDDEV:
      case STDVAR: {
        final double delta = v - means[g];
        means[g] += delta / counts[g];
        values[g] += delta * (v - means[g]);
        break;
      }
      case QUANTILE:
        groupValues[g].add(v);
        break;
      default:
        break;
      }
    }

    for (int g = 0; g < groupCount; g++) {
      if (!seen[g])
        continue;
      final double value = switch (op) {
        case SUM -> Double.isInfinite(values[g]) ? values[g] : values[g] + compensations[g];
        case AVG -> means[g];
        case MIN, MAX -> values[g];
        case COUNT -> counts[g];
        case GROUP -> 1;
        case STDVAR -> values[g] / counts[g];
        case STDDEV -> Math.sqrt(values[g] / counts[g]);
        case QUANTILE -> MathUtils.quantile(param, groupValues[g].toArray(), groupValues[g].size());
        default -> throw new IllegalStateException("Unexpected aggregation " + op);
      };
      out.appendSample(g, value);
    }
  }

  private void kahanAdd(final int g, final double v) {
    final double t = values[g] + v;
    if (Math.abs(values[g]) >= Math.abs(v))
      compensations[g] += (values[g] - t) + v;
    else
      compensations[g] += (v - t) + values[g];
    values[g] = t;
  }

  /**
   * Keeps the {@code k} highest (topk) or lowest (bottomk) samples of every group. NaN values rank last.
   */
  private void select(final StepVector in, final StepVector out, final int[] mapping, final double param) {
    if (Double.isNaN(param) || param < 1)
      return;
    final int k = param >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) param;

    final List<Integer> touched = new ArrayList<>();
    for (int s = 0; s < in.sampleCount(); s++) {
      final int g = mapping[in.getSampleId(s)];
      if (groupSamples[g].isEmpty())
        touched.add(g);
      groupSamples[g].add(s);
    }

    final boolean top = op == AggOp.TOPK;
    for (final int g : touched) {
      final IntArrayList candidates = groupSamples[g];
      final List<Integer> sorted = new ArrayList<>(candidates.size());
      candidates.forEach(sorted::add);
      sorted.sort((a, b) -> compareForSelection(in.getSample(a), in.getSample(b), top));
      for (int i = 0; i < Math.min(k, sorted.size()); i++) {
        final int s = sorted.get(i);
        out.appendSample(in.getSampleId(s), in.getSample(s));
      }
      candidates.clear();
    }
  }

  private static int compareForSelection(final double a, final double b, final boolean top) {
    if (Double.isNaN(a))
      return Double.isNaN(b) ? 0 : 1;
    if (Double.isNaN(b))
      return -1;
    return top ? Double.compare(b, a) : Double.compare(a, b);
  }

  @Override
  public String describe() {
    final StringBuilder sb = new StringBuilder("[aggregate] ").append(op.getName());
    if (without || !grouping.isEmpty())
      sb.append(without ? " without (" : " by (").append(String.join(", ", grouping)).append(')');
    return sb.toString();
  }

  @Override
  public List<VectorOperator> getChildren() {
    return paramOp != null ? List.of(paramOp, next) : List.of(next);
  }
}
