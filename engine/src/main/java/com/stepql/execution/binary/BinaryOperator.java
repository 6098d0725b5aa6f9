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
import com.stepql.query.promql.ast.PromQLExpr.BinaryOp;
import com.stepql.query.promql.ast.ValueType;
import com.stepql.utility.ComputeOnce;
import org.eclipse.collections.impl.map.mutable.primitive.ObjectIntHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Binary operator between two operands, each either a scalar or an instant vector. Results are written into the batch of
 * the vector operand (the left one when both are vectors), the other batch goes back to its pool.
 * <p>
 * Vector/vector operations match one-to-one on the label sets without the metric name. Arithmetic drops the metric name,
 * comparisons filter unless {@code bool} is set, in which case they return 0 or 1 and drop the metric name. The set
 * operators {@code and}, {@code or}, {@code unless} keep the labels of the samples they select. Histogram samples are not
 * supported and are dropped.
 */
public class BinaryOperator implements VectorOperator {
  private final VectorOperator           left;
  private final VectorOperator           right;
  private final BinaryOp                 op;
  private final boolean                  returnBool;
  private final boolean                  leftScalar;
  private final boolean                  rightScalar;
  private final ComputeOnce<MatchTable>  matchTable = new ComputeOnce<>();
  // PER-STEP LOOKUP BY MATCH KEY, STAMPED TO AVOID CLEARING
  private       double[]                 rightValues;
  private       int[]                    rightStamps;
  private       int[]                    leftStamps;
  private       int                      stamp;

  /**
   * Output series with the match key of every input series. For {@code or} the right series are appended after the left
   * ones.
   */
  private record MatchTable(List<Labels> series, int[] leftKeys, int[] rightKeys, int keyCount) {
  }

  public BinaryOperator(final VectorOperator left, final VectorOperator right, final BinaryOp op, final boolean returnBool,
      final ValueType leftType, final ValueType rightType) {
    this.left = left;
    this.right = right;
    this.op = op;
    this.returnBool = returnBool;
    this.leftScalar = leftType == ValueType.SCALAR;
    this.rightScalar = rightType == ValueType.SCALAR;
  }

  @Override
  public List<StepVector> next(final QueryContext context) {
    context.checkForCancellation();

    final List<StepVector> l = left.next(context);
    if (l == null)
      return null;
    final List<StepVector> r = right.next(context);
    if (r == null) {
      left.getPool().putVectors(l);
      return null;
    }

    final List<StepVector> result;
    if (leftScalar && rightScalar) {
      for (int i = 0; i < l.size(); i++) {
        final StepVector v = l.get(i);
        final double value = apply(op, scalarAt(l, i), scalarAt(r, i));
        v.truncateSamples(0);
        v.truncateHistograms(0);
        v.appendSample(0, value);
      }
      result = l;
      right.getPool().putVectors(r);
    } else if (rightScalar) {
      vectorScalar(l, r, false);
      result = l;
      right.getPool().putVectors(r);
    } else if (leftScalar) {
      vectorScalar(r, l, true);
      result = r;
      left.getPool().putVectors(l);
    } else {
      vectorVector(l, r, matchTable(context));
      result = l;
      right.getPool().putVectors(r);
    }
    return result;
  }

  private void vectorScalar(final List<StepVector> vectors, final List<StepVector> scalars, final boolean scalarOnLeft) {
    for (int i = 0; i < vectors.size(); i++) {
      final StepVector v = vectors.get(i);
      final double scalar = scalarAt(scalars, i);
      int write = 0;
      for (int read = 0; read < v.sampleCount(); read++) {
        final double sample = v.getSample(read);
        final double value = scalarOnLeft ? apply(op, scalar, sample) : apply(op, sample, scalar);
        if (op.isComparison() && !returnBool) {
          if (value != 0)
            v.setSample(write++, v.getSampleId(read), sample);
        } else
          v.setSample(write++, v.getSampleId(read), value);
      }
      v.truncateSamples(write);
      v.truncateHistograms(0);
    }
  }

  private void vectorVector(final List<StepVector> l, final List<StepVector> r, final MatchTable table) {
    if (rightValues == null) {
      rightValues = new double[table.keyCount()];
      rightStamps = new int[table.keyCount()];
      leftStamps = new int[table.keyCount()];
    }

    final int leftSeries = table.leftKeys().length;
    for (int i = 0; i < l.size(); i++) {
      final StepVector lv = l.get(i);
      final StepVector rv = i < r.size() ? r.get(i) : null;
      ++stamp;

      if (rv != null)
        for (int s = 0; s < rv.sampleCount(); s++) {
          final int key = table.rightKeys()[rv.getSampleId(s)];
          rightValues[key] = rv.getSample(s);
          rightStamps[key] = stamp;
        }

      int write = 0;
      for (int read = 0; read < lv.sampleCount(); read++) {
        final int id = lv.getSampleId(read);
        final int key = table.leftKeys()[id];
        final double sample = lv.getSample(read);
        final boolean matched = rightStamps[key] == stamp;
        leftStamps[key] = stamp;

        switch (op) {
        case AND:
          if (matched)
            lv.setSample(write++, id, sample);
          break;
        case UNLESS:
        case OR:
          if (!matched || op == BinaryOp.OR)
            lv.setSample(write++, id, sample);
          break;
        default:
          if (!matched)
            break;
          final double value = apply(op, sample, rightValues[key]);
          if (op.isComparison() && !returnBool) {
            if (value != 0)
              lv.setSample(write++, id, sample);
          } else
            lv.setSample(write++, id, value);
        }
      }
      lv.truncateSamples(write);
      lv.truncateHistograms(0);

      if (op == BinaryOp.OR && rv != null)
        for (int s = 0; s < rv.sampleCount(); s++) {
          final int id = rv.getSampleId(s);
          if (leftStamps[table.rightKeys()[id]] != stamp)
            lv.appendSample(leftSeries + id, rv.getSample(s));
        }
    }
  }

  private MatchTable matchTable(final QueryContext context) {
    return matchTable.get(() -> {
      final List<Labels> leftSeries = left.series(context);
      final List<Labels> rightSeries = right.series(context);
      final ObjectIntHashMap<Labels> keys = new ObjectIntHashMap<>();
      final int[] leftKeys = new int[leftSeries.size()];
      final int[] rightKeys = new int[rightSeries.size()];
      for (int i = 0; i < leftSeries.size(); i++)
        leftKeys[i] = keyOf(keys, leftSeries.get(i));
      for (int i = 0; i < rightSeries.size(); i++)
        rightKeys[i] = keyOf(keys, rightSeries.get(i));

      final List<Labels> series = new ArrayList<>(leftSeries.size() + (op == BinaryOp.OR ? rightSeries.size() : 0));
      for (final Labels l : leftSeries)
        series.add(op.isSetOperator() ? l : outputLabels(l));
      if (op == BinaryOp.OR)
        series.addAll(rightSeries);
      return new MatchTable(Collections.unmodifiableList(series), leftKeys, rightKeys, keys.size());
    });
  }

  private static int keyOf(final ObjectIntHashMap<Labels> keys, final Labels labels) {
    final Labels key = labels.dropMetricName();
    int id = keys.getIfAbsent(key, -1);
    if (id < 0) {
      id = keys.size();
      keys.put(key, id);
    }
    return id;
  }

  private Labels outputLabels(final Labels labels) {
    return op.isComparison() && !returnBool ? labels : labels.dropMetricName();
  }

  @Override
  public List<Labels> series(final QueryContext context) {
    if (leftScalar && rightScalar)
      return List.of(Labels.EMPTY);
    if (leftScalar || rightScalar) {
      return matchTable.get(() -> {
        final List<Labels> input = (leftScalar ? right : left).series(context);
        final List<Labels> output = new ArrayList<>(input.size());
        for (final Labels l : input)
          output.add(outputLabels(l));
        return new MatchTable(Collections.unmodifiableList(output), new int[0], new int[0], 0);
      }).series();
    }
    return matchTable(context).series();
  }

  static double scalarAt(final List<StepVector> batch, final int index) {
    if (index >= batch.size())
      return Double.NaN;
    final StepVector v = batch.get(index);
    return v.sampleCount() > 0 ? v.getSample(0) : Double.NaN;
  }

  /**
   * Applies an arithmetic or comparison operator. Comparisons return 1 or 0.
   */
  static double apply(final BinaryOp op, final double left, final double right) {
    return switch (op) {
      case ADD -> left + right;
      case SUB -> left - right;
      case MUL -> left * right;
      case DIV -> left / right;
      case MOD -> left % right;
      case POW -> Math.pow(left, right);
      case EQ -> left == right ? 1.0 : 0.0;
      case NEQ -> left != right ? 1.0 : 0.0;
      case LT -> left < right ? 1.0 : 0.0;
      case GT -> left > right ? 1.0 : 0.0;
      case LTE -> left <= right ? 1.0 : 0.0;
      case GTE -> left >= right ? 1.0 : 0.0;
      case AND, OR, UNLESS -> Double.NaN; // handled at vector level
    };
  }

  @Override
  public VectorPool getPool() {
    return leftScalar && !rightScalar ? right.getPool() : left.getPool();
  }

  @Override
  public String describe() {
    return "[binary] " + op.getSymbol() + (returnBool ? " bool" : "");
  }

  @Override
  public List<VectorOperator> getChildren() {
    return List.of(left, right);
  }
}
