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

import com.stepql.exception.QueryException;
import com.stepql.execution.aggregate.AggregateOperator;
import com.stepql.execution.binary.BinaryOperator;
import com.stepql.execution.binary.UnaryNegationOperator;
import com.stepql.execution.function.FunctionOperators;
import com.stepql.execution.scan.MatrixSelectorOperator;
import com.stepql.execution.scan.NumberLiteralOperator;
import com.stepql.execution.scan.RangeFunctions;
import com.stepql.execution.scan.VectorSelectorOperator;
import com.stepql.log.LogManager;
import com.stepql.query.promql.ast.PromQLExpr;
import com.stepql.query.promql.ast.PromQLExpr.AggregationExpr;
import com.stepql.query.promql.ast.PromQLExpr.BinaryExpr;
import com.stepql.query.promql.ast.PromQLExpr.FunctionCallExpr;
import com.stepql.query.promql.ast.PromQLExpr.MatrixSelector;
import com.stepql.query.promql.ast.PromQLExpr.NumberLiteral;
import com.stepql.query.promql.ast.PromQLExpr.StringLiteral;
import com.stepql.query.promql.ast.PromQLExpr.UnaryExpr;
import com.stepql.query.promql.ast.PromQLExpr.VectorSelector;
import com.stepql.query.promql.ast.ValueType;
import com.stepql.storage.SeriesStorage;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

/**
 * Translates an expression tree into a tree of operators. Building performs no I/O: storage is only read when the
 * operators are pulled. Every error is raised here, synchronously, as a {@link QueryException}.
 */
public class ExecutionPlanBuilder {
  private final SeriesStorage storage;
  private final QueryOptions  options;

  public ExecutionPlanBuilder(final SeriesStorage storage, final QueryOptions options) {
    this.storage = storage;
    this.options = options;
  }

  public static VectorOperator build(final PromQLExpr expr, final SeriesStorage storage, final QueryOptions options) {
    final VectorOperator root = new ExecutionPlanBuilder(storage, options).build(expr);
    if (LogManager.instance().isLoggable(ExecutionPlanBuilder.class, Level.FINE))
      LogManager.instance().log(ExecutionPlanBuilder.class, Level.FINE, "Execution plan for %s (%s):\n%s", expr, options,
          root.explain());
    return root;
  }

  public VectorOperator build(final PromQLExpr expr) {
    if (expr instanceof NumberLiteral literal)
      return new NumberLiteralOperator(literal.value(), options);

    if (expr instanceof VectorSelector selector)
      return concurrent(new VectorSelectorOperator(storage, selector, options));

    if (expr instanceof AggregationExpr agg) {
      final VectorOperator next = build(agg.expr());
      final VectorOperator paramOp = agg.param() != null ? build(agg.param()) : null;
      return concurrent(new AggregateOperator(next, paramOp, agg.op(), agg.without(), agg.groupLabels(), options));
    }

    if (expr instanceof FunctionCallExpr call)
      return concurrent(buildFunctionCall(call));

    if (expr instanceof BinaryExpr binary) {
      final VectorOperator left = build(binary.left());
      final VectorOperator right = build(binary.right());
      return concurrent(new BinaryOperator(left, right, binary.op(), binary.returnBool(), binary.left().type(),
          binary.right().type()));
    }

    if (expr instanceof UnaryExpr unary) {
      final VectorOperator next = build(unary.expr());
      if (unary.op() == '+')
        return next;
      return new UnaryNegationOperator(next, unary.expr().type() == ValueType.SCALAR);
    }

    // MATRIX SELECTORS ARE ONLY VALID AS FUNCTION ARGUMENTS, STRINGS ONLY AS FUNCTION PARAMETERS
    throw QueryException.unsupportedExpression(expr);
  }

  private VectorOperator buildFunctionCall(final FunctionCallExpr call) {
    if (RangeFunctions.exists(call.name()))
      return buildRangeFunction(call);

    final List<VectorOperator> nextOps = new ArrayList<>(call.args().size());
    for (final PromQLExpr arg : call.args())
      if (!(arg instanceof StringLiteral))
        nextOps.add(build(arg));
    return FunctionOperators.newFunctionOperator(call, nextOps, options);
  }

  /**
   * Range functions are fused with their matrix selector. Other arguments must be number literals.
   */
  private VectorOperator buildRangeFunction(final FunctionCallExpr call) {
    MatrixSelector matrix = null;
    double param = Double.NaN;
    for (final PromQLExpr arg : call.args()) {
      if (arg instanceof MatrixSelector m && matrix == null)
        matrix = m;
      else if (arg instanceof NumberLiteral n)
        param = n.value();
      else
        throw QueryException.unsupportedExpression(call);
    }
    if (matrix == null)
      throw QueryException.unsupportedExpression(call);
    return new MatrixSelectorOperator(storage, matrix, call.name(), RangeFunctions.get(call.name()), param, options);
  }

  private VectorOperator concurrent(final VectorOperator operator) {
    return options.isConcurrentOperators() ? new ConcurrentOperator(operator, options) : operator;
  }
}
