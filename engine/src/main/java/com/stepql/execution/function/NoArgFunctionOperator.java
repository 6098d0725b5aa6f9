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
import com.stepql.execution.AbstractOperator;
import com.stepql.execution.QueryContext;
import com.stepql.execution.QueryOptions;
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import com.stepql.query.promql.ast.PromQLExpr.FunctionCallExpr;

import java.util.List;
import java.util.function.LongToDoubleFunction;

/**
 * Function without operator inputs: one sample per step, computed from the step timestamp alone.
 */
public class NoArgFunctionOperator extends AbstractOperator {
  private final FunctionCallExpr     funcExpr;
  private final LongToDoubleFunction call;

  public NoArgFunctionOperator(final FunctionCallExpr funcExpr, final QueryOptions options) {
    super(options);
    this.funcExpr = funcExpr;
    this.call = NoArgFunctions.get(funcExpr.name());
    if (call == null)
      throw QueryException.unknownFunction(funcExpr.name());
  }

  @Override
  public List<StepVector> next(final QueryContext context) {
    context.checkForCancellation();
    final List<StepVector> batch = nextEmptyBatch();
    if (batch == null)
      return null;
    for (final StepVector vector : batch)
      vector.appendSample(0, call.applyAsDouble(vector.getT()));
    return batch;
  }

  @Override
  protected List<Labels> loadSeries(final QueryContext context) {
    return List.of(Labels.EMPTY);
  }

  @Override
  public String describe() {
    return "[noArgFunction] " + funcExpr;
  }
}
