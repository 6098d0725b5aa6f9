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
import com.stepql.execution.QueryOptions;
import com.stepql.execution.VectorOperator;
import com.stepql.query.promql.ast.PromQLExpr.FunctionCallExpr;

import java.util.List;

/**
 * Picks the operator variant evaluating a function call.
 */
public final class FunctionOperators {
  private FunctionOperators() {
  }

  /**
   * @param nextOps one operator per non-string argument of the call, in argument order
   *
   * @throws QueryException if the function has no executable variant or its arguments do not fit it
   */
  public static VectorOperator newFunctionOperator(final FunctionCallExpr funcExpr, final List<VectorOperator> nextOps,
      final QueryOptions options) {
    switch (funcExpr.name()) {
    case "scalar":
      return new ScalarFunctionOperator(single(funcExpr, nextOps), options);
    case "label_join":
    case "label_replace":
      return new RelabelFunctionOperator(funcExpr, single(funcExpr, nextOps));
    case "absent":
      return new AbsentOperator(funcExpr, single(funcExpr, nextOps), options);
    case "histogram_quantile":
      if (nextOps.size() != 2)
        throw QueryException.notImplemented(funcExpr);
      return new HistogramQuantileOperator(nextOps.get(0), nextOps.get(1), options);
    default:
      if (nextOps.isEmpty())
        return new NoArgFunctionOperator(funcExpr, options);
      return new InstantVectorFunctionOperator(funcExpr, nextOps, options.getStepsBatch());
    }
  }

  private static VectorOperator single(final FunctionCallExpr funcExpr, final List<VectorOperator> nextOps) {
    if (nextOps.size() != 1)
      throw QueryException.notImplemented(funcExpr);
    return nextOps.get(0);
  }
}
