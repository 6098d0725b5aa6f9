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

import com.stepql.exception.ErrorCode;
import com.stepql.exception.QueryException;
import com.stepql.execution.QueryOptions;
import com.stepql.execution.ScriptedOperator;
import com.stepql.execution.VectorOperator;
import com.stepql.execution.model.Labels;
import com.stepql.query.promql.PromQLParser;
import com.stepql.query.promql.ast.PromQLExpr.FunctionCallExpr;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FunctionOperatorsTest {
  private final QueryOptions options = QueryOptions.of(0, 0, 1);

  private static FunctionCallExpr call(final String query) {
    return (FunctionCallExpr) PromQLParser.parse(query);
  }

  private static VectorOperator op() {
    return new ScriptedOperator(10, Labels.EMPTY);
  }

  private VectorOperator build(final String query, final VectorOperator... nextOps) {
    return FunctionOperators.newFunctionOperator(call(query), List.of(nextOps), options);
  }

  @Test
  void testDispatch() {
    assertThat(build("scalar(up)", op())).isInstanceOf(ScalarFunctionOperator.class);
    assertThat(build("label_replace(up, \"a\", \"b\", \"c\", \".*\")", op())).isInstanceOf(RelabelFunctionOperator.class);
    assertThat(build("label_join(up, \"a\", \",\", \"b\")", op())).isInstanceOf(RelabelFunctionOperator.class);
    assertThat(build("absent(up)", op())).isInstanceOf(AbsentOperator.class);
    assertThat(build("histogram_quantile(0.9, up)", op(), op())).isInstanceOf(HistogramQuantileOperator.class);
    assertThat(build("time()")).isInstanceOf(NoArgFunctionOperator.class);
    assertThat(build("hour()")).isInstanceOf(NoArgFunctionOperator.class);
    assertThat(build("hour(up)", op())).isInstanceOf(InstantVectorFunctionOperator.class);
    assertThat(build("clamp_min(up, 0)", op(), op())).isInstanceOf(InstantVectorFunctionOperator.class);
  }

  @Test
  void testWrongOperatorCount() {
    assertThatThrownBy(() -> build("scalar(up)", op(), op()))//
        .isInstanceOf(QueryException.class)//
        .satisfies(e -> assertThat(((QueryException) e).getErrorCode()).isEqualTo(ErrorCode.NOT_IMPLEMENTED));
    assertThatThrownBy(() -> build("histogram_quantile(0.9, up)", op()))//
        .isInstanceOf(QueryException.class)//
        .satisfies(e -> assertThat(((QueryException) e).getErrorCode()).isEqualTo(ErrorCode.NOT_IMPLEMENTED));
  }
}
