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

import com.stepql.execution.QueryContext;
import com.stepql.execution.QueryOptions;
import com.stepql.execution.ScriptedOperator;
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import com.stepql.query.promql.PromQLParser;
import com.stepql.query.promql.ast.PromQLExpr.FunctionCallExpr;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AbsentOperatorTest {
  private final QueryOptions options = QueryOptions.of(0, 2000, 1000);
  private final QueryContext context = new QueryContext();

  private static FunctionCallExpr call(final String query) {
    return (FunctionCallExpr) PromQLParser.parse(query);
  }

  @Test
  void testEmptyStepsProduceOne() {
    final ScriptedOperator input = new ScriptedOperator(10).step(0).step(1000).step(2000);
    final AbsentOperator op = new AbsentOperator(call("absent(nonexistent{job=\"api\", env=~\"prod.*\"})"), input, options);

    assertThat(op.series(context)).containsExactly(Labels.of("job", "api"));

    final List<StepVector> steps = ScriptedOperator.flatten(ScriptedOperator.drain(op, context));
    assertThat(steps).hasSize(3).allSatisfy(v -> {
      assertThat(v.sampleCount()).isEqualTo(1);
      assertThat(v.getSampleId(0)).isEqualTo(0);
      assertThat(v.getSample(0)).isEqualTo(1);
    });
  }

  @Test
  void testPresentStepsProduceNothing() {
    final ScriptedOperator input = new ScriptedOperator(10, Labels.of("__name__", "up")).step(0, 0, 1).step(1000).step(2000, 0, 1);
    final AbsentOperator op = new AbsentOperator(call("absent(up)"), input, options);

    final List<StepVector> steps = ScriptedOperator.flatten(ScriptedOperator.drain(op, context));
    assertThat(steps.get(0).isEmpty()).isTrue();
    assertThat(steps.get(1).sampleCount()).isEqualTo(1);
    assertThat(steps.get(2).isEmpty()).isTrue();
  }

  @Test
  void testLabelsMatchedTwiceAreDropped() {
    final AbsentOperator op = new AbsentOperator(call("absent(up{job=\"a\", job=\"b\", env=\"prod\"})"),
        new ScriptedOperator(10), options);
    assertThat(op.series(context)).containsExactly(Labels.of("env", "prod"));
  }

  @Test
  void testNonSelectorArgumentHasNoLabels() {
    final AbsentOperator op = new AbsentOperator(call("absent(abs(up{job=\"a\"}))"), new ScriptedOperator(10), options);
    assertThat(op.series(context)).containsExactly(Labels.EMPTY);
  }
}
