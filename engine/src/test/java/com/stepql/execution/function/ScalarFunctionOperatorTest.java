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
import com.stepql.execution.model.Histogram;
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScalarFunctionOperatorTest {
  @Test
  void testSingleSampleBecomesScalar() {
    final ScriptedOperator input = new ScriptedOperator(10, Labels.of("a", "1"), Labels.of("a", "2"))//
        .step(0, 1, 3)//
        .step(1000, 0, 1, 1, 2)//
        .step(2000);
    final ScalarFunctionOperator op = new ScalarFunctionOperator(input, QueryOptions.of(0, 2000, 1000));
    final QueryContext context = new QueryContext();

    assertThat(op.series(context)).containsExactly(Labels.EMPTY);

    final List<StepVector> steps = ScriptedOperator.flatten(ScriptedOperator.drain(op, context));
    assertThat(steps).extracting(StepVector::sampleCount).containsOnly(1);
    assertThat(steps).extracting(v -> v.getSampleId(0)).containsOnly(0);
    assertThat(steps.get(0).getSample(0)).isEqualTo(3);
    assertThat(steps.get(1).getSample(0)).isNaN();
    assertThat(steps.get(2).getSample(0)).isNaN();
    assertThat(op.explain()).isEqualTo("[function] scalar\n  [scripted]");
  }

  @Test
  void testFloatNextToHistogramIsNotScalar() {
    final Histogram h = Histogram.fromCumulative(new double[] { 1, Double.POSITIVE_INFINITY }, new double[] { 3, 4 }, 6);
    final ScriptedOperator input = new ScriptedOperator(10, Labels.of("a", "1"), Labels.of("a", "2"))//
        .histogramStep(0, 1, h, 0, 7)//
        .histogramStep(1000, 1, h);
    final ScalarFunctionOperator op = new ScalarFunctionOperator(input, QueryOptions.of(0, 1000, 1000));

    final List<StepVector> steps = ScriptedOperator.flatten(ScriptedOperator.drain(op, new QueryContext()));
    assertThat(steps).hasSize(2);
    assertThat(steps.get(0).getSample(0)).isNaN();
    assertThat(steps.get(1).getSample(0)).isNaN();
    assertThat(steps).extracting(StepVector::histogramCount).containsOnly(0);
  }
}
