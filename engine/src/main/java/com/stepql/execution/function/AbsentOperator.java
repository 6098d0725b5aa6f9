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
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import com.stepql.query.promql.ast.PromQLExpr;
import com.stepql.query.promql.ast.PromQLExpr.FunctionCallExpr;
import com.stepql.query.promql.ast.PromQLExpr.LabelMatcher;
import com.stepql.query.promql.ast.PromQLExpr.MatchOp;
import com.stepql.query.promql.ast.PromQLExpr.VectorSelector;
import org.eclipse.collections.impl.map.mutable.primitive.ObjectIntHashMap;

import java.util.List;

/**
 * {@code absent(v)}: a single sample of value 1 for every step where the input is empty.
 */
public class AbsentOperator extends AbstractOperator {
  private final FunctionCallExpr funcExpr;
  private final VectorOperator   next;

  public AbsentOperator(final FunctionCallExpr funcExpr, final VectorOperator next, final QueryOptions options) {
    super(options);
    this.funcExpr = funcExpr;
    this.next = next;
  }

  @Override
  public List<StepVector> next(final QueryContext context) {
    context.checkForCancellation();

    final List<StepVector> in = next.next(context);
    if (in == null)
      return null;

    final List<StepVector> result = pool.getVectorBatch();
    for (final StepVector vector : in) {
      final StepVector out = pool.getStepVector(vector.getT());
      if (vector.isEmpty())
        out.appendSample(0, 1);
      result.add(out);
    }
    next.getPool().putVectors(in);
    return result;
  }

  /**
   * The output labels come from the equality matchers of a selector argument. Label names matched more than once and the
   * metric name are left out.
   */
  @Override
  protected List<Labels> loadSeries(final QueryContext context) {
    if (funcExpr.args().isEmpty())
      return List.of(Labels.EMPTY);
    final PromQLExpr arg = funcExpr.args().get(0);
    if (!(arg instanceof VectorSelector selector))
      return List.of(Labels.EMPTY);

    final ObjectIntHashMap<String> occurrences = new ObjectIntHashMap<>();
    for (final LabelMatcher m : selector.matchers())
      occurrences.addToValue(m.name(), 1);

    final Labels.Builder b = Labels.builder();
    for (final LabelMatcher m : selector.matchers())
      if (m.op() == MatchOp.EQ && !Labels.METRIC_NAME.equals(m.name()) && occurrences.get(m.name()) == 1)
        b.set(m.name(), m.value());
    return List.of(b.build());
  }

  @Override
  public String describe() {
    return "[function] " + funcExpr;
  }

  @Override
  public List<VectorOperator> getChildren() {
    return List.of(next);
  }
}
