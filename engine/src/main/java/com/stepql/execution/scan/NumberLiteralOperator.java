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
package com.stepql.execution.scan;

import com.stepql.execution.AbstractOperator;
import com.stepql.execution.QueryContext;
import com.stepql.execution.QueryOptions;
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;

import java.util.List;

/**
 * Scalar constant: one sample with id 0 per step.
 */
public class NumberLiteralOperator extends AbstractOperator {
  private final double value;

  public NumberLiteralOperator(final double value, final QueryOptions options) {
    super(options);
    this.value = value;
  }

  @Override
  public List<StepVector> next(final QueryContext context) {
    context.checkForCancellation();
    final List<StepVector> batch = nextEmptyBatch();
    if (batch == null)
      return null;
    for (final StepVector vector : batch)
      vector.appendSample(0, value);
    return batch;
  }

  @Override
  protected List<Labels> loadSeries(final QueryContext context) {
    return List.of(Labels.EMPTY);
  }

  @Override
  public String describe() {
    return "[numberLiteral] " + value;
  }
}
