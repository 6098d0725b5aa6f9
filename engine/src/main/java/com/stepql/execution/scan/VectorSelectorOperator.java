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

import com.stepql.execution.QueryContext;
import com.stepql.execution.QueryOptions;
import com.stepql.execution.model.StepVector;
import com.stepql.query.promql.ast.PromQLExpr.VectorSelector;
import com.stepql.storage.Sample;
import com.stepql.storage.SeriesStorage;
import com.stepql.storage.StoredSeries;

import java.util.List;

/**
 * Instant-vector selector: for every step {@code t}, emits per series the latest sample in
 * {@code (t - offset - lookbackDelta, t - offset]}.
 */
public class VectorSelectorOperator extends AbstractSelectorOperator {
  private int[] cursors;

  public VectorSelectorOperator(final SeriesStorage storage, final VectorSelector selector, final QueryOptions options) {
    super(storage, selector, options);
  }

  @Override
  protected long windowBefore() {
    return options.getLookbackDelta();
  }

  @Override
  public List<StepVector> next(final QueryContext context) {
    context.checkForCancellation();

    final List<StoredSeries> stored = data(context);
    if (cursors == null)
      cursors = new int[stored.size()];

    final List<StepVector> batch = nextEmptyBatch();
    if (batch == null)
      return null;

    for (final StepVector vector : batch) {
      final long ref = vector.getT() - selector.offsetMs();
      final long minT = ref - options.getLookbackDelta();
      for (int i = 0; i < stored.size(); i++) {
        final List<Sample> samples = stored.get(i).samples();
        int c = cursors[i];
        while (c < samples.size() && samples.get(c).timestamp() <= ref)
          c++;
        cursors[i] = c;
        if (c == 0)
          continue;
        final Sample latest = samples.get(c - 1);
        if (latest.timestamp() <= minT)
          continue;
        if (latest.isHistogram())
          vector.appendHistogram(i, latest.histogram());
        else
          vector.appendSample(i, latest.value());
      }
    }
    return batch;
  }

  @Override
  public String describe() {
    return "[vectorSelector] " + selector;
  }
}
