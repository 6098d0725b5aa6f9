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

import com.stepql.exception.ErrorCode;
import com.stepql.exception.StepQLException;
import com.stepql.execution.AbstractOperator;
import com.stepql.execution.QueryContext;
import com.stepql.execution.QueryOptions;
import com.stepql.execution.model.Labels;
import com.stepql.log.LogManager;
import com.stepql.query.promql.ast.PromQLExpr.LabelMatcher;
import com.stepql.query.promql.ast.PromQLExpr.MatchOp;
import com.stepql.query.promql.ast.PromQLExpr.VectorSelector;
import com.stepql.storage.SeriesStorage;
import com.stepql.storage.StoredSeries;
import com.stepql.utility.ComputeOnce;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

/**
 * Leaf operator reading from storage. The samples of the whole query range are selected once; per-series cursors then move
 * forward only, one batch of steps at a time.
 */
public abstract class AbstractSelectorOperator extends AbstractOperator {
  protected final SeriesStorage                   storage;
  protected final VectorSelector                  selector;
  protected final List<LabelMatcher>              matchers;
  private final   ComputeOnce<List<StoredSeries>> data = new ComputeOnce<>();

  protected AbstractSelectorOperator(final SeriesStorage storage, final VectorSelector selector, final QueryOptions options) {
    super(options);
    this.storage = storage;
    this.selector = selector;
    this.matchers = toStorageMatchers(selector);
  }

  static List<LabelMatcher> toStorageMatchers(final VectorSelector selector) {
    final List<LabelMatcher> result = new ArrayList<>(selector.matchers().size() + 1);
    if (selector.metricName() != null)
      result.add(new LabelMatcher(Labels.METRIC_NAME, MatchOp.EQ, selector.metricName()));
    result.addAll(selector.matchers());
    return result;
  }

  /**
   * How far before the first step (after offset) samples are needed.
   */
  protected abstract long windowBefore();

  protected List<StoredSeries> data(final QueryContext context) {
    return data.get(() -> {
      context.checkForCancellation();
      final long mint = options.getStart() - selector.offsetMs() - windowBefore();
      final long maxt = options.getEnd() - selector.offsetMs();
      try {
        final List<StoredSeries> result = storage.select(mint, maxt, matchers);
        LogManager.instance().log(this, Level.FINE, "Selected %d series for %s in [%d, %d]", result.size(), selector, mint, maxt);
        return result;
      } catch (final StepQLException e) {
        throw e;
      } catch (final RuntimeException e) {
        throw new StepQLException(ErrorCode.STORAGE_ERROR, "Error selecting series for " + selector, e).addContext("selector",
            selector.toString());
      }
    });
  }

  @Override
  protected List<Labels> loadSeries(final QueryContext context) {
    final List<StoredSeries> stored = data(context);
    final List<Labels> result = new ArrayList<>(stored.size());
    for (final StoredSeries s : stored)
      result.add(outputLabels(s.labels()));
    return result;
  }

  protected Labels outputLabels(final Labels labels) {
    return labels;
  }
}
