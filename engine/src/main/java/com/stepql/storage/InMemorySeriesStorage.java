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
package com.stepql.storage;

import com.stepql.execution.model.Histogram;
import com.stepql.execution.model.Labels;
import com.stepql.query.promql.ast.PromQLExpr.LabelMatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Thread-safe in-memory series store. Series are kept sorted by labels, samples by timestamp. Appending a sample with the
 * timestamp of an existing one replaces it.
 */
public class InMemorySeriesStorage implements SeriesStorage {
  private final ConcurrentSkipListMap<Labels, TreeMap<Long, Sample>> series = new ConcurrentSkipListMap<>();

  public InMemorySeriesStorage add(final Labels labels, final long timestamp, final double value) {
    return add(labels, Sample.of(timestamp, value));
  }

  public InMemorySeriesStorage add(final Labels labels, final long timestamp, final Histogram histogram) {
    return add(labels, Sample.of(timestamp, histogram));
  }

  public InMemorySeriesStorage add(final Labels labels, final Sample sample) {
    final TreeMap<Long, Sample> samples = series.computeIfAbsent(labels, k -> new TreeMap<>());
    synchronized (samples) {
      samples.put(sample.timestamp(), sample);
    }
    return this;
  }

  public int getSeriesCount() {
    return series.size();
  }

  @Override
  public List<StoredSeries> select(final long mint, final long maxt, final List<LabelMatcher> matchers) {
    final List<StoredSeries> result = new ArrayList<>();
    if (maxt < mint)
      return result;

    for (final Map.Entry<Labels, TreeMap<Long, Sample>> entry : series.entrySet()) {
      if (!LabelMatchers.matches(entry.getKey(), matchers))
        continue;

      final TreeMap<Long, Sample> samples = entry.getValue();
      final List<Sample> window;
      synchronized (samples) {
        final NavigableMap<Long, Sample> sub = samples.subMap(mint, true, maxt, true);
        if (sub.isEmpty())
          continue;
        window = new ArrayList<>(sub.values());
      }
      result.add(new StoredSeries(entry.getKey(), window));
    }
    return result;
  }
}
