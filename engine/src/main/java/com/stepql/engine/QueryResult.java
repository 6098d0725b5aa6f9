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
package com.stepql.engine;

import com.stepql.execution.model.Histogram;
import com.stepql.execution.model.Labels;

import java.util.List;

/**
 * Result of a query evaluation.
 */
public sealed interface QueryResult {

  record ScalarResult(double value, long timestampMs) implements QueryResult {
  }

  /**
   * One sample of an instant vector. {@code histogram} is null for float samples.
   */
  record VectorSample(Labels labels, double value, Histogram histogram, long timestampMs) {
    public boolean isHistogram() {
      return histogram != null;
    }
  }

  record InstantVector(List<VectorSample> samples) implements QueryResult {
  }

  record Point(long timestampMs, double value, Histogram histogram) {
  }

  record MatrixSeries(Labels labels, List<Point> points) {
  }

  record MatrixResult(List<MatrixSeries> series) implements QueryResult {
  }
}
