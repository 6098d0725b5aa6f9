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

import com.stepql.query.promql.ast.PromQLExpr.LabelMatcher;

import java.util.List;

/**
 * Read access to stored series.
 */
public interface SeriesStorage {
  /**
   * Returns every series matching all {@code matchers}, restricted to the samples with timestamp in {@code [mint, maxt]}.
   * Series without samples in the window may be omitted. The metric name is matched through the {@code __name__} label.
   */
  List<StoredSeries> select(long mint, long maxt, List<LabelMatcher> matchers);
}
