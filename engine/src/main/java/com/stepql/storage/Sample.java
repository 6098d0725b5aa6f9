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

/**
 * One stored point: either a float value or, when {@link #histogram()} is not null, a histogram.
 */
public record Sample(long timestamp, double value, Histogram histogram) {
  public static Sample of(final long timestamp, final double value) {
    return new Sample(timestamp, value, null);
  }

  public static Sample of(final long timestamp, final Histogram histogram) {
    return new Sample(timestamp, Double.NaN, histogram);
  }

  public boolean isHistogram() {
    return histogram != null;
  }
}
