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
package com.stepql.utility;

import java.util.Arrays;

/**
 * Numeric helpers shared by aggregations and functions.
 */
public final class MathUtils {
  private MathUtils() {
  }

  /**
   * Computes the φ-quantile of the first {@code n} values, interpolating linearly between the two closest ranks. Sorts the
   * values in place.
   *
   * @return NaN if there are no values or φ is NaN, -Inf for φ &lt; 0, +Inf for φ &gt; 1
   */
  public static double quantile(final double q, final double[] values, final int n) {
    if (n == 0 || Double.isNaN(q))
      return Double.NaN;
    if (q < 0)
      return Double.NEGATIVE_INFINITY;
    if (q > 1)
      return Double.POSITIVE_INFINITY;
    Arrays.sort(values, 0, n);
    final double rank = q * (n - 1);
    final int lower = (int) Math.max(0, Math.floor(rank));
    final int upper = Math.min(n - 1, lower + 1);
    final double weight = rank - Math.floor(rank);
    return values[lower] * (1 - weight) + values[upper] * weight;
  }

  /**
   * Kahan-compensated running sum: {@code state[0]} holds the sum, {@code state[1]} the compensation.
   */
  public static void kahanAdd(final double value, final double[] state) {
    final double t = state[0] + value;
    if (Math.abs(state[0]) >= Math.abs(value))
      state[1] += (state[0] - t) + value;
    else
      state[1] += (value - t) + state[0];
    state[0] = t;
  }

  public static double kahanResult(final double[] state) {
    return Double.isInfinite(state[0]) ? state[0] : state[0] + state[1];
  }
}
