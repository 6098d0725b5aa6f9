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

import com.stepql.storage.Sample;

import java.util.List;

/**
 * Body of a function over a range vector. The window holds {@code samples[from, to)} with timestamps in
 * {@code (rangeStart, rangeEnd]}.
 */
@FunctionalInterface
public interface RangeFunction {
  /**
   * @param param scalar parameter of the function, NaN when it has none
   * @param out   receives the result in {@code out[0]}
   *
   * @return false if the function has no value for this window
   */
  boolean apply(List<Sample> samples, int from, int to, long rangeStart, long rangeEnd, double param, double[] out);
}
