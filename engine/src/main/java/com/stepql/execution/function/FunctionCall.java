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

import com.stepql.execution.model.Histogram;

/**
 * Body of an instant-vector function, evaluated per sample.
 */
@FunctionalInterface
public interface FunctionCall {
  /**
   * @param value     float value of the sample, NaN for histogram samples
   * @param histogram histogram of the sample, null for float samples
   * @param args      scalar arguments of the call for the current step, in argument order, without the vector argument; NaN
   *                  where a scalar argument produced no sample
   * @param out       receives the result in {@code out[0]}
   *
   * @return false when the result is invalid and the sample must be dropped
   */
  boolean call(double value, Histogram histogram, double[] args, double[] out);
}
