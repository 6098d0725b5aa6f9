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
package com.stepql.query.promql.ast;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.stepql.query.promql.ast.ValueType.MATRIX;
import static com.stepql.query.promql.ast.ValueType.SCALAR;
import static com.stepql.query.promql.ast.ValueType.STRING;
import static com.stepql.query.promql.ast.ValueType.VECTOR;

/**
 * Registry of the built-in function signatures known to the parser. Being registered here does not imply the execution
 * engine can evaluate the function: plan construction fails with an unknown function error for names it has no operator
 * for.
 */
public final class Functions {
  private static final Map<String, Function> FUNCTIONS;

  static {
    final Map<String, Function> m = new HashMap<>();

    // MATH ON INSTANT VECTORS
    for (final String name : List.of("abs", "ceil", "floor", "exp", "sqrt", "ln", "log2", "log10", "sgn", "sin", "cos", "tan",
        "asin", "acos", "atan", "sinh", "cosh", "tanh", "asinh", "acosh", "atanh", "deg", "rad"))
      register(m, name, List.of(VECTOR), 0, VECTOR);
    register(m, "round", List.of(VECTOR, SCALAR), 1, VECTOR);
    register(m, "clamp", List.of(VECTOR, SCALAR, SCALAR), 0, VECTOR);
    register(m, "clamp_min", List.of(VECTOR, SCALAR), 0, VECTOR);
    register(m, "clamp_max", List.of(VECTOR, SCALAR), 0, VECTOR);

    // DATES: WITHOUT ARGUMENT THEY ARE EVALUATED ON THE STEP TIMESTAMP
    for (final String name : List.of("minute", "hour", "day_of_week", "day_of_month", "day_of_year", "days_in_month", "month",
        "year"))
      register(m, name, List.of(VECTOR), 1, VECTOR);

    register(m, "pi", List.of(), 0, SCALAR);
    register(m, "time", List.of(), 0, SCALAR);
    register(m, "vector", List.of(SCALAR), 0, VECTOR);
    register(m, "scalar", List.of(VECTOR), 0, SCALAR);
    register(m, "absent", List.of(VECTOR), 0, VECTOR);
    register(m, "label_replace", List.of(VECTOR, STRING, STRING, STRING, STRING), 0, VECTOR);
    register(m, "label_join", List.of(VECTOR, STRING, STRING, STRING), -1, VECTOR);

    // HISTOGRAMS
    register(m, "histogram_quantile", List.of(SCALAR, VECTOR), 0, VECTOR);
    register(m, "histogram_count", List.of(VECTOR), 0, VECTOR);
    register(m, "histogram_sum", List.of(VECTOR), 0, VECTOR);
    register(m, "histogram_avg", List.of(VECTOR), 0, VECTOR);
    register(m, "histogram_fraction", List.of(SCALAR, SCALAR, VECTOR), 0, VECTOR);

    // RANGE VECTORS
    for (final String name : List.of("rate", "irate", "increase", "delta", "idelta", "changes", "resets", "deriv",
        "sum_over_time", "avg_over_time", "min_over_time", "max_over_time", "count_over_time", "last_over_time",
        "present_over_time", "stddev_over_time", "stdvar_over_time"))
      register(m, name, List.of(MATRIX), 0, VECTOR);
    register(m, "quantile_over_time", List.of(SCALAR, MATRIX), 0, VECTOR);

    // KNOWN TO THE LANGUAGE, NOT EVALUATED BY THE ENGINE
    register(m, "timestamp", List.of(VECTOR), 0, VECTOR);
    register(m, "sort", List.of(VECTOR), 0, VECTOR);
    register(m, "sort_desc", List.of(VECTOR), 0, VECTOR);
    register(m, "absent_over_time", List.of(MATRIX), 0, VECTOR);
    register(m, "predict_linear", List.of(MATRIX, SCALAR), 0, VECTOR);
    register(m, "holt_winters", List.of(MATRIX, SCALAR, SCALAR), 0, VECTOR);

    FUNCTIONS = Collections.unmodifiableMap(m);
  }

  private Functions() {
  }

  private static void register(final Map<String, Function> m, final String name, final List<ValueType> argTypes,
      final int variadic, final ValueType returnType) {
    m.put(name, new Function(name, argTypes, variadic, returnType));
  }

  /**
   * @return the signature of the function, or null if the name is not a known function
   */
  public static Function get(final String name) {
    return FUNCTIONS.get(name);
  }

  public static boolean exists(final String name) {
    return FUNCTIONS.containsKey(name);
  }
}
