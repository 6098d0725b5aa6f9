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

import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.LongToDoubleFunction;
import java.util.function.ToDoubleFunction;

/**
 * Bodies of the functions called without arguments. Each one is a pure function of the step timestamp (in ms).
 */
public final class NoArgFunctions {
  private static final Map<String, LongToDoubleFunction> FUNCTIONS;

  static {
    final Map<String, LongToDoubleFunction> m = new HashMap<>();
    m.put("pi", t -> Math.PI);
    m.put("time", t -> t / 1000.0);
    m.put("minute", date(ZonedDateTime::getMinute));
    m.put("hour", date(ZonedDateTime::getHour));
    m.put("day_of_week", date(t -> t.getDayOfWeek().getValue() % 7));
    m.put("day_of_month", date(ZonedDateTime::getDayOfMonth));
    m.put("day_of_year", date(ZonedDateTime::getDayOfYear));
    m.put("days_in_month", date(t -> YearMonth.from(t).lengthOfMonth()));
    m.put("month", date(ZonedDateTime::getMonthValue));
    m.put("year", date(ZonedDateTime::getYear));
    FUNCTIONS = Collections.unmodifiableMap(m);
  }

  private NoArgFunctions() {
  }

  /**
   * @return the function body, or null if the name is not callable without arguments
   */
  public static LongToDoubleFunction get(final String name) {
    return FUNCTIONS.get(name);
  }

  private static LongToDoubleFunction date(final ToDoubleFunction<ZonedDateTime> f) {
    return t -> InstantVectorFunctions.dateField(Math.floorDiv(t, 1000L), f);
  }
}
