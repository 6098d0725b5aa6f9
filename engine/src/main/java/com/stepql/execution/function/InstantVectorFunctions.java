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

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;
import java.util.function.ToDoubleFunction;

/**
 * Instant-vector function bodies. Float functions reject histogram samples and histogram functions reject float samples.
 */
public final class InstantVectorFunctions {
  private static final Map<String, FunctionCall> FUNCTIONS;

  // RANGE OF ZonedDateTime IN UTC, NARROWER THAN Instant
  private static final long MIN_DATE_SECONDS = LocalDateTime.MIN.toEpochSecond(ZoneOffset.UTC);
  private static final long MAX_DATE_SECONDS = LocalDateTime.MAX.toEpochSecond(ZoneOffset.UTC);

  static {
    final Map<String, FunctionCall> m = new HashMap<>();
    m.put("abs", simple(Math::abs));
    m.put("ceil", simple(Math::ceil));
    m.put("floor", simple(Math::floor));
    m.put("exp", simple(Math::exp));
    m.put("sqrt", simple(Math::sqrt));
    m.put("ln", simple(Math::log));
    m.put("log2", simple(v -> Math.log(v) / Math.log(2)));
    m.put("log10", simple(Math::log10));
    m.put("sgn", simple(Math::signum));
    m.put("sin", simple(Math::sin));
    m.put("cos", simple(Math::cos));
    m.put("tan", simple(Math::tan));
    m.put("asin", simple(Math::asin));
    m.put("acos", simple(Math::acos));
    m.put("atan", simple(Math::atan));
    m.put("sinh", simple(Math::sinh));
    m.put("cosh", simple(Math::cosh));
    m.put("tanh", simple(Math::tanh));
    m.put("asinh", simple(v -> Double.isInfinite(v) ? v : Math.log(v + Math.sqrt(v * v + 1))));
    m.put("acosh", simple(v -> Math.log(v + Math.sqrt(v * v - 1))));
    m.put("atanh", simple(v -> 0.5 * Math.log((1 + v) / (1 - v))));
    m.put("deg", simple(Math::toDegrees));
    m.put("rad", simple(Math::toRadians));
    m.put("vector", simple(v -> v));

    m.put("round", (v, h, args, out) -> {
      if (h != null)
        return false;
      final double toNearest = args.length > 0 ? args[0] : 1;
      final double inverse = 1.0 / toNearest;
      out[0] = Math.floor(v * inverse + 0.5) / inverse;
      return true;
    });
    m.put("clamp", (v, h, args, out) -> {
      if (h != null || args.length < 2 || args[1] < args[0])
        return false;
      out[0] = Math.max(args[0], Math.min(args[1], v));
      return true;
    });
    m.put("clamp_min", (v, h, args, out) -> {
      if (h != null || args.length < 1)
        return false;
      out[0] = Math.max(args[0], v);
      return true;
    });
    m.put("clamp_max", (v, h, args, out) -> {
      if (h != null || args.length < 1)
        return false;
      out[0] = Math.min(args[0], v);
      return true;
    });

    m.put("minute", date(t -> t.getMinute()));
    m.put("hour", date(t -> t.getHour()));
    m.put("day_of_week", date(t -> t.getDayOfWeek().getValue() % 7));
    m.put("day_of_month", date(t -> t.getDayOfMonth()));
    m.put("day_of_year", date(t -> t.getDayOfYear()));
    m.put("days_in_month", date(t -> YearMonth.from(t).lengthOfMonth()));
    m.put("month", date(t -> t.getMonthValue()));
    m.put("year", date(t -> t.getYear()));

    m.put("histogram_count", (v, h, args, out) -> {
      if (h == null)
        return false;
      out[0] = h.getCount();
      return true;
    });
    m.put("histogram_sum", (v, h, args, out) -> {
      if (h == null)
        return false;
      out[0] = h.getSum();
      return true;
    });
    m.put("histogram_avg", (v, h, args, out) -> {
      if (h == null)
        return false;
      out[0] = h.getSum() / h.getCount();
      return true;
    });
    m.put("histogram_fraction", (v, h, args, out) -> {
      if (h == null || args.length < 2)
        return false;
      out[0] = h.fraction(args[0], args[1]);
      return true;
    });

    FUNCTIONS = Collections.unmodifiableMap(m);
  }

  private InstantVectorFunctions() {
  }

  /**
   * @return the function body, or null if the name is not an instant-vector function
   */
  public static FunctionCall get(final String name) {
    return FUNCTIONS.get(name);
  }

  private static FunctionCall simple(final DoubleUnaryOperator f) {
    return (v, h, args, out) -> {
      if (h != null)
        return false;
      out[0] = f.applyAsDouble(v);
      return true;
    };
  }

  private static FunctionCall date(final ToDoubleFunction<ZonedDateTime> f) {
    return (v, h, args, out) -> {
      if (h != null)
        return false;
      out[0] = dateField(v, f);
      return true;
    };
  }

  /**
   * Extracts a calendar field from a unix timestamp in seconds, in UTC. Timestamps outside the calendar range give NaN.
   */
  static double dateField(final double seconds, final ToDoubleFunction<ZonedDateTime> f) {
    if (Double.isNaN(seconds))
      return Double.NaN;
    // THE CAST SATURATES ON INFINITE AND HUGE VALUES
    final long epochSeconds = (long) seconds;
    if (epochSeconds < MIN_DATE_SECONDS || epochSeconds > MAX_DATE_SECONDS)
      return Double.NaN;
    return f.applyAsDouble(ZonedDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC));
  }
}
