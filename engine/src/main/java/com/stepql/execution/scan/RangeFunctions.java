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
import com.stepql.utility.MathUtils;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Range-vector function bodies. Histogram samples are skipped by every function working on float values.
 */
public final class RangeFunctions {
  private static final Map<String, RangeFunction> FUNCTIONS;

  static {
    final Map<String, RangeFunction> m = new HashMap<>();
    m.put("rate", (s, from, to, rs, re, p, out) -> extrapolatedRate(s, from, to, rs, re, true, true, out));
    m.put("increase", (s, from, to, rs, re, p, out) -> extrapolatedRate(s, from, to, rs, re, true, false, out));
    m.put("delta", (s, from, to, rs, re, p, out) -> extrapolatedRate(s, from, to, rs, re, false, false, out));
    m.put("irate", (s, from, to, rs, re, p, out) -> instantValue(s, from, to, true, out));
    m.put("idelta", (s, from, to, rs, re, p, out) -> instantValue(s, from, to, false, out));
    m.put("changes", RangeFunctions::changes);
    m.put("resets", RangeFunctions::resets);
    m.put("deriv", RangeFunctions::deriv);
    m.put("sum_over_time", RangeFunctions::sumOverTime);
    m.put("avg_over_time", RangeFunctions::avgOverTime);
    m.put("min_over_time", RangeFunctions::minOverTime);
    m.put("max_over_time", RangeFunctions::maxOverTime);
    m.put("count_over_time", RangeFunctions::countOverTime);
    m.put("last_over_time", RangeFunctions::lastOverTime);
    m.put("present_over_time", RangeFunctions::presentOverTime);
    m.put("stddev_over_time", (s, from, to, rs, re, p, out) -> variance(s, from, to, true, out));
    m.put("stdvar_over_time", (s, from, to, rs, re, p, out) -> variance(s, from, to, false, out));
    m.put("quantile_over_time", RangeFunctions::quantileOverTime);
    FUNCTIONS = Collections.unmodifiableMap(m);
  }

  private RangeFunctions() {
  }

  /**
   * @return the function body, or null if the name is not a range function
   */
  public static RangeFunction get(final String name) {
    return FUNCTIONS.get(name);
  }

  public static boolean exists(final String name) {
    return FUNCTIONS.containsKey(name);
  }

  /**
   * Output of the named function keeps the metric name of its input.
   */
  public static boolean keepsMetricName(final String name) {
    return "last_over_time".equals(name);
  }

  /**
   * Increase over the window, extrapolated to the window bounds. Counter resets are compensated when {@code isCounter}.
   */
  static boolean extrapolatedRate(final List<Sample> samples, final int from, final int to, final long rangeStart,
      final long rangeEnd, final boolean isCounter, final boolean isRate, final double[] out) {
    int count = 0;
    Sample first = null;
    Sample last = null;
    double resultValue = 0;
    double prev = 0;
    for (int i = from; i < to; i++) {
      final Sample s = samples.get(i);
      if (s.isHistogram())
        continue;
      if (first == null)
        first = s;
      else if (isCounter && s.value() < prev)
        resultValue += prev; // counter reset
      prev = s.value();
      last = s;
      count++;
    }
    if (count < 2)
      return false;

    resultValue += last.value() - first.value();

    double durationToStart = (first.timestamp() - rangeStart) / 1000.0;
    final double durationToEnd = (rangeEnd - last.timestamp()) / 1000.0;
    final double sampledInterval = (last.timestamp() - first.timestamp()) / 1000.0;
    final double averageDurationBetweenSamples = sampledInterval / (count - 1);

    if (isCounter && resultValue > 0 && first.value() >= 0) {
      // A COUNTER CANNOT BE EXTRAPOLATED BELOW ZERO
      final double durationToZero = sampledInterval * (first.value() / resultValue);
      if (durationToZero < durationToStart)
        durationToStart = durationToZero;
    }

    final double extrapolationThreshold = averageDurationBetweenSamples * 1.1;
    double extrapolateToInterval = sampledInterval;
    extrapolateToInterval += durationToStart < extrapolationThreshold ? durationToStart : averageDurationBetweenSamples / 2;
    extrapolateToInterval += durationToEnd < extrapolationThreshold ? durationToEnd : averageDurationBetweenSamples / 2;

    resultValue = resultValue * (extrapolateToInterval / sampledInterval);
    if (isRate)
      resultValue = resultValue / ((rangeEnd - rangeStart) / 1000.0);

    out[0] = resultValue;
    return true;
  }

  /**
   * Rate (or difference) between the last two float samples of the window.
   */
  static boolean instantValue(final List<Sample> samples, final int from, final int to, final boolean isRate,
      final double[] out) {
    Sample last = null;
    Sample previous = null;
    for (int i = to - 1; i >= from && previous == null; i--) {
      final Sample s = samples.get(i);
      if (s.isHistogram())
        continue;
      if (last == null)
        last = s;
      else
        previous = s;
    }
    if (previous == null)
      return false;

    double result;
    if (isRate && last.value() < previous.value())
      result = last.value(); // counter reset
    else
      result = last.value() - previous.value();

    if (isRate) {
      final long sampledInterval = last.timestamp() - previous.timestamp();
      if (sampledInterval == 0)
        return false;
      result = result / (sampledInterval / 1000.0);
    }
    out[0] = result;
    return true;
  }

  static boolean changes(final List<Sample> samples, final int from, final int to, final long rangeStart, final long rangeEnd,
      final double param, final double[] out) {
    int changes = 0;
    boolean found = false;
    double prev = 0;
    for (int i = from; i < to; i++) {
      final Sample s = samples.get(i);
      if (s.isHistogram())
        continue;
      if (found && s.value() != prev && !(Double.isNaN(s.value()) && Double.isNaN(prev)))
        changes++;
      prev = s.value();
      found = true;
    }
    if (!found)
      return false;
    out[0] = changes;
    return true;
  }

  static boolean resets(final List<Sample> samples, final int from, final int to, final long rangeStart, final long rangeEnd,
      final double param, final double[] out) {
    int resets = 0;
    boolean found = false;
    double prev = 0;
    for (int i = from; i < to; i++) {
      final Sample s = samples.get(i);
      if (s.isHistogram())
        continue;
      if (found && s.value() < prev)
        resets++;
      prev = s.value();
      found = true;
    }
    if (!found)
      return false;
    out[0] = resets;
    return true;
  }

  /**
   * Per-second derivative from a simple linear regression over the float samples.
   */
  static boolean deriv(final List<Sample> samples, final int from, final int to, final long rangeStart, final long rangeEnd,
      final double param, final double[] out) {
    int n = 0;
    long baseT = 0;
    double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
    for (int i = from; i < to; i++) {
      final Sample s = samples.get(i);
      if (s.isHistogram())
        continue;
      if (n == 0)
        baseT = s.timestamp();
      final double x = (s.timestamp() - baseT) / 1000.0;
      sumX += x;
      sumY += s.value();
      sumXY += x * s.value();
      sumX2 += x * x;
      n++;
    }
    if (n < 2)
      return false;
    final double covXY = sumXY - sumX * sumY / n;
    final double varX = sumX2 - sumX * sumX / n;
    if (varX == 0)
      return false;
    out[0] = covXY / varX;
    return true;
  }

  static boolean sumOverTime(final List<Sample> samples, final int from, final int to, final long rangeStart,
      final long rangeEnd, final double param, final double[] out) {
    final double[] kahan = new double[2];
    boolean found = false;
    for (int i = from; i < to; i++) {
      final Sample s = samples.get(i);
      if (s.isHistogram())
        continue;
      MathUtils.kahanAdd(s.value(), kahan);
      found = true;
    }
    if (!found)
      return false;
    out[0] = MathUtils.kahanResult(kahan);
    return true;
  }

  static boolean avgOverTime(final List<Sample> samples, final int from, final int to, final long rangeStart,
      final long rangeEnd, final double param, final double[] out) {
    double mean = 0;
    int count = 0;
    for (int i = from; i < to; i++) {
      final Sample s = samples.get(i);
      if (s.isHistogram())
        continue;
      count++;
      // INCREMENTAL MEAN DOES NOT OVERFLOW ON LARGE VALUES
      mean += (s.value() - mean) / count;
    }
    if (count == 0)
      return false;
    out[0] = mean;
    return true;
  }

  static boolean minOverTime(final List<Sample> samples, final int from, final int to, final long rangeStart,
      final long rangeEnd, final double param, final double[] out) {
    double min = Double.NaN;
    boolean found = false;
    for (int i = from; i < to; i++) {
      final Sample s = samples.get(i);
      if (s.isHistogram())
        continue;
      if (!found || s.value() < min || Double.isNaN(min))
        min = s.value();
      found = true;
    }
    if (!found)
      return false;
    out[0] = min;
    return true;
  }

  static boolean maxOverTime(final List<Sample> samples, final int from, final int to, final long rangeStart,
      final long rangeEnd, final double param, final double[] out) {
    double max = Double.NaN;
    boolean found = false;
    for (int i = from; i < to; i++) {
      final Sample s = samples.get(i);
      if (s.isHistogram())
        continue;
      if (!found || s.value() > max || Double.isNaN(max))
        max = s.value();
      found = true;
    }
    if (!found)
      return false;
    out[0] = max;
    return true;
  }

  static boolean countOverTime(final List<Sample> samples, final int from, final int to, final long rangeStart,
      final long rangeEnd, final double param, final double[] out) {
    if (to <= from)
      return false;
    out[0] = to - from;
    return true;
  }

  /**
   * Value of the last float sample. A window ending with a histogram is handled by the selector, which emits the histogram.
   */
  static boolean lastOverTime(final List<Sample> samples, final int from, final int to, final long rangeStart,
      final long rangeEnd, final double param, final double[] out) {
    if (to <= from)
      return false;
    final Sample last = samples.get(to - 1);
    if (last.isHistogram())
      return false;
    out[0] = last.value();
    return true;
  }

  static boolean presentOverTime(final List<Sample> samples, final int from, final int to, final long rangeStart,
      final long rangeEnd, final double param, final double[] out) {
    if (to <= from)
      return false;
    out[0] = 1;
    return true;
  }

  static boolean variance(final List<Sample> samples, final int from, final int to, final boolean stddev,
      final double[] out) {
    int count = 0;
    double mean = 0;
    double m2 = 0;
    for (int i = from; i < to; i++) {
      final Sample s = samples.get(i);
      if (s.isHistogram())
        continue;
      count++;
      final double delta = s.value() - mean;
      mean += delta / count;
      m2 += delta * (s.value() - mean);
    }
    if (count == 0)
      return false;
    final double variance = m2 / count;
    out[0] = stddev ? Math.sqrt(variance) : variance;
    return true;
  }

  static boolean quantileOverTime(final List<Sample> samples, final int from, final int to, final long rangeStart,
      final long rangeEnd, final double param, final double[] out) {
    final double[] values = new double[Math.max(0, to - from)];
    int n = 0;
    for (int i = from; i < to; i++) {
      final Sample s = samples.get(i);
      if (!s.isHistogram())
        values[n++] = s.value();
    }
    if (n == 0)
      return false;
    out[0] = MathUtils.quantile(param, values, n);
    return true;
  }
}
