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
package com.stepql.execution.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable histogram sample with explicit, non-overlapping buckets in ascending order. Bucket counts are not cumulative.
 */
public final class Histogram {
  public record Bucket(double lower, double upper, double count) {
  }

  private final double       count;
  private final double       sum;
  private final List<Bucket> buckets;

  public Histogram(final double count, final double sum, final List<Bucket> buckets) {
    this.count = count;
    this.sum = sum;
    this.buckets = List.copyOf(buckets);
  }

  /**
   * Builds a histogram from cumulative upper bounds, as exposed by classic bucket series. The first bucket's lower bound is 0
   * when its upper bound is positive, otherwise negative infinity.
   */
  public static Histogram fromCumulative(final double[] upperBounds, final double[] cumulativeCounts, final double sum) {
    final List<Bucket> buckets = new ArrayList<>(upperBounds.length);
    double lower = upperBounds.length > 0 && upperBounds[0] > 0 ? 0 : Double.NEGATIVE_INFINITY;
    double previous = 0;
    for (int i = 0; i < upperBounds.length; i++) {
      buckets.add(new Bucket(lower, upperBounds[i], cumulativeCounts[i] - previous));
      previous = cumulativeCounts[i];
      lower = upperBounds[i];
    }
    return new Histogram(previous, sum, buckets);
  }

  public double getCount() {
    return count;
  }

  public double getSum() {
    return sum;
  }

  public List<Bucket> getBuckets() {
    return buckets;
  }

  /**
   * Estimates the φ-quantile with linear interpolation inside the bucket holding the rank.
   */
  public double quantile(final double q) {
    if (Double.isNaN(q))
      return Double.NaN;
    if (q < 0)
      return Double.NEGATIVE_INFINITY;
    if (q > 1)
      return Double.POSITIVE_INFINITY;
    if (count == 0 || buckets.isEmpty())
      return Double.NaN;

    final double rank = q * count;
    double cumulative = 0;
    for (final Bucket b : buckets) {
      if (b.count() <= 0)
        continue;
      if (cumulative + b.count() >= rank) {
        if (Double.isInfinite(b.upper()))
          return b.lower();
        if (Double.isInfinite(b.lower()))
          return b.upper();
        return b.lower() + (b.upper() - b.lower()) * ((rank - cumulative) / b.count());
      }
      cumulative += b.count();
    }
    return buckets.get(buckets.size() - 1).upper();
  }

  /**
   * Estimates the fraction of observations between {@code lower} and {@code upper}, interpolating linearly inside the
   * buckets crossing a boundary.
   */
  public double fraction(final double lower, final double upper) {
    if (count == 0 || Double.isNaN(lower) || Double.isNaN(upper))
      return Double.NaN;
    if (lower >= upper)
      return 0;

    double inside = 0;
    for (final Bucket b : buckets) {
      if (b.upper() <= lower || b.lower() >= upper)
        continue;
      if (b.lower() >= lower && b.upper() <= upper) {
        inside += b.count();
        continue;
      }
      if (Double.isInfinite(b.lower()) || Double.isInfinite(b.upper())) {
        // CANNOT INTERPOLATE INSIDE AN OPEN BUCKET
        if (b.lower() >= lower || b.upper() <= upper)
          inside += b.count();
        continue;
      }
      final double from = Math.max(lower, b.lower());
      final double to = Math.min(upper, b.upper());
      inside += b.count() * (to - from) / (b.upper() - b.lower());
    }
    return inside / count;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Histogram))
      return false;
    final Histogram other = (Histogram) o;
    return Double.compare(count, other.count) == 0 && Double.compare(sum, other.sum) == 0 && buckets.equals(other.buckets);
  }

  @Override
  public int hashCode() {
    return (31 * Double.hashCode(count) + Double.hashCode(sum)) * 31 + buckets.hashCode();
  }

  @Override
  public String toString() {
    return "{count:" + count + ", sum:" + sum + ", buckets:" + buckets + "}";
  }
}
