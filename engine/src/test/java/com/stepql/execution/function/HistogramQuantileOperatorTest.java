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

import com.stepql.exception.QueryCancelledException;
import com.stepql.execution.QueryContext;
import com.stepql.execution.QueryOptions;
import com.stepql.execution.ScriptedOperator;
import com.stepql.execution.model.Histogram;
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HistogramQuantileOperatorTest {
  private static final double INF = Double.POSITIVE_INFINITY;

  private final QueryContext context = new QueryContext();

  private static Labels bucket(final String job, final String le) {
    return Labels.of("__name__", "latency_bucket", "job", job, "le", le);
  }

  @Test
  void testBucketQuantile() {
    assertThat(HistogramQuantileOperator.bucketQuantile(0.5, new double[] { 1, 2, INF }, new double[] { 1, 3, 4 })).isEqualTo(1.5);
    // UNORDERED INPUT
    assertThat(HistogramQuantileOperator.bucketQuantile(0.5, new double[] { INF, 2, 1 }, new double[] { 4, 3, 1 })).isEqualTo(1.5);
    // RANK IN THE +Inf BUCKET
    assertThat(HistogramQuantileOperator.bucketQuantile(0.99, new double[] { 1, 2, INF }, new double[] { 1, 3, 4 })).isEqualTo(2);
    // DECREASING COUNTS ARE FIXED UP
    assertThat(HistogramQuantileOperator.bucketQuantile(0.25, new double[] { 1, 2, INF }, new double[] { 2, 1, 4 })).isEqualTo(0.5);
  }

  @Test
  void testBucketQuantileEdgeCases() {
    assertThat(HistogramQuantileOperator.bucketQuantile(0.5, new double[] { 1, 2 }, new double[] { 1, 3 })).isNaN();
    assertThat(HistogramQuantileOperator.bucketQuantile(0.5, new double[] { INF }, new double[] { 3 })).isNaN();
    assertThat(HistogramQuantileOperator.bucketQuantile(0.5, new double[] { 1, INF }, new double[] { 0, 0 })).isNaN();
    assertThat(HistogramQuantileOperator.bucketQuantile(Double.NaN, new double[] { 1, INF }, new double[] { 1, 2 })).isNaN();
    assertThat(HistogramQuantileOperator.bucketQuantile(-1, new double[] { 1, INF }, new double[] { 1, 2 })).isEqualTo(
        Double.NEGATIVE_INFINITY);
    assertThat(HistogramQuantileOperator.bucketQuantile(2, new double[] { 1, INF }, new double[] { 1, 2 })).isEqualTo(INF);
  }

  @Test
  void testParseBound() {
    assertThat(HistogramQuantileOperator.parseBound("0.25")).isEqualTo(0.25);
    assertThat(HistogramQuantileOperator.parseBound("+Inf")).isEqualTo(INF);
    assertThat(HistogramQuantileOperator.parseBound("abc")).isNaN();
  }

  @Test
  void testClassicBuckets() {
    final ScriptedOperator buckets = new ScriptedOperator(10,//
        bucket("api", "1"), bucket("api", "2"), bucket("api", "+Inf"),//
        bucket("db", "1"), bucket("db", "+Inf"))//
        .step(0, 0, 1, 1, 3, 2, 4)//
        .step(1000, 0, 1, 1, 3, 2, 4, 3, 2, 4, 2);
    final ScriptedOperator q = new ScriptedOperator(10, Labels.EMPTY).step(0, 0, 0.5).step(1000, 0, 0.5);

    final HistogramQuantileOperator op = new HistogramQuantileOperator(q, buckets, QueryOptions.of(0, 1000, 1000));
    assertThat(op.series(context)).containsExactly(Labels.of("job", "api"), Labels.of("job", "db"));

    final List<StepVector> steps = ScriptedOperator.flatten(ScriptedOperator.drain(op, context));
    assertThat(steps).hasSize(2);
    // THE db GROUP HAS NO DATA AT THE FIRST STEP
    assertThat(steps.get(0).sampleCount()).isEqualTo(1);
    assertThat(steps.get(0).getSampleId(0)).isEqualTo(0);
    assertThat(steps.get(0).getSample(0)).isEqualTo(1.5);
    assertThat(steps.get(1).sampleCount()).isEqualTo(2);
    // ALL db OBSERVATIONS ARE <= 1: INTERPOLATION INSIDE [0, 1]
    assertThat(steps.get(1).getSample(1)).isEqualTo(0.5);
    assertThat(op.getChildren()).containsExactly(q, buckets);
  }

  @Test
  void testNativeHistogram() {
    final Histogram h = Histogram.fromCumulative(new double[] { 1, 2, 4 }, new double[] { 2, 6, 8 }, 10);
    final ScriptedOperator input = new ScriptedOperator(10, Labels.of("__name__", "latency", "job", "api"))//
        .histogramStep(0, 0, h);
    final ScriptedOperator q = new ScriptedOperator(10, Labels.EMPTY).step(0, 0, 0.5);

    final HistogramQuantileOperator op = new HistogramQuantileOperator(q, input, QueryOptions.of(0, 0, 1));
    assertThat(op.series(context)).containsExactly(Labels.of("job", "api"));
    assertThat(op.next(context).get(0).getSample(0)).isEqualTo(h.quantile(0.5));
  }

  @Test
  void testInvalidBoundIsIgnored() {
    final ScriptedOperator buckets = new ScriptedOperator(10, bucket("api", "abc"), bucket("api", "+Inf"))//
        .step(0, 0, 1, 1, 1);
    final ScriptedOperator q = new ScriptedOperator(10, Labels.EMPTY).step(0, 0, 0.5);
    final HistogramQuantileOperator op = new HistogramQuantileOperator(q, buckets, QueryOptions.of(0, 0, 1));

    // ONLY THE +Inf BUCKET REMAINS: NOT ENOUGH BUCKETS
    assertThat(op.next(context).get(0).getSample(0)).isNaN();
  }

  @Test
  void testBucketFailureSkipsQuantileArgument() {
    final IllegalStateException error = new IllegalStateException("storage failure");
    final ScriptedOperator buckets = new ScriptedOperator(10, bucket("api", "1"), bucket("api", "+Inf")).failAfterSteps(error);
    final ScriptedOperator q = new ScriptedOperator(10, Labels.EMPTY).step(0, 0, 0.5);
    final HistogramQuantileOperator op = new HistogramQuantileOperator(q, buckets, QueryOptions.of(0, 0, 1));

    assertThatThrownBy(() -> op.next(context)).isSameAs(error);
    assertThat(q.getPulls()).isZero();
  }

  @Test
  void testCancelledBeforeFirstPull() {
    final ScriptedOperator buckets = new ScriptedOperator(10, bucket("api", "+Inf")).step(0, 0, 1);
    final ScriptedOperator q = new ScriptedOperator(10, Labels.EMPTY).step(0, 0, 0.5);
    final HistogramQuantileOperator op = new HistogramQuantileOperator(q, buckets, QueryOptions.of(0, 0, 1));

    final QueryContext cancelled = new QueryContext();
    cancelled.cancel();
    assertThatThrownBy(() -> op.next(cancelled)).isInstanceOf(QueryCancelledException.class);
    assertThat(buckets.getPulls()).isZero();
    assertThat(q.getPulls()).isZero();
  }
}
