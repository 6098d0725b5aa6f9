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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StepVectorTest {

  @Test
  void testInPlaceCompaction() {
    final VectorPool pool = new VectorPool(4);
    final StepVector v = pool.getStepVector(1000);
    v.appendSample(0, 1);
    v.appendSample(1, -2);
    v.appendSample(2, 3);
    v.appendSample(3, -4);

    int write = 0;
    for (int read = 0; read < v.sampleCount(); read++)
      if (v.getSample(read) > 0)
        v.setSample(write++, v.getSampleId(read), v.getSample(read) * 10);
    v.truncateSamples(write);

    assertThat(v.sampleCount()).isEqualTo(2);
    assertThat(v.getSampleId(0)).isEqualTo(0);
    assertThat(v.getSample(0)).isEqualTo(10);
    assertThat(v.getSampleId(1)).isEqualTo(2);
    assertThat(v.getSample(1)).isEqualTo(30);
  }

  @Test
  void testHistograms() {
    final VectorPool pool = new VectorPool(1);
    final StepVector v = pool.getStepVector(0);
    final Histogram h = Histogram.fromCumulative(new double[] { 1, Double.POSITIVE_INFINITY }, new double[] { 1, 2 }, 3);
    v.appendHistogram(5, h);
    assertThat(v.isEmpty()).isFalse();
    assertThat(v.histogramCount()).isEqualTo(1);
    assertThat(v.getHistogramId(0)).isEqualTo(5);
    assertThat(v.getHistogram(0)).isSameAs(h);

    v.truncateHistograms(0);
    assertThat(v.isEmpty()).isTrue();
  }

  @Test
  void testPoolReusesVectors() {
    final VectorPool pool = new VectorPool(2);
    final List<StepVector> batch = pool.getVectorBatch();
    final StepVector first = pool.getStepVector(10);
    first.appendSample(0, 1);
    batch.add(first);
    batch.add(pool.getStepVector(20));
    assertThat(pool.getAllocatedVectors()).isEqualTo(2);

    pool.putVectors(batch);
    assertThat(batch).isEmpty();

    final StepVector reused = pool.getStepVector(30);
    pool.getStepVector(40);
    assertThat(pool.getAllocatedVectors()).isEqualTo(2);
    assertThat(reused.getT()).isEqualTo(30);
    assertThat(reused.isEmpty()).isTrue();

    assertThat(pool.getVectorBatch()).isSameAs(batch);
  }

  @Test
  void testStepsBatchAtLeastOne() {
    assertThat(new VectorPool(0).getStepsBatch()).isEqualTo(1);
  }
}
