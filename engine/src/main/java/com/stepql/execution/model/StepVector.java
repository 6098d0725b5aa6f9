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

import org.eclipse.collections.impl.list.mutable.primitive.DoubleArrayList;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;

import java.util.ArrayList;
import java.util.List;

/**
 * Samples of one step. Every sample carries the id of its series, a position in the series array of the operator that
 * produced the vector. Instances are owned by a {@link VectorPool} and must go back to the pool of the producing operator
 * once consumed.
 */
public final class StepVector {
  private       long            t;
  private final IntArrayList    sampleIds      = new IntArrayList();
  private final DoubleArrayList samples        = new DoubleArrayList();
  private final IntArrayList    histogramIds   = new IntArrayList();
  private final List<Histogram> histograms     = new ArrayList<>();

  StepVector(final long t) {
    this.t = t;
  }

  public long getT() {
    return t;
  }

  public void appendSample(final int id, final double value) {
    sampleIds.add(id);
    samples.add(value);
  }

  public void appendHistogram(final int id, final Histogram h) {
    histogramIds.add(id);
    histograms.add(h);
  }

  public int sampleCount() {
    return sampleIds.size();
  }

  public int histogramCount() {
    return histogramIds.size();
  }

  public boolean isEmpty() {
    return sampleIds.isEmpty() && histogramIds.isEmpty();
  }

  public int getSampleId(final int index) {
    return sampleIds.get(index);
  }

  public double getSample(final int index) {
    return samples.get(index);
  }

  public int getHistogramId(final int index) {
    return histogramIds.get(index);
  }

  public Histogram getHistogram(final int index) {
    return histograms.get(index);
  }

  /**
   * Overwrites the sample at {@code index}. Used by in-place compaction, where {@code index} never exceeds the read position.
   */
  public void setSample(final int index, final int id, final double value) {
    sampleIds.set(index, id);
    samples.set(index, value);
  }

  public void setHistogram(final int index, final int id, final Histogram h) {
    histogramIds.set(index, id);
    histograms.set(index, h);
  }

  /**
   * Drops every float sample from position {@code size} on.
   */
  public void truncateSamples(final int size) {
    for (int i = sampleIds.size() - 1; i >= size; i--) {
      sampleIds.removeAtIndex(i);
      samples.removeAtIndex(i);
    }
  }

  /**
   * Drops every histogram sample from position {@code size} on.
   */
  public void truncateHistograms(final int size) {
    for (int i = histogramIds.size() - 1; i >= size; i--) {
      histogramIds.removeAtIndex(i);
      histograms.remove(i);
    }
  }

  void reset(final long t) {
    this.t = t;
    sampleIds.clear();
    samples.clear();
    histogramIds.clear();
    histograms.clear();
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder("StepVector{t=").append(t);
    for (int i = 0; i < sampleIds.size(); i++)
      sb.append(", ").append(sampleIds.get(i)).append('=').append(samples.get(i));
    for (int i = 0; i < histogramIds.size(); i++)
      sb.append(", ").append(histogramIds.get(i)).append('=').append(histograms.get(i));
    return sb.append('}').toString();
  }
}
