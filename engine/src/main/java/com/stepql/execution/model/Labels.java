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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * Immutable label set, sorted by label name. Empty values are not stored: a label with an empty value is the same as an
 * absent label.
 */
public final class Labels implements Comparable<Labels> {
  public static final String METRIC_NAME = "__name__";
  public static final Labels EMPTY       = new Labels(new String[0], new String[0]);

  private final String[] names;
  private final String[] values;
  private       int      hash;

  private Labels(final String[] names, final String[] values) {
    this.names = names;
    this.values = values;
  }

  /**
   * Creates a label set from alternated names and values: {@code Labels.of("job", "api", "instance", "a:80")}.
   */
  public static Labels of(final String... namesAndValues) {
    if (namesAndValues.length % 2 != 0)
      throw new IllegalArgumentException("Labels require an even number of arguments, got " + namesAndValues.length);
    final Builder b = builder();
    for (int i = 0; i < namesAndValues.length; i += 2)
      b.set(namesAndValues[i], namesAndValues[i + 1]);
    return b.build();
  }

  public static Labels fromMap(final Map<String, String> map) {
    final Builder b = builder();
    for (final Map.Entry<String, String> e : map.entrySet())
      b.set(e.getKey(), e.getValue());
    return b.build();
  }

  public static Builder builder() {
    return new Builder(EMPTY);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public int size() {
    return names.length;
  }

  public boolean isEmpty() {
    return names.length == 0;
  }

  /**
   * @return the label value, or the empty string when the label is not set
   */
  public String get(final String name) {
    final int idx = Arrays.binarySearch(names, name);
    return idx >= 0 ? values[idx] : "";
  }

  public boolean has(final String name) {
    return Arrays.binarySearch(names, name) >= 0;
  }

  public String getName(final int index) {
    return names[index];
  }

  public String getValue(final int index) {
    return values[index];
  }

  public List<String> names() {
    return Collections.unmodifiableList(Arrays.asList(names));
  }

  public void forEach(final BiConsumer<String, String> action) {
    for (int i = 0; i < names.length; i++)
      action.accept(names[i], values[i]);
  }

  public Map<String, String> toMap() {
    final Map<String, String> map = new LinkedHashMap<>(names.length);
    for (int i = 0; i < names.length; i++)
      map.put(names[i], values[i]);
    return map;
  }

  public Labels dropMetricName() {
    return has(METRIC_NAME) ? toBuilder().del(METRIC_NAME).build() : this;
  }

  /**
   * Returns the subset of labels whose name is in {@code keep}.
   */
  public Labels keep(final Collection<String> keep) {
    final Builder b = builder();
    for (int i = 0; i < names.length; i++)
      if (keep.contains(names[i]))
        b.set(names[i], values[i]);
    return b.build();
  }

  /**
   * Returns the labels without the ones whose name is in {@code drop}.
   */
  public Labels without(final Collection<String> drop) {
    final Builder b = builder();
    for (int i = 0; i < names.length; i++)
      if (!drop.contains(names[i]))
        b.set(names[i], values[i]);
    return b.build();
  }

  @Override
  public int compareTo(final Labels other) {
    final int n = Math.min(names.length, other.names.length);
    for (int i = 0; i < n; i++) {
      int c = names[i].compareTo(other.names[i]);
      if (c != 0)
        return c;
      c = values[i].compareTo(other.values[i]);
      if (c != 0)
        return c;
    }
    return Integer.compare(names.length, other.names.length);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Labels))
      return false;
    final Labels other = (Labels) o;
    return Arrays.equals(names, other.names) && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    int h = hash;
    if (h == 0) {
      h = 31 * Arrays.hashCode(names) + Arrays.hashCode(values);
      hash = h;
    }
    return h;
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder("{");
    for (int i = 0; i < names.length; i++) {
      if (i > 0)
        sb.append(", ");
      sb.append(names[i]).append("=\"").append(values[i].replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
    }
    return sb.append('}').toString();
  }

  public static final class Builder {
    private final TreeMap<String, String> labels = new TreeMap<>();

    private Builder(final Labels base) {
      base.forEach(labels::put);
    }

    /**
     * Sets a label. An empty or null value removes it.
     */
    public Builder set(final String name, final String value) {
      if (value == null || value.isEmpty())
        labels.remove(name);
      else
        labels.put(name, value);
      return this;
    }

    public Builder del(final String name) {
      labels.remove(name);
      return this;
    }

    public String get(final String name) {
      final String v = labels.get(name);
      return v != null ? v : "";
    }

    public Labels build() {
      if (labels.isEmpty())
        return EMPTY;
      final List<String> n = new ArrayList<>(labels.keySet());
      final List<String> v = new ArrayList<>(labels.values());
      return new Labels(n.toArray(new String[0]), v.toArray(new String[0]));
    }
  }
}
