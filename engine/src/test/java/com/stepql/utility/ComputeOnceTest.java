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
package com.stepql.utility;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComputeOnceTest {

  @Test
  void testComputedOnce() {
    final ComputeOnce<List<String>> once = new ComputeOnce<>();
    final AtomicInteger calls = new AtomicInteger();

    assertThat(once.isComputed()).isFalse();
    final List<String> first = once.get(() -> {
      calls.incrementAndGet();
      return List.of("a");
    });
    final List<String> second = once.get(() -> {
      calls.incrementAndGet();
      return List.of("b");
    });

    assertThat(second).isSameAs(first);
    assertThat(calls.get()).isEqualTo(1);
    assertThat(once.isComputed()).isTrue();
  }

  @Test
  void testConcurrentCallersObserveSameValue() throws Exception {
    final ComputeOnce<Object> once = new ComputeOnce<>();
    final AtomicInteger calls = new AtomicInteger();
    final int threads = 8;
    final CountDownLatch start = new CountDownLatch(1);

    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final List<Future<Object>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        final Callable<Object> task = () -> {
          start.await();
          return once.get(() -> {
            calls.incrementAndGet();
            try {
              Thread.sleep(50);
            } catch (final InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            return new Object();
          });
        };
        futures.add(executor.submit(task));
      }
      start.countDown();

      final Object expected = futures.get(0).get(5, TimeUnit.SECONDS);
      for (final Future<Object> f : futures)
        assertThat(f.get(5, TimeUnit.SECONDS)).isSameAs(expected);
      assertThat(calls.get()).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void testFailureIsCached() {
    final ComputeOnce<String> once = new ComputeOnce<>();
    final AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(() -> once.get(() -> {
      calls.incrementAndGet();
      throw new IllegalArgumentException("boom");
    })).isInstanceOf(IllegalArgumentException.class).hasMessage("boom");

    assertThatThrownBy(() -> once.get(() -> "ok")).isInstanceOf(IllegalArgumentException.class).hasMessage("boom");
    assertThat(calls.get()).isEqualTo(1);
    assertThat(once.isComputed()).isTrue();
  }

  @Test
  void testErrorIsRethrownAndNotCached() {
    final ComputeOnce<String> once = new ComputeOnce<>();
    final AssertionError error = new AssertionError("out of resources");

    assertThatThrownBy(() -> once.get(() -> {
      throw error;
    })).isSameAs(error);
    assertThat(once.isComputed()).isFalse();

    assertThat(once.get(() -> "recovered")).isEqualTo("recovered");
    assertThat(once.isComputed()).isTrue();
  }
}
