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
package com.stepql.execution;

import com.stepql.exception.QueryCancelledException;
import com.stepql.exception.QueryTimeoutException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation-carrying context passed through every pull. Once cancelled (explicitly, by deadline or by closing) it stays
 * cancelled and {@link #checkForCancellation()} keeps throwing the same exception.
 */
public class QueryContext implements AutoCloseable {
  private final    long                    deadlineNanos;
  private final    long                    timeoutMs;
  private final    List<Runnable>          closeListeners = new CopyOnWriteArrayList<>();
  private volatile QueryCancelledException cancellation;
  private volatile boolean                 closed;

  public QueryContext() {
    this(0);
  }

  /**
   * @param timeoutMs maximum evaluation time in milliseconds, 0 for no limit
   */
  public QueryContext(final long timeoutMs) {
    this.timeoutMs = timeoutMs;
    this.deadlineNanos = timeoutMs > 0 ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs) : 0;
  }

  public void cancel() {
    cancel(new QueryCancelledException("Query cancelled"));
  }

  public synchronized void cancel(final QueryCancelledException reason) {
    if (cancellation == null)
      cancellation = reason;
  }

  public boolean isCancelled() {
    if (cancellation != null)
      return true;
    if (deadlineNanos != 0 && System.nanoTime() - deadlineNanos > 0) {
      cancel(new QueryTimeoutException("Query exceeded the timeout of " + timeoutMs + "ms"));
      return true;
    }
    return false;
  }

  /**
   * @throws QueryCancelledException if the context has been cancelled or its deadline passed
   */
  public void checkForCancellation() {
    if (isCancelled())
      throw cancellation;
  }

  public QueryCancelledException getCancellation() {
    return isCancelled() ? cancellation : null;
  }

  /**
   * Registers a callback invoked when the context is closed.
   */
  public void onClose(final Runnable listener) {
    closeListeners.add(listener);
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Releases the evaluation: background producers still running observe a cancelled context and stop.
   */
  @Override
  public void close() {
    if (closed)
      return;
    closed = true;
    cancel(new QueryCancelledException("Query context closed"));
    for (final Runnable r : closeListeners)
      r.run();
  }
}
