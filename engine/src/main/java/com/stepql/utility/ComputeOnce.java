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

import java.util.function.Supplier;

/**
 * Lazily computes a value exactly once. Concurrent callers block until the first caller completed the computation and then
 * all observe the same result. A computation failing with a {@link RuntimeException} is cached as well: every caller, present
 * and future, receives the same exception. An {@link Error} is rethrown as is and leaves the value uncomputed.
 */
public class ComputeOnce<T> {
  private enum State {UNCOMPUTED, COMPUTING, READY, FAILED}

  private volatile State            state = State.UNCOMPUTED;
  private          T                value;
  private          RuntimeException failure;

  /**
   * Returns the computed value, running {@code supplier} if no caller did it before. Suppliers passed by later callers are
   * ignored.
   */
  public T get(final Supplier<T> supplier) {
    if (state == State.READY)
      return value;

    synchronized (this) {
      while (state == State.COMPUTING) {
        try {
          wait();
        } catch (final InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted while waiting for a lazy computation", e);
        }
      }

      switch (state) {
      case READY:
        return value;
      case FAILED:
        throw failure;
      default:
        state = State.COMPUTING;
      }
    }

    // THE SUPPLIER RUNS OUTSIDE THE LOCK SO IT CAN CALL OTHER COMPUTE-ONCE INSTANCES WITHOUT NESTED MONITORS
    T result = null;
    RuntimeException error = null;
    try {
      result = supplier.get();
    } catch (final RuntimeException e) {
      error = e;
    } catch (final Error e) {
      // ERRORS ARE NOT CACHED: THE NEXT CALLER COMPUTES AGAIN
      synchronized (this) {
        state = State.UNCOMPUTED;
        notifyAll();
      }
      throw e;
    }

    synchronized (this) {
      if (error == null) {
        value = result;
        state = State.READY;
      } else {
        failure = error;
        state = State.FAILED;
      }
      notifyAll();
    }

    if (error != null)
      throw error;
    return result;
  }

  public boolean isComputed() {
    return state == State.READY || state == State.FAILED;
  }
}
