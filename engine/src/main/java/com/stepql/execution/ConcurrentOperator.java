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

import com.conversantmedia.util.concurrent.PushPullBlockingQueue;
import com.stepql.exception.ErrorCode;
import com.stepql.exception.QueryCancelledException;
import com.stepql.exception.StepQLException;
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import com.stepql.execution.model.VectorPool;
import com.stepql.log.LogManager;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;

/**
 * Runs the wrapped operator in a background producer thread that stays at most one batch ahead of the consumer. Batches
 * flow through a single-slot hand-off queue in production order. Series and pool are the wrapped operator's.
 */
public class ConcurrentOperator implements VectorOperator {
  private static final AtomicInteger THREAD_IDS = new AtomicInteger();
  private static final Message       END        = new Message(null, null);

  private final    VectorOperator         next;
  private final    BlockingQueue<Message> buffer;
  private final    long                   pollIntervalMs;
  private volatile ProducerThread         producer;
  private          boolean                finished;
  private          RuntimeException       failure;

  private record Message(List<StepVector> batch, RuntimeException error) {
  }

  public ConcurrentOperator(final VectorOperator next, final QueryOptions options) {
    this.next = next;
    this.pollIntervalMs = options.getOperatorPollInterval();

    final String cfgQueueImpl = options.getOperatorQueueImpl();
    if ("fast".equalsIgnoreCase(cfgQueueImpl))
      this.buffer = new PushPullBlockingQueue<>(1);
    else if ("standard".equalsIgnoreCase(cfgQueueImpl))
      this.buffer = new ArrayBlockingQueue<>(1);
    else {
      // WARNING AND THEN USE THE DEFAULT
      LogManager.instance().log(this, Level.WARNING, "Error on operator queue implementation setting: %s is not supported",
          cfgQueueImpl);
      this.buffer = new ArrayBlockingQueue<>(1);
    }
  }

  @Override
  public List<StepVector> next(final QueryContext context) {
    checkForCancellation(context);

    if (finished) {
      if (failure != null)
        throw failure;
      return null;
    }

    if (producer == null)
      start(context);

    while (true) {
      final Message message;
      try {
        message = buffer.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new QueryCancelledException("Interrupted while waiting for operator " + next.describe(), e);
      }

      if (message == null) {
        checkForCancellation(context);
        continue;
      }

      if (message == END) {
        finished = true;
        return null;
      }

      if (message.error() != null) {
        finished = true;
        failure = message.error();
        throw failure;
      }

      return message.batch();
    }
  }

  private void checkForCancellation(final QueryContext context) {
    try {
      context.checkForCancellation();
    } catch (final QueryCancelledException e) {
      releaseBuffered();
      throw e;
    }
  }

  /**
   * Gives a batch still waiting in the hand-off queue back to the wrapped operator's pool.
   */
  private void releaseBuffered() {
    final Message pending = buffer.poll();
    if (pending != null && pending.batch() != null)
      next.getPool().putVectors(pending.batch());
  }

  @Override
  public List<Labels> series(final QueryContext context) {
    return next.series(context);
  }

  @Override
  public VectorPool getPool() {
    return next.getPool();
  }

  @Override
  public String describe() {
    return "[concurrent(buff=1)]";
  }

  @Override
  public List<VectorOperator> getChildren() {
    return List.of(next);
  }

  public VectorOperator getWrapped() {
    return next;
  }

  boolean isProducerAlive() {
    final ProducerThread p = producer;
    return p != null && p.isAlive();
  }

  private synchronized void start(final QueryContext context) {
    if (producer != null)
      return;
    producer = new ProducerThread(context, LogManager.instance().getContext());
    producer.start();
  }

  private class ProducerThread extends Thread {
    private final QueryContext context;
    private final String       logContext;

    private ProducerThread(final QueryContext context, final String logContext) {
      super("StepQL-Operator-" + THREAD_IDS.incrementAndGet());
      this.context = context;
      this.logContext = logContext;
      setDaemon(true);
    }

    @Override
    public void run() {
      LogManager.instance().setContext(logContext);
      LogManager.instance().log(this, Level.FINE, "Started producer for %s", next.describe());
      try {
        while (!context.isCancelled()) {
          final List<StepVector> batch = next.next(context);
          if (batch == null) {
            publish(END);
            return;
          }
          if (!publish(new Message(batch, null))) {
            next.getPool().putVectors(batch);
            break;
          }
        }
        // CANCELLED: A BATCH LEFT IN THE QUEUE MAY NEVER BE PICKED UP BY THE CONSUMER
        releaseBuffered();
      } catch (final RuntimeException e) {
        LogManager.instance().log(this, Level.FINE, "Producer for %s failed, forwarding the error to the consumer", e,
            next.describe());
        publish(new Message(null, e));
      } catch (final Error e) {
        LogManager.instance().log(this, Level.SEVERE, "Producer for %s failed", e, next.describe());
        publish(new Message(null, new StepQLException(ErrorCode.INTERNAL_ERROR, "Operator failed: " + e, e)));
      } finally {
        LogManager.instance().log(this, Level.FINE, "Stopped producer for %s", next.describe());
        LogManager.instance().setContext(null);
      }
    }

    /**
     * Blocks until the consumer has room for the message.
     *
     * @return false if the context got cancelled before the message could be handed over
     */
    private boolean publish(final Message message) {
      try {
        while (!buffer.offer(message, pollIntervalMs, TimeUnit.MILLISECONDS)) {
          if (context.isCancelled())
            return false;
        }
        return true;
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    }
  }
}
