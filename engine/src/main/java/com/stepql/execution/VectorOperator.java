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

import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import com.stepql.execution.model.VectorPool;

import java.util.Collections;
import java.util.List;

/**
 * Physical operator. Consumers pull batches with {@link #next(QueryContext)} until it returns {@code null}, resolving sample
 * ids through the array returned by {@link #series(QueryContext)}, and give every consumed batch back to
 * {@link #getPool()}.
 */
public interface VectorOperator {

  static String getIndent(final int depth, final int indent) {
    final StringBuilder result = new StringBuilder();
    for (int i = 0; i < depth; i++)
      for (int j = 0; j < indent; j++)
        result.append(" ");
    return result.toString();
  }

  /**
   * Pulls the next batch: one step vector per step, up to the configured steps batch, each possibly empty.
   *
   * @return the batch, or {@code null} once all steps have been produced
   * @throws com.stepql.exception.QueryCancelledException if the context is cancelled
   */
  List<StepVector> next(QueryContext context);

  /**
   * Returns the series array indexed by sample ids. Computed once on first call; callers must not modify it.
   */
  List<Labels> series(QueryContext context);

  VectorPool getPool();

  /**
   * One-line description of this node, without children.
   */
  String describe();

  default List<VectorOperator> getChildren() {
    return Collections.emptyList();
  }

  /**
   * Human-readable description of this node and its children.
   */
  default String explain() {
    return prettyPrint(0, 2);
  }

  default String prettyPrint(final int depth, final int indent) {
    final StringBuilder result = new StringBuilder(getIndent(depth, indent)).append(describe());
    for (final VectorOperator child : getChildren())
      result.append("\n").append(child.prettyPrint(depth + 1, indent));
    return result.toString();
  }
}
