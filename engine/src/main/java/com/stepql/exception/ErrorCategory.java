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
package com.stepql.exception;

/**
 * Categories for organizing error codes.
 * <ul>
 *   <li>{@link #QUERY} - Parsing and plan construction</li>
 *   <li>{@link #EXECUTION} - Errors surfaced while pulling batches, such as cancellation</li>
 *   <li>{@link #STORAGE} - Failures of the series storage</li>
 *   <li>{@link #INTERNAL} - Internal system errors and unexpected conditions</li>
 * </ul>
 */
public enum ErrorCategory {
  QUERY("Query"),
  EXECUTION("Execution"),
  STORAGE("Storage"),
  INTERNAL("Internal");

  private final String displayName;

  ErrorCategory(final String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
