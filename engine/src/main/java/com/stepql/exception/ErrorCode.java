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

import java.util.HashMap;
import java.util.Map;

/**
 * Standardized error codes. Codes are organized in categories based on the first digit:
 * <ul>
 *   <li>3xxx - Query errors (parsing, plan construction)</li>
 *   <li>4xxx - Execution errors (cancellation, timeouts)</li>
 *   <li>5xxx - Storage errors</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 */
public enum ErrorCode {

  // ========== Query Errors (3xxx) ==========
  /** Query syntax is invalid or malformed */
  QUERY_SYNTAX_ERROR(3001, "Query syntax error"),

  /** The expression kind or call shape cannot be turned into an operator */
  UNSUPPORTED_EXPRESSION(3002, "Unsupported expression"),

  /** The function name is not present in any dispatch table */
  UNKNOWN_FUNCTION(3003, "Unknown function"),

  /** An argument resolves to a value type the operator does not implement */
  NOT_IMPLEMENTED(3004, "Not implemented"),

  /** An argument or parameter is invalid (regex, label name, time range) */
  INVALID_ARGUMENT(3005, "Invalid argument"),

  // ========== Execution Errors (4xxx) ==========
  /** The query context was cancelled */
  QUERY_CANCELLED(4001, "Query cancelled"),

  /** The query deadline expired */
  QUERY_TIMEOUT(4002, "Query timeout"),

  // ========== Storage Errors (5xxx) ==========
  /** The storage failed to return series */
  STORAGE_ERROR(5001, "Storage error"),

  // ========== General Errors (99xxx) ==========
  /** Unexpected internal error */
  INTERNAL_ERROR(99001, "Internal error"),

  /** Error of unknown origin */
  UNKNOWN_ERROR(99999, "Unknown error");

  private static final Map<Integer, ErrorCode> BY_CODE = new HashMap<>();

  static {
    for (final ErrorCode code : values())
      if (BY_CODE.put(code.code, code) != null)
        throw new ExceptionInInitializerError("Duplicated error code " + code.code);
  }

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  public int getCode() {
    return code;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }

  public ErrorCategory getCategory() {
    if (code >= 99000)
      return ErrorCategory.INTERNAL;
    return switch (code / 1000) {
      case 3 -> ErrorCategory.QUERY;
      case 4 -> ErrorCategory.EXECUTION;
      case 5 -> ErrorCategory.STORAGE;
      default -> ErrorCategory.INTERNAL;
    };
  }

  /**
   * Returns the error code for a numeric code, or {@link #UNKNOWN_ERROR} if not found.
   */
  public static ErrorCode fromCode(final int code) {
    return BY_CODE.getOrDefault(code, UNKNOWN_ERROR);
  }
}
