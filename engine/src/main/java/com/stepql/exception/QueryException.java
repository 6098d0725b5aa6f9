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
 * Exception thrown when an expression cannot be parsed or turned into an operator tree.
 * <p>
 * These errors are permanent: retrying the same query with the same arguments fails the same way. They are raised
 * synchronously while parsing or building the plan, never while pulling batches.
 * <p>
 * Example usage:
 * <pre>{@code
 * throw new QueryException(ErrorCode.UNKNOWN_FUNCTION, "Unknown function: foo")
 *     .addContext("function", "foo");
 * }</pre>
 *
 * @see ErrorCode
 */
public class QueryException extends StepQLException {

  public QueryException(final ErrorCode errorCode, final String message) {
    super(errorCode, message);
  }

  public QueryException(final ErrorCode errorCode, final String message, final Throwable cause) {
    super(errorCode, message, cause);
  }

  public static QueryException unsupportedExpression(final Object expression) {
    return (QueryException) new QueryException(ErrorCode.UNSUPPORTED_EXPRESSION, "Unsupported expression " + expression)
        .addContext("expression", String.valueOf(expression));
  }

  public static QueryException unknownFunction(final String name) {
    return (QueryException) new QueryException(ErrorCode.UNKNOWN_FUNCTION, "Unknown function: " + name)
        .addContext("function", name);
  }

  public static QueryException notImplemented(final Object expression) {
    return (QueryException) new QueryException(ErrorCode.NOT_IMPLEMENTED, "Not implemented: got " + expression)
        .addContext("expression", String.valueOf(expression));
  }
}
