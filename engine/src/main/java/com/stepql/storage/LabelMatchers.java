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
package com.stepql.storage;

import com.stepql.GlobalConfiguration;
import com.stepql.exception.ErrorCode;
import com.stepql.exception.QueryException;
import com.stepql.execution.model.Labels;
import com.stepql.query.promql.ast.PromQLExpr.LabelMatcher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates label matchers against label sets. Regular expressions are fully anchored and compiled once through a bounded
 * LRU cache.
 */
public final class LabelMatchers {
  private static final int     MAX_PATTERN_CACHE = 1024;
  // NESTED QUANTIFIERS (a+)+ OR QUANTIFIED ALTERNATIONS (a|aa)+ BACKTRACK CATASTROPHICALLY
  private static final Pattern REDOS_CHECK       = Pattern.compile(
      "\\((?:[^()\\\\]|\\\\.)*[+*](?:[^()\\\\]|\\\\.)*\\)[+*{]"
          + "|\\((?:[^()\\\\]|\\\\.)*\\|(?:[^()\\\\]|\\\\.)*\\)[+*{]");

  private static final Map<String, Pattern> PATTERN_CACHE = Collections.synchronizedMap(
      new LinkedHashMap<>(MAX_PATTERN_CACHE, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(final Map.Entry<String, Pattern> eldest) {
          return size() > MAX_PATTERN_CACHE;
        }
      });

  private LabelMatchers() {
  }

  public static boolean matches(final Labels labels, final List<LabelMatcher> matchers) {
    for (final LabelMatcher m : matchers)
      if (!matches(labels, m))
        return false;
    return true;
  }

  public static boolean matches(final Labels labels, final LabelMatcher m) {
    final String value = labels.get(m.name());
    return switch (m.op()) {
      case EQ -> value.equals(m.value());
      case NEQ -> !value.equals(m.value());
      case RE -> compilePattern(m.value()).matcher(value).matches();
      case NRE -> !compilePattern(m.value()).matcher(value).matches();
    };
  }

  /**
   * Compiles a regular expression, anchored on both ends by {@link java.util.regex.Matcher#matches()}.
   *
   * @throws QueryException with {@link ErrorCode#INVALID_ARGUMENT} if the expression is too long, risky or invalid
   */
  public static Pattern compilePattern(final String regex) {
    final int maxLength = GlobalConfiguration.QUERY_MAX_REGEX_LENGTH.getValueAsInteger();
    if (regex.length() > maxLength)
      throw new QueryException(ErrorCode.INVALID_ARGUMENT, "Regex pattern exceeds maximum length of " + maxLength + " characters");
    if (REDOS_CHECK.matcher(regex).find())
      throw new QueryException(ErrorCode.INVALID_ARGUMENT, "Regex pattern is not allowed (ReDoS risk): " + regex);

    synchronized (PATTERN_CACHE) {
      return PATTERN_CACHE.computeIfAbsent(regex, r -> {
        try {
          return Pattern.compile(r, Pattern.DOTALL);
        } catch (final PatternSyntaxException e) {
          throw new QueryException(ErrorCode.INVALID_ARGUMENT, "Invalid regex pattern: " + r, e);
        }
      });
    }
  }
}
