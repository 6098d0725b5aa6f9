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
package com.stepql.execution.function;

import com.stepql.exception.ErrorCode;
import com.stepql.exception.QueryException;
import com.stepql.execution.QueryContext;
import com.stepql.execution.VectorOperator;
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import com.stepql.execution.model.VectorPool;
import com.stepql.query.promql.ast.PromQLExpr;
import com.stepql.query.promql.ast.PromQLExpr.FunctionCallExpr;
import com.stepql.query.promql.ast.PromQLExpr.StringLiteral;
import com.stepql.storage.LabelMatchers;
import com.stepql.utility.ComputeOnce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code label_replace} and {@code label_join}: rewrite the series labels, batches flow through untouched.
 */
public class RelabelFunctionOperator implements VectorOperator {
  private static final Pattern LABEL_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

  private final FunctionCallExpr          funcExpr;
  private final VectorOperator            next;
  private final List<String>              stringArgs;
  private final Pattern                   regex;
  private final ComputeOnce<List<Labels>> series = new ComputeOnce<>();

  public RelabelFunctionOperator(final FunctionCallExpr funcExpr, final VectorOperator next) {
    this.funcExpr = funcExpr;
    this.next = next;

    final List<String> strings = new ArrayList<>();
    for (final PromQLExpr arg : funcExpr.args())
      if (arg instanceof StringLiteral s)
        strings.add(s.value());
    this.stringArgs = Collections.unmodifiableList(strings);

    final boolean replace = "label_replace".equals(funcExpr.name());
    if (stringArgs.size() < (replace ? 4 : 2))
      throw new QueryException(ErrorCode.INVALID_ARGUMENT, "Invalid number of arguments for " + funcExpr.name());

    final String dst = stringArgs.get(0);
    if (!LABEL_NAME.matcher(dst).matches())
      throw new QueryException(ErrorCode.INVALID_ARGUMENT, "Invalid destination label name in " + funcExpr.name() + ": " + dst);

    if (replace) {
      final String src = stringArgs.get(2);
      if (!LABEL_NAME.matcher(src).matches())
        throw new QueryException(ErrorCode.INVALID_ARGUMENT, "Invalid source label name in label_replace: " + src);
      this.regex = LabelMatchers.compilePattern(stringArgs.get(3));
    } else {
      for (final String src : stringArgs.subList(2, stringArgs.size()))
        if (!LABEL_NAME.matcher(src).matches())
          throw new QueryException(ErrorCode.INVALID_ARGUMENT, "Invalid source label name in label_join: " + src);
      this.regex = null;
    }
  }

  @Override
  public List<StepVector> next(final QueryContext context) {
    context.checkForCancellation();
    return next.next(context);
  }

  @Override
  public List<Labels> series(final QueryContext context) {
    return series.get(() -> {
      final List<Labels> input = next.series(context);
      final List<Labels> output = new ArrayList<>(input.size());
      for (final Labels l : input)
        output.add(regex != null ? replace(l) : join(l));
      return Collections.unmodifiableList(output);
    });
  }

  private Labels replace(final Labels labels) {
    final Matcher m = regex.matcher(labels.get(stringArgs.get(2)));
    if (!m.matches())
      return labels;
    return labels.toBuilder().set(stringArgs.get(0), expand(m, stringArgs.get(1))).build();
  }

  private Labels join(final Labels labels) {
    final String separator = stringArgs.get(1);
    final StringBuilder value = new StringBuilder();
    for (int i = 2; i < stringArgs.size(); i++) {
      if (i > 2)
        value.append(separator);
      value.append(labels.get(stringArgs.get(i)));
    }
    return labels.toBuilder().set(stringArgs.get(0), value.toString()).build();
  }

  /**
   * Expands {@code $1}, {@code ${1}}, {@code $name}, {@code ${name}} and {@code $$} in the template. References to groups
   * that do not exist expand to the empty string.
   */
  static String expand(final Matcher m, final String template) {
    final StringBuilder out = new StringBuilder(template.length());
    int i = 0;
    while (i < template.length()) {
      final char c = template.charAt(i);
      if (c != '$' || i + 1 >= template.length()) {
        out.append(c);
        i++;
        continue;
      }

      final char n = template.charAt(i + 1);
      if (n == '$') {
        out.append('$');
        i += 2;
        continue;
      }

      final String ref;
      if (n == '{') {
        final int close = template.indexOf('}', i + 2);
        if (close < 0) {
          out.append(c);
          i++;
          continue;
        }
        ref = template.substring(i + 2, close);
        i = close + 1;
      } else {
        int j = i + 1;
        while (j < template.length() && isNameChar(template.charAt(j)))
          j++;
        if (j == i + 1) {
          out.append(c);
          i++;
          continue;
        }
        ref = template.substring(i + 1, j);
        i = j;
      }
      out.append(group(m, ref));
    }
    return out.toString();
  }

  private static String group(final Matcher m, final String ref) {
    if (ref.isEmpty())
      return "";
    String value;
    if (ref.chars().allMatch(Character::isDigit)) {
      final int index = ref.length() < 10 ? Integer.parseInt(ref) : Integer.MAX_VALUE;
      value = index <= m.groupCount() ? m.group(index) : null;
    } else {
      try {
        value = m.group(ref);
      } catch (final IllegalArgumentException e) {
        // NO GROUP WITH THIS NAME
        value = null;
      }
    }
    return value != null ? value : "";
  }

  private static boolean isNameChar(final char c) {
    return c == '_' || Character.isLetterOrDigit(c);
  }

  @Override
  public VectorPool getPool() {
    return next.getPool();
  }

  @Override
  public String describe() {
    return "[relabel] " + funcExpr;
  }

  @Override
  public List<VectorOperator> getChildren() {
    return List.of(next);
  }
}
