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
package com.stepql.query.promql.ast;

import java.util.List;
import java.util.Locale;

/**
 * Expression tree produced by the parser. The node set is closed: the plan builder handles every kind or rejects it
 * explicitly. {@link #toString()} renders the node back to query text.
 */
public sealed interface PromQLExpr {

  ValueType type();

  enum MatchOp {
    EQ("="), NEQ("!="), RE("=~"), NRE("!~");

    private final String symbol;

    MatchOp(final String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }
  }

  enum AggOp {
    SUM, AVG, MIN, MAX, COUNT, GROUP, STDDEV, STDVAR, TOPK, BOTTOMK, QUANTILE;

    public boolean hasParam() {
      return this == TOPK || this == BOTTOMK || this == QUANTILE;
    }

    public String getName() {
      return name().toLowerCase(Locale.ENGLISH);
    }

    /**
     * @return the operator with the given name, or null if there is none
     */
    public static AggOp fromName(final String name) {
      for (final AggOp op : values())
        if (op.getName().equals(name))
          return op;
      return null;
    }
  }

  enum BinaryOp {
    ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"), POW("^"),
    EQ("=="), NEQ("!="), LT("<"), GT(">"), LTE("<="), GTE(">="),
    AND("and"), OR("or"), UNLESS("unless");

    private final String symbol;

    BinaryOp(final String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }

    public boolean isComparison() {
      return this == EQ || this == NEQ || this == LT || this == GT || this == LTE || this == GTE;
    }

    public boolean isSetOperator() {
      return this == AND || this == OR || this == UNLESS;
    }
  }

  record LabelMatcher(String name, MatchOp op, String value) {
    @Override
    public String toString() {
      return name + op.getSymbol() + PromQLExpr.quote(value);
    }
  }

  record NumberLiteral(double value) implements PromQLExpr {
    @Override
    public ValueType type() {
      return ValueType.SCALAR;
    }

    @Override
    public String toString() {
      if (Double.isNaN(value))
        return "NaN";
      if (Double.isInfinite(value))
        return value > 0 ? "+Inf" : "-Inf";
      if (value == Math.rint(value) && Math.abs(value) < 1e15)
        return Long.toString((long) value);
      return Double.toString(value);
    }
  }

  record StringLiteral(String value) implements PromQLExpr {
    @Override
    public ValueType type() {
      return ValueType.STRING;
    }

    @Override
    public String toString() {
      return PromQLExpr.quote(value);
    }
  }

  record VectorSelector(String metricName, List<LabelMatcher> matchers, long offsetMs) implements PromQLExpr {
    public VectorSelector {
      matchers = List.copyOf(matchers);
    }

    @Override
    public ValueType type() {
      return ValueType.VECTOR;
    }

    @Override
    public String toString() {
      final StringBuilder sb = new StringBuilder();
      if (metricName != null)
        sb.append(metricName);
      if (!matchers.isEmpty() || metricName == null) {
        sb.append('{');
        for (int i = 0; i < matchers.size(); i++) {
          if (i > 0)
            sb.append(',');
          sb.append(matchers.get(i));
        }
        sb.append('}');
      }
      if (offsetMs != 0)
        sb.append(" offset ").append(PromQLExpr.formatDuration(offsetMs));
      return sb.toString();
    }
  }

  record MatrixSelector(VectorSelector selector, long rangeMs) implements PromQLExpr {
    @Override
    public ValueType type() {
      return ValueType.MATRIX;
    }

    @Override
    public String toString() {
      final VectorSelector noOffset = new VectorSelector(selector.metricName(), selector.matchers(), 0);
      final String s = noOffset + "[" + PromQLExpr.formatDuration(rangeMs) + "]";
      return selector.offsetMs() != 0 ? s + " offset " + PromQLExpr.formatDuration(selector.offsetMs()) : s;
    }
  }

  record AggregationExpr(AggOp op, PromQLExpr expr, List<String> groupLabels, boolean without, PromQLExpr param)
      implements PromQLExpr {
    public AggregationExpr {
      groupLabels = List.copyOf(groupLabels);
    }

    @Override
    public ValueType type() {
      return ValueType.VECTOR;
    }

    @Override
    public String toString() {
      final StringBuilder sb = new StringBuilder(op.getName());
      if (without || !groupLabels.isEmpty())
        sb.append(without ? " without (" : " by (").append(String.join(", ", groupLabels)).append(") ");
      sb.append('(');
      if (param != null)
        sb.append(param).append(", ");
      sb.append(expr).append(')');
      return sb.toString();
    }
  }

  record FunctionCallExpr(Function function, List<PromQLExpr> args) implements PromQLExpr {
    public FunctionCallExpr {
      args = List.copyOf(args);
    }

    public String name() {
      return function.name();
    }

    @Override
    public ValueType type() {
      return function.returnType();
    }

    @Override
    public String toString() {
      final StringBuilder sb = new StringBuilder(function.name()).append('(');
      for (int i = 0; i < args.size(); i++) {
        if (i > 0)
          sb.append(", ");
        sb.append(args.get(i));
      }
      return sb.append(')').toString();
    }
  }

  record BinaryExpr(PromQLExpr left, BinaryOp op, PromQLExpr right, boolean returnBool) implements PromQLExpr {
    public BinaryExpr(final PromQLExpr left, final BinaryOp op, final PromQLExpr right) {
      this(left, op, right, false);
    }

    @Override
    public ValueType type() {
      return left.type() == ValueType.SCALAR && right.type() == ValueType.SCALAR ? ValueType.SCALAR : ValueType.VECTOR;
    }

    @Override
    public String toString() {
      return operand(left) + " " + op.getSymbol() + (returnBool ? " bool " : " ") + operand(right);
    }

    private static String operand(final PromQLExpr expr) {
      return expr instanceof BinaryExpr ? "(" + expr + ")" : expr.toString();
    }
  }

  record UnaryExpr(char op, PromQLExpr expr) implements PromQLExpr {
    @Override
    public ValueType type() {
      return expr.type();
    }

    @Override
    public String toString() {
      return op + (expr instanceof BinaryExpr ? "(" + expr + ")" : expr.toString());
    }
  }

  private static String quote(final String s) {
    return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
  }

  static String formatDuration(final long ms) {
    if (ms == 0)
      return "0s";
    if (ms < 0)
      return "-" + formatDuration(-ms);
    final StringBuilder sb = new StringBuilder();
    long rest = ms;
    final long[] units = { 604_800_000L, 86_400_000L, 3_600_000L, 60_000L, 1_000L, 1L };
    final String[] names = { "w", "d", "h", "m", "s", "ms" };
    for (int i = 0; i < units.length; i++) {
      if (rest >= units[i]) {
        sb.append(rest / units[i]).append(names[i]);
        rest %= units[i];
      }
    }
    return sb.toString();
  }
}
