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
package com.stepql.query.promql;

import com.stepql.exception.ErrorCode;
import com.stepql.exception.QueryException;
import com.stepql.query.promql.ast.Function;
import com.stepql.query.promql.ast.Functions;
import com.stepql.query.promql.ast.PromQLExpr;
import com.stepql.query.promql.ast.PromQLExpr.AggOp;
import com.stepql.query.promql.ast.PromQLExpr.AggregationExpr;
import com.stepql.query.promql.ast.PromQLExpr.BinaryExpr;
import com.stepql.query.promql.ast.PromQLExpr.BinaryOp;
import com.stepql.query.promql.ast.PromQLExpr.FunctionCallExpr;
import com.stepql.query.promql.ast.PromQLExpr.LabelMatcher;
import com.stepql.query.promql.ast.PromQLExpr.MatchOp;
import com.stepql.query.promql.ast.PromQLExpr.MatrixSelector;
import com.stepql.query.promql.ast.PromQLExpr.NumberLiteral;
import com.stepql.query.promql.ast.PromQLExpr.StringLiteral;
import com.stepql.query.promql.ast.PromQLExpr.UnaryExpr;
import com.stepql.query.promql.ast.PromQLExpr.VectorSelector;
import com.stepql.query.promql.ast.ValueType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for PromQL expressions. Function calls are checked against the {@link Functions} registry
 * (arity and argument types), so the resulting tree is well typed.
 */
public class PromQLParser {
  private static final int MAX_PARSE_DEPTH = 128;

  private final Lexer lexer;
  private       int   parseDepth;

  public PromQLParser(final String input) {
    this.lexer = new Lexer(input);
  }

  public static PromQLExpr parse(final String query) {
    return new PromQLParser(query).parse();
  }

  public PromQLExpr parse() {
    final PromQLExpr expr = parseOr();
    if (lexer.hasMore())
      throw syntaxError("Unexpected token: '" + lexer.peek() + "' at position " + lexer.pos);
    return expr;
  }

  // --- Operator precedence chain ---

  private PromQLExpr parseOr() {
    enterLevel();
    try {
      PromQLExpr left = parseAndUnless();
      while (lexer.matchKeyword("or"))
        left = binary(left, BinaryOp.OR, false, parseAndUnless());
      return left;
    } finally {
      parseDepth--;
    }
  }

  private PromQLExpr parseAndUnless() {
    PromQLExpr left = parseComparison();
    while (true) {
      if (lexer.matchKeyword("and"))
        left = binary(left, BinaryOp.AND, false, parseComparison());
      else if (lexer.matchKeyword("unless"))
        left = binary(left, BinaryOp.UNLESS, false, parseComparison());
      else
        break;
    }
    return left;
  }

  private PromQLExpr parseComparison() {
    PromQLExpr left = parseAddSub();
    while (true) {
      final BinaryOp op;
      if (lexer.match("=="))
        op = BinaryOp.EQ;
      else if (lexer.match("!="))
        op = BinaryOp.NEQ;
      else if (lexer.match("<="))
        op = BinaryOp.LTE;
      else if (lexer.match(">="))
        op = BinaryOp.GTE;
      else if (lexer.match("<"))
        op = BinaryOp.LT;
      else if (lexer.match(">"))
        op = BinaryOp.GT;
      else
        break;
      final boolean returnBool = lexer.matchKeyword("bool");
      left = binary(left, op, returnBool, parseAddSub());
    }
    return left;
  }

  private PromQLExpr parseAddSub() {
    PromQLExpr left = parseMulDiv();
    while (true) {
      if (lexer.match("+"))
        left = binary(left, BinaryOp.ADD, false, parseMulDiv());
      else if (lexer.match("-"))
        left = binary(left, BinaryOp.SUB, false, parseMulDiv());
      else
        break;
    }
    return left;
  }

  private PromQLExpr parseMulDiv() {
    PromQLExpr left = parsePow();
    while (true) {
      if (lexer.match("*"))
        left = binary(left, BinaryOp.MUL, false, parsePow());
      else if (lexer.match("/"))
        left = binary(left, BinaryOp.DIV, false, parsePow());
      else if (lexer.match("%"))
        left = binary(left, BinaryOp.MOD, false, parsePow());
      else
        break;
    }
    return left;
  }

  private PromQLExpr parsePow() {
    final PromQLExpr left = parseUnary();
    if (lexer.match("^")) {
      enterLevel();
      try {
        return binary(left, BinaryOp.POW, false, parsePow()); // right-associative
      } finally {
        parseDepth--;
      }
    }
    return left;
  }

  private PromQLExpr parseUnary() {
    if (lexer.match("-")) {
      enterLevel();
      try {
        final PromQLExpr operand = parseUnary();
        if (operand instanceof NumberLiteral nl)
          return new NumberLiteral(-nl.value());
        checkOperand(operand, "unary expression");
        return new UnaryExpr('-', operand);
      } finally {
        parseDepth--;
      }
    }
    if (lexer.match("+")) {
      enterLevel();
      try {
        return parseUnary();
      } finally {
        parseDepth--;
      }
    }
    return parsePrimary();
  }

  private PromQLExpr parsePrimary() {
    lexer.skipWhitespace();

    if (lexer.match("(")) {
      final PromQLExpr expr = parseOr();
      lexer.expect(")");
      return maybeMatrixOrOffset(expr);
    }

    final char c = lexer.peekChar();
    if (c == '"' || c == '\'' || c == '`')
      return new StringLiteral(lexer.readString());

    if (isNumberStart())
      return new NumberLiteral(lexer.readNumber());

    // SELECTOR WITHOUT METRIC NAME: {__name__="x", job="y"}
    if (c == '{')
      return parseVectorSelector(null);

    if (!lexer.hasMore())
      throw syntaxError("Unexpected end of input, expected expression");

    final String ident = lexer.readIdent();
    if (ident.equals("NaN"))
      return new NumberLiteral(Double.NaN);
    if (ident.equals("Inf"))
      return new NumberLiteral(Double.POSITIVE_INFINITY);

    final AggOp aggOp = AggOp.fromName(ident.toLowerCase());
    if (aggOp != null && lexer.peekAggregationStart())
      return parseAggregation(aggOp);

    if (lexer.peekChar() == '(')
      return parseFunctionCall(ident);

    return parseVectorSelector(ident);
  }

  private boolean isNumberStart() {
    final char c = lexer.peekChar();
    if (c >= '0' && c <= '9')
      return true;
    return c == '.' && lexer.pos + 1 < lexer.input.length() && Character.isDigit(lexer.input.charAt(lexer.pos + 1));
  }

  private PromQLExpr parseAggregation(final AggOp op) {
    List<String> groupLabels = List.of();
    boolean without = false;
    boolean grouped = false;

    if (lexer.matchKeyword("by")) {
      groupLabels = parseLabelList();
      grouped = true;
    } else if (lexer.matchKeyword("without")) {
      without = true;
      groupLabels = parseLabelList();
      grouped = true;
    }

    lexer.expect("(");
    PromQLExpr param = null;
    if (op.hasParam()) {
      param = parseOr();
      if (param.type() != ValueType.SCALAR)
        throw syntaxError("Expected scalar parameter for aggregation '" + op.getName() + "', got " + param.type().getName());
      lexer.expect(",");
    }

    final PromQLExpr expr = parseOr();
    lexer.expect(")");
    if (expr.type() != ValueType.VECTOR)
      throw syntaxError("Expected instant vector in aggregation '" + op.getName() + "', got " + expr.type().getName());

    if (!grouped) {
      if (lexer.matchKeyword("by")) {
        groupLabels = parseLabelList();
      } else if (lexer.matchKeyword("without")) {
        without = true;
        groupLabels = parseLabelList();
      }
    }

    return new AggregationExpr(op, expr, groupLabels, without, param);
  }

  private List<String> parseLabelList() {
    lexer.expect("(");
    final List<String> labels = new ArrayList<>();
    while (!lexer.match(")")) {
      if (!labels.isEmpty())
        lexer.expect(",");
      labels.add(lexer.readIdent());
    }
    return labels;
  }

  private PromQLExpr parseFunctionCall(final String name) {
    final Function function = Functions.get(name);
    if (function == null)
      throw syntaxError("Unknown function with name '" + name + "'");

    lexer.expect("(");
    final List<PromQLExpr> args = new ArrayList<>();
    while (!lexer.match(")")) {
      if (!args.isEmpty())
        lexer.expect(",");
      args.add(parseOr());
    }

    if (args.size() < function.minArgs() || args.size() > function.maxArgs())
      throw syntaxError(
          "Expected " + describeArity(function) + " argument(s) in call to '" + name + "', got " + args.size());

    for (int i = 0; i < args.size(); i++) {
      final ValueType expected = function.argType(i);
      final ValueType actual = args.get(i).type();
      if (expected != actual)
        throw syntaxError(
            "Expected type " + expected.getName() + " in call to function '" + name + "' (argument " + (i + 1) + "), got "
                + actual.getName());
    }
    return new FunctionCallExpr(function, args);
  }

  private static String describeArity(final Function function) {
    if (function.minArgs() == function.maxArgs())
      return Integer.toString(function.minArgs());
    if (function.maxArgs() == Integer.MAX_VALUE)
      return "at least " + function.minArgs();
    return "between " + function.minArgs() + " and " + function.maxArgs();
  }

  private PromQLExpr parseVectorSelector(final String metricName) {
    final List<LabelMatcher> matchers = new ArrayList<>();

    if (lexer.match("{")) {
      while (!lexer.match("}")) {
        if (!matchers.isEmpty()) {
          lexer.expect(",");
          if (lexer.match("}"))
            break;
        }
        final String labelName = lexer.readIdent();
        final MatchOp matchOp = lexer.readMatchOp();
        final String labelValue = lexer.readString();
        matchers.add(new LabelMatcher(labelName, matchOp, labelValue));
      }
    }

    if (metricName == null) {
      boolean hasNonEmptyMatcher = false;
      for (final LabelMatcher m : matchers)
        if (!m.value().isEmpty() || m.op() == MatchOp.NEQ || m.op() == MatchOp.NRE)
          hasNonEmptyMatcher = true;
      if (!hasNonEmptyMatcher)
        throw syntaxError("Vector selector must contain at least one non-empty matcher");
    }

    return maybeMatrixOrOffset(new VectorSelector(metricName, matchers, 0));
  }

  private PromQLExpr maybeMatrixOrOffset(final PromQLExpr expr) {
    if (lexer.match("[")) {
      final long rangeMs = lexer.readDuration();
      lexer.expect("]");
      if (!(expr instanceof VectorSelector vs))
        throw syntaxError("Range selector requires a vector selector, got: " + expr);
      if (rangeMs <= 0)
        throw syntaxError("Range must be positive: " + expr);

      long offsetMs = vs.offsetMs();
      if (lexer.matchKeyword("offset"))
        offsetMs = readSignedDuration();

      return new MatrixSelector(new VectorSelector(vs.metricName(), vs.matchers(), offsetMs), rangeMs);
    }

    if (lexer.matchKeyword("offset")) {
      final long offsetMs = readSignedDuration();
      if (expr instanceof VectorSelector vs)
        return new VectorSelector(vs.metricName(), vs.matchers(), offsetMs);
      throw syntaxError("Offset modifier requires a vector selector, got: " + expr);
    }

    return expr;
  }

  private long readSignedDuration() {
    final boolean negative = lexer.match("-");
    final long d = lexer.readDuration();
    return negative ? -d : d;
  }

  private PromQLExpr binary(final PromQLExpr left, final BinaryOp op, final boolean returnBool, final PromQLExpr right) {
    checkOperand(left, "binary expression");
    checkOperand(right, "binary expression");

    if (returnBool && !op.isComparison())
      throw syntaxError("Bool modifier can only be used on comparison operators");

    if (op.isSetOperator() && (left.type() != ValueType.VECTOR || right.type() != ValueType.VECTOR))
      throw syntaxError("Set operator '" + op.getSymbol() + "' not allowed in binary scalar expression");

    if (op.isComparison() && !returnBool && left.type() == ValueType.SCALAR && right.type() == ValueType.SCALAR)
      throw syntaxError("Comparisons between scalars must use BOOL modifier");

    return new BinaryExpr(left, op, right, returnBool);
  }

  private void checkOperand(final PromQLExpr operand, final String where) {
    if (operand.type() != ValueType.SCALAR && operand.type() != ValueType.VECTOR)
      throw syntaxError(
          "Operand of " + where + " must be of type scalar or instant vector, got " + operand.type().getName());
  }

  private void enterLevel() {
    if (++parseDepth > MAX_PARSE_DEPTH)
      throw syntaxError("PromQL expression exceeds maximum nesting depth of " + MAX_PARSE_DEPTH);
  }

  static QueryException syntaxError(final String message) {
    return new QueryException(ErrorCode.QUERY_SYNTAX_ERROR, message);
  }

  // --- Duration parsing ---

  public static long parseDuration(final String s) {
    long totalMs = 0;
    long current = 0;
    boolean digits = false;
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c >= '0' && c <= '9') {
        if (current > (Long.MAX_VALUE - 9) / 10)
          throw syntaxError("Duration value too large: " + s);
        current = current * 10 + (c - '0');
        digits = true;
      } else {
        if (!digits)
          throw syntaxError("Invalid duration: " + s);
        // 'ms' MUST BE CHECKED BEFORE 'm'
        if (c == 'm' && i + 1 < s.length() && s.charAt(i + 1) == 's') {
          totalMs += current;
          current = 0;
          digits = false;
          i++;
          continue;
        }
        final long unitMs = switch (c) {
          case 's' -> 1_000L;
          case 'm' -> 60_000L;
          case 'h' -> 3_600_000L;
          case 'd' -> 86_400_000L;
          case 'w' -> 604_800_000L;
          case 'y' -> 31_536_000_000L;
          default -> throw syntaxError("Unknown duration unit: " + c);
        };
        if (current > Long.MAX_VALUE / unitMs)
          throw syntaxError("Duration value too large: " + s);
        totalMs += current * unitMs;
        current = 0;
        digits = false;
      }
    }
    if (digits)
      throw syntaxError("Duration must end with a unit (ms/s/m/h/d/w/y): " + s);
    return totalMs;
  }

  // --- Inner Lexer ---

  static class Lexer {
    final String input;
    int pos;

    Lexer(final String input) {
      this.input = input != null ? input : "";
      this.pos = 0;
    }

    boolean hasMore() {
      skipWhitespace();
      return pos < input.length();
    }

    char peekChar() {
      skipWhitespace();
      return pos < input.length() ? input.charAt(pos) : 0;
    }

    String peek() {
      skipWhitespace();
      if (pos >= input.length())
        return "";
      return input.substring(pos, Math.min(pos + 10, input.length()));
    }

    /**
     * An aggregation keyword is followed by '(' or by a grouping clause, otherwise it is a metric name (e.g. "count").
     */
    boolean peekAggregationStart() {
      final int saved = pos;
      try {
        return peekChar() == '(' || matchKeyword("by") || matchKeyword("without");
      } finally {
        pos = saved;
      }
    }

    void skipWhitespace() {
      while (pos < input.length()) {
        final char c = input.charAt(pos);
        if (Character.isWhitespace(c))
          pos++;
        else if (c == '#') {
          // COMMENT UNTIL END OF LINE
          while (pos < input.length() && input.charAt(pos) != '\n')
            pos++;
        } else
          break;
      }
    }

    boolean match(final String s) {
      skipWhitespace();
      if (input.startsWith(s, pos)) {
        if (s.length() == 1) {
          final int next = pos + 1;
          final boolean followedBy = next < input.length();
          if (s.equals("=") && followedBy && (input.charAt(next) == '=' || input.charAt(next) == '~'))
            return false;
          if (s.equals("!") && followedBy && (input.charAt(next) == '=' || input.charAt(next) == '~'))
            return false;
          if ((s.equals("<") || s.equals(">")) && followedBy && input.charAt(next) == '=')
            return false;
        }
        pos += s.length();
        return true;
      }
      return false;
    }

    boolean matchKeyword(final String keyword) {
      skipWhitespace();
      if (pos + keyword.length() > input.length())
        return false;
      if (!input.regionMatches(true, pos, keyword, 0, keyword.length()))
        return false;
      final int end = pos + keyword.length();
      if (end < input.length() && isIdentChar(input.charAt(end)))
        return false;
      pos = end;
      return true;
    }

    void expect(final String s) {
      skipWhitespace();
      if (!input.startsWith(s, pos))
        throw syntaxError("Expected '" + s + "' at position " + pos + ", found: '" + (pos < input.length() ?
            input.substring(pos, Math.min(pos + 10, input.length())) :
            "end of input") + "'");
      pos += s.length();
    }

    String readIdent() {
      skipWhitespace();
      final int start = pos;
      while (pos < input.length() && isIdentChar(input.charAt(pos)) && (pos > start || !Character.isDigit(input.charAt(pos))))
        pos++;
      if (pos == start)
        throw syntaxError("Expected identifier at position " + pos);
      return input.substring(start, pos);
    }

    double readNumber() {
      skipWhitespace();
      final int start = pos;
      if (input.startsWith("0x", pos) || input.startsWith("0X", pos)) {
        pos += 2;
        while (pos < input.length() && Character.digit(input.charAt(pos), 16) >= 0)
          pos++;
        if (pos == start + 2)
          throw syntaxError("Invalid hexadecimal number at position " + start);
        return Long.parseLong(input.substring(start + 2, pos), 16);
      }

      while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.'
          || input.charAt(pos) == 'e' || input.charAt(pos) == 'E'
          || ((input.charAt(pos) == '+' || input.charAt(pos) == '-') && pos > start
              && (input.charAt(pos - 1) == 'e' || input.charAt(pos - 1) == 'E'))))
        pos++;

      if (pos == start)
        throw syntaxError("Expected number at position " + pos);
      try {
        return Double.parseDouble(input.substring(start, pos));
      } catch (final NumberFormatException e) {
        throw new QueryException(ErrorCode.QUERY_SYNTAX_ERROR, "Invalid number '" + input.substring(start, pos) + "'", e);
      }
    }

    String readString() {
      skipWhitespace();
      if (pos >= input.length())
        throw syntaxError("Expected string at end of input");
      final char quote = input.charAt(pos);
      if (quote != '"' && quote != '\'' && quote != '`')
        throw syntaxError("Expected string at position " + pos);
      pos++;
      final StringBuilder sb = new StringBuilder();
      while (pos < input.length() && input.charAt(pos) != quote) {
        if (quote != '`' && input.charAt(pos) == '\\' && pos + 1 < input.length()) {
          pos++;
          sb.append(switch (input.charAt(pos)) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            default -> input.charAt(pos);
          });
        } else {
          sb.append(input.charAt(pos));
        }
        pos++;
      }
      if (pos >= input.length())
        throw syntaxError("Unterminated string");
      pos++;
      return sb.toString();
    }

    MatchOp readMatchOp() {
      if (match("=~"))
        return MatchOp.RE;
      if (match("!~"))
        return MatchOp.NRE;
      if (match("!="))
        return MatchOp.NEQ;
      if (match("="))
        return MatchOp.EQ;
      throw syntaxError("Expected match operator at position " + pos);
    }

    long readDuration() {
      skipWhitespace();
      final int start = pos;
      while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || Character.isLetter(input.charAt(pos))))
        pos++;
      if (pos == start)
        throw syntaxError("Expected duration at position " + pos);
      return parseDuration(input.substring(start, pos));
    }

    private static boolean isIdentChar(final char c) {
      return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_' || c == ':';
    }
  }
}
