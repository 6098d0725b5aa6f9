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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromQLParserTest {

  @Test
  void testSimpleSelector() {
    final PromQLExpr expr = new PromQLParser("cpu_usage").parse();
    assertThat(expr).isInstanceOf(VectorSelector.class);
    final VectorSelector vs = (VectorSelector) expr;
    assertThat(vs.metricName()).isEqualTo("cpu_usage");
    assertThat(vs.matchers()).isEmpty();
    assertThat(vs.offsetMs()).isZero();
    assertThat(vs.type()).isEqualTo(ValueType.VECTOR);
  }

  @Test
  void testSelectorWithMatchers() {
    final VectorSelector vs = (VectorSelector) PromQLParser.parse("http_requests{job=\"api\",status!=\"500\"}");
    assertThat(vs.metricName()).isEqualTo("http_requests");
    assertThat(vs.matchers()).containsExactly(new LabelMatcher("job", MatchOp.EQ, "api"),
        new LabelMatcher("status", MatchOp.NEQ, "500"));
  }

  @Test
  void testRegexMatchers() {
    final VectorSelector vs = (VectorSelector) PromQLParser.parse("http_requests{job=~\"api.*\", env!~'test.*',}");
    assertThat(vs.matchers()).hasSize(2);
    assertThat(vs.matchers().get(0).op()).isEqualTo(MatchOp.RE);
    assertThat(vs.matchers().get(0).value()).isEqualTo("api.*");
    assertThat(vs.matchers().get(1).op()).isEqualTo(MatchOp.NRE);
  }

  @Test
  void testSelectorWithoutMetricName() {
    final VectorSelector vs = (VectorSelector) PromQLParser.parse("{__name__=\"up\", job=\"api\"}");
    assertThat(vs.metricName()).isNull();
    assertThat(vs.matchers()).hasSize(2);

    assertThatThrownBy(() -> PromQLParser.parse("{job=\"\"}")).isInstanceOf(QueryException.class)
        .hasMessageContaining("non-empty matcher");
  }

  @Test
  void testRangeVector() {
    final MatrixSelector ms = (MatrixSelector) PromQLParser.parse("http_requests{job=\"api\"}[5m]");
    assertThat(ms.selector().metricName()).isEqualTo("http_requests");
    assertThat(ms.selector().matchers()).hasSize(1);
    assertThat(ms.rangeMs()).isEqualTo(300_000);
    assertThat(ms.type()).isEqualTo(ValueType.MATRIX);
  }

  @Test
  void testOffsets() {
    assertThat(((VectorSelector) PromQLParser.parse("http_requests offset 5m")).offsetMs()).isEqualTo(300_000);
    assertThat(((VectorSelector) PromQLParser.parse("http_requests offset -1m")).offsetMs()).isEqualTo(-60_000);

    final MatrixSelector ms = (MatrixSelector) PromQLParser.parse("http_requests[5m] offset 1h");
    assertThat(ms.rangeMs()).isEqualTo(300_000);
    assertThat(ms.selector().offsetMs()).isEqualTo(3_600_000);
  }

  @Test
  void testAggregationGroupingPosition() {
    final AggregationExpr before = (AggregationExpr) PromQLParser.parse("sum by (job) (http_requests)");
    assertThat(before.op()).isEqualTo(AggOp.SUM);
    assertThat(before.groupLabels()).containsExactly("job");
    assertThat(before.without()).isFalse();
    assertThat(before.expr()).isInstanceOf(VectorSelector.class);

    final AggregationExpr after = (AggregationExpr) PromQLParser.parse("sum(http_requests) by (job, instance)");
    assertThat(after.groupLabels()).containsExactly("job", "instance");

    final AggregationExpr without = (AggregationExpr) PromQLParser.parse("avg without (instance) (cpu_usage)");
    assertThat(without.op()).isEqualTo(AggOp.AVG);
    assertThat(without.without()).isTrue();
  }

  @Test
  void testAggregationParameter() {
    final AggregationExpr topk = (AggregationExpr) PromQLParser.parse("topk(5, http_requests)");
    assertThat(topk.op()).isEqualTo(AggOp.TOPK);
    assertThat(((NumberLiteral) topk.param()).value()).isEqualTo(5.0);

    final AggregationExpr quantile = (AggregationExpr) PromQLParser.parse("quantile(0.9, latency) by (job)");
    assertThat(quantile.op()).isEqualTo(AggOp.QUANTILE);
    assertThat(((NumberLiteral) quantile.param()).value()).isEqualTo(0.9);

    assertThatThrownBy(() -> PromQLParser.parse("topk(http_requests, 5)")).isInstanceOf(QueryException.class);
  }

  @Test
  void testAggregationNameAsMetric() {
    final PromQLExpr expr = PromQLParser.parse("count + 1");
    assertThat(expr).isInstanceOf(BinaryExpr.class);
    assertThat(((VectorSelector) ((BinaryExpr) expr).left()).metricName()).isEqualTo("count");
  }

  @Test
  void testFunctionCall() {
    final FunctionCallExpr fn = (FunctionCallExpr) PromQLParser.parse("rate(http_requests[5m])");
    assertThat(fn.name()).isEqualTo("rate");
    assertThat(fn.args()).hasSize(1);
    assertThat(fn.args().get(0)).isInstanceOf(MatrixSelector.class);
    assertThat(fn.type()).isEqualTo(ValueType.VECTOR);
  }

  @Test
  void testFunctionArity() {
    assertThat(((FunctionCallExpr) PromQLParser.parse("round(cpu_usage, 0.5)")).args()).hasSize(2);
    assertThat(((FunctionCallExpr) PromQLParser.parse("round(cpu_usage)")).args()).hasSize(1);
    assertThat(((FunctionCallExpr) PromQLParser.parse("time()")).type()).isEqualTo(ValueType.SCALAR);
    assertThat(((FunctionCallExpr) PromQLParser.parse("label_join(up, \"dst\", \",\", \"a\", \"b\", \"c\")")).args())
        .hasSize(6);

    assertThatThrownBy(() -> PromQLParser.parse("abs(a, b)")).isInstanceOf(QueryException.class)
        .hasMessageContaining("Expected 1 argument(s)");
    assertThatThrownBy(() -> PromQLParser.parse("clamp(up, 1)")).isInstanceOf(QueryException.class);
  }

  @Test
  void testFunctionArgumentTypes() {
    assertThatThrownBy(() -> PromQLParser.parse("rate(http_requests)")).isInstanceOf(QueryException.class)
        .hasMessageContaining("type matrix");
    assertThatThrownBy(() -> PromQLParser.parse("abs(http_requests[5m])")).isInstanceOf(QueryException.class);
  }

  @Test
  void testUnknownFunction() {
    assertThatThrownBy(() -> PromQLParser.parse("does_not_exist(up)")).isInstanceOf(QueryException.class)
        .hasMessageContaining("Unknown function with name 'does_not_exist'")
        .satisfies(e -> assertThat(((QueryException) e).getErrorCode()).isEqualTo(ErrorCode.QUERY_SYNTAX_ERROR));
  }

  @Test
  void testBinaryExpression() {
    final BinaryExpr bin = (BinaryExpr) PromQLParser.parse("cpu_usage * 100");
    assertThat(bin.op()).isEqualTo(BinaryOp.MUL);
    assertThat(bin.left()).isInstanceOf(VectorSelector.class);
    assertThat(((NumberLiteral) bin.right()).value()).isEqualTo(100.0);
    assertThat(bin.type()).isEqualTo(ValueType.VECTOR);
  }

  @Test
  void testOperatorPrecedence() {
    final BinaryExpr bin = (BinaryExpr) PromQLParser.parse("1 + 2 * 3");
    assertThat(bin.op()).isEqualTo(BinaryOp.ADD);
    assertThat(bin.left()).isInstanceOf(NumberLiteral.class);
    assertThat(((BinaryExpr) bin.right()).op()).isEqualTo(BinaryOp.MUL);
    assertThat(bin.type()).isEqualTo(ValueType.SCALAR);

    // POWER IS RIGHT-ASSOCIATIVE
    final BinaryExpr pow = (BinaryExpr) PromQLParser.parse("2 ^ 3 ^ 2");
    assertThat(pow.left()).isInstanceOf(NumberLiteral.class);
    assertThat(((BinaryExpr) pow.right()).op()).isEqualTo(BinaryOp.POW);
  }

  @Test
  void testParenthesizedExpression() {
    final BinaryExpr bin = (BinaryExpr) PromQLParser.parse("(cpu_usage + mem_usage) / 2");
    assertThat(bin.op()).isEqualTo(BinaryOp.DIV);
    assertThat(bin.left()).isInstanceOf(BinaryExpr.class);
    assertThat(bin.toString()).isEqualTo("(cpu_usage + mem_usage) / 2");
  }

  @Test
  void testComparisonAndBool() {
    final BinaryExpr gt = (BinaryExpr) PromQLParser.parse("cpu_usage > 80");
    assertThat(gt.op()).isEqualTo(BinaryOp.GT);
    assertThat(gt.returnBool()).isFalse();

    final BinaryExpr bool = (BinaryExpr) PromQLParser.parse("cpu_usage >= bool 80");
    assertThat(bool.op()).isEqualTo(BinaryOp.GTE);
    assertThat(bool.returnBool()).isTrue();

    assertThat(((BinaryExpr) PromQLParser.parse("1 == bool 1")).type()).isEqualTo(ValueType.SCALAR);
    assertThatThrownBy(() -> PromQLParser.parse("1 == 1")).isInstanceOf(QueryException.class)
        .hasMessageContaining("BOOL");
    assertThatThrownBy(() -> PromQLParser.parse("a + bool b")).isInstanceOf(QueryException.class);
  }

  @Test
  void testSetOperators() {
    final BinaryExpr or = (BinaryExpr) PromQLParser.parse("a and b or c unless d");
    assertThat(or.op()).isEqualTo(BinaryOp.OR);
    assertThat(((BinaryExpr) or.left()).op()).isEqualTo(BinaryOp.AND);
    assertThat(((BinaryExpr) or.right()).op()).isEqualTo(BinaryOp.UNLESS);

    assertThatThrownBy(() -> PromQLParser.parse("a and 1")).isInstanceOf(QueryException.class);
  }

  @Test
  void testUnaryNegation() {
    final UnaryExpr un = (UnaryExpr) PromQLParser.parse("-cpu_usage");
    assertThat(un.op()).isEqualTo('-');
    assertThat(un.expr()).isInstanceOf(VectorSelector.class);

    // NEGATIVE LITERALS ARE FOLDED
    assertThat(((NumberLiteral) PromQLParser.parse("-5")).value()).isEqualTo(-5.0);
  }

  @Test
  void testLiterals() {
    assertThat(((StringLiteral) PromQLParser.parse("\"hello world\"")).value()).isEqualTo("hello world");
    assertThat(((StringLiteral) PromQLParser.parse("`a\\b`")).value()).isEqualTo("a\\b");
    assertThat(((NumberLiteral) PromQLParser.parse("42.5")).value()).isEqualTo(42.5);
    assertThat(((NumberLiteral) PromQLParser.parse("0x1F")).value()).isEqualTo(31.0);
    assertThat(((NumberLiteral) PromQLParser.parse("1e3")).value()).isEqualTo(1000.0);
    assertThat(((NumberLiteral) PromQLParser.parse("NaN")).value()).isNaN();
    assertThat(((NumberLiteral) PromQLParser.parse("Inf")).value()).isEqualTo(Double.POSITIVE_INFINITY);
  }

  @Test
  void testComments() {
    final PromQLExpr expr = PromQLParser.parse("sum(up) # total\n by (job)");
    assertThat(((AggregationExpr) expr).groupLabels()).containsExactly("job");
  }

  @Test
  void testDurationParsing() {
    assertThat(PromQLParser.parseDuration("5m")).isEqualTo(300_000);
    assertThat(PromQLParser.parseDuration("1h30m")).isEqualTo(5_400_000);
    assertThat(PromQLParser.parseDuration("2d")).isEqualTo(172_800_000);
    assertThat(PromQLParser.parseDuration("1w")).isEqualTo(604_800_000);
    assertThat(PromQLParser.parseDuration("30s")).isEqualTo(30_000);
    assertThat(PromQLParser.parseDuration("500ms")).isEqualTo(500);
    assertThat(PromQLParser.parseDuration("1s500ms")).isEqualTo(1_500);
    assertThat(PromQLParser.parseDuration("2m30s")).isEqualTo(150_000);
  }

  @Test
  void testInvalidDurations() {
    assertThatThrownBy(() -> PromQLParser.parseDuration("300000000y")).isInstanceOf(QueryException.class)
        .hasMessageContaining("too large");
    assertThatThrownBy(() -> PromQLParser.parseDuration("5")).isInstanceOf(QueryException.class);
    assertThatThrownBy(() -> PromQLParser.parseDuration("5x")).isInstanceOf(QueryException.class);
    assertThatThrownBy(() -> PromQLParser.parse("up[0s]")).isInstanceOf(QueryException.class);
  }

  @Test
  void testMalformedExpressions() {
    assertThatThrownBy(() -> PromQLParser.parse("sum(")).isInstanceOf(QueryException.class);
    assertThatThrownBy(() -> PromQLParser.parse("")).isInstanceOf(QueryException.class);
    assertThatThrownBy(() -> PromQLParser.parse("up{job=\"a\"")).isInstanceOf(QueryException.class);
    assertThatThrownBy(() -> PromQLParser.parse("up )")).isInstanceOf(QueryException.class)
        .hasMessageContaining("Unexpected token");
    assertThatThrownBy(() -> PromQLParser.parse("sum(up) offset 5m")).isInstanceOf(QueryException.class);
  }

  @Test
  void testNestingDepthLimit() {
    final String deep = "(".repeat(200) + "1" + ")".repeat(200);
    assertThatThrownBy(() -> PromQLParser.parse(deep)).isInstanceOf(QueryException.class)
        .hasMessageContaining("nesting depth");
  }

  @Test
  void testToStringRendersQuery() {
    assertThat(PromQLParser.parse("sum by (job) (rate(http_requests{code=~\"5..\"}[5m]))").toString()).isEqualTo(
        "sum by (job) (rate(http_requests{code=~\"5..\"}[5m]))");
    assertThat(PromQLParser.parse("up offset -1m").toString()).isEqualTo("up offset -1m");
  }
}
