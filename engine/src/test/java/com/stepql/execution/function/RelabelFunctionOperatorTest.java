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
import com.stepql.execution.ScriptedOperator;
import com.stepql.execution.model.Labels;
import com.stepql.execution.model.StepVector;
import com.stepql.query.promql.PromQLParser;
import com.stepql.query.promql.ast.PromQLExpr.FunctionCallExpr;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelabelFunctionOperatorTest {
  private static final Labels FOO = Labels.of("__name__", "up", "job", "foo-api", "instance", "a:80");
  private static final Labels BAR = Labels.of("__name__", "up", "job", "bar", "instance", "b:80");

  private final QueryContext context = new QueryContext();

  private static FunctionCallExpr call(final String query) {
    return (FunctionCallExpr) PromQLParser.parse(query);
  }

  private static ScriptedOperator input() {
    return new ScriptedOperator(10, FOO, BAR).step(0, 0, 1, 1, 2);
  }

  @Test
  void testLabelReplace() {
    final RelabelFunctionOperator op = new RelabelFunctionOperator(
        call("label_replace(up, \"service\", \"$1-svc\", \"job\", \"(.*)-api\")"), input());

    assertThat(op.series(context)).containsExactly(//
        FOO.toBuilder().set("service", "foo-svc").build(),//
        BAR);
  }

  @Test
  void testEmptyReplacementRemovesLabel() {
    final RelabelFunctionOperator op = new RelabelFunctionOperator(
        call("label_replace(up, \"instance\", \"\", \"job\", \"bar\")"), input());
    assertThat(op.series(context).get(1)).isEqualTo(Labels.of("__name__", "up", "job", "bar"));
    assertThat(op.series(context).get(0)).isEqualTo(FOO);
  }

  @Test
  void testLabelJoin() {
    final RelabelFunctionOperator op = new RelabelFunctionOperator(
        call("label_join(up, \"combined\", \"/\", \"job\", \"instance\")"), input());
    assertThat(op.series(context).get(0).get("combined")).isEqualTo("foo-api/a:80");
    assertThat(op.series(context).get(1).get("combined")).isEqualTo("bar/b:80");
  }

  @Test
  void testSamplesPassThrough() {
    final ScriptedOperator in = input();
    final RelabelFunctionOperator op = new RelabelFunctionOperator(
        call("label_join(up, \"combined\", \",\", \"job\")"), in);

    assertThat(op.getPool()).isSameAs(in.getPool());
    final List<StepVector> steps = ScriptedOperator.flatten(ScriptedOperator.drain(op, context));
    assertThat(steps).hasSize(1);
    assertThat(steps.get(0).getSample(1)).isEqualTo(2);
    assertThat(in.getPulls()).isEqualTo(2);
  }

  @Test
  void testExpandTemplate() {
    final Matcher m = Pattern.compile("(?<host>[a-z]+):(\\d+)").matcher("web:8080");
    assertThat(m.matches()).isTrue();

    assertThat(RelabelFunctionOperator.expand(m, "$1")).isEqualTo("web");
    assertThat(RelabelFunctionOperator.expand(m, "${2}0")).isEqualTo("80800");
    assertThat(RelabelFunctionOperator.expand(m, "$host-$2")).isEqualTo("web-8080");
    assertThat(RelabelFunctionOperator.expand(m, "$$1")).isEqualTo("$1");
    assertThat(RelabelFunctionOperator.expand(m, "[$9][$missing][$99999999999]")).isEqualTo("[][][]");
    assertThat(RelabelFunctionOperator.expand(m, "cost $")).isEqualTo("cost $");
  }

  @Test
  void testInvalidArguments() {
    assertThatThrownBy(() -> new RelabelFunctionOperator(call("label_replace(up, \"1bad\", \"x\", \"job\", \".*\")"), input()))//
        .isInstanceOf(QueryException.class)//
        .satisfies(e -> assertThat(((QueryException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_ARGUMENT));
    assertThatThrownBy(() -> new RelabelFunctionOperator(call("label_replace(up, \"dst\", \"x\", \"job\", \"[a-\")"), input()))//
        .isInstanceOf(QueryException.class).hasMessageContaining("Invalid regex");
    assertThatThrownBy(() -> new RelabelFunctionOperator(call("label_join(up, \"dst\", \"-\", \"a-b\")"), input()))//
        .isInstanceOf(QueryException.class).hasMessageContaining("source label");
  }
}
