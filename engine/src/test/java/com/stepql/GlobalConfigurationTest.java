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
package com.stepql;

import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GlobalConfigurationTest {

  @AfterEach
  void resetConfiguration() {
    GlobalConfiguration.resetAll();
  }

  @Test
  void testDefaults() {
    assertThat(GlobalConfiguration.QUERY_STEPS_BATCH.getValueAsInteger()).isEqualTo(10);
    assertThat(GlobalConfiguration.QUERY_LOOKBACK_DELTA.getValueAsLong()).isEqualTo(300_000L);
    assertThat(GlobalConfiguration.QUERY_CONCURRENT_OPERATORS.getValueAsBoolean()).isTrue();
    assertThat(GlobalConfiguration.QUERY_OPERATOR_QUEUE_IMPL.getValueAsString()).isEqualTo("standard");
    assertThat(GlobalConfiguration.QUERY_TIMEOUT.isChanged()).isFalse();
  }

  @Test
  void testSetValueConvertsToDeclaredType() {
    GlobalConfiguration.QUERY_STEPS_BATCH.setValue("25");
    assertThat(GlobalConfiguration.QUERY_STEPS_BATCH.<Integer>getValue()).isEqualTo(25);
    assertThat(GlobalConfiguration.QUERY_STEPS_BATCH.isChanged()).isTrue();

    GlobalConfiguration.QUERY_CONCURRENT_OPERATORS.setValue("false");
    assertThat(GlobalConfiguration.QUERY_CONCURRENT_OPERATORS.getValueAsBoolean()).isFalse();

    assertThatThrownBy(() -> GlobalConfiguration.QUERY_TIMEOUT.setValue("soon")).isInstanceOf(
        IllegalArgumentException.class);
  }

  @Test
  void testSetConfigurationByKeyOrName() {
    GlobalConfiguration.setConfiguration(Map.of("stepql.query.maxSteps", 100L, "QUERY_TIMEOUT", "2000"));
    assertThat(GlobalConfiguration.QUERY_MAX_STEPS.getValueAsLong()).isEqualTo(100L);
    assertThat(GlobalConfiguration.QUERY_TIMEOUT.getValueAsLong()).isEqualTo(2000L);
  }

  @Test
  void testFindByKey() {
    assertThat(GlobalConfiguration.findByKey("STEPQL.QUERY.STEPSBATCH")).isEqualTo(GlobalConfiguration.QUERY_STEPS_BATCH);
    assertThat(GlobalConfiguration.findByKey("stepql.unknown")).isNull();
  }

  @Test
  void testToJSON() {
    final JSONObject cfg = new JSONObject(GlobalConfiguration.toJSON()).getJSONObject("configuration");
    assertThat(cfg.getInt("query.stepsBatch")).isEqualTo(10);
    assertThat(cfg.getString("query.operatorQueueImpl")).isEqualTo("standard");
  }

  @Test
  void testDumpConfiguration() {
    GlobalConfiguration.QUERY_STEPS_BATCH.setValue(25);

    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    GlobalConfiguration.dumpConfiguration(new PrintStream(bytes, true, StandardCharsets.UTF_8));
    final String dump = bytes.toString(StandardCharsets.UTF_8);

    assertThat(dump).startsWith("STEPQL CONFIGURATION");
    assertThat(dump).contains("- stepql.query.stepsBatch = 25 (default=10)");
    assertThat(dump).contains("- stepql.query.operatorQueueImpl = standard\n");
  }
}
