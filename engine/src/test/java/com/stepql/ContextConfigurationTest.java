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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextConfigurationTest {

  @AfterEach
  void resetConfiguration() {
    GlobalConfiguration.resetAll();
  }

  @Test
  void testFallsBackToGlobals() {
    final ContextConfiguration cfg = new ContextConfiguration();
    assertThat(cfg.getValueAsInteger(GlobalConfiguration.QUERY_STEPS_BATCH)).isEqualTo(10);

    GlobalConfiguration.QUERY_STEPS_BATCH.setValue(3);
    assertThat(cfg.getValueAsInteger(GlobalConfiguration.QUERY_STEPS_BATCH)).isEqualTo(3);
  }

  @Test
  void testOverridesGlobals() {
    final ContextConfiguration cfg = new ContextConfiguration(Map.of("stepql.query.stepsBatch", "7"));
    assertThat(cfg.getValueAsInteger(GlobalConfiguration.QUERY_STEPS_BATCH)).isEqualTo(7);
    assertThat(GlobalConfiguration.QUERY_STEPS_BATCH.getValueAsInteger()).isEqualTo(10);

    cfg.setValue(GlobalConfiguration.QUERY_STEPS_BATCH, null);
    assertThat(cfg.getValueAsInteger(GlobalConfiguration.QUERY_STEPS_BATCH)).isEqualTo(10);
  }

  @Test
  void testUnknownSetting() {
    assertThatThrownBy(() -> new ContextConfiguration().setValue("stepql.query.nope", 1)).isInstanceOf(
        IllegalArgumentException.class);
  }

  @Test
  void testJSONRoundTrip() {
    final ContextConfiguration cfg = new ContextConfiguration().setValue(GlobalConfiguration.QUERY_TIMEOUT, 1500L)
        .setValue(GlobalConfiguration.QUERY_CONCURRENT_OPERATORS, false);

    final ContextConfiguration copy = new ContextConfiguration();
    copy.fromJSON(cfg.toJSON());
    assertThat(copy.getValueAsLong(GlobalConfiguration.QUERY_TIMEOUT)).isEqualTo(1500L);
    assertThat(copy.getValueAsBoolean(GlobalConfiguration.QUERY_CONCURRENT_OPERATORS)).isFalse();
    assertThat(copy.getContextKeys()).containsExactlyInAnyOrder("stepql.query.timeout", "stepql.query.concurrentOperators");
  }

  @Test
  void testCopyAndMerge() {
    final ContextConfiguration parent = new ContextConfiguration().setValue(GlobalConfiguration.QUERY_MAX_STEPS, 50L);
    final ContextConfiguration child = new ContextConfiguration(parent);
    assertThat(child.getValueAsLong(GlobalConfiguration.QUERY_MAX_STEPS)).isEqualTo(50L);

    final ContextConfiguration other = new ContextConfiguration().setValue(GlobalConfiguration.QUERY_MAX_STEPS, 60L);
    child.merge(other);
    assertThat(child.getValueAsLong(GlobalConfiguration.QUERY_MAX_STEPS)).isEqualTo(60L);
    assertThat(parent.getValueAsLong(GlobalConfiguration.QUERY_MAX_STEPS)).isEqualTo(50L);

    child.reset();
    assertThat(child.getContextKeys()).isEmpty();
  }
}
