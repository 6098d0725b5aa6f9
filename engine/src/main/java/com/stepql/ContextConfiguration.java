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

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Represents a context configuration where custom setting could be defined for the context only. If not defined, globals
 * will be taken.
 **/
public class ContextConfiguration {
  private final Map<String, Object> config = new ConcurrentHashMap<>();

  /**
   * Empty constructor to create just a proxy for the GlobalConfiguration. No values are set.
   */
  public ContextConfiguration() {
  }

  public ContextConfiguration(final Map<String, Object> config) {
    for (final Map.Entry<String, Object> entry : config.entrySet())
      setValue(entry.getKey(), entry.getValue());
  }

  public ContextConfiguration(final ContextConfiguration parent) {
    if (parent != null)
      config.putAll(parent.config);
  }

  public void fromJSON(final String input) {
    if (input == null)
      return;

    final JSONObject json = new JSONObject(input);
    final JSONObject cfg = json.getJSONObject("configuration");
    for (final String k : cfg.keySet()) {
      final GlobalConfiguration cfgEntry = GlobalConfiguration.findByKey(GlobalConfiguration.PREFIX + k);
      if (cfgEntry != null)
        setValue(cfgEntry, cfg.get(k));
    }
  }

  public String toJSON() {
    final JSONObject json = new JSONObject();
    final JSONObject cfg = new JSONObject();
    json.put("configuration", cfg);
    for (final Map.Entry<String, Object> entry : config.entrySet())
      cfg.put(entry.getKey().substring(GlobalConfiguration.PREFIX.length()), entry.getValue());
    return json.toString();
  }

  public ContextConfiguration setValue(final GlobalConfiguration setting, final Object value) {
    if (value == null)
      config.remove(setting.getKey());
    else
      config.put(setting.getKey(), GlobalConfiguration.convert(setting.getType(), value));
    return this;
  }

  public ContextConfiguration setValue(final String name, final Object value) {
    final GlobalConfiguration setting = GlobalConfiguration.findByKey(name);
    if (setting == null)
      throw new IllegalArgumentException("Unknown configuration setting '" + name + "'");
    return setValue(setting, value);
  }

  public Object getValue(final GlobalConfiguration setting) {
    final Object v = config.get(setting.getKey());
    return v != null ? v : setting.getValue();
  }

  public boolean getValueAsBoolean(final GlobalConfiguration setting) {
    final Object v = getValue(setting);
    if (v == null)
      return false;
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString(final GlobalConfiguration setting) {
    final Object v = getValue(setting);
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger(final GlobalConfiguration setting) {
    final Object v = getValue(setting);
    if (v == null)
      return 0;
    return v instanceof Number ? ((Number) v).intValue() : Integer.parseInt(v.toString());
  }

  public long getValueAsLong(final GlobalConfiguration setting) {
    final Object v = getValue(setting);
    if (v == null)
      return 0;
    return v instanceof Number ? ((Number) v).longValue() : Long.parseLong(v.toString());
  }

  public Set<String> getContextKeys() {
    return config.keySet();
  }

  public void merge(final ContextConfiguration other) {
    this.config.putAll(other.config);
  }

  public void reset() {
    config.clear();
  }
}
