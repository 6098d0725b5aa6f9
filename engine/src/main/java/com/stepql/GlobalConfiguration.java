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

import com.stepql.log.LogManager;
import org.json.JSONObject;

import java.io.PrintStream;
import java.util.Map;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties and,
 * when no property is set, environment variables with the same name.
 */
public enum GlobalConfiguration {
  // QUERY
  QUERY_STEPS_BATCH("stepql.query.stepsBatch", "Number of consecutive steps each operator produces per pull", Integer.class, 10),

  QUERY_LOOKBACK_DELTA("stepql.query.lookbackDelta",
      "Maximum distance (in ms) an instant selector looks back from a step to find the latest sample", Long.class, 5 * 60_000L),

  QUERY_CONCURRENT_OPERATORS("stepql.query.concurrentOperators",
      "Runs every operator boundary created by the plan builder in its own producer thread, one batch ahead of the consumer",
      Boolean.class, true),

  QUERY_OPERATOR_QUEUE_IMPL("stepql.query.operatorQueueImpl",
      "Queue implementation for the hand-off between a producer thread and its consumer. Available values are 'standard' (JDK ArrayBlockingQueue) and 'fast' (PushPullBlockingQueue)",
      String.class, "standard"),

  QUERY_OPERATOR_POLL_INTERVAL("stepql.query.operatorPollInterval",
      "Interval (in ms) a blocked producer or consumer waits before checking the query context for cancellation again", Long.class, 50L),

  QUERY_TIMEOUT("stepql.query.timeout", "Default timeout for query evaluation (in ms). 0 means no timeout", Long.class, 0L),

  QUERY_MAX_STEPS("stepql.query.maxSteps", "Maximum number of steps a range query can evaluate", Long.class, 1_000_000L),

  QUERY_MAX_REGEX_LENGTH("stepql.query.maxRegexLength", "Maximum length of a regular expression in label matchers", Integer.class,
      1024),
  ;

  public static final String PREFIX = "stepql.";

  private final String   key;
  private final Object   defValue;
  private final Class<?> type;
  private final String   description;
  private volatile Object value = null;

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue) {
    this.key = key;
    this.description = description;
    this.type = type;
    this.defValue = defValue;
  }

  public static void resetAll() {
    for (final GlobalConfiguration v : values())
      v.reset();
  }

  public void reset() {
    value = null;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.print("STEPQL CONFIGURATION");
    final StringBuilder sb = new StringBuilder();
    for (final GlobalConfiguration v : values()) {
      sb.setLength(0);
      sb.append("\n- ").append(v.key).append(" = ").append((Object) v.getValue());
      if (v.isChanged())
        sb.append(" (default=").append(v.defValue).append(")");
      out.print(sb);
    }
    out.println();
  }

  public static String toJSON() {
    final JSONObject json = new JSONObject();
    final JSONObject cfg = new JSONObject();
    json.put("configuration", cfg);
    for (final GlobalConfiguration k : values())
      cfg.put(k.key.substring(PREFIX.length()), (Object) k.getValue());
    return json.toString();
  }

  /**
   * Finds the configuration entry by the key. Key is case insensitive.
   *
   * @return the entry if found, otherwise null
   */
  public static GlobalConfiguration findByKey(final String key) {
    for (final GlobalConfiguration v : values())
      if (v.getKey().equalsIgnoreCase(key))
        return v;
    return null;
  }

  /**
   * Changes the configuration values in one shot by passing a Map of values. Keys can be the Java ENUM names or the string
   * representation of configuration values.
   */
  public static void setConfiguration(final Map<String, Object> config) {
    for (final Map.Entry<String, Object> entry : config.entrySet()) {
      for (final GlobalConfiguration v : values()) {
        if (v.getKey().equals(entry.getKey()) || v.name().equals(entry.getKey())) {
          v.setValue(entry.getValue());
          break;
        }
      }
    }
  }

  private static void readConfiguration() {
    for (final GlobalConfiguration config : values()) {
      String prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null) {
        try {
          config.setValue(prop);
        } catch (final IllegalArgumentException e) {
          LogManager.instance().log(GlobalConfiguration.class, Level.WARNING, "Ignoring invalid value '%s' for setting %s", e, prop,
              config.key);
        }
      }
    }
  }

  public <T> T getValue() {
    //noinspection unchecked
    return (T) (value != null ? value : defValue);
  }

  /**
   * @return {@literal true} if configuration was changed from default value and {@literal false} otherwise.
   */
  public boolean isChanged() {
    return value != null;
  }

  /**
   * Converts and stores the value according to the declared type of the setting.
   *
   * @throws IllegalArgumentException if the value cannot be converted to the declared type
   */
  public void setValue(final Object newValue) {
    value = convert(type, newValue);
  }

  static Object convert(final Class<?> type, final Object newValue) {
    if (newValue == null)
      return null;
    if (type.isInstance(newValue))
      return newValue;
    final String s = newValue.toString().trim();
    if (type == Boolean.class)
      return Boolean.parseBoolean(s);
    else if (type == Integer.class)
      return Integer.parseInt(s);
    else if (type == Long.class)
      return Long.parseLong(s);
    else if (type == String.class)
      return s;
    throw new IllegalArgumentException("Unsupported configuration type " + type.getSimpleName());
  }

  public boolean getValueAsBoolean() {
    final Object v = getValue();
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString() {
    final Object v = getValue();
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).intValue() : Integer.parseInt(v.toString());
  }

  public long getValueAsLong() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).longValue() : Long.parseLong(v.toString());
  }

  public String getKey() {
    return key;
  }

  public Object getDefValue() {
    return defValue;
  }

  public Class<?> getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }
}
