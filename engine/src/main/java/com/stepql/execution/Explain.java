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
package com.stepql.execution;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Renders operator trees for diagnostics.
 */
public final class Explain {
  private Explain() {
  }

  public static String prettyPrint(final VectorOperator root) {
    return root.prettyPrint(0, 2);
  }

  public static JSONObject toJSON(final VectorOperator root) {
    final JSONObject json = new JSONObject();
    json.put("operator", root.describe());
    json.put("type", root.getClass().getSimpleName());
    if (!root.getChildren().isEmpty()) {
      final JSONArray children = new JSONArray();
      for (final VectorOperator child : root.getChildren())
        children.put(toJSON(child));
      json.put("children", children);
    }
    return json;
  }
}
