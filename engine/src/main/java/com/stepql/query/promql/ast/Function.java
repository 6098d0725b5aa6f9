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

/**
 * Signature of a built-in function.
 *
 * @param name       function name as written in queries
 * @param argTypes   declared argument types, in order
 * @param variadic   0 when every declared argument is required, N when the last N arguments are optional, -1 when the last
 *                   argument may repeat any number of times (including zero)
 * @param returnType type of the value the function produces
 */
public record Function(String name, List<ValueType> argTypes, int variadic, ValueType returnType) {

  public Function {
    argTypes = List.copyOf(argTypes);
  }

  public int minArgs() {
    if (variadic > 0)
      return argTypes.size() - variadic;
    if (variadic < 0)
      return argTypes.size() - 1;
    return argTypes.size();
  }

  public int maxArgs() {
    return variadic < 0 ? Integer.MAX_VALUE : argTypes.size();
  }

  /**
   * Returns the declared type of the argument at the given position. Repeated variadic arguments share the last type.
   */
  public ValueType argType(final int position) {
    if (position < argTypes.size())
      return argTypes.get(position);
    return argTypes.get(argTypes.size() - 1);
  }
}
