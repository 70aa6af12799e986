/*
 * Copyright 2025 The Tytle Authors
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
 */

package org.tytle.ast;

/** The static type of an expression, variable, parameter, or procedure result. */
public enum ExpressionType {
  INT,
  STR,
  BOOL,

  /** The result type of a procedure that doesn't return a value; no expression can have it. */
  UNIT;

  /** Returns the type named by a type annotation in the source ("INT", "STR", or "BOOL"). */
  public static ExpressionType forName(String name) {
    switch (name) {
      case "INT":
        return INT;
      case "STR":
        return STR;
      case "BOOL":
        return BOOL;
      default:
        throw new IllegalArgumentException("No type named " + name);
    }
  }
}
