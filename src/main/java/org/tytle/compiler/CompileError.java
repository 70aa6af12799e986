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

package org.tytle.compiler;

import com.google.errorprone.annotations.FormatMethod;
import org.jspecify.annotations.Nullable;
import org.tytle.ast.Location;

/** All Tytle language errors detected at compile time throw a CompileError. */
public class CompileError extends RuntimeException {

  /** What went wrong. */
  public enum Kind {
    SYNTAX_ERROR,

    // Scope errors
    DUPLICATE_SYMBOL,
    NO_OPEN_SCOPE,

    // Resolution errors
    UNDEFINED_VARIABLE,
    UNDEFINED_PROCEDURE,
    ARGUMENT_COUNT_MISMATCH,
    TYPE_MISMATCH,
    RETURN_OUTSIDE_PROCEDURE,
    NESTED_PROCEDURE,

    // Graph construction
    MALFORMED_GRAPH
  }

  public final Kind kind;
  public final String msg;

  /** Where the error was detected, or null if it isn't tied to a source position. */
  public final @Nullable Location location;

  public CompileError(Kind kind, String msg, @Nullable Location location) {
    super(msg);
    this.kind = kind;
    this.msg = msg;
    this.location = location;
  }

  /** Returns a new CompileError with the given kind and location. */
  @FormatMethod
  static CompileError error(
      Kind kind, @Nullable Location location, String fmt, Object... fmtArgs) {
    return new CompileError(kind, String.format(fmt, fmtArgs), location);
  }

  @Override
  public String getMessage() {
    return (location == null) ? msg : String.format("%s (%s)", msg, location);
  }
}
