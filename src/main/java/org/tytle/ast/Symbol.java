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

/**
 * A named entity that source identifiers resolve to. There are two subclasses, {@link Variable}
 * and {@link Procedure}; each scope keeps a separate namespace for each {@link Kind}, so a variable
 * and a procedure may share a name.
 */
public abstract class Symbol {

  /** The namespaces of a scope. */
  public enum Kind {
    VAR,
    PROC
  }

  public final String name;

  Symbol(String name) {
    this.name = name;
  }

  public abstract Kind kind();
}
