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

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.tytle.ast.Symbol;

/**
 * A Scope maps names to symbols, with a separate namespace for each {@link Symbol.Kind}. Scopes
 * refer to their parent by id; the {@link SymbolTable} owns them all and keeps them after they are
 * closed, so a scope id stays valid for lookups for the life of the table.
 */
public final class Scope {

  /** Scope ids start at 1; 0 is reserved for the (implicit) root. */
  public final int id;

  /** The id of the enclosing scope, or 0 if this is an outermost scope. */
  public final int parentId;

  private final Map<Symbol.Kind, Map<String, Symbol>> symbols = new EnumMap<>(Symbol.Kind.class);

  Scope(int id, int parentId) {
    this.id = id;
    this.parentId = parentId;
  }

  public boolean hasParent() {
    return parentId != SymbolTable.ROOT_ID;
  }

  /** Returns the symbol of the given kind defined directly in this scope, or null. */
  public @Nullable Symbol get(String name, Symbol.Kind kind) {
    Map<String, Symbol> map = symbols.get(kind);
    return (map == null) ? null : map.get(name);
  }

  /** Adds a symbol; returns false (and does nothing) if one with the same name and kind exists. */
  boolean add(Symbol symbol) {
    Map<String, Symbol> map = symbols.computeIfAbsent(symbol.kind(), k -> new HashMap<>());
    return map.putIfAbsent(symbol.name, symbol) == null;
  }

  @Override
  public String toString() {
    return "scope " + id;
  }
}
