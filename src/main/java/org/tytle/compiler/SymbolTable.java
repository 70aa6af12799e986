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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.tytle.ast.Procedure;
import org.tytle.ast.Symbol;
import org.tytle.ast.Variable;

/**
 * A SymbolTable holds every scope created while resolving a program.
 *
 * <p>Scopes are opened and closed in stack order, mirroring the lexical nesting of the program, but
 * they are never discarded: the table is an arena of scopes indexed by id, and each scope records
 * its parent's id. Lookups by scope id therefore keep working after the scope has been closed.
 *
 * <p>Before the first scope is opened (and after the last one is closed) the table is at the
 * <em>root</em>, which has id {@link #ROOT_ID} and cannot hold symbols.
 */
public class SymbolTable {

  public static final int ROOT_ID = 0;

  /** {@code scopes.get(i)} has id {@code i + 1}. */
  private final List<Scope> scopes = new ArrayList<>();

  /** The innermost open scope, or ROOT_ID. */
  private int currentId = ROOT_ID;

  /** Opens a new scope nested in the current one, and makes it current. */
  @CanIgnoreReturnValue
  public Scope startScope() {
    Scope scope = new Scope(scopes.size() + 1, currentId);
    scopes.add(scope);
    currentId = scope.id;
    return scope;
  }

  /** Closes the current scope, making its parent current. */
  public void endScope() {
    if (currentId == ROOT_ID) {
      throw CompileError.error(CompileError.Kind.NO_OPEN_SCOPE, null, "No scope to close");
    }
    currentId = getScope(currentId).parentId;
  }

  /** True if no scope is open. */
  public boolean isRootScope() {
    return currentId == ROOT_ID;
  }

  /** True if at least one scope is open. */
  public boolean isInnerScope() {
    return !isRootScope();
  }

  /** Returns the innermost open scope, or null if none is open. */
  public @Nullable Scope getCurrentScope() {
    return isRootScope() ? null : getScope(currentId);
  }

  /** Returns the scope with the given id, whether or not it is still open. */
  public Scope getScope(int id) {
    Preconditions.checkArgument(id > ROOT_ID && id <= scopes.size(), "No scope %s", id);
    return scopes.get(id - 1);
  }

  /** The number of scopes created so far. */
  public int numScopes() {
    return scopes.size();
  }

  /** Adds a variable to the current scope. */
  public void createVarSymbol(Variable var) {
    addSymbol(currentScopeOrThrow(), var);
  }

  /** Adds a variable to the given scope, which need not be open. */
  public void createVarSymbol(int scopeId, Variable var) {
    addSymbol(getScope(scopeId), var);
  }

  /** Adds a procedure to the current scope. */
  public void createProcSymbol(Procedure proc) {
    addSymbol(currentScopeOrThrow(), proc);
  }

  private Scope currentScopeOrThrow() {
    if (currentId == ROOT_ID) {
      throw CompileError.error(
          CompileError.Kind.NO_OPEN_SCOPE, null, "Cannot define a symbol with no open scope");
    }
    return getScope(currentId);
  }

  private static void addSymbol(Scope scope, Symbol symbol) {
    if (!scope.add(symbol)) {
      throw CompileError.error(
          CompileError.Kind.DUPLICATE_SYMBOL,
          null,
          "'%s' is already defined in %s",
          symbol.name,
          scope);
    }
  }

  /** Returns the symbol defined directly in the given scope, ignoring its ancestors. */
  public @Nullable Symbol lookupSymbol(int scopeId, String name, Symbol.Kind kind) {
    return (scopeId == ROOT_ID) ? null : getScope(scopeId).get(name, kind);
  }

  /**
   * Returns the symbol found in the given scope or its nearest ancestor that defines one, so that
   * an inner definition shadows outer ones. Returns null if no ancestor defines the name.
   */
  public @Nullable Symbol recursiveLookupSymbol(int scopeId, String name, Symbol.Kind kind) {
    for (int id = scopeId; id != ROOT_ID; ) {
      Scope scope = getScope(id);
      Symbol result = scope.get(name, kind);
      if (result != null) {
        return result;
      }
      id = scope.parentId;
    }
    return null;
  }
}
