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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.tytle.ast.ExpressionType;
import org.tytle.ast.Procedure;
import org.tytle.ast.Symbol;
import org.tytle.ast.Variable;
import org.tytle.code.Address;

@RunWith(JUnit4.class)
public class SymbolTableTest {

  private final SymbolTable table = new SymbolTable();

  private static Variable local(String name, int index) {
    Variable var = Variable.local(name, ExpressionType.INT);
    var.setAddress(Address.local(index));
    return var;
  }

  @Test
  public void startsAtRoot() {
    assertThat(table.isRootScope()).isTrue();
    assertThat(table.isInnerScope()).isFalse();
    assertThat(table.getCurrentScope()).isNull();

    table.startScope();
    assertThat(table.isRootScope()).isFalse();
    assertThat(table.isInnerScope()).isTrue();

    table.endScope();
    assertThat(table.isRootScope()).isTrue();
    assertThat(table.isInnerScope()).isFalse();
  }

  @Test
  public void missingVariable() {
    int scopeId = table.startScope().id;
    assertThat(table.lookupSymbol(scopeId, "A", Symbol.Kind.VAR)).isNull();
    assertThat(table.recursiveLookupSymbol(scopeId, "A", Symbol.Kind.VAR)).isNull();
  }

  @Test
  public void variableAndProcedureMayShareAName() {
    Variable var = Variable.global("A", ExpressionType.INT);
    Procedure proc = new Procedure("A", 1);
    int scopeId = table.startScope().id;
    table.createVarSymbol(var);
    table.createProcSymbol(proc);

    assertThat(table.lookupSymbol(scopeId, "A", Symbol.Kind.VAR)).isSameInstanceAs(var);
    assertThat(table.lookupSymbol(scopeId, "A", Symbol.Kind.PROC)).isSameInstanceAs(proc);
    assertThat(table.lookupSymbol(scopeId, "B", Symbol.Kind.PROC)).isNull();
  }

  @Test
  public void innerVariableShadowsOuter() {
    int outerId = table.startScope().id;
    Variable outer = local("A", 100);
    table.createVarSymbol(outer);
    int innerId = table.startScope().id;
    Variable inner = local("A", 200);
    table.createVarSymbol(inner);

    assertThat(outerId).isEqualTo(1);
    assertThat(innerId).isEqualTo(2);
    assertThat(table.getScope(innerId).parentId).isEqualTo(outerId);
    assertThat(table.getScope(outerId).hasParent()).isFalse();
    assertThat(table.lookupSymbol(innerId, "A", Symbol.Kind.VAR)).isSameInstanceAs(inner);
    assertThat(table.lookupSymbol(outerId, "A", Symbol.Kind.VAR)).isSameInstanceAs(outer);
    assertThat(table.recursiveLookupSymbol(innerId, "A", Symbol.Kind.VAR)).isSameInstanceAs(inner);
  }

  @Test
  public void recursiveLookupFindsAncestors() {
    int x = table.startScope().id;
    Variable var = local("A", 100);
    table.createVarSymbol(var);
    int y = table.startScope().id;
    int z = table.startScope().id;

    assertThat(table.recursiveLookupSymbol(z, "A", Symbol.Kind.VAR)).isSameInstanceAs(var);
    assertThat(table.recursiveLookupSymbol(y, "A", Symbol.Kind.VAR)).isSameInstanceAs(var);
    assertThat(table.recursiveLookupSymbol(x, "A", Symbol.Kind.VAR)).isSameInstanceAs(var);
    assertThat(table.lookupSymbol(z, "A", Symbol.Kind.VAR)).isNull();
    assertThat(table.recursiveLookupSymbol(z, "B", Symbol.Kind.VAR)).isNull();
  }

  @Test
  public void siblingScopesDontSeeEachOther() {
    int x = table.startScope().id;
    table.endScope();
    int y = table.startScope().id;
    Variable var = local("A", 100);
    table.createVarSymbol(var);
    table.endScope();
    int z = table.startScope().id;
    table.endScope();

    assertThat(new int[] {x, y, z}).asList().containsExactly(1, 2, 3).inOrder();
    assertThat(table.recursiveLookupSymbol(x, "A", Symbol.Kind.VAR)).isNull();
    assertThat(table.recursiveLookupSymbol(z, "A", Symbol.Kind.VAR)).isNull();
    // Closed scopes can still be searched.
    assertThat(table.recursiveLookupSymbol(y, "A", Symbol.Kind.VAR)).isSameInstanceAs(var);
    assertThat(table.numScopes()).isEqualTo(3);
  }

  @Test
  public void currentScopeFollowsNesting() {
    int x = table.startScope().id;
    assertThat(table.getCurrentScope().id).isEqualTo(x);
    int y = table.startScope().id;
    assertThat(table.getCurrentScope().id).isEqualTo(y);
    table.endScope();
    assertThat(table.getCurrentScope().id).isEqualTo(x);
    table.endScope();
    assertThat(table.getCurrentScope()).isNull();
  }

  @Test
  public void duplicateSymbol() {
    table.startScope();
    table.createVarSymbol(local("A", 0));
    CompileError e =
        assertThrows(CompileError.class, () -> table.createVarSymbol(local("A", 1)));
    assertThat(e.kind).isEqualTo(CompileError.Kind.DUPLICATE_SYMBOL);

    table.createProcSymbol(new Procedure("P", 1));
    e = assertThrows(CompileError.class, () -> table.createProcSymbol(new Procedure("P", 2)));
    assertThat(e.kind).isEqualTo(CompileError.Kind.DUPLICATE_SYMBOL);

    // The same name is fine in a nested scope.
    table.startScope();
    table.createVarSymbol(local("A", 2));
  }

  @Test
  public void noOpenScope() {
    CompileError e = assertThrows(CompileError.class, table::endScope);
    assertThat(e.kind).isEqualTo(CompileError.Kind.NO_OPEN_SCOPE);
    e = assertThrows(CompileError.class, () -> table.createVarSymbol(local("A", 0)));
    assertThat(e.kind).isEqualTo(CompileError.Kind.NO_OPEN_SCOPE);
    e = assertThrows(CompileError.class, () -> table.createProcSymbol(new Procedure("P", 1)));
    assertThat(e.kind).isEqualTo(CompileError.Kind.NO_OPEN_SCOPE);
  }

  @Test
  public void createInClosedOuterScope() {
    int outer = table.startScope().id;
    table.startScope();
    Variable var = Variable.global("G", ExpressionType.STR);
    table.createVarSymbol(outer, var);
    assertThat(table.lookupSymbol(outer, "G", Symbol.Kind.VAR)).isSameInstanceAs(var);
    assertThat(table.lookupSymbol(table.getCurrentScope().id, "G", Symbol.Kind.VAR)).isNull();
  }

  @Test
  public void idsAreNeverReused() {
    for (int i = 1; i <= 5; i++) {
      assertThat(table.startScope().id).isEqualTo(i);
      if (i % 2 == 0) {
        table.endScope();
      }
    }
    assertThat(table.numScopes()).isEqualTo(5);
  }
}
