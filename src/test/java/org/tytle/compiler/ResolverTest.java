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
import org.tytle.ast.Expression;
import org.tytle.ast.ExpressionType;
import org.tytle.ast.Procedure;
import org.tytle.ast.Program;
import org.tytle.ast.Statement;
import org.tytle.ast.Statement.IfStmt;
import org.tytle.ast.Statement.MakeStmt;
import org.tytle.ast.Statement.ProcedureStmt;
import org.tytle.ast.Statement.RepeatStmt;
import org.tytle.ast.Symbol;
import org.tytle.ast.Variable;
import org.tytle.code.Address;

@RunWith(JUnit4.class)
public class ResolverTest {

  private static Program resolve(String source) {
    Program program = Compiler.parse(source);
    Resolver.resolve(program);
    return program;
  }

  private static CompileError.Kind errorKind(String source) {
    return assertThrows(CompileError.class, () -> resolve(source)).kind;
  }

  @Test
  public void globalsGetSlotsInOrder() {
    Program program = resolve("MAKE X = 1\nMAKEGLOBAL Y = \"s\"\nMAKE X = 2");
    Variable x = ((MakeStmt) program.statements.get(0)).variable();
    Variable y = ((MakeStmt) program.statements.get(1)).variable();
    assertThat(x.isGlobal()).isTrue();
    assertThat(x.address()).isEqualTo(Address.global(0));
    assertThat(y.address()).isEqualTo(Address.global(1));
    assertThat(y.type).isEqualTo(ExpressionType.STR);
    // The second MAKE assigns the existing variable.
    assertThat(((MakeStmt) program.statements.get(2)).variable()).isSameInstanceAs(x);
    assertThat(program.globalsSize()).isEqualTo(2);
    assertThat(program.mainFrameSize()).isEqualTo(0);
  }

  @Test
  public void blockLocalsShadowGlobals() {
    Program program =
        resolve("MAKE X = 1\nIF TRUE [ MAKELOCAL X = 2\nMAKE X = 3\nFORWARD X ]\nFORWARD X");
    Variable global = ((MakeStmt) program.statements.get(0)).variable();
    IfStmt ifStmt = (IfStmt) program.statements.get(1);
    Variable local = ((MakeStmt) ifStmt.trueBlock.stmts.get(0)).variable();
    assertThat(local.isGlobal()).isFalse();
    assertThat(local.address()).isEqualTo(Address.local(0));
    assertThat(((MakeStmt) ifStmt.trueBlock.stmts.get(1)).variable()).isSameInstanceAs(local);
    Expression.VariableRef inner =
        (Expression.VariableRef) ((Statement.DirectionStmt) ifStmt.trueBlock.stmts.get(2)).distance;
    assertThat(inner.variable()).isSameInstanceAs(local);
    Expression.VariableRef outer =
        (Expression.VariableRef) ((Statement.DirectionStmt) program.statements.get(2)).distance;
    assertThat(outer.variable()).isSameInstanceAs(global);
    assertThat(program.mainFrameSize()).isEqualTo(1);
  }

  @Test
  public void makeGlobalFromProcedure() {
    Program program = resolve("TO P\n  MAKEGLOBAL G = 7\nEND\nP()\nFORWARD G");
    MakeStmt make = (MakeStmt) ((ProcedureStmt) program.statements.get(0)).block.stmts.get(0);
    assertThat(make.variable().isGlobal()).isTrue();
    assertThat(make.variable().address()).isEqualTo(Address.global(0));
    assertThat(program.globalsSize()).isEqualTo(1);
  }

  @Test
  public void procedureFrames() {
    Program program =
        resolve(
            "TO P(A, B: STR): INT\n"
                + "  MAKELOCAL C = A\n"
                + "  REPEAT A [ MAKELOCAL D = 1 ]\n"
                + "  RETURN C\n"
                + "END\n"
                + "MAKE R = P(1, \"x\")");
    ProcedureStmt proc = (ProcedureStmt) program.statements.get(0);
    Procedure symbol = proc.procedure();
    assertThat(symbol.id).isEqualTo(1);
    assertThat(symbol.paramTypes)
        .containsExactly(ExpressionType.INT, ExpressionType.STR)
        .inOrder();
    assertThat(symbol.returnType).isEqualTo(ExpressionType.INT);
    // A, B, C, the loop counter, and D
    assertThat(symbol.frameSize()).isEqualTo(5);
    RepeatStmt repeat = (RepeatStmt) proc.block.stmts.get(1);
    assertThat(repeat.counter().address()).isEqualTo(Address.local(3));
    assertThat(((MakeStmt) proc.block.stmts.get(0)).variable().address())
        .isEqualTo(Address.local(2));
    assertThat(program.globalsSize()).isEqualTo(1);
    assertThat(program.mainFrameSize()).isEqualTo(0);
    Expression.ProcCall call = (Expression.ProcCall) ((MakeStmt) program.statements.get(1)).value;
    assertThat(call.procedure()).isSameInstanceAs(symbol);
  }

  @Test
  public void recursionSeesItself() {
    Program program =
        resolve("TO F(N): INT\n  IF N < 1 [ RETURN 0 ]\n  RETURN F(N - 1)\nEND\nMAKE X = F(3)");
    ProcedureStmt proc = (ProcedureStmt) program.statements.get(0);
    assertThat(proc.procedure().numParams()).isEqualTo(1);
  }

  @Test
  public void proceduresGetIdsInOrder() {
    Program program = resolve("TO A\nEND\nTO B\nEND\nTO C\nEND");
    assertThat(((ProcedureStmt) program.statements.get(2)).procedure().id).isEqualTo(3);
  }

  @Test
  public void symbolTableKeepsScopes() {
    Program program = Compiler.parse("MAKE X = 1\nTO P(A)\nEND\nIF TRUE [ PENUP ]");
    SymbolTable table = Resolver.resolve(program);
    // The global scope, the procedure's scope, and the IF block's scope.
    assertThat(table.numScopes()).isEqualTo(3);
    assertThat(table.isRootScope()).isTrue();
    assertThat(table.lookupSymbol(1, "P", Symbol.Kind.PROC)).isNotNull();
    assertThat(table.lookupSymbol(2, "A", Symbol.Kind.VAR)).isNotNull();
    assertThat(table.getScope(3).parentId).isEqualTo(1);
  }

  @Test
  public void notAndComparisons() {
    resolve("IF NOT(1 < 2) [ PENUP ] [ PENDOWN ]");
    resolve("MAKE S = \"a\" + \"b\" + \"c\"");
    assertThat(errorKind("MAKE S = \"a\" - \"b\"")).isEqualTo(CompileError.Kind.TYPE_MISMATCH);
    assertThat(errorKind("IF NOT(1) [ PENUP ]")).isEqualTo(CompileError.Kind.TYPE_MISMATCH);
    assertThat(errorKind("IF \"a\" < \"b\" [ PENUP ]"))
        .isEqualTo(CompileError.Kind.TYPE_MISMATCH);
  }

  @Test
  public void procedureCannotSeeMainLocals() {
    assertThat(errorKind("IF TRUE [ MAKELOCAL X = 1 ]\nTO P\n  FORWARD X\nEND"))
        .isEqualTo(CompileError.Kind.UNDEFINED_VARIABLE);
  }

  @Test
  public void namesMustBeDefinedBeforeUse() {
    assertThat(errorKind("P()\nTO P\nEND")).isEqualTo(CompileError.Kind.UNDEFINED_PROCEDURE);
    assertThat(errorKind("TO P\n  FORWARD X\nEND\nMAKE X = 1"))
        .isEqualTo(CompileError.Kind.UNDEFINED_VARIABLE);
  }

  @Test
  public void resolvingTwiceIsAnError() {
    Program program = resolve("PENUP");
    assertThrows(IllegalArgumentException.class, () -> Resolver.resolve(program));
  }
}
