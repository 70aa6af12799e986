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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.tytle.ast.Expression.Binary;
import org.tytle.ast.Expression.Literal;
import org.tytle.ast.Expression.Not;
import org.tytle.ast.Expression.Parenthesized;
import org.tytle.ast.Expression.ProcCall;
import org.tytle.ast.Expression.VariableRef;
import org.tytle.ast.Statement.BlockStmt;
import org.tytle.ast.Statement.Command;
import org.tytle.ast.Statement.CommandStmt;
import org.tytle.ast.Statement.Direction;
import org.tytle.ast.Statement.DirectionStmt;
import org.tytle.ast.Statement.ExpressionStmt;
import org.tytle.ast.Statement.IfStmt;
import org.tytle.ast.Statement.MakeKind;
import org.tytle.ast.Statement.MakeStmt;
import org.tytle.ast.Statement.ProcParam;
import org.tytle.ast.Statement.ProcedureStmt;
import org.tytle.ast.Statement.RepeatStmt;
import org.tytle.ast.Statement.ReturnStmt;

@RunWith(JUnit4.class)
public class AstWalkerTest {

  /** Records every hook call. */
  private static class Recorder implements AstWalker {
    final List<String> events = new ArrayList<>();

    @Override
    public void onProcStart(ProcedureStmt proc) {
      events.add("procStart " + proc.name);
    }

    @Override
    public void onProcParam(ProcedureStmt proc, ProcParam param) {
      events.add("param " + param.name());
    }

    @Override
    public void onProcEnd(ProcedureStmt proc) {
      events.add("procEnd " + proc.name);
    }

    @Override
    public void onBlockStart(BlockStmt block) {
      events.add("[");
    }

    @Override
    public void onBlockEnd(BlockStmt block) {
      events.add("]");
    }

    @Override
    public void onIfCondition(IfStmt ifStmt) {
      events.add("if");
    }

    @Override
    public void onRepeatCount(RepeatStmt repeat) {
      events.add("repeat");
    }

    @Override
    public void onReturnStmt(ReturnStmt ret) {
      events.add("return");
    }

    @Override
    public void onLiteralExpr(Literal literal) {
      events.add(literal.toString());
    }

    @Override
    public void onVariableRefExpr(VariableRef ref) {
      events.add(ref.name);
    }

    @Override
    public void onBinaryExpr(Binary binary) {
      events.add(binary.op.symbol);
    }

    @Override
    public void onParenExpr(Parenthesized paren) {
      events.add("()");
    }

    @Override
    public void onNotExpr(Not not) {
      events.add("not");
    }

    @Override
    public void onProcCallStart(ProcCall call) {
      events.add("call " + call.name);
    }

    @Override
    public void onProcParamExprStart(ProcCall call, Expression arg) {
      events.add("<");
    }

    @Override
    public void onProcParamExprEnd(ProcCall call, Expression arg) {
      events.add(">");
    }

    @Override
    public void onProcCallEnd(ProcCall call) {
      events.add("end " + call.name);
    }

    @Override
    public void onMakeGlobal(MakeStmt make) {
      events.add("makeGlobal " + make.name);
    }

    @Override
    public void onMakeLocal(MakeStmt make) {
      events.add("makeLocal " + make.name);
    }

    @Override
    public void onMakeAssign(MakeStmt make) {
      events.add("make " + make.name);
    }

    @Override
    public void onCommandStmt(CommandStmt cmd) {
      events.add(cmd.command.name());
    }

    @Override
    public void onDirectionStmt(DirectionStmt direction) {
      events.add(direction.direction.name());
    }

    @Override
    public void onExpressionStmt(ExpressionStmt exprStmt) {
      events.add("discard");
    }
  }

  private static Literal num(int i) {
    return Literal.ofInt(i, null);
  }

  private static List<String> walk(Statement... stmts) {
    Recorder recorder = new Recorder();
    recorder.walkProgram(Program.of(stmts));
    return recorder.events;
  }

  @Test
  public void expressionsArePostOrder() {
    Expression expr =
        new Binary(
            BinaryOp.MUL,
            new Parenthesized(new Binary(BinaryOp.ADD, num(1), num(2), null), null),
            new VariableRef("X", null),
            null);
    assertThat(walk(new DirectionStmt(Direction.FORWARD, expr, null)))
        .containsExactly("1", "2", "+", "()", "X", "*", "FORWARD")
        .inOrder();
  }

  @Test
  public void callsBracketTheirArguments() {
    ProcCall call =
        new ProcCall(
            "P",
            ImmutableList.of(num(1), new Not(Literal.ofBool(true, null), null)),
            null);
    assertThat(walk(new ExpressionStmt(call, null)))
        .containsExactly("call P", "<", "1", ">", "<", "true", "not", ">", "end P", "discard")
        .inOrder();
  }

  @Test
  public void ifAndRepeat() {
    Statement ifStmt =
        new IfStmt(
            Literal.ofBool(false, null),
            BlockStmt.of(new CommandStmt(Command.PENUP, null)),
            BlockStmt.of(new CommandStmt(Command.PENDOWN, null)),
            null);
    Statement repeat =
        new RepeatStmt(num(3), BlockStmt.of(new MakeStmt(MakeKind.LOCAL, "A", num(4), null)), null);
    assertThat(walk(ifStmt, repeat))
        .containsExactly(
            "false", "if", "[", "PENUP", "]", "[", "PENDOWN", "]", "3", "repeat", "[", "4",
            "makeLocal A", "]")
        .inOrder();
  }

  @Test
  public void procedureBodyHasNoBlockHooks() {
    Statement proc =
        new ProcedureStmt(
            "P",
            ImmutableList.of(
                new ProcParam("A", ExpressionType.INT), new ProcParam("B", ExpressionType.STR)),
            ExpressionType.INT,
            BlockStmt.of(
                new MakeStmt(MakeKind.GLOBAL, "G", new VariableRef("A", null), null),
                new ReturnStmt(num(0), null)),
            null);
    assertThat(walk(proc, new MakeStmt(MakeKind.ASSIGN, "X", num(1), null)))
        .containsExactly(
            "procStart P", "param A", "param B", "A", "makeGlobal G", "0", "return", "procEnd P",
            "1", "make X")
        .inOrder();
  }

  @Test
  public void bareReturnHasNoValue() {
    assertThat(walk(new ReturnStmt(null, null))).containsExactly("return");
  }
}
