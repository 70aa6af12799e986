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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.tytle.ast.BinaryOp;
import org.tytle.ast.Expression;
import org.tytle.ast.Expression.ProcCall;
import org.tytle.ast.ExpressionType;
import org.tytle.ast.Program;
import org.tytle.ast.Statement;
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
import org.tytle.compiler.TytleParser.BinaryExpressionContext;
import org.tytle.compiler.TytleParser.BlockContext;
import org.tytle.compiler.TytleParser.BoolLiteralContext;
import org.tytle.compiler.TytleParser.CallExpressionContext;
import org.tytle.compiler.TytleParser.CallStatementContext;
import org.tytle.compiler.TytleParser.CommandStatementContext;
import org.tytle.compiler.TytleParser.DirectionStatementContext;
import org.tytle.compiler.TytleParser.ExpressionContext;
import org.tytle.compiler.TytleParser.IfStatementContext;
import org.tytle.compiler.TytleParser.IntLiteralContext;
import org.tytle.compiler.TytleParser.MakeStatementContext;
import org.tytle.compiler.TytleParser.NotExpressionContext;
import org.tytle.compiler.TytleParser.ParamContext;
import org.tytle.compiler.TytleParser.ParenExpressionContext;
import org.tytle.compiler.TytleParser.ProcedureCallContext;
import org.tytle.compiler.TytleParser.ProcedureStatementContext;
import org.tytle.compiler.TytleParser.ProgramContext;
import org.tytle.compiler.TytleParser.RepeatStatementContext;
import org.tytle.compiler.TytleParser.ReturnStatementContext;
import org.tytle.compiler.TytleParser.StatementContext;
import org.tytle.compiler.TytleParser.StringLiteralContext;
import org.tytle.compiler.TytleParser.TypeNameContext;
import org.tytle.compiler.TytleParser.VariableExpressionContext;

/**
 * Converts a parse tree into an (unresolved) AST. Each AST node gets the location of the first
 * token of the parse tree node it came from.
 */
class AstBuilder extends VisitorBase<Statement> {

  private final ExpressionBuilder expressions = new ExpressionBuilder();

  static Program build(ProgramContext program) {
    return new Program(new AstBuilder().statements(program.statement()));
  }

  private ImmutableList<Statement> statements(List<StatementContext> stmts) {
    return stmts.stream().map(this::visit).collect(ImmutableList.toImmutableList());
  }

  private BlockStmt block(BlockContext block) {
    return new BlockStmt(statements(block.statement()));
  }

  private Expression expression(ExpressionContext expr) {
    return expressions.visit(expr);
  }

  @Override
  public Statement visitCommandStatement(CommandStatementContext ctx) {
    return new CommandStmt(Command.valueOf(ctx.command.getText()), location());
  }

  @Override
  public Statement visitDirectionStatement(DirectionStatementContext ctx) {
    return new DirectionStmt(
        Direction.valueOf(ctx.direction.getText()), expression(ctx.expression()), location());
  }

  @Override
  public Statement visitRepeatStatement(RepeatStatementContext ctx) {
    return new RepeatStmt(expression(ctx.expression()), block(ctx.block()), location());
  }

  @Override
  public Statement visitIfStatement(IfStatementContext ctx) {
    List<BlockContext> blocks = ctx.block();
    BlockStmt falseBlock = (blocks.size() > 1) ? block(blocks.get(1)) : null;
    return new IfStmt(expression(ctx.expression()), block(blocks.get(0)), falseBlock, location());
  }

  @Override
  public Statement visitMakeStatement(MakeStatementContext ctx) {
    MakeKind kind =
        switch (ctx.kind.getText()) {
          case "MAKEGLOBAL" -> MakeKind.GLOBAL;
          case "MAKELOCAL" -> MakeKind.LOCAL;
          default -> MakeKind.ASSIGN;
        };
    return new MakeStmt(kind, ctx.ID().getText(), expression(ctx.expression()), location());
  }

  @Override
  public Statement visitProcedureStatement(ProcedureStatementContext ctx) {
    ImmutableList<ProcParam> params = ImmutableList.of();
    if (ctx.paramList() != null) {
      params =
          ctx.paramList().param().stream()
              .map(AstBuilder::param)
              .collect(ImmutableList.toImmutableList());
    }
    ExpressionType returnType =
        (ctx.typeName() == null) ? ExpressionType.UNIT : type(ctx.typeName());
    return new ProcedureStmt(
        ctx.ID().getText(),
        params,
        returnType,
        new BlockStmt(statements(ctx.statement())),
        location());
  }

  private static ProcParam param(ParamContext param) {
    ExpressionType type = (param.typeName() == null) ? ExpressionType.INT : type(param.typeName());
    return new ProcParam(param.ID().getText(), type);
  }

  private static ExpressionType type(TypeNameContext typeName) {
    return ExpressionType.forName(typeName.getText());
  }

  @Override
  public Statement visitReturnStatement(ReturnStatementContext ctx) {
    Expression value = (ctx.expression() == null) ? null : expression(ctx.expression());
    return new ReturnStmt(value, location());
  }

  @Override
  public Statement visitCallStatement(CallStatementContext ctx) {
    return new ExpressionStmt(expressions.call(ctx.procedureCall()), location());
  }

  /** Builds expressions. */
  private static class ExpressionBuilder extends VisitorBase<Expression> {

    ProcCall call(ProcedureCallContext call) {
      return (ProcCall) visit(call);
    }

    @Override
    public Expression visitBinaryExpression(BinaryExpressionContext ctx) {
      return new Expression.Binary(
          BinaryOp.forSymbol(ctx.op.getText()), visit(ctx.left), visit(ctx.right), location());
    }

    @Override
    public Expression visitNotExpression(NotExpressionContext ctx) {
      return new Expression.Not(visit(ctx.expression()), location());
    }

    @Override
    public Expression visitParenExpression(ParenExpressionContext ctx) {
      return new Expression.Parenthesized(visit(ctx.expression()), location());
    }

    @Override
    public Expression visitCallExpression(CallExpressionContext ctx) {
      return visit(ctx.procedureCall());
    }

    @Override
    public Expression visitProcedureCall(ProcedureCallContext ctx) {
      ImmutableList<Expression> args =
          ctx.expression().stream().map(this::visit).collect(ImmutableList.toImmutableList());
      return new ProcCall(ctx.ID().getText(), args, location());
    }

    @Override
    public Expression visitIntLiteral(IntLiteralContext ctx) {
      int value;
      try {
        value = Integer.parseInt(ctx.INT().getText());
      } catch (NumberFormatException e) {
        throw error("Integer literal %s is too large", ctx.INT().getText());
      }
      return Expression.Literal.ofInt(value, location());
    }

    @Override
    public Expression visitStringLiteral(StringLiteralContext ctx) {
      String text = ctx.STRING().getText();
      return Expression.Literal.ofStr(text.substring(1, text.length() - 1), location());
    }

    @Override
    public Expression visitBoolLiteral(BoolLiteralContext ctx) {
      return Expression.Literal.ofBool(ctx.value.getText().equals("TRUE"), location());
    }

    @Override
    public Expression visitVariableExpression(VariableExpressionContext ctx) {
      return new Expression.VariableRef(ctx.ID().getText(), location());
    }
  }
}
