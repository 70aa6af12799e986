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

import org.tytle.ast.Expression.Binary;
import org.tytle.ast.Expression.Literal;
import org.tytle.ast.Expression.Not;
import org.tytle.ast.Expression.Parenthesized;
import org.tytle.ast.Expression.ProcCall;
import org.tytle.ast.Expression.VariableRef;
import org.tytle.ast.Statement.BlockStmt;
import org.tytle.ast.Statement.CommandStmt;
import org.tytle.ast.Statement.DirectionStmt;
import org.tytle.ast.Statement.ExpressionStmt;
import org.tytle.ast.Statement.IfStmt;
import org.tytle.ast.Statement.MakeStmt;
import org.tytle.ast.Statement.ProcParam;
import org.tytle.ast.Statement.ProcedureStmt;
import org.tytle.ast.Statement.RepeatStmt;
import org.tytle.ast.Statement.ReturnStmt;

/**
 * A traversal skeleton over the AST. The {@code walk} methods implement a fixed traversal order and
 * call the {@code on} hooks as they go; every hook does nothing by default, so each pass overrides
 * only the hooks it cares about.
 *
 * <p>The order is:
 *
 * <ul>
 *   <li>statements are walked in source order;
 *   <li>a statement's expressions are walked before the statement's own hook fires, and a binary
 *       or NOT expression's operands are walked before its hook fires (post-order);
 *   <li>a procedure call fires {@link #onProcCallStart}, then brackets each argument with {@link
 *       #onProcParamExprStart} and {@link #onProcParamExprEnd}, then fires {@link #onProcCallEnd};
 *   <li>{@code IF} walks its condition, fires {@link #onIfCondition}, then walks the true block and
 *       the false block (if any); {@code REPEAT} walks its count, fires {@link #onRepeatCount}, then
 *       walks the body;
 *   <li>a block fires {@link #onBlockStart} and {@link #onBlockEnd} around its statements, which
 *       makes them the place to open and close lexical scopes;
 *   <li>a procedure fires {@link #onProcStart}, then {@link #onProcParam} for each parameter, then
 *       walks the body's statements <em>without</em> the block hooks (so that the parameters and the
 *       body's top-level statements share a scope), then fires {@link #onProcEnd}.
 * </ul>
 *
 * <p>A hook reports failure by throwing; the exception propagates out of the walk immediately and
 * no other hooks run.
 *
 * <p>Implementations that need to change how a construct is lowered (e.g. the CFG builder) may
 * override a {@code walk} method, but must preserve the order above.
 */
public interface AstWalker {

  default void walkProgram(Program program) {
    for (Statement stmt : program.statements) {
      walkStmt(stmt);
    }
  }

  default void walkStmt(Statement stmt) {
    if (stmt instanceof CommandStmt cmd) {
      walkCommandStmt(cmd);
    } else if (stmt instanceof DirectionStmt direction) {
      walkDirectionStmt(direction);
    } else if (stmt instanceof IfStmt ifStmt) {
      walkIfStmt(ifStmt);
    } else if (stmt instanceof MakeStmt make) {
      walkMakeStmt(make);
    } else if (stmt instanceof RepeatStmt repeat) {
      walkRepeatStmt(repeat);
    } else if (stmt instanceof ProcedureStmt proc) {
      walkProcStmt(proc);
    } else if (stmt instanceof ReturnStmt ret) {
      walkReturnStmt(ret);
    } else if (stmt instanceof ExpressionStmt exprStmt) {
      walkExpressionStmt(exprStmt);
    } else {
      throw new AssertionError("Unexpected statement " + stmt);
    }
  }

  default void walkProcStmt(ProcedureStmt proc) {
    onProcStart(proc);
    walkProcParams(proc);
    // Not walkBlockStmt(), since that would open a second scope for the body.
    for (Statement stmt : proc.block.stmts) {
      walkStmt(stmt);
    }
    onProcEnd(proc);
  }

  default void walkProcParams(ProcedureStmt proc) {
    for (ProcParam param : proc.params) {
      onProcParam(proc, param);
    }
  }

  default void walkIfStmt(IfStmt ifStmt) {
    walkExpr(ifStmt.condition);
    onIfCondition(ifStmt);
    walkBlockStmt(ifStmt.trueBlock);
    if (ifStmt.falseBlock != null) {
      walkBlockStmt(ifStmt.falseBlock);
    }
  }

  default void walkRepeatStmt(RepeatStmt repeat) {
    walkExpr(repeat.count);
    onRepeatCount(repeat);
    walkBlockStmt(repeat.block);
  }

  default void walkBlockStmt(BlockStmt block) {
    onBlockStart(block);
    for (Statement stmt : block.stmts) {
      walkStmt(stmt);
    }
    onBlockEnd(block);
  }

  default void walkCommandStmt(CommandStmt cmd) {
    onCommandStmt(cmd);
  }

  default void walkDirectionStmt(DirectionStmt direction) {
    walkExpr(direction.distance);
    onDirectionStmt(direction);
  }

  default void walkMakeStmt(MakeStmt make) {
    walkExpr(make.value);
    switch (make.kind) {
      case GLOBAL -> onMakeGlobal(make);
      case LOCAL -> onMakeLocal(make);
      case ASSIGN -> onMakeAssign(make);
    }
  }

  default void walkReturnStmt(ReturnStmt ret) {
    if (ret.value != null) {
      walkExpr(ret.value);
    }
    onReturnStmt(ret);
  }

  default void walkExpressionStmt(ExpressionStmt exprStmt) {
    walkExpr(exprStmt.call);
    onExpressionStmt(exprStmt);
  }

  default void walkExpr(Expression expr) {
    if (expr instanceof Literal literal) {
      onLiteralExpr(literal);
    } else if (expr instanceof VariableRef ref) {
      onVariableRefExpr(ref);
    } else if (expr instanceof ProcCall call) {
      walkProcCallExpr(call);
    } else if (expr instanceof Binary binary) {
      walkExpr(binary.left);
      walkExpr(binary.right);
      onBinaryExpr(binary);
    } else if (expr instanceof Parenthesized paren) {
      walkExpr(paren.inner);
      onParenExpr(paren);
    } else if (expr instanceof Not not) {
      walkExpr(not.inner);
      onNotExpr(not);
    } else {
      throw new AssertionError("Unexpected expression " + expr);
    }
  }

  default void walkProcCallExpr(ProcCall call) {
    onProcCallStart(call);
    for (Expression arg : call.args) {
      onProcParamExprStart(call, arg);
      walkExpr(arg);
      onProcParamExprEnd(call, arg);
    }
    onProcCallEnd(call);
  }

  // Procedures

  default void onProcStart(ProcedureStmt proc) {}

  default void onProcParam(ProcedureStmt proc, ProcParam param) {}

  default void onProcEnd(ProcedureStmt proc) {}

  // Blocks

  default void onBlockStart(BlockStmt block) {}

  default void onBlockEnd(BlockStmt block) {}

  // Control flow

  default void onIfCondition(IfStmt ifStmt) {}

  default void onRepeatCount(RepeatStmt repeat) {}

  default void onReturnStmt(ReturnStmt ret) {}

  // Expressions

  default void onLiteralExpr(Literal literal) {}

  default void onVariableRefExpr(VariableRef ref) {}

  default void onBinaryExpr(Binary binary) {}

  default void onParenExpr(Parenthesized paren) {}

  default void onNotExpr(Not not) {}

  // Procedure calls

  default void onProcCallStart(ProcCall call) {}

  default void onProcParamExprStart(ProcCall call, Expression arg) {}

  default void onProcParamExprEnd(ProcCall call, Expression arg) {}

  default void onProcCallEnd(ProcCall call) {}

  // MAKE statements

  default void onMakeGlobal(MakeStmt make) {}

  default void onMakeLocal(MakeStmt make) {}

  default void onMakeAssign(MakeStmt make) {}

  // Everything else

  default void onCommandStmt(CommandStmt cmd) {}

  default void onDirectionStmt(DirectionStmt direction) {}

  default void onExpressionStmt(ExpressionStmt exprStmt) {}
}
