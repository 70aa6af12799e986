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

import org.tytle.ast.AstWalker;
import org.tytle.ast.Expression.Binary;
import org.tytle.ast.Expression.Literal;
import org.tytle.ast.Expression.Not;
import org.tytle.ast.Expression.ProcCall;
import org.tytle.ast.Expression.VariableRef;
import org.tytle.ast.Statement.CommandStmt;
import org.tytle.ast.Statement.DirectionStmt;
import org.tytle.ast.Statement.ExpressionStmt;
import org.tytle.ast.Statement.MakeStmt;
import org.tytle.ast.Variable;
import org.tytle.code.Address;
import org.tytle.code.Instruction;
import org.tytle.code.Opcode;

/**
 * Translates straight-line constructs (expressions, MAKE, turtle and pen statements) into stack
 * instructions. Where the instructions go is up to the subclass; constructs that need more than a
 * sequence of instructions (IF, REPEAT, procedures, RETURN) are also the subclass's job.
 *
 * <p>Expressions are evaluated left to right, each leaving its value on the operand stack.
 */
abstract class InstructionEmitter implements AstWalker {

  /** Appends an instruction at the current position. */
  abstract void emit(Instruction inst);

  static Address addressOf(Variable var) {
    Address address = var.address();
    if (address == null) {
      throw new IllegalStateException("No address for " + var.name);
    }
    return address;
  }

  @Override
  public void onLiteralExpr(Literal literal) {
    emit(Instruction.push(literal.value));
  }

  @Override
  public void onVariableRefExpr(VariableRef ref) {
    emit(Instruction.load(addressOf(ref.variable())));
  }

  @Override
  public void onBinaryExpr(Binary binary) {
    emit(Instruction.binary(binary.op));
  }

  @Override
  public void onNotExpr(Not not) {
    emit(Instruction.of(Opcode.NOT));
  }

  @Override
  public void onProcCallEnd(ProcCall call) {
    emit(Instruction.call(call.procedure().id));
  }

  @Override
  public void onMakeGlobal(MakeStmt make) {
    emitStore(make);
  }

  @Override
  public void onMakeLocal(MakeStmt make) {
    emitStore(make);
  }

  @Override
  public void onMakeAssign(MakeStmt make) {
    emitStore(make);
  }

  private void emitStore(MakeStmt make) {
    emit(Instruction.store(addressOf(make.variable())));
  }

  @Override
  public void onCommandStmt(CommandStmt cmd) {
    emit(Instruction.command(cmd.command));
  }

  @Override
  public void onDirectionStmt(DirectionStmt direction) {
    emit(Instruction.direction(direction.direction));
  }

  @Override
  public void onExpressionStmt(ExpressionStmt exprStmt) {
    // A call used as a statement must not leave its result behind.
    if (exprStmt.call.procedure().returnsValue()) {
      emit(Instruction.of(Opcode.POP));
    }
  }
}
