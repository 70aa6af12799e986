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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tytle.ast.AstWalker;
import org.tytle.ast.BinaryOp;
import org.tytle.ast.Expression;
import org.tytle.ast.Expression.Binary;
import org.tytle.ast.Expression.Literal;
import org.tytle.ast.Expression.Not;
import org.tytle.ast.Expression.ProcCall;
import org.tytle.ast.Expression.VariableRef;
import org.tytle.ast.ExpressionType;
import org.tytle.ast.Location;
import org.tytle.ast.Procedure;
import org.tytle.ast.Program;
import org.tytle.ast.Statement.BlockStmt;
import org.tytle.ast.Statement.DirectionStmt;
import org.tytle.ast.Statement.ExpressionStmt;
import org.tytle.ast.Statement.IfStmt;
import org.tytle.ast.Statement.MakeStmt;
import org.tytle.ast.Statement.ProcParam;
import org.tytle.ast.Statement.ProcedureStmt;
import org.tytle.ast.Statement.RepeatStmt;
import org.tytle.ast.Statement.ReturnStmt;
import org.tytle.ast.Symbol;
import org.tytle.ast.Variable;
import org.tytle.code.Address;

/**
 * The resolution pass. It links every variable reference, assignment target, and procedure call to
 * its symbol, allocates storage for variables, and type-checks expressions.
 *
 * <p>Scoping rules:
 *
 * <ul>
 *   <li>The whole program is resolved inside a <em>global</em> scope (always scope 1). Variables
 *       defined directly in it have GLOBAL storage; all others are LOCAL to the frame of the main
 *       program or of the enclosing procedure.
 *   <li>Each block opens a scope; a procedure's parameters and the top level of its body share
 *       one. Procedures may only be defined at the top level, so a procedure body sees only its own
 *       variables and the globals.
 *   <li>{@code MAKEGLOBAL} assigns a variable in the global scope, creating it if needed; {@code
 *       MAKELOCAL} creates a variable in the current scope; {@code MAKE} assigns the nearest visible
 *       variable, except that directly in the global scope it creates a global if none exists.
 *   <li>Names must be defined before they are used; a procedure is defined (and can be called
 *       recursively) from the start of its body.
 * </ul>
 *
 * <p>Expression types are computed on a stack as the walker visits expressions in post-order.
 */
public final class Resolver implements AstWalker {

  private static final Logger logger = LoggerFactory.getLogger(Resolver.class);

  /**
   * Resolves the given program, filling in the symbol references in its AST and its storage
   * requirements. Throws a {@link CompileError} at the first problem found.
   *
   * @return the symbol table, with all the scopes that were created
   */
  public static SymbolTable resolve(Program program) {
    Preconditions.checkArgument(!program.isResolved(), "Program already resolved");
    Resolver resolver = new Resolver();
    resolver.globalScopeId = resolver.table.startScope().id;
    resolver.walkProgram(program);
    resolver.table.endScope();
    assert resolver.types.isEmpty() && resolver.calls.isEmpty();
    program.setStorage(resolver.numGlobals, resolver.mainFrame.size);
    logger.debug(
        "Resolved {} procedures, {} globals, {} scopes",
        resolver.numProcs,
        resolver.numGlobals,
        resolver.table.numScopes());
    return resolver.table;
  }

  private final SymbolTable table = new SymbolTable();

  private int globalScopeId;

  private int numGlobals;

  private int numProcs;

  /** Allocates LOCAL slots for one procedure call (or for the main program). */
  private static class Frame {
    int size;

    int alloc() {
      return size++;
    }
  }

  private final Frame mainFrame = new Frame();

  /** Non-null while resolving a procedure body. */
  private Procedure currentProc;

  private Frame currentFrame = mainFrame;

  /** The types of the expressions that have been resolved but not yet consumed. */
  private final Deque<ExpressionType> types = new ArrayDeque<>();

  /** A procedure call whose arguments are being resolved. */
  private static class PendingCall {
    final ProcCall call;
    final Procedure proc;
    int numArgs;

    PendingCall(ProcCall call, Procedure proc) {
      this.call = call;
      this.proc = proc;
    }
  }

  /** Calls nest when an argument is itself a call. */
  private final Deque<PendingCall> calls = new ArrayDeque<>();

  private Resolver() {}

  private int currentScopeId() {
    return table.getCurrentScope().id;
  }

  private boolean inGlobalScope() {
    return currentScopeId() == globalScopeId;
  }

  @FormatMethod
  private static CompileError error(
      CompileError.Kind kind, @Nullable Location location, String fmt, Object... fmtArgs) {
    return CompileError.error(kind, location, fmt, fmtArgs);
  }

  private void expect(ExpressionType expected, @Nullable Location location, String what) {
    ExpressionType actual = types.pop();
    if (actual != expected) {
      if (actual == ExpressionType.UNIT) {
        throw error(
            CompileError.Kind.TYPE_MISMATCH, location, "%s: procedure returns no value", what);
      }
      throw error(
          CompileError.Kind.TYPE_MISMATCH,
          location,
          "%s: expected %s, found %s",
          what,
          expected,
          actual);
    }
  }

  /**
   * Creates a variable in the current scope; it is GLOBAL if the current scope is the global scope,
   * LOCAL otherwise.
   */
  private Variable newVariable(String name, ExpressionType type, @Nullable Location location) {
    if (table.lookupSymbol(currentScopeId(), name, Symbol.Kind.VAR) != null) {
      throw error(CompileError.Kind.DUPLICATE_SYMBOL, location, "'%s' is already defined", name);
    }
    Variable var;
    if (inGlobalScope()) {
      var = Variable.global(name, type);
      var.setAddress(Address.global(numGlobals++));
    } else {
      var = Variable.local(name, type);
      var.setAddress(Address.local(currentFrame.alloc()));
    }
    table.createVarSymbol(var);
    return var;
  }

  // Procedures

  @Override
  public void onProcStart(ProcedureStmt proc) {
    if (currentProc != null || !inGlobalScope()) {
      throw error(
          CompileError.Kind.NESTED_PROCEDURE,
          proc.location,
          "Procedure '%s' must be defined at the top level",
          proc.name);
    }
    if (table.lookupSymbol(globalScopeId, proc.name, Symbol.Kind.PROC) != null) {
      throw error(
          CompileError.Kind.DUPLICATE_SYMBOL,
          proc.location,
          "Procedure '%s' is already defined",
          proc.name);
    }
    ImmutableList<ExpressionType> paramTypes =
        proc.params.stream().map(ProcParam::type).collect(ImmutableList.toImmutableList());
    Procedure symbol = new Procedure(proc.name, ++numProcs, paramTypes, proc.returnType);
    table.createProcSymbol(symbol);
    proc.resolve(symbol);
    currentProc = symbol;
    currentFrame = new Frame();
    table.startScope();
  }

  @Override
  public void onProcParam(ProcedureStmt proc, ProcParam param) {
    newVariable(param.name(), param.type(), proc.location);
  }

  @Override
  public void onProcEnd(ProcedureStmt proc) {
    table.endScope();
    currentProc.setFrameSize(currentFrame.size);
    currentProc = null;
    currentFrame = mainFrame;
  }

  // Blocks

  @Override
  public void onBlockStart(BlockStmt block) {
    table.startScope();
  }

  @Override
  public void onBlockEnd(BlockStmt block) {
    table.endScope();
  }

  // Control flow

  @Override
  public void onIfCondition(IfStmt ifStmt) {
    expect(ExpressionType.BOOL, ifStmt.location, "IF condition");
  }

  @Override
  public void onRepeatCount(RepeatStmt repeat) {
    expect(ExpressionType.INT, repeat.location, "REPEAT count");
    // The counter has no name in any scope; it only needs a slot in the current frame.
    Variable counter = Variable.local("repeat@" + repeat.location, ExpressionType.INT);
    counter.setAddress(Address.local(currentFrame.alloc()));
    repeat.setCounter(counter);
  }

  @Override
  public void onReturnStmt(ReturnStmt ret) {
    if (currentProc == null) {
      throw error(
          CompileError.Kind.RETURN_OUTSIDE_PROCEDURE, ret.location, "RETURN outside a procedure");
    }
    String what = "RETURN from " + currentProc.name;
    if (ret.value != null) {
      if (!currentProc.returnsValue()) {
        throw error(
            CompileError.Kind.TYPE_MISMATCH, ret.location, "%s: must not return a value", what);
      }
      expect(currentProc.returnType, ret.location, what);
    } else if (currentProc.returnsValue()) {
      throw error(
          CompileError.Kind.TYPE_MISMATCH,
          ret.location,
          "%s: must return a %s",
          what,
          currentProc.returnType);
    }
  }

  // Expressions

  @Override
  public void onLiteralExpr(Literal literal) {
    types.push(literal.type());
  }

  @Override
  public void onVariableRefExpr(VariableRef ref) {
    Symbol symbol = table.recursiveLookupSymbol(currentScopeId(), ref.name, Symbol.Kind.VAR);
    if (symbol == null) {
      throw error(
          CompileError.Kind.UNDEFINED_VARIABLE, ref.location, "Undefined variable '%s'", ref.name);
    }
    Variable var = (Variable) symbol;
    ref.resolve(var);
    types.push(var.type);
  }

  @Override
  public void onBinaryExpr(Binary binary) {
    ExpressionType right = types.pop();
    ExpressionType left = types.peek();
    String what = "Operand of " + binary.op.symbol;
    // "+" also concatenates strings; everything else takes ints.
    ExpressionType operandType =
        (binary.op == BinaryOp.ADD && left == ExpressionType.STR)
            ? ExpressionType.STR
            : ExpressionType.INT;
    expect(operandType, binary.location, what);
    types.push(right);
    expect(operandType, binary.location, what);
    types.push(binary.op.isComparison() ? ExpressionType.BOOL : operandType);
  }

  @Override
  public void onNotExpr(Not not) {
    expect(ExpressionType.BOOL, not.location, "Operand of NOT");
    types.push(ExpressionType.BOOL);
  }

  // Procedure calls

  @Override
  public void onProcCallStart(ProcCall call) {
    Symbol symbol = table.recursiveLookupSymbol(currentScopeId(), call.name, Symbol.Kind.PROC);
    if (symbol == null) {
      throw error(
          CompileError.Kind.UNDEFINED_PROCEDURE,
          call.location,
          "Undefined procedure '%s'",
          call.name);
    }
    Procedure proc = (Procedure) symbol;
    call.resolve(proc);
    calls.push(new PendingCall(call, proc));
  }

  @Override
  public void onProcParamExprEnd(ProcCall call, Expression arg) {
    PendingCall pending = calls.peek();
    assert pending.call == call;
    int index = pending.numArgs++;
    if (index >= pending.proc.numParams()) {
      throw argCountMismatch(pending.proc, call);
    }
    expect(
        pending.proc.paramTypes.get(index),
        arg.location,
        String.format("Argument %s of %s", index + 1, call.name));
  }

  @Override
  public void onProcCallEnd(ProcCall call) {
    PendingCall pending = calls.pop();
    assert pending.call == call;
    if (pending.numArgs != pending.proc.numParams()) {
      throw argCountMismatch(pending.proc, call);
    }
    types.push(pending.proc.returnType);
  }

  private static CompileError argCountMismatch(Procedure proc, ProcCall call) {
    return error(
        CompileError.Kind.ARGUMENT_COUNT_MISMATCH,
        call.location,
        "'%s' expects %s arguments, got %s",
        proc.name,
        proc.numParams(),
        call.args.size());
  }

  // MAKE statements

  @Override
  public void onMakeGlobal(MakeStmt make) {
    Symbol existing = table.lookupSymbol(globalScopeId, make.name, Symbol.Kind.VAR);
    if (existing != null) {
      assign(make, (Variable) existing);
      return;
    }
    ExpressionType type = valueType(make);
    Variable var = Variable.global(make.name, type);
    var.setAddress(Address.global(numGlobals++));
    table.createVarSymbol(globalScopeId, var);
    make.resolve(var);
  }

  @Override
  public void onMakeLocal(MakeStmt make) {
    make.resolve(newVariable(make.name, valueType(make), make.location));
  }

  @Override
  public void onMakeAssign(MakeStmt make) {
    Symbol existing = table.recursiveLookupSymbol(currentScopeId(), make.name, Symbol.Kind.VAR);
    if (existing != null) {
      assign(make, (Variable) existing);
    } else if (inGlobalScope()) {
      make.resolve(newVariable(make.name, valueType(make), make.location));
    } else {
      throw error(
          CompileError.Kind.UNDEFINED_VARIABLE,
          make.location,
          "Undefined variable '%s'",
          make.name);
    }
  }

  /** Pops the type of a MAKE's value, which must be an actual value. */
  private ExpressionType valueType(MakeStmt make) {
    ExpressionType type = types.peek();
    if (type == ExpressionType.UNIT) {
      expect(ExpressionType.INT, make.location, "Value of " + make.name);
    }
    return types.pop();
  }

  private void assign(MakeStmt make, Variable var) {
    expect(var.type, make.location, "Value of " + make.name);
    make.resolve(var);
  }

  // Everything else

  @Override
  public void onDirectionStmt(DirectionStmt direction) {
    expect(ExpressionType.INT, direction.location, direction.direction.name());
  }

  @Override
  public void onExpressionStmt(ExpressionStmt exprStmt) {
    // The result (if any) is discarded.
    types.pop();
  }
}
