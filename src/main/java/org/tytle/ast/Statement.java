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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * The statement tree. As with {@link Expression}, the resolver fills in the symbol fields (the
 * target of a {@link MakeStmt}, the counter of a {@link RepeatStmt}, the symbol of a {@link
 * ProcedureStmt}) but never changes the structure.
 */
public abstract class Statement {

  /** Where this statement started in the source, or null for a synthesized tree. */
  public final @Nullable Location location;

  private Statement(@Nullable Location location) {
    this.location = location;
  }

  /** The turtle and pen commands that take no argument. */
  public enum Command {
    PENUP,
    PENDOWN,
    PENERASE,
    SHOWTURTLE,
    HIDETURTLE
  }

  /** The turtle commands that take a distance (or angle, or coordinate). */
  public enum Direction {
    FORWARD,
    BACKWARD,
    LEFT,
    RIGHT,
    SETX,
    SETY
  }

  /** The three flavors of assignment. */
  public enum MakeKind {
    /** {@code MAKEGLOBAL}: assigns (creating if necessary) a variable in the global scope. */
    GLOBAL,
    /** {@code MAKELOCAL}: creates a new variable in the current scope. */
    LOCAL,
    /** {@code MAKE}: assigns a variable that is already visible. */
    ASSIGN
  }

  /** A bracketed list of statements; each block introduces a new scope. */
  public static final class BlockStmt {
    public final ImmutableList<Statement> stmts;

    public BlockStmt(ImmutableList<Statement> stmts) {
      this.stmts = stmts;
    }

    public static BlockStmt of(Statement... stmts) {
      return new BlockStmt(ImmutableList.copyOf(stmts));
    }
  }

  public static final class CommandStmt extends Statement {
    public final Command command;

    public CommandStmt(Command command, @Nullable Location location) {
      super(location);
      this.command = command;
    }

    @Override
    public String toString() {
      return command.name();
    }
  }

  public static final class DirectionStmt extends Statement {
    public final Direction direction;
    public final Expression distance;

    public DirectionStmt(Direction direction, Expression distance, @Nullable Location location) {
      super(location);
      this.direction = direction;
      this.distance = distance;
    }

    @Override
    public String toString() {
      return direction + " " + distance;
    }
  }

  public static final class RepeatStmt extends Statement {
    public final Expression count;
    public final BlockStmt block;

    /** A hidden variable holding the number of iterations left. */
    private Variable counter;

    public RepeatStmt(Expression count, BlockStmt block, @Nullable Location location) {
      super(location);
      this.count = count;
      this.block = block;
    }

    public @Nullable Variable counter() {
      return counter;
    }

    public void setCounter(Variable counter) {
      Preconditions.checkState(this.counter == null);
      this.counter = counter;
    }

    @Override
    public String toString() {
      return "REPEAT " + count + " [...]";
    }
  }

  public static final class IfStmt extends Statement {
    public final Expression condition;
    public final BlockStmt trueBlock;
    public final @Nullable BlockStmt falseBlock;

    public IfStmt(
        Expression condition,
        BlockStmt trueBlock,
        @Nullable BlockStmt falseBlock,
        @Nullable Location location) {
      super(location);
      this.condition = condition;
      this.trueBlock = trueBlock;
      this.falseBlock = falseBlock;
    }

    @Override
    public String toString() {
      return "IF " + condition + ((falseBlock == null) ? " [...]" : " [...] [...]");
    }
  }

  public static final class MakeStmt extends Statement {
    public final MakeKind kind;
    public final String name;
    public final Expression value;
    private Variable variable;

    public MakeStmt(MakeKind kind, String name, Expression value, @Nullable Location location) {
      super(location);
      this.kind = kind;
      this.name = name;
      this.value = value;
    }

    /** The variable being assigned, or null if it has not been resolved yet. */
    public @Nullable Variable variable() {
      return variable;
    }

    public void resolve(Variable variable) {
      Preconditions.checkState(this.variable == null);
      this.variable = variable;
    }

    @Override
    public String toString() {
      String keyword =
          switch (kind) {
            case GLOBAL -> "MAKEGLOBAL";
            case LOCAL -> "MAKELOCAL";
            case ASSIGN -> "MAKE";
          };
      return String.format("%s %s = %s", keyword, name, value);
    }
  }

  /** A declared procedure parameter. */
  public record ProcParam(String name, ExpressionType type) {}

  public static final class ProcedureStmt extends Statement {
    public final String name;
    public final ImmutableList<ProcParam> params;
    public final ExpressionType returnType;
    public final BlockStmt block;
    private Procedure procedure;

    public ProcedureStmt(
        String name,
        ImmutableList<ProcParam> params,
        ExpressionType returnType,
        BlockStmt block,
        @Nullable Location location) {
      super(location);
      this.name = name;
      this.params = params;
      this.returnType = returnType;
      this.block = block;
    }

    public @Nullable Procedure procedure() {
      return procedure;
    }

    public void resolve(Procedure procedure) {
      Preconditions.checkState(this.procedure == null);
      this.procedure = procedure;
    }

    @Override
    public String toString() {
      return "TO " + name + params;
    }
  }

  /** Returns from the enclosing procedure, optionally with a value. */
  public static final class ReturnStmt extends Statement {
    public final @Nullable Expression value;

    public ReturnStmt(@Nullable Expression value, @Nullable Location location) {
      super(location);
      this.value = value;
    }

    @Override
    public String toString() {
      return (value == null) ? "RETURN" : "RETURN " + value;
    }
  }

  /** A procedure call whose result (if any) is discarded. */
  public static final class ExpressionStmt extends Statement {
    public final Expression.ProcCall call;

    public ExpressionStmt(Expression.ProcCall call, @Nullable Location location) {
      super(location);
      this.call = call;
    }

    @Override
    public String toString() {
      return call.toString();
    }
  }
}
