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
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * The expression tree. Each subclass is a node type; the fields that refer to symbols (on {@link
 * VariableRef} and {@link ProcCall}) start out null and are filled in exactly once by the resolver,
 * which never changes the structure of the tree.
 */
public abstract class Expression {

  /** Where this expression started in the source, or null for a synthesized tree. */
  public final @Nullable Location location;

  private Expression(@Nullable Location location) {
    this.location = location;
  }

  /** An int, string or boolean constant. */
  public static final class Literal extends Expression {
    public final Object value;

    private Literal(Object value, @Nullable Location location) {
      super(location);
      this.value = value;
    }

    public static Literal ofInt(int value, @Nullable Location location) {
      return new Literal(value, location);
    }

    public static Literal ofStr(String value, @Nullable Location location) {
      return new Literal(value, location);
    }

    public static Literal ofBool(boolean value, @Nullable Location location) {
      return new Literal(value, location);
    }

    public ExpressionType type() {
      if (value instanceof Integer) {
        return ExpressionType.INT;
      } else if (value instanceof String) {
        return ExpressionType.STR;
      } else {
        return ExpressionType.BOOL;
      }
    }

    @Override
    public String toString() {
      return (value instanceof String) ? "\"" + value + "\"" : value.toString();
    }
  }

  /** A reference to a variable's current value. */
  public static final class VariableRef extends Expression {
    public final String name;
    private Variable variable;

    public VariableRef(String name, @Nullable Location location) {
      super(location);
      this.name = name;
    }

    /** The variable this name resolved to, or null if it has not been resolved yet. */
    public @Nullable Variable variable() {
      return variable;
    }

    public void resolve(Variable variable) {
      Preconditions.checkState(this.variable == null);
      this.variable = variable;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A call to a user-defined procedure. */
  public static final class ProcCall extends Expression {
    public final String name;
    public final ImmutableList<Expression> args;
    private Procedure procedure;

    public ProcCall(String name, ImmutableList<Expression> args, @Nullable Location location) {
      super(location);
      this.name = name;
      this.args = args;
    }

    /** The procedure this call resolved to, or null if it has not been resolved yet. */
    public @Nullable Procedure procedure() {
      return procedure;
    }

    public void resolve(Procedure procedure) {
      Preconditions.checkState(this.procedure == null);
      this.procedure = procedure;
    }

    @Override
    public String toString() {
      return args.stream().map(Object::toString).collect(Collectors.joining(", ", name + "(", ")"));
    }
  }

  /** {@code left op right}. */
  public static final class Binary extends Expression {
    public final BinaryOp op;
    public final Expression left;
    public final Expression right;

    public Binary(BinaryOp op, Expression left, Expression right, @Nullable Location location) {
      super(location);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public String toString() {
      return String.format("%s %s %s", left, op.symbol, right);
    }
  }

  /** An expression in parentheses; kept in the tree so that it prints the way it was written. */
  public static final class Parenthesized extends Expression {
    public final Expression inner;

    public Parenthesized(Expression inner, @Nullable Location location) {
      super(location);
      this.inner = inner;
    }

    @Override
    public String toString() {
      return "(" + inner + ")";
    }
  }

  /** {@code NOT(inner)}. */
  public static final class Not extends Expression {
    public final Expression inner;

    public Not(Expression inner, @Nullable Location location) {
      super(location);
      this.inner = inner;
    }

    @Override
    public String toString() {
      return "NOT(" + inner + ")";
    }
  }
}
