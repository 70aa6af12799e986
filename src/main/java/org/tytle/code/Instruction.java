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

package org.tytle.code;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.tytle.ast.BinaryOp;
import org.tytle.ast.Statement.Command;
import org.tytle.ast.Statement.Direction;

/**
 * A single VM instruction: an {@link Opcode} and, for some opcodes, an operand (a constant for
 * PUSH, an {@link Address} for LOAD and STORE, a procedure id for CALL, a has-value flag for
 * RETURN). Instructions are immutable and compare by value.
 */
public final class Instruction {

  public final Opcode opcode;

  private final @Nullable Object operand;

  private Instruction(Opcode opcode, @Nullable Object operand) {
    this.opcode = opcode;
    this.operand = operand;
  }

  /** Instructions without an operand are shared. */
  private static final ImmutableMap<Opcode, Instruction> SIMPLE;

  static {
    ImmutableMap.Builder<Opcode, Instruction> builder = ImmutableMap.builder();
    for (Opcode op : Opcode.values()) {
      switch (op) {
        case PUSH, LOAD, STORE, CALL, RETURN -> {}
        default -> builder.put(op, new Instruction(op, null));
      }
    }
    SIMPLE = builder.buildOrThrow();
  }

  /** Returns the instruction for an opcode that takes no operand. */
  public static Instruction of(Opcode opcode) {
    Instruction result = SIMPLE.get(opcode);
    Preconditions.checkArgument(result != null, "%s requires an operand", opcode);
    return result;
  }

  public static Instruction pushInt(int value) {
    return new Instruction(Opcode.PUSH, value);
  }

  public static Instruction pushStr(String value) {
    return new Instruction(Opcode.PUSH, Preconditions.checkNotNull(value));
  }

  public static Instruction pushBool(boolean value) {
    return new Instruction(Opcode.PUSH, value);
  }

  /** Returns a PUSH of an Integer, String or Boolean constant. */
  public static Instruction push(Object value) {
    Preconditions.checkArgument(
        value instanceof Integer || value instanceof String || value instanceof Boolean,
        "Not a constant: %s",
        value);
    return new Instruction(Opcode.PUSH, value);
  }

  public static Instruction load(Address address) {
    return new Instruction(Opcode.LOAD, Preconditions.checkNotNull(address));
  }

  public static Instruction store(Address address) {
    return new Instruction(Opcode.STORE, Preconditions.checkNotNull(address));
  }

  public static Instruction call(int procId) {
    return new Instruction(Opcode.CALL, procId);
  }

  /** Returns a RETURN; if {@code withValue} is true the result is on top of the stack. */
  public static Instruction ret(boolean withValue) {
    return new Instruction(Opcode.RETURN, withValue);
  }

  public static Instruction binary(BinaryOp op) {
    return of(Opcode.valueOf(op.name()));
  }

  public static Instruction direction(Direction direction) {
    return of(Opcode.valueOf(direction.name()));
  }

  public static Instruction command(Command command) {
    return of(Opcode.valueOf(command.name()));
  }

  /** The constant pushed by a PUSH instruction. */
  public Object constant() {
    Preconditions.checkState(opcode == Opcode.PUSH);
    return operand;
  }

  /** The address read or written by a LOAD or STORE instruction. */
  public Address address() {
    Preconditions.checkState(opcode == Opcode.LOAD || opcode == Opcode.STORE);
    return (Address) operand;
  }

  /** The procedure called by a CALL instruction. */
  public int procId() {
    Preconditions.checkState(opcode == Opcode.CALL);
    return (Integer) operand;
  }

  /** True if this is a RETURN with the procedure's result on top of the stack. */
  public boolean returnsValue() {
    Preconditions.checkState(opcode == Opcode.RETURN);
    return (Boolean) operand;
  }

  public boolean isReturn() {
    return opcode == Opcode.RETURN;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Instruction other
        && opcode == other.opcode
        && Objects.equals(operand, other.operand);
  }

  @Override
  public int hashCode() {
    return Objects.hash(opcode, operand);
  }

  @Override
  public String toString() {
    if (operand == null) {
      return opcode.toString();
    } else if (opcode == Opcode.RETURN) {
      return returnsValue() ? "return value" : "return";
    } else if (operand instanceof String) {
      return opcode + " \"" + operand + "\"";
    } else if (opcode == Opcode.CALL) {
      return "call #" + operand;
    }
    return opcode + " " + operand;
  }
}
