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

import com.google.common.base.Ascii;

/**
 * The operations an {@link Instruction} can perform. Value operations work on the VM's value stack:
 * operands are popped (right operand on top) and the result pushed.
 */
public enum Opcode {
  // Values

  /** Pushes the instruction's constant operand. */
  PUSH(true),
  /** Pushes the value stored at the instruction's address. */
  LOAD(true),
  /** Pops a value and stores it at the instruction's address. */
  STORE(false),
  /** Pops and discards a value. */
  POP(false),
  ADD(true),
  SUB(true),
  MUL(true),
  DIV(true),
  LT(true),
  GT(true),
  NOT(true),

  // Control

  /**
   * Pops the callee's arguments and transfers control to its entry node; the callee's result (if
   * it has one) is on the stack when control comes back.
   */
  CALL(true),
  /** Returns from the current procedure; the operand says whether a result is on the stack. */
  RETURN(false),

  // Turtle movement; each pops its argument.

  FORWARD(false),
  BACKWARD(false),
  LEFT(false),
  RIGHT(false),
  SETX(false),
  SETY(false),

  // Pen and visibility.

  PENUP(false),
  PENDOWN(false),
  PENERASE(false),
  SHOWTURTLE(false),
  HIDETURTLE(false);

  /**
   * True if executing this opcode leaves a new value on top of the stack. CALL is included,
   * although it only does so for procedures that return a value.
   */
  public final boolean producesValue;

  Opcode(boolean producesValue) {
    this.producesValue = producesValue;
  }

  @Override
  public String toString() {
    return Ascii.toLowerCase(name());
  }
}
