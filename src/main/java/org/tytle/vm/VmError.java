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

package org.tytle.vm;

import com.google.errorprone.annotations.FormatMethod;

/**
 * An error detected while executing a program. The {@link VirtualMachine} catches these, records
 * them, and stops in the FAILED state.
 *
 * <p>A VmError thrown by one of the VM's components doesn't know where execution was; the VM fills
 * that in (see {@link #at}).
 */
public class VmError extends RuntimeException {

  public enum Kind {
    ADDRESS_OUT_OF_RANGE,
    UNINITIALIZED_ADDRESS,
    DIVISION_BY_ZERO,
    TYPE_MISMATCH,
    OPERAND_STACK_UNDERFLOW,
    MISSING_RETURN_VALUE,
    CALL_STACK_OVERFLOW,
    CALL_STACK_UNDERFLOW,
    MISSING_EDGE;

    /** Throws a VmError of this kind unless {@code check} is true. */
    @FormatMethod
    void unless(boolean check, String fmt, Object... fmtArgs) {
      if (!check) {
        throw new VmError(this, String.format(fmt, fmtArgs));
      }
    }
  }

  /** Used for {@link #nodeId} and {@link #instIndex} until the position is known. */
  public static final int UNKNOWN = -1;

  public final Kind kind;
  public final String msg;

  /** The node being executed when the error occurred. */
  public final int nodeId;

  /**
   * The index of the failing instruction within its node, or the node's instruction count if the
   * error occurred while leaving the node.
   */
  public final int instIndex;

  public VmError(Kind kind, String msg, int nodeId, int instIndex) {
    super(msg);
    this.kind = kind;
    this.msg = msg;
    this.nodeId = nodeId;
    this.instIndex = instIndex;
  }

  public VmError(Kind kind, String msg) {
    this(kind, msg, UNKNOWN, UNKNOWN);
  }

  /** Returns this error if its position is known, or a copy with the given position otherwise. */
  VmError at(int nodeId, int instIndex) {
    return (this.nodeId != UNKNOWN) ? this : new VmError(kind, msg, nodeId, instIndex);
  }

  @Override
  public String getMessage() {
    return String.format("%s: %s (node %s, instruction %s)", kind, msg, nodeId, instIndex);
  }
}
