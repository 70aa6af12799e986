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

import com.google.common.base.Preconditions;
import org.tytle.ast.ExpressionType;

/** An int, string or boolean; the values that live in memory and on the operand stack. */
public final class MemoryValue {

  public static final MemoryValue TRUE = new MemoryValue(Boolean.TRUE);
  public static final MemoryValue FALSE = new MemoryValue(Boolean.FALSE);

  private final Object value;

  private MemoryValue(Object value) {
    this.value = value;
  }

  public static MemoryValue ofInt(int i) {
    return new MemoryValue(i);
  }

  public static MemoryValue ofStr(String s) {
    return new MemoryValue(Preconditions.checkNotNull(s));
  }

  public static MemoryValue ofBool(boolean b) {
    return b ? TRUE : FALSE;
  }

  /** Wraps an Integer, String or Boolean (such as the constant of a PUSH instruction). */
  public static MemoryValue of(Object value) {
    if (value instanceof Boolean b) {
      return ofBool(b);
    }
    Preconditions.checkArgument(
        value instanceof Integer || value instanceof String, "Not a value: %s", value);
    return new MemoryValue(value);
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

  public boolean isInt() {
    return value instanceof Integer;
  }

  public boolean isStr() {
    return value instanceof String;
  }

  /** Returns the int value, or throws a TYPE_MISMATCH VmError. */
  public int asInt() {
    VmError.Kind.TYPE_MISMATCH.unless(isInt(), "Expected an int, found %s", this);
    return (Integer) value;
  }

  /** Returns the string value, or throws a TYPE_MISMATCH VmError. */
  public String asStr() {
    VmError.Kind.TYPE_MISMATCH.unless(isStr(), "Expected a string, found %s", this);
    return (String) value;
  }

  /** Returns the boolean value, or throws a TYPE_MISMATCH VmError. */
  public boolean asBool() {
    VmError.Kind.TYPE_MISMATCH.unless(
        value instanceof Boolean, "Expected a boolean, found %s", this);
    return (Boolean) value;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof MemoryValue other && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return isStr() ? "\"" + value + "\"" : value.toString();
  }
}
