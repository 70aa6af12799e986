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

/**
 * The compile-time location of a variable's value. GLOBAL addresses are absolute memory addresses;
 * LOCAL addresses are offsets from the base address of the active frame (the main program's frame
 * or the innermost procedure call).
 */
public record Address(Kind kind, int index) {

  /** Distinguishes absolute from frame-relative addresses. */
  public enum Kind {
    GLOBAL,
    LOCAL
  }

  public Address {
    Preconditions.checkNotNull(kind);
    Preconditions.checkArgument(index >= 0, "negative address %s", index);
  }

  public static Address global(int index) {
    return new Address(Kind.GLOBAL, index);
  }

  public static Address local(int index) {
    return new Address(Kind.LOCAL, index);
  }

  public boolean isGlobal() {
    return kind == Kind.GLOBAL;
  }

  /** Returns the absolute memory address, given the base address of the active frame. */
  public int resolve(int frameBase) {
    return isGlobal() ? index : frameBase + index;
  }

  @Override
  public String toString() {
    return (isGlobal() ? "g" : "l") + index;
  }
}
