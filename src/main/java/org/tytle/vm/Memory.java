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
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * A fixed number of value slots indexed by absolute address. Slots start out uninitialized, and
 * reading one before it has been written is an error.
 */
public final class Memory {

  private final MemoryValue[] slots;

  public Memory(int capacity) {
    Preconditions.checkArgument(capacity >= 0);
    slots = new MemoryValue[capacity];
  }

  public int capacity() {
    return slots.length;
  }

  private void checkAddress(int address) {
    VmError.Kind.ADDRESS_OUT_OF_RANGE.unless(
        address >= 0 && address < slots.length, "Address %s out of range", address);
  }

  /** Returns the value at the given address; throws a VmError if there isn't one. */
  public MemoryValue load(int address) {
    checkAddress(address);
    MemoryValue result = slots[address];
    VmError.Kind.UNINITIALIZED_ADDRESS.unless(
        result != null, "Address %s read before being written", address);
    return result;
  }

  public void store(int address, MemoryValue value) {
    checkAddress(address);
    slots[address] = Preconditions.checkNotNull(value);
  }

  /** Returns the value at the given address, or null if it is out of range or uninitialized. */
  public @Nullable MemoryValue get(int address) {
    return (address >= 0 && address < slots.length) ? slots[address] : null;
  }

  /** Marks {@code [start, start + size)} as uninitialized. */
  void clear(int start, int size) {
    Preconditions.checkArgument(start >= 0 && start + size <= slots.length);
    Arrays.fill(slots, start, start + size, null);
  }
}
