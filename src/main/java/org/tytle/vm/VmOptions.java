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
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** Resource limits and debugging options for a {@link VirtualMachine}. */
public final class VmOptions {

  public static final int DEFAULT_MEMORY_CAPACITY = 65536;
  public static final int DEFAULT_MAX_CALL_DEPTH = 1024;

  public static final VmOptions DEFAULT = builder().build();

  /** The number of memory slots, for globals and all frames. */
  public final int memoryCapacity;

  public final int maxCallDepth;

  /** If true, each instruction is logged at DEBUG rather than TRACE. */
  public final boolean trace;

  private VmOptions(Builder builder) {
    this.memoryCapacity = builder.memoryCapacity;
    this.maxCallDepth = builder.maxCallDepth;
    this.trace = builder.trace;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private int memoryCapacity = DEFAULT_MEMORY_CAPACITY;
    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
    private boolean trace;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder memoryCapacity(int memoryCapacity) {
      Preconditions.checkArgument(
          memoryCapacity >= 0, "memoryCapacity must not be negative: %s", memoryCapacity);
      this.memoryCapacity = memoryCapacity;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder maxCallDepth(int maxCallDepth) {
      Preconditions.checkArgument(
          maxCallDepth >= 0, "maxCallDepth must not be negative: %s", maxCallDepth);
      this.maxCallDepth = maxCallDepth;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder trace(boolean trace) {
      this.trace = trace;
      return this;
    }

    public VmOptions build() {
      return new VmOptions(this);
    }
  }

  @Override
  public String toString() {
    return String.format(
        "memory=%s maxCallDepth=%s trace=%s", memoryCapacity, maxCallDepth, trace);
  }
}
