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
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/** The activation frames of the procedure calls in progress, innermost on top. */
public final class CallStack {

  /**
   * One procedure call.
   *
   * @param returnNodeId the node containing the CALL
   * @param returnIndex the index of the instruction after the CALL
   * @param base the absolute address of the callee's first local slot
   * @param size the number of local slots
   * @param procId the callee
   */
  public record Frame(int returnNodeId, int returnIndex, int base, int size, int procId) {}

  private final Deque<Frame> frames = new ArrayDeque<>();

  private final int maxDepth;

  public CallStack(int maxDepth) {
    Preconditions.checkArgument(maxDepth >= 0);
    this.maxDepth = maxDepth;
  }

  public int depth() {
    return frames.size();
  }

  public boolean isEmpty() {
    return frames.isEmpty();
  }

  /** The innermost frame, or null if no call is in progress. */
  public @Nullable Frame top() {
    return frames.peek();
  }

  void push(Frame frame) {
    VmError.Kind.CALL_STACK_OVERFLOW.unless(
        frames.size() < maxDepth, "More than %s nested calls", maxDepth);
    frames.push(frame);
  }

  Frame pop() {
    VmError.Kind.CALL_STACK_UNDERFLOW.unless(!frames.isEmpty(), "RETURN with no call in progress");
    return frames.pop();
  }
}
