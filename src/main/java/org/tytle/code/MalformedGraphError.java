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

/** Thrown by {@link CfgGraph#verify} when a graph is not fit to be executed. */
public class MalformedGraphError extends RuntimeException {
  public final String msg;

  /** The node at which the problem was detected. */
  public final int nodeId;

  public MalformedGraphError(String msg, int nodeId) {
    super(msg);
    this.msg = msg;
    this.nodeId = nodeId;
  }

  @Override
  public String getMessage() {
    return String.format("%s (node %s)", msg, nodeId);
  }
}
