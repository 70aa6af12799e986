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

/** The kinds of control transfer along a {@link CfgEdge}. */
public enum JumpKind {
  /** Taken unconditionally. */
  ALWAYS,
  /** Taken when the condition evaluated at the end of the source node was true. */
  WHEN_TRUE,
  /** Taken on the complementary path: the condition was false, or a loop counter is exhausted. */
  FALLBACK
}
