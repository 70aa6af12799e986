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

package org.tytle.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The root of the AST: the top-level statements in source order. Resolution records how much
 * storage the program needs.
 */
public final class Program {
  public final ImmutableList<Statement> statements;

  private int globalsSize = -1;
  private int mainFrameSize = -1;

  public Program(ImmutableList<Statement> statements) {
    this.statements = statements;
  }

  public static Program of(Statement... statements) {
    return new Program(ImmutableList.copyOf(statements));
  }

  public boolean isResolved() {
    return globalsSize >= 0;
  }

  /** The number of global slots. */
  public int globalsSize() {
    Preconditions.checkState(isResolved());
    return globalsSize;
  }

  /** The number of local slots used by top-level code (block locals and loop counters). */
  public int mainFrameSize() {
    Preconditions.checkState(isResolved());
    return mainFrameSize;
  }

  public void setStorage(int globalsSize, int mainFrameSize) {
    Preconditions.checkState(!isResolved());
    Preconditions.checkArgument(globalsSize >= 0 && mainFrameSize >= 0);
    this.globalsSize = globalsSize;
    this.mainFrameSize = mainFrameSize;
  }
}
