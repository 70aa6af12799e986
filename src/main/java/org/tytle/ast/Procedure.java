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
 * A procedure symbol. The resolver creates one for each {@link Statement.ProcedureStmt} before
 * resolving its body (so that the body may call it recursively), and records the procedure's frame
 * size once the body has been resolved.
 */
public final class Procedure extends Symbol {

  /** Procedure ids are assigned from 1 in definition order. */
  public final int id;

  public final ImmutableList<ExpressionType> paramTypes;

  public final ExpressionType returnType;

  /** The number of local slots (parameters, locals, loop counters) a call needs; -1 until known. */
  private int frameSize = -1;

  public Procedure(
      String name, int id, ImmutableList<ExpressionType> paramTypes, ExpressionType returnType) {
    super(name);
    Preconditions.checkArgument(id > 0);
    this.id = id;
    this.paramTypes = paramTypes;
    this.returnType = returnType;
  }

  /** Creates a procedure with no parameters that returns nothing. */
  public Procedure(String name, int id) {
    this(name, id, ImmutableList.of(), ExpressionType.UNIT);
  }

  @Override
  public Kind kind() {
    return Kind.PROC;
  }

  public int numParams() {
    return paramTypes.size();
  }

  public boolean returnsValue() {
    return returnType != ExpressionType.UNIT;
  }

  public int frameSize() {
    Preconditions.checkState(frameSize >= 0, "frame size of %s not known yet", name);
    return frameSize;
  }

  public void setFrameSize(int frameSize) {
    Preconditions.checkState(this.frameSize < 0);
    Preconditions.checkArgument(frameSize >= paramTypes.size());
    this.frameSize = frameSize;
  }

  @Override
  public String toString() {
    return String.format("%s#%s%s:%s", name, id, paramTypes, returnType);
  }
}
