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

/** The binary operators. */
public enum BinaryOp {
  ADD("+"),
  SUB("-"),
  MUL("*"),
  DIV("/"),
  LT("<"),
  GT(">");

  /** How this operator is written in the source. */
  public final String symbol;

  BinaryOp(String symbol) {
    this.symbol = symbol;
  }

  /** True for the operators that compare their arguments and produce a BOOL. */
  public boolean isComparison() {
    return this == LT || this == GT;
  }

  /** Returns the BinaryOp written as {@code symbol}. */
  public static BinaryOp forSymbol(String symbol) {
    for (BinaryOp op : values()) {
      if (op.symbol.equals(symbol)) {
        return op;
      }
    }
    throw new IllegalArgumentException("No binary operator " + symbol);
  }
}
