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

package org.tytle.compiler;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.function.Function;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.tytle.ast.Location;

/**
 * A base class for the parse tree visitors that:
 *
 * <ul>
 *   <li>disables the default "do nothing" behavior for node types that haven't been overridden;
 *       visiting a node that doesn't have an explicit visit* method throws an AssertionError; and
 *   <li>tracks the node currently being visited, so that AST nodes and errors can be given its
 *       location without passing it around.
 * </ul>
 */
class VisitorBase<T> extends TytleBaseVisitor<T> {

  /** The node currently being visited. */
  private ParseTree currentNode;

  @Override
  protected final T defaultResult() {
    // Only reached from a visitXXX() method that should have been overridden.
    throw new AssertionError();
  }

  @Override
  public final T visit(ParseTree tree) {
    return visitWithCurrentNode(tree, super::visit);
  }

  /**
   * Calls {@code visitor} with the given node, binding {@link #currentNode} for the duration of the
   * call.
   *
   * <p>Assumes that if the function throws an exception, this visitor will not be used again.
   */
  @CanIgnoreReturnValue
  T visitWithCurrentNode(ParseTree node, Function<ParseTree, T> visitor) {
    ParseTree prevNode = currentNode;
    currentNode = node;
    T result = visitor.apply(node);
    currentNode = prevNode;
    return result;
  }

  /** Returns the first token of the current node. */
  Token currentToken() {
    return ((ParserRuleContext) currentNode).start;
  }

  /** Returns the location of the current node. */
  Location location() {
    return Compiler.location(currentToken());
  }

  /** Returns a SYNTAX_ERROR pointing at the current node. */
  @FormatMethod
  CompileError error(String fmt, Object... fmtArgs) {
    return CompileError.error(CompileError.Kind.SYNTAX_ERROR, location(), fmt, fmtArgs);
  }
}
