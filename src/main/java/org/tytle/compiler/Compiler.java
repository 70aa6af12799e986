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

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tytle.ast.Location;
import org.tytle.ast.Program;
import org.tytle.code.CompiledProgram;

/** Parses Tytle source code, resolves it, and lowers it to a {@link CompiledProgram}. */
public final class Compiler {

  private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

  // Static methods only
  private Compiler() {}

  /**
   * Compiles a Tytle program.
   *
   * @param input the program text
   * @throws CompileError if the program has a syntax error or fails to resolve
   */
  public static CompiledProgram compile(CharStream input) {
    Program program = parse(input);
    Resolver.resolve(program);
    CompiledProgram result = CfgBuilder.build(program);
    logger.debug("Compiled {}", input.getSourceName());
    return result;
  }

  public static CompiledProgram compile(String input) {
    return compile(CharStreams.fromString(input));
  }

  /** Parses a Tytle program, returning its unresolved AST. */
  public static Program parse(CharStream input) {
    // Throw CompileErrors in response to parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            throw new CompileError(
                CompileError.Kind.SYNTAX_ERROR, msg, new Location(lineNum, charPositionInLine));
          }
        };
    TytleLexer lexer = new TytleLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    TytleParser parser = new TytleParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    Program program = AstBuilder.build(parser.program());
    logger.debug("Parsed {} top-level statements", program.statements.size());
    return program;
  }

  public static Program parse(String input) {
    return parse(CharStreams.fromString(input));
  }

  /** Returns the location of the given token. */
  static Location location(Token token) {
    if (token == null) {
      // Shouldn't happen, but 0:0 is less useless than a NullPointerException.
      return new Location(0, 0);
    }
    return new Location(token.getLine(), token.getCharPositionInLine());
  }
}
