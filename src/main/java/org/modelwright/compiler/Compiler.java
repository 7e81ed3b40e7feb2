/*
 * Copyright 2025 The Modelwright Authors
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

package org.modelwright.compiler;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.FormatMethod;
import java.util.Map;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.modelwright.Model;
import org.modelwright.compiler.ModelSpecParser.UnitContext;

public final class Compiler {

  // Static methods only
  private Compiler() {}

  /**
   * Compiles a sequence of model statements, adding the variables, constraints and objective they
   * describe to {@code model}.
   *
   * <p>Statements are compiled in order and each statement may refer to the names declared by the
   * statements before it. If a statement cannot be compiled a {@link CompileError} is thrown; any
   * entities added to the model by earlier statements (or by the failed statement before the error
   * was detected) are not removed.
   *
   * @param input the statements
   * @param source an optional identifier for the source of the statements, e.g. a filename; used
   *     only for logging
   * @param model the model to build
   * @param parser used to evaluate each algebraic expression in the statements
   * @param parameters values for names that may be referenced by the statements, e.g. data arrays
   * @return the values of the named containers, and the result of each statement
   */
  public static Compilation compile(
      CharStream input,
      Object source,
      Model.Builder model,
      Model.ExpressionParser parser,
      Map<String, ?> parameters) {
    return compile(input, source, model, parser, parameters, BuilderDispatch.standard());
  }

  /**
   * Like {@link #compile(CharStream, Object, Model.Builder, Model.ExpressionParser, Map)}, but
   * builds constraints with the given BuilderDispatch rather than the standard one.
   */
  public static Compilation compile(
      CharStream input,
      Object source,
      Model.Builder model,
      Model.ExpressionParser parser,
      Map<String, ?> parameters,
      BuilderDispatch dispatch) {
    Preconditions.checkNotNull(model);
    Preconditions.checkNotNull(parser);
    Preconditions.checkNotNull(dispatch);
    return Symbols.compile(
        model, parser, dispatch, source, parse(input), ImmutableMap.copyOf(parameters));
  }

  /** Parses a sequence of model statements. */
  public static UnitContext parse(CharStream input) {
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
            throw new CompileError(msg, lineNum, charPositionInLine);
          }
        };
    ModelSpecLexer lexer = new ModelSpecLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    ModelSpecParser parser = new ModelSpecParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    return parser.unit();
  }

  /** Returns a new CompileError referring to the given token. */
  static CompileError error(Token token, String msg) {
    int lineNum;
    int charPositionInLine;
    if (token != null) {
      lineNum = token.getLine();
      charPositionInLine = token.getCharPositionInLine();
    } else {
      // Shouldn't happen, but 0:0 is less useless than a NullPointerException.
      lineNum = 0;
      charPositionInLine = 0;
    }
    return new CompileError(msg, lineNum, charPositionInLine);
  }

  /** Returns a new CompileError referring to the given token. */
  @FormatMethod
  static CompileError error(Token token, String fmt, Object... fmtArgs) {
    return error(token, String.format(fmt, fmtArgs));
  }

  /** Returns the source text of the given node, including any whitespace and comments. */
  static String sourceText(ParserRuleContext ctx) {
    if (ctx.stop == null || ctx.stop.getStopIndex() < ctx.start.getStartIndex()) {
      return "";
    }
    return ctx.start
        .getInputStream()
        .getText(Interval.of(ctx.start.getStartIndex(), ctx.stop.getStopIndex()));
  }

  /**
   * Returns an ErrorContext for the given statement, labeled with its keyword and the rest of its
   * text, e.g. {@code "constraint(x[i] <= i)"}.
   */
  static ErrorContext errorContext(ParserRuleContext statement) {
    String keyword = statement.start.getText();
    String text = sourceText(statement).substring(keyword.length()).trim();
    if (text.endsWith(";")) {
      text = text.substring(0, text.length() - 1).trim();
    }
    return new ErrorContext(
        keyword + "(" + text + ")",
        statement.start.getLine(),
        statement.start.getCharPositionInLine());
  }
}
