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

import com.google.errorprone.annotations.FormatMethod;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.modelwright.compiler.ModelSpecParser.ParenArithContext;

/**
 * Base class for the ModelSpec visitors. Remembers the node being visited so that {@link #error}
 * can report its position, and visits through parentheses.
 */
abstract class VisitorBase<T> extends ModelSpecBaseVisitor<T> {

  private ParseTree currentNode;

  @Override
  protected final T defaultResult() {
    // Subclasses override a visit method for every node they can be given.
    throw new AssertionError();
  }

  @Override
  public final T visit(ParseTree tree) {
    ParseTree prevNode = currentNode;
    currentNode = tree;
    try {
      return super.visit(tree);
    } finally {
      currentNode = prevNode;
    }
  }

  @Override
  public final T visitParenArith(ParenArithContext ctx) {
    return visit(ctx.arith());
  }

  /** Returns a {@link CompileError} at the start of the node being visited. */
  @FormatMethod
  CompileError error(String fmt, Object... fmtArgs) {
    return Compiler.error(((ParserRuleContext) currentNode).start, fmt, fmtArgs);
  }
}
