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

import org.modelwright.Model;
import org.modelwright.algebra.Algebra;

/**
 * Compiles expression statements. Each element of an indexed expression must be affine, and is
 * stored as an {@link org.modelwright.algebra.AffExpr}; an unindexed expression keeps whatever
 * value it evaluates to. Expressions are declared for later statements but are not registered
 * with the model.
 */
final class ExpressionCompiler {
  private final Symbols symbols;
  private final ErrorContext errorContext;

  ExpressionCompiler(Symbols symbols, ErrorContext errorContext) {
    this.symbols = symbols;
    this.errorContext = errorContext;
  }

  Object compile(ContainerSpec spec, boolean indexed, Syntax body) {
    if (spec.name != null) {
      symbols.checkUndeclared(spec.name, errorContext);
    }
    ContainerPlan plan = ContainerSynthesizer.synthesize(spec, errorContext);
    Model.ParsedExpression parsed = symbols.parser.parse(body, errorContext);
    LoopBuilder.ElementBuilder<Object> elementBuilder =
        (scope, key) -> {
          Object value = parsed.build(scope);
          if (!indexed) {
            return value;
          } else if (!Algebra.isAffine(value)) {
            throw errorContext.specificationError(
                "Collection of expressions with expression must be linear. For quadratic"
                    + " expressions, use your own array.");
          }
          return Algebra.toAffine(value);
        };
    Object result =
        new LoopBuilder(symbols.parser, errorContext)
            .build(plan, elementBuilder)
            .populate(symbols.root);
    if (spec.name != null) {
      symbols.declare(spec.name, result, false, errorContext);
    }
    return result;
  }
}
