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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.modelwright.Model;
import org.modelwright.compiler.ModelSpecParser.StatementContext;
import org.modelwright.compiler.ModelSpecParser.UnitContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The state shared by the statements of a single compilation: the model being built, the names
 * declared so far, and the Scope in which each statement is evaluated.
 */
final class Symbols {
  private static final Logger logger = LoggerFactory.getLogger(Symbols.class);

  final Model.Builder model;
  final Model.ExpressionParser parser;
  final BuilderDispatch dispatch;

  /** Binds each parameter and each declared name. */
  final Scope root = Scope.root();

  private final Map<String, Object> named = new LinkedHashMap<>();

  private Symbols(Model.Builder model, Model.ExpressionParser parser, BuilderDispatch dispatch) {
    this.model = model;
    this.parser = parser;
    this.dispatch = dispatch;
  }

  static Compilation compile(
      Model.Builder model,
      Model.ExpressionParser parser,
      BuilderDispatch dispatch,
      Object source,
      UnitContext unit,
      ImmutableMap<String, Object> parameters) {
    Symbols symbols = new Symbols(model, parser, dispatch);
    parameters.forEach(symbols.root::bind);
    logger.debug("Compiling {} statements from {}", unit.statement().size(), source);
    StatementCompiler compiler = new StatementCompiler(symbols);
    ImmutableList.Builder<Object> results = ImmutableList.builder();
    for (StatementContext statement : unit.statement()) {
      results.add(compiler.visit(statement));
    }
    return new Compilation(source, ImmutableMap.copyOf(symbols.named), results.build());
  }

  /** Throws a SpecificationError if {@code name} has already been declared or is a parameter. */
  void checkUndeclared(String name, ErrorContext errorContext) {
    if (root.isBound(name)) {
      throw errorContext.specificationError(
          "An object of name %s is already attached to this model.", name);
    }
  }

  /**
   * Declares a name for the remaining statements. If {@code register} is true the name is also
   * registered with the model.
   */
  void declare(String name, Object value, boolean register, ErrorContext errorContext) {
    checkUndeclared(name, errorContext);
    if (register) {
      model.registerName(name, value);
    }
    root.bind(name, value);
    named.put(name, value);
    logger.debug("{} declared {}", errorContext, name);
  }
}
