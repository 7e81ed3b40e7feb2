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

package org.modelwright;

import org.modelwright.algebra.VariableRef;
import org.modelwright.compiler.ErrorContext;
import org.modelwright.compiler.Scope;
import org.modelwright.compiler.Syntax;
import org.modelwright.entity.Constraint;
import org.modelwright.entity.ConstraintRef;
import org.modelwright.entity.ScalarVariable;

/**
 * The Model class is just a namespace for the interfaces through which the compiler reaches its
 * collaborators: the model being built ({@link Builder}) and the evaluator of algebraic
 * expressions ({@link ExpressionParser}). Reference implementations of both are in {@code
 * org.modelwright.impl}.
 */
public class Model {

  // Just a namespace for the contained interfaces.
  private Model() {}

  /**
   * A model under construction. The compiler adds each variable and constraint as soon as it has
   * been built, and registers the name of each named container once it has been completely
   * populated.
   */
  public interface Builder {

    /**
     * Adds a new scalar variable to the model and returns a handle for it. {@code name} may be
     * empty.
     */
    VariableRef addVariable(ScalarVariable variable, String name);

    /** Adds a constraint to the model and returns a handle for it. {@code name} may be empty. */
    ConstraintRef addConstraint(Constraint constraint, String name);

    /**
     * Associates a name with a container (or single handle) of variables or constraints. Throws an
     * IllegalArgumentException if the name is already in use.
     */
    void registerName(String name, Object handle);

    /** Sets the objective function. */
    void setObjective(ObjectiveSense sense, Object function);
  }

  /** The direction of optimization. */
  public enum ObjectiveSense {
    MIN,
    MAX
  }

  /**
   * Converts the syntax of an algebraic expression into an evaluator for it. Parsing happens once
   * per statement; the result is evaluated once for each index tuple.
   */
  public interface ExpressionParser {

    /**
     * Returns an evaluator for {@code expr}. Errors found while parsing or evaluating should be
     * reported using {@code errorContext}.
     */
    ParsedExpression parse(Syntax expr, ErrorContext errorContext);
  }

  /** An expression that can be evaluated once its free names have been bound. */
  public interface ParsedExpression {

    /**
     * Evaluates the expression, looking up names in {@code scope}. Returns a Number, String,
     * Boolean, algebraic function, set, list or container.
     */
    Object build(Scope scope);
  }
}
