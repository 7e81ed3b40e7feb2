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
import java.util.List;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.modelwright.Model;
import org.modelwright.algebra.Algebra;
import org.modelwright.container.RectangularContainer;
import org.modelwright.entity.Constraint;
import org.modelwright.entity.ConstraintRef;
import org.modelwright.sets.Bounds;
import org.modelwright.sets.MathSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles constraint and sdconstraint statements.
 *
 * <p>For each index tuple the canonical relation is evaluated, the function and set are passed to
 * the {@link BuilderDispatch}, and the resulting constraint is added to the model with the name
 * {@code c[i,j]} (or just {@code c} if the constraint is not indexed). A broadcast relation
 * produces a nested list of unnamed constraints, one for each element of the function.
 */
final class ConstraintCompiler {
  private static final Logger logger = LoggerFactory.getLogger(ConstraintCompiler.class);

  private final Symbols symbols;
  private final ErrorContext errorContext;

  ConstraintCompiler(Symbols symbols, ErrorContext errorContext) {
    this.symbols = symbols;
    this.errorContext = errorContext;
  }

  /**
   * Returns the type of the elements built for {@code form}: a ConstraintRef, or for a broadcast
   * relation either a ConstraintRef or a nested list of them.
   */
  static Class<?> elementType(RelationalForm form) {
    return form.broadcast ? Object.class : ConstraintRef.class;
  }

  /**
   * Adds the constraints and returns the container of their handles (or the single handle, if
   * {@code spec} has no indices). If the container is named it is declared and registered with the
   * model.
   */
  Object compile(ContainerSpec spec, RelationalForm form) {
    if (spec.name != null) {
      symbols.checkUndeclared(spec.name, errorContext);
    }
    ContainerPlan plan = ContainerSynthesizer.synthesize(spec, errorContext);
    LoopBuilder.ElementBuilder<Object> elementBuilder =
        elementBuilder(form, (spec.name == null) ? "" : spec.name);
    Object result =
        new LoopBuilder(symbols.parser, errorContext)
            .build(plan, elementBuilder)
            .populate(symbols.root);
    logger.debug("{} built {}", errorContext, form);
    if (spec.name != null) {
      symbols.declare(spec.name, result, true, errorContext);
    }
    return result;
  }

  private LoopBuilder.ElementBuilder<Object> elementBuilder(RelationalForm form, String baseName) {
    if (form instanceof RelationalForm.SetMembership membership) {
      Model.ParsedExpression function = parse(membership.function);
      Model.ParsedExpression set = parse(membership.set);
      return (scope, key) -> {
        Object f = function.build(scope);
        MathSet s = asSet(set.build(scope), membership.set);
        if (form.broadcast) {
          return broadcast(f, element -> add(element, s, ""));
        }
        return add(f, s, key.elementName(baseName));
      };
    }
    RelationalForm.Ranged ranged = (RelationalForm.Ranged) form;
    Model.ParsedExpression lower = parse(ranged.lower);
    Model.ParsedExpression function = parse(ranged.function);
    Model.ParsedExpression upper = parse(ranged.upper);
    return (scope, key) -> {
      Object lb = lower.build(scope);
      Object f = function.build(scope);
      Object ub = upper.build(scope);
      if (form.broadcast) {
        return broadcastRanged(lb, f, ub);
      }
      return add(f, new Bounds(lb, ub), key.elementName(baseName));
    };
  }

  private Model.ParsedExpression parse(Syntax syntax) {
    return symbols.parser.parse(syntax, errorContext);
  }

  private MathSet asSet(Object value, Syntax syntax) {
    if (value instanceof MathSet set) {
      return set;
    }
    throw errorContext.specificationError(
        "Expected %s to be a set, got %s", syntax, Algebra.describe(value));
  }

  private ConstraintRef add(Object function, MathSet set, String name) {
    Constraint constraint = symbols.dispatch.build(errorContext, function, set);
    return symbols.model.addConstraint(constraint, name);
  }

  /**
   * If {@code value} is a list or rectangular container, returns its elements (rows, for a
   * container with more than one dimension); otherwise returns null.
   */
  private static @Nullable List<?> elements(Object value) {
    if (value instanceof List<?> list) {
      return list;
    } else if (value instanceof RectangularContainer<?> container) {
      return container.toNestedList();
    }
    return null;
  }

  /** Applies {@code builder} to each scalar element of {@code function}, preserving its shape. */
  private Object broadcast(Object function, Function<Object, Object> builder) {
    List<?> elements = elements(function);
    if (elements == null) {
      return builder.apply(function);
    }
    ImmutableList.Builder<Object> result = ImmutableList.builder();
    elements.forEach(element -> result.add(broadcast(element, builder)));
    return result.build();
  }

  /**
   * Adds an interval constraint for each scalar element of {@code function}. Each bound is either a
   * single value used for every element, or has the same shape as {@code function}.
   */
  private Object broadcastRanged(Object lb, Object function, Object ub) {
    List<?> elements = elements(function);
    List<?> lbs = elements(lb);
    List<?> ubs = elements(ub);
    if (elements == null) {
      if (lbs != null || ubs != null) {
        throw errorContext.specificationError(
            "Dimension mismatch in broadcast: bounds %s and %s do not match %s",
            lb, ub, Algebra.describe(function));
      }
      return add(function, new Bounds(lb, ub), "");
    }
    checkBroadcastLength(elements, lbs, lb);
    checkBroadcastLength(elements, ubs, ub);
    ImmutableList.Builder<Object> result = ImmutableList.builder();
    for (int i = 0; i < elements.size(); i++) {
      result.add(
          broadcastRanged(
              (lbs == null) ? lb : lbs.get(i),
              elements.get(i),
              (ubs == null) ? ub : ubs.get(i)));
    }
    return result.build();
  }

  private void checkBroadcastLength(List<?> elements, @Nullable List<?> bounds, Object bound) {
    if (bounds != null && bounds.size() != elements.size()) {
      throw errorContext.specificationError(
          "Dimension mismatch in broadcast: %s elements and %s bounds (%s)",
          elements.size(), bounds.size(), bound);
    }
  }
}
