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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.modelwright.Model;
import org.modelwright.algebra.Algebra;
import org.modelwright.container.AssociativeMap;
import org.modelwright.container.AxisArray;
import org.modelwright.container.DenseArray;
import org.modelwright.container.IndexKey;
import org.modelwright.container.IndexedContainer;
import org.modelwright.container.IntRange;

/**
 * Turns a {@link ContainerPlan} into a procedure that allocates the container and builds one
 * element for each index tuple.
 *
 * <p>Indices are iterated outermost first, in the order they were declared; each iteration binds
 * its index name in a new child Scope, so later index sets, the filter and the element builder can
 * refer to it. For each complete index tuple the filter (if any) is evaluated first; tuples that
 * fail it get no element. Associative maps then check that the tuple has not already been seen.
 *
 * <p>{@link #buildSymmetric} instead builds one element for each {@code (i, j)} with {@code i <=
 * j} of a square two-dimensional container, and stores it at both {@code (i, j)} and {@code (j,
 * i)}.
 *
 * <p>Every element must be an instance of the plan's element type; an ElementBuilder that returns
 * anything else is a bug in its caller, and causes an IllegalStateException.
 */
public final class LoopBuilder {

  /** Builds the element for one index tuple, with each index name bound in {@code scope}. */
  @FunctionalInterface
  public interface ElementBuilder<T> {
    T build(Scope scope, IndexKey key);
  }

  /** The result of {@link #build} or {@link #buildSymmetric}. */
  @FunctionalInterface
  public interface PopulationProcedure {
    /**
     * Allocates and populates the container, evaluating index sets in {@code scope}. Returns the
     * container, or the single element if the plan has no indices.
     */
    Object populate(Scope scope);
  }

  private final Model.ExpressionParser parser;
  private final ErrorContext errorContext;

  public LoopBuilder(Model.ExpressionParser parser, ErrorContext errorContext) {
    this.parser = parser;
    this.errorContext = errorContext;
  }

  public <T> PopulationProcedure build(ContainerPlan plan, ElementBuilder<T> elementBuilder) {
    if (plan.isScalar()) {
      return scope -> checkElement(plan, elementBuilder.build(scope, IndexKey.of()));
    }
    return new Population<>(plan, elementBuilder);
  }

  /**
   * Returns a procedure that populates a symmetric container. The plan must have exactly two
   * independent indices, each ranging over {@code 1..N} for the same N, and no filter.
   */
  public <T> PopulationProcedure buildSymmetric(
      ContainerPlan plan, ElementBuilder<T> elementBuilder) {
    if (plan.filter != null) {
      throw errorContext.specificationError(
          "Cannot have conditional indexing for symmetric variables");
    } else if (plan.indexSpecs.size() != 2) {
      throw errorContext.specificationError("Symmetric variables must be 2-dimensional");
    } else if (DependencyAnalyzer.isDependent(plan.indexSpecs, 0)
        || DependencyAnalyzer.isDependent(plan.indexSpecs, 1)) {
      throw errorContext.specificationError(
          "Cannot have index dependencies in symmetric variables");
    }
    for (IndexSpec spec : plan.indexSpecs) {
      if (!ContainerSynthesizer.isOneBasedRange(spec.set)) {
        throw errorContext.specificationError(
            "Index sets for symmetric variables must be ranges of the form 1..N");
      }
    }
    return new SymmetricPopulation<>(plan, elementBuilder);
  }

  /** Implements the standard iteration. */
  private class Population<T> implements PopulationProcedure {
    final ContainerPlan plan;
    final ElementBuilder<T> elementBuilder;
    final ImmutableList<Model.ParsedExpression> sets;
    final Model.@Nullable ParsedExpression filter;

    Population(ContainerPlan plan, ElementBuilder<T> elementBuilder) {
      this.plan = plan;
      this.elementBuilder = elementBuilder;
      ImmutableList.Builder<Model.ParsedExpression> builder = ImmutableList.builder();
      plan.indexSpecs.forEach(spec -> builder.add(parser.parse(spec.set, errorContext)));
      this.sets = builder.build();
      this.filter = (plan.filter == null) ? null : parser.parse(plan.filter, errorContext);
    }

    @Override
    public Object populate(Scope scope) {
      // Rectangular containers need all of their axes before anything is stored; associative
      // maps evaluate each index set inside the loops, where the earlier indices are bound.
      List<List<?>> axes = null;
      if (plan.kind != ContainerKind.ASSOCIATIVE_MAP) {
        ImmutableList.Builder<List<?>> builder = ImmutableList.builder();
        for (int i = 0; i < sets.size(); i++) {
          builder.add(setValues(sets.get(i).build(scope), plan.indexSpecs.get(i)));
        }
        axes = builder.build();
      }
      IndexedContainer<T> container = allocate(plan, axes);
      loop(container, axes, scope, new Object[sets.size()], 0);
      return container;
    }

    private void loop(
        IndexedContainer<T> container,
        @Nullable List<List<?>> axes,
        Scope scope,
        Object[] components,
        int level) {
      if (level == components.length) {
        if (filter != null && !evaluateCondition(filter, plan.filter, scope)) {
          return;
        }
        IndexKey key = IndexKey.of(components);
        if (plan.needsDuplicateCheck && container.containsKey(key)) {
          throw errorContext.duplicateKey(key);
        }
        container.put(key, checkElement(plan, elementBuilder.build(scope, key)));
        return;
      }
      IndexSpec spec = plan.indexSpecs.get(level);
      List<?> values =
          (axes != null) ? axes.get(level) : setValues(sets.get(level).build(scope), spec);
      for (Object value : values) {
        Scope child = scope.child();
        child.bind(spec.name, value);
        components[level] = value;
        loop(container, axes, child, components, level + 1);
      }
    }
  }

  /** Implements the iteration used by {@link #buildSymmetric}. */
  private class SymmetricPopulation<T> implements PopulationProcedure {
    final ContainerPlan plan;
    final ElementBuilder<T> elementBuilder;
    final Model.ParsedExpression rows;
    final Model.ParsedExpression columns;

    SymmetricPopulation(ContainerPlan plan, ElementBuilder<T> elementBuilder) {
      this.plan = plan;
      this.elementBuilder = elementBuilder;
      this.rows = parser.parse(plan.indexSpecs.get(0).set, errorContext);
      this.columns = parser.parse(plan.indexSpecs.get(1).set, errorContext);
    }

    @Override
    public Object populate(Scope scope) {
      IndexSpec rowSpec = plan.indexSpecs.get(0);
      IndexSpec columnSpec = plan.indexSpecs.get(1);
      List<?> rowValues = setValues(rows.build(scope), rowSpec);
      List<?> columnValues = setValues(columns.build(scope), columnSpec);
      if (rowValues.size() != columnValues.size()) {
        throw errorContext.specificationError(
            "Cannot construct symmetric variables with nonsquare dimensions");
      }
      IndexedContainer<T> container = allocate(plan, ImmutableList.of(rowValues, columnValues));
      for (Object i : rowValues) {
        for (Object j : columnValues) {
          if ((Integer) i > (Integer) j) {
            continue;
          }
          Scope child = scope.child();
          child.bind(rowSpec.name, i);
          child.bind(columnSpec.name, j);
          T element = checkElement(plan, elementBuilder.build(child, IndexKey.of(i, j)));
          container.put(IndexKey.of(i, j), element);
          container.put(IndexKey.of(j, i), element);
        }
      }
      return container;
    }
  }

  /**
   * Returns an empty container of the planned kind. Rectangular containers are given their axes,
   * which are checked here: each axis of a dense array must be {@code 1..N}, and an axis array may
   * not repeat a value on any axis.
   */
  private <T> IndexedContainer<T> allocate(ContainerPlan plan, @Nullable List<List<?>> axes) {
    if (plan.kind == ContainerKind.ASSOCIATIVE_MAP) {
      return new AssociativeMap<>(plan.indexSpecs.size());
    }
    assert axes != null;
    if (plan.kind == ContainerKind.DENSE_ARRAY) {
      int[] lengths = new int[axes.size()];
      for (int i = 0; i < lengths.length; i++) {
        List<?> axis = axes.get(i);
        if (!axis.equals(new IntRange(1, axis.size()))) {
          throw errorContext.specificationError(
              "Index set %s is not of the form 1..N, as required by an Array container",
              plan.indexSpecs.get(i).set);
        }
        lengths[i] = axis.size();
      }
      return DenseArray.withLengths(lengths);
    }
    for (List<?> axis : axes) {
      Set<Object> seen = new HashSet<>();
      for (Object value : axis) {
        if (!seen.add(IndexKey.normalize(value))) {
          throw errorContext.duplicateKey(IndexKey.of(value));
        }
      }
    }
    return new AxisArray<>(axes);
  }

  private static <T> T checkElement(ContainerPlan plan, T element) {
    if (!plan.elementType.isInstance(element)) {
      throw new IllegalStateException(
          String.format(
              "Expected an element of type %s, got %s",
              plan.elementType.getSimpleName(),
              Algebra.describe(element)));
    }
    return element;
  }

  /** Returns the values of an evaluated index set. */
  private List<?> setValues(Object set, IndexSpec spec) {
    if (set instanceof List<?> list) {
      return list;
    } else if (set instanceof IndexedContainer<?> container) {
      return container.values();
    } else if (set instanceof Iterable<?> iterable) {
      return ImmutableList.copyOf(iterable);
    }
    throw errorContext.specificationError(
        "Expected index set %s to be a list or range, got %s", spec.set, Algebra.describe(set));
  }

  /** Evaluates a filter, which must produce a Boolean. */
  private boolean evaluateCondition(Model.ParsedExpression condition, Syntax syntax, Scope scope) {
    Object value = condition.build(scope);
    if (value instanceof Boolean b) {
      return b;
    }
    throw errorContext.specificationError(
        "Condition %s must evaluate to true or false, got %s", syntax, Algebra.describe(value));
  }
}
