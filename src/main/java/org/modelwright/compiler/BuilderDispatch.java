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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.modelwright.algebra.AffExpr;
import org.modelwright.algebra.Algebra;
import org.modelwright.algebra.QuadExpr;
import org.modelwright.algebra.VariableRef;
import org.modelwright.container.RectangularContainer;
import org.modelwright.entity.Constraint;
import org.modelwright.sets.Bounds;
import org.modelwright.sets.MathSet;
import org.modelwright.sets.PsdCone;
import org.modelwright.sets.ScalarSet;
import org.modelwright.sets.VectorSet;

/**
 * Builds a {@link Constraint} from a function value and a set, choosing the builder by the classes
 * of the two.
 *
 * <p>Builders are registered for a (function class, set class) pair, and {@link #build} uses the
 * most specific registered pair that both values are instances of. Before lookup, lists and
 * rectangular containers are converted to arrays: a {@code VariableRef[]} if every element is a
 * variable, an {@code AffExpr[]} if every element is affine, an {@code Object[][]} (one array per
 * row) for a list of lists, and an {@code Object[]} otherwise. An empty list is an empty matrix
 * if the set is a {@link PsdCone}, and an empty {@code AffExpr[]} otherwise.
 *
 * <p>{@link #standard} returns an instance with builders for the functions and sets in {@code
 * org.modelwright.algebra} and {@code org.modelwright.sets}; other pairs can be added to it
 * without changing the existing ones.
 */
public final class BuilderDispatch {

  /** Builds a constraint from a function and set of the registered classes. */
  @FunctionalInterface
  public interface EntityBuilder<F, S extends MathSet> {
    Constraint build(ErrorContext errorContext, F function, S set);
  }

  private static class Entry {
    final Class<?> functionClass;
    final Class<?> setClass;
    final EntityBuilder<Object, MathSet> builder;

    Entry(Class<?> functionClass, Class<?> setClass, EntityBuilder<Object, MathSet> builder) {
      this.functionClass = functionClass;
      this.setClass = setClass;
      this.builder = builder;
    }

    boolean accepts(Object function, MathSet set) {
      return functionClass.isInstance(function) && setClass.isInstance(set);
    }

    /** True if every (function, set) pair accepted by this Entry is also accepted by other. */
    boolean isAtLeastAsSpecificAs(Entry other) {
      return other.functionClass.isAssignableFrom(functionClass)
          && other.setClass.isAssignableFrom(setClass);
    }
  }

  private final List<Entry> entries = new ArrayList<>();

  /**
   * Registers a builder for the given function and set classes, replacing any builder previously
   * registered for exactly the same classes.
   */
  @CanIgnoreReturnValue
  @SuppressWarnings("unchecked")
  public <F, S extends MathSet> BuilderDispatch register(
      Class<F> functionClass, Class<S> setClass, EntityBuilder<? super F, ? super S> builder) {
    entries.removeIf(e -> e.functionClass == functionClass && e.setClass == setClass);
    entries.add(
        new Entry(
            functionClass,
            setClass,
            (EntityBuilder<Object, MathSet>) (EntityBuilder<?, ?>) builder));
    return this;
  }

  /** Builds a constraint that {@code function} belongs to {@code set}. */
  public Constraint build(ErrorContext errorContext, Object function, MathSet set) {
    Object normalized = normalize(function, set);
    Entry best = null;
    List<Entry> candidates = new ArrayList<>();
    for (Entry entry : entries) {
      if (entry.accepts(normalized, set)) {
        candidates.add(entry);
      }
    }
    for (Entry candidate : candidates) {
      if (candidates.stream().allMatch(candidate::isAtLeastAsSpecificAs)) {
        best = candidate;
        break;
      }
    }
    if (best == null) {
      throw errorContext.dispatchError(
          "%s constraint builder for %s in %s (function type %s, set type %s)",
          candidates.isEmpty() ? "No" : "Ambiguous",
          format(normalized),
          set,
          normalized.getClass().getSimpleName(),
          set.getClass().getSimpleName());
    }
    return best.builder.build(errorContext, normalized, set);
  }

  /**
   * Converts lists and rectangular containers to arrays, as described above; other values are
   * returned unchanged.
   */
  static Object normalize(Object function, MathSet set) {
    if (function instanceof RectangularContainer<?> container) {
      return normalize(container.toNestedList(), set);
    }
    if (!(function instanceof List<?> list)) {
      return function;
    }
    if (list.isEmpty()) {
      return (set instanceof PsdCone) ? new Object[0][] : new AffExpr[0];
    } else if (list.stream().allMatch(x -> x instanceof List)) {
      Object[][] rows = new Object[list.size()][];
      for (int i = 0; i < rows.length; i++) {
        rows[i] = ((List<?>) list.get(i)).toArray();
      }
      return rows;
    } else if (list.stream().allMatch(x -> x instanceof VariableRef)) {
      return list.toArray(new VariableRef[0]);
    } else if (list.stream().allMatch(Algebra::isAffine)) {
      return list.stream().map(Algebra::toAffine).toArray(AffExpr[]::new);
    }
    return list.toArray();
  }

  /** Formats a function value for an error message. */
  static String format(Object value) {
    if (value instanceof Object[] array) {
      return Arrays.deepToString(array);
    }
    return String.valueOf(value);
  }

  /** Returns a BuilderDispatch with the standard builders. */
  public static BuilderDispatch standard() {
    BuilderDispatch dispatch = new BuilderDispatch();
    dispatch
        .register(
            VariableRef.class,
            ScalarSet.class,
            (ctx, v, set) -> new Constraint.SingleVariable(v, set))
        .register(
            VariableRef[].class,
            VectorSet.class,
            (ctx, vars, set) -> {
              checkDimension(ctx, vars, set);
              return new Constraint.VectorOfVariables(Arrays.asList(vars), set);
            })
        .register(
            Number.class,
            ScalarSet.class,
            (ctx, n, set) -> dispatch.build(ctx, Algebra.toAffine(n), set))
        .register(
            AffExpr.class,
            ScalarSet.class,
            (ctx, aff, set) ->
                new Constraint.Affine(aff.withConstant(0), set.minus(aff.constant())))
        .register(
            AffExpr[].class,
            VectorSet.class,
            (ctx, affs, set) -> {
              checkDimension(ctx, affs, set);
              return new Constraint.VectorAffine(Arrays.asList(affs), set);
            })
        .register(
            QuadExpr.class,
            ScalarSet.class,
            (ctx, quad, set) ->
                new Constraint.Quadratic(
                    quad.withAffine(quad.aff().withConstant(0)), set.minus(quad.aff().constant())))
        .register(
            Object[].class,
            ScalarSet.class,
            (ctx, array, set) -> {
              throw ctx.dispatchError(
                  "Unexpected vector in scalar constraint. Did you mean to use the dot comparison"
                      + " operators like .==, .<=, and .>= instead?");
            })
        .register(
            VariableRef.class,
            Bounds.class,
            (ctx, v, bounds) -> new Constraint.SingleVariable(v, interval(ctx, bounds)))
        .register(
            AffExpr.class,
            Bounds.class,
            (ctx, aff, bounds) ->
                new Constraint.Affine(
                    aff.withConstant(0), interval(ctx, bounds).minus(aff.constant())))
        .register(
            Number.class,
            Bounds.class,
            (ctx, n, bounds) -> dispatch.build(ctx, Algebra.toAffine(n), bounds))
        .register(
            QuadExpr.class,
            Bounds.class,
            (ctx, quad, bounds) -> {
              throw ctx.dispatchError("Two-sided quadratic constraints not supported.");
            })
        .register(
            Object.class,
            Bounds.class,
            (ctx, f, bounds) -> {
              interval(ctx, bounds);
              throw ctx.dispatchError("Range constraint is not supported for %s.", format(f));
            })
        .register(Object[][].class, PsdCone.class, BuilderDispatch::psdConstraint);
    return dispatch;
  }

  private static void checkDimension(ErrorContext errorContext, Object[] functions, VectorSet set) {
    if (functions.length != set.dimension()) {
      throw errorContext.dispatchError(
          "Dimension of %s (%s) does not match the number of functions (%s)",
          set,
          set.dimension(),
          functions.length);
    }
  }

  /** Converts Bounds to an Interval, if both bounds are numbers. */
  private static ScalarSet.Interval interval(ErrorContext errorContext, Bounds bounds) {
    if (!(bounds.lower instanceof Number lower)) {
      throw errorContext.dispatchError("Expected %s to be a number.", format(bounds.lower));
    }
    if (!(bounds.upper instanceof Number upper)) {
      throw errorContext.dispatchError("Expected %s to be a number.", format(bounds.upper));
    }
    return new ScalarSet.Interval(lower.doubleValue(), upper.doubleValue());
  }

  /**
   * Constrains a square matrix to be positive semidefinite. A symmetric matrix is represented by
   * its upper triangle, and any other matrix by all of its elements, in column-major order.
   */
  private static Constraint psdConstraint(
      ErrorContext errorContext, Object[][] matrix, PsdCone cone) {
    int n = matrix.length;
    for (Object[] row : matrix) {
      if (row.length != n) {
        throw errorContext.dispatchError(
            "Expected a square matrix in PSDCone constraint, got %s rows of length %s",
            n,
            row.length);
      }
    }
    boolean symmetric = isSymmetric(matrix);
    ImmutableList.Builder<Object> builder = ImmutableList.builder();
    for (int j = 0; j < n; j++) {
      for (int i = 0; i < (symmetric ? j + 1 : n); i++) {
        builder.add(matrix[i][j]);
      }
    }
    ImmutableList<Object> elements = builder.build();
    VectorSet set =
        symmetric
            ? new VectorSet.PositiveSemidefiniteConeTriangle(n)
            : new VectorSet.PositiveSemidefiniteConeSquare(n);
    if (elements.stream().allMatch(x -> x instanceof VariableRef)) {
      return new Constraint.VectorOfVariables(
          elements.stream().map(x -> (VariableRef) x).collect(ImmutableList.toImmutableList()),
          set);
    }
    for (Object element : elements) {
      if (!Algebra.isAffine(element)) {
        throw errorContext.dispatchError(
            "Expected the elements of a PSDCone constraint to be affine, got %s",
            Algebra.describe(element));
      }
    }
    return new Constraint.VectorAffine(
        elements.stream().map(Algebra::toAffine).collect(ImmutableList.toImmutableList()), set);
  }

  private static boolean isSymmetric(Object[][] matrix) {
    for (int i = 0; i < matrix.length; i++) {
      for (int j = i + 1; j < matrix.length; j++) {
        if (!sameElement(matrix[i][j], matrix[j][i])) {
          return false;
        }
      }
    }
    return true;
  }

  private static boolean sameElement(Object x, Object y) {
    if (Algebra.isAffine(x) && Algebra.isAffine(y)) {
      return Algebra.toAffine(x).equals(Algebra.toAffine(y));
    }
    return Objects.equals(x, y);
  }
}
