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

package org.modelwright.impl;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;
import org.modelwright.Model;
import org.modelwright.algebra.Algebra;
import org.modelwright.compiler.CompileError;
import org.modelwright.compiler.ErrorContext;
import org.modelwright.compiler.Scope;
import org.modelwright.compiler.Syntax;
import org.modelwright.container.IndexKey;
import org.modelwright.container.IndexedContainer;
import org.modelwright.container.IntRange;
import org.modelwright.container.RectangularContainer;
import org.modelwright.sets.PsdCone;
import org.modelwright.sets.ScalarSet;
import org.modelwright.sets.VectorSet;

/**
 * An ExpressionParser for the expressions of the statement language, using the arithmetic in
 * {@link Algebra}.
 *
 * <p>Values are Numbers, Strings, Booleans, the algebraic types of {@code org.modelwright.algebra},
 * sets, Lists (including {@link IntRange}s) and {@link IndexedContainer}s. Arithmetic on Lists and
 * rectangular containers is applied elementwise; a scalar operand is combined with every element,
 * and a list of rows times a list is a matrix-vector product. Lists are indexed from 1.
 *
 * <p>The following functions are defined: {@code LessThan(u)}, {@code GreaterThan(l)}, {@code
 * EqualTo(v)}, {@code Interval(l, u)}, {@code Zeros(n)}, {@code Nonnegatives(n)}, {@code
 * Nonpositives(n)}, {@code SecondOrderCone(n)}, {@code PSDCone()} and {@code length(x)}.
 */
public class AlgebraParser implements Model.ExpressionParser {

  /** A builtin function; args have already been evaluated. */
  @FunctionalInterface
  private interface Builtin {
    Object apply(List<Object> args);
  }

  private static final ImmutableMap<String, Integer> ARITIES =
      ImmutableMap.<String, Integer>builder()
          .put("LessThan", 1)
          .put("GreaterThan", 1)
          .put("EqualTo", 1)
          .put("Interval", 2)
          .put("Zeros", 1)
          .put("Nonnegatives", 1)
          .put("Nonpositives", 1)
          .put("SecondOrderCone", 1)
          .put("PSDCone", 0)
          .put("length", 1)
          .buildOrThrow();

  private static final ImmutableMap<String, Builtin> BUILTINS =
      ImmutableMap.<String, Builtin>builder()
          .put("LessThan", args -> new ScalarSet.LessThan(toDouble(args.get(0))))
          .put("GreaterThan", args -> new ScalarSet.GreaterThan(toDouble(args.get(0))))
          .put("EqualTo", args -> new ScalarSet.EqualTo(toDouble(args.get(0))))
          .put(
              "Interval",
              args -> new ScalarSet.Interval(toDouble(args.get(0)), toDouble(args.get(1))))
          .put("Zeros", args -> new VectorSet.Zeros(toInt(args.get(0))))
          .put("Nonnegatives", args -> new VectorSet.Nonnegatives(toInt(args.get(0))))
          .put("Nonpositives", args -> new VectorSet.Nonpositives(toInt(args.get(0))))
          .put("SecondOrderCone", args -> new VectorSet.SecondOrderCone(toInt(args.get(0))))
          .put("PSDCone", args -> PsdCone.INSTANCE)
          .put("length", args -> length(args.get(0)))
          .buildOrThrow();

  @Override
  public Model.ParsedExpression parse(Syntax expr, ErrorContext errorContext) {
    Model.ParsedExpression result = new Translator(errorContext).translate(expr);
    return scope -> {
      try {
        return result.build(scope);
      } catch (IllegalArgumentException | ArithmeticException e) {
        throw errorContext.error("Cannot evaluate %s: %s", expr, e.getMessage());
      }
    };
  }

  /** Translates the Syntax of one expression. */
  private static class Translator {
    final ErrorContext errorContext;

    Translator(ErrorContext errorContext) {
      this.errorContext = errorContext;
    }

    Model.ParsedExpression translate(Syntax expr) {
      if (expr instanceof Syntax.Num num) {
        Object value = num.value;
        return scope -> value;
      } else if (expr instanceof Syntax.Str str) {
        return scope -> str.value;
      } else if (expr instanceof Syntax.Bool bool) {
        Object value = bool.value;
        return scope -> value;
      } else if (expr instanceof Syntax.Constant constant) {
        return scope -> constant.value;
      } else if (expr instanceof Syntax.Name name) {
        return scope -> lookup(scope, name.name);
      } else if (expr instanceof Syntax.Index index) {
        return translateIndex(index);
      } else if (expr instanceof Syntax.Call call) {
        return translateCall(call);
      } else if (expr instanceof Syntax.ListOf list) {
        ImmutableList<Model.ParsedExpression> elements = translateAll(list.elements);
        return scope -> evaluateAll(elements, scope);
      } else if (expr instanceof Syntax.Unary unary) {
        Model.ParsedExpression operand = translate(unary.operand);
        if (unary.op == Syntax.UnaryOp.NOT) {
          return scope -> !toBoolean(operand.build(scope), unary.operand);
        }
        return scope -> map(operand.build(scope), Algebra::negate);
      } else if (expr instanceof Syntax.Binary binary) {
        return translateBinary(binary);
      } else if (expr instanceof Syntax.Sum sum) {
        return translateSum(sum);
      }
      throw new AssertionError(expr);
    }

    ImmutableList<Model.ParsedExpression> translateAll(List<Syntax> exprs) {
      ImmutableList.Builder<Model.ParsedExpression> builder = ImmutableList.builder();
      exprs.forEach(expr -> builder.add(translate(expr)));
      return builder.build();
    }

    Object lookup(Scope scope, String name) {
      Object value = scope.lookup(name);
      if (value == null) {
        throw errorContext.specificationError("Undefined name %s", name);
      }
      return value;
    }

    Model.ParsedExpression translateIndex(Syntax.Index index) {
      ImmutableList<Model.ParsedExpression> indices = translateAll(index.indices);
      return scope -> {
        Object base = lookup(scope, index.name);
        ImmutableList<Object> key = evaluateAll(indices, scope);
        if (base instanceof IndexedContainer<?> container) {
          IndexKey indexKey = IndexKey.of(key);
          Object result = container.get(indexKey);
          if (result == null) {
            throw errorContext.error("Index %s is not in %s", indexKey, index.name);
          }
          return result;
        }
        Object result = base;
        for (Object k : key) {
          if (!(result instanceof List<?> list)) {
            throw errorContext.error("Cannot index %s", Algebra.describe(result));
          }
          Object position = IndexKey.normalize(k);
          if (!(position instanceof Integer i) || i < 1 || i > list.size()) {
            throw errorContext.error(
                "Index %s is out of bounds for %s (length %s)", k, index.name, list.size());
          }
          result = list.get(i - 1);
        }
        return result;
      };
    }

    Model.ParsedExpression translateCall(Syntax.Call call) {
      Builtin builtin = BUILTINS.get(call.function);
      if (builtin == null) {
        throw errorContext.specificationError("Unknown function %s", call.function);
      }
      int arity = ARITIES.get(call.function);
      if (call.args.size() != arity) {
        throw errorContext.specificationError(
            "%s expects %s arguments, got %s", call.function, arity, call.args.size());
      }
      ImmutableList<Model.ParsedExpression> args = translateAll(call.args);
      return scope -> builtin.apply(evaluateAll(args, scope));
    }

    Model.ParsedExpression translateBinary(Syntax.Binary binary) {
      Model.ParsedExpression left = translate(binary.left);
      Model.ParsedExpression right = translate(binary.right);
      return switch (binary.op) {
        case OR -> scope ->
            toBoolean(left.build(scope), binary.left)
                || toBoolean(right.build(scope), binary.right);
        case AND -> scope ->
            toBoolean(left.build(scope), binary.left)
                && toBoolean(right.build(scope), binary.right);
        case EQ -> scope -> areEqual(left.build(scope), right.build(scope));
        case NE -> scope -> !areEqual(left.build(scope), right.build(scope));
        case LE -> scope -> compare(left.build(scope), right.build(scope)) <= 0;
        case GE -> scope -> compare(left.build(scope), right.build(scope)) >= 0;
        case LT -> scope -> compare(left.build(scope), right.build(scope)) < 0;
        case GT -> scope -> compare(left.build(scope), right.build(scope)) > 0;
        case RANGE -> scope ->
            new IntRange(toInt(left.build(scope)), toInt(right.build(scope)));
        case ADD -> scope -> elementwise(left.build(scope), right.build(scope), Algebra::add);
        case SUB -> scope ->
            elementwise(left.build(scope), right.build(scope), Algebra::subtract);
        case MUL -> scope -> multiply(left.build(scope), right.build(scope));
        case DIV -> scope -> {
          Object divisor = right.build(scope);
          return map(left.build(scope), x -> Algebra.divide(x, divisor));
        };
        case POW -> scope -> Algebra.power(left.build(scope), right.build(scope));
      };
    }

    Model.ParsedExpression translateSum(Syntax.Sum sum) {
      Model.ParsedExpression body = translate(sum.body);
      ImmutableList<Model.ParsedExpression> sets =
          sum.generators.stream()
              .map(g -> translate(g.set))
              .collect(ImmutableList.toImmutableList());
      Model.ParsedExpression condition =
          (sum.condition == null) ? null : translate(sum.condition);
      return scope -> {
        Object[] total = {0};
        accumulate(sum, body, sets, condition, scope, 0, total);
        return total[0];
      };
    }

    private void accumulate(
        Syntax.Sum sum,
        Model.ParsedExpression body,
        List<Model.ParsedExpression> sets,
        Model.@Nullable ParsedExpression condition,
        Scope scope,
        int level,
        Object[] total) {
      if (level == sets.size()) {
        if (condition == null || toBoolean(condition.build(scope), sum.condition)) {
          total[0] = Algebra.add(total[0], body.build(scope));
        }
        return;
      }
      Syntax.Generator generator = sum.generators.get(level);
      Object set = sets.get(level).build(scope);
      for (Object value : iterate(set, generator.set)) {
        Scope child = scope.child();
        child.bind(generator.name, value);
        accumulate(sum, body, sets, condition, child, level + 1, total);
      }
    }

    List<?> iterate(Object set, Syntax syntax) {
      if (set instanceof List<?> list) {
        return list;
      } else if (set instanceof IndexedContainer<?> container) {
        return container.values();
      }
      throw errorContext.error(
          "Expected %s to be a list or range, got %s", syntax, Algebra.describe(set));
    }

    boolean toBoolean(Object value, @Nullable Syntax syntax) {
      if (value instanceof Boolean b) {
        return b;
      }
      throw errorContext.error(
          "Expected %s to be true or false, got %s", syntax, Algebra.describe(value));
    }
  }

  private static ImmutableList<Object> evaluateAll(
      List<Model.ParsedExpression> exprs, Scope scope) {
    ImmutableList.Builder<Object> builder = ImmutableList.builder();
    exprs.forEach(expr -> builder.add(expr.build(scope)));
    return builder.build();
  }

  /**
   * Returns the elements of a List, or the rows of a rectangular container; returns null for any
   * other value.
   */
  private static @Nullable List<?> elements(Object value) {
    if (value instanceof List<?> list) {
      return list;
    } else if (value instanceof RectangularContainer<?> container) {
      return container.toNestedList();
    }
    return null;
  }

  private static Object map(Object x, UnaryOperator<Object> op) {
    List<?> xs = elements(x);
    if (xs == null) {
      return op.apply(x);
    }
    return xs.stream().map(e -> map(e, op)).collect(ImmutableList.toImmutableList());
  }

  /**
   * Applies {@code op} to corresponding elements of {@code x} and {@code y}, which must have the
   * same length if both are lists.
   */
  private static Object elementwise(Object x, Object y, BinaryOperator<Object> op) {
    List<?> xs = elements(x);
    List<?> ys = elements(y);
    if (xs == null && ys == null) {
      return op.apply(x, y);
    } else if (xs != null && ys != null && xs.size() != ys.size()) {
      throw new IllegalArgumentException(
          String.format("Dimension mismatch: lengths %s and %s", xs.size(), ys.size()));
    }
    int n = (xs != null) ? xs.size() : ys.size();
    ImmutableList.Builder<Object> builder = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      builder.add(
          elementwise((xs == null) ? x : xs.get(i), (ys == null) ? y : ys.get(i), op));
    }
    return builder.build();
  }

  private static Object multiply(Object x, Object y) {
    List<?> xs = elements(x);
    List<?> ys = elements(y);
    if (xs != null && ys != null) {
      if (xs.isEmpty() || elements(xs.get(0)) == null) {
        throw new IllegalArgumentException(
            String.format(
                "Cannot multiply %s by %s; use a matrix times a vector",
                Algebra.describe(x), Algebra.describe(y)));
      }
      ImmutableList.Builder<Object> builder = ImmutableList.builder();
      for (Object row : xs) {
        List<?> r = elements(row);
        if (r == null || r.size() != ys.size()) {
          throw new IllegalArgumentException(
              String.format("Dimension mismatch: cannot multiply %s by %s", row, y));
        }
        Object dot = 0;
        for (int i = 0; i < r.size(); i++) {
          dot = Algebra.add(dot, Algebra.multiply(r.get(i), ys.get(i)));
        }
        builder.add(dot);
      }
      return builder.build();
    }
    return elementwise(x, y, Algebra::multiply);
  }

  private static boolean areEqual(Object x, Object y) {
    if (x instanceof Number nx && y instanceof Number ny) {
      return nx.doubleValue() == ny.doubleValue();
    }
    return Objects.equals(x, y);
  }

  private static int compare(Object x, Object y) {
    if (x instanceof Number nx && y instanceof Number ny) {
      return Double.compare(nx.doubleValue(), ny.doubleValue());
    } else if (x instanceof String sx && y instanceof String sy) {
      return sx.compareTo(sy);
    }
    throw new IllegalArgumentException(
        String.format("Cannot compare %s and %s", Algebra.describe(x), Algebra.describe(y)));
  }

  private static double toDouble(Object x) {
    if (x instanceof Number n) {
      return n.doubleValue();
    }
    throw new IllegalArgumentException("Expected a number, got " + Algebra.describe(x));
  }

  private static int toInt(Object x) {
    Object key = IndexKey.normalize(x);
    if (key instanceof Integer i) {
      return i;
    }
    throw new IllegalArgumentException("Expected an integer, got " + Algebra.describe(x));
  }

  private static int length(Object x) {
    if (x instanceof List<?> list) {
      return list.size();
    } else if (x instanceof IndexedContainer<?> container) {
      return container.size();
    }
    throw new IllegalArgumentException("Cannot take the length of " + Algebra.describe(x));
  }
}
