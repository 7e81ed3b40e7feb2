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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * An immutable syntax tree for an algebraic expression or a condition, as written in a statement.
 * Syntax trees are built from the parse tree by {@link SyntaxBuilder} and evaluated by a {@link
 * org.modelwright.Model.ExpressionParser}.
 *
 * <p>{@link #toString} returns an equivalent source text.
 */
public abstract class Syntax {

  private Syntax() {}

  /** The immediate subexpressions of this node, in source order. */
  public abstract ImmutableList<Syntax> children();

  /**
   * The precedence of this node when it appears as an operand; higher binds tighter. Used to decide
   * where {@link #toString} needs parentheses.
   */
  int precedence() {
    return Integer.MAX_VALUE;
  }

  /** A numeric literal; the value is an Integer if it was written without a decimal point. */
  public static final class Num extends Syntax {
    public final Number value;

    public Num(Number value) {
      this.value = value;
    }

    @Override
    public ImmutableList<Syntax> children() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  public static final class Str extends Syntax {
    public final String value;

    public Str(String value) {
      this.value = value;
    }

    @Override
    public ImmutableList<Syntax> children() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
  }

  public static final class Bool extends Syntax {
    public final boolean value;

    public Bool(boolean value) {
      this.value = value;
    }

    @Override
    public ImmutableList<Syntax> children() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /** A reference to a parameter, a declared container, or an index. */
  public static final class Name extends Syntax {
    public final String name;

    public Name(String name) {
      this.name = name;
    }

    @Override
    public ImmutableList<Syntax> children() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** {@code name[i1, ..., in]} */
  public static final class Index extends Syntax {
    public final String name;
    public final ImmutableList<Syntax> indices;

    public Index(String name, ImmutableList<Syntax> indices) {
      this.name = name;
      this.indices = indices;
    }

    @Override
    public ImmutableList<Syntax> children() {
      return indices;
    }

    @Override
    public String toString() {
      return name + "[" + Joiner.on(", ").join(indices) + "]";
    }
  }

  /** {@code function(a1, ..., an)} */
  public static final class Call extends Syntax {
    public final String function;
    public final ImmutableList<Syntax> args;

    public Call(String function, ImmutableList<Syntax> args) {
      this.function = function;
      this.args = args;
    }

    @Override
    public ImmutableList<Syntax> children() {
      return args;
    }

    @Override
    public String toString() {
      return function + "(" + Joiner.on(", ").join(args) + ")";
    }
  }

  /** {@code [e1, ..., en]}; a list of lists is a matrix, one list per row. */
  public static final class ListOf extends Syntax {
    public final ImmutableList<Syntax> elements;

    public ListOf(ImmutableList<Syntax> elements) {
      this.elements = elements;
    }

    @Override
    public ImmutableList<Syntax> children() {
      return elements;
    }

    @Override
    public String toString() {
      return "[" + Joiner.on(", ").join(elements) + "]";
    }
  }

  public enum UnaryOp {
    NEG("-"),
    NOT("!");

    public final String symbol;

    UnaryOp(String symbol) {
      this.symbol = symbol;
    }
  }

  public static final class Unary extends Syntax {
    public final UnaryOp op;
    public final Syntax operand;

    public Unary(UnaryOp op, Syntax operand) {
      this.op = op;
      this.operand = operand;
    }

    @Override
    public ImmutableList<Syntax> children() {
      return ImmutableList.of(operand);
    }

    @Override
    int precedence() {
      return 7;
    }

    @Override
    public String toString() {
      return op.symbol + operand(operand, operand.precedence() < precedence());
    }
  }

  public enum BinaryOp {
    OR("||", 1),
    AND("&&", 2),
    LE("<=", 3),
    GE(">=", 3),
    EQ("==", 3),
    NE("!=", 3),
    LT("<", 3),
    GT(">", 3),
    RANGE("..", 4),
    ADD("+", 5),
    SUB("-", 5),
    MUL("*", 6),
    DIV("/", 6),
    POW("^", 8);

    public final String symbol;
    final int precedence;

    BinaryOp(String symbol, int precedence) {
      this.symbol = symbol;
      this.precedence = precedence;
    }
  }

  public static final class Binary extends Syntax {
    public final BinaryOp op;
    public final Syntax left;
    public final Syntax right;

    public Binary(BinaryOp op, Syntax left, Syntax right) {
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public ImmutableList<Syntax> children() {
      return ImmutableList.of(left, right);
    }

    @Override
    int precedence() {
      return op.precedence;
    }

    @Override
    public String toString() {
      // POW is right-associative, everything else groups to the left.
      boolean rightAssoc = (op == BinaryOp.POW);
      int lp = left.precedence();
      int rp = right.precedence();
      String l = operand(left, rightAssoc ? lp <= op.precedence : lp < op.precedence);
      String r = operand(right, rightAssoc ? rp < op.precedence : rp <= op.precedence);
      if (op == BinaryOp.RANGE || op == BinaryOp.POW) {
        return l + op.symbol + r;
      }
      return l + " " + op.symbol + " " + r;
    }
  }

  /** One {@code name in set} clause of a {@link Sum}. */
  public static final class Generator {
    public final String name;
    public final Syntax set;

    public Generator(String name, Syntax set) {
      this.name = name;
      this.set = set;
    }

    @Override
    public String toString() {
      return name + " in " + set;
    }
  }

  /**
   * {@code sum(body for i in S, j in T if condition)}. The generators bind their names in the
   * later generators, the condition and the body.
   */
  public static final class Sum extends Syntax {
    public final Syntax body;
    public final ImmutableList<Generator> generators;
    public final @Nullable Syntax condition;

    public Sum(Syntax body, ImmutableList<Generator> generators, @Nullable Syntax condition) {
      this.body = body;
      this.generators = generators;
      this.condition = condition;
    }

    @Override
    public ImmutableList<Syntax> children() {
      ImmutableList.Builder<Syntax> builder = ImmutableList.builder();
      generators.forEach(g -> builder.add(g.set));
      if (condition != null) {
        builder.add(condition);
      }
      return builder.add(body).build();
    }

    @Override
    public String toString() {
      String result = "sum(" + body + " for " + Joiner.on(", ").join(generators);
      return result + ((condition == null) ? ")" : " if " + condition + ")");
    }
  }

  /**
   * A value that was computed by the compiler rather than written in the source, such as the set
   * {@code LessThan(0.0)} introduced when a comparison is canonicalized.
   */
  public static final class Constant extends Syntax {
    public final Object value;

    public Constant(Object value) {
      this.value = value;
    }

    @Override
    public ImmutableList<Syntax> children() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  private static String operand(Syntax syntax, boolean parenthesize) {
    return parenthesize ? "(" + syntax + ")" : syntax.toString();
  }
}
