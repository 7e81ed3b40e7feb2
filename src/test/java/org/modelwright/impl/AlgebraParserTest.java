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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.modelwright.algebra.AffExpr;
import org.modelwright.algebra.VariableRef;
import org.modelwright.compiler.CompileError;
import org.modelwright.compiler.ErrorContext;
import org.modelwright.compiler.Scope;
import org.modelwright.compiler.Syntax;
import org.modelwright.compiler.Syntax.BinaryOp;
import org.modelwright.container.DenseArray;
import org.modelwright.container.IndexKey;

public class AlgebraParserTest {
  private final AlgebraParser parser = new AlgebraParser();
  private final Scope scope = Scope.root();

  private Object evaluate(Syntax expr) {
    return parser.parse(expr, ErrorContext.of("test")).build(scope);
  }

  private static Syntax num(Number n) {
    return new Syntax.Num(n);
  }

  private static Syntax name(String name) {
    return new Syntax.Name(name);
  }

  private static Syntax binary(BinaryOp op, Syntax left, Syntax right) {
    return new Syntax.Binary(op, left, right);
  }

  private static Syntax list(Syntax... elements) {
    return new Syntax.ListOf(ImmutableList.copyOf(elements));
  }

  private static Syntax index(String name, Syntax... indices) {
    return new Syntax.Index(name, ImmutableList.copyOf(indices));
  }

  private static Syntax call(String function, Syntax... args) {
    return new Syntax.Call(function, ImmutableList.copyOf(args));
  }

  @Test
  public void numbers() {
    // 1 + 2 * 3
    assertThat(evaluate(binary(BinaryOp.ADD, num(1), binary(BinaryOp.MUL, num(2), num(3)))))
        .isEqualTo(7);
    assertThat(evaluate(binary(BinaryOp.DIV, num(3), num(2)))).isEqualTo(1.5);
    assertThat(evaluate(binary(BinaryOp.POW, num(2), num(3)))).isEqualTo(8.0);
    assertThat(evaluate(new Syntax.Unary(Syntax.UnaryOp.NEG, num(2.5)))).isEqualTo(-2.5);
  }

  @Test
  public void logic() {
    assertThat(evaluate(new Syntax.Unary(Syntax.UnaryOp.NOT, new Syntax.Bool(true))))
        .isEqualTo(false);
    assertThat(evaluate(binary(BinaryOp.EQ, num(2), num(2.0)))).isEqualTo(true);
    assertThat(evaluate(binary(BinaryOp.LT, new Syntax.Str("a"), new Syntax.Str("b"))))
        .isEqualTo(true);
    assertThat(
            evaluate(
                binary(
                    BinaryOp.AND,
                    binary(BinaryOp.GE, num(3), num(1)),
                    binary(BinaryOp.NE, num(3), num(3)))))
        .isEqualTo(false);
  }

  @Test
  public void ranges() {
    Object range = evaluate(binary(BinaryOp.RANGE, num(1), num(3)));
    assertThat((List<?>) range).containsExactly(1, 2, 3).inOrder();
    assertThat((List<?>) evaluate(binary(BinaryOp.RANGE, num(3), num(1)))).isEmpty();
  }

  @Test
  public void elementwise() {
    assertThat(evaluate(binary(BinaryOp.ADD, list(num(1), num(2)), num(1))))
        .isEqualTo(ImmutableList.of(2, 3));
    assertThat(evaluate(binary(BinaryOp.SUB, list(num(5), num(6)), list(num(1), num(2)))))
        .isEqualTo(ImmutableList.of(4, 4));
    // [[1, 2], [3, 4]] * [1, 1]
    Syntax matrix = list(list(num(1), num(2)), list(num(3), num(4)));
    assertThat(evaluate(binary(BinaryOp.MUL, matrix, list(num(1), num(1)))))
        .isEqualTo(ImmutableList.of(3, 7));
  }

  @Test
  public void affine() {
    VariableRef x = new VariableRef(this, 0, "x");
    scope.bind("x", x);
    Object result = evaluate(binary(BinaryOp.ADD, binary(BinaryOp.MUL, num(2), name("x")), num(1)));
    assertThat(result).isEqualTo(AffExpr.of(x).times(2).plus(AffExpr.constant(1)));
    assertThat(result.toString()).isEqualTo("2.0 x + 1.0");
  }

  @Test
  public void indexing() {
    scope.bind("v", ImmutableList.of("a", "b"));
    DenseArray<String> d = DenseArray.withLengths(2);
    d.put(IndexKey.of(1), "p");
    d.put(IndexKey.of(2), "q");
    scope.bind("d", d);
    assertThat(evaluate(index("v", num(2)))).isEqualTo("b");
    assertThat(evaluate(index("v", num(1.0)))).isEqualTo("a");
    assertThat(evaluate(index("d", num(2.0)))).isEqualTo("q");

    CompileError e = assertThrows(CompileError.class, () -> evaluate(index("v", num(3))));
    assertThat(e).hasMessageThat().isEqualTo("In test: Index 3 is out of bounds for v (length 2)");
    e = assertThrows(CompileError.class, () -> evaluate(index("d", num(3))));
    assertThat(e).hasMessageThat().isEqualTo("In test: Index 3 is not in d");
  }

  @Test
  public void undefinedName() {
    CompileError e =
        assertThrows(CompileError.SpecificationError.class, () -> evaluate(name("z")));
    assertThat(e).hasMessageThat().isEqualTo("In test: Undefined name z");
  }

  @Test
  public void builtins() {
    assertThat(evaluate(call("Interval", num(0), num(1))).toString())
        .isEqualTo("Interval(0.0, 1.0)");
    assertThat(evaluate(call("Zeros", num(2))).toString()).isEqualTo("Zeros(2)");
    assertThat(evaluate(call("length", list(num(1), num(2), num(3))))).isEqualTo(3);

    CompileError e =
        assertThrows(CompileError.SpecificationError.class, () -> evaluate(call("foo", num(1))));
    assertThat(e).hasMessageThat().isEqualTo("In test: Unknown function foo");
    e = assertThrows(CompileError.SpecificationError.class, () -> evaluate(call("LessThan")));
    assertThat(e).hasMessageThat().isEqualTo("In test: LessThan expects 1 arguments, got 0");
  }

  @Test
  public void sums() {
    // sum(i * i for i in 1..4 if i != 2)
    Syntax sum =
        new Syntax.Sum(
            binary(BinaryOp.MUL, name("i"), name("i")),
            ImmutableList.of(new Syntax.Generator("i", binary(BinaryOp.RANGE, num(1), num(4)))),
            binary(BinaryOp.NE, name("i"), num(2)));
    assertThat(evaluate(sum)).isEqualTo(26);
    // The generator's name is not visible afterwards.
    assertThat(scope.isBound("i")).isFalse();

    Syntax empty =
        new Syntax.Sum(
            name("i"),
            ImmutableList.of(new Syntax.Generator("i", list())),
            null);
    assertThat(evaluate(empty)).isEqualTo(0);
  }

  @Test
  public void evaluationErrors() {
    CompileError e =
        assertThrows(
            CompileError.class,
            () -> evaluate(binary(BinaryOp.DIV, num(1), new Syntax.Str("a"))));
    assertThat(e).hasMessageThat().startsWith("In test: Cannot evaluate ");
    assertThat(e).hasMessageThat().contains("Cannot divide by a (String)");

    e =
        assertThrows(
            CompileError.class,
            () -> evaluate(binary(BinaryOp.ADD, num(Integer.MAX_VALUE), num(1))));
    assertThat(e).hasMessageThat().contains("integer overflow");

    e =
        assertThrows(
            CompileError.class,
            () -> evaluate(binary(BinaryOp.ADD, list(num(1)), list(num(1), num(2)))));
    assertThat(e).hasMessageThat().contains("Dimension mismatch: lengths 1 and 2");

    e =
        assertThrows(
            CompileError.class,
            () -> evaluate(binary(BinaryOp.RANGE, num(0), num(Integer.MAX_VALUE))));
    assertThat(e).hasMessageThat().contains("Range 0..2147483647 has too many elements");
  }
}
