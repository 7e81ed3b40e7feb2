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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.modelwright.algebra.AffExpr;
import org.modelwright.algebra.Algebra;
import org.modelwright.algebra.VariableRef;
import org.modelwright.container.DenseArray;
import org.modelwright.container.IndexKey;
import org.modelwright.entity.Constraint;
import org.modelwright.sets.Bounds;
import org.modelwright.sets.MathSet;
import org.modelwright.sets.PsdCone;
import org.modelwright.sets.ScalarSet;
import org.modelwright.sets.VectorSet;

public class BuilderDispatchTest {
  private static final ErrorContext CONTEXT = ErrorContext.of("test");

  private final BuilderDispatch dispatch = BuilderDispatch.standard();
  private final Object owner = new Object();
  private final VariableRef x = new VariableRef(owner, 0, "x");
  private final VariableRef y = new VariableRef(owner, 1, "y");
  private final VariableRef z = new VariableRef(owner, 2, "z");

  private Constraint build(Object function, MathSet set) {
    return dispatch.build(CONTEXT, function, set);
  }

  private CompileError buildError(Object function, MathSet set) {
    return assertThrows(CompileError.BuilderDispatchError.class, () -> build(function, set));
  }

  @Test
  public void singleVariable() {
    Constraint c = build(x, new ScalarSet.GreaterThan(0));
    assertThat(c).isInstanceOf(Constraint.SingleVariable.class);
    assertThat(c.toString()).isEqualTo("x in GreaterThan(0.0)");
  }

  @Test
  public void affineConstantMovesToTheSet() {
    Object f = Algebra.subtract(Algebra.add(x, Algebra.multiply(2, y)), 3);
    Constraint c = build(f, new ScalarSet.LessThan(0));
    assertThat(c).isInstanceOf(Constraint.Affine.class);
    assertThat(c.toString()).isEqualTo("x + 2.0 y in LessThan(3.0)");
    assertThat(((Constraint.Affine) c).function.constant()).isEqualTo(0.0);
  }

  @Test
  public void constantFunction() {
    Constraint c = build(2, new ScalarSet.EqualTo(0));
    assertThat(c).isEqualTo(new Constraint.Affine(AffExpr.constant(0), new ScalarSet.EqualTo(-2)));
  }

  @Test
  public void quadratic() {
    Object f = Algebra.add(Algebra.multiply(x, y), 1);
    Constraint c = build(f, new ScalarSet.LessThan(0));
    assertThat(c).isInstanceOf(Constraint.Quadratic.class);
    assertThat(c.toString()).isEqualTo("x*y in LessThan(-1.0)");
    CompileError e = buildError(f, new Bounds(0, 1));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("In test: Two-sided quadratic constraints not supported.");
  }

  @Test
  public void interval() {
    assertThat(build(x, new Bounds(0, 1)).toString()).isEqualTo("x in Interval(0.0, 1.0)");
    assertThat(build(Algebra.add(x, 1), new Bounds(0, 1.5)).toString())
        .isEqualTo("x in Interval(-1.0, 0.5)");
    CompileError e = buildError(x, new Bounds(0, y));
    assertThat(e).hasMessageThat().isEqualTo("In test: Expected y to be a number.");
    e = buildError(ImmutableList.of(x, y), new Bounds(0, 1));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("In test: Range constraint is not supported for [x, y].");
  }

  @Test
  public void vectors() {
    Constraint c = build(ImmutableList.of(x, y), new VectorSet.Nonnegatives(2));
    assertThat(c).isInstanceOf(Constraint.VectorOfVariables.class);
    assertThat(c.toString()).isEqualTo("[x, y] in Nonnegatives(2)");

    c = build(ImmutableList.of(Algebra.add(x, 1), y), new VectorSet.Zeros(2));
    assertThat(c).isInstanceOf(Constraint.VectorAffine.class);
    assertThat(c.toString()).isEqualTo("[x + 1.0, y] in Zeros(2)");

    CompileError e = buildError(ImmutableList.of(x, y), new VectorSet.SecondOrderCone(3));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "In test: Dimension of SecondOrderCone(3) (3) does not match the number of functions"
                + " (2)");
  }

  @Test
  public void vectorInScalarSet() {
    CompileError e = buildError(ImmutableList.of(x, y), new ScalarSet.LessThan(0));
    assertThat(e).hasMessageThat().contains("Unexpected vector in scalar constraint");
  }

  @Test
  public void noBuilder() {
    CompileError e = buildError("abc", new ScalarSet.LessThan(0));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "In test: No constraint builder for abc in LessThan(0.0) (function type String, set"
                + " type LessThan)");
  }

  @Test
  public void symmetricMatrix() {
    DenseArray<VariableRef> matrix = DenseArray.withLengths(2, 2);
    matrix.put(IndexKey.of(1, 1), x);
    matrix.put(IndexKey.of(1, 2), y);
    matrix.put(IndexKey.of(2, 1), y);
    matrix.put(IndexKey.of(2, 2), z);
    Constraint c = build(matrix, PsdCone.INSTANCE);
    assertThat(c).isInstanceOf(Constraint.VectorOfVariables.class);
    assertThat(c.toString()).isEqualTo("[x, y, z] in PositiveSemidefiniteConeTriangle(2)");
    assertThat(c.set()).isEqualTo(new VectorSet.PositiveSemidefiniteConeTriangle(2));
    assertThat(((VectorSet) c.set()).dimension()).isEqualTo(3);
  }

  @Test
  public void squareMatrix() {
    Constraint c =
        build(
            ImmutableList.of(ImmutableList.of(x, y), ImmutableList.of(z, Algebra.add(x, 1))),
            PsdCone.INSTANCE);
    assertThat(c).isInstanceOf(Constraint.VectorAffine.class);
    // Column-major order.
    assertThat(c.toString()).isEqualTo("[x, z, y, x + 1.0] in PositiveSemidefiniteConeSquare(2)");
  }

  @Test
  public void nonSquareMatrix() {
    CompileError e =
        buildError(
            ImmutableList.of(ImmutableList.of(x, y), ImmutableList.of(z)), PsdCone.INSTANCE);
    assertThat(e).hasMessageThat().contains("Expected a square matrix");
  }

  @Test
  public void emptyFunctions() {
    Constraint c = build(ImmutableList.of(), new VectorSet.Zeros(0));
    assertThat(c).isInstanceOf(Constraint.VectorAffine.class);
    assertThat(c.toString()).isEqualTo("[] in Zeros(0)");

    c = build(DenseArray.withLengths(0, 0), PsdCone.INSTANCE);
    assertThat(c.toString()).isEqualTo("[] in PositiveSemidefiniteConeTriangle(0)");

    CompileError e = buildError(ImmutableList.of(), new VectorSet.Nonnegatives(1));
    assertThat(e).hasMessageThat().contains("Dimension of Nonnegatives(1) (1)");
  }

  @Test
  public void customBuilder() {
    dispatch.register(
        String.class,
        ScalarSet.class,
        (ctx, name, set) -> new Constraint.SingleVariable(name.equals("x") ? x : y, set));
    assertThat(build("y", new ScalarSet.EqualTo(1)).toString()).isEqualTo("y in EqualTo(1.0)");
    // The existing builders are unchanged.
    assertThat(build(x, new ScalarSet.EqualTo(1)).toString()).isEqualTo("x in EqualTo(1.0)");
  }
}
