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
import static org.modelwright.compiler.TestSyntax.arith;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.modelwright.sets.PsdCone;
import org.modelwright.sets.ScalarSet;

@RunWith(JUnitParamsRunner.class)
public class RelationalCanonicalizerTest {
  private static final ErrorContext CONTEXT = ErrorContext.of("test");

  private static RelationalForm canonicalize(String lhs, RelOp op, String rhs) {
    return RelationalCanonicalizer.canonicalize(
        new RelationalSpec.Comparison(arith(lhs), op, arith(rhs)), CONTEXT);
  }

  private static RelationalForm canonicalize(
      String left, RelOp leftOp, String middle, RelOp rightOp, String right) {
    return RelationalCanonicalizer.canonicalize(
        new RelationalSpec.Ranged(arith(left), leftOp, arith(middle), rightOp, arith(right)),
        CONTEXT);
  }

  private static Object[] comparisons() {
    return new Object[] {
      new Object[] {RelOp.LE, "x + 1 - 2 in LessThan(0.0)"},
      new Object[] {RelOp.GE, "x + 1 - 2 in GreaterThan(0.0)"},
      new Object[] {RelOp.EQ, "x + 1 - 2 in EqualTo(0.0)"},
      new Object[] {RelOp.DOT_LE, "x + 1 - 2 .in LessThan(0.0)"},
      new Object[] {RelOp.DOT_GE, "x + 1 - 2 .in GreaterThan(0.0)"},
      new Object[] {RelOp.DOT_EQ, "x + 1 - 2 .in EqualTo(0.0)"},
    };
  }

  @Test
  @Parameters(method = "comparisons")
  public void comparison(RelOp op, String expected) {
    RelationalForm form = canonicalize("x + 1", op, "2");
    assertThat(form).isInstanceOf(RelationalForm.SetMembership.class);
    assertThat(form.broadcast).isEqualTo(op.isBroadcast());
    assertThat(form.toString()).isEqualTo(expected);
  }

  @Test
  public void rightHandSideIsParenthesized() {
    RelationalForm.SetMembership form =
        (RelationalForm.SetMembership) canonicalize("x", RelOp.LE, "y + 1");
    assertThat(form.function.toString()).isEqualTo("x - (y + 1)");
    assertThat(((Syntax.Constant) form.set).value).isEqualTo(new ScalarSet.LessThan(0));
  }

  @Test
  public void unrecognizedSense() {
    CompileError e =
        assertThrows(CompileError.class, () -> canonicalize("x", RelOp.NE, "1"));
    assertThat(e).hasMessageThat().isEqualTo("In test: Unrecognized sense !=");
  }

  @Test
  public void ranged() {
    RelationalForm.Ranged form =
        (RelationalForm.Ranged) canonicalize("0", RelOp.LE, "x + y", RelOp.LE, "u");
    assertThat(form.lower.toString()).isEqualTo("0");
    assertThat(form.function.toString()).isEqualTo("x + y");
    assertThat(form.upper.toString()).isEqualTo("u");
    assertThat(form.broadcast).isFalse();

    // ub >= expr >= lb has the same canonical form.
    form = (RelationalForm.Ranged) canonicalize("u", RelOp.GE, "x + y", RelOp.GE, "0");
    assertThat(form.toString()).isEqualTo("0 <= x + y <= u");

    form = (RelationalForm.Ranged) canonicalize("l", RelOp.DOT_LE, "x", RelOp.DOT_LE, "u");
    assertThat(form.broadcast).isTrue();
    assertThat(form.toString()).isEqualTo("l .<= x .<= u");
  }

  @Test
  public void badRanges() {
    CompileError e =
        assertThrows(
            CompileError.class, () -> canonicalize("0", RelOp.LE, "x", RelOp.GE, "1"));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "In test: Only two-sided rows of the form lb <= expr <= ub or ub >= expr >= lb are"
                + " supported.");
    e = assertThrows(CompileError.class, () -> canonicalize("0", RelOp.EQ, "x", RelOp.EQ, "1"));
    assertThat(e).hasMessageThat().contains("Only two-sided rows");
    e =
        assertThrows(
            CompileError.class, () -> canonicalize("0", RelOp.DOT_LE, "x", RelOp.LE, "1"));
    assertThat(e).hasMessageThat().isEqualTo("In test: Signs are inconsistently vectorized");
  }

  @Test
  public void membership() {
    RelationalForm form =
        RelationalCanonicalizer.canonicalize(
            new RelationalSpec.Membership(arith("[x, y]"), arith("Zeros(2)")), CONTEXT);
    assertThat(form.broadcast).isFalse();
    assertThat(form.toString()).isEqualTo("[x, y] in Zeros(2)");
  }

  private static Object[] semidefinite() {
    return new Object[] {
      new Object[] {RelOp.GE, "A - B in PSDCone()"},
      new Object[] {RelOp.SUCC_EQ, "A - B in PSDCone()"},
      new Object[] {RelOp.LE, "B - A in PSDCone()"},
      new Object[] {RelOp.PREC_EQ, "B - A in PSDCone()"},
    };
  }

  @Test
  @Parameters(method = "semidefinite")
  public void semidefinite(RelOp op, String expected) {
    RelationalForm form =
        RelationalCanonicalizer.canonicalizeSemidefinite(
            new RelationalSpec.Comparison(arith("A"), op, arith("B")), CONTEXT);
    assertThat(form.toString()).isEqualTo(expected);
    assertThat(((Syntax.Constant) ((RelationalForm.SetMembership) form).set).value)
        .isSameInstanceAs(PsdCone.INSTANCE);
  }

  @Test
  public void semidefiniteEquality() {
    CompileError e =
        assertThrows(
            CompileError.class,
            () ->
                RelationalCanonicalizer.canonicalizeSemidefinite(
                    new RelationalSpec.Comparison(arith("A"), RelOp.EQ, arith("B")), CONTEXT));
    assertThat(e).hasMessageThat().isEqualTo("In test: Invalid sense == in SDP constraint");
  }
}
