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

package org.modelwright.algebra;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An immutable affine function {@code a1*x1 + ... + an*xn + c} of scalar variables.
 *
 * <p>Terms are kept in the order in which their variables were first added. Equality is canonical:
 * terms with a zero coefficient are ignored, so {@code 0*x + 1} equals {@code 1}.
 */
public final class AffExpr {
  private static final AffExpr ZERO = new AffExpr(ImmutableMap.of(), 0);

  private final ImmutableMap<VariableRef, Double> terms;
  private final double constant;

  private AffExpr(ImmutableMap<VariableRef, Double> terms, double constant) {
    this.terms = terms;
    this.constant = constant;
  }

  /** Returns the affine function with no terms and the given constant. */
  public static AffExpr constant(double constant) {
    return (constant == 0) ? ZERO : new AffExpr(ImmutableMap.of(), constant);
  }

  /** Returns {@code 1*v + 0}. */
  public static AffExpr of(VariableRef v) {
    return new AffExpr(ImmutableMap.of(v, 1.0), 0);
  }

  /** Returns an affine function with the given terms and constant. */
  public static AffExpr of(Map<VariableRef, Double> terms, double constant) {
    return new AffExpr(ImmutableMap.copyOf(terms), constant);
  }

  /** The coefficient of each variable, in order of first appearance. */
  public ImmutableMap<VariableRef, Double> terms() {
    return terms;
  }

  /** The additive constant. */
  public double constant() {
    return constant;
  }

  /** Returns true if every coefficient is zero. */
  public boolean isConstant() {
    return terms.values().stream().allMatch(c -> c == 0);
  }

  /** Returns a copy of this function with its constant replaced. */
  public AffExpr withConstant(double newConstant) {
    return (newConstant == constant) ? this : new AffExpr(terms, newConstant);
  }

  public AffExpr plus(double c) {
    return withConstant(constant + c);
  }

  public AffExpr plus(AffExpr other) {
    if (other.terms.isEmpty()) {
      return plus(other.constant);
    }
    Map<VariableRef, Double> sum = new LinkedHashMap<>(terms);
    other.terms.forEach((v, c) -> sum.merge(v, c, Double::sum));
    return new AffExpr(ImmutableMap.copyOf(sum), constant + other.constant);
  }

  public AffExpr times(double factor) {
    Map<VariableRef, Double> scaled = new LinkedHashMap<>();
    terms.forEach((v, c) -> scaled.put(v, c * factor));
    return new AffExpr(ImmutableMap.copyOf(scaled), constant * factor);
  }

  public AffExpr negate() {
    return times(-1);
  }

  /** Returns the non-zero terms of this function. */
  private Map<VariableRef, Double> canonicalTerms() {
    Map<VariableRef, Double> result = new LinkedHashMap<>();
    terms.forEach(
        (v, c) -> {
          if (c != 0) {
            result.put(v, c);
          }
        });
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof AffExpr other
        && constant == other.constant
        && canonicalTerms().equals(other.canonicalTerms());
  }

  @Override
  public int hashCode() {
    // Adding 0.0 maps -0.0 to 0.0, which == treats as equal.
    return canonicalTerms().hashCode() * 31 + Double.hashCode(constant + 0.0);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    canonicalTerms().forEach((v, c) -> appendTerm(sb, c, v.toString()));
    if (constant != 0 || sb.length() == 0) {
      appendTerm(sb, constant, null);
    }
    return sb.toString();
  }

  /**
   * Appends {@code coefficient*name} (or just {@code coefficient} if name is null) to {@code sb},
   * preceded by " + " or " - " unless it is the first term.
   */
  static void appendTerm(StringBuilder sb, double coefficient, String name) {
    if (sb.length() != 0) {
      sb.append(coefficient < 0 ? " - " : " + ");
      coefficient = Math.abs(coefficient);
    }
    if (name == null) {
      sb.append(coefficient);
    } else if (coefficient == 1) {
      sb.append(name);
    } else if (coefficient == -1) {
      sb.append('-').append(name);
    } else {
      sb.append(coefficient).append(' ').append(name);
    }
  }
}
