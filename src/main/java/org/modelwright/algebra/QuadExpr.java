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
 * An immutable quadratic function: a sum of {@code q*xi*xj} terms plus an affine part. The
 * constant of a QuadExpr is the constant of its affine part.
 */
public final class QuadExpr {

  /** An unordered pair of variables; {@code first.index <= second.index}. */
  public static final class VariablePair {
    public final VariableRef first;
    public final VariableRef second;

    private VariablePair(VariableRef first, VariableRef second) {
      this.first = first;
      this.second = second;
    }

    public static VariablePair of(VariableRef x, VariableRef y) {
      return (x.index <= y.index) ? new VariablePair(x, y) : new VariablePair(y, x);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof VariablePair other && first == other.first && second == other.second;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(first) * 31 + System.identityHashCode(second);
    }

    @Override
    public String toString() {
      return (first == second) ? first + "^2" : first + "*" + second;
    }
  }

  private final ImmutableMap<VariablePair, Double> quadTerms;
  private final AffExpr aff;

  private QuadExpr(ImmutableMap<VariablePair, Double> quadTerms, AffExpr aff) {
    this.quadTerms = quadTerms;
    this.aff = aff;
  }

  /** Returns a QuadExpr with no quadratic terms. */
  public static QuadExpr of(AffExpr aff) {
    return new QuadExpr(ImmutableMap.of(), aff);
  }

  /** Returns the product of two affine functions. */
  public static QuadExpr product(AffExpr x, AffExpr y) {
    Map<VariablePair, Double> quad = new LinkedHashMap<>();
    x.terms()
        .forEach(
            (vx, cx) ->
                y.terms()
                    .forEach(
                        (vy, cy) -> quad.merge(VariablePair.of(vx, vy), cx * cy, Double::sum)));
    AffExpr linear = y.times(x.constant()).plus(x.times(y.constant()).withConstant(0));
    return new QuadExpr(ImmutableMap.copyOf(quad), linear);
  }

  public ImmutableMap<VariablePair, Double> quadTerms() {
    return quadTerms;
  }

  public AffExpr aff() {
    return aff;
  }

  /** Returns a copy of this function with its affine part replaced. */
  public QuadExpr withAffine(AffExpr newAff) {
    return new QuadExpr(quadTerms, newAff);
  }

  public QuadExpr plus(AffExpr other) {
    return new QuadExpr(quadTerms, aff.plus(other));
  }

  public QuadExpr plus(QuadExpr other) {
    Map<VariablePair, Double> sum = new LinkedHashMap<>(quadTerms);
    other.quadTerms.forEach((p, c) -> sum.merge(p, c, Double::sum));
    return new QuadExpr(ImmutableMap.copyOf(sum), aff.plus(other.aff));
  }

  public QuadExpr times(double factor) {
    Map<VariablePair, Double> scaled = new LinkedHashMap<>();
    quadTerms.forEach((p, c) -> scaled.put(p, c * factor));
    return new QuadExpr(ImmutableMap.copyOf(scaled), aff.times(factor));
  }

  public QuadExpr negate() {
    return times(-1);
  }

  private Map<VariablePair, Double> canonicalTerms() {
    Map<VariablePair, Double> result = new LinkedHashMap<>();
    quadTerms.forEach(
        (p, c) -> {
          if (c != 0) {
            result.put(p, c);
          }
        });
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof QuadExpr other
        && aff.equals(other.aff)
        && canonicalTerms().equals(other.canonicalTerms());
  }

  @Override
  public int hashCode() {
    return canonicalTerms().hashCode() * 31 + aff.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    canonicalTerms().forEach((p, c) -> AffExpr.appendTerm(sb, c, p.toString()));
    if (sb.length() == 0) {
      return aff.toString();
    }
    String affine = aff.toString();
    if (!aff.equals(AffExpr.constant(0))) {
      if (affine.startsWith("-")) {
        sb.append(" - ").append(affine.substring(1));
      } else {
        sb.append(" + ").append(affine);
      }
    }
    return sb.toString();
  }
}
