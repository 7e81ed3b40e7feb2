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

package org.modelwright.entity;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.modelwright.algebra.AffExpr;
import org.modelwright.algebra.QuadExpr;
import org.modelwright.algebra.VariableRef;
import org.modelwright.sets.MathSet;
import org.modelwright.sets.ScalarSet;
import org.modelwright.sets.VectorSet;

/**
 * A constraint that a function belongs to a set, ready to be added to a model. Constraints are
 * immutable; the function's constant (if it has one) has already been moved into the set.
 */
public abstract class Constraint {

  private Constraint() {}

  /** The constrained function. */
  public abstract Object function();

  /** The set the function must belong to. */
  public abstract MathSet set();

  @Override
  public boolean equals(Object obj) {
    return obj != null
        && obj.getClass() == getClass()
        && function().equals(((Constraint) obj).function())
        && set().equals(((Constraint) obj).set());
  }

  @Override
  public int hashCode() {
    return function().hashCode() * 31 + set().hashCode();
  }

  @Override
  public String toString() {
    return String.format("%s in %s", function(), set());
  }

  /** {@code x in S} for a single variable {@code x}. */
  public static final class SingleVariable extends Constraint {
    public final VariableRef variable;
    public final ScalarSet set;

    public SingleVariable(VariableRef variable, ScalarSet set) {
      this.variable = variable;
      this.set = set;
    }

    @Override
    public VariableRef function() {
      return variable;
    }

    @Override
    public ScalarSet set() {
      return set;
    }
  }

  /** {@code [x1, ..., xn] in S}. */
  public static final class VectorOfVariables extends Constraint {
    public final ImmutableList<VariableRef> variables;
    public final VectorSet set;

    public VectorOfVariables(List<VariableRef> variables, VectorSet set) {
      this.variables = ImmutableList.copyOf(variables);
      this.set = set;
    }

    @Override
    public ImmutableList<VariableRef> function() {
      return variables;
    }

    @Override
    public VectorSet set() {
      return set;
    }
  }

  /** {@code f in S} for an affine {@code f} with no constant. */
  public static final class Affine extends Constraint {
    public final AffExpr function;
    public final ScalarSet set;

    public Affine(AffExpr function, ScalarSet set) {
      this.function = function;
      this.set = set;
    }

    @Override
    public AffExpr function() {
      return function;
    }

    @Override
    public ScalarSet set() {
      return set;
    }
  }

  /** {@code [f1, ..., fn] in S} for affine functions {@code fi}. */
  public static final class VectorAffine extends Constraint {
    public final ImmutableList<AffExpr> functions;
    public final VectorSet set;

    public VectorAffine(List<AffExpr> functions, VectorSet set) {
      this.functions = ImmutableList.copyOf(functions);
      this.set = set;
    }

    @Override
    public ImmutableList<AffExpr> function() {
      return functions;
    }

    @Override
    public VectorSet set() {
      return set;
    }
  }

  /** {@code f in S} for a quadratic {@code f} with no constant. */
  public static final class Quadratic extends Constraint {
    public final QuadExpr function;
    public final ScalarSet set;

    public Quadratic(QuadExpr function, ScalarSet set) {
      this.function = function;
      this.set = set;
    }

    @Override
    public QuadExpr function() {
      return function;
    }

    @Override
    public ScalarSet set() {
      return set;
    }
  }
}
