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

import org.modelwright.compiler.Syntax.Binary;
import org.modelwright.compiler.Syntax.BinaryOp;
import org.modelwright.sets.PsdCone;
import org.modelwright.sets.ScalarSet;

/**
 * A statics-only class that converts each {@link RelationalSpec} to a {@link RelationalForm}.
 *
 * <p>A comparison moves everything to its left-hand side: {@code a <= b} becomes {@code a - b in
 * LessThan(0.0)}. The constant of {@code a - b} is moved into the set only when the constraint is
 * built, since it is not known until then (see {@link BuilderDispatch}).
 */
public class RelationalCanonicalizer {

  // Statics only
  private RelationalCanonicalizer() {}

  public static RelationalForm canonicalize(RelationalSpec spec, ErrorContext errorContext) {
    if (spec instanceof RelationalSpec.Comparison comparison) {
      RelOp op = comparison.op;
      ScalarSet set = zeroSet(op.scalar(), errorContext);
      Syntax function = new Binary(BinaryOp.SUB, comparison.lhs, comparison.rhs);
      return new RelationalForm.SetMembership(
          function, new Syntax.Constant(set), op.isBroadcast());
    } else if (spec instanceof RelationalSpec.Ranged ranged) {
      if (ranged.leftOp.isBroadcast() != ranged.rightOp.isBroadcast()) {
        throw errorContext.specificationError("Signs are inconsistently vectorized");
      }
      RelOp leftOp = ranged.leftOp.scalar();
      RelOp rightOp = ranged.rightOp.scalar();
      boolean broadcast = ranged.leftOp.isBroadcast();
      if (leftOp == RelOp.LE && rightOp == RelOp.LE) {
        return new RelationalForm.Ranged(ranged.left, ranged.middle, ranged.right, broadcast);
      } else if (leftOp == RelOp.GE && rightOp == RelOp.GE) {
        return new RelationalForm.Ranged(ranged.right, ranged.middle, ranged.left, broadcast);
      }
      throw errorContext.specificationError(
          "Only two-sided rows of the form lb <= expr <= ub or ub >= expr >= lb are supported.");
    }
    RelationalSpec.Membership membership = (RelationalSpec.Membership) spec;
    return new RelationalForm.SetMembership(membership.function, membership.set, false);
  }

  /**
   * Converts the relation of a semidefinite constraint: {@code a >= b} (or {@code a ⪰ b}) becomes
   * {@code a - b in PSDCone()}, and {@code a <= b} (or {@code a ⪯ b}) becomes {@code b - a in
   * PSDCone()}.
   */
  public static RelationalForm canonicalizeSemidefinite(
      RelationalSpec spec, ErrorContext errorContext) {
    if (!(spec instanceof RelationalSpec.Comparison comparison)) {
      throw errorContext.specificationError(
          "Semidefinite constraints must have the form lhs >= rhs or lhs <= rhs, got %s", spec);
    }
    Syntax function =
        switch (comparison.op) {
          case GE, SUCC_EQ -> new Binary(BinaryOp.SUB, comparison.lhs, comparison.rhs);
          case LE, PREC_EQ -> new Binary(BinaryOp.SUB, comparison.rhs, comparison.lhs);
          default -> throw errorContext.specificationError(
              "Invalid sense %s in SDP constraint", comparison.op);
        };
    return new RelationalForm.SetMembership(
        function, new Syntax.Constant(PsdCone.INSTANCE), false);
  }

  /** Returns the set with a zero bound for a (non-broadcast) comparison operator. */
  static ScalarSet zeroSet(RelOp op, ErrorContext errorContext) {
    return switch (op) {
      case LE -> new ScalarSet.LessThan(0.0);
      case GE -> new ScalarSet.GreaterThan(0.0);
      case EQ -> new ScalarSet.EqualTo(0.0);
      default -> throw errorContext.specificationError("Unrecognized sense %s", op);
    };
  }
}
