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

/** A relation as written in a constraint statement, before canonicalization. */
public abstract class RelationalSpec {

  private RelationalSpec() {}

  /** {@code lhs op rhs} */
  public static final class Comparison extends RelationalSpec {
    public final Syntax lhs;
    public final RelOp op;
    public final Syntax rhs;

    public Comparison(Syntax lhs, RelOp op, Syntax rhs) {
      this.lhs = lhs;
      this.op = op;
      this.rhs = rhs;
    }

    @Override
    public String toString() {
      return lhs + " " + op + " " + rhs;
    }
  }

  /** {@code left leftOp middle rightOp right} */
  public static final class Ranged extends RelationalSpec {
    public final Syntax left;
    public final RelOp leftOp;
    public final Syntax middle;
    public final RelOp rightOp;
    public final Syntax right;

    public Ranged(Syntax left, RelOp leftOp, Syntax middle, RelOp rightOp, Syntax right) {
      this.left = left;
      this.leftOp = leftOp;
      this.middle = middle;
      this.rightOp = rightOp;
      this.right = right;
    }

    @Override
    public String toString() {
      return left + " " + leftOp + " " + middle + " " + rightOp + " " + right;
    }
  }

  /** {@code function in set} */
  public static final class Membership extends RelationalSpec {
    public final Syntax function;
    public final Syntax set;

    public Membership(Syntax function, Syntax set) {
      this.function = function;
      this.set = set;
    }

    @Override
    public String toString() {
      return function + " in " + set;
    }
  }
}
