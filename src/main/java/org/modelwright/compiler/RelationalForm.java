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

/**
 * The canonical form of a relation: either membership of a function in a set, or a function
 * between two bounds. If {@link #broadcast} is true the function (and bounds) are arrays and the
 * relation applies to each element separately.
 */
public abstract class RelationalForm {
  public final boolean broadcast;

  private RelationalForm(boolean broadcast) {
    this.broadcast = broadcast;
  }

  /** {@code function in set} */
  public static final class SetMembership extends RelationalForm {
    public final Syntax function;
    public final Syntax set;

    public SetMembership(Syntax function, Syntax set, boolean broadcast) {
      super(broadcast);
      this.function = function;
      this.set = set;
    }

    @Override
    public String toString() {
      return function + (broadcast ? " .in " : " in ") + set;
    }
  }

  /** {@code lower <= function <= upper} */
  public static final class Ranged extends RelationalForm {
    public final Syntax lower;
    public final Syntax function;
    public final Syntax upper;

    public Ranged(Syntax lower, Syntax function, Syntax upper, boolean broadcast) {
      super(broadcast);
      this.lower = lower;
      this.function = function;
      this.upper = upper;
    }

    @Override
    public String toString() {
      String op = broadcast ? " .<= " : " <= ";
      return lower + op + function + op + upper;
    }
  }
}
