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

package org.modelwright.sets;

import java.util.Objects;

/**
 * The bounds of a two-sided relation {@code lower <= f <= upper}. The bounds are the values that
 * the expression parser produced for them and have not been checked; building a constraint from
 * Bounds fails unless both are numbers.
 */
public final class Bounds extends MathSet {
  public final Object lower;
  public final Object upper;

  public Bounds(Object lower, Object upper) {
    this.lower = lower;
    this.upper = upper;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Bounds other
        && Objects.equals(lower, other.lower)
        && Objects.equals(upper, other.upper);
  }

  @Override
  public int hashCode() {
    return Objects.hash(lower, upper);
  }

  @Override
  public String toString() {
    return "Bounds(" + lower + ", " + upper + ")";
  }
}
