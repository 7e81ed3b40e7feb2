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

import com.google.common.base.Preconditions;

/** A set of real vectors of a fixed dimension. */
public abstract class VectorSet extends MathSet {

  private final int dimension;

  private VectorSet(int dimension) {
    Preconditions.checkArgument(dimension >= 0, "Negative dimension %s", dimension);
    this.dimension = dimension;
  }

  /** The number of scalar functions that must be constrained to this set. */
  public int dimension() {
    return dimension;
  }

  /** The name used by {@link #toString}. */
  abstract String name();

  @Override
  public boolean equals(Object obj) {
    return obj != null && obj.getClass() == getClass() && ((VectorSet) obj).dimension == dimension;
  }

  @Override
  public int hashCode() {
    return getClass().hashCode() * 31 + dimension;
  }

  @Override
  public String toString() {
    return name() + "(" + dimension + ")";
  }

  /** {@code {0}^n} */
  public static final class Zeros extends VectorSet {
    public Zeros(int dimension) {
      super(dimension);
    }

    @Override
    String name() {
      return "Zeros";
    }
  }

  /** Vectors whose elements are all {@code >= 0}. */
  public static final class Nonnegatives extends VectorSet {
    public Nonnegatives(int dimension) {
      super(dimension);
    }

    @Override
    String name() {
      return "Nonnegatives";
    }
  }

  /** Vectors whose elements are all {@code <= 0}. */
  public static final class Nonpositives extends VectorSet {
    public Nonpositives(int dimension) {
      super(dimension);
    }

    @Override
    String name() {
      return "Nonpositives";
    }
  }

  /** Vectors {@code (t, x)} with {@code t >= ||x||}. */
  public static final class SecondOrderCone extends VectorSet {
    public SecondOrderCone(int dimension) {
      super(dimension);
    }

    @Override
    String name() {
      return "SecondOrderCone";
    }
  }

  /**
   * Positive semidefinite matrices of the given side length, represented by the column-major upper
   * triangle {@code (1,1), (1,2), (2,2), (1,3), ...}.
   */
  public static final class PositiveSemidefiniteConeTriangle extends VectorSet {
    public final int side;

    public PositiveSemidefiniteConeTriangle(int side) {
      super(side * (side + 1) / 2);
      this.side = side;
    }

    @Override
    String name() {
      return "PositiveSemidefiniteConeTriangle";
    }

    @Override
    public String toString() {
      return name() + "(" + side + ")";
    }
  }

  /**
   * Positive semidefinite matrices of the given side length, represented by all of their elements
   * in column-major order. Used when the matrix is not known to be symmetric.
   */
  public static final class PositiveSemidefiniteConeSquare extends VectorSet {
    public final int side;

    public PositiveSemidefiniteConeSquare(int side) {
      super(side * side);
      this.side = side;
    }

    @Override
    String name() {
      return "PositiveSemidefiniteConeSquare";
    }

    @Override
    public String toString() {
      return name() + "(" + side + ")";
    }
  }
}
