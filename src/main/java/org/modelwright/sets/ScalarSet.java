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

/**
 * A set of real numbers described by one or two bounds. There are four subclasses: {@link
 * LessThan}, {@link GreaterThan}, {@link EqualTo} and {@link Interval}.
 */
public abstract class ScalarSet extends MathSet {

  private ScalarSet() {}

  /**
   * Returns the set of values {@code v - offset} for {@code v} in this set, i.e. this set with each
   * bound decreased by {@code offset}. Used to move the constant of a function {@code f + c} into
   * the set: {@code f + c in S} is equivalent to {@code f in S.minus(c)}.
   */
  public abstract ScalarSet minus(double offset);

  /** {@code (-inf, upper]} */
  public static final class LessThan extends ScalarSet {
    public final double upper;

    public LessThan(double upper) {
      this.upper = upper;
    }

    @Override
    public LessThan minus(double offset) {
      return new LessThan(upper - offset);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof LessThan other && upper == other.upper;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(upper + 0.0);
    }

    @Override
    public String toString() {
      return "LessThan(" + upper + ")";
    }
  }

  /** {@code [lower, inf)} */
  public static final class GreaterThan extends ScalarSet {
    public final double lower;

    public GreaterThan(double lower) {
      this.lower = lower;
    }

    @Override
    public GreaterThan minus(double offset) {
      return new GreaterThan(lower - offset);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof GreaterThan other && lower == other.lower;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(lower + 0.0) * 3;
    }

    @Override
    public String toString() {
      return "GreaterThan(" + lower + ")";
    }
  }

  /** {@code {value}} */
  public static final class EqualTo extends ScalarSet {
    public final double value;

    public EqualTo(double value) {
      this.value = value;
    }

    @Override
    public EqualTo minus(double offset) {
      return new EqualTo(value - offset);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof EqualTo other && value == other.value;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value + 0.0) * 5;
    }

    @Override
    public String toString() {
      return "EqualTo(" + value + ")";
    }
  }

  /** {@code [lower, upper]} */
  public static final class Interval extends ScalarSet {
    public final double lower;
    public final double upper;

    public Interval(double lower, double upper) {
      this.lower = lower;
      this.upper = upper;
    }

    @Override
    public Interval minus(double offset) {
      return new Interval(lower - offset, upper - offset);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Interval other && lower == other.lower && upper == other.upper;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(lower + 0.0) * 7 + Double.hashCode(upper + 0.0);
    }

    @Override
    public String toString() {
      return "Interval(" + lower + ", " + upper + ")";
    }
  }
}
