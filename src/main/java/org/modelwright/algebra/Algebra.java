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

/**
 * A statics-only class implementing arithmetic on scalar algebraic values: Numbers, {@link
 * VariableRef}s, {@link AffExpr}s and {@link QuadExpr}s.
 *
 * <p>Sums and differences of Integers stay Integers (index arithmetic such as {@code i + 1} should
 * produce a valid key); any other numeric result is a Double. Operations that would leave the
 * quadratic functions throw an IllegalArgumentException.
 */
public class Algebra {

  // Statics only
  private Algebra() {}

  /** Returns true if {@code x} is one of the value types handled by this class. */
  public static boolean isScalar(Object x) {
    return x instanceof Number
        || x instanceof VariableRef
        || x instanceof AffExpr
        || x instanceof QuadExpr;
  }

  /** Returns true if {@code x} is a Number, a VariableRef or an AffExpr. */
  public static boolean isAffine(Object x) {
    return x instanceof Number || x instanceof VariableRef || x instanceof AffExpr;
  }

  /** Converts a Number, VariableRef or AffExpr to an AffExpr. */
  public static AffExpr toAffine(Object x) {
    if (x instanceof AffExpr aff) {
      return aff;
    } else if (x instanceof VariableRef v) {
      return AffExpr.of(v);
    } else if (x instanceof Number n) {
      return AffExpr.constant(n.doubleValue());
    }
    throw new IllegalArgumentException("Expected an affine function, got " + describe(x));
  }

  /** Converts any scalar algebraic value to a QuadExpr. */
  public static QuadExpr toQuadratic(Object x) {
    return (x instanceof QuadExpr quad) ? quad : QuadExpr.of(toAffine(x));
  }

  public static Object add(Object x, Object y) {
    if (x instanceof Number nx && y instanceof Number ny) {
      if (nx instanceof Integer ix && ny instanceof Integer iy) {
        return Math.addExact(ix, iy);
      }
      return nx.doubleValue() + ny.doubleValue();
    } else if (x instanceof QuadExpr || y instanceof QuadExpr) {
      checkScalar(x);
      checkScalar(y);
      return toQuadratic(x).plus(toQuadratic(y));
    }
    return toAffine(x).plus(toAffine(y));
  }

  public static Object negate(Object x) {
    if (x instanceof Integer i) {
      return Math.negateExact(i);
    } else if (x instanceof Number n) {
      return -n.doubleValue();
    } else if (x instanceof QuadExpr quad) {
      return quad.negate();
    }
    return toAffine(x).negate();
  }

  public static Object subtract(Object x, Object y) {
    if (x instanceof Integer ix && y instanceof Integer iy) {
      return Math.subtractExact(ix, iy);
    }
    return add(x, negate(y));
  }

  public static Object multiply(Object x, Object y) {
    if (x instanceof Number nx && y instanceof Number ny) {
      if (nx instanceof Integer ix && ny instanceof Integer iy) {
        return Math.multiplyExact(ix, iy);
      }
      return nx.doubleValue() * ny.doubleValue();
    } else if (x instanceof Number nx) {
      return scale(y, nx.doubleValue());
    } else if (y instanceof Number ny) {
      return scale(x, ny.doubleValue());
    } else if (isAffine(x) && isAffine(y)) {
      return QuadExpr.product(toAffine(x), toAffine(y));
    }
    throw new IllegalArgumentException(
        String.format("Cannot multiply %s by %s", describe(x), describe(y)));
  }

  public static Object divide(Object x, Object y) {
    if (!(y instanceof Number ny)) {
      throw new IllegalArgumentException("Cannot divide by " + describe(y));
    } else if (x instanceof Number nx) {
      return nx.doubleValue() / ny.doubleValue();
    }
    return scale(x, 1 / ny.doubleValue());
  }

  /** Returns {@code x^exponent}; non-numeric bases only support exponents 0, 1 and 2. */
  public static Object power(Object x, Object exponent) {
    if (!(exponent instanceof Number e)) {
      throw new IllegalArgumentException("Exponent must be a number, got " + describe(exponent));
    } else if (x instanceof Number nx) {
      return Math.pow(nx.doubleValue(), e.doubleValue());
    }
    double d = e.doubleValue();
    if (d == 0) {
      return 1.0;
    } else if (d == 1) {
      return x;
    } else if (d == 2) {
      return multiply(x, x);
    }
    throw new IllegalArgumentException(
        String.format("Only exponents 0, 1 and 2 are supported for %s", describe(x)));
  }

  private static Object scale(Object x, double factor) {
    if (x instanceof QuadExpr quad) {
      return quad.times(factor);
    }
    return toAffine(x).times(factor);
  }

  private static void checkScalar(Object x) {
    if (!isScalar(x)) {
      throw new IllegalArgumentException("Expected a scalar function, got " + describe(x));
    }
  }

  /** Returns a short description of {@code x} for error messages. */
  public static String describe(Object x) {
    return (x == null) ? "null" : String.format("%s (%s)", x, x.getClass().getSimpleName());
  }
}
