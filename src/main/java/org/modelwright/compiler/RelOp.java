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

/** The comparison operators that may appear in a relation. */
public enum RelOp {
  LE("<="),
  GE(">="),
  EQ("=="),
  NE("!="),
  LT("<"),
  GT(">"),
  DOT_LE(".<="),
  DOT_GE(".>="),
  DOT_EQ(".=="),
  SUCC_EQ("⪰"),
  PREC_EQ("⪯");

  public final String symbol;

  RelOp(String symbol) {
    this.symbol = symbol;
  }

  /** True for the element-wise operators {@code .<=}, {@code .>=} and {@code .==}. */
  public boolean isBroadcast() {
    return this == DOT_LE || this == DOT_GE || this == DOT_EQ;
  }

  /** Returns the operator without its broadcast marker. */
  public RelOp scalar() {
    return switch (this) {
      case DOT_LE -> LE;
      case DOT_GE -> GE;
      case DOT_EQ -> EQ;
      default -> this;
    };
  }

  @Override
  public String toString() {
    return symbol;
  }
}
