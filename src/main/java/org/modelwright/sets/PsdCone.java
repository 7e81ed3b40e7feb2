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
 * The cone of positive semidefinite matrices, as written in a constraint ({@code A in PSDCone()}).
 * The side length is taken from the constrained matrix.
 */
public final class PsdCone extends MathSet {
  public static final PsdCone INSTANCE = new PsdCone();

  private PsdCone() {}

  @Override
  public boolean equals(Object obj) {
    return obj == this;
  }

  @Override
  public int hashCode() {
    return 17;
  }

  @Override
  public String toString() {
    return "PSDCone()";
  }
}
