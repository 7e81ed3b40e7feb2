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
 * The set that a constrained function must belong to.
 *
 * <ul>
 *   <li>{@link ScalarSet}s constrain a single scalar function.
 *   <li>{@link VectorSet}s constrain an ordered vector of scalar functions.
 *   <li>{@link PsdCone} constrains a square matrix, and is converted to one of the positive
 *       semidefinite VectorSets when the constraint is built.
 *   <li>{@link Bounds} is the unevaluated pair of bounds of a two-sided relation; it becomes an
 *       {@link ScalarSet.Interval} once both bounds are known to be numbers.
 * </ul>
 *
 * <p>MathSets are immutable values.
 */
public abstract class MathSet {

  MathSet() {}

  @Override
  public abstract boolean equals(Object obj);

  @Override
  public abstract int hashCode();
}
