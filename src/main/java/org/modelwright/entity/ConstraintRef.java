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

package org.modelwright.entity;

/**
 * A handle for a constraint that has been added to a model. Like {@link
 * org.modelwright.algebra.VariableRef}, ConstraintRefs are compared by identity.
 */
public final class ConstraintRef {
  private final Object owner;
  public final int index;
  public final String name;

  public ConstraintRef(Object owner, int index, String name) {
    this.owner = owner;
    this.index = index;
    this.name = name;
  }

  /** Returns the model that created this constraint. */
  public Object owner() {
    return owner;
  }

  @Override
  public String toString() {
    return name.isEmpty() ? "noname" : name;
  }
}
