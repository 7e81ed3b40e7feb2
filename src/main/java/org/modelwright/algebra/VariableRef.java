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
 * A handle for one scalar decision variable. VariableRefs are created by the model that owns the
 * variable (see {@link org.modelwright.Model.Builder#addVariable}) and compared by identity, so two
 * handles are equal only if they are the same object.
 */
public final class VariableRef {
  private final Object owner;

  /** The position of this variable in its model, starting from zero. */
  public final int index;

  /** The name given when the variable was added; may be empty. */
  public final String name;

  public VariableRef(Object owner, int index, String name) {
    this.owner = owner;
    this.index = index;
    this.name = name;
  }

  /** Returns the model that created this variable. */
  public Object owner() {
    return owner;
  }

  @Override
  public String toString() {
    return name.isEmpty() ? "noname" : name;
  }
}
