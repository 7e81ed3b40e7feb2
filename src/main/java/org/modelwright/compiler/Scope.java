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

import com.google.common.base.Preconditions;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Maps names to values while a statement is being evaluated. The root Scope of a compilation holds
 * its parameters and the containers declared so far; each iteration of an index loop (or of a sum
 * generator) binds its index name in a new child Scope.
 */
public final class Scope {
  private final @Nullable Scope parent;
  private final Map<String, Object> bindings = new HashMap<>();

  private Scope(@Nullable Scope parent) {
    this.parent = parent;
  }

  /** Returns a new Scope with no parent and no bindings. */
  public static Scope root() {
    return new Scope(null);
  }

  /** Returns a new, empty Scope whose lookups fall back to this one. */
  public Scope child() {
    return new Scope(this);
  }

  /**
   * Binds {@code name} in this Scope, hiding any binding in a parent. A name may only be bound once
   * in each Scope.
   */
  public void bind(String name, Object value) {
    Preconditions.checkNotNull(value);
    Object prev = bindings.putIfAbsent(name, value);
    Preconditions.checkArgument(prev == null, "'%s' is already bound", name);
  }

  /** Returns the value bound to {@code name} here or in a parent, or null if there is none. */
  public @Nullable Object lookup(String name) {
    for (Scope scope = this; scope != null; scope = scope.parent) {
      Object result = scope.bindings.get(name);
      if (result != null) {
        return result;
      }
    }
    return null;
  }

  public boolean isBound(String name) {
    return lookup(name) != null;
  }
}
