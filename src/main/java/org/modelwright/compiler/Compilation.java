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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/** The result of {@link Compiler#compile}. */
public final class Compilation {
  public final Object source;
  private final ImmutableMap<String, Object> named;
  private final ImmutableList<Object> results;

  Compilation(Object source, ImmutableMap<String, Object> named, ImmutableList<Object> results) {
    this.source = source;
    this.named = named;
    this.results = results;
  }

  /**
   * Returns the value declared with the given name (a container, a variable or constraint handle,
   * an expression, or a parameter defined by a {@code param} statement), or null if there is none.
   */
  public @Nullable Object get(String name) {
    return named.get(name);
  }

  /** All named values, in the order in which they were declared. */
  public ImmutableMap<String, Object> named() {
    return named;
  }

  /**
   * The value produced by each statement, in order. Objective statements produce the objective
   * function.
   */
  public ImmutableList<Object> results() {
    return results;
  }
}
