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

/**
 * One index of a container: the name bound to each of its values, and the expression for the set
 * of values.
 */
public final class IndexSpec {
  public final String name;
  public final Syntax set;

  public IndexSpec(String name, Syntax set) {
    this.name = name;
    this.set = set;
  }

  /** Returns the name used for the {@code position}'th index (from 1) when none is given. */
  static String syntheticName(int position) {
    return "_i" + position;
  }

  @Override
  public String toString() {
    return name + " in " + set;
  }
}
