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

import org.jspecify.annotations.Nullable;

/**
 * One option of a statement, e.g. {@code Bin}, {@code container = Dict} or {@code lowerbound = 0}.
 */
final class StatementOption {
  final String name;

  /** The option's value, or null if the option is a flag. */
  final @Nullable Syntax value;

  StatementOption(String name, @Nullable Syntax value) {
    this.name = name;
    this.value = value;
  }

  boolean isFlag() {
    return value == null;
  }

  @Override
  public String toString() {
    return isFlag() ? name : name + " = " + value;
  }
}
