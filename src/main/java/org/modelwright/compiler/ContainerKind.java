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

/** The kinds of container that may be requested with the {@code container} option. */
public enum ContainerKind {
  /** Let the compiler choose. */
  AUTO("Auto"),
  /** A {@link org.modelwright.container.DenseArray}. */
  DENSE_ARRAY("Array"),
  /** An {@link org.modelwright.container.AxisArray}. */
  ORDERED_AXIS_ARRAY("AxisArray"),
  /** An {@link org.modelwright.container.AssociativeMap}. */
  ASSOCIATIVE_MAP("Dict");

  /** The name used in statements, e.g. {@code container = Dict}. */
  public final String keyword;

  ContainerKind(String keyword) {
    this.keyword = keyword;
  }

  /** Returns the ContainerKind with the given keyword. */
  public static ContainerKind fromKeyword(String keyword, ErrorContext errorContext) {
    for (ContainerKind kind : values()) {
      if (kind.keyword.equals(keyword)) {
        return kind;
      }
    }
    throw errorContext.specificationError(
        "Invalid container type %s. Must be Auto, Array, AxisArray, or Dict.", keyword);
  }
}
