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
import org.jspecify.annotations.Nullable;

/** The container chosen for a {@link ContainerSpec} by {@link ContainerSynthesizer}. */
public final class ContainerPlan {
  /**
   * DENSE_ARRAY, ORDERED_AXIS_ARRAY or ASSOCIATIVE_MAP; null if there are no indices, in which case
   * the "container" is just the element.
   */
  public final @Nullable ContainerKind kind;

  public final ImmutableList<IndexSpec> indexSpecs;
  public final @Nullable Syntax filter;
  public final Class<?> elementType;

  /**
   * True if each index tuple must be checked against the keys already stored before building its
   * element. Rectangular containers check their axes for repeated values when they are allocated
   * instead.
   */
  public final boolean needsDuplicateCheck;

  ContainerPlan(
      @Nullable ContainerKind kind,
      ImmutableList<IndexSpec> indexSpecs,
      @Nullable Syntax filter,
      Class<?> elementType,
      boolean needsDuplicateCheck) {
    this.kind = kind;
    this.indexSpecs = indexSpecs;
    this.filter = filter;
    this.elementType = elementType;
    this.needsDuplicateCheck = needsDuplicateCheck;
  }

  public boolean isScalar() {
    return kind == null;
  }

  @Override
  public String toString() {
    return String.format(
        "%s%s of %s%s",
        (kind == null) ? "scalar" : kind,
        indexSpecs,
        elementType.getSimpleName(),
        needsDuplicateCheck ? " (checked)" : "");
  }
}
