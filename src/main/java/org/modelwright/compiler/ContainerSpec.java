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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A declarative description of a container, e.g. {@code x[i in 1..3, j in S; i != j]}: its name,
 * its indices (in nesting order), an optional filter on the index values, and the requested
 * kind.
 */
public final class ContainerSpec {
  /** The name of the container, or null if it is anonymous. */
  public final @Nullable String name;

  public final ImmutableList<IndexSpec> indexSpecs;

  /** If non-null, only index tuples for which this evaluates to true have an element. */
  public final @Nullable Syntax filter;

  /** The class of the container's elements. */
  public final Class<?> elementType;

  public final ContainerKind requestedKind;

  public ContainerSpec(
      @Nullable String name,
      ImmutableList<IndexSpec> indexSpecs,
      @Nullable Syntax filter,
      Class<?> elementType,
      ContainerKind requestedKind) {
    this.name = name;
    this.indexSpecs = indexSpecs;
    this.filter = filter;
    this.elementType = elementType;
    this.requestedKind = requestedKind;
  }

  /** Returns a spec for a single, unindexed element. */
  public static ContainerSpec scalar(@Nullable String name, Class<?> elementType) {
    return new ContainerSpec(name, ImmutableList.of(), null, elementType, ContainerKind.AUTO);
  }

  /** Returns a copy of this spec with a different requested kind. */
  public ContainerSpec withRequestedKind(ContainerKind kind) {
    return new ContainerSpec(name, indexSpecs, filter, elementType, kind);
  }

  @Override
  public String toString() {
    String result = (name == null) ? "" : name;
    if (indexSpecs.isEmpty()) {
      return result;
    }
    result += "[" + Joiner.on(", ").join(indexSpecs);
    return result + ((filter == null) ? "]" : "; " + filter + "]");
  }
}
