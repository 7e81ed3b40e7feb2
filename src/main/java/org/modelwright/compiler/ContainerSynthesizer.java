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

import org.modelwright.compiler.Syntax.Binary;
import org.modelwright.compiler.Syntax.BinaryOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A statics-only class that chooses the kind of container for a {@link ContainerSpec}.
 *
 * <ul>
 *   <li>A filter, or an index set that depends on an earlier index, requires an associative map,
 *       since the keys need not form a rectangle.
 *   <li>Otherwise {@link ContainerKind#AUTO} chooses a dense array if every index set is written
 *       {@code 1..N}, and an axis array if not.
 * </ul>
 */
public class ContainerSynthesizer {

  private static final Logger logger = LoggerFactory.getLogger(ContainerSynthesizer.class);

  // Statics only
  private ContainerSynthesizer() {}

  public static ContainerPlan synthesize(ContainerSpec spec, ErrorContext errorContext) {
    if (spec.indexSpecs.isEmpty()) {
      return new ContainerPlan(null, spec.indexSpecs, null, spec.elementType, false);
    }
    ContainerKind kind = spec.requestedKind;
    if (spec.filter != null) {
      if (kind == ContainerKind.AUTO) {
        kind = ContainerKind.ASSOCIATIVE_MAP;
      } else if (kind != ContainerKind.ASSOCIATIVE_MAP) {
        throw errorContext.specificationError(
            "Requested container type is incompatible with conditional indexing."
                + " Use Dict or Auto instead.");
      }
    }
    if (DependencyAnalyzer.hasDependentSets(spec.indexSpecs)) {
      if (kind == ContainerKind.AUTO) {
        kind = ContainerKind.ASSOCIATIVE_MAP;
      } else if (kind != ContainerKind.ASSOCIATIVE_MAP) {
        throw errorContext.specificationError(
            "Requested container type is incompatible with index sets that depend on other"
                + " indices. Use Dict or Auto instead.");
      }
    }
    if (kind == ContainerKind.AUTO) {
      kind =
          spec.indexSpecs.stream().allMatch(s -> isOneBasedRange(s.set))
              ? ContainerKind.DENSE_ARRAY
              : ContainerKind.ORDERED_AXIS_ARRAY;
    }
    ContainerPlan plan =
        new ContainerPlan(
            kind,
            spec.indexSpecs,
            spec.filter,
            spec.elementType,
            kind == ContainerKind.ASSOCIATIVE_MAP);
    logger.debug("{}: {} -> {}", errorContext, spec, plan);
    return plan;
  }

  /** Returns true if {@code set} is written {@code 1..N}, for any expression {@code N}. */
  static boolean isOneBasedRange(Syntax set) {
    return set instanceof Binary range
        && range.op == BinaryOp.RANGE
        && range.left instanceof Syntax.Num lo
        && lo.value instanceof Integer i
        && i == 1;
  }
}
