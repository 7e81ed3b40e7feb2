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

import java.util.List;

/**
 * A statics-only class that determines whether the index sets of a container depend on its index
 * variables. Dense and axis arrays require a closed index domain: each index set must be known
 * before any index has a value.
 */
public class DependencyAnalyzer {

  // Statics only
  private DependencyAnalyzer() {}

  /**
   * Returns true if {@code name} occurs free in {@code expr}. A generator of a {@code sum} that
   * binds {@code name} hides it from the rest of the sum.
   */
  public static boolean dependsOn(Syntax expr, String name) {
    if (expr instanceof Syntax.Name n) {
      return n.name.equals(name);
    } else if (expr instanceof Syntax.Index index && index.name.equals(name)) {
      return true;
    } else if (expr instanceof Syntax.Sum sum) {
      for (Syntax.Generator generator : sum.generators) {
        if (dependsOn(generator.set, name)) {
          return true;
        } else if (generator.name.equals(name)) {
          return false;
        }
      }
      return (sum.condition != null && dependsOn(sum.condition, name))
          || dependsOn(sum.body, name);
    }
    for (Syntax child : expr.children()) {
      if (dependsOn(child, name)) {
        return true;
      }
    }
    return false;
  }

  /** Returns true if any index set refers to the name of an earlier index. */
  public static boolean hasDependentSets(List<IndexSpec> specs) {
    for (int i = 1; i < specs.size(); i++) {
      for (int j = 0; j < i; j++) {
        if (dependsOn(specs.get(i).set, specs.get(j).name)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Returns true if the {@code i}'th index set refers to the name of any other index. */
  public static boolean isDependent(List<IndexSpec> specs, int i) {
    Syntax set = specs.get(i).set;
    for (int j = 0; j < specs.size(); j++) {
      if (j != i && dependsOn(set, specs.get(j).name)) {
        return true;
      }
    }
    return false;
  }
}
