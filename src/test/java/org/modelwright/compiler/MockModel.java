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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.modelwright.Model;
import org.modelwright.algebra.VariableRef;
import org.modelwright.entity.Constraint;
import org.modelwright.entity.ConstraintRef;
import org.modelwright.entity.ScalarVariable;

/** A Model.Builder that records each call as a line of text. */
class MockModel implements Model.Builder {
  final List<String> calls = new ArrayList<>();
  final List<ScalarVariable> variables = new ArrayList<>();
  final List<Constraint> constraints = new ArrayList<>();
  private final Set<String> names = new HashSet<>();

  @Override
  public VariableRef addVariable(ScalarVariable variable, String name) {
    VariableRef ref = new VariableRef(this, variables.size(), name);
    variables.add(variable);
    calls.add(String.format("variable %s: %s", ref, variable));
    return ref;
  }

  @Override
  public ConstraintRef addConstraint(Constraint constraint, String name) {
    ConstraintRef ref = new ConstraintRef(this, constraints.size(), name);
    constraints.add(constraint);
    calls.add(String.format("constraint %s: %s", ref, constraint));
    return ref;
  }

  @Override
  public void registerName(String name, Object handle) {
    if (!names.add(name)) {
      throw new IllegalArgumentException("Name " + name + " already registered");
    }
    calls.add("name " + name);
  }

  @Override
  public void setObjective(Model.ObjectiveSense sense, Object function) {
    calls.add(String.format("objective %s %s", sense, function));
  }

  @Override
  public String toString() {
    return Joiner.on("\n").join(calls);
  }
}
