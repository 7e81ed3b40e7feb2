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

package org.modelwright.impl;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.modelwright.Model;
import org.modelwright.algebra.VariableRef;
import org.modelwright.entity.Constraint;
import org.modelwright.entity.ConstraintRef;
import org.modelwright.entity.ScalarVariable;

/** A Model.Builder that just records everything it is given. */
public class InMemoryModel implements Model.Builder {
  private final List<ScalarVariable> variables = new ArrayList<>();
  private final List<VariableRef> variableRefs = new ArrayList<>();
  private final List<Constraint> constraints = new ArrayList<>();
  private final List<ConstraintRef> constraintRefs = new ArrayList<>();
  private final Map<String, Object> names = new LinkedHashMap<>();
  private Model.@Nullable ObjectiveSense objectiveSense;
  private @Nullable Object objective;

  @Override
  public VariableRef addVariable(ScalarVariable variable, String name) {
    VariableRef ref = new VariableRef(this, variables.size(), name);
    variables.add(Preconditions.checkNotNull(variable));
    variableRefs.add(ref);
    return ref;
  }

  @Override
  public ConstraintRef addConstraint(Constraint constraint, String name) {
    ConstraintRef ref = new ConstraintRef(this, constraints.size(), name);
    constraints.add(Preconditions.checkNotNull(constraint));
    constraintRefs.add(ref);
    return ref;
  }

  @Override
  public void registerName(String name, Object handle) {
    Preconditions.checkNotNull(handle);
    if (names.putIfAbsent(name, handle) != null) {
      throw new IllegalArgumentException(
          String.format("An object of name %s is already attached to this model.", name));
    }
  }

  @Override
  public void setObjective(Model.ObjectiveSense sense, Object function) {
    this.objectiveSense = sense;
    this.objective = function;
  }

  public int numVariables() {
    return variables.size();
  }

  public int numConstraints() {
    return constraints.size();
  }

  /** All variable handles, in the order they were added. */
  public ImmutableList<VariableRef> variableRefs() {
    return ImmutableList.copyOf(variableRefs);
  }

  /** All constraint handles, in the order they were added. */
  public ImmutableList<ConstraintRef> constraintRefs() {
    return ImmutableList.copyOf(constraintRefs);
  }

  public ScalarVariable variable(VariableRef ref) {
    Preconditions.checkArgument(ref.owner() == this, "%s belongs to another model", ref);
    return variables.get(ref.index);
  }

  public Constraint constraint(ConstraintRef ref) {
    Preconditions.checkArgument(ref.owner() == this, "%s belongs to another model", ref);
    return constraints.get(ref.index);
  }

  /** Returns the handle registered with the given name, or null if there is none. */
  public @Nullable Object named(String name) {
    return names.get(name);
  }

  /** All registered names, in the order they were registered. */
  public ImmutableMap<String, Object> names() {
    return ImmutableMap.copyOf(names);
  }

  public Model.@Nullable ObjectiveSense objectiveSense() {
    return objectiveSense;
  }

  public @Nullable Object objective() {
    return objective;
  }
}
