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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import org.antlr.v4.runtime.CharStreams;
import org.junit.Test;
import org.modelwright.Model;
import org.modelwright.algebra.VariableRef;
import org.modelwright.compiler.Compiler;
import org.modelwright.container.DenseArray;
import org.modelwright.entity.Constraint;
import org.modelwright.entity.ConstraintRef;
import org.modelwright.entity.ScalarVariable;
import org.modelwright.sets.ScalarSet;

public class InMemoryModelTest {
  private final InMemoryModel model = new InMemoryModel();

  private void compile(String source) {
    Compiler.compile(
        CharStreams.fromString(source), "test", model, new AlgebraParser(), ImmutableMap.of());
  }

  @Test
  public void records() {
    VariableRef x = model.addVariable(ScalarVariable.builder().setLowerBound(1).build(), "x");
    ConstraintRef c =
        model.addConstraint(new Constraint.SingleVariable(x, new ScalarSet.LessThan(2)), "c");
    model.registerName("x", x);
    model.setObjective(Model.ObjectiveSense.MIN, x);

    assertThat(model.numVariables()).isEqualTo(1);
    assertThat(model.numConstraints()).isEqualTo(1);
    assertThat(model.variableRefs()).containsExactly(x);
    assertThat(model.constraintRefs()).containsExactly(c);
    assertThat(model.variable(x).lowerBound).isEqualTo(1.0);
    assertThat(model.constraint(c).toString()).isEqualTo("x in LessThan(2.0)");
    assertThat(model.named("x")).isSameInstanceAs(x);
    assertThat(model.named("c")).isNull();
    assertThat(model.objectiveSense()).isEqualTo(Model.ObjectiveSense.MIN);
    assertThat(model.objective()).isSameInstanceAs(x);
  }

  @Test
  public void duplicateName() {
    VariableRef x = model.addVariable(ScalarVariable.free(), "x");
    model.registerName("x", x);
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> model.registerName("x", x));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("An object of name x is already attached to this model.");
  }

  @Test
  public void foreignHandle() {
    VariableRef other = new InMemoryModel().addVariable(ScalarVariable.free(), "y");
    assertThrows(IllegalArgumentException.class, () -> model.variable(other));
  }

  @Test
  public void compiledModel() {
    compile(
        """
        variable x[1..2] >= 0
        constraint c[i in 1..2]: x[i] <= 3
        maximize x[1] + x[2]
        """);
    assertThat(model.numVariables()).isEqualTo(2);
    assertThat(model.numConstraints()).isEqualTo(2);
    assertThat(model.names().keySet()).containsExactly("x", "c").inOrder();
    assertThat(model.named("c")).isInstanceOf(DenseArray.class);
    VariableRef x1 = model.variableRefs().get(0);
    assertThat(x1.toString()).isEqualTo("x[1]");
    assertThat(model.variable(x1).lowerBound).isEqualTo(0.0);
    assertThat(model.constraint(model.constraintRefs().get(1)).toString())
        .isEqualTo("x[2] in LessThan(3.0)");
    assertThat(model.objectiveSense()).isEqualTo(Model.ObjectiveSense.MAX);
    assertThat(String.valueOf(model.objective())).isEqualTo("x[1] + x[2]");
  }

  @Test
  public void registrationErrorsPropagate() {
    compile("variable x");
    // A second compilation does not know about x, but the model does.
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> compile("variable x"));
    assertThat(e).hasMessageThat().contains("An object of name x is already attached");
  }
}
