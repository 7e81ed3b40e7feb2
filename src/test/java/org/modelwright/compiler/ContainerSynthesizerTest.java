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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.modelwright.compiler.TestSyntax.containerSpec;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class ContainerSynthesizerTest {
  private static final ErrorContext CONTEXT = ErrorContext.of("test");

  /** Each entry is a ref, the requested container kind, and the expected kind. */
  private static Object[] plans() {
    return new Object[] {
      new Object[] {"x[i in 1..3]", "Auto", ContainerKind.DENSE_ARRAY},
      new Object[] {"x[1..3, j = 1..n]", "Auto", ContainerKind.DENSE_ARRAY},
      new Object[] {"x[i in 2..3]", "Auto", ContainerKind.ORDERED_AXIS_ARRAY},
      new Object[] {"x[i in 1..3, s in S]", "Auto", ContainerKind.ORDERED_AXIS_ARRAY},
      new Object[] {"x[i in [1, 2, 3]]", "Auto", ContainerKind.ORDERED_AXIS_ARRAY},
      new Object[] {"x[i in 1..3; i != 2]", "Auto", ContainerKind.ASSOCIATIVE_MAP},
      new Object[] {"x[i in 1..3, j in i..3]", "Auto", ContainerKind.ASSOCIATIVE_MAP},
      new Object[] {"x[i in 1..3]", "Dict", ContainerKind.ASSOCIATIVE_MAP},
      new Object[] {"x[i in 1..3]", "AxisArray", ContainerKind.ORDERED_AXIS_ARRAY},
      new Object[] {"x[s in S]", "Array", ContainerKind.DENSE_ARRAY},
      new Object[] {"x[i in 1..3; i != 2]", "Dict", ContainerKind.ASSOCIATIVE_MAP},
    };
  }

  @Test
  @Parameters(method = "plans")
  public void chooseKind(String ref, String requested, ContainerKind expected) {
    ContainerKind kind = ContainerKind.fromKeyword(requested, CONTEXT);
    ContainerPlan plan = ContainerSynthesizer.synthesize(containerSpec(ref, kind), CONTEXT);
    assertThat(plan.kind).isEqualTo(expected);
    assertThat(plan.isScalar()).isFalse();
    assertThat(plan.needsDuplicateCheck).isEqualTo(expected == ContainerKind.ASSOCIATIVE_MAP);
  }

  @Test
  public void scalar() {
    ContainerPlan plan = ContainerSynthesizer.synthesize(containerSpec("x"), CONTEXT);
    assertThat(plan.isScalar()).isTrue();
    assertThat(plan.kind).isNull();
  }

  @Test
  public void syntheticIndexNames() {
    ContainerSpec spec = containerSpec("x[1..3, j in S, T]");
    assertThat(spec.indexSpecs.get(0).name).isEqualTo(IndexSpec.syntheticName(1));
    assertThat(spec.indexSpecs.get(1).name).isEqualTo("j");
    assertThat(spec.indexSpecs.get(2).name).isEqualTo(IndexSpec.syntheticName(3));
  }

  private static Object[] incompatible() {
    return new Object[] {
      new Object[] {
        "x[i in 1..3; i != 2]",
        "Array",
        "In test: Requested container type is incompatible with conditional indexing."
            + " Use Dict or Auto instead."
      },
      new Object[] {
        "x[i in 1..3; i != 2]",
        "AxisArray",
        "In test: Requested container type is incompatible with conditional indexing."
            + " Use Dict or Auto instead."
      },
      new Object[] {
        "x[i in 1..3, j in i..3]",
        "AxisArray",
        "In test: Requested container type is incompatible with index sets that depend on other"
            + " indices. Use Dict or Auto instead."
      },
    };
  }

  @Test
  @Parameters(method = "incompatible")
  public void incompatibleRequest(String ref, String requested, String message) {
    ContainerKind kind = ContainerKind.fromKeyword(requested, CONTEXT);
    CompileError e =
        assertThrows(
            CompileError.SpecificationError.class,
            () -> ContainerSynthesizer.synthesize(containerSpec(ref, kind), CONTEXT));
    assertThat(e).hasMessageThat().isEqualTo(message);
  }

  @Test
  public void invalidKind() {
    CompileError e =
        assertThrows(CompileError.class, () -> ContainerKind.fromKeyword("Vector", CONTEXT));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "In test: Invalid container type Vector. Must be Auto, Array, AxisArray, or Dict.");
  }
}
