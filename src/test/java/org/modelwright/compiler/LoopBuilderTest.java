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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.modelwright.container.AssociativeMap;
import org.modelwright.container.AxisArray;
import org.modelwright.container.DenseArray;
import org.modelwright.container.IndexKey;
import org.modelwright.container.IndexedContainer;
import org.modelwright.impl.AlgebraParser;

public class LoopBuilderTest {
  private static final ErrorContext CONTEXT = ErrorContext.of("test");

  private final LoopBuilder loopBuilder = new LoopBuilder(new AlgebraParser(), CONTEXT);
  private final Scope scope = Scope.root();

  /** The keys passed to {@link #elementBuilder}, in order. */
  private final List<IndexKey> built = new ArrayList<>();

  private LoopBuilder.ElementBuilder<String> elementBuilder() {
    return (s, key) -> {
      built.add(key);
      return key.elementName("e");
    };
  }

  private IndexedContainer<?> populate(String ref, ContainerKind kind) {
    ContainerPlan plan = ContainerSynthesizer.synthesize(containerSpec(ref, kind), CONTEXT);
    return (IndexedContainer<?>) loopBuilder.build(plan, elementBuilder()).populate(scope);
  }

  private IndexedContainer<?> populate(String ref) {
    return populate(ref, ContainerKind.AUTO);
  }

  private IndexedContainer<?> populateSymmetric(String ref) {
    ContainerPlan plan = ContainerSynthesizer.synthesize(containerSpec(ref), CONTEXT);
    return (IndexedContainer<?>) loopBuilder.buildSymmetric(plan, elementBuilder()).populate(scope);
  }

  @Test
  public void scalar() {
    ContainerPlan plan = ContainerSynthesizer.synthesize(containerSpec("x"), CONTEXT);
    assertThat(loopBuilder.build(plan, elementBuilder()).populate(scope)).isEqualTo("e");
    assertThat(built).containsExactly(IndexKey.of());
  }

  @Test
  public void denseArray() {
    scope.bind("n", 3);
    IndexedContainer<?> result = populate("x[i in 1..2, j in 1..n]");
    assertThat(result).isInstanceOf(DenseArray.class);
    assertThat(result.get(2, 3)).isEqualTo("e[2,3]");
    assertThat(result.size()).isEqualTo(6);
    // The last index varies fastest.
    assertThat(built.subList(0, 3))
        .containsExactly(IndexKey.of(1, 1), IndexKey.of(1, 2), IndexKey.of(1, 3))
        .inOrder();
  }

  @Test
  public void axisArray() {
    scope.bind("S", ImmutableList.of("a", "b"));
    IndexedContainer<?> result = populate("x[s in S, 2..3]");
    assertThat(result).isInstanceOf(AxisArray.class);
    assertThat(result.keys())
        .containsExactly(
            IndexKey.of("a", 2), IndexKey.of("a", 3), IndexKey.of("b", 2), IndexKey.of("b", 3))
        .inOrder();
    assertThat(result.get("b", 2)).isEqualTo("e[b,2]");
  }

  @Test
  public void conditionalIndexing() {
    IndexedContainer<?> result = populate("x[i in 1..3, j in 1..3; i < j]");
    assertThat(result).isInstanceOf(AssociativeMap.class);
    assertThat(result.keys())
        .containsExactly(IndexKey.of(1, 2), IndexKey.of(1, 3), IndexKey.of(2, 3))
        .inOrder();
  }

  @Test
  public void dependentIndexSets() {
    IndexedContainer<?> result = populate("x[i in 1..3, j in i..3]");
    assertThat(result).isInstanceOf(AssociativeMap.class);
    assertThat(result.size()).isEqualTo(6);
    assertThat(result.get(2, 2)).isEqualTo("e[2,2]");
    assertThat(result.get(2, 1)).isNull();
  }

  @Test
  public void indexNamesAreScoped() {
    // j's set refers to i, and the filter to both.
    IndexedContainer<?> result = populate("x[i in 1..2, j in [i, i + 10]; j != 11]");
    assertThat(result.keys())
        .containsExactly(IndexKey.of(1, 1), IndexKey.of(2, 2), IndexKey.of(2, 12))
        .inOrder();
    assertThat(scope.isBound("i")).isFalse();
  }

  @Test
  public void repeatedKey() {
    scope.bind("S", ImmutableList.of("a", "b", "a"));
    CompileError e =
        assertThrows(
            CompileError.DuplicateKeyError.class,
            () -> populate("x[s in S]", ContainerKind.ASSOCIATIVE_MAP));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("In test: Repeated index \"a\". Index sets must have unique elements.");
    assertThrows(CompileError.DuplicateKeyError.class, () -> populate("x[s in S]"));
  }

  @Test
  public void integralDoublesAreIntegerKeys() {
    scope.bind("S", ImmutableList.of(1, 1.0));
    CompileError e =
        assertThrows(
            CompileError.DuplicateKeyError.class,
            () -> populate("x[s in S]", ContainerKind.ASSOCIATIVE_MAP));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("In test: Repeated index 1. Index sets must have unique elements.");
    assertThrows(CompileError.DuplicateKeyError.class, () -> populate("x[s in S]"));

    scope.bind("T", ImmutableList.of(2.0, 3.0));
    IndexedContainer<?> result = populate("x[t in T]");
    assertThat(result).isInstanceOf(AxisArray.class);
    assertThat(result.get(3)).isEqualTo("e[3]");
    assertThat(result.get(3.0)).isEqualTo("e[3]");
    assertThat(result.keys()).containsExactly(IndexKey.of(2), IndexKey.of(3)).inOrder();
  }

  @Test
  public void elementsMustHaveTheDeclaredType() {
    ContainerPlan plan =
        ContainerSynthesizer.synthesize(containerSpec("x[i in 1..2]", Integer.class), CONTEXT);
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class,
            () -> loopBuilder.build(plan, elementBuilder()).populate(scope));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Expected an element of type Integer, got e[1] (String)");
    assertThat(built).containsExactly(IndexKey.of(1));

    ContainerPlan strings =
        ContainerSynthesizer.synthesize(containerSpec("x[i in 1..2]", String.class), CONTEXT);
    assertThat(loopBuilder.build(strings, elementBuilder()).populate(scope))
        .isInstanceOf(DenseArray.class);
  }

  @Test
  public void arrayRequiresOneBasedRanges() {
    scope.bind("S", ImmutableList.of(2, 3));
    CompileError e =
        assertThrows(CompileError.class, () -> populate("x[s in S]", ContainerKind.DENSE_ARRAY));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "In test: Index set S is not of the form 1..N, as required by an Array container");
    scope.bind("T", ImmutableList.of(1, 2));
    assertThat(populate("x[t in T]", ContainerKind.DENSE_ARRAY)).isInstanceOf(DenseArray.class);
  }

  @Test
  public void badIndexSet() {
    CompileError e = assertThrows(CompileError.class, () -> populate("x[i in 3]"));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("In test: Expected index set 3 to be a list or range, got 3 (Integer)");
  }

  @Test
  public void symmetric() {
    IndexedContainer<?> result = populateSymmetric("x[i in 1..3, j in 1..3]");
    assertThat(result).isInstanceOf(DenseArray.class);
    assertThat(built).hasSize(6);
    assertThat(built).doesNotContain(IndexKey.of(2, 1));
    assertThat(result.get(2, 1)).isSameInstanceAs(result.get(1, 2));
    assertThat(result.get(2, 1)).isEqualTo("e[1,2]");
    assertThat(result.get(3, 3)).isEqualTo("e[3,3]");
  }

  @Test
  public void symmetricRequirements() {
    scope.bind("S", ImmutableList.of(1, 2));
    assertSymmetricError(
        "x[i in 1..3, j in 1..3; i != j]",
        "Cannot have conditional indexing for symmetric variables");
    assertSymmetricError("x[i in 1..3]", "Symmetric variables must be 2-dimensional");
    assertSymmetricError(
        "x[i in 1..3, j in 1..i]", "Cannot have index dependencies in symmetric variables");
    assertSymmetricError(
        "x[i in S, j in S]", "Index sets for symmetric variables must be ranges of the form 1..N");
    assertSymmetricError(
        "x[i in 1..2, j in 1..3]",
        "Cannot construct symmetric variables with nonsquare dimensions");
    assertThat(built).isEmpty();
  }

  private void assertSymmetricError(String ref, String message) {
    CompileError e = assertThrows(CompileError.class, () -> populateSymmetric(ref));
    assertThat(e).hasMessageThat().isEqualTo("In test: " + message);
  }
}
