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

package org.modelwright.container;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A RectangularContainer whose axis {@code i} has the values {@code 1..lengths[i]}. */
public final class DenseArray<T> extends RectangularContainer<T> {

  private DenseArray(List<IntRange> axes) {
    super(axes);
  }

  /** Returns an empty DenseArray with the given lengths. */
  public static <T> DenseArray<T> withLengths(int... lengths) {
    ImmutableList.Builder<IntRange> axes = ImmutableList.builder();
    for (int length : lengths) {
      axes.add(new IntRange(1, length));
    }
    return new DenseArray<>(axes.build());
  }

  @Override
  int position(int axis, Object value) {
    if (value instanceof Integer i && i >= 1 && i <= length(axis)) {
      return i - 1;
    }
    return -1;
  }
}
