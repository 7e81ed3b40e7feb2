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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A RectangularContainer whose axes are arbitrary lists of distinct values, e.g. {@code ["a",
 * "b"]} or {@code 2..4}.
 */
public final class AxisArray<T> extends RectangularContainer<T> {
  private final ImmutableList<ImmutableMap<Object, Integer>> positions;

  /** Throws an IllegalArgumentException if any axis has a repeated value. */
  public AxisArray(List<? extends List<?>> axes) {
    super(axes);
    ImmutableList.Builder<ImmutableMap<Object, Integer>> builder = ImmutableList.builder();
    for (List<?> axis : axes) {
      Map<Object, Integer> map = new HashMap<>();
      for (Object value : axis) {
        Integer prev = map.putIfAbsent(IndexKey.normalize(value), map.size());
        Preconditions.checkArgument(prev == null, "Repeated axis value %s", value);
      }
      builder.add(ImmutableMap.copyOf(map));
    }
    this.positions = builder.build();
  }

  @Override
  int position(int axis, Object value) {
    Integer result = positions.get(axis).get(IndexKey.normalize(value));
    return (result == null) ? -1 : result;
  }
}
