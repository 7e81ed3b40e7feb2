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
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Base class for containers whose keys are the cartesian product of one list of values per axis.
 * Elements are stored in a flat array in row-major order (the last index varies fastest), which
 * is also the order of {@link #keys}.
 */
public abstract class RectangularContainer<T> extends IndexedContainer<T> {
  private final ImmutableList<ImmutableList<Object>> axes;
  private final Object[] elements;

  RectangularContainer(List<? extends List<?>> axes) {
    ImmutableList.Builder<ImmutableList<Object>> builder = ImmutableList.builder();
    int total = 1;
    for (List<?> axis : axes) {
      builder.add(ImmutableList.copyOf(axis));
      total = Math.multiplyExact(total, axis.size());
    }
    this.axes = builder.build();
    this.elements = new Object[total];
  }

  @Override
  public int dimensions() {
    return axes.size();
  }

  /** The values of the given axis (numbered from zero), in order. */
  public ImmutableList<Object> axis(int i) {
    return axes.get(i);
  }

  /** The number of values of the given axis. */
  public int length(int i) {
    return axes.get(i).size();
  }

  /**
   * Returns the position (from zero) of {@code value} on the given axis, or -1 if it is not one of
   * the axis values.
   */
  abstract int position(int axis, Object value);

  /** Returns the index in {@link #elements} for the given key, or -1 if it is not a valid key. */
  private int offset(IndexKey key) {
    if (key.size() != axes.size()) {
      return -1;
    }
    int result = 0;
    for (int i = 0; i < axes.size(); i++) {
      int pos = position(i, key.get(i));
      if (pos < 0) {
        return -1;
      }
      result = result * axes.get(i).size() + pos;
    }
    return result;
  }

  /** Returns the element at the given zero-based positions, or null if none has been stored. */
  @SuppressWarnings("unchecked")
  public @Nullable T getAt(int... positions) {
    Preconditions.checkArgument(positions.length == axes.size());
    int result = 0;
    for (int i = 0; i < positions.length; i++) {
      Preconditions.checkElementIndex(positions[i], axes.get(i).size());
      result = result * axes.get(i).size() + positions[i];
    }
    return (T) elements[result];
  }

  @Override
  @SuppressWarnings("unchecked")
  public @Nullable T get(IndexKey key) {
    int offset = offset(key);
    return (offset < 0) ? null : (T) elements[offset];
  }

  @Override
  public void put(IndexKey key, T element) {
    int offset = offset(key);
    Preconditions.checkArgument(offset >= 0, "%s is not a valid key for %s", key, this);
    elements[offset] = element;
  }

  @Override
  public ImmutableList<IndexKey> keys() {
    ImmutableList.Builder<IndexKey> builder = ImmutableList.builder();
    Object[] components = new Object[axes.size()];
    addKeys(builder, components, 0);
    return builder.build();
  }

  private void addKeys(ImmutableList.Builder<IndexKey> builder, Object[] components, int axis) {
    if (axis == components.length) {
      if (get(IndexKey.of(components)) != null) {
        builder.add(IndexKey.of(components));
      }
      return;
    }
    for (Object value : axes.get(axis)) {
      components[axis] = value;
      addKeys(builder, components, axis + 1);
    }
  }

  /**
   * Returns the elements as nested lists: a list of the elements for a one-dimensional container,
   * a list of rows for a two-dimensional container, and so on. Every element must have been stored.
   */
  public ImmutableList<Object> toNestedList() {
    return nested(0, 0);
  }

  private ImmutableList<Object> nested(int axis, int offset) {
    ImmutableList.Builder<Object> builder = ImmutableList.builder();
    int n = axes.get(axis).size();
    for (int i = 0; i < n; i++) {
      int next = offset * n + i;
      builder.add((axis == axes.size() - 1) ? elements[next] : nested(axis + 1, next));
    }
    return builder.build();
  }
}
