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
import org.jspecify.annotations.Nullable;

/**
 * A container of elements, one for each of its keys. A key is an {@link IndexKey} with one
 * component per dimension.
 *
 * <p>There are three implementations:
 *
 * <ul>
 *   <li>{@link DenseArray}: every index ranges over {@code 1..n}.
 *   <li>{@link AxisArray}: every index ranges over an arbitrary list of distinct values.
 *   <li>{@link AssociativeMap}: an arbitrary set of keys, in insertion order.
 * </ul>
 *
 * <p>Elements of a DenseArray or AxisArray may be absent until they are stored; an AssociativeMap
 * contains exactly the keys that have been stored.
 */
public abstract class IndexedContainer<T> {

  IndexedContainer() {}

  /** The number of components in each key. */
  public abstract int dimensions();

  /** Returns the element with the given key, or null if there is none. */
  public abstract @Nullable T get(IndexKey key);

  /** Returns the element with the given index values, or null if there is none. */
  public @Nullable T get(Object... components) {
    return get(IndexKey.of(components));
  }

  /** Returns true if an element has been stored with the given key. */
  public boolean containsKey(IndexKey key) {
    return get(key) != null;
  }

  /**
   * Stores an element. Throws an IllegalArgumentException if the key is not valid for this
   * container.
   */
  public abstract void put(IndexKey key, T element);

  /** The keys of all stored elements, in iteration order. */
  public abstract ImmutableList<IndexKey> keys();

  /** The stored elements, in the order of {@link #keys}. */
  public ImmutableList<T> values() {
    ImmutableList.Builder<T> builder = ImmutableList.builder();
    for (IndexKey key : keys()) {
      builder.add(get(key));
    }
    return builder.build();
  }

  /** The number of stored elements. */
  public int size() {
    return keys().size();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append("{");
    boolean first = true;
    for (IndexKey key : keys()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(key).append("=").append(get(key));
    }
    return sb.append("}").toString();
  }
}
