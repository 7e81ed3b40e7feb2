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
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * An IndexedContainer with an arbitrary set of keys. Used for filtered index sets and for index
 * sets that depend on earlier indices, where the keys need not form a rectangle.
 */
public final class AssociativeMap<T> extends IndexedContainer<T> {
  private final int dimensions;
  private final Map<IndexKey, T> elements = new LinkedHashMap<>();

  public AssociativeMap(int dimensions) {
    this.dimensions = dimensions;
  }

  @Override
  public int dimensions() {
    return dimensions;
  }

  @Override
  public @Nullable T get(IndexKey key) {
    return elements.get(key);
  }

  @Override
  public boolean containsKey(IndexKey key) {
    return elements.containsKey(key);
  }

  @Override
  public void put(IndexKey key, T element) {
    Preconditions.checkArgument(
        key.size() == dimensions, "%s is not a valid key for %s", key, this);
    elements.put(key, element);
  }

  @Override
  public ImmutableList<IndexKey> keys() {
    return ImmutableList.copyOf(elements.keySet());
  }

  @Override
  public ImmutableList<T> values() {
    return ImmutableList.copyOf(elements.values());
  }

  @Override
  public int size() {
    return elements.size();
  }
}
