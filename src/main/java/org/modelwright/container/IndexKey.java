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
import java.util.Arrays;
import java.util.List;

/**
 * The key of one element of an {@link IndexedContainer}: one value for each index. Integral
 * doubles are stored as integers, so {@code 1} and {@code 1.0} are the same key.
 */
public final class IndexKey {
  public final ImmutableList<Object> components;

  private IndexKey(ImmutableList<Object> components) {
    this.components = components;
  }

  public static IndexKey of(Object... components) {
    return of(Arrays.asList(components));
  }

  public static IndexKey of(List<?> components) {
    ImmutableList.Builder<Object> builder =
        ImmutableList.builderWithExpectedSize(components.size());
    components.forEach(c -> builder.add(normalize(c)));
    return new IndexKey(builder.build());
  }

  /** Returns {@code value} as an Integer if it is a Double with an int value. */
  public static Object normalize(Object value) {
    if (value instanceof Double d && d == Math.rint(d) && Math.abs(d) <= Integer.MAX_VALUE) {
      return d.intValue();
    }
    return value;
  }

  public int size() {
    return components.size();
  }

  public Object get(int i) {
    return components.get(i);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof IndexKey other && components.equals(other.components);
  }

  @Override
  public int hashCode() {
    return components.hashCode();
  }

  /** Returns "{@code 1}" for a single component, or "{@code (1, 2)}" for more than one. */
  @Override
  public String toString() {
    if (components.size() == 1) {
      return format(components.get(0));
    }
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < components.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      sb.append(format(components.get(i)));
    }
    return sb.append(")").toString();
  }

  /**
   * Returns the name of the element with this key in a container named {@code base}, e.g. {@code
   * "x[1,a]"}. Returns {@code base} if it is empty or this key has no components.
   */
  public String elementName(String base) {
    if (base.isEmpty() || components.isEmpty()) {
      return base;
    }
    StringBuilder sb = new StringBuilder(base).append('[');
    for (int i = 0; i < components.size(); i++) {
      if (i != 0) {
        sb.append(',');
      }
      sb.append(components.get(i));
    }
    return sb.append(']').toString();
  }

  /** Formats a single index value the way it appears in error messages; strings are quoted. */
  static String format(Object value) {
    if (value instanceof String s) {
      return '"' + s + '"';
    } else if (value instanceof Object[] array) {
      return Arrays.toString(array);
    }
    return String.valueOf(value);
  }
}
