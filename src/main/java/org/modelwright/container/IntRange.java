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
import java.util.AbstractList;

/**
 * The integers {@code lo, lo + 1, ..., hi}, as written {@code lo..hi}. Empty if {@code hi < lo}.
 * A range may have at most {@code Integer.MAX_VALUE} elements.
 */
public final class IntRange extends AbstractList<Integer> {
  public final int lo;
  public final int hi;

  /** Throws an IllegalArgumentException if the range would be too long to index. */
  public IntRange(int lo, int hi) {
    Preconditions.checkArgument(
        (long) hi - lo < Integer.MAX_VALUE, "Range %s..%s has too many elements", lo, hi);
    this.lo = lo;
    this.hi = hi;
  }

  @Override
  public Integer get(int i) {
    if (i < 0 || i >= size()) {
      throw new IndexOutOfBoundsException(i);
    }
    return lo + i;
  }

  @Override
  public int size() {
    return (hi < lo) ? 0 : hi - lo + 1;
  }

  @Override
  public boolean contains(Object obj) {
    return obj instanceof Integer i && i >= lo && i <= hi;
  }

  @Override
  public String toString() {
    return lo + ".." + hi;
  }
}
