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

package org.modelwright.entity;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The description of a scalar decision variable: its optional bounds, fixed value and starting
 * value, and whether it is restricted to integer or binary values.
 *
 * <p>ScalarVariables are immutable; use {@link #builder} to create one.
 */
public final class ScalarVariable {
  public final @Nullable Double lowerBound;
  public final @Nullable Double upperBound;
  public final @Nullable Double fixedValue;
  public final @Nullable Double start;
  public final boolean binary;
  public final boolean integer;

  private ScalarVariable(Builder builder) {
    this.lowerBound = builder.lowerBound;
    this.upperBound = builder.upperBound;
    this.fixedValue = builder.fixedValue;
    this.start = builder.start;
    this.binary = builder.binary;
    this.integer = builder.integer;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** A variable with no bounds, no start value and no integrality restriction. */
  public static ScalarVariable free() {
    return new Builder().build();
  }

  @Override
  public String toString() {
    List<String> parts = new ArrayList<>();
    if (lowerBound != null) {
      parts.add("lb=" + lowerBound);
    }
    if (upperBound != null) {
      parts.add("ub=" + upperBound);
    }
    if (fixedValue != null) {
      parts.add("fix=" + fixedValue);
    }
    if (start != null) {
      parts.add("start=" + start);
    }
    if (binary) {
      parts.add("binary");
    }
    if (integer) {
      parts.add("integer");
    }
    return "ScalarVariable" + parts;
  }

  /** Collects the attributes of a ScalarVariable; each may be set at most once. */
  public static final class Builder {
    private Double lowerBound;
    private Double upperBound;
    private Double fixedValue;
    private Double start;
    private boolean binary;
    private boolean integer;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setLowerBound(double value) {
      Preconditions.checkState(lowerBound == null);
      lowerBound = value;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setUpperBound(double value) {
      Preconditions.checkState(upperBound == null);
      upperBound = value;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setFixedValue(double value) {
      Preconditions.checkState(fixedValue == null);
      fixedValue = value;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setStart(double value) {
      Preconditions.checkState(start == null);
      start = value;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setBinary() {
      binary = true;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setInteger() {
      integer = true;
      return this;
    }

    public ScalarVariable build() {
      return new ScalarVariable(this);
    }
  }
}
