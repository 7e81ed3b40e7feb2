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

import com.google.errorprone.annotations.FormatMethod;
import org.modelwright.container.IndexKey;

/**
 * Identifies the statement being compiled, so that errors can point back to it. An ErrorContext is
 * passed to every step that may reject a statement; each of its methods returns (rather than
 * throws) a CompileError whose message starts with "{@code In <label>: }".
 */
public final class ErrorContext {
  /** A description of the statement, e.g. {@code "constraint(c[i in 1..3]: x[i] <= i)"}. */
  public final String label;

  public final int lineNum;
  public final int charPositionInLine;

  public ErrorContext(String label, int lineNum, int charPositionInLine) {
    this.label = label;
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
  }

  /** Returns an ErrorContext with no source position. */
  public static ErrorContext of(String label) {
    return new ErrorContext(label, 0, 0);
  }

  private String message(String fmt, Object... fmtArgs) {
    return "In " + label + ": " + String.format(fmt, fmtArgs);
  }

  /** Returns a new CompileError for a problem that none of the more specific kinds describe. */
  @FormatMethod
  public CompileError error(String fmt, Object... fmtArgs) {
    return new CompileError(message(fmt, fmtArgs), lineNum, charPositionInLine);
  }

  @FormatMethod
  public CompileError.SpecificationError specificationError(String fmt, Object... fmtArgs) {
    return new CompileError.SpecificationError(
        message(fmt, fmtArgs), lineNum, charPositionInLine);
  }

  /** Returns a new "Repeated index" error for the given key. */
  public CompileError.DuplicateKeyError duplicateKey(IndexKey key) {
    return new CompileError.DuplicateKeyError(
        message("Repeated index %s. Index sets must have unique elements.", key),
        lineNum,
        charPositionInLine);
  }

  @FormatMethod
  public CompileError.BuilderDispatchError dispatchError(String fmt, Object... fmtArgs) {
    return new CompileError.BuilderDispatchError(
        message(fmt, fmtArgs), lineNum, charPositionInLine);
  }

  @Override
  public String toString() {
    return label;
  }
}
