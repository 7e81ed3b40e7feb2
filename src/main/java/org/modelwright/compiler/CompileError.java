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

/**
 * Thrown when a statement cannot be compiled. The message includes the position of the statement
 * in the source text, when it is known.
 *
 * <p>The nested subclasses distinguish the reasons a well-formed statement may still be rejected;
 * syntax errors and errors evaluating expressions are plain CompileErrors.
 */
public class CompileError extends RuntimeException {
  public final String msg;

  /** The (1-based) line number of the statement, or zero if it is not known. */
  public final int lineNum;

  public final int charPositionInLine;

  public CompileError(String msg, int lineNum, int charPositionInLine) {
    super(msg);
    this.msg = msg;
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
  }

  @Override
  public String getMessage() {
    return (lineNum == 0) ? msg : String.format("%s (%s:%s)", msg, lineNum, charPositionInLine);
  }

  /** The statement is malformed; detected before any entity is built. */
  public static class SpecificationError extends CompileError {
    public SpecificationError(String msg, int lineNum, int charPositionInLine) {
      super(msg, lineNum, charPositionInLine);
    }
  }

  /** An index tuple occurred twice while populating an associative container. */
  public static class DuplicateKeyError extends CompileError {
    public DuplicateKeyError(String msg, int lineNum, int charPositionInLine) {
      super(msg, lineNum, charPositionInLine);
    }
  }

  /** No entity builder accepts the given function and set. */
  public static class BuilderDispatchError extends CompileError {
    public BuilderDispatchError(String msg, int lineNum, int charPositionInLine) {
      super(msg, lineNum, charPositionInLine);
    }
  }
}
