/*
 * Copyright 2024 The Ruby Sexp Translator Authors.
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
package org.rubysexp.prism;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;

/**
 * A line span in some piece of source code.
 *
 * @param startLine One-indexed line on which the span starts.
 * @param endLine One-indexed line on which the span ends, inclusive.
 */
public record Location(int startLine, int endLine) implements Serializable {
  public Location {
    checkArgument(startLine >= 1, "startLine must be one-indexed: %s", startLine);
    checkArgument(endLine >= startLine, "endLine %s precedes startLine %s", endLine, startLine);
  }

  /** A span covering a single line. */
  public static Location line(int line) {
    return new Location(line, line);
  }

  public static Location lines(int startLine, int endLine) {
    return new Location(startLine, endLine);
  }

  @Override
  public String toString() {
    return startLine == endLine ? String.valueOf(startLine) : startLine + "-" + endLine;
  }
}
