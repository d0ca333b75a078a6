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
package org.rubysexp.sexp;

import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * A realized range literal, the value of a folded {@code lit} node.
 *
 * @param begin The lower bound, or null for a beginless range.
 * @param end The upper bound, or null for an endless range.
 * @param excludeEnd Whether the range was written with {@code ...}.
 */
public record RubyRange(@Nullable Number begin, @Nullable Number end, boolean excludeEnd)
    implements Serializable {

  @Override
  public String toString() {
    String dots = excludeEnd ? "..." : "..";
    if (begin == null && end == null) {
      return "nil" + dots + "nil";
    }
    return (begin == null ? "" : begin.toString()) + dots + (end == null ? "" : end.toString());
  }
}
