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
package org.rubysexp.translation;

import org.rubysexp.prism.Node;

/**
 * Indicates that a node was handed to {@link SexpCompiler#visit} that only has meaning as part
 * of its parent, such as a raw argument list. This is a bug in the caller, not bad input.
 */
public final class DispatchInvariantViolation extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  DispatchInvariantViolation(String message) {
    super(message);
  }

  static DispatchInvariantViolation notDispatchable(Node n) {
    return new DispatchInvariantViolation("Cannot visit " + n.getKind() + " directly: " + n);
  }
}
