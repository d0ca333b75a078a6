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

import static java.util.Objects.requireNonNull;

import java.io.Serializable;

/**
 * A syntax error reported by the parser.
 *
 * @param message Description of the error.
 * @param location Where the error was found.
 */
public record ParseError(String message, Location location) implements Serializable {
  public ParseError {
    requireNonNull(message, "message");
    requireNonNull(location, "location");
  }

  public int startLine() {
    return location.startLine();
  }
}
