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

/**
 * Produces prism syntax trees from Ruby source.
 *
 * <p>The parser is supplied by the embedding application; this library only consumes its output.
 * Implementations must be safe to call from several threads if translators sharing them are.
 */
@FunctionalInterface
public interface PrismParser {

  /**
   * Parses {@code source}.
   *
   * @param source The Ruby source text.
   * @param fileName The name the source is known by, for error reporting.
   */
  ParseResult parse(String source, String fileName);
}
