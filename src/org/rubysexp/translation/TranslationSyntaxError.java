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

import org.rubysexp.prism.ParseError;

/**
 * Thrown when the source handed to the translator does not parse. The message has the form
 * {@code <file>:<line> :: <message>} and describes the first error the parser reported.
 */
public class TranslationSyntaxError extends Exception {
  private static final long serialVersionUID = 1L;

  static final DiagnosticType PARSE_ERROR =
      DiagnosticType.error("RUBY_PARSE_ERROR", "{0}:{1} :: {2}");

  private final String fileName;
  private final ParseError parseError;

  TranslationSyntaxError(String fileName, ParseError parseError) {
    super(PARSE_ERROR.describe(fileName, parseError));
    this.fileName = fileName;
    this.parseError = parseError;
  }

  public String getFileName() {
    return fileName;
  }

  public int getLine() {
    return parseError.startLine();
  }

  /** The parser's own report. */
  public ParseError getParseError() {
    return parseError;
  }
}
