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

import static com.google.common.base.Preconditions.checkNotNull;

import java.text.MessageFormat;
import org.rubysexp.prism.ParseError;

/**
 * A kind of error the translator reports, with a {@link MessageFormat} pattern over the file
 * name, the line and the parser's message, in that order.
 */
public final class DiagnosticType {

  /** Names the error, e.g. in logs. */
  public final String key;

  public final String format;

  public static DiagnosticType error(String key, String format) {
    return new DiagnosticType(checkNotNull(key), checkNotNull(format));
  }

  private DiagnosticType(String key, String format) {
    this.key = key;
    this.format = format;
  }

  /** Describes {@code error}, found in {@code fileName}. Lines are not number-formatted. */
  String describe(String fileName, ParseError error) {
    return format(fileName, String.valueOf(error.startLine()), error.message());
  }

  String format(String... arguments) {
    return new MessageFormat(format).format(arguments);
  }
}
