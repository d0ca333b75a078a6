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

import static java.util.Objects.requireNonNull;

import java.io.Serializable;

/**
 * A regular expression literal, the value of a {@code lit} node.
 *
 * @param source The unescaped pattern text.
 * @param options The Ruby {@code Regexp#options} bit set.
 */
public record RubyRegexp(String source, int options) implements Serializable {
  public static final int IGNORECASE = 1;
  public static final int EXTENDED = 2;
  public static final int MULTILINE = 4;
  public static final int FIXEDENCODING = 16;
  public static final int NOENCODING = 32;

  public RubyRegexp {
    requireNonNull(source, "source");
  }

  public boolean hasOption(int option) {
    return (options & option) != 0;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("/").append(source).append('/');
    if (hasOption(MULTILINE)) {
      sb.append('m');
    }
    if (hasOption(IGNORECASE)) {
      sb.append('i');
    }
    if (hasOption(EXTENDED)) {
      sb.append('x');
    }
    if (hasOption(NOENCODING)) {
      sb.append('n');
    }
    return sb.toString();
  }
}
