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
 * A complex number, the value of an imaginary literal such as {@code 2i}.
 *
 * @param real The real part; always zero for a literal.
 * @param imaginary The imaginary part: an integer, float or {@link RubyRational}.
 */
public record RubyComplex(Number real, Number imaginary) implements Serializable {
  public RubyComplex {
    requireNonNull(real, "real");
    requireNonNull(imaginary, "imaginary");
  }

  /** The value of the literal {@code <imaginary>i}. */
  public static RubyComplex imaginary(Number imaginary) {
    return new RubyComplex(0L, imaginary);
  }

  @Override
  public String toString() {
    String sign = imaginary.toString().startsWith("-") ? "" : "+";
    String unit = imaginary instanceof RubyRational ? "*i" : "i";
    return "(" + real + sign + imaginary + unit + ")";
  }
}
