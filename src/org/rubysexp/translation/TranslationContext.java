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

import org.jspecify.annotations.Nullable;
import org.rubysexp.prism.Location;
import org.rubysexp.prism.Node;
import org.rubysexp.sexp.Sexp;
import org.rubysexp.sexp.SexpTag;

/**
 * The state shared by one translation: the name of the file being translated. Every Sexp the
 * translation emits is made here, so that each carries this file and the lines of the node it
 * came from.
 */
public final class TranslationContext {
  private final String fileName;

  public TranslationContext(String fileName) {
    this.fileName = checkNotNull(fileName);
  }

  public String getFileName() {
    return fileName;
  }

  /** Creates a Sexp spanning the lines of {@code n}. */
  public Sexp build(Node n, SexpTag tag, @Nullable Object... values) {
    return build(n.getLocation(), tag, values);
  }

  /** Creates a Sexp spanning {@code location}. */
  public Sexp build(Location location, SexpTag tag, @Nullable Object... values) {
    return Sexp.create(tag, location.startLine(), location.endLine(), fileName, values);
  }
}
