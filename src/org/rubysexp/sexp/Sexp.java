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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CheckReturnValue;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A node of a ruby_parser s-expression tree: a {@link SexpTag} followed by an ordered list of
 * elements.
 *
 * <p>Elements are symbols, strings, numbers, booleans, ranges, regexps, nested {@code Sexp}s or
 * null. Each value also records the lines it was built from and the file it belongs to. Those
 * are not part of {@link #equals}; use {@link #isEquivalentWithPositions} to compare them too.
 *
 * <p>Values are immutable. Methods that look like mutators return modified copies.
 */
public final class Sexp {

  private final SexpTag tag;
  private final List<@Nullable Object> elements;
  private final int startLine;
  private final int endLine;
  private final String file;

  private Sexp(
      SexpTag tag, List<@Nullable Object> elements, int startLine, int endLine, String file) {
    this.tag = tag;
    this.elements = elements;
    this.startLine = startLine;
    this.endLine = endLine;
    this.file = file;
  }

  public static Sexp create(
      SexpTag tag, int startLine, int endLine, String file, @Nullable Object... elements) {
    return create(tag, startLine, endLine, file, Arrays.asList(elements));
  }

  public static Sexp create(
      SexpTag tag, int startLine, int endLine, String file, List<?> elements) {
    checkNotNull(tag);
    checkNotNull(file);
    checkArgument(startLine >= 0 && endLine >= startLine, "bad span %s-%s", startLine, endLine);
    List<@Nullable Object> copy = new ArrayList<>(elements.size());
    for (Object element : elements) {
      copy.add(normalize(element));
    }
    return new Sexp(tag, Collections.unmodifiableList(copy), startLine, endLine, file);
  }

  /**
   * Checks that {@code element} may appear in a Sexp and boxes integers uniformly: as a Long
   * when the value fits, as a BigInteger otherwise.
   */
  private static @Nullable Object normalize(@Nullable Object element) {
    if (element == null
        || element instanceof Sexp
        || element instanceof RubySymbol
        || element instanceof String
        || element instanceof Long
        || element instanceof Double
        || element instanceof Boolean
        || element instanceof RubyRange
        || element instanceof RubyRegexp
        || element instanceof RubyRational
        || element instanceof RubyComplex) {
      return element;
    }
    if (element instanceof Integer || element instanceof Short || element instanceof Byte) {
      return ((Number) element).longValue();
    }
    if (element instanceof BigInteger) {
      BigInteger value = (BigInteger) element;
      return value.bitLength() < Long.SIZE ? (Object) value.longValue() : value;
    }
    throw new IllegalArgumentException(
        "Not a Sexp element: " + element + " (" + element.getClass().getName() + ")");
  }

  public SexpTag getTag() {
    return tag;
  }

  public boolean hasTag(SexpTag tag) {
    return this.tag == tag;
  }

  /** The elements following the tag. The list admits nulls and cannot be modified. */
  public List<@Nullable Object> getElements() {
    return elements;
  }

  public int size() {
    return elements.size();
  }

  public @Nullable Object get(int index) {
    checkElementIndex(index, elements.size());
    return elements.get(index);
  }

  /** Returns element {@code index}, which must be a nested Sexp. */
  public Sexp getSexp(int index) {
    Object element = get(index);
    checkArgument(element instanceof Sexp, "element %s of %s is not a Sexp", index, this);
    return (Sexp) element;
  }

  public int getStartLine() {
    return startLine;
  }

  public int getEndLine() {
    return endLine;
  }

  public String getFile() {
    return file;
  }

  /** Returns a copy with {@code element} appended. */
  @CheckReturnValue
  public Sexp plus(@Nullable Object element) {
    List<@Nullable Object> copy = new ArrayList<>(elements);
    copy.add(element);
    return create(tag, startLine, endLine, file, copy);
  }

  /** Returns a copy with {@code more} appended in order. */
  @CheckReturnValue
  public Sexp plusAll(List<?> more) {
    if (more.isEmpty()) {
      return this;
    }
    List<@Nullable Object> copy = new ArrayList<>(elements);
    copy.addAll(more);
    return create(tag, startLine, endLine, file, copy);
  }

  /** Returns a copy spanning the given lines. */
  @CheckReturnValue
  public Sexp withLines(int startLine, int endLine) {
    checkArgument(startLine >= 0 && endLine >= startLine, "bad span %s-%s", startLine, endLine);
    return new Sexp(tag, elements, startLine, endLine, file);
  }

  /** This value followed by all nested values, depth first. */
  public ImmutableList<Sexp> preOrder() {
    ImmutableList.Builder<Sexp> builder = ImmutableList.builder();
    List<Sexp> worklist = new ArrayList<>();
    worklist.add(this);
    while (!worklist.isEmpty()) {
      Sexp current = worklist.remove(worklist.size() - 1);
      builder.add(current);
      for (int i = current.elements.size() - 1; i >= 0; i--) {
        if (current.elements.get(i) instanceof Sexp) {
          worklist.add((Sexp) current.elements.get(i));
        }
      }
    }
    return builder.build();
  }

  /**
   * Whether {@code other} has the same structure and every pair of corresponding values also
   * agrees on start line, end line and file.
   */
  public boolean isEquivalentWithPositions(@Nullable Sexp other) {
    if (other == null
        || tag != other.tag
        || startLine != other.startLine
        || endLine != other.endLine
        || !file.equals(other.file)
        || elements.size() != other.elements.size()) {
      return false;
    }
    for (int i = 0; i < elements.size(); i++) {
      Object mine = elements.get(i);
      Object theirs = other.elements.get(i);
      if (mine instanceof Sexp && theirs instanceof Sexp) {
        if (!((Sexp) mine).isEquivalentWithPositions((Sexp) theirs)) {
          return false;
        }
      } else if (!Objects.equals(mine, theirs)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Sexp)) {
      return false;
    }
    Sexp that = (Sexp) other;
    return tag == that.tag && elements.equals(that.elements);
  }

  @Override
  public int hashCode() {
    return 31 * tag.hashCode() + elements.hashCode();
  }

  /** Prints this value compactly, e.g. {@code (lasgn :foo (lit 1))}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb);
    return sb.toString();
  }

  private void appendTo(StringBuilder sb) {
    sb.append('(').append(tag.getTagName());
    for (Object element : elements) {
      sb.append(' ');
      if (element instanceof Sexp) {
        ((Sexp) element).appendTo(sb);
      } else {
        sb.append(SexpPrinter.formatScalar(element, false));
      }
    }
    sb.append(')');
  }
}
