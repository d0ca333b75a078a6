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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of parsing one piece of source: either a complete tree or the errors that kept the
 * parser from producing one.
 */
public final class ParseResult {

  private final @Nullable Node root;
  private final ImmutableList<ParseError> errors;

  private ParseResult(@Nullable Node root, ImmutableList<ParseError> errors) {
    this.root = root;
    this.errors = errors;
  }

  public static ParseResult success(Node root) {
    checkArgument(root.isKind(NodeKind.PROGRAM), "root must be a PROGRAM node: %s", root);
    return new ParseResult(root, ImmutableList.of());
  }

  public static ParseResult failure(List<ParseError> errors) {
    checkArgument(!errors.isEmpty(), "a failed parse reports at least one error");
    return new ParseResult(null, ImmutableList.copyOf(errors));
  }

  public boolean isSuccess() {
    return errors.isEmpty();
  }

  public boolean isFailure() {
    return !isSuccess();
  }

  /** The root PROGRAM node. Only available on success. */
  public Node getRoot() {
    checkState(isSuccess(), "parse failed: %s", errors);
    return checkNotNull(root);
  }

  /** The errors in the order the parser reported them; empty on success. */
  public ImmutableList<ParseError> getErrors() {
    return errors;
  }
}
