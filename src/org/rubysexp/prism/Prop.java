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

/** The named fields a {@link Node} may carry, each with the type of value it holds. */
public enum Prop {
  // Child nodes
  ARGUMENTS(Type.NODE), // an ARGUMENTS node
  BLOCK(Type.NODE), // a BLOCK or BLOCK_ARGUMENT node
  BODY(Type.NODE),
  CALL(Type.NODE),
  COLLECTION(Type.NODE),
  CONSEQUENT(Type.NODE),
  CONSTANT(Type.NODE),
  CONSTANT_PATH(Type.NODE),
  ELSE_CLAUSE(Type.NODE),
  ENSURE_CLAUSE(Type.NODE),
  EXPRESSION(Type.NODE),
  INDEX(Type.NODE),
  KEY(Type.NODE),
  KEYWORD_REST(Type.NODE),
  LEFT(Type.NODE),
  NEW_NAME(Type.NODE),
  NUMERIC(Type.NODE),
  OLD_NAME(Type.NODE),
  PARAMETERS(Type.NODE),
  PARENT(Type.NODE),
  PATTERN(Type.NODE),
  PREDICATE(Type.NODE),
  RECEIVER(Type.NODE),
  REFERENCE(Type.NODE),
  RESCUE_CLAUSE(Type.NODE),
  RESCUE_EXPRESSION(Type.NODE),
  REST(Type.NODE),
  RIGHT(Type.NODE),
  STATEMENTS(Type.NODE), // a STATEMENTS node
  SUPERCLASS(Type.NODE),
  TARGET(Type.NODE),
  VALUE(Type.NODE),
  VARIABLE(Type.NODE),

  // Ordered child lists
  ARGUMENT_LIST(Type.NODE_LIST),
  CONDITIONS(Type.NODE_LIST),
  ELEMENTS(Type.NODE_LIST),
  EXCEPTIONS(Type.NODE_LIST),
  KEYWORDS(Type.NODE_LIST),
  LEFTS(Type.NODE_LIST),
  LOCALS(Type.NODE_LIST),
  NAMES(Type.NODE_LIST),
  OPTIONALS(Type.NODE_LIST),
  PARTS(Type.NODE_LIST),
  POSTS(Type.NODE_LIST),
  REQUIREDS(Type.NODE_LIST),
  RIGHTS(Type.NODE_LIST),
  STATEMENT_LIST(Type.NODE_LIST),

  // Names and text
  CALL_OPERATOR(Type.STRING), // ".", "&." or "::"
  NAME(Type.STRING),
  OPENING(Type.STRING),
  OPERATOR(Type.STRING), // binary operator of an operator-write, e.g. "+"
  READ_NAME(Type.STRING),
  SYMBOL_VALUE(Type.STRING), // symbol text as written, before unescaping
  UNESCAPED(Type.STRING),
  WRITE_NAME(Type.STRING),

  // Already-parsed numbers
  DENOMINATOR(Type.NUMBER),
  NUMBER(Type.NUMBER),
  NUMERATOR(Type.NUMBER),

  // Auxiliary spans
  CLOSING_LOC(Type.LOCATION),
  CONTENT_LOC(Type.LOCATION),
  OPENING_LOC(Type.LOCATION),

  // Flags
  ASCII_8BIT(Type.FLAG),
  ATTRIBUTE_WRITE(Type.FLAG),
  BEGIN_MODIFIER(Type.FLAG),
  EUC_JP(Type.FLAG),
  EXCLUDE_END(Type.FLAG),
  EXTENDED(Type.FLAG),
  HEREDOC(Type.FLAG),
  IGNORE_CASE(Type.FLAG),
  MULTI_LINE(Type.FLAG),
  ONCE(Type.FLAG),
  SAFE_NAVIGATION(Type.FLAG),
  UTF_8(Type.FLAG),
  WINDOWS_31J(Type.FLAG);

  /** The type of value stored under a property. */
  public enum Type {
    NODE,
    NODE_LIST,
    STRING,
    NUMBER,
    LOCATION,
    FLAG
  }

  private final Type type;

  Prop(Type type) {
    this.type = type;
  }

  public Type getType() {
    return type;
  }
}
