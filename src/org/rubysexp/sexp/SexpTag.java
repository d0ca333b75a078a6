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

import com.google.common.base.Ascii;

/**
 * The closed vocabulary of head tags used by the ruby_parser s-expression format.
 *
 * <p>The name a tag is printed with is the lower-case spelling of the constant.
 */
public enum SexpTag {
  ALIAS,
  AND,
  ARGLIST,
  ARGS,
  ARRAY,
  ARRAY_PAT,
  ATTRASGN,
  BACK_REF,
  BEGIN,
  BLOCK,
  BLOCK_PASS,
  BREAK,
  CALL,
  CASE,
  CDECL,
  CLASS,
  COLON2,
  COLON3,
  CONST,
  CVAR,
  CVDECL,
  DEF,
  DEFINED,
  DEFN,
  DEFS,
  DOT2,
  DOT3,
  DREGX,
  DSTR,
  DSYM,
  DXSTR,
  ENSURE,
  EVSTR,
  FALSE,
  FIND_PAT,
  FLIP2,
  FLIP3,
  FOR,
  FORWARD_ARGS,
  GASGN,
  GVAR,
  HASH,
  HASH_PAT,
  IASGN,
  IF,
  IN,
  ITER,
  IVAR,
  KWARG,
  KWREST,
  KWSPLAT,
  LAMBDA,
  LASGN,
  LIT,
  LVAR,
  MASGN,
  MATCH2,
  MATCH3,
  MODULE,
  NEXT,
  NIL,
  NOT,
  NTH_REF,
  OP_ASGN,
  OP_ASGN1,
  OP_ASGN2,
  OP_ASGN_AND,
  OP_ASGN_OR,
  OR,
  POSTEXE,
  PREEXE,
  REDO,
  RESBODY,
  RESCUE,
  RETRY,
  RETURN,
  SAFE_ATTRASGN,
  SAFE_CALL,
  SCLASS,
  SELF,
  SHADOW,
  SPLAT,
  STR,
  SUPER,
  SVALUE,
  TO_ARY,
  TRUE,
  UNDEF,
  UNTIL,
  VALIAS,
  WHEN,
  WHILE,
  XSTR,
  YIELD,
  ZSUPER;

  private final String tagName = Ascii.toLowerCase(name());

  /** The name of this tag as ruby_parser spells it, e.g. {@code op_asgn_and}. */
  public String getTagName() {
    return tagName;
  }

  @Override
  public String toString() {
    return tagName;
  }
}
