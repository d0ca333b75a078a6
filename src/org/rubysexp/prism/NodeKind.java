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
 * The kinds of node a prism syntax tree is made of.
 *
 * <p>The set is closed: every consumer that switches over it is expected to handle each constant,
 * so adding a kind here is a compile error everywhere a handler is missing.
 */
public enum NodeKind {
  ALIAS_GLOBAL_VARIABLE, // alias $foo $bar
  ALIAS_METHOD, // alias foo bar
  ALTERNATION_PATTERN, // foo => bar | baz
  AND, // a and b
  ARGUMENTS, // the argument list of a call, only meaningful inside its parent
  ARRAY, // [a, b]
  ARRAY_PATTERN, // foo => [bar]
  ASSOC, // { a: 1 } pair
  ASSOC_SPLAT, // { **foo }
  BACK_REFERENCE_READ, // $+
  BEGIN, // begin ... rescue ... else ... ensure ... end
  BLOCK, // { |x| ... } attached to a call
  BLOCK_ARGUMENT, // foo(&bar)
  BLOCK_LOCAL_VARIABLE, // foo { |; bar| }
  BLOCK_PARAMETER, // def foo(&bar)
  BLOCK_PARAMETERS, // foo { |bar| }
  BREAK, // break foo
  CALL, // foo.bar(baz)
  CALL_AND_WRITE, // foo.bar &&= baz
  CALL_OPERATOR_WRITE, // foo.bar += baz
  CALL_OR_WRITE, // foo.bar ||= baz
  CALL_TARGET, // foo.bar, = 1
  CAPTURE_PATTERN, // foo => bar => baz
  CASE, // case foo; when bar; end
  CASE_MATCH, // case foo; in bar; end
  CLASS, // class Foo; end
  CLASS_VARIABLE_AND_WRITE, // @@foo &&= bar
  CLASS_VARIABLE_OPERATOR_WRITE, // @@foo += bar
  CLASS_VARIABLE_OR_WRITE, // @@foo ||= bar
  CLASS_VARIABLE_READ, // @@foo
  CLASS_VARIABLE_TARGET, // @@foo, = bar
  CLASS_VARIABLE_WRITE, // @@foo = 1
  CONSTANT_AND_WRITE, // Foo &&= bar
  CONSTANT_OPERATOR_WRITE, // Foo += bar
  CONSTANT_OR_WRITE, // Foo ||= bar
  CONSTANT_PATH, // Foo::Bar
  CONSTANT_PATH_AND_WRITE, // Foo::Bar &&= baz
  CONSTANT_PATH_OPERATOR_WRITE, // Foo::Bar += baz
  CONSTANT_PATH_OR_WRITE, // Foo::Bar ||= baz
  CONSTANT_PATH_TARGET, // Foo::Bar, = baz
  CONSTANT_PATH_WRITE, // Foo::Bar = 1
  CONSTANT_READ, // Foo
  CONSTANT_TARGET, // Foo, = bar
  CONSTANT_WRITE, // Foo = 1
  DEF, // def foo; end
  DEFINED, // defined?(a)
  ELSE, // else branch of if/case/begin
  EMBEDDED_STATEMENTS, // "#{bar}"
  EMBEDDED_VARIABLE, // "#@bar"
  ENSURE, // ensure clause of begin
  FALSE, // false
  FIND_PATTERN, // foo => [*, bar, *]
  FLIP_FLOP, // if foo .. bar; end
  FLOAT, // 1.0
  FOR, // for foo in bar do end
  FORWARDING_ARGUMENTS, // bar(...)
  FORWARDING_PARAMETER, // def foo(...)
  FORWARDING_SUPER, // super
  GLOBAL_VARIABLE_AND_WRITE, // $foo &&= bar
  GLOBAL_VARIABLE_OPERATOR_WRITE, // $foo += bar
  GLOBAL_VARIABLE_OR_WRITE, // $foo ||= bar
  GLOBAL_VARIABLE_READ, // $foo
  GLOBAL_VARIABLE_TARGET, // $foo, = bar
  GLOBAL_VARIABLE_WRITE, // $foo = 1
  HASH, // { a: 1 }
  HASH_PATTERN, // foo => { a: }
  IF, // if foo then bar end
  IMAGINARY, // 1i
  IMPLICIT, // { foo: } value
  IMPLICIT_REST, // foo { |bar,| }
  IN, // in clause of case/in
  INDEX_AND_WRITE, // foo[bar] &&= baz
  INDEX_OPERATOR_WRITE, // foo[bar] += baz
  INDEX_OR_WRITE, // foo[bar] ||= baz
  INDEX_TARGET, // foo[bar], = 1
  INSTANCE_VARIABLE_AND_WRITE, // @foo &&= bar
  INSTANCE_VARIABLE_OPERATOR_WRITE, // @foo += bar
  INSTANCE_VARIABLE_OR_WRITE, // @foo ||= bar
  INSTANCE_VARIABLE_READ, // @foo
  INSTANCE_VARIABLE_TARGET, // @foo, = bar
  INSTANCE_VARIABLE_WRITE, // @foo = 1
  INTEGER, // 1
  INTERPOLATED_MATCH_LAST_LINE, // if /foo #{bar}/ then end
  INTERPOLATED_REGULAR_EXPRESSION, // /foo #{bar}/
  INTERPOLATED_STRING, // "foo #{bar}"
  INTERPOLATED_SYMBOL, // :"foo #{bar}"
  INTERPOLATED_X_STRING, // `foo #{bar}`
  IT_PARAMETERS, // the implicit `it` parameter marker of a block
  KEYWORD_HASH, // foo(bar: baz)
  KEYWORD_REST_PARAMETER, // def foo(**bar)
  LAMBDA, // -> {}
  LOCAL_VARIABLE_AND_WRITE, // foo &&= bar
  LOCAL_VARIABLE_OPERATOR_WRITE, // foo += bar
  LOCAL_VARIABLE_OR_WRITE, // foo ||= bar
  LOCAL_VARIABLE_READ, // foo
  LOCAL_VARIABLE_TARGET, // foo, = bar
  LOCAL_VARIABLE_WRITE, // foo = 1
  MATCH_LAST_LINE, // if /foo/ then end
  MATCH_PREDICATE, // foo in bar
  MATCH_REQUIRED, // foo => bar
  MATCH_WRITE, // /(?<foo>foo)/ =~ bar
  MISSING, // placeholder for a syntax error
  MODULE, // module Foo; end
  MULTI_TARGET, // (foo, bar), = baz
  MULTI_WRITE, // foo, bar = baz
  NEXT, // next foo
  NIL, // nil
  NO_KEYWORDS_PARAMETER, // def foo(**nil)
  NUMBERED_PARAMETERS, // the _1.._9 parameter marker of a block
  NUMBERED_REFERENCE_READ, // $1
  OPTIONAL_KEYWORD_PARAMETER, // def foo(bar: baz)
  OPTIONAL_PARAMETER, // def foo(bar = 1)
  OR, // a or b
  PARAMETERS, // def foo(bar, *baz)
  PARENTHESES, // (1)
  PINNED_EXPRESSION, // foo => ^(bar)
  PINNED_VARIABLE, // foo => ^bar
  POST_EXECUTION, // END {}
  PRE_EXECUTION, // BEGIN {}
  PROGRAM, // the root of every tree
  RANGE, // 0..5
  RATIONAL, // 1r
  REDO, // redo
  REGULAR_EXPRESSION, // /foo/
  REQUIRED_KEYWORD_PARAMETER, // def foo(bar:)
  REQUIRED_PARAMETER, // def foo(bar)
  RESCUE, // rescue clause of begin
  RESCUE_MODIFIER, // foo rescue bar
  REST_PARAMETER, // def foo(*bar)
  RETRY, // retry
  RETURN, // return 1
  SELF, // self
  SINGLETON_CLASS, // class << self; end
  SOURCE_ENCODING, // __ENCODING__
  SOURCE_FILE, // __FILE__
  SOURCE_LINE, // __LINE__
  SPLAT, // foo(*bar)
  STATEMENTS, // a list of statements
  STRING, // "foo"
  SUPER, // super(foo)
  SYMBOL, // :foo
  TRUE, // true
  UNDEF, // undef foo
  UNLESS, // unless foo; bar end
  UNTIL, // until foo; bar end
  WHEN, // when clause of case
  WHILE, // while foo; bar end
  X_STRING, // `foo`
  YIELD, // yield 1
}
