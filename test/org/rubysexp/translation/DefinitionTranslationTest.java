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

import static org.junit.Assert.assertThrows;
import static org.rubysexp.testing.SexpSubject.assertSexp;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rubysexp.prism.IR;
import org.rubysexp.prism.Location;
import org.rubysexp.prism.Node;
import org.rubysexp.prism.Prop;
import org.rubysexp.sexp.Sexp;
import org.rubysexp.sexp.SexpTag;

/** Tests for methods, parameters, lambdas, classes, modules, alias and undef. */
@RunWith(JUnit4.class)
public final class DefinitionTranslationTest extends SexpCompilerTestCase {

  private static Node emptyDef(String name) {
    return IR.def(null, name, null, null);
  }

  @Test
  public void testDef() {
    test(emptyDef("foo"), "(defn :foo (args) (nil))");
    test(
        IR.def(
            null,
            "foo",
            IR.parameters(IR.requiredParameter("a")),
            IR.statements(IR.localRead("a"))),
        "(defn :foo (args :a) (lvar :a))");
  }

  @Test
  public void testSingletonDef() {
    test(
        IR.def(IR.self(), "foo", IR.parameters(), IR.statements(IR.integer(1))),
        "(defs (self) :foo (args) (lit 1))");
  }

  @Test
  public void testParameterOrder() {
    Node parameters =
        IR.parametersBuilder()
            .put(Prop.REQUIREDS, List.of(IR.requiredParameter("a")))
            .put(Prop.OPTIONALS, List.of(IR.optionalParameter("b", IR.integer(1))))
            .put(Prop.REST, IR.restParameter("c"))
            .put(Prop.POSTS, List.of(IR.requiredParameter("d")))
            .put(
                Prop.KEYWORDS,
                List.of(
                    IR.requiredKeywordParameter("e"),
                    IR.optionalKeywordParameter("f", IR.integer(2))))
            .put(Prop.KEYWORD_REST, IR.keywordRestParameter("g"))
            .put(Prop.BLOCK, IR.blockParameter("h"))
            .build();
    test(
        IR.def(null, "m", parameters, null),
        "(defn :m (args :a (lasgn :b (lit 1)) :*c :d (kwarg :e) (kwarg :f (lit 2)) :**g :&h)"
            + " (nil))");
  }

  @Test
  public void testAnonymousParameters() {
    Node parameters =
        IR.parametersBuilder()
            .put(Prop.REST, IR.restParameter(null))
            .put(Prop.KEYWORD_REST, IR.keywordRestParameter(null))
            .put(Prop.BLOCK, IR.blockParameter(null))
            .build();
    test(IR.def(null, "m", parameters, null), "(defn :m (args :* :** :&) (nil))");
  }

  @Test
  public void testNoKeywordsAndForwarding() {
    test(
        IR.def(
            null,
            "m",
            IR.parametersBuilder().put(Prop.KEYWORD_REST, IR.noKeywordsParameter()).build(),
            null),
        "(defn :m (args :**nil) (nil))");
    test(
        IR.def(
            null,
            "m",
            IR.parametersBuilder().put(Prop.KEYWORD_REST, IR.forwardingParameter()).build(),
            IR.statements(IR.call(null, "n", IR.forwardingArguments()))),
        "(defn :m (args (forward_args)) (call nil :n (forward_args)))");
  }

  @Test
  public void testDestructuredParameter() {
    Node inner = IR.multiTarget(List.of(IR.requiredParameter("b")), null, List.of());
    Node outer =
        IR.multiTarget(
            List.of(IR.requiredParameter("a"), inner),
            IR.splat(IR.requiredParameter("c")),
            List.of());
    test(
        IR.def(null, "m", IR.parameters(outer), null),
        "(defn :m (args (masgn :a (masgn :b) :*c)) (nil))");
  }

  @Test
  public void testDestructuredParameterRests() {
    Node anonymous =
        IR.multiTarget(List.of(IR.requiredParameter("a")), IR.splat(null), List.of());
    test(
        IR.def(null, "m", IR.parameters(anonymous), null),
        "(defn :m (args (masgn :a :*)) (nil))");

    Node trailingComma =
        IR.multiTarget(List.of(IR.requiredParameter("a")), IR.implicitRest(), List.of());
    test(
        IR.def(null, "m", IR.parameters(trailingComma), null),
        "(defn :m (args (masgn :a)) (nil))");
  }

  @Test
  public void testMalformedDestructuredParameter() {
    Node malformed = IR.multiTarget(List.of(IR.integer(1)), null, List.of());
    assertThrows(
        DispatchInvariantViolation.class,
        () -> translate(IR.def(null, "m", IR.parameters(malformed), null)));
  }

  @Test
  public void testBlockLocals() {
    Node foo = IR.variableCall("foo");
    test(
        IR.withBlock(
            foo,
            IR.block(
                IR.blockParameters(
                    IR.parameters(IR.requiredParameter("a")), IR.blockLocalVariable("b")),
                null)),
        "(iter (call nil :foo) (args :a (shadow :b)))");
    test(
        IR.withBlock(foo, IR.block(IR.blockParameters(null, IR.blockLocalVariable("b")), null)),
        "(iter (call nil :foo) (args (shadow :b)))");
  }

  @Test
  public void testParenthesizedBlockParametersSpanTheirParentheses() {
    Node parameters =
        IR.parenthesizedBlockParameters(
                IR.parameters(IR.requiredParameter("a").atLine(2)).atLine(2),
                Location.line(1),
                Location.line(3))
            .atLine(2);
    Sexp lambda = translate(IR.lambda(parameters, null).atLines(1, 4));
    assertSexp(lambda).printsAs("(iter (lambda) (args :a))");
    assertSexp(lambda.getSexp(1)).hasLines(1, 3);
  }

  @Test
  public void testLambda() {
    test(IR.lambda(null, null), "(iter (lambda) (args))");
    test(
        IR.lambda(
            IR.blockParameters(IR.parameters(IR.requiredParameter("x"))),
            IR.statements(IR.localRead("x"))),
        "(iter (lambda) (args :x) (lvar :x))");
    test(
        IR.lambda(IR.numberedParameters(), IR.statements(IR.localRead("_1"))),
        "(iter (lambda) (args) (call nil :_1))");
    test(IR.lambda(IR.itParameters(), null), "(iter (lambda) (args))");
  }

  @Test
  public void testClass() {
    test(IR.classNode("Foo", IR.constantRead("Foo"), null, null), "(class :Foo nil)");
    test(
        IR.classNode(
            "Foo",
            IR.constantRead("Foo"),
            IR.constantRead("Bar"),
            IR.statements(emptyDef("a"), emptyDef("b"))),
        "(class :Foo (const :Bar) (defn :a (args) (nil)) (defn :b (args) (nil)))");
    test(
        IR.classNode("Bar", IR.constantPath(IR.constantRead("Foo"), "Bar"), null, null),
        "(class :Bar nil)");
  }

  @Test
  public void testClassWithBeginBody() {
    Node body =
        IR.begin(
            IR.statements(IR.variableCall("a")),
            IR.rescue(List.of(), null, IR.statements(IR.variableCall("b")), null),
            null,
            null);
    test(
        IR.classNode("Foo", IR.constantRead("Foo"), null, body),
        "(class :Foo nil (rescue (call nil :a) (resbody (array) (call nil :b))))");
  }

  @Test
  public void testModule() {
    test(
        IR.module(IR.constantRead("Foo"), IR.statements(IR.integer(1))),
        "(module :Foo (lit 1))");
    test(
        IR.module(IR.constantPath(IR.constantRead("Foo"), "Bar"), null),
        "(module (colon2 (const :Foo) :Bar))");
  }

  @Test
  public void testSingletonClass() {
    test(
        IR.singletonClass(IR.self(), IR.statements(emptyDef("foo"))),
        "(sclass (self) (defn :foo (args) (nil)))");
    test(IR.singletonClass(IR.self(), null), "(sclass (self))");
  }

  @Test
  public void testAlias() {
    test(IR.aliasMethod(IR.symbol("foo"), IR.symbol("bar")), "(alias (lit :foo) (lit :bar))");
  }

  @Test
  public void testGlobalAlias() {
    test(IR.aliasGlobal(IR.globalRead("$foo"), IR.globalRead("$bar")), "(valias :$foo :$bar)");
    test(IR.aliasGlobal(IR.globalRead("$foo"), IR.backReference("$&")), "(valias :$foo :$&)");
    test(IR.aliasGlobal(IR.globalRead("$foo"), IR.numberedReference(1)), "(valias :$foo :$1)");
  }

  @Test
  public void testUndef() {
    test(IR.undef(IR.symbol("foo")), "(undef (lit :foo))");
    Sexp block = translate(IR.undef(IR.symbol("a"), IR.symbol("b")));
    assertSexp(block).printsAs("(block (undef (lit :a)) (undef (lit :b)))");
    assertSexp(block).hasTag(SexpTag.BLOCK);
  }
}
