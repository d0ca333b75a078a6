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

import static com.google.common.truth.Truth.assertThat;
import static org.rubysexp.testing.SexpSubject.assertSexp;

import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rubysexp.prism.IR;
import org.rubysexp.prism.Location;
import org.rubysexp.prism.Node;
import org.rubysexp.prism.Prop;
import org.rubysexp.sexp.RubyRegexp;
import org.rubysexp.sexp.Sexp;

/** Tests for literals, interpolation and the other leaf values. */
@RunWith(JUnit4.class)
public final class LiteralTranslationTest extends SexpCompilerTestCase {

  @Test
  public void testInteger() {
    test(IR.integer(1), "(lit 1)");
    test(IR.integer(-42), "(lit -42)");
    assertThat(translate(IR.integer(1)).get(0)).isEqualTo(1L);
  }

  @Test
  public void testBigInteger() {
    BigInteger big = new BigInteger("123456789012345678901234567890");
    test(IR.integer(big), "(lit 123456789012345678901234567890)");
    assertThat(translate(IR.integer(big)).get(0)).isEqualTo(big);
  }

  @Test
  public void testFloat() {
    test(IR.floatLiteral(1.5), "(lit 1.5)");
    test(IR.floatLiteral(2.0), "(lit 2.0)");
  }

  @Test
  public void testRational() {
    test(IR.rational(6, 4), "(lit (3/2))");
    test(IR.rational(3, 1), "(lit (3/1))");
  }

  @Test
  public void testImaginary() {
    test(IR.imaginary(IR.integer(2)), "(lit (0+2i))");
    test(IR.imaginary(IR.floatLiteral(1.5)), "(lit (0+1.5i))");
    test(IR.imaginary(IR.rational(1, 2)), "(lit (0+(1/2)*i))");
  }

  @Test
  public void testString() {
    test(IR.string("foo"), "(str \"foo\")");
    test(IR.string("a\"b\n"), "(str \"a\\\"b\\n\")");
  }

  @Test
  public void testSymbol() {
    test(IR.symbol("foo"), "(lit :foo)");
    test(IR.symbol("foo bar"), "(lit :foo bar)");
  }

  @Test
  public void testNotOperatorSymbolKeepsItsSpelling() {
    test(IR.symbol("!@", "!"), "(lit :!@)");
    test(IR.symbol("-@", "-@"), "(lit :-@)");
  }

  @Test
  public void testRegexp() {
    test(IR.regexp("foo"), "(lit /foo/)");
    test(IR.regexp("foo", Prop.IGNORE_CASE, Prop.MULTI_LINE), "(lit /foo/mi)");
    test(IR.regexp("foo", Prop.EXTENDED), "(lit /foo/x)");
    test(IR.matchLastLine("foo"), "(lit /foo/)");
  }

  @Test
  public void testRegexpEncodingOptions() {
    assertThat(regexpOf(IR.regexp("a", Prop.UTF_8)).options()).isEqualTo(RubyRegexp.FIXEDENCODING);
    assertThat(regexpOf(IR.regexp("a", Prop.EUC_JP)).options()).isEqualTo(16);
    assertThat(regexpOf(IR.regexp("a", Prop.WINDOWS_31J)).options()).isEqualTo(16);
    assertThat(regexpOf(IR.regexp("a", Prop.ASCII_8BIT)).options())
        .isEqualTo(RubyRegexp.NOENCODING);
    assertThat(regexpOf(IR.regexp("a", Prop.IGNORE_CASE, Prop.UTF_8)).options()).isEqualTo(17);
    test(IR.regexp("a", Prop.ASCII_8BIT), "(lit /a/n)");
  }

  private RubyRegexp regexpOf(Node n) {
    return (RubyRegexp) translate(n).get(0);
  }

  @Test
  public void testXString() {
    test(IR.xString("ls"), "(xstr \"ls\")");
  }

  @Test
  public void testHeredocXStringSpansItsBody() {
    Node heredoc = IR.heredocXString("ls\n", Location.lines(2, 3)).atLine(1);
    assertSexp(translate(heredoc)).hasLines(2, 3);

    setHeredocContentSpan(false);
    assertSexp(translate(heredoc)).hasLines(1, 1);
  }

  @Test
  public void testInterpolatedHeredocXStringSpansItsFirstPart() {
    Node heredoc =
        IR.interpolatedHeredocXString(
                IR.string("ls ").atLine(2),
                IR.embeddedStatements(IR.statements(IR.variableCall("dir"))).atLine(2))
            .atLine(1);
    Sexp dxstr = translate(heredoc);
    assertSexp(dxstr).printsAs("(dxstr \"ls \" (evstr (call nil :dir)))");
    assertSexp(dxstr).hasLines(2, 2);
  }

  @Test
  public void testInterpolatedString() {
    test(
        IR.interpolatedString(
            IR.string("foo "), IR.embeddedStatements(IR.statements(IR.variableCall("bar")))),
        "(dstr \"foo \" (evstr (call nil :bar)))");
  }

  @Test
  public void testInterpolationStartingWithExpression() {
    test(
        IR.interpolatedString(
            IR.embeddedStatements(IR.statements(IR.variableCall("bar"))), IR.string(" baz")),
        "(dstr \"\" (evstr (call nil :bar)) (str \" baz\"))");
  }

  @Test
  public void testInterpolationKinds() {
    Node part = IR.embeddedVariable(IR.instanceRead("@a"));
    test(IR.interpolatedSymbol(IR.string("a"), part), "(dsym \"a\" (evstr (ivar :@a)))");
    test(IR.interpolatedRegexp(IR.string("a"), part), "(dregx \"a\" (evstr (ivar :@a)))");
    test(IR.interpolatedMatchLastLine(part), "(dregx \"\" (evstr (ivar :@a)))");
    test(IR.interpolatedXString(IR.string("a"), part), "(dxstr \"a\" (evstr (ivar :@a)))");
  }

  @Test
  public void testEmptyInterpolation() {
    test(
        IR.interpolatedString(IR.string("a"), IR.embeddedStatements(null)),
        "(dstr \"a\" (evstr))");
  }

  @Test
  public void testKeywordLiterals() {
    test(IR.trueNode(), "(true)");
    test(IR.falseNode(), "(false)");
    test(IR.nil(), "(nil)");
    test(IR.self(), "(self)");
  }

  @Test
  public void testSourceFile() {
    test(IR.sourceFile(), "(str \"" + GENERATED_SRC_NAME + "\")");
  }

  @Test
  public void testSourceLine() {
    test(IR.sourceLine().atLine(7), "(lit 7)");
  }

  @Test
  public void testSourceEncoding() {
    test(IR.sourceEncoding(), "(colon2 (const :Encoding) :UTF_8)");
  }

  @Test
  public void testArray() {
    test(IR.bracketArray(), "(array)");
    test(IR.bracketArray(IR.integer(1), IR.integer(2)), "(array (lit 1) (lit 2))");
    test(IR.bracketArray(IR.splat(IR.variableCall("a"))), "(array (splat (call nil :a)))");
  }

  @Test
  public void testHash() {
    test(IR.hash(), "(hash)");
    test(
        IR.hash(
            IR.assoc(IR.symbol("a"), IR.integer(1)), IR.assocSplat(IR.localRead("b"))),
        "(hash (lit :a) (lit 1) (kwsplat (lvar :b)))");
  }

  @Test
  public void testHashWithImplicitValue() {
    test(
        IR.hash(IR.assoc(IR.symbol("a"), IR.implicit(IR.variableCall("a")))),
        "(hash (lit :a) nil)");
  }

  @Test
  public void testAnonymousDoubleSplat() {
    test(IR.keywordHash(IR.assocSplat(null)), "(hash (kwsplat))");
  }

  @Test
  public void testRangeFolding() {
    test(IR.range(IR.integer(1), IR.integer(2)), "(lit 1..2)");
    test(IR.exclusiveRange(IR.integer(1), IR.integer(2)), "(lit 1...2)");
    test(IR.range(IR.nil(), IR.integer(2)), "(lit ..2)");
    test(IR.range(IR.integer(1), IR.nil()), "(lit 1..)");
    test(IR.range(IR.nil(), IR.nil()), "(lit nil..nil)");
  }

  @Test
  public void testRangeWithoutFolding() {
    test(IR.range(IR.localRead("a"), IR.integer(2)), "(dot2 (lvar :a) (lit 2))");
    test(IR.exclusiveRange(IR.integer(1), IR.localRead("b")), "(dot3 (lit 1) (lvar :b))");
    // An endless range has no right node at all, which is not a foldable bound.
    test(IR.range(IR.integer(1), null), "(dot2 (lit 1) nil)");
    test(IR.range(IR.floatLiteral(1.0), IR.integer(2)), "(dot2 (lit 1.0) (lit 2))");
  }

  @Test
  public void testFlipFlop() {
    test(IR.flipFlop(IR.integer(1), IR.integer(2), false), "(lit 1..2)");
    test(IR.flipFlop(IR.nil(), IR.integer(2), false), "(flip2 (nil) (lit 2))");
    test(
        IR.flipFlop(IR.localRead("a"), IR.localRead("b"), true), "(flip3 (lvar :a) (lvar :b))");
  }

  @Test
  public void testReferences() {
    test(IR.backReference("$+"), "(back_ref :+)");
    test(IR.numberedReference(1), "(nth_ref 1)");
  }
}
