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

import static org.rubysexp.testing.SexpSubject.assertSexp;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rubysexp.prism.IR;
import org.rubysexp.prism.Node;
import org.rubysexp.prism.NodeKind;
import org.rubysexp.sexp.Sexp;

/** Tests for variables, constants and every form of assignment. */
@RunWith(JUnit4.class)
public final class AssignmentTranslationTest extends SexpCompilerTestCase {

  private static final Node ONE = IR.integer(1);

  @Test
  public void testReads() {
    test(IR.localRead("a"), "(lvar :a)");
    test(IR.instanceRead("@a"), "(ivar :@a)");
    test(IR.read(NodeKind.CLASS_VARIABLE_READ, "@@a"), "(cvar :@@a)");
    test(IR.globalRead("$a"), "(gvar :$a)");
    test(IR.constantRead("A"), "(const :A)");
  }

  @Test
  public void testNumberedParameterReadIsACall() {
    test(IR.localRead("_1"), "(call nil :_1)");
    test(IR.localRead("_9"), "(call nil :_9)");
    test(IR.localRead("_10"), "(lvar :_10)");
    test(IR.localRead("_a"), "(lvar :_a)");
  }

  @Test
  public void testLocalWrite() {
    test(IR.localWrite("foo", ONE), "(lasgn :foo (lit 1))");
  }

  @Test
  public void testWrites() {
    test(IR.write(NodeKind.INSTANCE_VARIABLE_WRITE, "@a", ONE), "(iasgn :@a (lit 1))");
    test(IR.write(NodeKind.CLASS_VARIABLE_WRITE, "@@a", ONE), "(cvdecl :@@a (lit 1))");
    test(IR.write(NodeKind.GLOBAL_VARIABLE_WRITE, "$a", ONE), "(gasgn :$a (lit 1))");
    test(IR.write(NodeKind.CONSTANT_WRITE, "A", ONE), "(cdecl :A (lit 1))");
  }

  @Test
  public void testWriteOfSplatListIsSvalue() {
    test(
        IR.localWrite("a", IR.array(IR.splat(IR.variableCall("b")), ONE)),
        "(lasgn :a (svalue (array (splat (call nil :b)) (lit 1))))");
    test(
        IR.write(NodeKind.INSTANCE_VARIABLE_WRITE, "@a", IR.array(IR.splat(IR.localRead("b")))),
        "(iasgn :@a (svalue (array (splat (lvar :b)))))");
  }

  @Test
  public void testWriteOfBracketArrayIsNotSvalue() {
    test(
        IR.localWrite("a", IR.bracketArray(IR.splat(IR.variableCall("b")))),
        "(lasgn :a (array (splat (call nil :b))))");
  }

  @Test
  public void testWriteOfListWithoutSplatIsNotSvalue() {
    test(
        IR.localWrite("a", IR.array(ONE, IR.integer(2))),
        "(lasgn :a (array (lit 1) (lit 2)))");
  }

  @Test
  public void testConstantWriteKeepsSplatList() {
    test(
        IR.write(NodeKind.CONSTANT_WRITE, "A", IR.array(IR.splat(IR.variableCall("b")))),
        "(cdecl :A (array (splat (call nil :b))))");
  }

  @Test
  public void testInstanceVariableOperatorWrite() {
    test(
        IR.operatorWrite(NodeKind.INSTANCE_VARIABLE_OPERATOR_WRITE, "@foo", "+", ONE),
        "(iasgn :@foo (call (ivar :@foo) :+ (lit 1)))");
  }

  @Test
  public void testOperatorWrites() {
    test(
        IR.operatorWrite(NodeKind.LOCAL_VARIABLE_OPERATOR_WRITE, "a", "+", ONE),
        "(lasgn :a (call (lvar :a) :+ (lit 1)))");
    test(
        IR.operatorWrite(NodeKind.CLASS_VARIABLE_OPERATOR_WRITE, "@@a", "*", IR.integer(2)),
        "(cvdecl :@@a (call (cvar :@@a) :* (lit 2)))");
    test(
        IR.operatorWrite(NodeKind.GLOBAL_VARIABLE_OPERATOR_WRITE, "$a", "-", ONE),
        "(gasgn :$a (call (gvar :$a) :- (lit 1)))");
    test(
        IR.operatorWrite(NodeKind.CONSTANT_OPERATOR_WRITE, "A", "<<", ONE),
        "(cdecl :A (call (const :A) :<< (lit 1)))");
  }

  @Test
  public void testOperatorWriteValues() {
    Node splatList = IR.array(IR.splat(IR.variableCall("b")));
    test(
        IR.operatorWrite(NodeKind.LOCAL_VARIABLE_OPERATOR_WRITE, "a", "+", splatList),
        "(lasgn :a (call (lvar :a) :+ (svalue (array (splat (call nil :b))))))");
    test(
        IR.operatorWrite(NodeKind.GLOBAL_VARIABLE_OPERATOR_WRITE, "$a", "+", splatList),
        "(gasgn :$a (call (gvar :$a) :+ (array (splat (call nil :b)))))");
  }

  @Test
  public void testLogicalWrites() {
    test(
        IR.logicalWrite(NodeKind.LOCAL_VARIABLE_AND_WRITE, "a", ONE),
        "(op_asgn_and (lvar :a) (lasgn :a (lit 1)))");
    test(
        IR.logicalWrite(NodeKind.INSTANCE_VARIABLE_OR_WRITE, "@a", ONE),
        "(op_asgn_or (ivar :@a) (iasgn :@a (lit 1)))");
    test(
        IR.logicalWrite(NodeKind.CLASS_VARIABLE_AND_WRITE, "@@a", ONE),
        "(op_asgn_and (cvar :@@a) (cvdecl :@@a (lit 1)))");
    test(
        IR.logicalWrite(NodeKind.GLOBAL_VARIABLE_OR_WRITE, "$a", ONE),
        "(op_asgn_or (gvar :$a) (gasgn :$a (lit 1)))");
    test(
        IR.logicalWrite(NodeKind.CONSTANT_OR_WRITE, "A", ONE),
        "(op_asgn_or (const :A) (cdecl :A (lit 1)))");
  }

  @Test
  public void testDesugaredWritesTakeTheWriteSpan() {
    Sexp result =
        translate(
            IR.operatorWrite(
                    NodeKind.LOCAL_VARIABLE_OPERATOR_WRITE, "a", "+", IR.integer(1).atLine(3))
                .atLines(2, 3));
    assertSexp(result).hasLines(2, 3);
    Sexp call = result.getSexp(1);
    assertSexp(call).hasLines(2, 3);
    assertSexp(call.getSexp(0)).hasLines(2, 3);
    assertSexp(call.getSexp(2)).hasLines(3, 3);
  }

  @Test
  public void testConstantPaths() {
    test(IR.constantPath(IR.constantRead("A"), "B"), "(colon2 (const :A) :B)");
    test(IR.constantPath(null, "B"), "(colon3 :B)");
    test(
        IR.constantPath(IR.constantPath(null, "A"), "B"),
        "(colon2 (colon3 :A) :B)");
  }

  @Test
  public void testConstantPathWrites() {
    Node path = IR.constantPath(IR.constantRead("A"), "B");
    test(IR.constantPathWrite(path, ONE), "(cdecl (colon2 (const :A) :B) (lit 1))");
    test(
        IR.constantPathOperatorWrite(path, "+", ONE),
        "(op_asgn (colon2 (const :A) :B) :+ (lit 1))");
    test(
        IR.constantPathLogicalWrite(NodeKind.CONSTANT_PATH_AND_WRITE, path, ONE),
        "(op_asgn_and (colon2 (const :A) :B) (lit 1))");
    test(
        IR.constantPathLogicalWrite(NodeKind.CONSTANT_PATH_OR_WRITE, path, ONE),
        "(op_asgn_or (colon2 (const :A) :B) (lit 1))");
  }

  @Test
  public void testMultiWriteOfBracketArray() {
    test(
        IR.multiWrite(
            List.of(IR.localTarget("a"), IR.localTarget("b")),
            null,
            List.of(),
            IR.bracketArray(ONE, IR.integer(2))),
        "(masgn (array (lasgn :a) (lasgn :b)) (array (lit 1) (lit 2)))");
  }

  @Test
  public void testMultiWriteOfExpressionUsesToAry() {
    test(
        IR.multiWrite(
            List.of(IR.localTarget("a"), IR.localTarget("b")),
            null,
            List.of(),
            IR.variableCall("c")),
        "(masgn (array (lasgn :a) (lasgn :b)) (to_ary (call nil :c)))");
  }

  @Test
  public void testMultiWriteOfCommaList() {
    test(
        IR.multiWrite(
            List.of(IR.localTarget("a"), IR.localTarget("b")),
            null,
            List.of(),
            IR.array(ONE, IR.integer(2))),
        "(masgn (array (lasgn :a) (lasgn :b)) (to_ary (array (lit 1) (lit 2))))");
  }

  @Test
  public void testMultiWriteWithRest() {
    test(
        IR.multiWrite(
            List.of(IR.localTarget("a")),
            IR.splat(IR.localTarget("b")),
            List.of(IR.localTarget("c")),
            IR.variableCall("d")),
        "(masgn (array (lasgn :a) (splat (lasgn :b)) (lasgn :c)) (to_ary (call nil :d)))");
    test(
        IR.multiWrite(
            List.of(IR.localTarget("a")), IR.splat(null), List.of(), IR.variableCall("d")),
        "(masgn (array (lasgn :a) (splat)) (to_ary (call nil :d)))");
  }

  @Test
  public void testMultiWriteWithImplicitRest() {
    test(
        IR.multiWrite(
            List.of(IR.localTarget("a")), IR.implicitRest(), List.of(), IR.variableCall("d")),
        "(masgn (array (lasgn :a)) (to_ary (call nil :d)))");
  }

  @Test
  public void testNestedMultiTarget() {
    Node nested =
        IR.multiTarget(List.of(IR.localTarget("a"), IR.localTarget("b")), null, List.of());
    test(
        IR.multiWrite(List.of(nested, IR.localTarget("c")), null, List.of(), IR.variableCall("d")),
        "(masgn (array (masgn (array (lasgn :a) (lasgn :b))) (lasgn :c)) (to_ary (call nil :d)))");
  }

  @Test
  public void testTargets() {
    Node value = IR.variableCall("v");
    test(
        IR.multiWrite(
            List.of(
                IR.target(NodeKind.INSTANCE_VARIABLE_TARGET, "@a"),
                IR.target(NodeKind.CLASS_VARIABLE_TARGET, "@@b"),
                IR.target(NodeKind.GLOBAL_VARIABLE_TARGET, "$c"),
                IR.target(NodeKind.CONSTANT_TARGET, "D")),
            null,
            List.of(),
            value),
        "(masgn (array (iasgn :@a) (cvdecl :@@b) (gasgn :$c) (cdecl :D)) (to_ary (call nil :v)))");
    test(
        IR.multiWrite(
            List.of(
                IR.constantPathTarget(IR.constantRead("A"), "B"),
                IR.constantPathTarget(null, "C")),
            null,
            List.of(),
            value),
        "(masgn (array (const (colon2 (const :A) :B)) (const (colon3 :C)))"
            + " (to_ary (call nil :v)))");
  }

  @Test
  public void testCallAndIndexTargets() {
    test(
        IR.multiWrite(
            List.of(
                IR.callTarget(IR.variableCall("a"), "b="),
                IR.indexTarget(IR.variableCall("c"), IR.integer(0))),
            null,
            List.of(),
            IR.variableCall("v")),
        "(masgn (array (attrasgn (call nil :a) :b=) (attrasgn (call nil :c) :[]= (lit 0)))"
            + " (to_ary (call nil :v)))");
  }

  @Test
  public void testMatchWrite() {
    test(
        IR.matchWrite(
            IR.call(IR.regexp("(?<foo>bar)"), "=~", IR.variableCall("baz")),
            IR.localTarget("foo")),
        "(match2 (lit /(?<foo>bar)/) (call nil :baz))");
  }
}
