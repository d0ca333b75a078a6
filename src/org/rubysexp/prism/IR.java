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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A prism tree construction helper class.
 *
 * <p>Every node is created on line 1; use {@link Node#atLines} to place it elsewhere.
 */
public class IR {

  private static final Location FIRST_LINE = Location.line(1);

  private IR() {}

  private static Node.Builder node(NodeKind kind) {
    return Node.builder(kind, FIRST_LINE);
  }

  private static List<Node> list(Node... nodes) {
    return ImmutableList.copyOf(nodes);
  }

  // Roots and statement lists

  public static Node program(Node... statements) {
    return node(NodeKind.PROGRAM).put(Prop.STATEMENTS, statements(statements)).build();
  }

  public static Node statements(Node... statements) {
    return statements(list(statements));
  }

  public static Node statements(List<Node> statements) {
    return node(NodeKind.STATEMENTS).put(Prop.STATEMENT_LIST, statements).build();
  }

  public static Node parentheses(@Nullable Node body) {
    return node(NodeKind.PARENTHESES).put(Prop.BODY, body).build();
  }

  // Literals

  public static Node integer(long value) {
    return integer(BigInteger.valueOf(value));
  }

  public static Node integer(BigInteger value) {
    return node(NodeKind.INTEGER).put(Prop.NUMBER, value).build();
  }

  public static Node floatLiteral(double value) {
    return node(NodeKind.FLOAT).put(Prop.NUMBER, value).build();
  }

  public static Node rational(long numerator, long denominator) {
    checkArgument(denominator != 0, "zero denominator");
    return node(NodeKind.RATIONAL)
        .put(Prop.NUMERATOR, BigInteger.valueOf(numerator))
        .put(Prop.DENOMINATOR, BigInteger.valueOf(denominator))
        .build();
  }

  public static Node imaginary(Node numeric) {
    checkState(
        numeric.isKind(NodeKind.INTEGER)
            || numeric.isKind(NodeKind.FLOAT)
            || numeric.isKind(NodeKind.RATIONAL),
        numeric);
    return node(NodeKind.IMAGINARY).put(Prop.NUMERIC, numeric).build();
  }

  public static Node string(String unescaped) {
    return node(NodeKind.STRING).put(Prop.UNESCAPED, unescaped).build();
  }

  public static Node symbol(String name) {
    return symbol(name, name);
  }

  /** A symbol whose source spelling differs from its unescaped name, such as {@code :!@}. */
  public static Node symbol(String value, String unescaped) {
    return node(NodeKind.SYMBOL)
        .put(Prop.SYMBOL_VALUE, value)
        .put(Prop.UNESCAPED, unescaped)
        .build();
  }

  public static Node regexp(String unescaped, Prop... flags) {
    return regexpLike(NodeKind.REGULAR_EXPRESSION, unescaped, flags);
  }

  public static Node matchLastLine(String unescaped, Prop... flags) {
    return regexpLike(NodeKind.MATCH_LAST_LINE, unescaped, flags);
  }

  private static Node regexpLike(NodeKind kind, String unescaped, Prop... flags) {
    Node.Builder builder = node(kind).put(Prop.UNESCAPED, unescaped);
    for (Prop flag : flags) {
      builder.flag(flag);
    }
    return builder.build();
  }

  public static Node xString(String unescaped) {
    return node(NodeKind.X_STRING).put(Prop.UNESCAPED, unescaped).build();
  }

  public static Node heredocXString(String unescaped, Location content) {
    return node(NodeKind.X_STRING)
        .put(Prop.UNESCAPED, unescaped)
        .put(Prop.CONTENT_LOC, content)
        .flag(Prop.HEREDOC)
        .build();
  }

  public static Node interpolatedString(Node... parts) {
    return interpolated(NodeKind.INTERPOLATED_STRING, parts);
  }

  public static Node interpolatedSymbol(Node... parts) {
    return interpolated(NodeKind.INTERPOLATED_SYMBOL, parts);
  }

  public static Node interpolatedRegexp(Node... parts) {
    return interpolated(NodeKind.INTERPOLATED_REGULAR_EXPRESSION, parts);
  }

  public static Node interpolatedMatchLastLine(Node... parts) {
    return interpolated(NodeKind.INTERPOLATED_MATCH_LAST_LINE, parts);
  }

  public static Node interpolatedXString(Node... parts) {
    return interpolated(NodeKind.INTERPOLATED_X_STRING, parts);
  }

  public static Node interpolatedHeredocXString(Node... parts) {
    return interpolated(NodeKind.INTERPOLATED_X_STRING, parts).withProp(Prop.HEREDOC, true);
  }

  private static Node interpolated(NodeKind kind, Node... parts) {
    return node(kind).put(Prop.PARTS, list(parts)).build();
  }

  public static Node embeddedStatements(@Nullable Node statements) {
    checkState(statements == null || statements.isKind(NodeKind.STATEMENTS));
    return node(NodeKind.EMBEDDED_STATEMENTS).put(Prop.STATEMENTS, statements).build();
  }

  public static Node embeddedVariable(Node variable) {
    return node(NodeKind.EMBEDDED_VARIABLE).put(Prop.VARIABLE, variable).build();
  }

  public static Node trueNode() {
    return node(NodeKind.TRUE).build();
  }

  public static Node falseNode() {
    return node(NodeKind.FALSE).build();
  }

  public static Node nil() {
    return node(NodeKind.NIL).build();
  }

  public static Node self() {
    return node(NodeKind.SELF).build();
  }

  public static Node sourceFile() {
    return node(NodeKind.SOURCE_FILE).build();
  }

  public static Node sourceLine() {
    return node(NodeKind.SOURCE_LINE).build();
  }

  public static Node sourceEncoding() {
    return node(NodeKind.SOURCE_ENCODING).build();
  }

  /** An array written without brackets, such as the right-hand side of {@code a = 1, 2}. */
  public static Node array(Node... elements) {
    return node(NodeKind.ARRAY).put(Prop.ELEMENTS, list(elements)).build();
  }

  /** An array literal written with {@code [...]}. */
  public static Node bracketArray(Node... elements) {
    return node(NodeKind.ARRAY)
        .put(Prop.ELEMENTS, list(elements))
        .put(Prop.OPENING_LOC, FIRST_LINE)
        .put(Prop.CLOSING_LOC, FIRST_LINE)
        .build();
  }

  public static Node hash(Node... elements) {
    return node(NodeKind.HASH).put(Prop.ELEMENTS, list(elements)).build();
  }

  public static Node keywordHash(Node... elements) {
    return node(NodeKind.KEYWORD_HASH).put(Prop.ELEMENTS, list(elements)).build();
  }

  public static Node assoc(Node key, Node value) {
    return node(NodeKind.ASSOC).put(Prop.KEY, key).put(Prop.VALUE, value).build();
  }

  public static Node assocSplat(@Nullable Node value) {
    return node(NodeKind.ASSOC_SPLAT).put(Prop.VALUE, value).build();
  }

  public static Node implicit(Node value) {
    return node(NodeKind.IMPLICIT).put(Prop.VALUE, value).build();
  }

  public static Node range(@Nullable Node left, @Nullable Node right) {
    return node(NodeKind.RANGE).put(Prop.LEFT, left).put(Prop.RIGHT, right).build();
  }

  public static Node exclusiveRange(@Nullable Node left, @Nullable Node right) {
    return range(left, right).withProp(Prop.EXCLUDE_END, true);
  }

  public static Node flipFlop(@Nullable Node left, @Nullable Node right, boolean excludeEnd) {
    return node(NodeKind.FLIP_FLOP)
        .put(Prop.LEFT, left)
        .put(Prop.RIGHT, right)
        .put(Prop.EXCLUDE_END, excludeEnd)
        .build();
  }

  // Variables

  public static Node localRead(String name) {
    return read(NodeKind.LOCAL_VARIABLE_READ, name);
  }

  public static Node localWrite(String name, Node value) {
    return write(NodeKind.LOCAL_VARIABLE_WRITE, name, value);
  }

  public static Node localTarget(String name) {
    return target(NodeKind.LOCAL_VARIABLE_TARGET, name);
  }

  public static Node instanceRead(String name) {
    return read(NodeKind.INSTANCE_VARIABLE_READ, name);
  }

  public static Node globalRead(String name) {
    return read(NodeKind.GLOBAL_VARIABLE_READ, name);
  }

  public static Node constantRead(String name) {
    return read(NodeKind.CONSTANT_READ, name);
  }

  public static Node read(NodeKind kind, String name) {
    checkState(
        kind == NodeKind.LOCAL_VARIABLE_READ
            || kind == NodeKind.INSTANCE_VARIABLE_READ
            || kind == NodeKind.CLASS_VARIABLE_READ
            || kind == NodeKind.GLOBAL_VARIABLE_READ
            || kind == NodeKind.CONSTANT_READ,
        kind);
    return node(kind).put(Prop.NAME, name).build();
  }

  public static Node write(NodeKind kind, String name, Node value) {
    checkState(
        kind == NodeKind.LOCAL_VARIABLE_WRITE
            || kind == NodeKind.INSTANCE_VARIABLE_WRITE
            || kind == NodeKind.CLASS_VARIABLE_WRITE
            || kind == NodeKind.GLOBAL_VARIABLE_WRITE
            || kind == NodeKind.CONSTANT_WRITE,
        kind);
    return node(kind).put(Prop.NAME, name).put(Prop.VALUE, value).build();
  }

  public static Node operatorWrite(NodeKind kind, String name, String operator, Node value) {
    checkState(
        kind == NodeKind.LOCAL_VARIABLE_OPERATOR_WRITE
            || kind == NodeKind.INSTANCE_VARIABLE_OPERATOR_WRITE
            || kind == NodeKind.CLASS_VARIABLE_OPERATOR_WRITE
            || kind == NodeKind.GLOBAL_VARIABLE_OPERATOR_WRITE
            || kind == NodeKind.CONSTANT_OPERATOR_WRITE,
        kind);
    return node(kind)
        .put(Prop.NAME, name)
        .put(Prop.OPERATOR, operator)
        .put(Prop.VALUE, value)
        .build();
  }

  /** A {@code &&=} or {@code ||=} write to a named variable or constant. */
  public static Node logicalWrite(NodeKind kind, String name, Node value) {
    checkState(kind.name().endsWith("_AND_WRITE") || kind.name().endsWith("_OR_WRITE"), kind);
    checkState(!kind.name().startsWith("CALL") && !kind.name().startsWith("INDEX"), kind);
    checkState(!kind.name().startsWith("CONSTANT_PATH"), kind);
    return node(kind).put(Prop.NAME, name).put(Prop.VALUE, value).build();
  }

  public static Node target(NodeKind kind, String name) {
    checkState(
        kind == NodeKind.LOCAL_VARIABLE_TARGET
            || kind == NodeKind.INSTANCE_VARIABLE_TARGET
            || kind == NodeKind.CLASS_VARIABLE_TARGET
            || kind == NodeKind.GLOBAL_VARIABLE_TARGET
            || kind == NodeKind.CONSTANT_TARGET,
        kind);
    return node(kind).put(Prop.NAME, name).build();
  }

  public static Node backReference(String name) {
    checkArgument(name.startsWith("$"), name);
    return node(NodeKind.BACK_REFERENCE_READ).put(Prop.NAME, name).build();
  }

  public static Node numberedReference(int number) {
    return node(NodeKind.NUMBERED_REFERENCE_READ).put(Prop.NUMBER, (long) number).build();
  }

  // Constant paths

  /** {@code parent::name}, or {@code ::name} when {@code parent} is null. */
  public static Node constantPath(@Nullable Node parent, String name) {
    return node(NodeKind.CONSTANT_PATH).put(Prop.PARENT, parent).put(Prop.NAME, name).build();
  }

  public static Node constantPathTarget(@Nullable Node parent, String name) {
    return node(NodeKind.CONSTANT_PATH_TARGET)
        .put(Prop.PARENT, parent)
        .put(Prop.NAME, name)
        .build();
  }

  public static Node constantPathWrite(Node target, Node value) {
    checkState(target.isKind(NodeKind.CONSTANT_PATH), target);
    return node(NodeKind.CONSTANT_PATH_WRITE)
        .put(Prop.TARGET, target)
        .put(Prop.VALUE, value)
        .build();
  }

  public static Node constantPathOperatorWrite(Node target, String operator, Node value) {
    checkState(target.isKind(NodeKind.CONSTANT_PATH), target);
    return node(NodeKind.CONSTANT_PATH_OPERATOR_WRITE)
        .put(Prop.TARGET, target)
        .put(Prop.OPERATOR, operator)
        .put(Prop.VALUE, value)
        .build();
  }

  public static Node constantPathLogicalWrite(NodeKind kind, Node target, Node value) {
    checkState(
        kind == NodeKind.CONSTANT_PATH_AND_WRITE || kind == NodeKind.CONSTANT_PATH_OR_WRITE, kind);
    checkState(target.isKind(NodeKind.CONSTANT_PATH), target);
    return node(kind).put(Prop.TARGET, target).put(Prop.VALUE, value).build();
  }

  // Calls

  public static Node arguments(Node... arguments) {
    return arguments(list(arguments));
  }

  public static Node arguments(List<Node> arguments) {
    return node(NodeKind.ARGUMENTS).put(Prop.ARGUMENT_LIST, arguments).build();
  }

  /** {@code receiver.name(arguments)}; an absent receiver makes a private call. */
  public static Node call(@Nullable Node receiver, String name, Node... arguments) {
    return node(NodeKind.CALL)
        .put(Prop.RECEIVER, receiver)
        .put(Prop.NAME, name)
        .put(Prop.CALL_OPERATOR, receiver == null ? null : ".")
        .put(Prop.ARGUMENTS, arguments.length == 0 ? null : arguments(arguments))
        .build();
  }

  /** A bare identifier that could be a method call, such as {@code foo}. */
  public static Node variableCall(String name) {
    return call(null, name);
  }

  /** {@code receiver&.name(arguments)}. */
  public static Node safeCall(Node receiver, String name, Node... arguments) {
    return call(receiver, name, arguments)
        .withProp(Prop.CALL_OPERATOR, "&.")
        .withProp(Prop.SAFE_NAVIGATION, true);
  }

  /** {@code receiver.name = value}. */
  public static Node attributeWrite(Node receiver, String name, Node... arguments) {
    checkArgument(name.endsWith("="), name);
    return call(receiver, name, arguments).withProp(Prop.ATTRIBUTE_WRITE, true);
  }

  /** Attaches a block or block argument to a call-like node. */
  public static Node withBlock(Node call, Node block) {
    checkState(
        call.isKind(NodeKind.CALL)
            || call.isKind(NodeKind.SUPER)
            || call.isKind(NodeKind.FORWARDING_SUPER),
        call);
    checkState(block.isKind(NodeKind.BLOCK) || block.isKind(NodeKind.BLOCK_ARGUMENT), block);
    return call.withProp(Prop.BLOCK, block);
  }

  public static Node block(@Nullable Node parameters, @Nullable Node body) {
    return node(NodeKind.BLOCK).put(Prop.PARAMETERS, parameters).put(Prop.BODY, body).build();
  }

  public static Node blockArgument(@Nullable Node expression) {
    return node(NodeKind.BLOCK_ARGUMENT).put(Prop.EXPRESSION, expression).build();
  }

  public static Node blockParameters(@Nullable Node parameters, Node... locals) {
    return node(NodeKind.BLOCK_PARAMETERS)
        .put(Prop.PARAMETERS, parameters)
        .put(Prop.LOCALS, list(locals))
        .build();
  }

  /** Block parameters written with parentheses, as in {@code -> (a) {}}. */
  public static Node parenthesizedBlockParameters(
      @Nullable Node parameters, Location opening, Location closing, Node... locals) {
    return blockParameters(parameters, locals).toBuilder()
        .put(Prop.OPENING, "(")
        .put(Prop.OPENING_LOC, opening)
        .put(Prop.CLOSING_LOC, closing)
        .build();
  }

  public static Node blockLocalVariable(String name) {
    return node(NodeKind.BLOCK_LOCAL_VARIABLE).put(Prop.NAME, name).build();
  }

  public static Node numberedParameters() {
    return node(NodeKind.NUMBERED_PARAMETERS).build();
  }

  public static Node itParameters() {
    return node(NodeKind.IT_PARAMETERS).build();
  }

  public static Node callOperatorWrite(
      Node receiver, String callOperator, String name, String operator, Node value) {
    return callWrite(NodeKind.CALL_OPERATOR_WRITE, receiver, callOperator, name, value)
        .withProp(Prop.OPERATOR, operator);
  }

  public static Node callLogicalWrite(
      NodeKind kind, Node receiver, String callOperator, String name, Node value) {
    checkState(kind == NodeKind.CALL_AND_WRITE || kind == NodeKind.CALL_OR_WRITE, kind);
    return callWrite(kind, receiver, callOperator, name, value);
  }

  private static Node callWrite(
      NodeKind kind, Node receiver, String callOperator, String name, Node value) {
    return node(kind)
        .put(Prop.RECEIVER, receiver)
        .put(Prop.CALL_OPERATOR, callOperator)
        .put(Prop.READ_NAME, name)
        .put(Prop.WRITE_NAME, name + "=")
        .put(Prop.SAFE_NAVIGATION, callOperator.equals("&."))
        .put(Prop.VALUE, value)
        .build();
  }

  public static Node callTarget(Node receiver, String name) {
    return node(NodeKind.CALL_TARGET).put(Prop.RECEIVER, receiver).put(Prop.NAME, name).build();
  }

  public static Node indexOperatorWrite(
      Node receiver, List<Node> arguments, String operator, Node value) {
    return indexWrite(NodeKind.INDEX_OPERATOR_WRITE, receiver, arguments, value)
        .withProp(Prop.OPERATOR, operator);
  }

  public static Node indexLogicalWrite(
      NodeKind kind, Node receiver, List<Node> arguments, Node value) {
    checkState(kind == NodeKind.INDEX_AND_WRITE || kind == NodeKind.INDEX_OR_WRITE, kind);
    return indexWrite(kind, receiver, arguments, value);
  }

  private static Node indexWrite(NodeKind kind, Node receiver, List<Node> arguments, Node value) {
    return node(kind)
        .put(Prop.RECEIVER, receiver)
        .put(Prop.ARGUMENTS, arguments.isEmpty() ? null : arguments(arguments))
        .put(Prop.VALUE, value)
        .build();
  }

  public static Node indexTarget(Node receiver, Node... arguments) {
    return node(NodeKind.INDEX_TARGET)
        .put(Prop.RECEIVER, receiver)
        .put(Prop.ARGUMENTS, arguments.length == 0 ? null : arguments(arguments))
        .build();
  }

  public static Node splat(@Nullable Node expression) {
    return node(NodeKind.SPLAT).put(Prop.EXPRESSION, expression).build();
  }

  public static Node forwardingArguments() {
    return node(NodeKind.FORWARDING_ARGUMENTS).build();
  }

  public static Node superCall(@Nullable Node arguments) {
    checkState(arguments == null || arguments.isKind(NodeKind.ARGUMENTS));
    return node(NodeKind.SUPER).put(Prop.ARGUMENTS, arguments).build();
  }

  public static Node forwardingSuper() {
    return node(NodeKind.FORWARDING_SUPER).build();
  }

  public static Node yield(Node... arguments) {
    return node(NodeKind.YIELD)
        .put(Prop.ARGUMENTS, arguments.length == 0 ? null : arguments(arguments))
        .build();
  }

  public static Node matchWrite(Node call, Node... targets) {
    checkState(call.isKind(NodeKind.CALL), call);
    return node(NodeKind.MATCH_WRITE).put(Prop.CALL, call).put(Prop.NAMES, list(targets)).build();
  }

  // Multiple assignment

  public static Node multiWrite(List<Node> lefts, @Nullable Node rest, List<Node> rights,
      Node value) {
    return node(NodeKind.MULTI_WRITE)
        .put(Prop.LEFTS, lefts)
        .put(Prop.REST, rest)
        .put(Prop.RIGHTS, rights)
        .put(Prop.VALUE, value)
        .build();
  }

  public static Node multiTarget(List<Node> lefts, @Nullable Node rest, List<Node> rights) {
    return node(NodeKind.MULTI_TARGET)
        .put(Prop.LEFTS, lefts)
        .put(Prop.REST, rest)
        .put(Prop.RIGHTS, rights)
        .build();
  }

  public static Node implicitRest() {
    return node(NodeKind.IMPLICIT_REST).build();
  }

  // Control flow

  public static Node and(Node left, Node right) {
    return node(NodeKind.AND).put(Prop.LEFT, left).put(Prop.RIGHT, right).build();
  }

  public static Node or(Node left, Node right) {
    return node(NodeKind.OR).put(Prop.LEFT, left).put(Prop.RIGHT, right).build();
  }

  public static Node ifNode(Node predicate, @Nullable Node statements, @Nullable Node consequent) {
    return conditional(NodeKind.IF, predicate, statements, consequent);
  }

  public static Node unless(Node predicate, @Nullable Node statements, @Nullable Node consequent) {
    return conditional(NodeKind.UNLESS, predicate, statements, consequent);
  }

  private static Node conditional(
      NodeKind kind, Node predicate, @Nullable Node statements, @Nullable Node consequent) {
    return node(kind)
        .put(Prop.PREDICATE, predicate)
        .put(Prop.STATEMENTS, statements)
        .put(Prop.CONSEQUENT, consequent)
        .build();
  }

  public static Node elseClause(@Nullable Node statements) {
    return node(NodeKind.ELSE).put(Prop.STATEMENTS, statements).build();
  }

  public static Node whileLoop(Node predicate, @Nullable Node statements, boolean beginModifier) {
    return loop(NodeKind.WHILE, predicate, statements, beginModifier);
  }

  public static Node untilLoop(Node predicate, @Nullable Node statements, boolean beginModifier) {
    return loop(NodeKind.UNTIL, predicate, statements, beginModifier);
  }

  private static Node loop(
      NodeKind kind, Node predicate, @Nullable Node statements, boolean beginModifier) {
    return node(kind)
        .put(Prop.PREDICATE, predicate)
        .put(Prop.STATEMENTS, statements)
        .put(Prop.BEGIN_MODIFIER, beginModifier)
        .build();
  }

  public static Node forLoop(Node index, Node collection, @Nullable Node statements) {
    return node(NodeKind.FOR)
        .put(Prop.INDEX, index)
        .put(Prop.COLLECTION, collection)
        .put(Prop.STATEMENTS, statements)
        .build();
  }

  public static Node caseNode(
      @Nullable Node predicate, List<Node> conditions, @Nullable Node consequent) {
    return node(NodeKind.CASE)
        .put(Prop.PREDICATE, predicate)
        .put(Prop.CONDITIONS, conditions)
        .put(Prop.CONSEQUENT, consequent)
        .build();
  }

  public static Node caseMatch(
      @Nullable Node predicate, List<Node> conditions, @Nullable Node consequent) {
    return node(NodeKind.CASE_MATCH)
        .put(Prop.PREDICATE, predicate)
        .put(Prop.CONDITIONS, conditions)
        .put(Prop.CONSEQUENT, consequent)
        .build();
  }

  public static Node when(List<Node> conditions, @Nullable Node statements) {
    return node(NodeKind.WHEN)
        .put(Prop.CONDITIONS, conditions)
        .put(Prop.STATEMENTS, statements)
        .build();
  }

  public static Node in(Node pattern, @Nullable Node statements) {
    return node(NodeKind.IN).put(Prop.PATTERN, pattern).put(Prop.STATEMENTS, statements).build();
  }

  public static Node begin(
      @Nullable Node statements,
      @Nullable Node rescueClause,
      @Nullable Node elseClause,
      @Nullable Node ensureClause) {
    checkState(rescueClause == null || rescueClause.isKind(NodeKind.RESCUE));
    checkState(elseClause == null || elseClause.isKind(NodeKind.ELSE));
    checkState(ensureClause == null || ensureClause.isKind(NodeKind.ENSURE));
    return node(NodeKind.BEGIN)
        .put(Prop.STATEMENTS, statements)
        .put(Prop.RESCUE_CLAUSE, rescueClause)
        .put(Prop.ELSE_CLAUSE, elseClause)
        .put(Prop.ENSURE_CLAUSE, ensureClause)
        .build();
  }

  public static Node rescue(
      List<Node> exceptions,
      @Nullable Node reference,
      @Nullable Node statements,
      @Nullable Node consequent) {
    checkState(consequent == null || consequent.isKind(NodeKind.RESCUE));
    return node(NodeKind.RESCUE)
        .put(Prop.EXCEPTIONS, exceptions)
        .put(Prop.REFERENCE, reference)
        .put(Prop.STATEMENTS, statements)
        .put(Prop.CONSEQUENT, consequent)
        .build();
  }

  public static Node rescueModifier(Node expression, Node rescueExpression) {
    return node(NodeKind.RESCUE_MODIFIER)
        .put(Prop.EXPRESSION, expression)
        .put(Prop.RESCUE_EXPRESSION, rescueExpression)
        .build();
  }

  public static Node ensureClause(@Nullable Node statements) {
    return node(NodeKind.ENSURE).put(Prop.STATEMENTS, statements).build();
  }

  public static Node breakNode(Node... arguments) {
    return jump(NodeKind.BREAK, arguments);
  }

  public static Node next(Node... arguments) {
    return jump(NodeKind.NEXT, arguments);
  }

  public static Node returnNode(Node... arguments) {
    return jump(NodeKind.RETURN, arguments);
  }

  private static Node jump(NodeKind kind, Node... arguments) {
    return node(kind)
        .put(Prop.ARGUMENTS, arguments.length == 0 ? null : arguments(arguments))
        .build();
  }

  public static Node redo() {
    return node(NodeKind.REDO).build();
  }

  public static Node retry() {
    return node(NodeKind.RETRY).build();
  }

  public static Node defined(Node value) {
    return node(NodeKind.DEFINED).put(Prop.VALUE, value).build();
  }

  public static Node preExecution(@Nullable Node statements) {
    return node(NodeKind.PRE_EXECUTION).put(Prop.STATEMENTS, statements).build();
  }

  public static Node postExecution(@Nullable Node statements) {
    return node(NodeKind.POST_EXECUTION).put(Prop.STATEMENTS, statements).build();
  }

  // Definitions

  public static Node def(
      @Nullable Node receiver, String name, @Nullable Node parameters, @Nullable Node body) {
    checkState(parameters == null || parameters.isKind(NodeKind.PARAMETERS));
    return node(NodeKind.DEF)
        .put(Prop.RECEIVER, receiver)
        .put(Prop.NAME, name)
        .put(Prop.PARAMETERS, parameters)
        .put(Prop.BODY, body)
        .build();
  }

  public static Node parameters(Node... requireds) {
    return parametersBuilder().put(Prop.REQUIREDS, list(requireds)).build();
  }

  /** A PARAMETERS node under construction, for lists that need more than required names. */
  public static Node.Builder parametersBuilder() {
    return node(NodeKind.PARAMETERS);
  }

  public static Node requiredParameter(String name) {
    return node(NodeKind.REQUIRED_PARAMETER).put(Prop.NAME, name).build();
  }

  public static Node optionalParameter(String name, Node value) {
    return node(NodeKind.OPTIONAL_PARAMETER).put(Prop.NAME, name).put(Prop.VALUE, value).build();
  }

  public static Node restParameter(@Nullable String name) {
    return node(NodeKind.REST_PARAMETER).put(Prop.NAME, name).build();
  }

  public static Node requiredKeywordParameter(String name) {
    return node(NodeKind.REQUIRED_KEYWORD_PARAMETER).put(Prop.NAME, name).build();
  }

  public static Node optionalKeywordParameter(String name, Node value) {
    return node(NodeKind.OPTIONAL_KEYWORD_PARAMETER)
        .put(Prop.NAME, name)
        .put(Prop.VALUE, value)
        .build();
  }

  public static Node keywordRestParameter(@Nullable String name) {
    return node(NodeKind.KEYWORD_REST_PARAMETER).put(Prop.NAME, name).build();
  }

  public static Node noKeywordsParameter() {
    return node(NodeKind.NO_KEYWORDS_PARAMETER).build();
  }

  public static Node blockParameter(@Nullable String name) {
    return node(NodeKind.BLOCK_PARAMETER).put(Prop.NAME, name).build();
  }

  public static Node forwardingParameter() {
    return node(NodeKind.FORWARDING_PARAMETER).build();
  }

  public static Node classNode(
      String name, Node constantPath, @Nullable Node superclass, @Nullable Node body) {
    return node(NodeKind.CLASS)
        .put(Prop.NAME, name)
        .put(Prop.CONSTANT_PATH, constantPath)
        .put(Prop.SUPERCLASS, superclass)
        .put(Prop.BODY, body)
        .build();
  }

  public static Node module(Node constantPath, @Nullable Node body) {
    return node(NodeKind.MODULE)
        .put(Prop.CONSTANT_PATH, constantPath)
        .put(Prop.BODY, body)
        .build();
  }

  public static Node singletonClass(Node expression, @Nullable Node body) {
    return node(NodeKind.SINGLETON_CLASS)
        .put(Prop.EXPRESSION, expression)
        .put(Prop.BODY, body)
        .build();
  }

  public static Node lambda(@Nullable Node parameters, @Nullable Node body) {
    return node(NodeKind.LAMBDA).put(Prop.PARAMETERS, parameters).put(Prop.BODY, body).build();
  }

  public static Node aliasMethod(Node newName, Node oldName) {
    return node(NodeKind.ALIAS_METHOD)
        .put(Prop.NEW_NAME, newName)
        .put(Prop.OLD_NAME, oldName)
        .build();
  }

  public static Node aliasGlobal(Node newName, Node oldName) {
    return node(NodeKind.ALIAS_GLOBAL_VARIABLE)
        .put(Prop.NEW_NAME, newName)
        .put(Prop.OLD_NAME, oldName)
        .build();
  }

  public static Node undef(Node... names) {
    checkArgument(names.length > 0, "undef needs at least one name");
    return node(NodeKind.UNDEF).put(Prop.NAMES, list(names)).build();
  }

  // Patterns

  public static Node arrayPattern(
      @Nullable Node constant, List<Node> requireds, @Nullable Node rest, List<Node> posts) {
    return node(NodeKind.ARRAY_PATTERN)
        .put(Prop.CONSTANT, constant)
        .put(Prop.REQUIREDS, requireds)
        .put(Prop.REST, rest)
        .put(Prop.POSTS, posts)
        .build();
  }

  public static Node findPattern(
      @Nullable Node constant, Node left, List<Node> requireds, Node right) {
    checkState(left.isKind(NodeKind.SPLAT) && right.isKind(NodeKind.SPLAT));
    return node(NodeKind.FIND_PATTERN)
        .put(Prop.CONSTANT, constant)
        .put(Prop.LEFT, left)
        .put(Prop.REQUIREDS, requireds)
        .put(Prop.RIGHT, right)
        .build();
  }

  public static Node hashPattern(
      @Nullable Node constant, List<Node> elements, @Nullable Node rest) {
    return node(NodeKind.HASH_PATTERN)
        .put(Prop.CONSTANT, constant)
        .put(Prop.ELEMENTS, elements)
        .put(Prop.REST, rest)
        .build();
  }

  public static Node alternationPattern(Node left, Node right) {
    return node(NodeKind.ALTERNATION_PATTERN).put(Prop.LEFT, left).put(Prop.RIGHT, right).build();
  }

  public static Node capturePattern(Node value, Node target) {
    return node(NodeKind.CAPTURE_PATTERN).put(Prop.VALUE, value).put(Prop.TARGET, target).build();
  }

  public static Node pinnedExpression(Node expression) {
    return node(NodeKind.PINNED_EXPRESSION).put(Prop.EXPRESSION, expression).build();
  }

  public static Node pinnedVariable(Node variable) {
    return node(NodeKind.PINNED_VARIABLE).put(Prop.VARIABLE, variable).build();
  }

  public static Node matchPredicate(Node value, Node pattern) {
    return node(NodeKind.MATCH_PREDICATE).put(Prop.VALUE, value).put(Prop.PATTERN, pattern).build();
  }

  public static Node matchRequired(Node value, Node pattern) {
    return node(NodeKind.MATCH_REQUIRED).put(Prop.VALUE, value).put(Prop.PATTERN, pattern).build();
  }

  /** The placeholder a recovering parser leaves where an expression was expected. */
  public static Node missing() {
    return node(NodeKind.MISSING).build();
  }
}
