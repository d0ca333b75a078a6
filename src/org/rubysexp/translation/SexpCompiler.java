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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.rubysexp.prism.Location;
import org.rubysexp.prism.Node;
import org.rubysexp.prism.NodeKind;
import org.rubysexp.prism.Prop;
import org.rubysexp.sexp.RubyComplex;
import org.rubysexp.sexp.RubyRange;
import org.rubysexp.sexp.RubyRational;
import org.rubysexp.sexp.RubyRegexp;
import org.rubysexp.sexp.RubySymbol;
import org.rubysexp.sexp.Sexp;
import org.rubysexp.sexp.SexpTag;

/**
 * Rewrites a prism syntax tree into the s-expressions of the ruby_parser gem.
 *
 * <p>There is one {@code visitXxx} rule per {@link NodeKind}. Rules call {@link #visit} on their
 * children and assemble the result bottom-up. Most rules return a {@link Sexp}; parameter rules
 * return bare {@link RubySymbol}s, and hash members return the flat list of elements they
 * contribute to the enclosing hash.
 *
 * <p>The compiler holds no per-translation state. The file being translated travels in the
 * {@link TranslationContext}, so one instance may serve any number of threads.
 */
public final class SexpCompiler {

  private static final Pattern NUMBERED_PARAMETER = Pattern.compile("_\\d");

  private final boolean heredocContentSpan;

  public SexpCompiler() {
    this(true);
  }

  /**
   * @param heredocContentSpan Whether heredoc shell strings take the lines of their body.
   */
  public SexpCompiler(boolean heredocContentSpan) {
    this.heredocContentSpan = heredocContentSpan;
  }

  /**
   * Translates {@code n}.
   *
   * @return a {@link Sexp}, a scalar element, a list of hash elements, or null for an absent node
   * @throws DispatchInvariantViolation if {@code n} only has meaning inside its parent
   */
  public @Nullable Object visit(@Nullable Node n, TranslationContext ctx) {
    if (n == null) {
      return null;
    }
    return switch (n.getKind()) {
      case ALIAS_GLOBAL_VARIABLE -> visitAliasGlobalVariable(n, ctx);
      case ALIAS_METHOD -> visitAliasMethod(n, ctx);
      case ALTERNATION_PATTERN -> visitBinary(n, SexpTag.OR, ctx);
      case AND -> visitBinary(n, SexpTag.AND, ctx);
      case ARRAY -> visitArray(n, ctx);
      case ARRAY_PATTERN -> visitArrayPattern(n, ctx);
      case ASSOC -> visitAssoc(n, ctx);
      case ASSOC_SPLAT -> visitAssocSplat(n, ctx);
      case BACK_REFERENCE_READ -> visitBackReference(n, ctx);
      case BEGIN -> visitBegin(n, ctx);
      case BLOCK_ARGUMENT ->
          ctx.build(n, SexpTag.BLOCK_PASS, visit(n.getNode(Prop.EXPRESSION), ctx));
      case BLOCK_LOCAL_VARIABLE -> symbol(n.getString(Prop.NAME));
      case BLOCK_PARAMETER -> prefixedName("&", n);
      case BLOCK_PARAMETERS -> visitBlockParameters(n, ctx);
      case BREAK -> visitJump(n, SexpTag.BREAK, false, ctx);
      case CALL -> visitCall(n, ctx);
      case CALL_AND_WRITE -> visitCallOperatorWrite(n, "&&", ctx);
      case CALL_OPERATOR_WRITE -> visitCallOperatorWrite(n, n.getString(Prop.OPERATOR), ctx);
      case CALL_OR_WRITE -> visitCallOperatorWrite(n, "||", ctx);
      case CALL_TARGET ->
          ctx.build(
              n,
              SexpTag.ATTRASGN,
              visit(n.getNode(Prop.RECEIVER), ctx),
              symbol(n.getString(Prop.NAME)));
      case CAPTURE_PATTERN ->
          visitSexp(n.getNode(Prop.TARGET), ctx).plus(visit(n.getNode(Prop.VALUE), ctx));
      case CASE, CASE_MATCH -> visitCase(n, ctx);
      case CLASS -> visitClass(n, ctx);
      case CLASS_VARIABLE_AND_WRITE -> visitLogicalWrite(n, SexpTag.OP_ASGN_AND, true, ctx);
      case CLASS_VARIABLE_OPERATOR_WRITE -> visitOperatorWrite(n, true, ctx);
      case CLASS_VARIABLE_OR_WRITE -> visitLogicalWrite(n, SexpTag.OP_ASGN_OR, true, ctx);
      case CLASS_VARIABLE_READ -> visitNamed(n, SexpTag.CVAR, ctx);
      case CLASS_VARIABLE_TARGET -> visitNamed(n, SexpTag.CVDECL, ctx);
      case CLASS_VARIABLE_WRITE -> visitVariableWrite(n, true, ctx);
      case CONSTANT_AND_WRITE -> visitLogicalWrite(n, SexpTag.OP_ASGN_AND, false, ctx);
      case CONSTANT_OPERATOR_WRITE -> visitOperatorWrite(n, true, ctx);
      case CONSTANT_OR_WRITE -> visitLogicalWrite(n, SexpTag.OP_ASGN_OR, false, ctx);
      case CONSTANT_PATH -> visitConstantPath(n, ctx);
      case CONSTANT_PATH_AND_WRITE -> visitConstantPathWrite(n, SexpTag.OP_ASGN_AND, ctx);
      case CONSTANT_PATH_OPERATOR_WRITE -> visitConstantPathWrite(n, SexpTag.OP_ASGN, ctx);
      case CONSTANT_PATH_OR_WRITE -> visitConstantPathWrite(n, SexpTag.OP_ASGN_OR, ctx);
      case CONSTANT_PATH_TARGET -> ctx.build(n, SexpTag.CONST, visitConstantPath(n, ctx));
      case CONSTANT_PATH_WRITE -> visitConstantPathWrite(n, SexpTag.CDECL, ctx);
      case CONSTANT_READ -> visitNamed(n, SexpTag.CONST, ctx);
      case CONSTANT_TARGET -> visitNamed(n, SexpTag.CDECL, ctx);
      case CONSTANT_WRITE -> visitVariableWrite(n, false, ctx);
      case DEF -> visitDef(n, ctx);
      case DEFINED -> ctx.build(n, SexpTag.DEFINED, visit(n.getNode(Prop.VALUE), ctx));
      case ELSE, PROGRAM -> visit(n.getNode(Prop.STATEMENTS), ctx);
      case EMBEDDED_STATEMENTS -> visitEmbeddedStatements(n, ctx);
      case EMBEDDED_VARIABLE ->
          ctx.build(n, SexpTag.EVSTR, visit(n.getNode(Prop.VARIABLE), ctx));
      case ENSURE -> visitOrNil(n, n.getNode(Prop.STATEMENTS), ctx);
      case FALSE -> ctx.build(n, SexpTag.FALSE);
      case FIND_PATTERN -> visitFindPattern(n, ctx);
      case FLIP_FLOP -> visitFlipFlop(n, ctx);
      case FLOAT -> ctx.build(n, SexpTag.LIT, n.getNumber(Prop.NUMBER).doubleValue());
      case FOR ->
          ctx.build(
              n,
              SexpTag.FOR,
              visit(n.getNode(Prop.COLLECTION), ctx),
              visit(n.getNode(Prop.INDEX), ctx),
              visit(n.getNode(Prop.STATEMENTS), ctx));
      case FORWARDING_ARGUMENTS, FORWARDING_PARAMETER -> ctx.build(n, SexpTag.FORWARD_ARGS);
      case FORWARDING_SUPER ->
          visitBlock(n, ctx.build(n, SexpTag.ZSUPER), n.getNode(Prop.BLOCK), ctx);
      case GLOBAL_VARIABLE_AND_WRITE -> visitLogicalWrite(n, SexpTag.OP_ASGN_AND, true, ctx);
      case GLOBAL_VARIABLE_OPERATOR_WRITE -> visitOperatorWrite(n, false, ctx);
      case GLOBAL_VARIABLE_OR_WRITE -> visitLogicalWrite(n, SexpTag.OP_ASGN_OR, true, ctx);
      case GLOBAL_VARIABLE_READ -> visitNamed(n, SexpTag.GVAR, ctx);
      case GLOBAL_VARIABLE_TARGET -> visitNamed(n, SexpTag.GASGN, ctx);
      case GLOBAL_VARIABLE_WRITE -> visitVariableWrite(n, true, ctx);
      case HASH, KEYWORD_HASH -> visitHash(n, ctx);
      case HASH_PATTERN -> visitHashPattern(n, ctx);
      case IF ->
          ctx.build(
              n,
              SexpTag.IF,
              visit(n.getNode(Prop.PREDICATE), ctx),
              visit(n.getNode(Prop.STATEMENTS), ctx),
              visit(n.getNode(Prop.CONSEQUENT), ctx));
      case IMAGINARY ->
          ctx.build(n, SexpTag.LIT, RubyComplex.imaginary(numericValue(n.getNode(Prop.NUMERIC))));
      case IMPLICIT, IMPLICIT_REST -> null;
      case IN -> visitClause(n, ctx.build(n, SexpTag.IN, visit(n.getNode(Prop.PATTERN), ctx)), ctx);
      case INDEX_AND_WRITE -> visitIndexWrite(n, "&&", ctx);
      case INDEX_OPERATOR_WRITE -> visitIndexWrite(n, n.getString(Prop.OPERATOR), ctx);
      case INDEX_OR_WRITE -> visitIndexWrite(n, "||", ctx);
      case INDEX_TARGET -> visitIndexTarget(n, ctx);
      case INSTANCE_VARIABLE_AND_WRITE ->
          visitLogicalWrite(n, SexpTag.OP_ASGN_AND, false, ctx);
      case INSTANCE_VARIABLE_OPERATOR_WRITE -> visitOperatorWrite(n, true, ctx);
      case INSTANCE_VARIABLE_OR_WRITE -> visitLogicalWrite(n, SexpTag.OP_ASGN_OR, false, ctx);
      case INSTANCE_VARIABLE_READ -> visitNamed(n, SexpTag.IVAR, ctx);
      case INSTANCE_VARIABLE_TARGET -> visitNamed(n, SexpTag.IASGN, ctx);
      case INSTANCE_VARIABLE_WRITE -> visitVariableWrite(n, true, ctx);
      case INTEGER -> ctx.build(n, SexpTag.LIT, integerValue(n.getNumber(Prop.NUMBER)));
      case INTERPOLATED_MATCH_LAST_LINE, INTERPOLATED_REGULAR_EXPRESSION ->
          visitInterpolated(n, SexpTag.DREGX, n.getLocation(), ctx);
      case INTERPOLATED_STRING -> visitInterpolated(n, SexpTag.DSTR, n.getLocation(), ctx);
      case INTERPOLATED_SYMBOL -> visitInterpolated(n, SexpTag.DSYM, n.getLocation(), ctx);
      case INTERPOLATED_X_STRING -> visitInterpolatedXString(n, ctx);
      case KEYWORD_REST_PARAMETER -> prefixedName("**", n);
      case LAMBDA -> visitLambda(n, ctx);
      case LOCAL_VARIABLE_AND_WRITE -> visitLogicalWrite(n, SexpTag.OP_ASGN_AND, true, ctx);
      case LOCAL_VARIABLE_OPERATOR_WRITE -> visitOperatorWrite(n, true, ctx);
      case LOCAL_VARIABLE_OR_WRITE -> visitLogicalWrite(n, SexpTag.OP_ASGN_OR, true, ctx);
      case LOCAL_VARIABLE_READ -> visitLocalVariableRead(n, ctx);
      case LOCAL_VARIABLE_TARGET -> visitNamed(n, SexpTag.LASGN, ctx);
      case LOCAL_VARIABLE_WRITE -> visitVariableWrite(n, true, ctx);
      case MATCH_LAST_LINE, REGULAR_EXPRESSION ->
          ctx.build(
              n, SexpTag.LIT, new RubyRegexp(n.getString(Prop.UNESCAPED), regexpOptions(n)));
      case MATCH_PREDICATE, MATCH_REQUIRED -> visitMatch(n, ctx);
      case MATCH_WRITE -> visitMatchWrite(n, ctx);
      case MODULE -> visitModule(n, ctx);
      case MULTI_TARGET ->
          ctx.build(n, SexpTag.MASGN, ctx.build(n, SexpTag.ARRAY).plusAll(visitTargets(n, ctx)));
      case MULTI_WRITE -> visitMultiWrite(n, ctx);
      case NEXT -> visitJump(n, SexpTag.NEXT, true, ctx);
      case NIL -> ctx.build(n, SexpTag.NIL);
      case NO_KEYWORDS_PARAMETER -> RubySymbol.of("**nil");
      case NUMBERED_REFERENCE_READ ->
          ctx.build(n, SexpTag.NTH_REF, integerValue(n.getNumber(Prop.NUMBER)));
      case OPTIONAL_KEYWORD_PARAMETER ->
          ctx.build(
              n, SexpTag.KWARG, symbol(n.getString(Prop.NAME)), visit(n.getNode(Prop.VALUE), ctx));
      case OPTIONAL_PARAMETER ->
          ctx.build(
              n, SexpTag.LASGN, symbol(n.getString(Prop.NAME)), visit(n.getNode(Prop.VALUE), ctx));
      case OR -> visitBinary(n, SexpTag.OR, ctx);
      case PARAMETERS -> visitParameters(n, ctx);
      case PARENTHESES -> visitOrNil(n, n.getNode(Prop.BODY), ctx);
      case PINNED_EXPRESSION -> visit(n.getNode(Prop.EXPRESSION), ctx);
      case PINNED_VARIABLE -> visitPinnedVariable(n, ctx);
      case POST_EXECUTION -> visitExecutionBlock(n, SexpTag.POSTEXE, ctx);
      case PRE_EXECUTION -> visitExecutionBlock(n, SexpTag.PREEXE, ctx);
      case RANGE -> visitRange(n, ctx);
      case RATIONAL -> ctx.build(n, SexpTag.LIT, rationalValue(n));
      case REDO -> ctx.build(n, SexpTag.REDO);
      case REQUIRED_KEYWORD_PARAMETER ->
          ctx.build(n, SexpTag.KWARG, symbol(n.getString(Prop.NAME)));
      case REQUIRED_PARAMETER -> symbol(n.getString(Prop.NAME));
      case RESCUE -> visitRescue(n, ctx);
      case RESCUE_MODIFIER -> visitRescueModifier(n, ctx);
      case REST_PARAMETER -> prefixedName("*", n);
      case RETRY -> ctx.build(n, SexpTag.RETRY);
      case RETURN -> visitJump(n, SexpTag.RETURN, true, ctx);
      case SELF -> ctx.build(n, SexpTag.SELF);
      case SINGLETON_CLASS -> visitSingletonClass(n, ctx);
      case SOURCE_ENCODING ->
          ctx.build(
              n,
              SexpTag.COLON2,
              ctx.build(n, SexpTag.CONST, RubySymbol.of("Encoding")),
              RubySymbol.of("UTF_8"));
      case SOURCE_FILE -> ctx.build(n, SexpTag.STR, ctx.getFileName());
      case SOURCE_LINE -> ctx.build(n, SexpTag.LIT, (long) n.getStartLine());
      case SPLAT -> visitSplat(n, ctx);
      case STATEMENTS -> visitStatements(n, ctx);
      case STRING -> ctx.build(n, SexpTag.STR, n.getString(Prop.UNESCAPED));
      case SUPER -> visitCallLike(n, ctx.build(n, SexpTag.SUPER), ctx);
      case SYMBOL -> visitSymbol(n, ctx);
      case TRUE -> ctx.build(n, SexpTag.TRUE);
      case UNDEF -> visitUndef(n, ctx);
      case UNLESS ->
          ctx.build(
              n,
              SexpTag.IF,
              visit(n.getNode(Prop.PREDICATE), ctx),
              visit(n.getNode(Prop.CONSEQUENT), ctx),
              visit(n.getNode(Prop.STATEMENTS), ctx));
      case UNTIL -> visitLoop(n, SexpTag.UNTIL, ctx);
      case WHEN -> visitWhen(n, ctx);
      case WHILE -> visitLoop(n, SexpTag.WHILE, ctx);
      case X_STRING -> visitXString(n, ctx);
      case YIELD ->
          ctx.build(n, SexpTag.YIELD).plusAll(visitAll(argumentList(n), ctx));
      // Only meaningful inside their parents.
      case ARGUMENTS, BLOCK, IT_PARAMETERS, MISSING, NUMBERED_PARAMETERS ->
          throw DispatchInvariantViolation.notDispatchable(n);
    };
  }

  /** Visits {@code n}, which must translate to a Sexp. */
  @VisibleForTesting
  Sexp visitSexp(Node n, TranslationContext ctx) {
    Object result = visit(n, ctx);
    if (!(result instanceof Sexp)) {
      throw new DispatchInvariantViolation(n + " did not translate to a Sexp: " + result);
    }
    return (Sexp) result;
  }

  private List<@Nullable Object> visitAll(List<Node> nodes, TranslationContext ctx) {
    List<@Nullable Object> results = new ArrayList<>(nodes.size());
    for (Node child : nodes) {
      results.add(visit(child, ctx));
    }
    return results;
  }

  // Variables, constants and assignment

  private Sexp visitNamed(Node n, SexpTag tag, TranslationContext ctx) {
    return ctx.build(n, tag, symbol(n.getString(Prop.NAME)));
  }

  /** The tags that read and write each kind of named variable. */
  private static SexpTag readTag(Node n) {
    String kind = n.getKind().name();
    if (kind.startsWith("LOCAL_")) {
      return SexpTag.LVAR;
    } else if (kind.startsWith("INSTANCE_")) {
      return SexpTag.IVAR;
    } else if (kind.startsWith("CLASS_")) {
      return SexpTag.CVAR;
    } else if (kind.startsWith("GLOBAL_")) {
      return SexpTag.GVAR;
    }
    checkState(kind.startsWith("CONSTANT_"), n);
    return SexpTag.CONST;
  }

  private static SexpTag writeTag(Node n) {
    return switch (readTag(n)) {
      case LVAR -> SexpTag.LASGN;
      case IVAR -> SexpTag.IASGN;
      case CVAR -> SexpTag.CVDECL;
      case GVAR -> SexpTag.GASGN;
      default -> SexpTag.CDECL;
    };
  }

  /**
   * {@code foo = 1}. Constant writes keep a bare comma list as a plain array; all other writes
   * turn one holding a splat into an {@code svalue}.
   */
  private Sexp visitVariableWrite(Node n, boolean writeValue, TranslationContext ctx) {
    return ctx.build(
        n, writeTag(n), symbol(n.getString(Prop.NAME)), visitValue(n, writeValue, ctx));
  }

  /** {@code foo += 1} becomes {@code foo = foo + 1}. */
  private Sexp visitOperatorWrite(Node n, boolean writeValue, TranslationContext ctx) {
    RubySymbol name = symbol(n.getString(Prop.NAME));
    Sexp call =
        ctx.build(
            n,
            SexpTag.CALL,
            ctx.build(n, readTag(n), name),
            symbol(n.getString(Prop.OPERATOR)),
            visitValue(n, writeValue, ctx));
    return ctx.build(n, writeTag(n), name, call);
  }

  /** {@code foo &&= 1} and {@code foo ||= 1}. */
  private Sexp visitLogicalWrite(
      Node n, SexpTag tag, boolean writeValue, TranslationContext ctx) {
    RubySymbol name = symbol(n.getString(Prop.NAME));
    return ctx.build(
        n,
        tag,
        ctx.build(n, readTag(n), name),
        ctx.build(n, writeTag(n), name, visitValue(n, writeValue, ctx)));
  }

  private @Nullable Object visitValue(Node n, boolean writeValue, TranslationContext ctx) {
    Node value = n.getNode(Prop.VALUE);
    return writeValue ? visitWriteValue(value, ctx) : visit(value, ctx);
  }

  /**
   * Visits the right-hand side of an assignment. A bare comma list that holds a splat, as in
   * {@code a = *b, c}, is wrapped in an {@code svalue}.
   */
  private @Nullable Object visitWriteValue(@Nullable Node value, TranslationContext ctx) {
    if (value != null
        && value.isKind(NodeKind.ARRAY)
        && !value.hasProp(Prop.OPENING_LOC)
        && value.getNodes(Prop.ELEMENTS).stream().anyMatch(e -> e.isKind(NodeKind.SPLAT))) {
      return ctx.build(value, SexpTag.SVALUE, visit(value, ctx));
    }
    return visit(value, ctx);
  }

  private Sexp visitLocalVariableRead(Node n, TranslationContext ctx) {
    String name = n.getString(Prop.NAME);
    if (NUMBERED_PARAMETER.matcher(name).matches()) {
      return ctx.build(n, SexpTag.CALL, null, symbol(name));
    }
    return ctx.build(n, SexpTag.LVAR, symbol(name));
  }

  private Sexp visitConstantPath(Node n, TranslationContext ctx) {
    Node parent = n.getNode(Prop.PARENT);
    RubySymbol name = symbol(n.getString(Prop.NAME));
    if (parent == null) {
      return ctx.build(n, SexpTag.COLON3, name);
    }
    return ctx.build(n, SexpTag.COLON2, visit(parent, ctx), name);
  }

  /** {@code Foo::Bar = 1} and its operator forms. */
  private Sexp visitConstantPathWrite(Node n, SexpTag tag, TranslationContext ctx) {
    Sexp result = ctx.build(n, tag, visit(n.getNode(Prop.TARGET), ctx));
    if (tag == SexpTag.OP_ASGN) {
      result = result.plus(symbol(n.getString(Prop.OPERATOR)));
    }
    return result.plus(visitWriteValue(n.getNode(Prop.VALUE), ctx));
  }

  private Sexp visitMultiWrite(Node n, TranslationContext ctx) {
    Sexp targets = ctx.build(n, SexpTag.ARRAY).plusAll(visitTargets(n, ctx));
    Node value = n.getNode(Prop.VALUE);
    Object result = visit(value, ctx);
    // A literal [...] is already an array; anything else is coerced with to_ary.
    if (!(value.isKind(NodeKind.ARRAY) && value.hasProp(Prop.OPENING_LOC))) {
      result = ctx.build(n, SexpTag.TO_ARY, result);
    }
    return ctx.build(n, SexpTag.MASGN, targets, result);
  }

  private List<@Nullable Object> visitTargets(Node n, TranslationContext ctx) {
    List<Node> targets = new ArrayList<>(n.getNodes(Prop.LEFTS));
    Node rest = n.getNode(Prop.REST);
    if (rest != null && !rest.isKind(NodeKind.IMPLICIT_REST)) {
      targets.add(rest);
    }
    targets.addAll(n.getNodes(Prop.RIGHTS));
    return visitAll(targets, ctx);
  }

  // Calls

  private Sexp visitCall(Node n, TranslationContext ctx) {
    String name = n.getString(Prop.NAME);
    List<Node> arguments = argumentList(n);
    Node receiver = n.getNode(Prop.RECEIVER);
    if (name.equals("!~")) {
      return ctx.build(n, SexpTag.NOT, visit(n.withProp(Prop.NAME, "=~"), ctx));
    }
    if (name.equals("=~") && arguments.size() == 1 && !n.hasProp(Prop.BLOCK) && receiver != null) {
      switch (receiver.getKind()) {
        case STRING:
          return ctx.build(
              n, SexpTag.MATCH3, visit(arguments.get(0), ctx), visit(receiver, ctx));
        case REGULAR_EXPRESSION:
        case INTERPOLATED_REGULAR_EXPRESSION:
          return ctx.build(
              n, SexpTag.MATCH2, visit(receiver, ctx), visit(arguments.get(0), ctx));
        default:
          break;
      }
    }

    SexpTag tag;
    if (n.getFlag(Prop.ATTRIBUTE_WRITE)) {
      tag = n.getFlag(Prop.SAFE_NAVIGATION) ? SexpTag.SAFE_ATTRASGN : SexpTag.ATTRASGN;
    } else {
      tag = n.getFlag(Prop.SAFE_NAVIGATION) ? SexpTag.SAFE_CALL : SexpTag.CALL;
    }
    return visitCallLike(n, ctx.build(n, tag, visit(receiver, ctx), symbol(name)), ctx);
  }

  /**
   * Appends the arguments of {@code n} to {@code call}. A block argument ({@code &blk}) becomes
   * the last argument; a literal block wraps the whole call in an {@code iter}.
   */
  private Sexp visitCallLike(Node n, Sexp call, TranslationContext ctx) {
    List<Node> arguments = new ArrayList<>(argumentList(n));
    Node block = n.getNode(Prop.BLOCK);
    if (block != null && block.isKind(NodeKind.BLOCK_ARGUMENT)) {
      arguments.add(block);
      block = null;
    }
    return visitBlock(n, call.plusAll(visitAll(arguments, ctx)), block, ctx);
  }

  /**
   * Wraps {@code call} in an {@code iter} for {@code block}, if there is one. A block with no
   * parameter list, or only implicit {@code _1}/{@code it} parameters, gets {@code 0} for its
   * parameters.
   */
  private Sexp visitBlock(Node n, Sexp call, @Nullable Node block, TranslationContext ctx) {
    if (block == null) {
      return call;
    }
    checkState(block.isKind(NodeKind.BLOCK), block);
    Node parameters = block.getNode(Prop.PARAMETERS);
    Object args = hasImplicitParameters(parameters) ? (Object) 0L : visit(parameters, ctx);
    Sexp iter = ctx.build(n, SexpTag.ITER, call, args);
    Node body = block.getNode(Prop.BODY);
    return body == null ? iter : iter.plus(visit(body, ctx));
  }

  private static boolean hasImplicitParameters(@Nullable Node parameters) {
    return parameters == null
        || parameters.isKind(NodeKind.NUMBERED_PARAMETERS)
        || parameters.isKind(NodeKind.IT_PARAMETERS);
  }

  /** The arguments of a call-like node. The ARGUMENTS node holding them is never visited. */
  private static List<Node> argumentList(Node n) {
    Node arguments = n.getNode(Prop.ARGUMENTS);
    return arguments == null ? List.of() : arguments.getNodes(Prop.ARGUMENT_LIST);
  }

  /**
   * {@code foo.bar += 1}. A {@code ::} call addresses a constant-like path and becomes an
   * {@code op_asgn}; a dotted call addresses an accessor pair and becomes an {@code op_asgn2}.
   */
  private Sexp visitCallOperatorWrite(Node n, String operator, TranslationContext ctx) {
    Object receiver = visit(n.getNode(Prop.RECEIVER), ctx);
    Object value = visitWriteValue(n.getNode(Prop.VALUE), ctx);
    if ("::".equals(n.getString(Prop.CALL_OPERATOR))) {
      return ctx.build(
          n,
          SexpTag.OP_ASGN,
          receiver,
          value,
          symbol(n.getString(Prop.READ_NAME)),
          symbol(operator));
    }
    return ctx.build(
        n,
        SexpTag.OP_ASGN2,
        receiver,
        symbol(n.getString(Prop.WRITE_NAME)),
        symbol(operator),
        value);
  }

  /** {@code foo[bar] += 1} */
  private Sexp visitIndexWrite(Node n, String operator, TranslationContext ctx) {
    Sexp arglist = ctx.build(n, SexpTag.ARGLIST).plusAll(visitAll(argumentList(n), ctx));
    return ctx.build(
        n,
        SexpTag.OP_ASGN1,
        visit(n.getNode(Prop.RECEIVER), ctx),
        arglist,
        symbol(operator),
        visitWriteValue(n.getNode(Prop.VALUE), ctx));
  }

  private Sexp visitIndexTarget(Node n, TranslationContext ctx) {
    return ctx.build(n, SexpTag.ATTRASGN, visit(n.getNode(Prop.RECEIVER), ctx), symbol("[]="))
        .plusAll(visitAll(argumentList(n), ctx));
  }

  private Sexp visitMatchWrite(Node n, TranslationContext ctx) {
    Node call = n.getNode(Prop.CALL);
    return ctx.build(
        n,
        SexpTag.MATCH2,
        visit(call.getNode(Prop.RECEIVER), ctx),
        visit(argumentList(call).get(0), ctx));
  }

  private Sexp visitSplat(Node n, TranslationContext ctx) {
    Node expression = n.getNode(Prop.EXPRESSION);
    Sexp splat = ctx.build(n, SexpTag.SPLAT);
    return expression == null ? splat : splat.plus(visit(expression, ctx));
  }

  /** {@code break}, {@code next} and {@code return}. */
  private Sexp visitJump(Node n, SexpTag tag, boolean splatValue, TranslationContext ctx) {
    Node argumentsNode = n.getNode(Prop.ARGUMENTS);
    if (argumentsNode == null) {
      return ctx.build(n, tag);
    }
    List<Node> arguments = argumentList(n);
    if (arguments.size() == 1) {
      Node argument = arguments.get(0);
      if (splatValue && argument.isKind(NodeKind.SPLAT)) {
        return ctx.build(n, tag, ctx.build(n, SexpTag.SVALUE, visit(argument, ctx)));
      }
      return ctx.build(n, tag, visit(argument, ctx));
    }
    Sexp array = ctx.build(argumentsNode, SexpTag.ARRAY).plusAll(visitAll(arguments, ctx));
    return ctx.build(n, tag, array);
  }

  // Literals

  @VisibleForTesting
  static Number integerValue(Number value) {
    if (value instanceof BigInteger) {
      BigInteger big = (BigInteger) value;
      return big.bitLength() < Long.SIZE ? (Number) big.longValue() : big;
    }
    return value.longValue();
  }

  private static BigInteger bigIntegerValue(Number value) {
    return value instanceof BigInteger ? (BigInteger) value : BigInteger.valueOf(value.longValue());
  }

  private static RubyRational rationalValue(Node n) {
    return RubyRational.of(
        bigIntegerValue(n.getNumber(Prop.NUMERATOR)),
        bigIntegerValue(n.getNumber(Prop.DENOMINATOR)));
  }

  /** The value of the literal an imaginary literal wraps. */
  private static Number numericValue(Node numeric) {
    return switch (numeric.getKind()) {
      case INTEGER -> integerValue(numeric.getNumber(Prop.NUMBER));
      case FLOAT -> numeric.getNumber(Prop.NUMBER).doubleValue();
      case RATIONAL -> rationalValue(numeric);
      default -> throw new DispatchInvariantViolation("Not a numeric literal: " + numeric);
    };
  }

  /** The {@code Regexp} option bits for the flags of a regular expression literal. */
  @VisibleForTesting
  static int regexpOptions(Node n) {
    int options = 0;
    if (n.getFlag(Prop.IGNORE_CASE)) {
      options |= RubyRegexp.IGNORECASE;
    }
    if (n.getFlag(Prop.EXTENDED)) {
      options |= RubyRegexp.EXTENDED;
    }
    if (n.getFlag(Prop.MULTI_LINE)) {
      options |= RubyRegexp.MULTILINE;
    }
    if (n.getFlag(Prop.EUC_JP) || n.getFlag(Prop.WINDOWS_31J) || n.getFlag(Prop.UTF_8)) {
      options |= RubyRegexp.FIXEDENCODING;
    }
    if (n.getFlag(Prop.ASCII_8BIT)) {
      options |= RubyRegexp.NOENCODING;
    }
    return options;
  }

  private Sexp visitSymbol(Node n, TranslationContext ctx) {
    // :!@ unescapes to :!, but ruby_parser keeps the spelling.
    if ("!@".equals(n.getString(Prop.SYMBOL_VALUE))) {
      return ctx.build(n, SexpTag.LIT, symbol("!@"));
    }
    return ctx.build(n, SexpTag.LIT, symbol(n.getString(Prop.UNESCAPED)));
  }

  private Sexp visitRange(Node n, TranslationContext ctx) {
    Node left = n.getNode(Prop.LEFT);
    Node right = n.getNode(Prop.RIGHT);
    boolean excludeEnd = n.getFlag(Prop.EXCLUDE_END);
    if (left != null && right != null && isFoldableBound(left) && isFoldableBound(right)) {
      return ctx.build(
          n, SexpTag.LIT, new RubyRange(boundValue(left), boundValue(right), excludeEnd));
    }
    return ctx.build(
        n, excludeEnd ? SexpTag.DOT3 : SexpTag.DOT2, visit(left, ctx), visit(right, ctx));
  }

  private static boolean isFoldableBound(Node bound) {
    return bound.isKind(NodeKind.INTEGER) || bound.isKind(NodeKind.NIL);
  }

  private static @Nullable Number boundValue(Node bound) {
    return bound.isKind(NodeKind.INTEGER) ? integerValue(bound.getNumber(Prop.NUMBER)) : null;
  }

  private Sexp visitFlipFlop(Node n, TranslationContext ctx) {
    Node left = n.getNode(Prop.LEFT);
    Node right = n.getNode(Prop.RIGHT);
    boolean excludeEnd = n.getFlag(Prop.EXCLUDE_END);
    if (left != null
        && right != null
        && left.isKind(NodeKind.INTEGER)
        && right.isKind(NodeKind.INTEGER)) {
      return ctx.build(
          n, SexpTag.LIT, new RubyRange(boundValue(left), boundValue(right), excludeEnd));
    }
    return ctx.build(
        n, excludeEnd ? SexpTag.FLIP3 : SexpTag.FLIP2, visit(left, ctx), visit(right, ctx));
  }

  private Sexp visitXString(Node n, TranslationContext ctx) {
    Sexp result = ctx.build(n, SexpTag.XSTR, n.getString(Prop.UNESCAPED));
    Location content = n.getLocation(Prop.CONTENT_LOC);
    if (heredocContentSpan && n.getFlag(Prop.HEREDOC) && content != null) {
      result = result.withLines(content.startLine(), content.endLine());
    }
    return result;
  }

  private Sexp visitInterpolatedXString(Node n, TranslationContext ctx) {
    List<Node> parts = n.getNodes(Prop.PARTS);
    Location span =
        heredocContentSpan && n.getFlag(Prop.HEREDOC) && !parts.isEmpty()
            ? parts.get(0).getLocation()
            : n.getLocation();
    return visitInterpolated(n, SexpTag.DXSTR, span, ctx);
  }

  /**
   * Linearizes the parts of an interpolated literal. The result always starts with a plain
   * string: the first part's text if it is a literal segment, else {@code ""}.
   */
  private Sexp visitInterpolated(Node n, SexpTag tag, Location span, TranslationContext ctx) {
    List<Node> parts = n.getNodes(Prop.PARTS);
    List<@Nullable Object> elements = new ArrayList<>(parts.size() + 1);
    for (int i = 0; i < parts.size(); i++) {
      Node part = parts.get(i);
      if (i == 0) {
        if (part.isKind(NodeKind.STRING)) {
          elements.add(part.getString(Prop.UNESCAPED));
          continue;
        }
        elements.add("");
      }
      elements.add(visit(part, ctx));
    }
    return ctx.build(span, tag).plusAll(elements);
  }

  private Sexp visitEmbeddedStatements(Node n, TranslationContext ctx) {
    Node statements = n.getNode(Prop.STATEMENTS);
    Sexp evstr = ctx.build(n, SexpTag.EVSTR);
    return statements == null ? evstr : evstr.plus(visit(statements, ctx));
  }

  private Sexp visitArray(Node n, TranslationContext ctx) {
    return ctx.build(n, SexpTag.ARRAY).plusAll(visitAll(n.getNodes(Prop.ELEMENTS), ctx));
  }

  private Sexp visitHash(Node n, TranslationContext ctx) {
    return ctx.build(n, SexpTag.HASH).plusAll(visitHashElements(n, ctx));
  }

  /** Flattens the key/value pairs and double splats of a hash into one element list. */
  private List<@Nullable Object> visitHashElements(Node n, TranslationContext ctx) {
    List<@Nullable Object> elements = new ArrayList<>();
    for (Node element : n.getNodes(Prop.ELEMENTS)) {
      Object result = visit(element, ctx);
      if (result instanceof List) {
        elements.addAll((List<?>) result);
      } else {
        elements.add(result);
      }
    }
    return elements;
  }

  private List<@Nullable Object> visitAssoc(Node n, TranslationContext ctx) {
    return Arrays.asList(visit(n.getNode(Prop.KEY), ctx), visit(n.getNode(Prop.VALUE), ctx));
  }

  private List<@Nullable Object> visitAssocSplat(Node n, TranslationContext ctx) {
    Node value = n.getNode(Prop.VALUE);
    Sexp kwsplat = ctx.build(n, SexpTag.KWSPLAT);
    return List.of(value == null ? kwsplat : kwsplat.plus(visit(value, ctx)));
  }

  private Sexp visitBackReference(Node n, TranslationContext ctx) {
    String name = n.getString(Prop.NAME);
    return ctx.build(n, SexpTag.BACK_REF, symbol(name.startsWith("$") ? name.substring(1) : name));
  }

  // Control flow

  private Sexp visitBinary(Node n, SexpTag tag, TranslationContext ctx) {
    return ctx.build(n, tag, visit(n.getNode(Prop.LEFT), ctx), visit(n.getNode(Prop.RIGHT), ctx));
  }

  private @Nullable Object visitStatements(Node n, TranslationContext ctx) {
    List<Node> body = n.getNodes(Prop.STATEMENT_LIST);
    if (body.size() <= 1) {
      return body.isEmpty() ? null : visit(body.get(0), ctx);
    }
    return ctx.build(n, SexpTag.BLOCK).plusAll(visitAll(body, ctx));
  }

  /** Visits {@code child}, or makes a {@code (nil)} spanning {@code n} when it is absent. */
  private @Nullable Object visitOrNil(Node n, @Nullable Node child, TranslationContext ctx) {
    return child == null ? ctx.build(n, SexpTag.NIL) : visit(child, ctx);
  }

  /**
   * Folds a begin block from the inside out: the body, then a {@code rescue} holding the body
   * and every rescue clause of the chain, then the else branch, then an {@code ensure} around all
   * of it. Each wrapper spans the first clause present, in the order statements, rescue, else,
   * ensure.
   */
  private @Nullable Object visitBegin(Node n, TranslationContext ctx) {
    Node statements = n.getNode(Prop.STATEMENTS);
    Node rescueClause = n.getNode(Prop.RESCUE_CLAUSE);
    Node elseClause = n.getNode(Prop.ELSE_CLAUSE);
    Node ensureClause = n.getNode(Prop.ENSURE_CLAUSE);

    Object result = statements == null ? ctx.build(n, SexpTag.NIL) : visit(statements, ctx);

    if (rescueClause != null) {
      Sexp rescue =
          statements != null
              ? ctx.build(statements, SexpTag.RESCUE, result, visit(rescueClause, ctx))
              : ctx.build(rescueClause, SexpTag.RESCUE, visit(rescueClause, ctx));
      List<Object> chained = new ArrayList<>();
      for (Node current = rescueClause.getNode(Prop.CONSEQUENT);
          current != null;
          current = current.getNode(Prop.CONSEQUENT)) {
        chained.add(visit(current, ctx));
      }
      result = rescue.plusAll(chained);
    }

    if (elseClause != null && elseClause.getNode(Prop.STATEMENTS) != null) {
      checkState(result instanceof Sexp, "else branch without a body to attach to: %s", n);
      result = ((Sexp) result).plus(visit(elseClause, ctx));
    }

    if (ensureClause != null) {
      if (statements != null || rescueClause != null || elseClause != null) {
        Node spanSource =
            statements != null ? statements : rescueClause != null ? rescueClause : elseClause;
        result = ctx.build(spanSource, SexpTag.ENSURE, result, visit(ensureClause, ctx));
      } else {
        result = ctx.build(ensureClause, SexpTag.ENSURE, visit(ensureClause, ctx));
      }
    }
    return result;
  }

  /** One {@code rescue} clause, without the clauses chained after it. */
  private Sexp visitRescue(Node n, TranslationContext ctx) {
    Sexp exceptions =
        ctx.build(n, SexpTag.ARRAY).plusAll(visitAll(n.getNodes(Prop.EXCEPTIONS), ctx));
    Node reference = n.getNode(Prop.REFERENCE);
    if (reference != null) {
      exceptions =
          exceptions.plus(
              visitSexp(reference, ctx)
                  .plus(ctx.build(reference, SexpTag.GVAR, symbol("$!"))));
    }
    return visitClause(n, ctx.build(n, SexpTag.RESBODY, exceptions), ctx);
  }

  private Sexp visitRescueModifier(Node n, TranslationContext ctx) {
    Sexp resbody =
        ctx.build(
            n,
            SexpTag.RESBODY,
            ctx.build(n, SexpTag.ARRAY),
            visit(n.getNode(Prop.RESCUE_EXPRESSION), ctx));
    return ctx.build(n, SexpTag.RESCUE, visit(n.getNode(Prop.EXPRESSION), ctx), resbody);
  }

  /** Appends each statement of a clause body to {@code head}, or a single nil if it has none. */
  private Sexp visitClause(Node n, Sexp head, TranslationContext ctx) {
    Node statements = n.getNode(Prop.STATEMENTS);
    if (statements == null) {
      return head.plus(null);
    }
    return head.plusAll(visitAll(statements.getNodes(Prop.STATEMENT_LIST), ctx));
  }

  private Sexp visitCase(Node n, TranslationContext ctx) {
    return ctx.build(n, SexpTag.CASE, visit(n.getNode(Prop.PREDICATE), ctx))
        .plusAll(visitAll(n.getNodes(Prop.CONDITIONS), ctx))
        .plus(visit(n.getNode(Prop.CONSEQUENT), ctx));
  }

  private Sexp visitWhen(Node n, TranslationContext ctx) {
    Sexp conditions =
        ctx.build(n, SexpTag.ARRAY).plusAll(visitAll(n.getNodes(Prop.CONDITIONS), ctx));
    return visitClause(n, ctx.build(n, SexpTag.WHEN, conditions), ctx);
  }

  /** {@code foo in bar} and {@code foo => bar} are one-branch case expressions. */
  private Sexp visitMatch(Node n, TranslationContext ctx) {
    return ctx.build(
        n,
        SexpTag.CASE,
        visit(n.getNode(Prop.VALUE), ctx),
        ctx.build(n, SexpTag.IN, visit(n.getNode(Prop.PATTERN), ctx), null),
        null);
  }

  /** The last element is true for a loop that tests before its first iteration. */
  private Sexp visitLoop(Node n, SexpTag tag, TranslationContext ctx) {
    return ctx.build(
        n,
        tag,
        visit(n.getNode(Prop.PREDICATE), ctx),
        visit(n.getNode(Prop.STATEMENTS), ctx),
        !n.getFlag(Prop.BEGIN_MODIFIER));
  }

  private Sexp visitExecutionBlock(Node n, SexpTag tag, TranslationContext ctx) {
    return ctx.build(
        n, SexpTag.ITER, ctx.build(n, tag), 0L, visit(n.getNode(Prop.STATEMENTS), ctx));
  }

  // Patterns

  private Sexp visitArrayPattern(Node n, TranslationContext ctx) {
    Sexp result =
        ctx.build(n, SexpTag.ARRAY_PAT, visit(n.getNode(Prop.CONSTANT), ctx))
            .plusAll(visitAll(n.getNodes(Prop.REQUIREDS), ctx));
    Node rest = n.getNode(Prop.REST);
    if (rest != null && rest.isKind(NodeKind.SPLAT)) {
      result = result.plus(restMarker("*", rest));
    }
    return result.plusAll(visitAll(n.getNodes(Prop.POSTS), ctx));
  }

  private Sexp visitFindPattern(Node n, TranslationContext ctx) {
    return ctx.build(
            n,
            SexpTag.FIND_PAT,
            visit(n.getNode(Prop.CONSTANT), ctx),
            restMarker("*", n.getNode(Prop.LEFT)))
        .plusAll(visitAll(n.getNodes(Prop.REQUIREDS), ctx))
        .plus(restMarker("*", n.getNode(Prop.RIGHT)));
  }

  private Sexp visitHashPattern(Node n, TranslationContext ctx) {
    Sexp result =
        ctx.build(n, SexpTag.HASH_PAT, visit(n.getNode(Prop.CONSTANT), ctx))
            .plusAll(visitHashElements(n, ctx));
    Node rest = n.getNode(Prop.REST);
    if (rest != null && rest.isKind(NodeKind.ASSOC_SPLAT)) {
      result = result.plus(ctx.build(rest, SexpTag.KWREST, restMarker("**", rest)));
    } else if (rest != null && rest.isKind(NodeKind.NO_KEYWORDS_PARAMETER)) {
      result = result.plus(visit(rest, ctx));
    }
    return result;
  }

  /**
   * The symbol naming a rest position: {@code :*name} for {@code *name} and a bare {@code :*}
   * for an anonymous rest.
   */
  private static RubySymbol restMarker(String prefix, Node splat) {
    Node target =
        splat.isKind(NodeKind.ASSOC_SPLAT)
            ? splat.getNode(Prop.VALUE)
            : splat.getNode(Prop.EXPRESSION);
    String name = target == null ? null : target.getString(Prop.NAME);
    return symbol(prefix + (name == null ? "" : name));
  }

  private Sexp visitPinnedVariable(Node n, TranslationContext ctx) {
    Node variable = n.getNode(Prop.VARIABLE);
    // ^_1 pins the numbered parameter as a local, not as a call.
    if (variable.isKind(NodeKind.LOCAL_VARIABLE_READ)
        && NUMBERED_PARAMETER.matcher(variable.getString(Prop.NAME)).matches()) {
      return ctx.build(n, SexpTag.LVAR, symbol(variable.getString(Prop.NAME)));
    }
    return visitSexp(variable, ctx);
  }

  // Definitions

  private Sexp visitDef(Node n, TranslationContext ctx) {
    Node parametersNode = n.getNode(Prop.PARAMETERS);
    Object parameters =
        parametersNode == null ? ctx.build(n, SexpTag.ARGS) : visit(parametersNode, ctx);
    Object body = visitOrNil(n, n.getNode(Prop.BODY), ctx);
    RubySymbol name = symbol(n.getString(Prop.NAME));
    Node receiver = n.getNode(Prop.RECEIVER);
    if (receiver == null) {
      return ctx.build(n, SexpTag.DEFN, name, parameters, body);
    }
    return ctx.build(n, SexpTag.DEFS, visit(receiver, ctx), name, parameters, body);
  }

  /**
   * The {@code args} of a method: required, optional, rest, post, keyword, keyword rest and
   * block parameters, in that order.
   */
  private Sexp visitParameters(Node n, TranslationContext ctx) {
    List<@Nullable Object> children = new ArrayList<>();
    for (Node required : n.getNodes(Prop.REQUIREDS)) {
      children.add(visitParameter(required, ctx));
    }
    for (Node optional : n.getNodes(Prop.OPTIONALS)) {
      children.add(visit(optional, ctx));
    }
    if (n.getNode(Prop.REST) != null) {
      children.add(visit(n.getNode(Prop.REST), ctx));
    }
    for (Node post : n.getNodes(Prop.POSTS)) {
      children.add(visitParameter(post, ctx));
    }
    for (Node keyword : n.getNodes(Prop.KEYWORDS)) {
      children.add(visit(keyword, ctx));
    }
    if (n.getNode(Prop.KEYWORD_REST) != null) {
      children.add(visit(n.getNode(Prop.KEYWORD_REST), ctx));
    }
    if (n.getNode(Prop.BLOCK) != null) {
      children.add(visit(n.getNode(Prop.BLOCK), ctx));
    }
    return ctx.build(n, SexpTag.ARGS).plusAll(children);
  }

  private @Nullable Object visitParameter(Node n, TranslationContext ctx) {
    return n.isKind(NodeKind.MULTI_TARGET) ? visitDestructuredParameter(n, ctx) : visit(n, ctx);
  }

  /** {@code def foo((bar, *baz))} */
  private Sexp visitDestructuredParameter(Node n, TranslationContext ctx) {
    List<Node> targets = new ArrayList<>(n.getNodes(Prop.LEFTS));
    Node rest = n.getNode(Prop.REST);
    // The trailing comma of (a,) leaves an unnamed implicit rest that adds nothing.
    if (rest != null && !rest.isKind(NodeKind.IMPLICIT_REST)) {
      targets.add(rest);
    }
    targets.addAll(n.getNodes(Prop.RIGHTS));

    List<@Nullable Object> children = new ArrayList<>(targets.size());
    for (Node child : targets) {
      children.add(
          switch (child.getKind()) {
            case REQUIRED_PARAMETER -> visit(child, ctx);
            case MULTI_TARGET -> visitDestructuredParameter(child, ctx);
            case SPLAT -> restMarker("*", child);
            default ->
                throw new DispatchInvariantViolation(
                    "Unexpected " + child.getKind() + " in destructured parameter " + n);
          });
    }
    return ctx.build(n, SexpTag.MASGN).plusAll(children);
  }

  /**
   * Block parameters. Parenthesized ones ({@code -> (a) {}}) span their parentheses; block-local
   * names ({@code |a; b|}) follow in a {@code shadow}.
   */
  private Sexp visitBlockParameters(Node n, TranslationContext ctx) {
    Node parameters = n.getNode(Prop.PARAMETERS);
    Sexp result = parameters == null ? ctx.build(n, SexpTag.ARGS) : visitSexp(parameters, ctx);

    Location opening = n.getLocation(Prop.OPENING_LOC);
    Location closing = n.getLocation(Prop.CLOSING_LOC);
    if ("(".equals(n.getString(Prop.OPENING)) && opening != null && closing != null) {
      result = result.withLines(opening.startLine(), closing.endLine());
    }

    List<Node> locals = n.getNodes(Prop.LOCALS);
    if (!locals.isEmpty()) {
      result = result.plus(ctx.build(n, SexpTag.SHADOW).plusAll(visitAll(locals, ctx)));
    }
    return result;
  }

  private Sexp visitLambda(Node n, TranslationContext ctx) {
    Node parametersNode = n.getNode(Prop.PARAMETERS);
    Object parameters =
        hasImplicitParameters(parametersNode)
            ? ctx.build(n, SexpTag.ARGS)
            : visit(parametersNode, ctx);
    Sexp iter = ctx.build(n, SexpTag.ITER, ctx.build(n, SexpTag.LAMBDA), parameters);
    Node body = n.getNode(Prop.BODY);
    return body == null ? iter : iter.plus(visit(body, ctx));
  }

  private Sexp visitClass(Node n, TranslationContext ctx) {
    Sexp result =
        ctx.build(
            n,
            SexpTag.CLASS,
            symbol(n.getString(Prop.NAME)),
            visit(n.getNode(Prop.SUPERCLASS), ctx));
    return appendBody(result, n.getNode(Prop.BODY), ctx);
  }

  private Sexp visitModule(Node n, TranslationContext ctx) {
    Node path = n.getNode(Prop.CONSTANT_PATH);
    Object name =
        path.isKind(NodeKind.CONSTANT_READ) ? symbol(path.getString(Prop.NAME)) : visit(path, ctx);
    return appendBody(ctx.build(n, SexpTag.MODULE, name), n.getNode(Prop.BODY), ctx);
  }

  /** Splices the statements of a class or module body; a begin body is one element. */
  private Sexp appendBody(Sexp head, @Nullable Node body, TranslationContext ctx) {
    if (body == null) {
      return head;
    } else if (body.isKind(NodeKind.STATEMENTS)) {
      return head.plusAll(visitAll(body.getNodes(Prop.STATEMENT_LIST), ctx));
    }
    return head.plus(visit(body, ctx));
  }

  private Sexp visitSingletonClass(Node n, TranslationContext ctx) {
    Sexp result = ctx.build(n, SexpTag.SCLASS, visit(n.getNode(Prop.EXPRESSION), ctx));
    Node body = n.getNode(Prop.BODY);
    return body == null ? result : result.plus(visit(body, ctx));
  }

  private Sexp visitAliasMethod(Node n, TranslationContext ctx) {
    return ctx.build(
        n,
        SexpTag.ALIAS,
        visit(n.getNode(Prop.NEW_NAME), ctx),
        visit(n.getNode(Prop.OLD_NAME), ctx));
  }

  private Sexp visitAliasGlobalVariable(Node n, TranslationContext ctx) {
    return ctx.build(
        n,
        SexpTag.VALIAS,
        symbol(globalName(n.getNode(Prop.NEW_NAME))),
        symbol(globalName(n.getNode(Prop.OLD_NAME))));
  }

  /** The name of a global, a back reference ({@code $&}) or a numbered reference ({@code $1}). */
  private static String globalName(Node n) {
    if (n.isKind(NodeKind.NUMBERED_REFERENCE_READ)) {
      return "$" + n.getNumber(Prop.NUMBER);
    }
    return n.getString(Prop.NAME);
  }

  /** {@code undef a, b} becomes a block of one {@code undef} per name. */
  private Object visitUndef(Node n, TranslationContext ctx) {
    List<Node> names = n.getNodes(Prop.NAMES);
    List<@Nullable Object> undefs = new ArrayList<>(names.size());
    for (Node name : names) {
      undefs.add(ctx.build(n, SexpTag.UNDEF, visit(name, ctx)));
    }
    return undefs.size() == 1 ? undefs.get(0) : ctx.build(n, SexpTag.BLOCK).plusAll(undefs);
  }

  private static RubySymbol symbol(String name) {
    return RubySymbol.of(name);
  }

  /** {@code :*name}, {@code :**name} or {@code :&name}; the prefix alone when anonymous. */
  private static RubySymbol prefixedName(String prefix, Node n) {
    String name = n.getString(Prop.NAME);
    return symbol(prefix + (name == null ? "" : name));
  }
}
