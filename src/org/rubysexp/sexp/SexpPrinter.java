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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Prints Sexp trees in the form {@code Sexp#inspect} produces in Ruby, e.g.
 * {@code s(:lasgn, :foo, s(:lit, 1))}, optionally followed by each node's line.
 */
public final class SexpPrinter {

  // Symbols that print without quotes: identifiers, variables, constants and operator methods.
  private static final Pattern PLAIN_SYMBOL =
      Pattern.compile(
          "(?:\\$|@@?)?[A-Za-z_][A-Za-z0-9_]*[?!=]?"
              + "|\\$(?:[~*$?!@/\\\\;,.=:<>\"&`'+0]|[1-9][0-9]*)"
              + "|\\[\\]=?|[-+*/%<>!~^&|]|\\*\\*|[-+!~]@|===?|=~|!=|!~|<=>|<=|>=|<<|>>");

  private SexpPrinter() {}

  /** Formats a non-Sexp element. {@code inspect} quotes symbols the way Ruby would. */
  static String formatScalar(@Nullable Object value, boolean inspect) {
    if (value == null) {
      return "nil";
    }
    if (value instanceof RubySymbol) {
      String name = ((RubySymbol) value).getName();
      return inspect && !PLAIN_SYMBOL.matcher(name).matches() ? ":" + quote(name) : ":" + name;
    }
    if (value instanceof String) {
      return quote((String) value);
    }
    if (value instanceof Double) {
      return formatDouble((Double) value);
    }
    return value.toString();
  }

  /** Formats a float the way Ruby's {@code Float#inspect} does. */
  static String formatDouble(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "Infinity" : "-Infinity";
    }
    if (value == 0) {
      return 1 / value < 0 ? "-0.0" : "0.0";
    }
    BigDecimal digits = shortestDigits(value);
    double magnitude = Math.abs(value);
    if (magnitude >= 1e16 || magnitude < 1e-4) {
      String unscaled = digits.unscaledValue().abs().toString();
      int exponent = unscaled.length() - 1 - digits.scale();
      String fraction = unscaled.length() > 1 ? unscaled.substring(1) : "0";
      return (value < 0 ? "-" : "")
          + unscaled.charAt(0)
          + "."
          + fraction
          + String.format("e%+03d", exponent);
    }
    String plain = digits.toPlainString();
    return plain.contains(".") ? plain : plain + ".0";
  }

  /**
   * Returns the fewest significant digits that read back as {@code value}. Double.toString
   * does not always produce these before JDK 19.
   */
  private static BigDecimal shortestDigits(double value) {
    BigDecimal exact = new BigDecimal(value);
    for (int precision = 1; precision < 17; precision++) {
      BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
      if (candidate.doubleValue() == value) {
        return candidate.stripTrailingZeros();
      }
    }
    return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
  }

  static String quote(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\t' -> sb.append("\\t");
        case '\r' -> sb.append("\\r");
        case '\u001b' -> sb.append("\\e");
        case '#' -> {
          char next = i + 1 < text.length() ? text.charAt(i + 1) : 0;
          sb.append(next == '{' || next == '$' || next == '@' ? "\\#" : "#");
        }
        default -> {
          if (c < 0x20 || c == 0x7f) {
            sb.append(String.format("\\x%02X", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.append('"').toString();
  }

  /** Configures and runs a print of one tree. */
  public static final class Builder {
    private final Sexp root;
    private boolean includeLines;

    /**
     * Sets the root of the tree to print.
     *
     * @param root The root node.
     */
    public Builder(Sexp root) {
      this.root = root;
    }

    /**
     * Sets whether each node is followed by {@code .line(n)}.
     *
     * @param includeLines If true, start lines are printed.
     */
    @CanIgnoreReturnValue
    public Builder setIncludeLines(boolean includeLines) {
      this.includeLines = includeLines;
      return this;
    }

    public String build() {
      StringBuilder sb = new StringBuilder();
      print(root, sb);
      return sb.toString();
    }

    private void print(Sexp sexp, StringBuilder sb) {
      sb.append("s(:").append(sexp.getTag().getTagName());
      for (Object element : sexp.getElements()) {
        sb.append(", ");
        if (element instanceof Sexp) {
          print((Sexp) element, sb);
        } else {
          sb.append(formatScalar(element, true));
        }
      }
      sb.append(')');
      if (includeLines) {
        sb.append(".line(").append(sexp.getStartLine()).append(')');
      }
    }
  }
}
