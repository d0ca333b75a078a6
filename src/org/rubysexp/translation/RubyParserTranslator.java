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

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.rubysexp.prism.ParseError;
import org.rubysexp.prism.ParseResult;
import org.rubysexp.prism.PrismParser;
import org.rubysexp.sexp.Sexp;

/**
 * Parses Ruby source with a {@link PrismParser} and converts the result into the s-expressions
 * of the ruby_parser gem.
 *
 * <p>Every Sexp in a result carries the file name it was translated under: the configured
 * {@linkplain TranslationOptions#getSourceName() source name} for text, the path for files.
 *
 * <p>An empty program translates to null.
 */
public final class RubyParserTranslator {
  private static final Logger logger = Logger.getLogger(RubyParserTranslator.class.getName());

  private final PrismParser parser;
  private final String sourceName;
  private final Charset inputCharset;
  private final SexpCompiler compiler;

  public RubyParserTranslator(PrismParser parser) {
    this(parser, new TranslationOptions());
  }

  /** Creates a translator. Later changes to {@code options} have no effect on it. */
  public RubyParserTranslator(PrismParser parser, TranslationOptions options) {
    this.parser = checkNotNull(parser);
    this.sourceName = options.getSourceName();
    this.inputCharset = options.getInputCharset();
    this.compiler = new SexpCompiler(options.isHeredocContentSpan());
  }

  /** Parses and translates {@code source}. */
  public @Nullable Sexp parse(String source) throws TranslationSyntaxError {
    return translate(parser.parse(checkNotNull(source), sourceName), sourceName);
  }

  /**
   * Reads, parses and translates the file at {@code path}. The path, as given, is the file
   * name of the result.
   */
  public @Nullable Sexp parseFile(Path path) throws IOException, TranslationSyntaxError {
    String fileName = path.toString();
    String source = Files.readString(path, inputCharset);
    logger.log(Level.FINE, "Translating {0}", fileName);
    return translate(parser.parse(source, fileName), fileName);
  }

  /**
   * Translates a completed parse.
   *
   * @throws TranslationSyntaxError describing the first error if the parse failed
   */
  public @Nullable Sexp translate(ParseResult result, String fileName)
      throws TranslationSyntaxError {
    checkNotNull(fileName);
    if (result.isFailure()) {
      ParseError first = result.getErrors().get(0);
      logger.log(
          Level.FINE,
          "{0}: parse failed with {1} error(s)",
          new Object[] {fileName, result.getErrors().size()});
      throw new TranslationSyntaxError(fileName, first);
    }

    Object root = compiler.visit(result.getRoot(), new TranslationContext(fileName));
    if (root != null && !(root instanceof Sexp)) {
      throw new DispatchInvariantViolation("Program did not translate to a Sexp: " + root);
    }
    return (Sexp) root;
  }
}
