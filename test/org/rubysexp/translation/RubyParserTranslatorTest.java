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
import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static org.junit.Assert.assertThrows;
import static org.rubysexp.testing.SexpSubject.assertSexp;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rubysexp.prism.IR;
import org.rubysexp.prism.Location;
import org.rubysexp.prism.Node;
import org.rubysexp.prism.ParseError;
import org.rubysexp.prism.ParseResult;
import org.rubysexp.prism.PrismParser;
import org.rubysexp.sexp.Sexp;

/** Tests for {@link RubyParserTranslator}. */
@RunWith(JUnit4.class)
public final class RubyParserTranslatorTest {

  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  /** The sources and file names the fake parser was called with. */
  private final List<String> parsedSources = new ArrayList<>();
  private final List<String> parsedFileNames = new ArrayList<>();

  /** A parser that records its input and returns {@code result} regardless of it. */
  private PrismParser parserReturning(ParseResult result) {
    return (source, fileName) -> {
      parsedSources.add(source);
      parsedFileNames.add(fileName);
      return result;
    };
  }

  private PrismParser parserReturning(Node... statements) {
    return parserReturning(ParseResult.success(IR.program(statements)));
  }

  @Test
  public void testParse() throws Exception {
    RubyParserTranslator translator =
        new RubyParserTranslator(parserReturning(IR.localWrite("foo", IR.integer(1))));
    Sexp result = translator.parse("foo = 1");
    assertSexp(result).printsAs("(lasgn :foo (lit 1))");
    assertSexp(result).isEntirelyInFile(TranslationOptions.DEFAULT_SOURCE_NAME);
    assertThat(parsedSources).containsExactly("foo = 1");
    assertThat(parsedFileNames).containsExactly("(string)");
  }

  @Test
  public void testSourceName() throws Exception {
    TranslationOptions options = new TranslationOptions();
    options.setSourceName("inline.rb");
    RubyParserTranslator translator =
        new RubyParserTranslator(parserReturning(IR.sourceFile()), options);
    Sexp result = translator.parse("__FILE__");
    assertSexp(result).printsAs("(str \"inline.rb\")");
    assertSexp(result).isEntirelyInFile("inline.rb");
    assertThat(parsedFileNames).containsExactly("inline.rb");
  }

  @Test
  public void testEmptyProgram() throws Exception {
    assertThat(new RubyParserTranslator(parserReturning()).parse("")).isNull();
  }

  @Test
  public void testParseError() {
    ParseResult failure =
        ParseResult.failure(
            List.of(
                new ParseError("unexpected end-of-input", Location.line(3)),
                new ParseError("expected an `end` to close the `def`", Location.line(4))));
    RubyParserTranslator translator = new RubyParserTranslator(parserReturning(failure));

    TranslationSyntaxError e =
        assertThrows(TranslationSyntaxError.class, () -> translator.parse("def foo\n\n"));
    assertThat(e).hasMessageThat().isEqualTo("(string):3 :: unexpected end-of-input");
    assertThat(e.getFileName()).isEqualTo("(string)");
    assertThat(e.getLine()).isEqualTo(3);
    assertThat(e.getParseError().message()).isEqualTo("unexpected end-of-input");
  }

  @Test
  public void testParseErrorMessageIsNotReformatted() {
    ParseResult failure =
        ParseResult.failure(List.of(new ParseError("can't use '{0}' here", Location.line(1200))));
    RubyParserTranslator translator = new RubyParserTranslator(parserReturning(failure));
    TranslationSyntaxError e =
        assertThrows(TranslationSyntaxError.class, () -> translator.parse("x"));
    assertThat(e).hasMessageThat().isEqualTo("(string):1200 :: can't use '{0}' here");
  }

  @Test
  public void testParseFile() throws Exception {
    Path file = folder.newFile("lib.rb").toPath();
    Files.writeString(file, "foo = 1\n");
    RubyParserTranslator translator =
        new RubyParserTranslator(parserReturning(IR.localWrite("foo", IR.integer(1))));

    Sexp result = translator.parseFile(file);

    assertSexp(result).printsAs("(lasgn :foo (lit 1))");
    assertSexp(result).isEntirelyInFile(file.toString());
    assertThat(parsedSources).containsExactly("foo = 1\n");
    assertThat(parsedFileNames).containsExactly(file.toString());
  }

  @Test
  public void testParseFileErrorNamesTheFile() throws Exception {
    Path file = folder.newFile("broken.rb").toPath();
    Files.writeString(file, "def\n");
    RubyParserTranslator translator =
        new RubyParserTranslator(
            parserReturning(
                ParseResult.failure(List.of(new ParseError("bad def", Location.line(1))))));
    TranslationSyntaxError e =
        assertThrows(TranslationSyntaxError.class, () -> translator.parseFile(file));
    assertThat(e).hasMessageThat().isEqualTo(file + ":1 :: bad def");
  }

  @Test
  public void testParseFileCharset() throws Exception {
    Path file = folder.newFile("latin1.rb").toPath();
    Files.write(file, "\"café\"".getBytes(ISO_8859_1));
    TranslationOptions options = new TranslationOptions();
    options.setInputCharset(ISO_8859_1);
    new RubyParserTranslator(parserReturning(IR.string("café")), options).parseFile(file);
    assertThat(parsedSources).containsExactly("\"café\"");
  }

  @Test
  public void testMissingFile() {
    RubyParserTranslator translator = new RubyParserTranslator(parserReturning(IR.nil()));
    Path missing = folder.getRoot().toPath().resolve("missing.rb");
    assertThrows(IOException.class, () -> translator.parseFile(missing));
    assertThat(parsedSources).isEmpty();
  }

  @Test
  public void testOptionsAreCopied() throws Exception {
    TranslationOptions options = new TranslationOptions();
    options.setSourceName("first.rb");
    RubyParserTranslator translator =
        new RubyParserTranslator(
            parserReturning(IR.heredocXString("ls\n", Location.lines(2, 3))), options);
    options.setSourceName("second.rb");
    options.setHeredocContentSpan(false);

    Sexp result = translator.parse("<<~`EOS`\nls\nEOS\n");

    assertSexp(result).isEntirelyInFile("first.rb");
    assertSexp(result).hasLines(2, 3);
  }

  @Test
  public void testHeredocContentSpanOption() throws Exception {
    TranslationOptions options = new TranslationOptions();
    options.setHeredocContentSpan(false);
    RubyParserTranslator translator =
        new RubyParserTranslator(
            parserReturning(IR.heredocXString("ls\n", Location.lines(2, 3))), options);
    assertSexp(translator.parse("<<~`EOS`\nls\nEOS\n")).hasLines(1, 1);
  }

  @Test
  public void testTranslateCompletedParse() throws Exception {
    RubyParserTranslator translator = new RubyParserTranslator(parserReturning());
    Sexp result =
        translator.translate(ParseResult.success(IR.program(IR.trueNode())), "other.rb");
    assertSexp(result).printsAs("(true)");
    assertSexp(result).isEntirelyInFile("other.rb");
    assertThat(parsedSources).isEmpty();
  }
}
