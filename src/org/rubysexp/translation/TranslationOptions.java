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

import com.google.common.base.MoreObjects;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/** Options for {@link RubyParserTranslator}. */
public class TranslationOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** The file name used by {@link RubyParserTranslator#parse(String)}. */
  public static final String DEFAULT_SOURCE_NAME = "(string)";

  private String sourceName = DEFAULT_SOURCE_NAME;

  /** Charset used to read files. */
  private transient Charset inputCharset = StandardCharsets.UTF_8;

  /**
   * Whether a heredoc shell string ({@code <<~`EOS`}) takes the lines of its body rather than
   * those of its opening token.
   */
  private boolean heredocContentSpan = true;

  public TranslationOptions() {}

  public void setSourceName(String sourceName) {
    this.sourceName = checkNotNull(sourceName);
  }

  public String getSourceName() {
    return sourceName;
  }

  public void setInputCharset(Charset charset) {
    this.inputCharset = checkNotNull(charset);
  }

  public Charset getInputCharset() {
    return inputCharset;
  }

  public void setHeredocContentSpan(boolean heredocContentSpan) {
    this.heredocContentSpan = heredocContentSpan;
  }

  public boolean isHeredocContentSpan() {
    return heredocContentSpan;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("sourceName", sourceName)
        .add("inputCharset", inputCharset)
        .add("heredocContentSpan", heredocContentSpan)
        .toString();
  }

  private void writeObject(ObjectOutputStream out) throws IOException {
    out.defaultWriteObject();
    out.writeObject(inputCharset.name());
  }

  private void readObject(ObjectInputStream in) throws IOException, ClassNotFoundException {
    in.defaultReadObject();
    inputCharset = Charset.forName((String) in.readObject());
  }
}
