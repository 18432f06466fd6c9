// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.syntaxdoc.docgen;

import com.google.common.io.MoreFiles;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import net.syntaxdoc.diagram.LiteralRendering;

/**
 * Reads documentation options from a JSON file, e.g.
 *
 * <pre>
 * {"grouping": "lexer-first", "cc-to-dash": true, "root-rule": "Expr.program"}
 * </pre>
 *
 * <p>Keys are the dashed option names. Keys missing from the file keep the value of the options
 * the file is applied to.
 */
public final class OptionsFile {

  private static final Gson GSON = new Gson();

  /** The JSON shape of an options file. Absent keys are null. */
  @SuppressWarnings("unused") // Fields are set by Gson.
  private static final class OptionsJson {
    String grouping;
    String ordering;

    @SerializedName("literal-rendering")
    String literalRendering;

    @SerializedName("lexer-rules")
    Boolean lexerRules;

    @SerializedName("parser-rules")
    Boolean parserRules;

    Boolean fragments;
    Boolean undocumented;

    @SerializedName("honor-sections")
    Boolean honorSections;

    Boolean diagrams;

    @SerializedName("cc-to-dash")
    Boolean ccToDash;

    @SerializedName("mark-root-rule")
    Boolean markRootRule;

    @SerializedName("bison-c-char-literals")
    Boolean bisonCCharLiterals;

    @SerializedName("root-rule")
    String rootRule;
  }

  private OptionsFile() {}

  /**
   * Reads {@code path} and applies it on top of {@code base}.
   *
   * @throws IOException if the file can't be read
   * @throws IllegalArgumentException if the file is not a JSON object of valid options
   */
  public static DocumentationOptions read(Path path, DocumentationOptions base)
      throws IOException {
    String text = MoreFiles.asCharSource(path, StandardCharsets.UTF_8).read();
    try {
      return parse(text, base);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(path + ": " + e.getMessage(), e);
    }
  }

  /** Parses the JSON text of an options file and applies it on top of {@code base}. */
  public static DocumentationOptions parse(String text, DocumentationOptions base) {
    OptionsJson json;
    try {
      json = GSON.fromJson(text, OptionsJson.class);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("malformed options file: " + e.getMessage(), e);
    }
    if (json == null) {
      return base;
    }

    DocumentationOptions.Builder options = base.toBuilder();
    if (json.grouping != null) {
      options.grouping(DocumentationOptions.Grouping.fromString(json.grouping));
    }
    if (json.ordering != null) {
      options.ordering(DocumentationOptions.Ordering.fromString(json.ordering));
    }
    if (json.literalRendering != null) {
      options.literalRendering(LiteralRendering.fromString(json.literalRendering));
    }
    if (json.lexerRules != null) {
      options.lexerRules(json.lexerRules);
    }
    if (json.parserRules != null) {
      options.parserRules(json.parserRules);
    }
    if (json.fragments != null) {
      options.fragments(json.fragments);
    }
    if (json.undocumented != null) {
      options.undocumented(json.undocumented);
    }
    if (json.honorSections != null) {
      options.honorSections(json.honorSections);
    }
    if (json.diagrams != null) {
      options.diagrams(json.diagrams);
    }
    if (json.ccToDash != null) {
      options.ccToDash(json.ccToDash);
    }
    if (json.markRootRule != null) {
      options.markRootRule(json.markRootRule);
    }
    if (json.bisonCCharLiterals != null) {
      options.bisonCCharLiterals(json.bisonCCharLiterals);
    }
    if (json.rootRule != null) {
      options.rootRule(json.rootRule.isEmpty() ? null : json.rootRule);
    }
    return options.build();
  }
}
