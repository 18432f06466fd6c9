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

package net.syntaxdoc.loader;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import javax.annotation.Nullable;
import net.syntaxdoc.events.Diagnostic;
import net.syntaxdoc.events.DiagnosticHandler;
import net.syntaxdoc.model.GrammarModel;
import net.syntaxdoc.model.LexerRule;
import net.syntaxdoc.model.Literal;
import net.syntaxdoc.model.ParserRule;
import net.syntaxdoc.model.Position;
import net.syntaxdoc.model.RuleContent;
import net.syntaxdoc.model.Section;

/**
 * Adds the rules found by a dialect parser to a model, combining each declaration with the
 * metadata of its documentation comments.
 */
public final class RuleLoader {

  private final GrammarModel model;
  private final DiagnosticHandler handler;

  public RuleLoader(GrammarModel model, DiagnosticHandler handler) {
    this.model = model;
    this.handler = handler;
  }

  /**
   * Adds a lexer rule. A {@code doc:content} command replaces the declared body; a rule whose
   * resulting body is a single literal is a literal rule.
   *
   * @param content the declared body, or null for a token that is only declared
   */
  @CanIgnoreReturnValue
  public LexerRule addLexerRule(
      String name,
      int line,
      @Nullable Section section,
      DocInfo docs,
      @Nullable RuleContent content,
      boolean fragment) {
    if (docs.content() != null) {
      content = docs.content();
    }
    LexerRule.Builder rule =
        LexerRule.builder(model, name, Position.create(model.getPath(), line))
            .setContent(content)
            .setSection(section)
            .setLiteral(content instanceof Literal)
            .setFragment(fragment);
    docs.applyTo(rule);
    LexerRule result = rule.build();
    model.addLexerRule(result);
    return result;
  }

  /** Adds a parser rule. Parser rules cannot have their body replaced by {@code doc:content}. */
  @CanIgnoreReturnValue
  public ParserRule addParserRule(
      String name, int line, @Nullable Section section, DocInfo docs, RuleContent content) {
    Position position = Position.create(model.getPath(), line);
    if (docs.content() != null) {
      handler.handle(
          Diagnostic.error(position, "'content' command can't appear before parser rules"));
    }
    ParserRule.Builder rule =
        ParserRule.builder(model, name, position).setContent(content).setSection(section);
    docs.applyTo(rule);
    ParserRule result = rule.build();
    model.addParserRule(result);
    return result;
  }
}
