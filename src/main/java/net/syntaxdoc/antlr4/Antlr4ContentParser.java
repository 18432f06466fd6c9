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

package net.syntaxdoc.antlr4;

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import net.syntaxdoc.events.Diagnostic;
import net.syntaxdoc.events.DiagnosticHandler;
import net.syntaxdoc.loader.InlineContentParser;
import net.syntaxdoc.model.Model;
import net.syntaxdoc.model.Position;
import net.syntaxdoc.model.RuleContent;

/**
 * Parses {@code doc:content} arguments written in ANTLR4 lexer rule notation, e.g. {@code //@
 * doc:content 'a' | 'b'}. Both dialects use this notation. Names in the body refer to the rules of
 * the grammar being documented.
 */
public final class Antlr4ContentParser implements InlineContentParser {

  private final Model model;
  private final DiagnosticHandler handler;

  public Antlr4ContentParser(Model model, DiagnosticHandler handler) {
    this.model = model;
    this.handler = handler;
  }

  @Override
  @Nullable
  public RuleContent parse(String body, Position position) {
    List<Diagnostic> errors = new ArrayList<>();
    RuleContent content =
        Parser.parseLexerBody(body, position.file(), position.line(), model, errors);
    errors.forEach(handler::handle);
    return content;
  }
}
