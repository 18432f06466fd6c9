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

package net.syntaxdoc.bison;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.syntaxdoc.antlr4.Antlr4ContentParser;
import net.syntaxdoc.events.DiagnosticHandler;
import net.syntaxdoc.loader.DocCommentParser;
import net.syntaxdoc.loader.DocInfo;
import net.syntaxdoc.loader.DocToken;
import net.syntaxdoc.loader.RuleLoader;
import net.syntaxdoc.model.Alternative;
import net.syntaxdoc.model.GrammarModel;
import net.syntaxdoc.model.Literal;
import net.syntaxdoc.model.LoadingOptions;
import net.syntaxdoc.model.ModelProvider;
import net.syntaxdoc.model.RuleContent;
import net.syntaxdoc.model.Section;

/**
 * Loads Bison and yacc grammars ({@code .y} files).
 *
 * <p>Every declared token becomes a lexer rule. A token declared with an alias, e.g. {@code
 * %token PLUS "+"}, is a literal rule that can also be looked up by its alias. Rules defined more
 * than once are merged into one rule. The model is named after the file, and a grammar with
 * syntax errors yields an empty model.
 */
public final class BisonModelProvider extends ModelProvider {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  public BisonModelProvider(DiagnosticHandler diagnosticHandler) {
    super(diagnosticHandler);
  }

  @Override
  public ImmutableSet<String> supportedExtensions() {
    return ImmutableSet.of(".y");
  }

  @Override
  protected void populate(
      GrammarModel model, String text, int firstLine, LoadingOptions options) {
    Parser.ParseResult result =
        Parser.parseGrammar(text, model.getPath(), options.useCCharLiterals(), model);
    if (!result.errors.isEmpty()) {
      result.errors.forEach(this::report);
      logger.atFine().log("%s has syntax errors, leaving it empty", model.getPath());
      return;
    }
    result.warnings.forEach(this::report);

    DocCommentParser docParser =
        new DocCommentParser(
            model.getPath(),
            getDiagnosticHandler(),
            new Antlr4ContentParser(model, getDiagnosticHandler()));
    model.setModelDocs(
        docParser.parse(result.grammarDocs, /* allowCommands= */ false).documentation());

    RuleLoader loader = new RuleLoader(model, getDiagnosticHandler());
    for (Parser.TokenGroup group : result.tokenGroups) {
      loadTokenGroup(model, loader, docParser, group);
    }
    for (MergedRule rule : mergeRules(result.rules)) {
      loader.addParserRule(
          rule.name,
          rule.line,
          docParser.parseSection(rule.headers),
          docParser.parse(rule.docs, /* allowCommands= */ true),
          rule.content);
    }
  }

  // Comments in front of a directive document its first token. Later tokens of the same directive
  // share the flags but not the name, documentation or content, unless they have comments of
  // their own.
  private static void loadTokenGroup(
      GrammarModel model, RuleLoader loader, DocCommentParser docParser, Parser.TokenGroup group) {
    Section section = docParser.parseSection(group.headers);
    DocInfo groupDocs = docParser.parse(group.docs, /* allowCommands= */ true);
    DocInfo restDocs =
        groupDocs.toBuilder()
            .name(null)
            .cssClass(null)
            .documentation(ImmutableList.of())
            .content(null)
            .build();
    boolean first = true;
    for (Parser.TokenEntry entry : group.entries) {
      if (model.lookupLocal(entry.name) != null) {
        continue;
      }
      DocInfo docs;
      if (first) {
        docs =
            entry.docs.isEmpty()
                ? groupDocs
                : docParser.parse(concat(group.docs, entry.docs), /* allowCommands= */ true);
      } else {
        docs =
            entry.docs.isEmpty()
                ? restDocs
                : docParser.parse(entry.docs, /* allowCommands= */ true);
      }
      first = false;

      RuleContent content = null;
      if (entry.epp) {
        if (entry.alias != null && docs.name() == null) {
          content = Literal.of(entry.alias);
        }
      } else if (entry.alias != null) {
        content = Literal.of(entry.alias);
      } else if (isQuoted(entry.name)) {
        content = Literal.of(entry.name);
      }
      loader.addLexerRule(entry.name, entry.line, section, docs, content, /* fragment= */ false);
    }
  }

  private static boolean isQuoted(String name) {
    return name.length() >= 2
        && (name.charAt(0) == '"' || name.charAt(0) == '\'')
        && name.charAt(name.length() - 1) == name.charAt(0);
  }

  private static ImmutableList<DocToken> concat(List<DocToken> first, List<DocToken> second) {
    return ImmutableList.<DocToken>builder().addAll(first).addAll(second).build();
  }

  private static final class MergedRule {
    final String name;
    final int line;
    final ImmutableList<DocToken> headers;
    final List<DocToken> docs = new ArrayList<>();
    RuleContent content;

    MergedRule(Parser.RuleDeclaration declaration) {
      this.name = declaration.name;
      this.line = declaration.line;
      this.headers = declaration.headers;
      this.docs.addAll(declaration.docs);
      this.content = declaration.content;
    }
  }

  // Bison allows a rule to be written as several definitions; they are alternatives of one rule.
  private static ImmutableList<MergedRule> mergeRules(List<Parser.RuleDeclaration> declarations) {
    Map<String, MergedRule> rules = new LinkedHashMap<>();
    for (Parser.RuleDeclaration declaration : declarations) {
      MergedRule rule = rules.get(declaration.name);
      if (rule == null) {
        rules.put(declaration.name, new MergedRule(declaration));
      } else {
        rule.docs.addAll(declaration.docs);
        rule.content = Alternative.of(rule.content, declaration.content);
      }
    }
    return ImmutableList.copyOf(rules.values());
  }
}
