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

import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.nio.file.Path;
import javax.annotation.Nullable;
import net.syntaxdoc.events.Diagnostic;
import net.syntaxdoc.events.DiagnosticHandler;
import net.syntaxdoc.loader.DocCommentParser;
import net.syntaxdoc.loader.RuleLoader;
import net.syntaxdoc.model.GrammarModel;
import net.syntaxdoc.model.LoadingOptions;
import net.syntaxdoc.model.ModelProvider;
import net.syntaxdoc.model.Position;
import net.syntaxdoc.model.RuleBase;

/**
 * Loads ANTLR4 grammars ({@code .g4} files).
 *
 * <p>Grammars named by {@code import} statements and by the {@code tokenVocab} option are loaded
 * from the directory of the importing grammar. A grammar with syntax errors yields an empty model.
 */
public final class Antlr4ModelProvider extends ModelProvider {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final String EXTENSION = ".g4";

  // Names of the rules that wrap diagram snippets.
  static final String LEXER_SNIPPET_RULE = "ROOT";
  static final String PARSER_SNIPPET_RULE = "root";

  public Antlr4ModelProvider(DiagnosticHandler diagnosticHandler) {
    super(diagnosticHandler);
  }

  @Override
  public ImmutableSet<String> supportedExtensions() {
    return ImmutableSet.of(EXTENSION);
  }

  @Override
  protected void populate(
      GrammarModel model, String text, int firstLine, LoadingOptions options) {
    Parser.ParseResult result = Parser.parseGrammar(text, model.getPath(), firstLine, model);
    if (!result.errors.isEmpty()) {
      result.errors.forEach(this::report);
      logger.atFine().log("%s has syntax errors, leaving it empty", model.getPath());
      return;
    }

    if (result.grammarName != null) {
      model.setName(result.grammarName);
    }
    DocCommentParser docParser =
        new DocCommentParser(
            model.getPath(),
            getDiagnosticHandler(),
            new Antlr4ContentParser(model, getDiagnosticHandler()));
    model.setModelDocs(
        docParser.parse(result.grammarDocs, /* allowCommands= */ false).documentation());

    for (Parser.Import anImport : result.imports) {
      if (model.isInMemory()) {
        report(
            Diagnostic.error(
                Position.create(model.getPath(), anImport.line),
                "imports are not allowed for in-memory grammars"));
        continue;
      }
      Path importPath = model.getPath().resolveSibling(anImport.name + EXTENSION);
      model.addImport(fromFile(importPath, options));
    }

    // Tokens first, then lexer rules, then parser rules. A lexer rule replaces a token of the same
    // name.
    RuleLoader loader = new RuleLoader(model, getDiagnosticHandler());
    for (Parser.DeclarationKind kind : Parser.DeclarationKind.values()) {
      for (Parser.Declaration declaration : result.declarations) {
        if (declaration.kind != kind) {
          continue;
        }
        switch (kind) {
          case TOKEN, LEXER_RULE ->
              loader.addLexerRule(
                  declaration.name,
                  declaration.line,
                  docParser.parseSection(declaration.headers),
                  docParser.parse(declaration.docs, /* allowCommands= */ true),
                  declaration.content,
                  declaration.fragment);
          case PARSER_RULE ->
              loader.addParserRule(
                  declaration.name,
                  declaration.line,
                  docParser.parseSection(declaration.headers),
                  docParser.parse(declaration.docs, /* allowCommands= */ true),
                  declaration.content);
        }
      }
    }
  }

  /**
   * Parses a lexer rule body embedded in a document, such as the body of a lexer diagram
   * directive. Returns the rule wrapping it, or null if it does not parse.
   *
   * @param line the line of the document at which the body starts
   */
  @Nullable
  public RuleBase parseLexerSnippet(String body, Path documentPath, int line) {
    String text = "grammar Snippet; " + LEXER_SNIPPET_RULE + " : " + body + " ;";
    return fromText(text, documentPath, line, LoadingOptions.DEFAULT)
        .lookupLocal(LEXER_SNIPPET_RULE);
  }

  /** Like {@link #parseLexerSnippet}, for parser rule bodies. */
  @Nullable
  public RuleBase parseParserSnippet(String body, Path documentPath, int line) {
    String text = "grammar Snippet; " + PARSER_SNIPPET_RULE + " : " + body + " ;";
    return fromText(text, documentPath, line, LoadingOptions.DEFAULT)
        .lookupLocal(PARSER_SNIPPET_RULE);
  }
}
