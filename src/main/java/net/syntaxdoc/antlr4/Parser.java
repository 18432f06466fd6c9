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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import javax.annotation.Nullable;
import net.syntaxdoc.events.Diagnostic;
import net.syntaxdoc.loader.DocCommentParser;
import net.syntaxdoc.loader.DocToken;
import net.syntaxdoc.loader.RuleContents;
import net.syntaxdoc.model.CharSet;
import net.syntaxdoc.model.Doc;
import net.syntaxdoc.model.Literal;
import net.syntaxdoc.model.Model;
import net.syntaxdoc.model.Negation;
import net.syntaxdoc.model.Range;
import net.syntaxdoc.model.Reference;
import net.syntaxdoc.model.RuleContent;
import net.syntaxdoc.model.Sequence;
import net.syntaxdoc.model.Wildcard;

/**
 * Recursive descent parser for ANTLR4 grammars.
 *
 * <p>The parser understands the whole ANTLR4 grammar language but keeps only what documentation
 * needs: the grammar header, imports, token declarations and the bodies of lexer and parser rules.
 * Actions, predicates, arguments, labels, options and lexer commands are skipped.
 *
 * <p>Rule bodies refer to other rules through {@link Reference}s into the model passed to the
 * parser; nothing is added to the model itself. The caller decides what to do with the result.
 */
final class Parser {

  /** Combines the declarations of a grammar file with a list of errors. */
  static final class ParseResult {
    @Nullable final String grammarName;
    final ImmutableList<DocToken> grammarDocs;
    final ImmutableList<Import> imports;
    final ImmutableList<Declaration> declarations;
    final ImmutableList<Diagnostic> errors;

    private ParseResult(
        @Nullable String grammarName,
        ImmutableList<DocToken> grammarDocs,
        ImmutableList<Import> imports,
        ImmutableList<Declaration> declarations,
        ImmutableList<Diagnostic> errors) {
      this.grammarName = grammarName;
      this.grammarDocs = grammarDocs;
      this.imports = imports;
      this.declarations = declarations;
      this.errors = errors;
    }
  }

  /** A grammar named by an {@code import} statement or a {@code tokenVocab} option. */
  static final class Import {
    final String name;
    final int line;

    Import(String name, int line) {
      this.name = name;
      this.line = line;
    }
  }

  /** The kinds of rule declarations. */
  enum DeclarationKind {
    /** An entry of a {@code tokens} block. */
    TOKEN,
    LEXER_RULE,
    PARSER_RULE,
  }

  /** A rule declaration and the comments in front of it. */
  static final class Declaration {
    final DeclarationKind kind;
    final String name;
    final int line;
    final ImmutableList<DocToken> headers;
    final ImmutableList<DocToken> docs;
    @Nullable final RuleContent content; // null for tokens
    final boolean fragment;

    Declaration(
        DeclarationKind kind,
        String name,
        int line,
        ImmutableList<DocToken> headers,
        ImmutableList<DocToken> docs,
        @Nullable RuleContent content,
        boolean fragment) {
      this.kind = kind;
      this.name = name;
      this.line = line;
      this.headers = headers;
      this.docs = docs;
      this.content = content;
      this.fragment = fragment;
    }
  }

  private static final EnumSet<TokenKind> RULE_TERMINATOR_SET =
      EnumSet.of(TokenKind.SEMI, TokenKind.EOF);

  private static final EnumSet<TokenKind> ELEMENT_START_SET =
      EnumSet.of(
          TokenKind.IDENTIFIER,
          TokenKind.STRING,
          TokenKind.LPAREN,
          TokenKind.NOT,
          TokenKind.DOT,
          TokenKind.ACTION,
          TokenKind.DOC_COMMENT,
          TokenKind.ARGUMENT);

  private static final EnumSet<TokenKind> SUFFIX_SET =
      EnumSet.of(TokenKind.QUESTION, TokenKind.STAR, TokenKind.PLUS);

  private final Lexer token; // token.kind is a prettier alias for lexer.kind
  private final Lexer lexer;
  private final Model model;
  private final List<Diagnostic> errors;

  private final List<Import> imports = new ArrayList<>();
  private final List<Declaration> declarations = new ArrayList<>();

  private int errorsCount;
  private boolean recoveryMode; // stop reporting errors until next rule

  private Parser(Lexer lexer, Model model, List<Diagnostic> errors) {
    this.lexer = lexer;
    this.token = lexer;
    this.model = model;
    this.errors = errors;
    nextToken();
  }

  /**
   * Parses a grammar file.
   *
   * @param file the file that positions refer to
   * @param firstLine the line of {@code file} at which {@code text} starts
   * @param model the model that references in rule bodies resolve against
   */
  static ParseResult parseGrammar(String text, Path file, int firstLine, Model model) {
    List<Diagnostic> errors = new ArrayList<>();
    Lexer lexer = new Lexer(text, file, firstLine, errors);
    Parser parser = new Parser(lexer, model, errors);
    ImmutableList<DocToken> grammarDocs = parser.token.docs;
    String name = parser.parseGrammarHeader();
    parser.parsePrequel();
    while (parser.token.kind != TokenKind.EOF) {
      parser.parseRuleSpec();
    }
    return new ParseResult(
        name,
        grammarDocs,
        ImmutableList.copyOf(parser.imports),
        ImmutableList.copyOf(parser.declarations),
        ImmutableList.copyOf(errors));
  }

  /**
   * Parses the alternatives of a lexer rule body, as written after the colon. Errors are appended
   * to {@code errors}; the result is null if there were any.
   */
  @Nullable
  static RuleContent parseLexerBody(
      String text, Path file, int firstLine, Model model, List<Diagnostic> errors) {
    int errorsBefore = errors.size();
    Lexer lexer = new Lexer(text, file, firstLine, errors);
    lexer.inRuleBody = true;
    Parser parser = new Parser(lexer, model, errors);
    RuleContent content = parser.parseAltList(/* lexerRule= */ true);
    if (parser.token.kind != TokenKind.EOF) {
      parser.syntaxError("expected end of rule body");
    }
    return errors.size() == errorsBefore ? content : null;
  }

  // grammar_header = ['lexer' | 'parser'] 'grammar' IDENTIFIER ';'
  @Nullable
  private String parseGrammarHeader() {
    if (isKeyword("lexer") || isKeyword("parser")) {
      nextToken();
    }
    if (!isKeyword("grammar")) {
      syntaxError("expected 'grammar'");
      syncPast(RULE_TERMINATOR_SET);
      return null;
    }
    nextToken();
    String name = parseIdent();
    expectAndRecover(TokenKind.SEMI);
    return name;
  }

  // prequel = (options_spec | 'import' delegates ';' | tokens_spec | channels_spec | action)*
  private void parsePrequel() {
    while (true) {
      if (isKeyword("options")) {
        parseOptionsSpec(/* recordImports= */ true);
      } else if (isKeyword("import")) {
        parseDelegateGrammars();
      } else if (isKeyword("tokens")) {
        parseTokensSpec();
      } else if (isKeyword("channels")) {
        parseChannelsSpec();
      } else if (token.kind == TokenKind.AT) {
        parseNamedAction();
      } else {
        return;
      }
    }
  }

  // options_spec = 'options' '{' (IDENTIFIER '=' option_value ';')* '}'
  private void parseOptionsSpec(boolean recordImports) {
    nextToken();
    expect(TokenKind.LBRACE);
    while (token.kind == TokenKind.IDENTIFIER) {
      String name = token.raw;
      int line = token.line;
      nextToken();
      expect(TokenKind.ASSIGN);
      String value = parseOptionValue();
      if (recordImports && name.equals("tokenVocab") && value != null) {
        imports.add(new Import(value, line));
      }
      expect(TokenKind.SEMI);
    }
    expectAndRecover(TokenKind.RBRACE);
  }

  // option_value = IDENTIFIER ('.' IDENTIFIER)* | STRING | ACTION | INT
  @Nullable
  private String parseOptionValue() {
    switch (token.kind) {
      case IDENTIFIER -> {
        List<String> parts = new ArrayList<>();
        parts.add(parseIdent());
        while (token.kind == TokenKind.DOT) {
          nextToken();
          parts.add(parseIdent());
        }
        return Joiner.on('.').join(parts);
      }
      case STRING, ACTION, INT -> {
        String value = token.raw;
        nextToken();
        return value;
      }
      default -> {
        syntaxError("expected option value");
        return null;
      }
    }
  }

  // delegates = delegate (',' delegate)* ; delegate = IDENTIFIER ['=' IDENTIFIER]
  private void parseDelegateGrammars() {
    nextToken();
    do {
      if (token.kind == TokenKind.COMMA) {
        nextToken();
      }
      int line = token.line;
      String name = parseIdent();
      if (token.kind == TokenKind.ASSIGN) {
        nextToken();
        line = token.line;
        name = parseIdent();
      }
      imports.add(new Import(name, line));
    } while (token.kind == TokenKind.COMMA);
    expectAndRecover(TokenKind.SEMI);
  }

  // tokens_spec = 'tokens' '{' [IDENTIFIER (',' IDENTIFIER)* [',']] '}'
  private void parseTokensSpec() {
    nextToken();
    expect(TokenKind.LBRACE);
    while (token.kind == TokenKind.IDENTIFIER) {
      declarations.add(
          new Declaration(
              DeclarationKind.TOKEN,
              token.raw,
              token.line,
              token.headers,
              token.docs,
              /* content= */ null,
              /* fragment= */ false));
      nextToken();
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    expectAndRecover(TokenKind.RBRACE);
  }

  // channels_spec = 'channels' '{' [IDENTIFIER (',' IDENTIFIER)* [',']] '}'
  private void parseChannelsSpec() {
    nextToken();
    expect(TokenKind.LBRACE);
    while (token.kind == TokenKind.IDENTIFIER) {
      nextToken();
      if (token.kind != TokenKind.COMMA) {
        break;
      }
      nextToken();
    }
    expectAndRecover(TokenKind.RBRACE);
  }

  // action = '@' [IDENTIFIER '::'] IDENTIFIER ACTION
  private void parseNamedAction() {
    expect(TokenKind.AT);
    parseIdent();
    if (token.kind == TokenKind.COLONCOLON) {
      nextToken();
      parseIdent();
    }
    expect(TokenKind.ACTION);
  }

  // rule_spec = 'mode' IDENTIFIER ';' | lexer_rule | parser_rule
  private void parseRuleSpec() {
    if (isKeyword("mode")) {
      nextToken();
      parseIdent();
      expectAndRecover(TokenKind.SEMI);
      return;
    }

    ImmutableList<DocToken> headers = token.headers;
    ImmutableList<DocToken> docs = token.docs;
    int line = token.line;
    boolean fragment = false;
    while (isKeyword("fragment")
        || isKeyword("public")
        || isKeyword("private")
        || isKeyword("protected")) {
      fragment |= token.raw.equals("fragment");
      nextToken();
    }
    if (token.kind != TokenKind.IDENTIFIER) {
      syntaxError("expected rule name");
      syncPast(RULE_TERMINATOR_SET);
      recoveryMode = false;
      return;
    }
    String name = token.raw;
    nextToken();

    boolean lexerRule = Character.isUpperCase(name.codePointAt(0));
    if (!lexerRule) {
      parseParserRulePrequel();
    } else if (isKeyword("options")) {
      parseOptionsSpec(/* recordImports= */ false);
    }

    lexer.inRuleBody = true;
    expect(TokenKind.COLON);
    RuleContent content = parseAltList(lexerRule);
    lexer.inRuleBody = false;
    if (token.kind == TokenKind.SEMI) {
      nextToken();
    } else {
      syntaxError("expected ';'");
      syncPast(RULE_TERMINATOR_SET);
    }
    recoveryMode = false;
    if (!lexerRule) {
      parseExceptionGroup();
    }

    declarations.add(
        new Declaration(
            lexerRule ? DeclarationKind.LEXER_RULE : DeclarationKind.PARSER_RULE,
            name,
            line,
            headers,
            docs,
            content,
            fragment));
  }

  // parser_rule_prequel = [ARGUMENT] ['returns' ARGUMENT] ['throws' IDENTIFIER (',' IDENTIFIER)*]
  //                       ['locals' ARGUMENT] (options_spec | action)*
  private void parseParserRulePrequel() {
    if (token.kind == TokenKind.ARGUMENT) {
      nextToken();
    }
    if (isKeyword("returns")) {
      nextToken();
      expect(TokenKind.ARGUMENT);
    }
    if (isKeyword("throws")) {
      nextToken();
      parseIdent();
      while (token.kind == TokenKind.COMMA) {
        nextToken();
        parseIdent();
      }
    }
    if (isKeyword("locals")) {
      nextToken();
      expect(TokenKind.ARGUMENT);
    }
    while (isKeyword("options") || token.kind == TokenKind.AT) {
      if (token.kind == TokenKind.AT) {
        parseNamedAction();
      } else {
        parseOptionsSpec(/* recordImports= */ false);
      }
    }
  }

  // exception_group = ('catch' ARGUMENT ACTION)* ['finally' ACTION]
  private void parseExceptionGroup() {
    while (isKeyword("catch")) {
      nextToken();
      expect(TokenKind.ARGUMENT);
      expect(TokenKind.ACTION);
    }
    if (isKeyword("finally")) {
      nextToken();
      expect(TokenKind.ACTION);
    }
  }

  // alt_list = alternative ('|' alternative)*
  private RuleContent parseAltList(boolean lexerRule) {
    List<RuleContent> alternatives = new ArrayList<>();
    alternatives.add(parseAlternative(lexerRule));
    while (token.kind == TokenKind.OR) {
      nextToken();
      alternatives.add(parseAlternative(lexerRule));
    }
    return RuleContents.alternative(alternatives);
  }

  // alternative = [element_options] element* ['#' IDENTIFIER]      (parser rules)
  //             | element* ['->' lexer_command (',' lexer_command)*]  (lexer rules)
  private RuleContent parseAlternative(boolean lexerRule) {
    if (token.kind == TokenKind.LT) {
      skipElementOptions();
    }
    List<RuleContent> elements = new ArrayList<>();
    while (ELEMENT_START_SET.contains(token.kind)) {
      elements.add(parseElement(lexerRule));
    }
    if (token.kind == TokenKind.POUND) {
      nextToken();
      parseIdent();
    } else if (token.kind == TokenKind.RARROW) {
      nextToken();
      parseLexerCommand();
      while (token.kind == TokenKind.COMMA) {
        nextToken();
        parseLexerCommand();
      }
    }
    return RuleContents.sequence(elements);
  }

  // lexer_command = IDENTIFIER ['(' (IDENTIFIER | INT) ')']
  private void parseLexerCommand() {
    parseIdent();
    if (token.kind == TokenKind.LPAREN) {
      nextToken();
      if (token.kind == TokenKind.IDENTIFIER || token.kind == TokenKind.INT) {
        nextToken();
      } else {
        syntaxError("expected lexer command argument");
      }
      expect(TokenKind.RPAREN);
    }
  }

  // element = DOC_COMMENT
  //         | ACTION ['?']
  //         | [IDENTIFIER ('=' | '+=')] (atom | block) [suffix]
  private RuleContent parseElement(boolean lexerRule) {
    switch (token.kind) {
      case DOC_COMMENT -> {
        String text = Joiner.on('\n').join(DocCommentParser.parseDocComment(token.raw));
        nextToken();
        return Doc.of(text);
      }
      case ACTION -> {
        nextToken();
        if (token.kind == TokenKind.QUESTION) {
          nextToken(); // semantic predicate
        }
        return Sequence.EMPTY;
      }
      default -> {
        RuleContent element;
        if (token.kind == TokenKind.LPAREN) {
          element = parseBlock(lexerRule);
        } else {
          element = parseAtom(lexerRule);
          if (token.kind == TokenKind.ASSIGN || token.kind == TokenKind.PLUS_ASSIGN) {
            // What we parsed is a label.
            nextToken();
            element =
                token.kind == TokenKind.LPAREN ? parseBlock(lexerRule) : parseAtom(lexerRule);
          }
        }
        return RuleContents.withSuffix(element, parseSuffix());
      }
    }
  }

  // suffix = ('?' | '*' | '+') ['?']
  private String parseSuffix() {
    if (!SUFFIX_SET.contains(token.kind)) {
      return "";
    }
    String suffix = token.raw;
    nextToken();
    if (token.kind == TokenKind.QUESTION) {
      nextToken(); // non-greedy
    }
    return suffix;
  }

  // block = '(' [(options_spec | action)* ':'] alt_list ')'
  private RuleContent parseBlock(boolean lexerRule) {
    expect(TokenKind.LPAREN);
    if (isKeyword("options") || token.kind == TokenKind.AT) {
      while (isKeyword("options") || token.kind == TokenKind.AT) {
        if (token.kind == TokenKind.AT) {
          parseNamedAction();
        } else {
          parseOptionsSpec(/* recordImports= */ false);
        }
      }
      expect(TokenKind.COLON);
    }
    RuleContent content = parseAltList(lexerRule);
    expect(TokenKind.RPAREN);
    return content;
  }

  // atom = STRING ['..' STRING] [element_options]
  //      | IDENTIFIER [ARGUMENT] [element_options]
  //      | '.' [element_options]
  //      | '~' (set_element | '(' set_element ('|' set_element)* ')')
  //      | ARGUMENT                                                     (lexer rules only)
  private RuleContent parseAtom(boolean lexerRule) {
    RuleContent atom;
    switch (token.kind) {
      case STRING, ARGUMENT -> atom = parseSetElement(lexerRule);
      case IDENTIFIER -> {
        atom = Reference.of(model, token.raw);
        nextToken();
        if (!lexerRule && token.kind == TokenKind.ARGUMENT) {
          nextToken(); // rule arguments
        }
      }
      case DOT -> {
        atom = Wildcard.WILDCARD;
        nextToken();
      }
      case NOT -> {
        nextToken();
        if (token.kind == TokenKind.LPAREN) {
          nextToken();
          List<RuleContent> elements = new ArrayList<>();
          elements.add(parseSetElement(lexerRule));
          while (token.kind == TokenKind.OR) {
            nextToken();
            elements.add(parseSetElement(lexerRule));
          }
          expect(TokenKind.RPAREN);
          atom = Negation.of(RuleContents.alternative(elements));
        } else {
          atom = Negation.of(parseSetElement(lexerRule));
        }
      }
      default -> {
        syntaxError("expected rule element");
        nextToken();
        return Sequence.EMPTY;
      }
    }
    if (token.kind == TokenKind.LT) {
      skipElementOptions();
    }
    return atom;
  }

  // set_element = IDENTIFIER | STRING ['..' STRING] | ARGUMENT
  private RuleContent parseSetElement(boolean lexerRule) {
    switch (token.kind) {
      case IDENTIFIER -> {
        RuleContent reference = Reference.of(model, token.raw);
        nextToken();
        return reference;
      }
      case ARGUMENT -> {
        String charSet = token.raw;
        nextToken();
        return charSet.equals("[]") ? Sequence.EMPTY : CharSet.of(charSet);
      }
      case STRING -> {
        String literal = token.raw;
        nextToken();
        if (token.kind == TokenKind.RANGE) {
          nextToken();
          String end = token.raw;
          expect(TokenKind.STRING);
          return Range.of(literal, end);
        }
        if (!lexerRule) {
          // Parser rules refer to literal tokens by their text.
          return Reference.of(model, literal);
        }
        return literal.equals("''") ? Sequence.EMPTY : Literal.of(literal);
      }
      default -> {
        syntaxError("expected token, literal or character set");
        return Sequence.EMPTY;
      }
    }
  }

  // element_options = '<' ... '>'
  private void skipElementOptions() {
    expect(TokenKind.LT);
    while (token.kind != TokenKind.GT && !RULE_TERMINATOR_SET.contains(token.kind)) {
      nextToken();
    }
    expect(TokenKind.GT);
  }

  private boolean isKeyword(String keyword) {
    return token.kind == TokenKind.IDENTIFIER && token.raw.equals(keyword);
  }

  private String parseIdent() {
    if (token.kind != TokenKind.IDENTIFIER) {
      syntaxError("expected identifier");
      return "";
    }
    String name = token.raw;
    nextToken();
    return name;
  }

  @FormatMethod
  private void reportError(int offset, String format, Object... args) {
    errorsCount++;
    // Limit the number of reported errors to avoid spamming output.
    if (errorsCount <= 5) {
      errors.add(Diagnostic.error(lexer.position(offset), format, args));
    }
  }

  private void syntaxError(String message) {
    if (!recoveryMode) {
      String tokenText = token.kind == TokenKind.EOF ? "EOF" : token.raw;
      reportError(token.start, "syntax error at '%s': %s", tokenText, message);
      recoveryMode = true;
    }
  }

  // Consumes the current token. Reports a syntax error if it is not of the expected kind.
  private void expect(TokenKind kind) {
    if (token.kind != kind) {
      syntaxError("expected " + kind);
    }
    nextToken();
  }

  // Like expect, but stops recovery mode if the token was expected.
  private void expectAndRecover(TokenKind kind) {
    if (token.kind != kind) {
      syntaxError("expected " + kind);
    } else {
      recoveryMode = false;
    }
    nextToken();
  }

  // Consumes tokens past the first token belonging to terminatingTokens.
  private void syncPast(EnumSet<TokenKind> terminatingTokens) {
    Preconditions.checkState(terminatingTokens.contains(TokenKind.EOF));
    while (!terminatingTokens.contains(token.kind)) {
      nextToken();
    }
    // read past the synchronization token
    nextToken();
  }

  private void nextToken() {
    if (token.kind != TokenKind.EOF) {
      lexer.nextToken();
    }
  }
}
