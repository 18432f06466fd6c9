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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import net.syntaxdoc.events.Diagnostic;
import net.syntaxdoc.loader.DocCommentParser;
import net.syntaxdoc.loader.DocToken;
import net.syntaxdoc.loader.RuleContents;
import net.syntaxdoc.model.Doc;
import net.syntaxdoc.model.Literal;
import net.syntaxdoc.model.Model;
import net.syntaxdoc.model.Reference;
import net.syntaxdoc.model.RuleContent;
import net.syntaxdoc.model.Sequence;

/**
 * Recursive descent parser for Bison grammars.
 *
 * <p>Of the declarations section, only token declarations ({@code %token}, the grmtools {@code
 * %epp} and documentation-only {@code //@ %token NAME} comments) are kept; everything else is
 * skipped. Rule bodies keep symbols, literals and inline doc comments. Actions, predicates and
 * directives such as {@code %prec} become empty elements.
 */
final class Parser {

  /** The declarations of a grammar file, with syntax errors and other problems found. */
  static final class ParseResult {
    final ImmutableList<DocToken> grammarDocs;
    final ImmutableList<TokenGroup> tokenGroups;
    final ImmutableList<RuleDeclaration> rules;
    // Any syntax error invalidates the whole grammar.
    final ImmutableList<Diagnostic> errors;
    // Problems that only affect a single declaration.
    final ImmutableList<Diagnostic> warnings;

    private ParseResult(
        ImmutableList<DocToken> grammarDocs,
        ImmutableList<TokenGroup> tokenGroups,
        ImmutableList<RuleDeclaration> rules,
        ImmutableList<Diagnostic> errors,
        ImmutableList<Diagnostic> warnings) {
      this.grammarDocs = grammarDocs;
      this.tokenGroups = tokenGroups;
      this.rules = rules;
      this.errors = errors;
      this.warnings = warnings;
    }
  }

  /** The tokens declared by one directive, and the comments in front of the directive. */
  static final class TokenGroup {
    final ImmutableList<DocToken> headers;
    final ImmutableList<DocToken> docs;
    final ImmutableList<TokenEntry> entries;

    TokenGroup(
        ImmutableList<DocToken> headers,
        ImmutableList<DocToken> docs,
        ImmutableList<TokenEntry> entries) {
      this.headers = headers;
      this.docs = docs;
      this.entries = entries;
    }
  }

  /** One declared token: {@code NAME [number] ["alias"]}. */
  static final class TokenEntry {
    final String name;
    final int line;
    @Nullable final String alias;
    // Doc comments written inside the directive, in front of this token.
    final ImmutableList<DocToken> docs;
    // Declared by grmtools' %epp, which only sets a pretty-printed name.
    final boolean epp;

    TokenEntry(
        String name, int line, @Nullable String alias, ImmutableList<DocToken> docs, boolean epp) {
      this.name = name;
      this.line = line;
      this.alias = alias;
      this.docs = docs;
      this.epp = epp;
    }
  }

  /** A rule {@code name: alternatives;} and the comments in front of it. */
  static final class RuleDeclaration {
    final String name;
    final int line;
    final ImmutableList<DocToken> headers;
    final ImmutableList<DocToken> docs;
    final RuleContent content;

    RuleDeclaration(
        String name,
        int line,
        ImmutableList<DocToken> headers,
        ImmutableList<DocToken> docs,
        RuleContent content) {
      this.name = name;
      this.line = line;
      this.headers = headers;
      this.docs = docs;
      this.content = content;
    }
  }

  private static final Pattern TOKEN_COMMAND = Pattern.compile("//@\\s*%token\\s*(.*)");

  // Tokens that start a new declaration.
  private static final EnumSet<TokenKind> DECLARATION_START_SET =
      EnumSet.of(
          TokenKind.DIRECTIVE,
          TokenKind.PROLOGUE,
          TokenKind.DOC_TOKEN,
          TokenKind.PERCENT_PERCENT,
          TokenKind.EOF);

  private static final EnumSet<TokenKind> ELEMENT_START_SET =
      EnumSet.of(
          TokenKind.IDENTIFIER,
          TokenKind.CHAR,
          TokenKind.STRING,
          TokenKind.ACTION,
          TokenKind.PREDICATE,
          TokenKind.DIRECTIVE,
          TokenKind.DOC_COMMENT,
          TokenKind.TAG,
          TokenKind.BRACKET);

  private final Lexer token; // token.kind is a prettier alias for lexer.kind
  private final Lexer lexer;
  private final Model model;
  private final List<Diagnostic> errors;
  private final List<Diagnostic> warnings = new ArrayList<>();

  // Comments collected in the declarations section since the last token declaration.
  private final List<DocToken> pendingDocs = new ArrayList<>();
  private final List<DocToken> pendingHeaders = new ArrayList<>();
  private boolean grammarDocsChosen;
  private ImmutableList<DocToken> grammarDocs = ImmutableList.of();

  private final List<TokenGroup> tokenGroups = new ArrayList<>();
  private final List<RuleDeclaration> rules = new ArrayList<>();

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
   * @param cCharLiterals whether action code uses C character literals, see {@link Lexer}
   * @param model the model that references in rule bodies resolve against
   */
  static ParseResult parseGrammar(String text, Path file, boolean cCharLiterals, Model model) {
    List<Diagnostic> errors = new ArrayList<>();
    Lexer lexer = new Lexer(text, file, cCharLiterals, errors);
    Parser parser = new Parser(lexer, model, errors);
    parser.parseDeclarations();
    parser.parseRules();
    return new ParseResult(
        parser.grammarDocs,
        ImmutableList.copyOf(parser.tokenGroups),
        ImmutableList.copyOf(parser.rules),
        ImmutableList.copyOf(errors),
        ImmutableList.copyOf(parser.warnings));
  }

  // declarations = (PROLOGUE | DOC_TOKEN | directive | ';')* '%%'
  private void parseDeclarations() {
    while (token.kind != TokenKind.PERCENT_PERCENT && token.kind != TokenKind.EOF) {
      collectComments();
      switch (token.kind) {
        case DOC_TOKEN -> parseTokenCommand();
        case DIRECTIVE -> {
          switch (token.raw) {
            case "%token" -> parseTokenDirective();
            case "%epp" -> parseEppDirective();
            default -> skipDirective();
          }
        }
        case PROLOGUE, SEMI -> nextToken();
        default -> {
          syntaxError("expected declaration");
          nextToken();
          recoveryMode = false;
        }
      }
    }
    chooseGrammarDocs();
    if (token.kind != TokenKind.PERCENT_PERCENT) {
      syntaxError("expected '%%'");
      return;
    }
    nextToken();
  }

  // The first doc comment of the declarations section documents the grammar. Called at the first
  // token declaration and at the end of the section; comments after it document tokens.
  private void chooseGrammarDocs() {
    if (grammarDocsChosen) {
      return;
    }
    grammarDocsChosen = true;
    if (!pendingDocs.isEmpty() && !pendingDocs.get(0).isCommand()) {
      grammarDocs = ImmutableList.of(pendingDocs.remove(0));
    }
  }

  private void collectComments() {
    pendingDocs.addAll(token.docs);
    pendingHeaders.addAll(token.headers);
  }

  private TokenGroup takeGroup(ImmutableList<TokenEntry> entries) {
    chooseGrammarDocs();
    TokenGroup group =
        new TokenGroup(
            ImmutableList.copyOf(pendingHeaders), ImmutableList.copyOf(pendingDocs), entries);
    pendingHeaders.clear();
    pendingDocs.clear();
    return group;
  }

  // '//@ %token' NAME
  private void parseTokenCommand() {
    Matcher matcher = TOKEN_COMMAND.matcher(token.raw.strip());
    String name = matcher.matches() ? matcher.group(1).strip() : "";
    if (name.isEmpty()) {
      warnings.add(
          Diagnostic.error(lexer.position(token.start), "failed to parse '%%token' command"));
    } else {
      tokenGroups.add(
          takeGroup(
              ImmutableList.of(
                  new TokenEntry(
                      name, token.line, /* alias= */ null, ImmutableList.of(), false))));
    }
    nextToken();
  }

  // '%token' ([TAG] IDENTIFIER [INT] [STRING | CHAR])+
  private void parseTokenDirective() {
    nextToken();
    ImmutableList.Builder<TokenEntry> entries = ImmutableList.builder();
    while (true) {
      if (token.kind == TokenKind.TAG) {
        nextToken();
      } else if (token.kind == TokenKind.IDENTIFIER) {
        String name = token.raw;
        int line = token.line;
        ImmutableList<DocToken> docs = token.docs;
        nextToken();
        if (token.kind == TokenKind.INT) {
          nextToken();
        }
        String alias = null;
        if (token.kind == TokenKind.STRING || token.kind == TokenKind.CHAR) {
          alias = token.raw;
          nextToken();
        }
        entries.add(new TokenEntry(name, line, alias, docs, /* epp= */ false));
      } else if (token.kind == TokenKind.STRING || token.kind == TokenKind.CHAR) {
        entries.add(
            new TokenEntry(token.raw, token.line, /* alias= */ null, token.docs, false));
        nextToken();
      } else {
        break;
      }
    }
    tokenGroups.add(takeGroup(entries.build()));
    if (token.kind == TokenKind.SEMI) {
      nextToken();
    } else if (!DECLARATION_START_SET.contains(token.kind)) {
      syntaxError("expected token name");
      skipDirectiveOperands();
    }
  }

  // '%epp' IDENTIFIER STRING
  private void parseEppDirective() {
    nextToken();
    if (token.kind != TokenKind.IDENTIFIER) {
      syntaxError("expected token name");
      skipDirectiveOperands();
      return;
    }
    String name = token.raw;
    int line = token.line;
    nextToken();
    String text = null;
    if (token.kind == TokenKind.STRING) {
      text = token.raw;
      nextToken();
    }
    tokenGroups.add(
        takeGroup(
            ImmutableList.of(new TokenEntry(name, line, text, ImmutableList.of(), true))));
    skipDirectiveOperands();
  }

  private void skipDirective() {
    nextToken();
    skipDirectiveOperands();
  }

  private void skipDirectiveOperands() {
    while (!DECLARATION_START_SET.contains(token.kind)) {
      if (token.kind == TokenKind.ILLEGAL) {
        syntaxError("unexpected character");
      }
      collectComments();
      nextToken();
    }
    recoveryMode = false;
  }

  // rules = rule* ; rule = RULE_NAME [BRACKET] ':' alternative ('|' alternative)* [';']
  private void parseRules() {
    while (token.kind != TokenKind.EOF) {
      if (token.kind == TokenKind.SEMI) {
        nextToken();
        continue;
      }
      if (token.kind != TokenKind.RULE_NAME) {
        syntaxError("expected rule");
        while (token.kind != TokenKind.RULE_NAME && token.kind != TokenKind.EOF) {
          nextToken();
        }
        recoveryMode = false;
        continue;
      }
      ImmutableList<DocToken> headers = token.headers;
      ImmutableList<DocToken> docs = token.docs;
      String name = token.raw;
      int line = token.line;
      nextToken();
      if (token.kind == TokenKind.BRACKET) {
        nextToken();
      }

      lexer.inRuleBody = true;
      expect(TokenKind.COLON);
      List<RuleContent> alternatives = new ArrayList<>();
      alternatives.add(parseAlternative());
      while (token.kind == TokenKind.OR) {
        nextToken();
        alternatives.add(parseAlternative());
      }
      lexer.inRuleBody = false;
      if (token.kind != TokenKind.SEMI
          && token.kind != TokenKind.RULE_NAME
          && token.kind != TokenKind.EOF) {
        syntaxError("expected ';'");
      }
      rules.add(
          new RuleDeclaration(
              name, line, headers, docs, RuleContents.alternative(alternatives)));
      recoveryMode = false;
    }
  }

  // alternative = element*
  private RuleContent parseAlternative() {
    List<RuleContent> elements = new ArrayList<>();
    while (ELEMENT_START_SET.contains(token.kind)) {
      elements.add(parseElement());
    }
    return RuleContents.sequence(elements);
  }

  // element = IDENTIFIER [BRACKET] | (CHAR | STRING) [BRACKET] | [TAG] ACTION [BRACKET]
  //         | PREDICATE | DOC_COMMENT | directive
  private RuleContent parseElement() {
    RuleContent element = Sequence.EMPTY;
    switch (token.kind) {
      case IDENTIFIER -> element = Reference.of(model, token.raw);
      case CHAR, STRING -> element = Literal.of(token.raw);
      case DOC_COMMENT ->
          element = Doc.of(Joiner.on('\n').join(DocCommentParser.parseDocComment(token.raw)));
      case DIRECTIVE -> {
        parseElementDirective();
        return Sequence.EMPTY;
      }
      default -> {} // actions, predicates, tags and stray named references
    }
    nextToken();
    if (token.kind == TokenKind.BRACKET) {
      nextToken();
    }
    return element;
  }

  // %empty | %prec symbol | %dprec INT | %merge TAG | %expect INT | %expect-rr INT
  private void parseElementDirective() {
    String directive = token.raw;
    nextToken();
    switch (directive) {
      case "%empty" -> {}
      case "%prec" -> {
        if (token.kind == TokenKind.IDENTIFIER
            || token.kind == TokenKind.CHAR
            || token.kind == TokenKind.STRING) {
          nextToken();
        } else {
          syntaxError("expected symbol after %prec");
        }
      }
      case "%dprec", "%expect", "%expect-rr" -> expect(TokenKind.INT);
      case "%merge" -> expect(TokenKind.TAG);
      default -> syntaxErrorAt(token.start, "unexpected directive %s in rule", directive);
    }
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

  @FormatMethod
  private void syntaxErrorAt(int offset, String format, Object... args) {
    if (!recoveryMode) {
      reportError(offset, "syntax error: %s", String.format(format, args));
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

  private void nextToken() {
    if (token.kind != TokenKind.EOF) {
      lexer.nextToken();
    }
  }
}
