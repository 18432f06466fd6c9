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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import net.syntaxdoc.events.Diagnostic;
import net.syntaxdoc.loader.DocToken;
import net.syntaxdoc.loader.LineIndex;
import net.syntaxdoc.model.Position;

/**
 * A scanner for Bison grammars.
 *
 * <p>The lexer tracks the three parts of a grammar file. In the declarations, {@code //@ %token
 * NAME} comments are tokens ({@link TokenKind#DOC_TOKEN}). In the rules, an identifier followed by
 * a colon is a {@link TokenKind#RULE_NAME}, and doc comments inside rule bodies are tokens. The
 * epilogue after the second {@code %%} is not scanned.
 *
 * <p>Other documentation comments are attached to the next token ({@link #docs}, {@link
 * #headers}).
 */
final class Lexer {

  private static final Pattern TOKEN_COMMAND = Pattern.compile("//@\\s*%token\\b.*");

  // Information about current token. Updated by nextToken.
  TokenKind kind;
  int start; // start offset
  int end; // end offset
  int line; // line of the start offset
  String raw; // source text of token

  // Documentation comments between the previous token and this one, in source order.
  ImmutableList<DocToken> docs = ImmutableList.of();
  ImmutableList<DocToken> headers = ImmutableList.of();

  // Set by the parser while it reads a rule body.
  boolean inRuleBody;

  // --- end of parser-visible fields ---

  private final List<Diagnostic> errors;
  private final Path file;
  private final LineIndex lines;
  private final boolean cCharLiterals;

  // Input buffer and position
  private final char[] buffer;
  private int pos;

  // Number of '%%' separators seen.
  private int separators;

  private final List<DocToken> pendingDocs = new ArrayList<>();
  private final List<DocToken> pendingHeaders = new ArrayList<>();

  /**
   * Constructs a lexer for the grammar in {@code text}.
   *
   * @param cCharLiterals whether single quotes in action code delimit character literals, as in C.
   *     Otherwise they only do so around a single (possibly escaped) character, so that Rust
   *     lifetimes and similar constructs are left alone.
   */
  Lexer(String text, Path file, boolean cCharLiterals, List<Diagnostic> errors) {
    this.buffer = text.toCharArray();
    this.file = file;
    this.lines = LineIndex.create(buffer, 1);
    this.cCharLiterals = cCharLiterals;
    this.errors = errors;
  }

  void nextToken() {
    Preconditions.checkState(kind != TokenKind.EOF, "nextToken called after EOF");
    tokenize();
    docs = ImmutableList.copyOf(pendingDocs);
    headers = ImmutableList.copyOf(pendingHeaders);
    pendingDocs.clear();
    pendingHeaders.clear();
  }

  /** Whether the lexer has passed the first {@code %%}. */
  boolean inRules() {
    return separators > 0;
  }

  Position position(int offset) {
    return Position.create(file, lines.lineOf(offset));
  }

  private String bufferSlice(int start, int end) {
    return new String(buffer, start, end - start);
  }

  private void error(String message, int offset) {
    errors.add(Diagnostic.error(position(offset), "%s", message));
  }

  private void setToken(TokenKind kind, int start, int end) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.line = lines.lineOf(start);
    this.raw = bufferSlice(start, end);
  }

  // Returns the char at offset p, or -1 for EOF.
  private int charAt(int p) {
    return p < buffer.length ? buffer[p] : -1;
  }

  private int peek(int i) {
    return charAt(pos + i);
  }

  private void tokenize() {
    while (pos < buffer.length) {
      int c = buffer[pos];
      int tokenStart = pos;
      switch (c) {
        case ' ', '\t', '\r', '\n', '\f' -> pos++;
        case '/' -> {
          if (peek(1) == '/' || peek(1) == '*') {
            if (comment()) {
              return;
            }
          } else {
            illegal();
            return;
          }
        }
        case '%' -> {
          percent();
          return;
        }
        case '{' -> {
          action(TokenKind.ACTION, pos);
          return;
        }
        case '<' -> {
          tag();
          return;
        }
        case '[' -> {
          bracket();
          return;
        }
        case '\'' -> {
          quoted('\'', TokenKind.CHAR);
          return;
        }
        case '"' -> {
          quoted('"', TokenKind.STRING);
          return;
        }
        case ':' -> {
          pos++;
          setToken(TokenKind.COLON, tokenStart, pos);
          return;
        }
        case ';' -> {
          pos++;
          setToken(TokenKind.SEMI, tokenStart, pos);
          return;
        }
        case '|' -> {
          pos++;
          setToken(TokenKind.OR, tokenStart, pos);
          return;
        }
        default -> {
          if (isIdentifierStart(c)) {
            pos = identifierEnd(pos);
            setToken(
                inRules() && followedByColon(pos) ? TokenKind.RULE_NAME : TokenKind.IDENTIFIER,
                tokenStart,
                pos);
          } else if (isDigit(c)) {
            while (peek(0) >= 0 && Character.isLetterOrDigit(peek(0))) {
              pos++; // decimal or hexadecimal
            }
            setToken(TokenKind.INT, tokenStart, pos);
          } else {
            illegal();
          }
          return;
        }
      }
    }
    setToken(TokenKind.EOF, pos, pos);
  }

  private void illegal() {
    int tokenStart = pos;
    pos++;
    error(String.format("invalid character: '%c'", buffer[tokenStart]), tokenStart);
    setToken(TokenKind.ILLEGAL, tokenStart, pos);
  }

  // Scans a comment starting at pos. Returns true if the comment is a token.
  private boolean comment() {
    int commentStart = pos;
    int commentLine = lines.lineOf(commentStart);
    if (peek(1) == '/') {
      while (pos < buffer.length && buffer[pos] != '\n') {
        pos++;
      }
      String text = bufferSlice(commentStart, pos);
      if (text.startsWith("///")) {
        pendingHeaders.add(DocToken.create(text, commentLine));
      } else if (text.startsWith("//@")) {
        if (!inRules() && TOKEN_COMMAND.matcher(text.stripTrailing()).matches()) {
          setToken(TokenKind.DOC_TOKEN, commentStart, pos);
          return true;
        }
        pendingDocs.add(DocToken.create(text, commentLine));
      }
      return false;
    }

    boolean isDoc = peek(2) == '*' && peek(3) != '/';
    pos = blockCommentEnd(pos);
    if (pos < 0) {
      pos = buffer.length;
      error("unterminated comment", commentStart);
      return false;
    }
    if (!isDoc) {
      return false;
    }
    if (inRuleBody && !atRuleBoundary(pos)) {
      setToken(TokenKind.DOC_COMMENT, commentStart, pos);
      return true;
    }
    pendingDocs.add(DocToken.create(bufferSlice(commentStart, pos), commentLine));
    return false;
  }

  // Returns the offset after the block comment starting at p, or -1 if it is unterminated.
  private int blockCommentEnd(int p) {
    p += 2;
    while (p < buffer.length && !(buffer[p] == '*' && charAt(p + 1) == '/')) {
      p++;
    }
    return p < buffer.length ? p + 2 : -1;
  }

  // Returns the offset of the first character at or after p that is not whitespace or a comment.
  private int skipTrivia(int p) {
    while (p < buffer.length) {
      char c = buffer[p];
      if (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f') {
        p++;
      } else if (c == '/' && charAt(p + 1) == '/') {
        while (p < buffer.length && buffer[p] != '\n') {
          p++;
        }
      } else if (c == '/' && charAt(p + 1) == '*') {
        int end = blockCommentEnd(p);
        p = end < 0 ? buffer.length : end;
      } else {
        break;
      }
    }
    return p;
  }

  // Whether the text at p, after trivia, starts a new rule or ends the rules section. A doc comment
  // in that place documents the next rule rather than the current alternative.
  private boolean atRuleBoundary(int p) {
    p = skipTrivia(p);
    if (p >= buffer.length || (buffer[p] == '%' && charAt(p + 1) == '%')) {
      return true;
    }
    return isIdentifierStart(buffer[p]) && followedByColon(identifierEnd(p));
  }

  // Whether an identifier ending at p is a rule name, i.e. followed by an optional named reference
  // and a colon.
  private boolean followedByColon(int p) {
    p = skipTrivia(p);
    if (charAt(p) == '[') {
      while (p < buffer.length && buffer[p] != ']' && buffer[p] != '\n') {
        p++;
      }
      p = skipTrivia(p + 1);
    }
    return charAt(p) == ':';
  }

  private int identifierEnd(int p) {
    while (isIdentifierPart(charAt(p))) {
      p++;
    }
    return p;
  }

  // %% | %{ ... %} | %?{ ... } | %directive
  private void percent() {
    int tokenStart = pos;
    switch (peek(1)) {
      case '%' -> {
        pos += 2;
        separators++;
        if (separators > 1) {
          pos = buffer.length; // the epilogue is target language code
          setToken(TokenKind.EOF, pos, pos);
        } else {
          setToken(TokenKind.PERCENT_PERCENT, tokenStart, pos);
        }
      }
      case '{' -> {
        pos += 2;
        while (pos < buffer.length && !(buffer[pos] == '%' && peek(1) == '}')) {
          pos++;
        }
        if (pos >= buffer.length) {
          error("unterminated prologue", tokenStart);
        } else {
          pos += 2;
        }
        setToken(TokenKind.PROLOGUE, tokenStart, pos);
      }
      case '?' -> {
        pos += 2;
        while (pos < buffer.length && Character.isWhitespace(buffer[pos])) {
          pos++;
        }
        if (peek(0) != '{') {
          error("expected '{' after '%?'", tokenStart);
          setToken(TokenKind.ILLEGAL, tokenStart, pos);
        } else {
          action(TokenKind.PREDICATE, tokenStart);
        }
      }
      default -> {
        pos++;
        while (isIdentifierPart(peek(0))) {
          pos++;
        }
        if (pos == tokenStart + 1) {
          error("expected directive name after '%'", tokenStart);
          setToken(TokenKind.ILLEGAL, tokenStart, pos);
        } else {
          setToken(TokenKind.DIRECTIVE, tokenStart, pos);
        }
      }
    }
  }

  // Scans brace-delimited code at pos, skipping nested braces, strings, character literals and
  // comments of the target language.
  private void action(TokenKind kind, int tokenStart) {
    int depth = 0;
    while (pos < buffer.length) {
      char c = buffer[pos];
      switch (c) {
        case '{' -> {
          depth++;
          pos++;
        }
        case '}' -> {
          pos++;
          if (--depth == 0) {
            setToken(kind, tokenStart, pos);
            return;
          }
        }
        case '"' -> skipQuoted('"');
        case '\'' -> skipCharLiteral();
        case '/' -> {
          if (peek(1) == '/') {
            while (pos < buffer.length && buffer[pos] != '\n') {
              pos++;
            }
          } else if (peek(1) == '*') {
            int end = blockCommentEnd(pos);
            pos = end < 0 ? buffer.length : end;
          } else {
            pos++;
          }
        }
        default -> pos++;
      }
    }
    error("unterminated action", tokenStart);
    setToken(kind, tokenStart, pos);
  }

  private void skipCharLiteral() {
    if (cCharLiterals) {
      skipQuoted('\'');
    } else if (peek(1) == '\\') {
      skipQuoted('\'');
    } else if (peek(1) != -1 && peek(2) == '\'') {
      pos += 3;
    } else {
      pos++; // a lifetime or a label, not a literal
    }
  }

  private void skipQuoted(char quote) {
    pos++;
    while (pos < buffer.length && buffer[pos] != quote && buffer[pos] != '\n') {
      pos += buffer[pos] == '\\' ? 2 : 1;
    }
    pos = Math.min(pos + 1, buffer.length);
  }

  // Scans a quoted literal. Escapes are kept as written.
  private void quoted(char quote, TokenKind kind) {
    int literalStart = pos;
    pos++;
    while (pos < buffer.length) {
      char c = buffer[pos];
      if (c == '\n') {
        break;
      }
      pos++;
      if (c == '\\') {
        if (pos < buffer.length && buffer[pos] != '\n') {
          pos++;
        }
      } else if (c == quote) {
        setToken(kind, literalStart, pos);
        return;
      }
    }
    error("unclosed " + kind, literalStart);
    setToken(kind, literalStart, pos);
  }

  // <tag>, where tags may nest angle brackets: <std::vector<int>>
  private void tag() {
    int tagStart = pos;
    int depth = 0;
    while (pos < buffer.length && buffer[pos] != '\n') {
      char c = buffer[pos++];
      if (c == '<') {
        depth++;
      } else if (c == '>' && --depth == 0) {
        setToken(TokenKind.TAG, tagStart, pos);
        return;
      }
    }
    error("unterminated type tag", tagStart);
    setToken(TokenKind.TAG, tagStart, pos);
  }

  // [name]
  private void bracket() {
    int bracketStart = pos;
    while (pos < buffer.length && buffer[pos] != '\n') {
      if (buffer[pos++] == ']') {
        setToken(TokenKind.BRACKET, bracketStart, pos);
        return;
      }
    }
    error("unterminated named reference", bracketStart);
    setToken(TokenKind.BRACKET, bracketStart, pos);
  }

  private static boolean isDigit(int c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(int c) {
    return c == '_' || c == '.' || (c >= 0 && Character.isLetter(c));
  }

  private static boolean isIdentifierPart(int c) {
    return c == '_' || c == '.' || c == '-' || (c >= 0 && Character.isLetterOrDigit(c));
  }
}
