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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.syntaxdoc.events.Diagnostic;
import net.syntaxdoc.loader.DocToken;
import net.syntaxdoc.loader.LineIndex;
import net.syntaxdoc.model.Position;

/**
 * A scanner for ANTLR4 grammars.
 *
 * <p>Ordinary comments are skipped. Documentation comments ({@code /**}, {@code //@} and {@code
 * ///}) are not tokens: the lexer attaches them to the next token, where the parser picks them up
 * through {@link #docs} and {@link #headers}. Inside rule bodies, {@code /**} comments are tokens
 * of their own ({@link TokenKind#DOC_COMMENT}), since they document the elements next to them.
 */
final class Lexer {

  // Keywords after which '{' opens a list of declarations rather than an action.
  private static final ImmutableSet<String> BLOCK_KEYWORDS =
      ImmutableSet.of("options", "tokens", "channels");

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

  // Input buffer and position
  private final char[] buffer;
  private int pos;

  // True between 'options {' and the matching '}'.
  private boolean inBlock;

  private final List<DocToken> pendingDocs = new ArrayList<>();
  private final List<DocToken> pendingHeaders = new ArrayList<>();

  /**
   * Constructs a lexer for {@code text}, whose first line is line {@code firstLine} of {@code
   * file}. Errors are appended to errors.
   */
  Lexer(String text, Path file, int firstLine, List<Diagnostic> errors) {
    this.buffer = text.toCharArray();
    this.file = file;
    this.lines = LineIndex.create(buffer, firstLine);
    this.errors = errors;
  }

  /**
   * Reads the next token, updating the Lexer's token fields. It is an error to call nextToken after
   * an EOF token.
   */
  void nextToken() {
    Preconditions.checkState(kind != TokenKind.EOF, "nextToken called after EOF");
    boolean afterBlockKeyword = kind == TokenKind.IDENTIFIER && BLOCK_KEYWORDS.contains(raw);
    tokenize(afterBlockKeyword);
    docs = ImmutableList.copyOf(pendingDocs);
    headers = ImmutableList.copyOf(pendingHeaders);
    pendingDocs.clear();
    pendingHeaders.clear();
  }

  /** Returns the position of the given offset. */
  Position position(int offset) {
    return Position.create(file, lines.lineOf(offset));
  }

  String bufferSlice(int start, int end) {
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

  // Returns the ith unconsumed char, or -1 for EOF.
  private int peek(int i) {
    return pos + i < buffer.length ? buffer[pos + i] : -1;
  }

  private void tokenize(boolean afterBlockKeyword) {
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
            pos++;
            error("unexpected character '/'", tokenStart);
            setToken(TokenKind.ILLEGAL, tokenStart, pos);
            return;
          }
        }
        case '{' -> {
          if (afterBlockKeyword && !inBlock) {
            pos++;
            inBlock = true;
            setToken(TokenKind.LBRACE, tokenStart, pos);
          } else {
            action();
          }
          return;
        }
        case '}' -> {
          pos++;
          inBlock = false;
          setToken(TokenKind.RBRACE, tokenStart, pos);
          return;
        }
        case '[' -> {
          argument();
          return;
        }
        case '\'' -> {
          stringLiteral();
          return;
        }
        case ':' -> {
          punctuation(peek(1) == ':' ? TokenKind.COLONCOLON : TokenKind.COLON);
          return;
        }
        case '-' -> {
          if (peek(1) == '>') {
            punctuation(TokenKind.RARROW);
          } else {
            pos++;
            error("unexpected character '-'", tokenStart);
            setToken(TokenKind.ILLEGAL, tokenStart, pos);
          }
          return;
        }
        case '.' -> {
          punctuation(peek(1) == '.' ? TokenKind.RANGE : TokenKind.DOT);
          return;
        }
        case '+' -> {
          punctuation(peek(1) == '=' ? TokenKind.PLUS_ASSIGN : TokenKind.PLUS);
          return;
        }
        case '=' -> {
          punctuation(TokenKind.ASSIGN);
          return;
        }
        case ',' -> {
          punctuation(TokenKind.COMMA);
          return;
        }
        case ';' -> {
          punctuation(TokenKind.SEMI);
          return;
        }
        case '(' -> {
          punctuation(TokenKind.LPAREN);
          return;
        }
        case ')' -> {
          punctuation(TokenKind.RPAREN);
          return;
        }
        case '<' -> {
          punctuation(TokenKind.LT);
          return;
        }
        case '>' -> {
          punctuation(TokenKind.GT);
          return;
        }
        case '?' -> {
          punctuation(TokenKind.QUESTION);
          return;
        }
        case '*' -> {
          punctuation(TokenKind.STAR);
          return;
        }
        case '|' -> {
          punctuation(TokenKind.OR);
          return;
        }
        case '$' -> {
          punctuation(TokenKind.DOLLAR);
          return;
        }
        case '@' -> {
          punctuation(TokenKind.AT);
          return;
        }
        case '#' -> {
          punctuation(TokenKind.POUND);
          return;
        }
        case '~' -> {
          punctuation(TokenKind.NOT);
          return;
        }
        default -> {
          if (isIdentifierStart(c)) {
            identifier();
          } else if (isDigit(c)) {
            while (isDigit(peek(0))) {
              pos++;
            }
            setToken(TokenKind.INT, tokenStart, pos);
          } else {
            pos++;
            error(String.format("invalid character: '%c'", (char) c), tokenStart);
            setToken(TokenKind.ILLEGAL, tokenStart, pos);
          }
          return;
        }
      }
    }
    setToken(TokenKind.EOF, pos, pos);
  }

  private void punctuation(TokenKind kind) {
    int tokenStart = pos;
    pos += kind.toString().length();
    setToken(kind, tokenStart, pos);
  }

  // Scans a comment starting at pos. Returns true if the comment is a token.
  private boolean comment() {
    int commentStart = pos;
    if (peek(1) == '/') {
      while (pos < buffer.length && buffer[pos] != '\n') {
        pos++;
      }
      String text = bufferSlice(commentStart, pos);
      DocToken token = DocToken.create(text, lines.lineOf(commentStart));
      if (text.startsWith("///")) {
        pendingHeaders.add(token);
      } else if (text.startsWith("//@")) {
        pendingDocs.add(token);
      }
      return false;
    }

    boolean isDoc = peek(2) == '*' && peek(3) != '/';
    pos += 2;
    while (pos < buffer.length && !(buffer[pos] == '*' && peek(1) == '/')) {
      pos++;
    }
    if (pos >= buffer.length) {
      error("unterminated comment", commentStart);
      return false;
    }
    pos += 2;
    if (!isDoc) {
      return false;
    }
    if (inRuleBody) {
      setToken(TokenKind.DOC_COMMENT, commentStart, pos);
      return true;
    }
    pendingDocs.add(
        DocToken.create(bufferSlice(commentStart, pos), lines.lineOf(commentStart)));
    return false;
  }

  private void identifier() {
    int tokenStart = pos;
    while (isIdentifierPart(peek(0))) {
      pos++;
    }
    setToken(TokenKind.IDENTIFIER, tokenStart, pos);
  }

  // Scans a quoted literal. Escapes are kept as written.
  private void stringLiteral() {
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
      } else if (c == '\'') {
        setToken(TokenKind.STRING, literalStart, pos);
        return;
      }
    }
    error("unclosed string literal", literalStart);
    setToken(TokenKind.STRING, literalStart, pos);
  }

  // Scans a bracketed block: a lexer character set in rule bodies, an argument list elsewhere.
  // Argument lists may nest; character sets may contain an unescaped '['.
  private void argument() {
    int argumentStart = pos;
    boolean nests = !inRuleBody;
    int depth = 0;
    while (pos < buffer.length) {
      char c = buffer[pos++];
      if (c == '\\' && pos < buffer.length) {
        pos++;
      } else if (c == '[' && (nests || depth == 0)) {
        depth++;
      } else if (c == ']' && --depth == 0) {
        setToken(TokenKind.ARGUMENT, argumentStart, pos);
        return;
      }
    }
    error("unterminated '['", argumentStart);
    setToken(TokenKind.ARGUMENT, argumentStart, pos);
  }

  // Scans a brace-delimited action, skipping nested braces, strings and comments of the target
  // language.
  private void action() {
    int actionStart = pos;
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
            setToken(TokenKind.ACTION, actionStart, pos);
            return;
          }
        }
        case '"', '\'' -> skipQuoted(c);
        case '/' -> {
          if (peek(1) == '/') {
            while (pos < buffer.length && buffer[pos] != '\n') {
              pos++;
            }
          } else if (peek(1) == '*') {
            pos += 2;
            while (pos < buffer.length && !(buffer[pos] == '*' && peek(1) == '/')) {
              pos++;
            }
            pos = Math.min(pos + 2, buffer.length);
          } else {
            pos++;
          }
        }
        case '\\' -> pos = Math.min(pos + 2, buffer.length);
        default -> pos++;
      }
    }
    error("unterminated action", actionStart);
    setToken(TokenKind.ACTION, actionStart, pos);
  }

  private void skipQuoted(char quote) {
    pos++;
    while (pos < buffer.length && buffer[pos] != quote && buffer[pos] != '\n') {
      pos += buffer[pos] == '\\' ? 2 : 1;
    }
    pos = Math.min(pos + 1, buffer.length);
  }

  private static boolean isDigit(int c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(int c) {
    return c == '_' || (c >= 0 && Character.isLetter(c));
  }

  private static boolean isIdentifierPart(int c) {
    return c == '_' || (c >= 0 && Character.isLetterOrDigit(c));
  }
}
