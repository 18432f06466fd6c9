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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.FormatMethod;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import net.syntaxdoc.events.Diagnostic;
import net.syntaxdoc.events.DiagnosticHandler;
import net.syntaxdoc.model.DocLine;
import net.syntaxdoc.model.Position;
import net.syntaxdoc.model.Section;

/**
 * Interprets the documentation comments of a grammar file.
 *
 * <p>Two kinds of comments carry documentation:
 *
 * <ul>
 *   <li>doc comments ({@code /**} blocks), whose text becomes documentation lines. Leading
 *       asterisks and common indentation are removed;
 *   <li>commands, {@code //@ doc:command argument}, which set rule metadata.
 * </ul>
 *
 * <p>A malformed command is reported and ignored; the remaining comments are still processed.
 */
public final class DocCommentParser {

  private static final Pattern COMMAND =
      Pattern.compile("//@\\s*doc\\s*:\\s*([a-zA-Z0-9_-]+)\\s*(.*)", Pattern.DOTALL);

  // Commands that take no argument.
  private static final ImmutableSet<String> FLAG_COMMANDS =
      ImmutableSet.of(
          "nodoc",
          "no-doc",
          "inline",
          "nodiagram",
          "no-diagram",
          "keep-diagram-recursive",
          "unimportant");

  private static final CharMatcher SLASH = CharMatcher.is('/');

  private final Path file;
  private final DiagnosticHandler handler;
  @Nullable private final InlineContentParser contentParser;

  /**
   * @param file the file that positions refer to
   * @param contentParser parses {@code doc:content} arguments; if null, the command is reported as
   *     unsupported
   */
  public DocCommentParser(
      Path file, DiagnosticHandler handler, @Nullable InlineContentParser contentParser) {
    this.file = file;
    this.handler = handler;
    this.contentParser = contentParser;
  }

  /**
   * Interprets the comments in front of a declaration.
   *
   * @param allowCommands whether {@code //@} commands may appear here. Commands in front of the
   *     grammar header or inside rule bodies are reported and ignored.
   */
  public DocInfo parse(List<DocToken> tokens, boolean allowCommands) {
    DocInfo.Builder info = DocInfo.builder();
    List<DocLine> documentation = new ArrayList<>();
    for (DocToken token : tokens) {
      Position position = Position.create(file, token.line());
      if (!token.isCommand()) {
        ImmutableList<String> lines = parseDocComment(token.text());
        for (int i = 0; i < lines.size(); i++) {
          documentation.add(DocLine.create(token.line() + i, lines.get(i)));
        }
        continue;
      }

      String text = CharMatcher.whitespace().trimTrailingFrom(token.text());
      Matcher matcher = COMMAND.matcher(text);
      if (!matcher.matches()) {
        error(position, "invalid command '%s'", text);
        continue;
      }
      if (!allowCommands) {
        error(position, "commands not allowed here");
        continue;
      }
      String command = matcher.group(1);
      String argument = matcher.group(2).trim();
      applyCommand(info, command, argument, position);
    }
    return info.documentation(documentation).build();
  }

  private void applyCommand(
      DocInfo.Builder info, String command, String argument, Position position) {
    switch (command) {
      case "nodoc", "no-doc" -> info.nodoc(true);
      case "inline" -> info.inline(true);
      case "nodiagram", "no-diagram" -> info.noDiagram(true);
      case "keep-diagram-recursive" -> info.keepDiagramRecursive(true);
      case "unimportant" -> info.importance(0);
      case "importance" -> {
        int importance;
        try {
          importance = Integer.parseInt(argument);
        } catch (NumberFormatException e) {
          error(position, "importance requires an integer argument");
          return;
        }
        if (importance < 0) {
          error(position, "importance should not be negative");
          return;
        }
        info.importance(importance);
      }
      case "name" -> {
        if (argument.isEmpty()) {
          error(position, "name command requires an argument");
          return;
        }
        info.name(argument);
      }
      case "css-class" -> {
        if (argument.isEmpty()) {
          error(position, "css-class command requires an argument");
          return;
        }
        info.cssClass(argument);
      }
      case "content" -> {
        if (argument.isEmpty()) {
          error(position, "content command requires an argument");
          return;
        }
        if (contentParser == null) {
          error(position, "content command is not supported here");
          return;
        }
        info.content(contentParser.parse(argument, position));
      }
      default -> {
        error(position, "unknown command '%s'", command);
        return;
      }
    }
    if (FLAG_COMMANDS.contains(command) && !argument.isEmpty()) {
      handler.handle(
          Diagnostic.warning(position, "argument for '%s' command is ignored", command));
    }
  }

  /**
   * Returns the section formed by consecutive {@code ///} comments, or null if there are none. The
   * slashes and surrounding whitespace are stripped from every line.
   */
  @Nullable
  public Section parseSection(List<DocToken> headers) {
    if (headers.isEmpty()) {
      return null;
    }
    ImmutableList.Builder<DocLine> lines = ImmutableList.builder();
    for (DocToken header : headers) {
      lines.add(DocLine.create(header.line(), SLASH.trimLeadingFrom(header.text()).trim()));
    }
    return new Section(lines.build(), Position.create(file, headers.get(0).line()));
  }

  /**
   * Returns the lines of text in a {@code /**} comment.
   *
   * <p>The text of a single-line comment is trimmed. In a multi-line comment, the text after the
   * opening delimiter is the first line; if every following line starts with an asterisk, the
   * asterisks are removed, and then the common indentation of those lines.
   */
  public static ImmutableList<String> parseDocComment(String text) {
    List<String> lines = Splitter.onPattern("\r?\n").splitToList(text);
    if (lines.size() == 1) {
      return ImmutableList.of(stripDelimiters(text).trim());
    }
    ImmutableList.Builder<String> result = ImmutableList.builder();
    result.add(lines.get(0).substring(Math.min(3, lines.get(0).length())).trim());

    List<String> rest = new ArrayList<>(lines.subList(1, lines.size()));
    String last = rest.get(rest.size() - 1);
    last = last.endsWith("*/") ? last.substring(0, last.length() - 2) : last;
    rest.set(rest.size() - 1, CharMatcher.whitespace().trimTrailingFrom(last));
    if (rest.get(rest.size() - 1).isBlank()) {
      rest.remove(rest.size() - 1);
    }

    CharMatcher whitespace = CharMatcher.whitespace();
    if (rest.stream().allMatch(line -> whitespace.trimLeadingFrom(line).startsWith("*"))) {
      rest.replaceAll(line -> whitespace.trimLeadingFrom(line).substring(1));
    }
    result.addAll(dedent(rest));
    return result.build();
  }

  private static String stripDelimiters(String text) {
    String inner = text.startsWith("/**") ? text.substring(3) : text;
    return inner.endsWith("*/") ? inner.substring(0, inner.length() - 2) : inner;
  }

  /**
   * Removes the longest whitespace prefix shared by all non-blank lines. Blank lines become empty.
   */
  static ImmutableList<String> dedent(List<String> lines) {
    String margin = null;
    for (String line : lines) {
      if (line.isBlank()) {
        continue;
      }
      String indent = line.substring(0, CharMatcher.whitespace().negate().indexIn(line));
      if (margin == null) {
        margin = indent;
      } else {
        int common = 0;
        while (common < margin.length()
            && common < indent.length()
            && margin.charAt(common) == indent.charAt(common)) {
          common++;
        }
        margin = margin.substring(0, common);
      }
    }
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (String line : lines) {
      if (line.isBlank()) {
        result.add("");
      } else {
        result.add(line.substring(margin.length()));
      }
    }
    return result.build();
  }

  @FormatMethod
  private void error(Position position, String format, Object... args) {
    handler.handle(Diagnostic.error(position, format, args));
  }
}
