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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import net.syntaxdoc.events.CollectingDiagnosticHandler;
import net.syntaxdoc.events.Diagnostic;
import net.syntaxdoc.model.DocLine;
import net.syntaxdoc.model.Literal;
import net.syntaxdoc.model.Position;
import net.syntaxdoc.model.Section;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link DocCommentParser}. */
@RunWith(JUnit4.class)
public class DocCommentParserTest {

  private static final Path FILE = Path.of("/grammars/G.g4");

  private final CollectingDiagnosticHandler handler = new CollectingDiagnosticHandler();
  private final DocCommentParser parser =
      new DocCommentParser(FILE, handler, (body, position) -> Literal.of("'" + body + "'"));

  private DocInfo parse(String... comments) {
    ImmutableList.Builder<DocToken> tokens = ImmutableList.builder();
    for (int i = 0; i < comments.length; i++) {
      tokens.add(DocToken.create(comments[i], 10 + i));
    }
    return parser.parse(tokens.build(), /* allowCommands= */ true);
  }

  @Test
  public void testSingleLineComment() {
    assertThat(DocCommentParser.parseDocComment("/**   A rule.  */")).containsExactly("A rule.");
  }

  @Test
  public void testMultiLineCommentWithAsterisks() {
    assertThat(
            DocCommentParser.parseDocComment(
                "/**\n   * Matches a number.\n   *\n   *   42\n   */"))
        .containsExactly("", "Matches a number.", "", "  42")
        .inOrder();
  }

  @Test
  public void testMultiLineCommentWithoutAsterisks() {
    assertThat(DocCommentParser.parseDocComment("/** First line\n    second\n      third */"))
        .containsExactly("First line", "second", "  third")
        .inOrder();
  }

  @Test
  public void testDedent() {
    assertThat(DocCommentParser.dedent(ImmutableList.of("    a", "  ", "      b")))
        .containsExactly("a", "", "  b")
        .inOrder();
  }

  @Test
  public void testDocumentationLinesKeepSourceLines() {
    DocInfo info = parse("/** one */", "/**\n * two\n * three\n */");
    assertThat(info.documentation())
        .containsExactly(
            DocLine.create(10, "one"),
            DocLine.create(11, ""),
            DocLine.create(12, "two"),
            DocLine.create(13, "three"))
        .inOrder();
    assertThat(handler.getDiagnostics()).isEmpty();
  }

  @Test
  public void testFlagCommands() {
    DocInfo info =
        parse(
            "//@ doc:nodoc",
            "//@ doc:inline",
            "//@doc:no-diagram",
            "//@ doc : keep-diagram-recursive",
            "//@ doc:unimportant");
    assertThat(info.nodoc()).isTrue();
    assertThat(info.inline()).isTrue();
    assertThat(info.noDiagram()).isTrue();
    assertThat(info.keepDiagramRecursive()).isTrue();
    assertThat(info.importance()).isEqualTo(0);
    assertThat(handler.getDiagnostics()).isEmpty();
  }

  @Test
  public void testCommandsWithArguments() {
    DocInfo info =
        parse(
            "//@ doc:name Binary expression",
            "//@ doc:css-class op",
            "//@ doc:importance 7",
            "//@ doc:content x y");
    assertThat(info.name()).isEqualTo("Binary expression");
    assertThat(info.cssClass()).isEqualTo("op");
    assertThat(info.importance()).isEqualTo(7);
    assertThat(info.content()).isSameInstanceAs(Literal.of("'x y'"));
    assertThat(handler.getDiagnostics()).isEmpty();
  }

  @Test
  public void testArgumentOfFlagCommandIsIgnored() {
    DocInfo info = parse("//@ doc:nodoc please");
    assertThat(info.nodoc()).isTrue();
    assertThat(handler.getDiagnostics())
        .containsExactly(
            Diagnostic.warning(
                Position.create(FILE, 10),
                "argument for 'nodoc' command is ignored"));
  }

  @Test
  public void testMalformedCommands() {
    DocInfo info =
        parse(
            "//@ nothing here",
            "//@ doc:importance high",
            "//@ doc:importance -2",
            "//@ doc:name",
            "//@ doc:css-class",
            "//@ doc:content",
            "//@ doc:frobnicate",
            "/** still documented */");
    assertThat(handler.getMessages())
        .containsExactly(
            "invalid command '//@ nothing here'",
            "importance requires an integer argument",
            "importance should not be negative",
            "name command requires an argument",
            "css-class command requires an argument",
            "content command requires an argument",
            "unknown command 'frobnicate'")
        .inOrder();
    assertThat(handler.hasErrors()).isTrue();
    assertThat(info.importance()).isEqualTo(1);
    assertThat(info.name()).isNull();
    assertThat(info.documentation()).containsExactly(DocLine.create(17, "still documented"));
  }

  @Test
  public void testCommandsNotAllowed() {
    DocInfo info =
        parser.parse(
            ImmutableList.of(DocToken.create("//@ doc:nodoc", 1)), /* allowCommands= */ false);
    assertThat(info.nodoc()).isFalse();
    assertThat(handler.getMessages()).containsExactly("commands not allowed here");
  }

  @Test
  public void testContentWithoutParser() {
    DocCommentParser noContent = new DocCommentParser(FILE, handler, null);
    DocInfo info =
        noContent.parse(
            ImmutableList.of(DocToken.create("//@ doc:content 'x'", 3)), /* allowCommands= */ true);
    assertThat(info.content()).isNull();
    assertThat(handler.getMessages()).containsExactly("content command is not supported here");
  }

  @Test
  public void testSection() {
    Section section =
        parser.parseSection(
            ImmutableList.of(DocToken.create("/// Expressions", 4), DocToken.create("///", 5)));
    assertThat(section.getDocs())
        .containsExactly(DocLine.create(4, "Expressions"), DocLine.create(5, ""))
        .inOrder();
    assertThat(section.getPosition().line()).isEqualTo(4);
    assertThat(parser.parseSection(ImmutableList.of())).isNull();
  }
}
