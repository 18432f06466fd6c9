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

package net.syntaxdoc.diagram;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;
import net.syntaxdoc.model.LineBreak;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link DiagramLoader} and {@link DiagramJson}. */
@RunWith(JUnit4.class)
public class DiagramLoaderTest {

  @Test
  public void testShorthands() throws Exception {
    assertThat(DiagramLoader.load("")).isEqualTo(Element.skip());
    assertThat(DiagramLoader.load("select")).isEqualTo(Element.terminal("select"));
    assertThat(DiagramLoader.load("[a, b]"))
        .isEqualTo(Element.sequence(Element.terminal("a"), Element.terminal("b")));
  }

  @Test
  public void testElements() throws Exception {
    Element diagram =
        DiagramLoader.load(
            String.join(
                "\n",
                "- terminal: select",
                "  css_class: keyword",
                "- one_or_more: {non_terminal: column, href: sql.column}",
                "  repeat: ','",
                "- optional: [where, {non_terminal: condition, text_is_weak: true}]",
                "  skip: true",
                "- choice: [asc, desc]",
                "  default: 1",
                "- zero_or_more: {comment: hint}",
                "- group: {barrier: {stack: [x, y]}}",
                "  text: tail"));
    assertThat(diagram)
        .isEqualTo(
            Element.sequence(
                Element.terminal("select", null, "keyword", false),
                Element.oneOrMore(
                    Element.nonTerminal("column", "sql.column", null, false),
                    Element.terminal(",")),
                Element.optional(
                    Element.sequence(
                        Element.terminal("where"),
                        Element.nonTerminal("condition", null, null, true)),
                    true),
                Element.choice(1, Element.terminal("asc"), Element.terminal("desc")),
                Element.zeroOrMore(Element.comment("hint")),
                Element.group(
                    Element.barrier(
                        Element.stack(
                            ImmutableList.of(Element.terminal("x"), Element.terminal("y")))),
                    "tail")));
  }

  @Test
  public void testSequenceWithLineBreaks() throws Exception {
    Element diagram = DiagramLoader.load("{sequence: [a, b, c], linebreaks: [hard, no_break]}");
    assertThat(((Element.Sequence) diagram).getLinebreaks())
        .containsExactly(LineBreak.HARD, LineBreak.NO_BREAK)
        .inOrder();
  }

  @Test
  public void testErrors() {
    DiagramLoadException e =
        assertThrows(
            DiagramLoadException.class, () -> DiagramLoader.load("{terminal: a, bogus: 1}"));
    assertThat(e).hasMessageThat().isEqualTo("unexpected attribute 'bogus' for terminal");

    e =
        assertThrows(
            DiagramLoadException.class, () -> DiagramLoader.load("{optional: a, choice: []}"));
    assertThat(e).hasMessageThat().contains("needs exactly one of the keys");

    e =
        assertThrows(
            DiagramLoadException.class, () -> DiagramLoader.load("{choice: [a], default: 3}"));
    assertThat(e).hasMessageThat().isEqualTo("choice default 3 is out of range for 1 items");

    e =
        assertThrows(
            DiagramLoadException.class,
            () -> DiagramLoader.load("{sequence: [a, b], linebreaks: [hard, soft]}"));
    assertThat(e).hasMessageThat().contains("2 items need 1 line breaks");

    e = assertThrows(DiagramLoadException.class, () -> DiagramLoader.load("[a, b"));
    assertThat(e).hasMessageThat().startsWith("can't parse syntax diagram description");
    assertThat(e.getLine()).isGreaterThan(0);
  }

  @Test
  public void testJsonIsReadBack() throws Exception {
    Element diagram =
        Element.sequence(
            Element.terminal("'+'", "Calc.PLUS", "literal", false),
            Element.zeroOrMore(
                Element.nonTerminal("expr", "Calc.expr", null, true), Element.terminal(","), true),
            Element.choice(0, Element.skip(), Element.comment("note")),
            Element.oneOrMore(Element.terminal("x")));
    String json = DiagramJson.toJson(diagram);
    assertThat(DiagramLoader.load(json)).isEqualTo(diagram);
  }

  @Test
  public void testJsonShape() {
    JsonObject json =
        DiagramJson.toJsonTree(Element.terminal("NUM", "Calc.NUM", null, true)).getAsJsonObject();
    assertThat(json.get("terminal").getAsString()).isEqualTo("NUM");
    assertThat(json.get("href").getAsString()).isEqualTo("Calc.NUM");
    assertThat(json.has("css_class")).isFalse();
    assertThat(json.get("text_is_weak").getAsBoolean()).isTrue();
    assertThat(DiagramJson.toJsonTree(Element.skip()).isJsonNull()).isTrue();
  }
}
