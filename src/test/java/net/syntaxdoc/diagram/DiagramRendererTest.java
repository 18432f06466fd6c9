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

import java.nio.file.Path;
import net.syntaxdoc.model.Alternative;
import net.syntaxdoc.model.CharSet;
import net.syntaxdoc.model.Doc;
import net.syntaxdoc.model.GrammarModel;
import net.syntaxdoc.model.LexerRule;
import net.syntaxdoc.model.Literal;
import net.syntaxdoc.model.ParserRule;
import net.syntaxdoc.model.Position;
import net.syntaxdoc.model.Reference;
import net.syntaxdoc.model.RuleContent;
import net.syntaxdoc.model.Sequence;
import net.syntaxdoc.model.ZeroPlus;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link DiagramRenderer}. */
@RunWith(JUnit4.class)
public class DiagramRendererTest {

  private GrammarModel model;
  private final DiagramRenderer renderer =
      new DiagramRenderer(LiteralRendering.CONTENTS, /* ccToDash= */ false);

  @Before
  public void createModel() {
    model = GrammarModel.create(null, Path.of("/grammars/Calc.g4"), "Calc");
    addToken("NUM", CharSet.of("[0-9]"));
    addToken("A", CharSet.of("[a]"));
    addToken("B", CharSet.of("[b]"));
    addToken("PLUS", Literal.of("'+'"));
    addToken("COMMA", Literal.of("','"));
    for (String name : new String[] {"x", "y", "z", "item"}) {
      addRule(ParserRule.builder(model, name, position()).setContent(ref("NUM")));
    }
  }

  private Position position() {
    return Position.create(model.getPath(), 1);
  }

  private Reference ref(String name) {
    return Reference.of(model, name);
  }

  private LexerRule addToken(String name, RuleContent content) {
    LexerRule rule =
        LexerRule.builder(model, name, position())
            .setContent(content)
            .setLiteral(content instanceof Literal)
            .build();
    model.addLexerRule(rule);
    return rule;
  }

  private ParserRule addRule(ParserRule.Builder builder) {
    ParserRule rule = builder.build();
    model.addParserRule(rule);
    return rule;
  }

  private ParserRule addRule(String name, RuleContent content) {
    return addRule(ParserRule.builder(model, name, position()).setContent(content));
  }

  @Test
  public void testLeftRecursionBecomesLoop() {
    ParserRule expr =
        addRule(
            "expr",
            Alternative.of(ref("NUM"), Sequence.of(ref("expr"), ref("'+'"), ref("expr"))));
    assertThat(renderer.render(expr).toString())
        .isEqualTo(
            "Sequence(Terminal(NUM), ZeroOrMore(Sequence(Terminal('+'), NonTerminal(expr))))");
  }

  @Test
  public void testLeftRecursionWithSharedOperandBecomesOneOrMore() {
    ParserRule sum =
        addRule(
            "sum", Alternative.of(Sequence.of(ref("sum"), ref("'+'"), ref("item")), ref("item")));
    assertThat(renderer.render(sum).toString())
        .isEqualTo("OneOrMore(NonTerminal(item), repeat=Terminal('+'))");
  }

  @Test
  public void testRightRecursionBecomesOneOrMore() {
    ParserRule list =
        addRule(
            "list", Alternative.of(Sequence.of(ref("item"), ref("','"), ref("list")), ref("item")));
    assertThat(renderer.render(list).toString())
        .isEqualTo("OneOrMore(NonTerminal(item), repeat=Terminal(','))");
  }

  @Test
  public void testKeepDiagramRecursive() {
    ParserRule list =
        addRule(
            ParserRule.builder(model, "list", position())
                .setKeepDiagramRecursive(true)
                .setContent(
                    Alternative.of(
                        Sequence.of(ref("item"), ref("','"), ref("list")), ref("item"))));
    assertThat(renderer.render(list).toString())
        .isEqualTo(
            "Choice(default=0: Sequence(NonTerminal(item), Terminal(','), NonTerminal(list))"
                + " | NonTerminal(item))");
  }

  @Test
  public void testCommonPrefixIsFactoredOut() {
    ParserRule rule =
        addRule(
            "r", Alternative.of(Sequence.of(ref("A"), ref("x")), Sequence.of(ref("A"), ref("y"))));
    assertThat(renderer.render(rule).toString())
        .isEqualTo("Sequence(Terminal(A), Choice(default=0: NonTerminal(x) | NonTerminal(y)))");
  }

  @Test
  public void testCommonSuffixIsFactoredOut() {
    ParserRule rule =
        addRule(
            "r", Alternative.of(Sequence.of(ref("x"), ref("B")), Sequence.of(ref("y"), ref("B"))));
    assertThat(renderer.render(rule).toString())
        .isEqualTo("Sequence(Choice(default=0: NonTerminal(x) | NonTerminal(y)), Terminal(B))");
  }

  @Test
  public void testFactoringProducesOptionalBranch() {
    ParserRule rule = addRule("r", Alternative.of(ref("A"), Sequence.of(ref("A"), ref("B"))));
    assertThat(renderer.render(rule).toString())
        .isEqualTo("Sequence(Terminal(A), Choice(default=1: Skip | Terminal(B)))");
  }

  @Test
  public void testRightRecursionWithEmptyBranch() {
    ParserRule list =
        addRule("list", Alternative.of(Sequence.of(ref("item"), ref("list")), Sequence.EMPTY));
    assertThat(renderer.render(list).toString()).isEqualTo("ZeroOrMore(NonTerminal(item))");
  }

  @Test
  public void testLeftRecursionWithEmptyBranch() {
    ParserRule list =
        addRule("list", Alternative.of(Sequence.of(ref("list"), ref("item")), Sequence.EMPTY));
    assertThat(renderer.render(list).toString()).isEqualTo("ZeroOrMore(NonTerminal(item))");
  }

  @Test
  public void testRecursionOverTokenWithEmptyBranch() {
    ParserRule rule =
        addRule("a", Alternative.of(Sequence.EMPTY, Sequence.of(ref("A"), ref("a"))));
    assertThat(renderer.render(rule).toString()).isEqualTo("ZeroOrMore(Terminal(A))");
  }

  @Test
  public void testEmptyBranchesAreNotFactored() {
    ParserRule rule = addRule("r", Alternative.of(ref("A"), Sequence.EMPTY, Sequence.EMPTY));
    assertThat(renderer.render(rule).toString()).isEqualTo("Choice(default=0: Terminal(A) | Skip)");
  }

  @Test
  public void testIdenticalBranchesAreDrawnOnce() {
    ParserRule single = addRule("single", Alternative.of(ref("A"), ref("A")));
    assertThat(renderer.render(single).toString()).isEqualTo("Terminal(A)");

    ParserRule pair =
        addRule(
            "pair",
            Alternative.of(Sequence.of(ref("x"), ref("A")), Sequence.of(ref("x"), ref("A"))));
    assertThat(renderer.render(pair).toString())
        .isEqualTo("Sequence(NonTerminal(x), Terminal(A))");
  }

  @Test
  public void testIdenticalBranchesNextToOptionalTail() {
    ParserRule rule =
        addRule(
            "r",
            Alternative.of(
                Sequence.of(ref("x"), ref("A")), ref("x"), Sequence.of(ref("x"), ref("A"))));
    assertThat(renderer.render(rule).toString())
        .isEqualTo("Sequence(NonTerminal(x), Choice(default=0: Terminal(A) | Skip))");
  }

  @Test
  public void testImportanceIsRecomputedOnEveryRender() {
    ParserRule rule = addRule("r", Alternative.of(ref("late"), ref("A")));
    assertThat(renderer.render(rule).toString())
        .isEqualTo("Choice(default=0: NonTerminal(late) | Terminal(A))");

    addRule(ParserRule.builder(model, "late", position()).setContent(ref("NUM")).setImportance(0));
    assertThat(renderer.render(rule).toString())
        .isEqualTo("Choice(default=1: NonTerminal(late) | Terminal(A))");
  }

  @Test
  public void testUnrolledLoopBeforeStar() {
    ParserRule rule =
        addRule(
            "r",
            Sequence.of(
                ref("x"),
                ref("y"),
                ref("z"),
                ZeroPlus.of(Sequence.of(ref("A"), ref("B"), ref("x"), ref("y"), ref("z")))));
    assertThat(renderer.render(rule).toString())
        .isEqualTo(
            "OneOrMore(Sequence(NonTerminal(x), NonTerminal(y), NonTerminal(z)),"
                + " repeat=Sequence(Terminal(A), Terminal(B)))");
  }

  @Test
  public void testUnrolledLoopAfterStar() {
    ParserRule rule =
        addRule(
            "r",
            Sequence.of(
                ZeroPlus.of(Sequence.of(ref("x"), ref("y"), ref("z"), ref("A"), ref("B"))),
                ref("x"),
                ref("y"),
                ref("z")));
    assertThat(renderer.render(rule).toString())
        .isEqualTo(
            "OneOrMore(Sequence(NonTerminal(x), NonTerminal(y), NonTerminal(z)),"
                + " repeat=Sequence(Terminal(A), Terminal(B)))");
  }

  @Test
  public void testSingleElementBeforeItsLoop() {
    ParserRule rule = addRule("r", Sequence.of(ref("A"), ref("x"), ZeroPlus.of(ref("x"))));
    assertThat(renderer.render(rule).toString())
        .isEqualTo("Sequence(Terminal(A), OneOrMore(NonTerminal(x)))");
  }

  @Test
  public void testLeavesAndLiterals() {
    ParserRule rule =
        addRule(
            "r",
            Sequence.of(
                Literal.of("'if'"),
                ref("PLUS"),
                ref("'+'"),
                ref("'undeclared'"),
                ref("UNDECLARED"),
                ref("undeclared")));
    Element.Sequence diagram = (Element.Sequence) renderer.render(rule);
    assertThat(diagram.getItems())
        .containsExactly(
            Element.terminal("'if'", null, "literal", false),
            Element.terminal("'+'", "Calc.PLUS", null, false),
            Element.terminal("'+'", "Calc.PLUS", null, false),
            Element.terminal("'undeclared'", null, null, true),
            Element.terminal("UNDECLARED", null, null, true),
            Element.nonTerminal("undeclared", null, null, true))
        .inOrder();
  }

  @Test
  public void testLexerAndParserRuleReferences() {
    ParserRule rule = addRule("r", Sequence.of(ref("NUM"), ref("x")));
    Element.Sequence diagram = (Element.Sequence) renderer.render(rule);
    assertThat(diagram.getItems())
        .containsExactly(
            Element.terminal("NUM", "Calc.NUM", null, true),
            Element.nonTerminal("x", "Calc.x", null, true))
        .inOrder();
  }

  @Test
  public void testLiteralRenderings() {
    ParserRule rule = addRule("r", ref("'+'"));
    assertThat(new DiagramRenderer(LiteralRendering.NAME, false).render(rule))
        .isEqualTo(Element.terminal("PLUS", "Calc.PLUS", null, true));
    assertThat(new DiagramRenderer(LiteralRendering.CONTENTS_UNQUOTED, false).render(rule))
        .isEqualTo(Element.terminal("+", "Calc.PLUS", null, false));
  }

  @Test
  public void testCamelCaseToDash() {
    addRule(
        ParserRule.builder(model, "fieldName", position())
            .setContent(ref("NUM"))
            .setCssClass("field"));
    addRule(
        ParserRule.builder(model, "typeName", position())
            .setContent(ref("NUM"))
            .setDisplayName("Type"));
    ParserRule rule = addRule("r", Sequence.of(ref("fieldName"), ref("typeName")));
    Element.Sequence diagram =
        (Element.Sequence) new DiagramRenderer(LiteralRendering.CONTENTS, true).render(rule);
    assertThat(diagram.getItems())
        .containsExactly(
            Element.nonTerminal("field-name", "Calc.fieldName", "field", true),
            Element.nonTerminal("Type", "Calc.typeName", null, true))
        .inOrder();
  }

  @Test
  public void testInlineRulesAreExpanded() {
    addRule(
        ParserRule.builder(model, "pair", position())
            .setInline(true)
            .setContent(Sequence.of(ref("A"), ref("B"))));
    ParserRule rule = addRule("r", Sequence.of(ref("pair"), ref("x")));
    assertThat(renderer.render(rule).toString())
        .isEqualTo("Sequence(Sequence(Terminal(A), Terminal(B)), NonTerminal(x))");
  }

  @Test
  public void testRecursiveInlineRuleIsExpandedOnce() {
    addRule(
        ParserRule.builder(model, "parens", position())
            .setInline(true)
            .setContent(
                Alternative.of(
                    Sequence.of(Literal.of("'('"), ref("parens"), Literal.of("')'")), ref("A"))));
    ParserRule rule = addRule("r", ref("parens"));
    assertThat(renderer.render(rule).toString())
        .isEqualTo(
            "Choice(default=0: Sequence(Terminal('('), NonTerminal(parens), Terminal(')'))"
                + " | Terminal(A))");
  }

  @Test
  public void testChoiceDefaultsToMostImportantBranch() {
    addRule(ParserRule.builder(model, "rare", position()).setContent(ref("A")).setImportance(0));
    addRule(ParserRule.builder(model, "common", position()).setContent(ref("B")).setImportance(5));
    ParserRule rule = addRule("r", Alternative.of(ref("rare"), ref("x"), ref("common")));
    assertThat(((Element.Choice) renderer.render(rule)).getDefaultIndex()).isEqualTo(2);
  }

  @Test
  public void testLoopOverUnimportantContentIsSkippedByDefault() {
    addRule(ParserRule.builder(model, "ws", position()).setContent(ref("A")).setImportance(0));
    ParserRule rule =
        addRule(
            "r", Sequence.of(ZeroPlus.of(ref("ws")), ZeroPlus.of(Doc.of("any note")), ref("x")));
    assertThat(renderer.render(rule).toString())
        .isEqualTo(
            "Sequence(ZeroOrMore[skip](NonTerminal(ws)), ZeroOrMore[skip](Comment(any note)),"
                + " NonTerminal(x))");
  }

  @Test
  public void testRuleWithoutBodyIsRejected() {
    LexerRule implicit = LexerRule.builder(model, "IMPLICIT", position()).build();
    assertThrows(IllegalArgumentException.class, () -> renderer.render(implicit));
  }

  @Test
  public void testDecodeQuoted() {
    assertThat(DiagramRenderer.decodeQuoted("a\\nb")).isEqualTo("a\nb");
    assertThat(DiagramRenderer.decodeQuoted("\\u0041\\x42")).isEqualTo("AB");
    assertThat(DiagramRenderer.decodeQuoted("\\'")).isEqualTo("'");
    assertThat(DiagramRenderer.decodeQuoted("a'b")).isNull();
    assertThat(DiagramRenderer.decodeQuoted("trailing\\")).isNull();
  }
}
