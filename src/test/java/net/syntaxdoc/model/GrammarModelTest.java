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

package net.syntaxdoc.model;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link GrammarModel} and the import traversal of {@link Model}. */
@RunWith(JUnit4.class)
public class GrammarModelTest {

  private static GrammarModel model(String name) {
    return GrammarModel.create(null, Path.of("/grammars/" + name + ".g4"), name);
  }

  private static LexerRule token(GrammarModel model, String name, RuleContent content) {
    LexerRule rule =
        LexerRule.builder(model, name, Position.create(model.getPath(), 1))
            .setContent(content)
            .setLiteral(content instanceof Literal)
            .build();
    model.addLexerRule(rule);
    return rule;
  }

  private static ParserRule rule(GrammarModel model, String name) {
    ParserRule rule =
        ParserRule.builder(model, name, Position.create(model.getPath(), 1))
            .setContent(Reference.of(model, "ID"))
            .build();
    model.addParserRule(rule);
    return rule;
  }

  @Test
  public void testLookupLocalPrefersParserRules() {
    GrammarModel model = model("A");
    LexerRule lexerRule = token(model, "x", Literal.of("'x'"));
    ParserRule parserRule = rule(model, "x");
    assertThat(model.lookupLocal("x")).isSameInstanceAs(parserRule);
    assertThat(model.getTerminals()).containsExactly(lexerRule);
    assertThat(model.lookupLocal("y")).isNull();
  }

  @Test
  public void testLiteralRulesAreIndexedByTheirText() {
    GrammarModel model = model("A");
    LexerRule plus = token(model, "PLUS", Literal.of("'+'"));
    LexerRule id = token(model, "ID", CharSet.of("[a-z]"));
    assertThat(model.lookupLocal("'+'")).isSameInstanceAs(plus);
    assertThat(model.lookupLocal("PLUS")).isSameInstanceAs(plus);
    assertThat(model.getTerminals()).containsExactly(plus, id).inOrder();
    assertThat(model.getAllRules()).containsExactly(plus, id).inOrder();
  }

  @Test
  public void testFirstLiteralRuleKeepsItsText() {
    GrammarModel model = model("A");
    LexerRule plus = token(model, "PLUS", Literal.of("'+'"));
    token(model, "ADD", Literal.of("'+'"));
    assertThat(model.lookupLocal("'+'")).isSameInstanceAs(plus);
  }

  @Test
  public void testImportTreeVisitsEachModelOnceBreadthFirst() {
    GrammarModel a = model("A");
    GrammarModel b = model("B");
    GrammarModel c = model("C");
    GrammarModel d = model("D");
    a.addImport(b);
    a.addImport(c);
    b.addImport(d);
    b.addImport(a);
    c.addImport(d);
    d.addImport(c);
    assertThat(a.iterImportTree()).containsExactly(a, b, c, d).inOrder();
    assertThat(d.iterImportTree()).containsExactly(d, c).inOrder();
  }

  @Test
  public void testLookupSearchesImportsInOrder() {
    GrammarModel a = model("A");
    GrammarModel b = model("B");
    GrammarModel c = model("C");
    a.addImport(b);
    a.addImport(c);
    c.addImport(a);
    LexerRule fromB = token(b, "ID", CharSet.of("[a-z]"));
    token(c, "ID", CharSet.of("[A-Z]"));
    LexerRule fromC = token(c, "INT", CharSet.of("[0-9]"));
    assertThat(a.lookup("ID")).isSameInstanceAs(fromB);
    assertThat(a.lookup("INT")).isSameInstanceAs(fromC);
    assertThat(a.lookup("missing")).isNull();
  }

  @Test
  public void testFrozenModelRejectsChanges() {
    GrammarModel model = model("A");
    model.freeze();
    assertThat(model.isFrozen()).isTrue();
    assertThrows(IllegalStateException.class, () -> rule(model, "x"));
    assertThrows(IllegalStateException.class, () -> model.setName("B"));
  }

  @Test
  public void testRulesMustBelongToTheModel() {
    GrammarModel a = model("A");
    GrammarModel b = model("B");
    ParserRule rule =
        ParserRule.builder(b, "x", Position.create(b.getPath(), 1))
            .setContent(Sequence.EMPTY)
            .build();
    assertThrows(IllegalArgumentException.class, () -> a.addParserRule(rule));
  }

  @Test
  public void testRuleProperties() {
    GrammarModel model = model("A");
    ParserRule rule =
        ParserRule.builder(model, "expr", Position.create(model.getPath(), 7))
            .setContent(Reference.of(model, "ID"))
            .setDisplayName("expression")
            .setImportance(3)
            .setCssClass("expr")
            .setDocumentation(ImmutableList.of(DocLine.create(6, "An expression.")))
            .build();
    assertThat(rule.getFullName()).isEqualTo("A.expr");
    assertThat(rule.getDisplayName()).isEqualTo("expression");
    assertThat(rule.getImportance()).isEqualTo(3);
    assertThat(rule.getCssClass()).isEqualTo("expr");
    assertThat(rule.getDocumentation()).containsExactly(DocLine.create(6, "An expression."));
    assertThat(rule.getPosition().line()).isEqualTo(7);
    assertThat(rule.toString()).isEqualTo("expr\n  : ID\n  ;");
  }

  @Test
  public void testNegativeImportanceIsRejected() {
    GrammarModel model = model("A");
    assertThrows(
        IllegalArgumentException.class,
        () ->
            ParserRule.builder(model, "x", Position.create(model.getPath(), 1))
                .setImportance(-1));
  }

  @Test
  public void testPositionsOrderByFileThenLine() {
    Position a1 = Position.create(Path.of("/a.g4"), 10);
    Position a2 = Position.create(Path.of("/a.g4"), 2);
    Position b1 = Position.create(Path.of("/b.g4"), 1);
    assertThat(a2).isLessThan(a1);
    assertThat(a1).isLessThan(b1);
    assertThat(a1.toString()).isEqualTo("/a.g4:10");
  }
}
