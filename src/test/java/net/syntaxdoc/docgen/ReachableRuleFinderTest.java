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

package net.syntaxdoc.docgen;

import static com.google.common.truth.Truth.assertThat;

import java.nio.file.Path;
import net.syntaxdoc.model.Alternative;
import net.syntaxdoc.model.CharSet;
import net.syntaxdoc.model.GrammarModel;
import net.syntaxdoc.model.LexerRule;
import net.syntaxdoc.model.Literal;
import net.syntaxdoc.model.Negation;
import net.syntaxdoc.model.ParserRule;
import net.syntaxdoc.model.Position;
import net.syntaxdoc.model.Reference;
import net.syntaxdoc.model.RuleBase;
import net.syntaxdoc.model.RuleContent;
import net.syntaxdoc.model.Sequence;
import net.syntaxdoc.model.ZeroPlus;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link ReachableRuleFinder}. */
@RunWith(JUnit4.class)
public class ReachableRuleFinderTest {

  private final GrammarModel lexer =
      GrammarModel.create(null, Path.of("/grammars/CalcLexer.g4"), "CalcLexer");
  private final GrammarModel parser =
      GrammarModel.create(null, Path.of("/grammars/CalcParser.g4"), "CalcParser");

  private static LexerRule token(GrammarModel model, String name, RuleContent content) {
    LexerRule rule =
        LexerRule.builder(model, name, Position.create(model.getPath(), 1))
            .setContent(content)
            .setLiteral(content instanceof Literal)
            .build();
    model.addLexerRule(rule);
    return rule;
  }

  private static ParserRule rule(GrammarModel model, String name, RuleContent content) {
    ParserRule rule =
        ParserRule.builder(model, name, Position.create(model.getPath(), 1))
            .setContent(content)
            .build();
    model.addParserRule(rule);
    return rule;
  }

  private Reference ref(String name) {
    return Reference.of(parser, name);
  }

  @Test
  public void testFollowsReferencesThroughCyclesAndImports() {
    parser.addImport(lexer);
    LexerRule num = token(lexer, "NUM", CharSet.of("[0-9]"));
    token(lexer, "WS", CharSet.of("[ \\t]"));
    ParserRule expr = rule(parser, "expr", Sequence.of(ref("term"), ZeroPlus.of(ref("tail"))));
    ParserRule term = rule(parser, "term", Alternative.of(ref("expr"), ref("missing")));
    ParserRule tail = rule(parser, "tail", Negation.of(ref("NUM")));
    rule(parser, "unused", ref("WS"));

    assertThat(ReachableRuleFinder.findReachableRules(expr))
        .containsExactly(expr, term, tail, num)
        .inOrder();
  }

  @Test
  public void testRuleWithoutContent() {
    LexerRule declared =
        LexerRule.builder(lexer, "EOF_MARKER", Position.create(lexer.getPath(), 1)).build();
    lexer.addLexerRule(declared);
    assertThat(ReachableRuleFinder.findReachableRules(declared)).containsExactly(declared);
  }

  @Test
  public void testLeavesAreNotRules() {
    ParserRule root =
        rule(parser, "root", Sequence.of(Literal.of("'('"), CharSet.of("[a]"), ref("root")));
    assertThat(ReachableRuleFinder.findReachableRules(root)).containsExactly(root);
  }

  @Test
  public void testResultIsKeyedByIdentity() {
    GrammarModel other = GrammarModel.create(null, Path.of("/grammars/Other.g4"), "Other");
    RuleBase first = rule(parser, "a", ref("b"));
    RuleBase second = rule(other, "a", Literal.of("'a'"));
    rule(parser, "b", Literal.of("'b'"));
    assertThat(ReachableRuleFinder.findReachableRules(first)).doesNotContain(second);
  }
}
