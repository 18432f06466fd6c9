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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import net.syntaxdoc.events.CollectingDiagnosticHandler;
import net.syntaxdoc.model.GrammarModel;
import net.syntaxdoc.model.LexerRule;
import net.syntaxdoc.model.LineBreak;
import net.syntaxdoc.model.Literal;
import net.syntaxdoc.model.OnePlus;
import net.syntaxdoc.model.ParserRule;
import net.syntaxdoc.model.RuleContent;
import net.syntaxdoc.model.Sequence;
import net.syntaxdoc.model.ZeroPlus;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link RuleContents}, {@link RuleLoader} and {@link LineIndex}. */
@RunWith(JUnit4.class)
public class RuleContentsTest {

  @Test
  public void testSequenceMarksSourceJunctionsSoft() {
    RuleContent a = Literal.of("'soft-a'");
    RuleContent group = Sequence.of(Literal.of("'soft-b'"), Literal.of("'soft-c'"));
    RuleContent d = Literal.of("'soft-d'");
    Sequence sequence = (Sequence) RuleContents.sequence(ImmutableList.of(a, group, d));
    assertThat(sequence.getChildren()).hasSize(4);
    assertThat(sequence.getLinebreaks())
        .containsExactly(LineBreak.SOFT, LineBreak.DEFAULT, LineBreak.SOFT)
        .inOrder();
  }

  @Test
  public void testSequenceOfOneOrNone() {
    RuleContent a = Literal.of("'a'");
    assertThat(RuleContents.sequence(ImmutableList.of(a))).isSameInstanceAs(a);
    assertThat(RuleContents.sequence(ImmutableList.of())).isSameInstanceAs(Sequence.EMPTY);
    assertThat(RuleContents.sequence(ImmutableList.of(Sequence.EMPTY, a))).isSameInstanceAs(a);
  }

  @Test
  public void testSuffixes() {
    RuleContent a = Literal.of("'a'");
    assertThat(RuleContents.withSuffix(a, "?").toString()).isEqualTo(" | 'a'");
    assertThat(RuleContents.withSuffix(a, "*")).isSameInstanceAs(ZeroPlus.of(a));
    assertThat(RuleContents.withSuffix(a, "+?")).isSameInstanceAs(OnePlus.of(a));
    assertThat(RuleContents.withSuffix(a, "")).isSameInstanceAs(a);
    assertThat(RuleContents.withSuffix(Sequence.EMPTY, "*")).isSameInstanceAs(Sequence.EMPTY);
    assertThrows(IllegalArgumentException.class, () -> RuleContents.withSuffix(a, "!"));
  }

  @Test
  public void testRuleLoaderAppliesDocs() {
    CollectingDiagnosticHandler handler = new CollectingDiagnosticHandler();
    GrammarModel model = GrammarModel.create(null, Path.of("/g/G.g4"), "G");
    RuleLoader loader = new RuleLoader(model, handler);

    DocInfo docs = DocInfo.builder().name("plus sign").content(Literal.of("'+'")).build();
    LexerRule plus = loader.addLexerRule("PLUS", 3, null, docs, null, /* fragment= */ false);
    assertThat(plus.isLiteral()).isTrue();
    assertThat(plus.getDisplayName()).isEqualTo("plus sign");
    assertThat(model.lookupLocal("'+'")).isSameInstanceAs(plus);

    ParserRule expr =
        loader.addParserRule(
            "expr", 5, null, docs, Sequence.of(Literal.of("'x'"), Literal.of("'+'")));
    assertThat(expr.getContent().toString()).isEqualTo("'x' '+'");
    assertThat(expr.getPosition().line()).isEqualTo(5);
    assertThat(handler.getMessages())
        .containsExactly("'content' command can't appear before parser rules");
  }

  @Test
  public void testLineIndex() {
    LineIndex index = LineIndex.create("ab\ncd\n\nef".toCharArray(), 10);
    assertThat(index.lineOf(0)).isEqualTo(10);
    assertThat(index.lineOf(2)).isEqualTo(10);
    assertThat(index.lineOf(3)).isEqualTo(11);
    assertThat(index.lineOf(6)).isEqualTo(12);
    assertThat(index.lineOf(8)).isEqualTo(13);
  }
}
