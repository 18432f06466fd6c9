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

import com.google.common.collect.ImmutableList;
import net.syntaxdoc.docgen.SyntaxIndex.IndexEntry;
import net.syntaxdoc.docgen.SyntaxIndex.Link;
import net.syntaxdoc.events.CollectingDiagnosticHandler;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link SyntaxIndex}. */
@RunWith(JUnit4.class)
public class SyntaxIndexTest {

  private final CollectingDiagnosticHandler handler = new CollectingDiagnosticHandler();
  private final SyntaxIndex index = new SyntaxIndex(handler);

  @Before
  public void populate() {
    index.addGrammar("CalcLexer", ImmutableList.of());
    index.addRule("CalcLexer", "NUM", "number");
    index.addRule("CalcLexer", "PLUS", null);
    index.addGrammar("CalcParser", ImmutableList.of("CalcLexer", "Missing"));
    index.addRule("CalcParser", "expr", null);
    index.addGrammar("Other", ImmutableList.of("Other"));
    index.addRule("Other", "expr", null);
    index.addRule(SyntaxIndex.DEFAULT_GRAMMAR, "ws", null);
  }

  private static ImmutableList<String> fullNames(ImmutableList<IndexEntry> entries) {
    return entries.stream().map(IndexEntry::fullName).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void testEntries() {
    IndexEntry grammar = index.resolveGrammar("CalcParser");
    assertThat(grammar.kind()).isEqualTo(IndexEntry.Kind.GRAMMAR);
    assertThat(grammar.imports()).containsExactly("CalcLexer", "Missing").inOrder();
    assertThat(grammar.anchor()).isEqualTo("#CalcParser");
    assertThat(index.resolveGrammar("Nope")).isNull();

    IndexEntry num = index.resolveRule("CalcLexer.NUM", null).get(0);
    assertThat(num.kind()).isEqualTo(IndexEntry.Kind.RULE);
    assertThat(num.name()).isEqualTo("NUM");
    assertThat(num.displayName()).isEqualTo("number");
    assertThat(num.anchor()).isEqualTo("#CalcLexer.NUM");
  }

  @Test
  public void testDottedNamesSearchImports() {
    assertThat(fullNames(index.resolveRule("CalcParser.NUM", null)))
        .containsExactly("CalcLexer.NUM");
    assertThat(fullNames(index.resolveRule("CalcLexer.expr", null))).isEmpty();
    assertThat(fullNames(index.resolveRule("CalcParser.ws", null))).isEmpty();
  }

  @Test
  public void testBareNamesSearchContextGrammar() {
    assertThat(fullNames(index.resolveRule("PLUS", "CalcParser")))
        .containsExactly("CalcLexer.PLUS");
    assertThat(fullNames(index.resolveRule("expr", "CalcParser")))
        .containsExactly("CalcParser.expr");
    assertThat(fullNames(index.resolveRule("ws", "CalcParser"))).containsExactly("ws");
    assertThat(fullNames(index.resolveRule("ws", SyntaxIndex.DEFAULT_GRAMMAR)))
        .containsExactly("ws");
    assertThat(fullNames(index.resolveRule("NUM", SyntaxIndex.DEFAULT_GRAMMAR))).isEmpty();
  }

  @Test
  public void testBareNamesWithoutContextSearchEverything() {
    assertThat(fullNames(index.resolveRule("expr", null)))
        .containsExactly("CalcParser.expr", "Other.expr")
        .inOrder();
  }

  @Test
  public void testResolveAnyPrefersGrammars() {
    index.addRule(SyntaxIndex.DEFAULT_GRAMMAR, "Other", null);
    assertThat(fullNames(index.resolveAny("Other", null)))
        .containsExactly("Other", "Other")
        .inOrder();
    assertThat(index.resolveAny("Other", null).get(0).kind())
        .isEqualTo(IndexEntry.Kind.GRAMMAR);
  }

  @Test
  public void testDuplicatesAreReported() {
    index.addRule("CalcParser", "expr", "expression");
    assertThat(handler.getMessages())
        .containsExactly("duplicate object description of rule CalcParser.expr");
    assertThat(handler.hasErrors()).isFalse();
    assertThat(index.resolveRule("CalcParser.expr", null).get(0).displayName())
        .isEqualTo("expression");
  }

  @Test
  public void testResolveHref() {
    assertThat(index.resolveHref("NUM", null, false, "CalcParser"))
        .isEqualTo(Link.create("number", "#CalcLexer.NUM"));
    assertThat(index.resolveHref("a number", "NUM", false, "CalcParser"))
        .isEqualTo(Link.create("a number", "#CalcLexer.NUM"));
    assertThat(index.resolveHref("NUM", "NUM", true, "CalcParser"))
        .isEqualTo(Link.create("number", "#CalcLexer.NUM"));
    assertThat(index.resolveHref("CalcParser", null, false, null))
        .isEqualTo(Link.create("CalcParser", "#CalcParser"));
  }

  @Test
  public void testExternalAndUnresolvedHrefs() {
    assertThat(index.resolveHref("docs", "https://example.com/", false, null))
        .isEqualTo(Link.create("docs", "https://example.com/"));
    assertThat(index.resolveHref("up", "..", false, null)).isEqualTo(Link.create("up", ".."));
    assertThat(index.resolveHref("top", "#top", false, null))
        .isEqualTo(Link.create("top", "#top"));
    assertThat(index.resolveHref("nothing", null, false, "CalcParser"))
        .isEqualTo(Link.create("nothing", null));
  }
}
