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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import net.syntaxdoc.diagram.DiagramJson;
import net.syntaxdoc.diagram.Element;
import net.syntaxdoc.diagram.EndClass;
import net.syntaxdoc.docgen.GrammarDocumentation.RuleEntry;
import net.syntaxdoc.docgen.GrammarDocumentation.SectionHeader;
import net.syntaxdoc.events.CollectingDiagnosticHandler;
import net.syntaxdoc.model.DocLine;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link GrammarDocumenter} and {@link GrammarDocumentation}. */
@RunWith(JUnit4.class)
public class GrammarDocumenterTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private final CollectingDiagnosticHandler handler = new CollectingDiagnosticHandler();
  private final GrammarDocumenter documenter =
      new GrammarDocumenter(BuiltinProviders.createRegistry(handler), handler);
  private Path grammar;

  @Before
  public void writeGrammar() throws IOException {
    grammar = tmp.getRoot().toPath().resolve("Expr.g4");
    Files.write(
        grammar,
        String.join(
                "\n",
                "/** Expression language. */",
                "grammar Expr;",
                "",
                "/// Syntax",
                "",
                "/** A program. */",
                "program : stmt+ ;",
                "",
                "/** A statement. */",
                "stmt : ID '=' NUM ';' ;",
                "",
                "/// Tokens",
                "",
                "/** An identifier. */",
                "ID : [a-z]+ ;",
                "/** A number. */",
                "NUM : [0-9]+ ;",
                "//@ doc:nodoc",
                "WS : [ ]+ -> skip ;")
            .getBytes(UTF_8));
  }

  private static ImmutableList<String> describe(GrammarDocumentation documentation) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (GrammarDocumentation.Entry entry : documentation.entries()) {
      if (entry instanceof SectionHeader header) {
        result.add("/// " + header.section().getDocs().get(0).text());
      } else {
        result.add(((RuleEntry) entry).fullName());
      }
    }
    return result.build();
  }

  @Test
  public void testDocumentsGrammarWithSections() {
    GrammarDocumentation documentation =
        documenter.document(grammar, DocumentationOptions.DEFAULT);
    assertThat(handler.getDiagnostics()).isEmpty();
    assertThat(documentation.grammarName()).isEqualTo("Expr");
    assertThat(documentation.path()).isEqualTo(grammar);
    assertThat(documentation.grammarDocs())
        .containsExactly(DocLine.create(1, "Expression language."));
    assertThat(documentation.imports()).isEmpty();
    assertThat(describe(documentation))
        .containsExactly(
            "/// Syntax", "Expr.program", "Expr.stmt", "/// Tokens", "Expr.ID", "Expr.NUM")
        .inOrder();
    assertThat(documentation.xrefTargets())
        .containsExactly("Expr", "Expr.program", "Expr.stmt", "Expr.ID", "Expr.NUM")
        .inOrder();
  }

  @Test
  public void testRuleEntries() {
    GrammarDocumentation documentation =
        documenter.document(grammar, DocumentationOptions.DEFAULT);
    RuleEntry program = documentation.rules().get(0);
    assertThat(program.documentation()).containsExactly(DocLine.create(6, "A program."));
    assertThat(program.displayName()).isNull();
    assertThat(program.endClass()).isEqualTo(EndClass.SIMPLE);
    assertThat(program.diagram())
        .isEqualTo(Element.oneOrMore(Element.nonTerminal("stmt", "Expr.stmt", null, true)));
  }

  @Test
  public void testSectionsAreDroppedWhenOrderingByName() {
    DocumentationOptions options =
        DocumentationOptions.builder()
            .ordering(DocumentationOptions.Ordering.BY_NAME)
            .grouping(DocumentationOptions.Grouping.LEXER_FIRST)
            .build();
    assertThat(describe(documenter.document(grammar, options)))
        .containsExactly("Expr.ID", "Expr.NUM", "Expr.program", "Expr.stmt")
        .inOrder();
  }

  @Test
  public void testRootRuleIsMarked() {
    DocumentationOptions options = DocumentationOptions.builder().rootRule("stmt").build();
    GrammarDocumentation documentation = documenter.document(grammar, options);
    assertThat(describe(documentation))
        .containsExactly("Expr.stmt", "/// Tokens", "Expr.ID", "Expr.NUM")
        .inOrder();
    assertThat(documentation.rules().get(0).endClass()).isEqualTo(EndClass.COMPLEX);
    assertThat(documentation.rules().get(1).endClass()).isEqualTo(EndClass.SIMPLE);

    options = options.toBuilder().markRootRule(false).build();
    assertThat(documenter.document(grammar, options).rules().get(0).endClass())
        .isEqualTo(EndClass.SIMPLE);
  }

  @Test
  public void testDiagramsCanBeDisabled() {
    DocumentationOptions options = DocumentationOptions.builder().diagrams(false).build();
    for (RuleEntry rule : documenter.document(grammar, options).rules()) {
      assertThat(rule.diagram()).isNull();
    }
  }

  @Test
  public void testJson() {
    JsonObject json = documenter.document(grammar, DocumentationOptions.DEFAULT).toJsonTree();
    assertThat(json.get("name").getAsString()).isEqualTo("Expr");
    assertThat(json.getAsJsonArray("docs").get(0).getAsJsonObject().get("text").getAsString())
        .isEqualTo("Expression language.");

    JsonObject section = json.getAsJsonArray("entries").get(0).getAsJsonObject();
    assertThat(section.getAsJsonArray("section").get(0).getAsJsonObject().get("line").getAsInt())
        .isEqualTo(4);

    JsonObject program = json.getAsJsonArray("entries").get(1).getAsJsonObject();
    assertThat(program.get("rule").getAsString()).isEqualTo("program");
    assertThat(program.get("full_name").getAsString()).isEqualTo("Expr.program");
    assertThat(program.get("kind").getAsString()).isEqualTo("parser");
    assertThat(program.get("end_class").getAsString()).isEqualTo("simple");
    assertThat(program.has("display_name")).isFalse();
    assertThat(program.getAsJsonObject("diagram").has("one_or_more")).isTrue();

    JsonObject id = json.getAsJsonArray("entries").get(4).getAsJsonObject();
    assertThat(id.get("kind").getAsString()).isEqualTo("lexer");
    assertThat(json.getAsJsonArray("xref_targets")).hasSize(5);
  }

  @Test
  public void testRecursiveExpressionGrammar() throws IOException {
    Path path = tmp.getRoot().toPath().resolve("E.g4");
    Files.write(
        path,
        String.join(
                "\n",
                "grammar E;",
                "/** A statement. */",
                "stmt : expr ';' ;",
                "/** An expression. */",
                "expr : NUM | expr '+' expr ;",
                "NUM : [0-9]+ ;")
            .getBytes(UTF_8));
    GrammarDocumentation documentation = documenter.document(path, DocumentationOptions.DEFAULT);
    assertThat(handler.getDiagnostics()).isEmpty();
    assertThat(describe(documentation)).containsExactly("E.stmt", "E.expr").inOrder();

    Element stmt = documentation.rules().get(0).diagram();
    assertThat(DiagramJson.toJson(stmt)).contains("\"E.expr\"");
    Element expr = documentation.rules().get(1).diagram();
    assertThat(expr.type()).isEqualTo(Element.Type.SEQUENCE);
    assertThat(((Element.Sequence) expr).getItems().get(1).type())
        .isEqualTo(Element.Type.ZERO_OR_MORE);
  }

  @Test
  public void testEmptyAndDuplicateAlternatives() throws IOException {
    Path path = tmp.getRoot().toPath().resolve("L.g4");
    Files.write(
        path,
        String.join(
                "\n",
                "grammar L;",
                "/** A list. */",
                "list : item list | ;",
                "/** A pair. */",
                "pair : NUM {one();} | NUM {two();} ;",
                "/** An item. */",
                "item : NUM ;",
                "/** A number. */",
                "NUM : [0-9]+ ;")
            .getBytes(UTF_8));
    GrammarDocumentation documentation = documenter.document(path, DocumentationOptions.DEFAULT);
    assertThat(handler.getDiagnostics()).isEmpty();

    Map<String, String> diagrams = new HashMap<>();
    for (RuleEntry rule : documentation.rules()) {
      diagrams.put(rule.fullName(), String.valueOf(rule.diagram()));
    }
    assertThat(diagrams).containsEntry("L.list", "ZeroOrMore(NonTerminal(item))");
    assertThat(diagrams).containsEntry("L.pair", "Terminal(NUM)");
  }

  @Test
  public void testUnknownFileFormat() throws IOException {
    Path text = tmp.newFile("notes.txt").toPath();
    assertThat(documenter.document(text, DocumentationOptions.DEFAULT)).isNull();
    assertThat(handler.getMessages()).hasSize(1);
    assertThat(handler.getMessages().get(0)).startsWith("can't determine file format for ");
  }
}
