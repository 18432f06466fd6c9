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
import static org.junit.Assert.assertThrows;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import net.syntaxdoc.diagram.LiteralRendering;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link SyntaxDocMain}. */
@RunWith(JUnit4.class)
public class SyntaxDocMainTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
  private Path lexer;
  private Path parser;

  @Before
  public void writeGrammars() throws IOException {
    lexer = write("CalcLexer.g4", "lexer grammar CalcLexer;", "/** A number. */", "NUM : [0-9]+ ;");
    parser =
        write(
            "CalcParser.g4",
            "parser grammar CalcParser;",
            "options { tokenVocab = CalcLexer; }",
            "/** A sum. */",
            "sum : NUM ('+' NUM)* ;",
            "other : NUM ;");
  }

  private Path write(String name, String... lines) throws IOException {
    Path path = tmp.getRoot().toPath().resolve(name);
    Files.write(path, String.join("\n", lines).getBytes(UTF_8));
    return path;
  }

  private JsonArray output() {
    return JsonParser.parseString(stdout.toString(UTF_8)).getAsJsonArray();
  }

  private int run(String... args) throws IOException {
    return SyntaxDocMain.run(args, new PrintStream(stdout, true, UTF_8));
  }

  @Test
  public void testDocumentsEveryGrammar() throws Exception {
    assertThat(run(lexer.toString(), parser.toString())).isEqualTo(0);
    JsonArray result = output();
    assertThat(result).hasSize(2);
    JsonObject calcParser = result.get(1).getAsJsonObject();
    assertThat(calcParser.get("name").getAsString()).isEqualTo("CalcParser");
    assertThat(calcParser.getAsJsonArray("imports").get(0).getAsString()).isEqualTo("CalcLexer");
    assertThat(calcParser.getAsJsonArray("entries")).hasSize(1);
  }

  @Test
  public void testCommandLineOptions() throws Exception {
    assertThat(run("--undocumented", "--diagrams", "false", parser.toString())).isEqualTo(0);
    JsonArray entries = output().get(0).getAsJsonObject().getAsJsonArray("entries");
    assertThat(entries).hasSize(2);
    assertThat(entries.get(1).getAsJsonObject().get("rule").getAsString()).isEqualTo("other");
    assertThat(entries.get(0).getAsJsonObject().has("diagram")).isFalse();
  }

  @Test
  public void testOutputFile() throws Exception {
    Path out = tmp.getRoot().toPath().resolve("out.json");
    assertThat(run("--output", out.toString(), lexer.toString())).isEqualTo(0);
    assertThat(stdout.size()).isEqualTo(0);
    JsonArray result = JsonParser.parseString(Files.readString(out)).getAsJsonArray();
    assertThat(result.get(0).getAsJsonObject().get("name").getAsString()).isEqualTo("CalcLexer");
  }

  @Test
  public void testErrorsSetExitCode() throws Exception {
    Path broken = write("Broken.g4", "grammar Broken;", "rule : ( ;");
    assertThat(run(broken.toString())).isEqualTo(1);
    assertThat(output().get(0).getAsJsonObject().getAsJsonArray("entries")).isEmpty();
  }

  @Test
  public void testOptionsAreLayered() throws Exception {
    Path optionsFile =
        write(
            "options.json",
            "{\"ordering\": \"by-name\", \"cc-to-dash\": true, \"literal-rendering\": \"name\"}");
    SyntaxDocMain.Options options =
        SyntaxDocMain.parseCommandLineOptions(
            new String[] {
              "--options", optionsFile.toString(), "--cc_to_dash", "false", parser.toString()
            });
    DocumentationOptions documentationOptions = SyntaxDocMain.documentationOptions(options);
    assertThat(documentationOptions.ordering()).isEqualTo(DocumentationOptions.Ordering.BY_NAME);
    assertThat(documentationOptions.literalRendering()).isEqualTo(LiteralRendering.NAME);
    assertThat(documentationOptions.ccToDash()).isFalse();
    assertThat(documentationOptions.grouping())
        .isEqualTo(DocumentationOptions.Grouping.PARSER_FIRST);
  }

  @Test
  public void testInvalidCommandLines() {
    assertThrows(
        IllegalArgumentException.class, () -> SyntaxDocMain.parseCommandLineOptions(new String[0]));
    assertThrows(
        IllegalArgumentException.class,
        () -> SyntaxDocMain.parseCommandLineOptions(new String[] {"/no/such/grammar.g4"}));
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                SyntaxDocMain.documentationOptions(
                    SyntaxDocMain.parseCommandLineOptions(
                        new String[] {"--grouping", "sideways", parser.toString()})));
    assertThat(e).hasMessageThat().isEqualTo("invalid grouping 'sideways'");
  }
}
