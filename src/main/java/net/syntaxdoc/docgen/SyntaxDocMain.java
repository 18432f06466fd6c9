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

import static com.google.common.io.MoreFiles.asCharSink;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.GoogleLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.syntaxdoc.diagram.LiteralRendering;
import net.syntaxdoc.events.CollectingDiagnosticHandler;
import net.syntaxdoc.events.LoggingDiagnosticHandler;
import net.syntaxdoc.model.ProviderRegistry;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.OptionDef;
import org.kohsuke.args4j.spi.Parameters;
import org.kohsuke.args4j.spi.PathOptionHandler;
import org.kohsuke.args4j.spi.Setter;

/**
 * Documents grammar files and prints their documentation as a JSON array, one object per grammar,
 * for a documentation pipeline to lay out.
 *
 * <p>Options are taken from the command line, then from the {@code --options} file, then from
 * {@link DocumentationOptions#DEFAULT}. Exits with status 1 if any error was reported.
 */
public class SyntaxDocMain {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final Gson GSON =
      new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();

  /** Command line options. Unset options are null. */
  public static class Options {
    @Argument(
        metaVar = "GRAMMAR",
        multiValued = true,
        handler = ExistingPathOptionHandler.class,
        usage = "Grammar files to document.")
    public List<Path> grammars = new ArrayList<>();

    @Option(
        name = "--output",
        handler = PathOptionHandler.class,
        usage = "Where to write the JSON documentation. Defaults to standard output.")
    public Path output;

    @Option(
        name = "--options",
        handler = ExistingPathOptionHandler.class,
        usage = "JSON file with documentation options, keyed by their dashed names.")
    public Path optionsFile;

    @Option(name = "--grouping", usage = "mixed, lexer-first or parser-first.")
    public String grouping;

    @Option(name = "--ordering", usage = "by-source or by-name.")
    public String ordering;

    @Option(name = "--literal_rendering", usage = "name, contents or contents-unquoted.")
    public String literalRendering;

    @Option(
        name = "--root_rule",
        usage = "Only document rules reachable from this rule: rule, grammar.rule or 'path rule'.")
    public String rootRule;

    @Option(
        name = "--lexer_rules",
        handler = BooleanOptionHandler.class,
        usage = "Document lexer rules.")
    public Boolean lexerRules;

    @Option(
        name = "--parser_rules",
        handler = BooleanOptionHandler.class,
        usage = "Document parser rules.")
    public Boolean parserRules;

    @Option(
        name = "--fragments",
        handler = BooleanOptionHandler.class,
        usage = "Document lexer fragments.")
    public Boolean fragments;

    @Option(
        name = "--undocumented",
        handler = BooleanOptionHandler.class,
        usage = "Document rules without documentation comments.")
    public Boolean undocumented;

    @Option(
        name = "--honor_sections",
        handler = BooleanOptionHandler.class,
        usage = "Emit /// section headers when ordering by source.")
    public Boolean honorSections;

    @Option(
        name = "--diagrams",
        handler = BooleanOptionHandler.class,
        usage = "Draw rule diagrams.")
    public Boolean diagrams;

    @Option(
        name = "--cc_to_dash",
        handler = BooleanOptionHandler.class,
        usage = "Show rule names in dash-case.")
    public Boolean ccToDash;

    @Option(
        name = "--mark_root_rule",
        handler = BooleanOptionHandler.class,
        usage = "Draw the root rule with a complex end.")
    public Boolean markRootRule;

    @Option(
        name = "--bison_c_char_literals",
        handler = BooleanOptionHandler.class,
        usage = "Whether Bison actions use C character literals.")
    public Boolean bisonCCharLiterals;
  }

  public static void main(String[] args) throws IOException {
    System.exit(run(args, System.out));
  }

  @VisibleForTesting
  static int run(String[] args, PrintStream out) throws IOException {
    Options options = parseCommandLineOptions(args);
    DocumentationOptions documentationOptions = documentationOptions(options);

    CollectingDiagnosticHandler diagnostics =
        new CollectingDiagnosticHandler(LoggingDiagnosticHandler.INSTANCE);
    ProviderRegistry registry = BuiltinProviders.createRegistry(diagnostics);
    GrammarDocumenter documenter = new GrammarDocumenter(registry, diagnostics);
    SyntaxIndex index = new SyntaxIndex(diagnostics);

    JsonArray result = new JsonArray();
    for (Path grammar : options.grammars) {
      GrammarDocumentation documentation = documenter.document(grammar, documentationOptions);
      if (documentation != null) {
        index.addDocumentation(documentation);
        result.add(documentation.toJsonTree());
      }
    }

    String json = GSON.toJson(result);
    if (options.output != null) {
      asCharSink(options.output, StandardCharsets.UTF_8).write(json);
    } else {
      out.println(json);
    }
    logger.atFine().log(
        "documented %d grammars, %d diagnostics",
        result.size(), diagnostics.getDiagnostics().size());
    return diagnostics.hasErrors() ? 1 : 0;
  }

  @VisibleForTesting
  static Options parseCommandLineOptions(String[] args) {
    Options options = new Options();
    CmdLineParser parser = new CmdLineParser(options);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      System.err.println(e.getMessage());
      parser.printUsage(System.err);
      throw new IllegalArgumentException(e);
    }
    if (options.grammars.isEmpty()) {
      parser.printUsage(System.err);
      throw new IllegalArgumentException("at least one grammar file is required");
    }
    return options;
  }

  /** Layers the command line over the options file over the defaults. */
  @VisibleForTesting
  static DocumentationOptions documentationOptions(Options options) throws IOException {
    DocumentationOptions base = DocumentationOptions.DEFAULT;
    if (options.optionsFile != null) {
      base = OptionsFile.read(options.optionsFile, base);
    }
    DocumentationOptions.Builder builder = base.toBuilder();
    if (options.grouping != null) {
      builder.grouping(DocumentationOptions.Grouping.fromString(options.grouping));
    }
    if (options.ordering != null) {
      builder.ordering(DocumentationOptions.Ordering.fromString(options.ordering));
    }
    if (options.literalRendering != null) {
      builder.literalRendering(LiteralRendering.fromString(options.literalRendering));
    }
    if (options.rootRule != null) {
      builder.rootRule(options.rootRule.isEmpty() ? null : options.rootRule);
    }
    if (options.lexerRules != null) {
      builder.lexerRules(options.lexerRules);
    }
    if (options.parserRules != null) {
      builder.parserRules(options.parserRules);
    }
    if (options.fragments != null) {
      builder.fragments(options.fragments);
    }
    if (options.undocumented != null) {
      builder.undocumented(options.undocumented);
    }
    if (options.honorSections != null) {
      builder.honorSections(options.honorSections);
    }
    if (options.diagrams != null) {
      builder.diagrams(options.diagrams);
    }
    if (options.ccToDash != null) {
      builder.ccToDash(options.ccToDash);
    }
    if (options.markRootRule != null) {
      builder.markRootRule(options.markRootRule);
    }
    if (options.bisonCCharLiterals != null) {
      builder.bisonCCharLiterals(options.bisonCCharLiterals);
    }
    return builder.build();
  }

  /**
   * Custom option handler for boolean values, to support both "--foo true" and "--foo" syntax. The
   * default args4j boolean handler only supports the latter.
   */
  public static class BooleanOptionHandler extends org.kohsuke.args4j.spi.BooleanOptionHandler {
    public BooleanOptionHandler(
        CmdLineParser parser, OptionDef option, Setter<? super Boolean> setter) {
      super(parser, option, setter);
    }

    @Override
    public int parseArguments(Parameters params) throws CmdLineException {
      if (params.size() > 0) {
        String value = params.getParameter(0);
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
          setter.addValue(Boolean.parseBoolean(value));
          return 1;
        }
      }
      return super.parseArguments(params);
    }
  }

  /** Custom option handler for a path that must exist. */
  public static class ExistingPathOptionHandler extends PathOptionHandler {

    public ExistingPathOptionHandler(
        CmdLineParser parser, OptionDef option, Setter<? super Path> setter) {
      super(parser, option, setter);
    }

    @Override
    protected Path parse(String argument) throws CmdLineException {
      Path path = FileSystems.getDefault().getPath(argument);
      if (!Files.exists(path)) {
        throw new CmdLineException(
            owner, String.format("Path %s for option %s does not exist.", argument, option));
      }
      return path;
    }
  }
}
