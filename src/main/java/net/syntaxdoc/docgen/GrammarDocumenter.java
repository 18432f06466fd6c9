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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import net.syntaxdoc.diagram.DiagramRenderer;
import net.syntaxdoc.diagram.Element;
import net.syntaxdoc.diagram.EndClass;
import net.syntaxdoc.diagram.NameFormatter;
import net.syntaxdoc.events.Diagnostic;
import net.syntaxdoc.events.DiagnosticHandler;
import net.syntaxdoc.model.Model;
import net.syntaxdoc.model.ModelProvider;
import net.syntaxdoc.model.ProviderRegistry;
import net.syntaxdoc.model.RuleBase;
import net.syntaxdoc.model.Section;

/** Loads a grammar and assembles its {@link GrammarDocumentation}. */
public final class GrammarDocumenter {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ProviderRegistry registry;
  private final DiagnosticHandler handler;
  private final RuleSelector selector;

  public GrammarDocumenter(ProviderRegistry registry, DiagnosticHandler handler) {
    this.registry = registry;
    this.handler = handler;
    this.selector = new RuleSelector(registry, handler);
  }

  /**
   * Loads and documents the grammar in {@code path}. Returns null and reports an error if no
   * registered provider handles the file.
   */
  @Nullable
  public GrammarDocumentation document(Path path, DocumentationOptions options) {
    ModelProvider provider = registry.find(path);
    if (provider == null) {
      handler.handle(
          Diagnostic.error(
              null,
              "can't determine file format for %s; make sure that a provider for this file type"
                  + " is registered",
              path));
      return null;
    }
    return document(provider.fromFile(path, options.loadingOptions()), options);
  }

  public GrammarDocumentation document(Model model, DocumentationOptions options) {
    RuleBase root = selector.findRootRule(model, options);
    ImmutableList<RuleBase> rules = selector.select(model, options, root);
    DiagramRenderer renderer = new DiagramRenderer(options.literalRendering(), options.ccToDash());
    boolean honorSections =
        options.honorSections() && options.ordering() == DocumentationOptions.Ordering.BY_SOURCE;

    List<GrammarDocumentation.Entry> entries = new ArrayList<>();
    Section lastSection = null;
    for (RuleBase rule : rules) {
      if (honorSections && rule.getSection() != lastSection) {
        lastSection = rule.getSection();
        if (lastSection != null) {
          entries.add(GrammarDocumentation.SectionHeader.create(lastSection));
        }
      }

      String displayName = rule.getDisplayName();
      if (displayName == null && options.ccToDash()) {
        displayName = NameFormatter.toDashCase(rule.getName());
      }
      Element diagram = null;
      if (options.diagrams() && !rule.isNoDiagram() && rule.getContent() != null) {
        diagram = renderer.render(rule);
      }
      EndClass endClass =
          options.markRootRule() && rule == root ? EndClass.COMPLEX : EndClass.SIMPLE;
      entries.add(GrammarDocumentation.RuleEntry.create(rule, displayName, diagram, endClass));
    }

    List<String> imports = new ArrayList<>();
    for (Model imported : model.getImports()) {
      imports.add(imported.getName());
    }
    logger.atFine().log("documented %s: %d entries", model.getName(), entries.size());
    return GrammarDocumentation.create(
        model.getName(), model.getPath(), model.getModelDocs(), imports, entries);
  }
}
