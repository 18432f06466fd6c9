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

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import net.syntaxdoc.events.Diagnostic;
import net.syntaxdoc.events.DiagnosticHandler;
import net.syntaxdoc.model.LexerRule;
import net.syntaxdoc.model.Model;
import net.syntaxdoc.model.ModelProvider;
import net.syntaxdoc.model.ProviderRegistry;
import net.syntaxdoc.model.RuleBase;

/**
 * Decides which rules of a grammar are documented, and in which order.
 *
 * <p>Rules are grouped and sorted according to {@link DocumentationOptions}. Rules marked {@code
 * nodoc} or {@code inline} are never documented, and each rule appears once even if the model
 * indexes it under several names. With a root rule, only rules reachable from it are kept; unless
 * undocumented rules are requested, only rules with documentation comments are kept.
 */
public final class RuleSelector {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ProviderRegistry registry;
  private final DiagnosticHandler handler;

  /**
   * @param registry providers for root rules given as {@code path/to/file rule}
   * @param handler receives problems with the root rule
   */
  public RuleSelector(ProviderRegistry registry, DiagnosticHandler handler) {
    this.registry = registry;
    this.handler = handler;
  }

  public ImmutableList<RuleBase> select(Model model, DocumentationOptions options) {
    return select(model, options, findRootRule(model, options));
  }

  /**
   * Like {@link #select(Model, DocumentationOptions)}, with the root rule already resolved by
   * {@link #findRootRule}.
   *
   * @param root the rule that restricts the selection, or null for no restriction
   */
  public ImmutableList<RuleBase> select(
      Model model, DocumentationOptions options, @Nullable RuleBase root) {
    List<RuleBase> lexerRules = new ArrayList<>();
    if (options.lexerRules()) {
      for (LexerRule rule : model.getTerminals()) {
        if (!rule.isFragment() || options.fragments()) {
          lexerRules.add(rule);
        }
      }
    }
    List<RuleBase> parserRules = new ArrayList<>();
    if (options.parserRules()) {
      parserRules.addAll(model.getNonTerminals());
    }

    Comparator<RuleBase> order =
        options.ordering() == DocumentationOptions.Ordering.BY_SOURCE
            ? Comparator.comparing(RuleBase::getPosition)
            : Comparator.comparing(rule -> Ascii.toLowerCase(rule.getName()));
    lexerRules.sort(order);
    parserRules.sort(order);
    List<RuleBase> ordered = new ArrayList<>();
    switch (options.grouping()) {
      case MIXED -> {
        ordered.addAll(lexerRules);
        ordered.addAll(parserRules);
        ordered.sort(order);
      }
      case LEXER_FIRST -> {
        ordered.addAll(lexerRules);
        ordered.addAll(parserRules);
      }
      case PARSER_FIRST -> {
        ordered.addAll(parserRules);
        ordered.addAll(lexerRules);
      }
    }

    Set<RuleBase> seen = Sets.newIdentityHashSet();
    List<RuleBase> rules = new ArrayList<>();
    for (RuleBase rule : ordered) {
      if (!rule.isNodoc() && !rule.isInline() && seen.add(rule)) {
        rules.add(rule);
      }
    }

    if (root != null) {
      ImmutableSet<RuleBase> reachable = ReachableRuleFinder.findReachableRules(root);
      rules.removeIf(rule -> !reachable.contains(rule));
    }

    if (!options.undocumented()) {
      rules.removeIf(rule -> rule.getDocumentation().isEmpty());
    }
    logger.atFine().log("documenting %d rules of %s", rules.size(), model.getName());
    return ImmutableList.copyOf(rules);
  }

  /**
   * Resolves the configured root rule, loading its grammar if it lives in another file. Returns
   * null if no root rule is configured, or reports an error and returns null if it can't be found.
   *
   * <p>The root rule may be written as {@code rule} (looked up through {@code model} and its
   * imports), {@code grammar.rule} (a grammar in the directory of {@code model}) or {@code
   * path/to/file rule} (a path relative to the directory of {@code model}).
   */
  @Nullable
  public RuleBase findRootRule(Model model, DocumentationOptions options) {
    String spec = options.rootRule();
    if (spec == null) {
      return null;
    }
    spec = spec.strip();

    Model rootModel;
    String name;
    int space = CharMatcher.whitespace().lastIndexIn(spec);
    int dot = spec.lastIndexOf('.');
    if (space >= 0) {
      name = spec.substring(space + 1);
      Path path = baseDirectory(model).resolve(spec.substring(0, space).strip());
      ModelProvider provider = registry.find(path);
      if (provider == null) {
        report("can't determine file format for %s", path);
        return null;
      }
      rootModel = provider.fromFile(path, options.loadingOptions());
    } else if (dot >= 0) {
      name = spec.substring(dot + 1);
      String grammar = spec.substring(0, dot);
      if (grammar.equals(model.getName())) {
        rootModel = model;
      } else if (model.getProvider() == null) {
        report("can't load grammar '%s' for root rule %s", grammar, spec);
        return null;
      } else {
        rootModel =
            model.getProvider().fromName(baseDirectory(model), grammar, options.loadingOptions());
        if (rootModel == null) {
          return null;
        }
      }
    } else {
      name = spec;
      rootModel = model;
    }

    RuleBase root = rootModel.lookup(name);
    if (root == null) {
      report("can't find root rule '%s' in grammar %s", name, rootModel.getName());
    }
    return root;
  }

  private static Path baseDirectory(Model model) {
    Path parent = model.getPath().toAbsolutePath().getParent();
    return parent != null ? parent : model.getPath().toAbsolutePath();
  }

  @FormatMethod
  private void report(String format, Object... args) {
    handler.handle(Diagnostic.error(null, format, args));
  }
}
