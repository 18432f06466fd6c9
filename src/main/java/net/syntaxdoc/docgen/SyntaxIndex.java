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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.syntaxdoc.events.Diagnostic;
import net.syntaxdoc.events.DiagnosticHandler;

/**
 * Cross-reference targets of a documentation build: documented grammars and rules.
 *
 * <p>Rules are registered under their full name {@code grammar.rule}. Rules documented outside of
 * any grammar belong to the default grammar, whose name is empty, and are registered under their
 * bare name.
 *
 * <p>An undotted rule name is resolved through the import closure of the grammar it is written
 * in, so a parser grammar can link to the tokens of the lexer grammar it imports.
 */
public final class SyntaxIndex {

  /** The name of the grammar that holds rules documented outside of any grammar. */
  public static final String DEFAULT_GRAMMAR = "";

  // Prefixes of hrefs that point outside of the index.
  private static final ImmutableList<String> EXTERNAL_HREF_PREFIXES =
      ImmutableList.of("http://", "https://", "/", "./", "../", "#");
  private static final ImmutableSet<String> EXTERNAL_HREFS = ImmutableSet.of(".", "..");

  /** A documented grammar or rule. */
  @AutoValue
  public abstract static class IndexEntry {
    /** Kinds of indexed objects. */
    public enum Kind {
      GRAMMAR,
      RULE
    }

    public abstract Kind kind();

    /** The grammar name, or the rule name without its grammar. */
    public abstract String name();

    /** The grammar name, or {@code grammar.rule}. */
    public abstract String fullName();

    @Nullable
    public abstract String displayName();

    /** For grammars, the names of the imported grammars. */
    public abstract ImmutableList<String> imports();

    /** Returns the anchor that links to this object. */
    public String anchor() {
      return "#" + fullName();
    }
  }

  /** The result of resolving a diagram href. */
  @AutoValue
  public abstract static class Link {
    public abstract String text();

    /** The link target, or null if the href could not be resolved. */
    @Nullable
    public abstract String href();

    static Link create(String text, @Nullable String href) {
      return new AutoValue_SyntaxIndex_Link(text, href);
    }
  }

  private final DiagnosticHandler handler;
  private final Map<String, IndexEntry> grammars = new LinkedHashMap<>();
  private final Map<String, IndexEntry> rules = new LinkedHashMap<>();

  public SyntaxIndex(DiagnosticHandler handler) {
    this.handler = handler;
  }

  public void addGrammar(String name, List<String> imports) {
    add(
        grammars,
        new AutoValue_SyntaxIndex_IndexEntry(
            IndexEntry.Kind.GRAMMAR, name, name, null, ImmutableList.copyOf(imports)));
  }

  public void addRule(String grammar, String name, @Nullable String displayName) {
    String fullName = grammar.isEmpty() ? name : grammar + "." + name;
    add(
        rules,
        new AutoValue_SyntaxIndex_IndexEntry(
            IndexEntry.Kind.RULE, name, fullName, displayName, ImmutableList.of()));
  }

  /** Registers a documented grammar and all of its documented rules. */
  public void addDocumentation(GrammarDocumentation documentation) {
    addGrammar(documentation.grammarName(), documentation.imports());
    for (GrammarDocumentation.RuleEntry rule : documentation.rules()) {
      addRule(documentation.grammarName(), rule.rule().getName(), rule.displayName());
    }
  }

  private void add(Map<String, IndexEntry> index, IndexEntry entry) {
    if (index.containsKey(entry.fullName())) {
      handler.handle(
          Diagnostic.warning(
              null,
              "duplicate object description of %s %s",
              entry.kind() == IndexEntry.Kind.GRAMMAR ? "grammar" : "rule",
              entry.fullName()));
    }
    index.put(entry.fullName(), entry);
  }

  @Nullable
  public IndexEntry resolveGrammar(String name) {
    return grammars.get(name);
  }

  /**
   * Finds the rules a reference may point to.
   *
   * <p>{@code grammar.rule} is looked up in {@code grammar} and the grammars it imports. A bare
   * rule name is looked up in {@code contextGrammar}, the grammars it imports and the default
   * grammar; without a context grammar, in every known grammar and the default grammar.
   *
   * @param contextGrammar the grammar the reference is written in, or null if unknown
   */
  public ImmutableList<IndexEntry> resolveRule(String target, @Nullable String contextGrammar) {
    List<String> roots = new ArrayList<>();
    String ruleName;
    boolean addDefaultGrammar;
    int dot = target.indexOf('.');
    if (dot >= 0) {
      roots.add(target.substring(0, dot));
      ruleName = target.substring(dot + 1);
      addDefaultGrammar = false;
    } else {
      if (contextGrammar == null) {
        roots.addAll(grammars.keySet());
      } else if (!contextGrammar.isEmpty()) {
        roots.add(contextGrammar);
      }
      ruleName = target;
      addDefaultGrammar = true;
    }

    ImmutableList.Builder<IndexEntry> results = ImmutableList.builder();
    for (String grammar : traverseGrammars(roots, addDefaultGrammar)) {
      IndexEntry rule = rules.get(grammar.isEmpty() ? ruleName : grammar + "." + ruleName);
      if (rule != null) {
        results.add(rule);
      }
    }
    return results.build();
  }

  /** Finds grammars and then rules named {@code target}. */
  public ImmutableList<IndexEntry> resolveAny(String target, @Nullable String contextGrammar) {
    ImmutableList.Builder<IndexEntry> results = ImmutableList.builder();
    IndexEntry grammar = resolveGrammar(target);
    if (grammar != null) {
      results.add(grammar);
    }
    return results.addAll(resolveRule(target, contextGrammar)).build();
  }

  /**
   * Resolves the link of a diagram node. External hrefs such as URLs and anchors are returned
   * unchanged. Otherwise {@code href}, or {@code text} if there is no href, names the target. When
   * the text was not chosen explicitly, it is replaced with the target's display name.
   */
  public Link resolveHref(
      String text, @Nullable String href, boolean textIsWeak, @Nullable String contextGrammar) {
    if (href != null && isExternal(href)) {
      return Link.create(text, href);
    }
    String target = href != null ? href : text;
    boolean explicitText = href != null && !textIsWeak;
    ImmutableList<IndexEntry> matches = resolveAny(target, contextGrammar);
    if (matches.isEmpty()) {
      return Link.create(text, null);
    }
    IndexEntry match = matches.get(0);
    String linkText = !explicitText && match.displayName() != null ? match.displayName() : text;
    return Link.create(linkText, match.anchor());
  }

  private static boolean isExternal(String href) {
    return EXTERNAL_HREFS.contains(href)
        || EXTERNAL_HREF_PREFIXES.stream().anyMatch(href::startsWith);
  }

  // Each grammar once, breadth-first through imports. Import cycles are allowed.
  private List<String> traverseGrammars(List<String> roots, boolean addDefaultGrammar) {
    List<String> result = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    Deque<String> queue = new ArrayDeque<>(roots);
    while (!queue.isEmpty()) {
      String name = queue.removeFirst();
      if (!seen.add(name)) {
        continue;
      }
      IndexEntry grammar = grammars.get(name);
      if (grammar != null) {
        result.add(name);
        queue.addAll(grammar.imports());
      }
    }
    if (addDefaultGrammar && !seen.contains(DEFAULT_GRAMMAR)) {
      result.add(DEFAULT_GRAMMAR);
    }
    return result;
  }
}
