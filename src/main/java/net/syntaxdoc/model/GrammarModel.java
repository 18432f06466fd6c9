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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The model implementation populated by the loaders.
 *
 * <p>A model is mutable while its loader populates it and immutable after {@link #freeze}. It is
 * registered with its provider before population starts, so a grammar that imports itself
 * (directly or through other grammars) sees the same, partially populated instance. This is safe
 * because references are resolved lazily.
 */
public final class GrammarModel extends Model {

  @Nullable private final ModelProvider provider;
  private final Path path;
  private final boolean inMemory;
  private String name;
  private ImmutableList<DocLine> modelDocs = ImmutableList.of();
  private final List<Model> imports = new ArrayList<>();
  private final Map<String, LexerRule> terminals = new LinkedHashMap<>();
  private final Map<String, ParserRule> nonTerminals = new LinkedHashMap<>();
  private boolean frozen;

  private GrammarModel(
      @Nullable ModelProvider provider, Path path, String name, boolean inMemory) {
    this.provider = provider;
    this.path = Preconditions.checkNotNull(path);
    this.name = Preconditions.checkNotNull(name);
    this.inMemory = inMemory;
  }

  /** Creates an empty model for the grammar in {@code path}. */
  public static GrammarModel create(@Nullable ModelProvider provider, Path path, String name) {
    return new GrammarModel(provider, path, name, /* inMemory= */ false);
  }

  /**
   * Creates an empty model for a grammar snippet embedded in another document. {@code path} is the
   * embedding document; such models cannot import other grammars.
   */
  public static GrammarModel createInMemory(
      @Nullable ModelProvider provider, Path path, String name) {
    return new GrammarModel(provider, path, name, /* inMemory= */ true);
  }

  @Override
  @Nullable
  public ModelProvider getProvider() {
    return provider;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public Path getPath() {
    return path;
  }

  public boolean isInMemory() {
    return inMemory;
  }

  @Override
  public ImmutableList<DocLine> getModelDocs() {
    return modelDocs;
  }

  @Override
  @Nullable
  public RuleBase lookupLocal(String name) {
    RuleBase rule = nonTerminals.get(name);
    return rule != null ? rule : terminals.get(name);
  }

  @Override
  public ImmutableList<Model> getImports() {
    return ImmutableList.copyOf(imports);
  }

  @Override
  public ImmutableList<LexerRule> getTerminals() {
    // Literal rules are indexed twice.
    return ImmutableSet.copyOf(terminals.values()).asList();
  }

  @Override
  public ImmutableList<ParserRule> getNonTerminals() {
    return ImmutableList.copyOf(nonTerminals.values());
  }

  public void setName(String name) {
    checkMutable();
    this.name = Preconditions.checkNotNull(name);
  }

  public void setModelDocs(List<DocLine> modelDocs) {
    checkMutable();
    this.modelDocs = ImmutableList.copyOf(modelDocs);
  }

  public void addImport(Model model) {
    checkMutable();
    if (!imports.contains(model)) {
      imports.add(model);
    }
  }

  /**
   * Adds a lexer rule. A literal rule is also registered under its literal text, unless another
   * rule already claimed that text.
   */
  public void addLexerRule(LexerRule rule) {
    checkMutable();
    Preconditions.checkArgument(rule.getModel() == this, "%s belongs to another model", rule);
    terminals.put(rule.getName(), rule);
    if (rule.isLiteral() && rule.getContent() != null) {
      terminals.putIfAbsent(rule.getContent().toString(), rule);
    }
  }

  public void addParserRule(ParserRule rule) {
    checkMutable();
    Preconditions.checkArgument(rule.getModel() == this, "%s belongs to another model", rule);
    nonTerminals.put(rule.getName(), rule);
  }

  /** Ends population. Any later mutation fails. */
  public void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  private void checkMutable() {
    checkState(!frozen, "model %s is frozen", name);
  }
}
