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

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Queue;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A single parsed grammar: its name, its documentation, the grammars it imports and the rules it
 * declares.
 *
 * <p>Imports may be cyclic. Everything that walks the import graph goes through {@link
 * #iterImportTree}, which visits each model once.
 */
public abstract class Model {

  /** Returns the provider that loaded this model, or null for a model built by hand. */
  @Nullable
  public abstract ModelProvider getProvider();

  public abstract String getName();

  /** Returns the file this model was loaded from. */
  public abstract Path getPath();

  /** Returns the documentation comments on top of the grammar, one entry per comment line. */
  public abstract ImmutableList<DocLine> getModelDocs();

  /**
   * Looks up a rule declared in this model. Parser rules win over lexer rules of the same name.
   * Literal lexer rules are also found by their literal text, e.g. {@code "'+'"}.
   */
  @Nullable
  public abstract RuleBase lookupLocal(String name);

  /** Returns the models imported directly by this one, in declaration order. */
  public abstract ImmutableList<Model> getImports();

  /** Returns the lexer rules declared in this model, including fragments. */
  public abstract ImmutableList<LexerRule> getTerminals();

  /** Returns the parser rules declared in this model. */
  public abstract ImmutableList<ParserRule> getNonTerminals();

  /**
   * Looks up a rule in this model and then in the transitively imported models, in the order of
   * {@link #iterImportTree}. If several models declare the name, the first one in that order wins.
   */
  @Nullable
  public RuleBase lookup(String name) {
    for (Model model : iterImportTree()) {
      RuleBase rule = model.lookupLocal(name);
      if (rule != null) {
        return rule;
      }
    }
    return null;
  }

  /**
   * Returns this model followed by every model it transitively imports, each exactly once.
   *
   * <p>Models are visited breadth first, imports in declaration order.
   */
  public ImmutableList<Model> iterImportTree() {
    ImmutableList.Builder<Model> result = ImmutableList.builder();
    Set<Model> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    Queue<Model> worklist = new ArrayDeque<>();
    worklist.add(this);
    while (!worklist.isEmpty()) {
      Model model = worklist.remove();
      if (!visited.add(model)) {
        continue;
      }
      result.add(model);
      worklist.addAll(model.getImports());
    }
    return result.build();
  }

  /** Returns all terminals followed by all non-terminals of this model. */
  public ImmutableList<RuleBase> getAllRules() {
    return ImmutableList.<RuleBase>builder()
        .addAll(getTerminals())
        .addAll(getNonTerminals())
        .build();
  }

  @Override
  public String toString() {
    return getName() + " (" + getPath() + ")";
  }
}
