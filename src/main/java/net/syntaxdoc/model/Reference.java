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

import com.google.common.base.Preconditions;
import javax.annotation.Nullable;

/**
 * Refers to another lexer or parser rule by name.
 *
 * <p>The reference is resolved lazily through {@link Model#lookup}, because forward and cyclic
 * references are legal and the referenced rule may live in an imported model that is still being
 * loaded. Two references are equal when they name the same rule in the same model instance.
 */
public final class Reference extends RuleContent {

  private final Model model;
  private final String name;

  private Reference(Model model, String name) {
    super(Kind.REFERENCE);
    this.model = model;
    this.name = name;
  }

  public static Reference of(Model model, String name) {
    return intern(
        new Reference(Preconditions.checkNotNull(model), Preconditions.checkNotNull(name)));
  }

  /** Returns the model in which the reference appears. */
  public Model getModel() {
    return model;
  }

  public String getName() {
    return name;
  }

  /** Looks up the referenced rule, or returns null for a dangling reference. */
  @Nullable
  public RuleBase getReference() {
    return model.lookup(name);
  }

  @Override
  public int precedence() {
    return 4;
  }

  @Override
  public <T> T accept(RuleContentVisitor<T> visitor) {
    return visitor.visitReference(this);
  }

  @Override
  void format(StringBuilder buf) {
    buf.append(name);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Reference that && model == that.model && name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(model) + name.hashCode();
  }
}
