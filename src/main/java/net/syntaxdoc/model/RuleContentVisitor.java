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

/**
 * A visitor over {@link RuleContent} nodes, computing a value of type {@code T} per node.
 *
 * <p>{@link #visit} double-dispatches to the method named after the node's kind. Every such method
 * defaults to {@link #visitDefault}, which throws {@link IllegalStateException}.
 *
 * <p>Visitors do not traverse children on their own; a method that needs the value of a child
 * calls {@link #visit} on it.
 */
public abstract class RuleContentVisitor<T> {

  /** Entrypoint for visiting a node. Clients should avoid calling kind-specific methods. */
  public T visit(RuleContent content) {
    return content.accept(this);
  }

  public T visitLiteral(Literal node) {
    return visitDefault(node);
  }

  public T visitRange(Range node) {
    return visitDefault(node);
  }

  public T visitCharSet(CharSet node) {
    return visitDefault(node);
  }

  public T visitWildcard(Wildcard node) {
    return visitDefault(node);
  }

  public T visitReference(Reference node) {
    return visitDefault(node);
  }

  public T visitDoc(Doc node) {
    return visitDefault(node);
  }

  public T visitNegation(Negation node) {
    return visitDefault(node);
  }

  public T visitZeroPlus(ZeroPlus node) {
    return visitDefault(node);
  }

  public T visitOnePlus(OnePlus node) {
    return visitDefault(node);
  }

  public T visitSequence(Sequence node) {
    return visitDefault(node);
  }

  public T visitAlternative(Alternative node) {
    return visitDefault(node);
  }

  /**
   * Called for every kind the subclass does not override.
   *
   * @throws IllegalStateException always, unless overridden
   */
  protected T visitDefault(RuleContent node) {
    throw new IllegalStateException(
        String.format("%s has no visitor for %s", getClass().getSimpleName(), node.kind()));
  }
}
