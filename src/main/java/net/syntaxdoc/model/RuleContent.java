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

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;

/**
 * Base class for the nodes that form lexer and parser rule bodies.
 *
 * <p>All nodes are interned: two structurally equal nodes are the same object, so algorithms that
 * need to recognize "the same child" compare nodes with {@code ==}. Nodes are obtained through the
 * static factories of the concrete classes ({@link Literal#of}, {@link Sequence#of}, ...), which
 * simplify eagerly and return the interned instance.
 *
 * <p>Each node has a precedence used by {@link #toString} to decide when a sub-expression needs
 * parentheses: a child is parenthesized unless its precedence is greater than its parent's.
 */
public abstract class RuleContent {

  /** Kinds of rule content, one per concrete subclass. */
  public enum Kind {
    LITERAL,
    RANGE,
    CHAR_SET,
    WILDCARD,
    REFERENCE,
    DOC,
    NEGATION,
    ZERO_PLUS,
    ONE_PLUS,
    SEQUENCE,
    ALTERNATIVE,
  }

  // Weak, so nodes no longer referenced by any model can be collected.
  private static final Interner<RuleContent> INTERNER = Interners.newWeakInterner();

  private final Kind kind;

  // Only classes of this package define node kinds.
  RuleContent(Kind kind) {
    this.kind = kind;
  }

  @SuppressWarnings("unchecked") // the interner returns an instance equal to node, hence same class
  static <T extends RuleContent> T intern(T node) {
    return (T) INTERNER.intern(node);
  }

  /** Returns the kind of this node. */
  public final Kind kind() {
    return kind;
  }

  /** Returns the binding strength of this node, from 0 (alternative) to 4 (atoms). */
  public abstract int precedence();

  /** Dispatches to the visitor method for this node's kind. */
  public abstract <T> T accept(RuleContentVisitor<T> visitor);

  abstract void format(StringBuilder buf);

  final void formatChild(StringBuilder buf, RuleContent child) {
    if (child.precedence() > precedence()) {
      child.format(buf);
    } else {
      buf.append('(');
      child.format(buf);
      buf.append(')');
    }
  }

  /** Returns the node in grammar notation, e.g. {@code 'a' (b | c)*}. */
  @Override
  public final String toString() {
    StringBuilder buf = new StringBuilder();
    format(buf);
    return buf.toString();
  }

  // Structural equality, used only by the interner. After interning, equal implies identical.
  @Override
  public abstract boolean equals(Object other);

  @Override
  public abstract int hashCode();
}
