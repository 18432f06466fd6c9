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

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.Set;
import net.syntaxdoc.model.Alternative;
import net.syntaxdoc.model.CharSet;
import net.syntaxdoc.model.Doc;
import net.syntaxdoc.model.Literal;
import net.syntaxdoc.model.Negation;
import net.syntaxdoc.model.OnePlus;
import net.syntaxdoc.model.Range;
import net.syntaxdoc.model.Reference;
import net.syntaxdoc.model.RuleBase;
import net.syntaxdoc.model.RuleContent;
import net.syntaxdoc.model.RuleContentVisitor;
import net.syntaxdoc.model.Sequence;
import net.syntaxdoc.model.Wildcard;
import net.syntaxdoc.model.ZeroPlus;

/**
 * Computes the rules that a root rule uses, directly or through other rules. References are
 * resolved through the import closure of the model they appear in; dangling references are
 * ignored.
 */
public final class ReachableRuleFinder extends RuleContentVisitor<Void> {

  // Rules are compared by identity.
  private final Set<RuleBase> seen = new LinkedHashSet<>();

  private ReachableRuleFinder() {}

  /** Returns {@code root} and every rule reachable from it, in discovery order. */
  public static ImmutableSet<RuleBase> findReachableRules(RuleBase root) {
    ReachableRuleFinder finder = new ReachableRuleFinder();
    finder.enter(root);
    return ImmutableSet.copyOf(finder.seen);
  }

  private void enter(RuleBase rule) {
    if (seen.add(rule) && rule.getContent() != null) {
      visit(rule.getContent());
    }
  }

  @Override
  public Void visitLiteral(Literal node) {
    return null;
  }

  @Override
  public Void visitRange(Range node) {
    return null;
  }

  @Override
  public Void visitCharSet(CharSet node) {
    return null;
  }

  @Override
  public Void visitWildcard(Wildcard node) {
    return null;
  }

  @Override
  public Void visitDoc(Doc node) {
    return null;
  }

  @Override
  public Void visitReference(Reference node) {
    RuleBase rule = node.getReference();
    if (rule != null) {
      enter(rule);
    }
    return null;
  }

  @Override
  public Void visitNegation(Negation node) {
    return visit(node.getChild());
  }

  @Override
  public Void visitZeroPlus(ZeroPlus node) {
    return visit(node.getChild());
  }

  @Override
  public Void visitOnePlus(OnePlus node) {
    return visit(node.getChild());
  }

  @Override
  public Void visitSequence(Sequence node) {
    visitAll(node.getChildren());
    return null;
  }

  @Override
  public Void visitAlternative(Alternative node) {
    visitAll(node.getChildren());
    return null;
  }

  private void visitAll(Iterable<RuleContent> children) {
    for (RuleContent child : children) {
      visit(child);
    }
  }
}
