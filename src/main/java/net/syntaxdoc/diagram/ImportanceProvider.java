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

package net.syntaxdoc.diagram;

import net.syntaxdoc.model.Alternative;
import net.syntaxdoc.model.CachingRuleContentVisitor;
import net.syntaxdoc.model.CharSet;
import net.syntaxdoc.model.Doc;
import net.syntaxdoc.model.Literal;
import net.syntaxdoc.model.Negation;
import net.syntaxdoc.model.OnePlus;
import net.syntaxdoc.model.Range;
import net.syntaxdoc.model.Reference;
import net.syntaxdoc.model.RuleBase;
import net.syntaxdoc.model.RuleContent;
import net.syntaxdoc.model.Sequence;
import net.syntaxdoc.model.Wildcard;
import net.syntaxdoc.model.ZeroPlus;

/**
 * Computes the importance of a rule body: the largest importance of any leaf in it.
 *
 * <p>Symbols have importance 1, references have the importance of the referenced rule (1 if it
 * can't be resolved), inline documentation has importance 0. The renderer uses it to pick the
 * default branch of a choice and to de-emphasize loops over unimportant content.
 */
public class ImportanceProvider extends CachingRuleContentVisitor<Integer> {

  @Override
  public Integer visitLiteral(Literal node) {
    return 1;
  }

  @Override
  public Integer visitRange(Range node) {
    return 1;
  }

  @Override
  public Integer visitCharSet(CharSet node) {
    return 1;
  }

  @Override
  public Integer visitWildcard(Wildcard node) {
    return 1;
  }

  @Override
  public Integer visitReference(Reference node) {
    RuleBase rule = node.getReference();
    return rule == null ? 1 : rule.getImportance();
  }

  @Override
  public Integer visitDoc(Doc node) {
    return 0;
  }

  @Override
  public Integer visitNegation(Negation node) {
    return visit(node.getChild());
  }

  @Override
  public Integer visitZeroPlus(ZeroPlus node) {
    return visit(node.getChild());
  }

  @Override
  public Integer visitOnePlus(OnePlus node) {
    return visit(node.getChild());
  }

  @Override
  public Integer visitSequence(Sequence node) {
    return max(node.getChildren());
  }

  @Override
  public Integer visitAlternative(Alternative node) {
    return max(node.getChildren());
  }

  private int max(Iterable<RuleContent> children) {
    int result = 0;
    for (RuleContent child : children) {
      result = Math.max(result, visit(child));
    }
    return result;
  }
}
