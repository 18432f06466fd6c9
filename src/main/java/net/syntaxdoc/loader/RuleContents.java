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

package net.syntaxdoc.loader;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import net.syntaxdoc.model.Alternative;
import net.syntaxdoc.model.LineBreak;
import net.syntaxdoc.model.OnePlus;
import net.syntaxdoc.model.RuleContent;
import net.syntaxdoc.model.Sequence;
import net.syntaxdoc.model.ZeroPlus;

/** Builds rule bodies from the elements of a parsed alternative. Shared by the loaders. */
public final class RuleContents {

  private RuleContents() {}

  /**
   * Returns the sequence of {@code elements} as written in one alternative.
   *
   * <p>An element that is itself a sequence (a parenthesized group) is spliced in. Junctions
   * between elements written separately get a {@link LineBreak#SOFT} hint, so long alternatives
   * wrap between source elements rather than inside groups.
   */
  public static RuleContent sequence(List<RuleContent> elements) {
    List<RuleContent> children = new ArrayList<>();
    BitSet softAfter = new BitSet();
    for (RuleContent element : elements) {
      if (element instanceof Sequence sequence) {
        children.addAll(sequence.getChildren());
      } else {
        children.add(element);
      }
      if (!children.isEmpty()) {
        softAfter.set(children.size() - 1);
      }
    }
    if (children.size() == 1) {
      return children.get(0);
    }
    List<LineBreak> linebreaks = new ArrayList<>();
    for (int i = 0; i + 1 < children.size(); i++) {
      linebreaks.add(softAfter.get(i) ? LineBreak.SOFT : LineBreak.DEFAULT);
    }
    return Sequence.of(children, linebreaks);
  }

  public static RuleContent alternative(List<RuleContent> alternatives) {
    return Alternative.of(alternatives);
  }

  /**
   * Applies an EBNF suffix ({@code ?}, {@code *} or {@code +}, optionally followed by the
   * non-greedy {@code ?}) to an element.
   */
  public static RuleContent withSuffix(RuleContent element, String suffix) {
    if (element == Sequence.EMPTY || suffix.isEmpty()) {
      return element;
    }
    return switch (suffix.charAt(0)) {
      case '?' -> Alternative.of(Sequence.EMPTY, element);
      case '*' -> ZeroPlus.of(element);
      case '+' -> OnePlus.of(element);
      default -> throw new IllegalArgumentException("bad suffix: " + suffix);
    };
  }
}
