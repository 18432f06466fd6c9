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
import java.util.Arrays;
import java.util.List;

/**
 * Matches exactly one of its children.
 *
 * <p>Construction flattens nested alternatives. No children gives {@link Sequence#EMPTY}; a single
 * child is returned as is.
 */
public final class Alternative extends RuleContent {

  private final ImmutableList<RuleContent> children;

  private Alternative(ImmutableList<RuleContent> children) {
    super(Kind.ALTERNATIVE);
    this.children = children;
  }

  public static RuleContent of(RuleContent... children) {
    return of(Arrays.asList(children));
  }

  public static RuleContent of(List<? extends RuleContent> children) {
    if (children.isEmpty()) {
      return Sequence.EMPTY;
    }
    if (children.size() == 1) {
      return children.get(0);
    }
    ImmutableList.Builder<RuleContent> flat = ImmutableList.builder();
    for (RuleContent item : children) {
      if (item instanceof Alternative nested) {
        flat.addAll(nested.children);
      } else {
        flat.add(item);
      }
    }
    return intern(new Alternative(flat.build()));
  }

  public ImmutableList<RuleContent> getChildren() {
    return children;
  }

  @Override
  public int precedence() {
    return 0;
  }

  @Override
  public <T> T accept(RuleContentVisitor<T> visitor) {
    return visitor.visitAlternative(this);
  }

  @Override
  void format(StringBuilder buf) {
    for (int i = 0; i < children.size(); i++) {
      if (i > 0) {
        buf.append(" | ");
      }
      formatChild(buf, children.get(i));
    }
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Alternative that && Sequence.sameChildren(children, that.children);
  }

  @Override
  public int hashCode() {
    return Sequence.identityHash(children) * 31 + 2;
  }
}
