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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Matches its children in order.
 *
 * <p>Construction flattens nested sequences and drops {@link #EMPTY} children, so a sequence never
 * directly contains another sequence. A sequence with no children is {@link #EMPTY}; a sequence
 * with one child is that child.
 *
 * <p>{@link #getLinebreaks} has one entry per junction between children. Line breaks are layout
 * hints only: they do not take part in equality, and the interned instance keeps the hints it was
 * first created with.
 */
public final class Sequence extends RuleContent {

  /** The unique empty sequence. */
  public static final Sequence EMPTY = intern(new Sequence(ImmutableList.of(), ImmutableList.of()));

  private final ImmutableList<RuleContent> children;
  private final ImmutableList<LineBreak> linebreaks;

  private Sequence(ImmutableList<RuleContent> children, ImmutableList<LineBreak> linebreaks) {
    super(Kind.SEQUENCE);
    this.children = children;
    this.linebreaks = linebreaks;
  }

  public static RuleContent of(RuleContent... children) {
    return of(Arrays.asList(children));
  }

  /** Returns the sequence of {@code children} with {@link LineBreak#DEFAULT} at every junction. */
  public static RuleContent of(List<? extends RuleContent> children) {
    return of(
        children, Collections.nCopies(Math.max(0, children.size() - 1), LineBreak.DEFAULT));
  }

  /**
   * Returns the sequence of {@code children}, where {@code linebreaks.get(i)} is the hint between
   * {@code children.get(i)} and {@code children.get(i + 1)}.
   */
  public static RuleContent of(
      List<? extends RuleContent> children, List<LineBreak> linebreaks) {
    checkArgument(
        linebreaks.size() == Math.max(0, children.size() - 1),
        "%s children need %s line breaks, got %s",
        children.size(),
        Math.max(0, children.size() - 1),
        linebreaks.size());
    ImmutableList.Builder<RuleContent> flatChildren = ImmutableList.builder();
    ImmutableList.Builder<LineBreak> flatLinebreaks = ImmutableList.builder();
    int count = 0;
    for (int i = 0; i < children.size(); i++) {
      RuleContent item = children.get(i);
      if (item == EMPTY) {
        continue;
      }
      if (count > 0) {
        flatLinebreaks.add(linebreaks.get(i - 1));
      }
      if (item instanceof Sequence nested) {
        flatChildren.addAll(nested.children);
        flatLinebreaks.addAll(nested.linebreaks);
        count += nested.children.size();
      } else {
        flatChildren.add(item);
        count++;
      }
    }
    if (count == 0) {
      return EMPTY;
    }
    ImmutableList<RuleContent> result = flatChildren.build();
    if (count == 1) {
      return result.get(0);
    }
    return intern(new Sequence(result, flatLinebreaks.build()));
  }

  public ImmutableList<RuleContent> getChildren() {
    return children;
  }

  public ImmutableList<LineBreak> getLinebreaks() {
    return linebreaks;
  }

  @Override
  public int precedence() {
    return 1;
  }

  @Override
  public <T> T accept(RuleContentVisitor<T> visitor) {
    return visitor.visitSequence(this);
  }

  @Override
  void format(StringBuilder buf) {
    for (int i = 0; i < children.size(); i++) {
      if (i > 0) {
        buf.append(' ');
      }
      formatChild(buf, children.get(i));
    }
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Sequence that && sameChildren(children, that.children);
  }

  @Override
  public int hashCode() {
    return identityHash(children) * 31 + 1;
  }

  static boolean sameChildren(List<RuleContent> a, List<RuleContent> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (a.get(i) != b.get(i)) {
        return false;
      }
    }
    return true;
  }

  static int identityHash(List<RuleContent> children) {
    int hash = 1;
    for (RuleContent child : children) {
      hash = 31 * hash + System.identityHashCode(child);
    }
    return hash;
  }
}
