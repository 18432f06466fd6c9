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

/** Matches the child zero or more times. */
public final class ZeroPlus extends RuleContent {

  private final RuleContent child;

  private ZeroPlus(RuleContent child) {
    super(Kind.ZERO_PLUS);
    this.child = child;
  }

  /** Returns the repetition of {@code child}, or {@link Sequence#EMPTY} if the child is empty. */
  public static RuleContent of(RuleContent child) {
    if (child == Sequence.EMPTY) {
      return Sequence.EMPTY;
    }
    return intern(new ZeroPlus(Preconditions.checkNotNull(child)));
  }

  public RuleContent getChild() {
    return child;
  }

  @Override
  public int precedence() {
    return 3;
  }

  @Override
  public <T> T accept(RuleContentVisitor<T> visitor) {
    return visitor.visitZeroPlus(this);
  }

  @Override
  void format(StringBuilder buf) {
    formatChild(buf, child);
    buf.append('*');
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ZeroPlus that && child == that.child;
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(child) + Kind.ZERO_PLUS.ordinal();
  }
}
