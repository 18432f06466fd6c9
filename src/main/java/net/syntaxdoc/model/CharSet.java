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

/** A character class, e.g. {@code [a-zA-Z_]}. */
public final class CharSet extends RuleContent {

  private final String content;

  private CharSet(String content) {
    super(Kind.CHAR_SET);
    this.content = content;
  }

  public static CharSet of(String content) {
    return intern(new CharSet(Preconditions.checkNotNull(content)));
  }

  public String getContent() {
    return content;
  }

  @Override
  public int precedence() {
    return 4;
  }

  @Override
  public <T> T accept(RuleContentVisitor<T> visitor) {
    return visitor.visitCharSet(this);
  }

  @Override
  void format(StringBuilder buf) {
    buf.append(content);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CharSet that && content.equals(that.content);
  }

  @Override
  public int hashCode() {
    return content.hashCode() ^ 0x5eed;
  }
}
