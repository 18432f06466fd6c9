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

/** Inline documentation inside a rule body. Matches nothing; diagrams show it as a comment. */
public final class Doc extends RuleContent {

  private final String value;

  private Doc(String value) {
    super(Kind.DOC);
    this.value = value;
  }

  public static Doc of(String value) {
    return intern(new Doc(Preconditions.checkNotNull(value)));
  }

  public String getValue() {
    return value;
  }

  @Override
  public int precedence() {
    return 4;
  }

  @Override
  public <T> T accept(RuleContentVisitor<T> visitor) {
    return visitor.visitDoc(this);
  }

  @Override
  void format(StringBuilder buf) {
    buf.append("/** ").append(value).append(" */");
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Doc that && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return 31 * value.hashCode() + 7;
  }
}
