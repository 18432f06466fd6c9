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
import java.util.Objects;

/** A range of symbols, e.g. {@code 'a'..'z'}. */
public final class Range extends RuleContent {

  private final String start;
  private final String end;

  private Range(String start, String end) {
    super(Kind.RANGE);
    this.start = start;
    this.end = end;
  }

  public static Range of(String start, String end) {
    return intern(new Range(Preconditions.checkNotNull(start), Preconditions.checkNotNull(end)));
  }

  /** Returns the first symbol of the range, as written in the grammar. */
  public String getStart() {
    return start;
  }

  /** Returns the last symbol of the range, as written in the grammar. */
  public String getEnd() {
    return end;
  }

  @Override
  public int precedence() {
    return 4;
  }

  @Override
  public <T> T accept(RuleContentVisitor<T> visitor) {
    return visitor.visitRange(this);
  }

  @Override
  void format(StringBuilder buf) {
    buf.append(start).append("..").append(end);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Range that && start.equals(that.start) && end.equals(that.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }
}
