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

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** A terminal: a token, a literal keyword or a lexer fragment. */
public final class LexerRule extends RuleBase {

  private final boolean literal;
  private final boolean fragment;

  private LexerRule(Builder builder) {
    super(builder);
    this.literal = builder.literal;
    this.fragment = builder.fragment;
  }

  public static Builder builder(Model model, String name, Position position) {
    return new Builder(model, name, position);
  }

  /** Whether the rule's body is a single fixed-string literal, e.g. {@code PLUS : '+' ;}. */
  public boolean isLiteral() {
    return literal;
  }

  /** Whether the rule is a fragment, i.e. only used to compose other lexer rules. */
  public boolean isFragment() {
    return fragment;
  }

  /** Builder for {@link LexerRule}. */
  public static final class Builder extends RuleBase.Builder<Builder> {
    private boolean literal;
    private boolean fragment;

    private Builder(Model model, String name, Position position) {
      super(model, name, position);
    }

    @Override
    Builder self() {
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLiteral(boolean literal) {
      this.literal = literal;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setFragment(boolean fragment) {
      this.fragment = fragment;
      return this;
    }

    public LexerRule build() {
      return new LexerRule(this);
    }
  }
}
