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

/** A non-terminal: a rule composed of other rules and terminals. */
public final class ParserRule extends RuleBase {

  private ParserRule(Builder builder) {
    super(builder);
  }

  public static Builder builder(Model model, String name, Position position) {
    return new Builder(model, name, position);
  }

  /** Builder for {@link ParserRule}. */
  public static final class Builder extends RuleBase.Builder<Builder> {
    private Builder(Model model, String name, Position position) {
      super(model, name, position);
    }

    @Override
    Builder self() {
      return this;
    }

    public ParserRule build() {
      return new ParserRule(this);
    }
  }
}
