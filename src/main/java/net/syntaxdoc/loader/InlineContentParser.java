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

import javax.annotation.Nullable;
import net.syntaxdoc.model.Position;
import net.syntaxdoc.model.RuleContent;

/** Parses the argument of a {@code //@ doc:content} command into a rule body. */
public interface InlineContentParser {

  /**
   * Returns the rule body written in {@code body}, or null if it does not parse. Problems are
   * reported to the caller's diagnostic handler, located relative to {@code position}.
   */
  @Nullable
  RuleContent parse(String body, Position position);
}
