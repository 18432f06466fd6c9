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

import com.google.auto.value.AutoValue;

/**
 * A documentation-bearing comment as found by a lexer: a {@code /**} doc comment, a {@code //@
 * doc:...} command or a {@code ///} section header.
 */
@AutoValue
public abstract class DocToken {

  /** The comment text, including its delimiters. */
  public abstract String text();

  /** The line of the grammar file (or embedding document) at which the comment starts. */
  public abstract int line();

  public static DocToken create(String text, int line) {
    return new AutoValue_DocToken(text, line);
  }

  public boolean isCommand() {
    return text().startsWith("//@");
  }
}
