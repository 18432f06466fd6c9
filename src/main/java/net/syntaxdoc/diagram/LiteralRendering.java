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

package net.syntaxdoc.diagram;

import com.google.common.base.Ascii;

/** How literal tokens are shown in diagrams. */
public enum LiteralRendering {
  /** Show the name of the token rule, e.g. {@code PLUS}. */
  NAME,
  /** Show the literal with its quotes, e.g. {@code '+'}. */
  CONTENTS,
  /** Show the literal without quotes, e.g. {@code +}. */
  CONTENTS_UNQUOTED;

  /**
   * Parses the configuration spelling: {@code name}, {@code contents} or {@code
   * contents-unquoted}.
   */
  public static LiteralRendering fromString(String value) {
    for (LiteralRendering rendering : values()) {
      if (rendering.toString().equals(value)) {
        return rendering;
      }
    }
    throw new IllegalArgumentException(
        "invalid literal rendering '" + value + "', expected name, contents or contents-unquoted");
  }

  @Override
  public String toString() {
    return Ascii.toLowerCase(name()).replace('_', '-');
  }
}
