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

import com.google.errorprone.annotations.FormatMethod;

/** Signals a malformed inline diagram description. */
public final class DiagramLoadException extends Exception {

  private final int line;

  /**
   * @param line the 1-based line of the description at which the problem is, or 0 if unknown
   */
  public DiagramLoadException(int line, String message, Throwable cause) {
    super(message, cause);
    this.line = line;
  }

  @FormatMethod
  DiagramLoadException(String format, Object... args) {
    super(String.format(format, args));
    this.line = 0;
  }

  /** Returns the 1-based line of the description at which the problem is, or 0 if unknown. */
  public int getLine() {
    return line;
  }
}
