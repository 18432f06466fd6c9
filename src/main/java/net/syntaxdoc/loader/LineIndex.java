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

import java.util.Arrays;

/** Maps character offsets of a source buffer to line numbers. */
public final class LineIndex {

  // Offsets at which lines start, in increasing order. lineStarts[0] is 0.
  private final int[] lineStarts;
  private final int firstLine;

  private LineIndex(int[] lineStarts, int firstLine) {
    this.lineStarts = lineStarts;
    this.firstLine = firstLine;
  }

  /**
   * Indexes {@code buffer}, whose first line is line {@code firstLine} of the enclosing file. A
   * grammar file starts at line 1; a snippet embedded in a document starts at its own line.
   */
  public static LineIndex create(char[] buffer, int firstLine) {
    int count = 1;
    for (char c : buffer) {
      if (c == '\n') {
        count++;
      }
    }
    int[] lineStarts = new int[count];
    int line = 1;
    for (int i = 0; i < buffer.length; i++) {
      if (buffer[i] == '\n') {
        lineStarts[line++] = i + 1;
      }
    }
    return new LineIndex(lineStarts, firstLine);
  }

  /** Returns the line containing {@code offset}. */
  public int lineOf(int offset) {
    int i = Arrays.binarySearch(lineStarts, offset);
    if (i < 0) {
      i = -i - 2; // the line starting before offset
    }
    return firstLine + i;
  }
}
