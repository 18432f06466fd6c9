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

import com.google.auto.value.AutoValue;
import java.nio.file.Path;
import java.util.Comparator;

/** A line in a grammar file. Positions order by file, then by line. */
@AutoValue
public abstract class Position implements Comparable<Position> {

  private static final Comparator<Position> ORDER =
      Comparator.comparing(Position::file).thenComparingInt(Position::line);

  /** The file in which the rule or section is declared. */
  public abstract Path file();

  /** The 1-based line at which the rule or section is declared. */
  public abstract int line();

  public static Position create(Path file, int line) {
    return new AutoValue_Position(file, line);
  }

  @Override
  public int compareTo(Position other) {
    return ORDER.compare(this, other);
  }

  @Override
  public final String toString() {
    return file() + ":" + line();
  }
}
