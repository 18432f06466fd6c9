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

/** One documentation comment, tagged with the line at which the comment starts. */
@AutoValue
public abstract class DocLine {

  public abstract int line();

  public abstract String text();

  public static DocLine create(int line, String text) {
    return new AutoValue_DocLine(line, text);
  }
}
