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
import com.google.common.collect.ImmutableList;

/**
 * A section header: a block of {@code ///} comments that groups the rules following it.
 *
 * <p>Sections compare by identity. Two headers with the same text are still two sections.
 */
public final class Section {

  private final ImmutableList<DocLine> docs;
  private final Position position;

  public Section(ImmutableList<DocLine> docs, Position position) {
    this.docs = Preconditions.checkNotNull(docs);
    this.position = Preconditions.checkNotNull(position);
  }

  public ImmutableList<DocLine> getDocs() {
    return docs;
  }

  /** Returns the position of the first header line. */
  public Position getPosition() {
    return position;
  }

  @Override
  public String toString() {
    return "Section(" + position + ")";
  }
}
