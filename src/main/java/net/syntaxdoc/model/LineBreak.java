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

/**
 * A hint describing how a diagram may wrap a sequence at the junction between two elements.
 *
 * <p>Loaders record {@link #SOFT} where the grammar author's source has separate alternatives or
 * elements, and {@link #DEFAULT} inside flattened sub-sequences.
 */
public enum LineBreak {
  /** Always break here. */
  HARD,
  /** Prefer breaking here when the sequence is too wide. */
  SOFT,
  /** Break only if nothing better exists. */
  DEFAULT,
  /** Never break here. */
  NO_BREAK,
}
