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

/** Options that affect how a grammar file is loaded. */
@AutoValue
public abstract class LoadingOptions {

  public static final LoadingOptions DEFAULT = builder().build();

  /**
   * Bison only: whether the target language of the grammar's actions uses C-like char literals
   * ({@code 'a'}) rather than single quoted strings. This decides how quotes in action code are
   * skipped.
   */
  public abstract boolean useCCharLiterals();

  public static Builder builder() {
    return new AutoValue_LoadingOptions.Builder().useCCharLiterals(true);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link LoadingOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder useCCharLiterals(boolean value);

    public abstract LoadingOptions build();
  }
}
