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
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;
import net.syntaxdoc.model.DocLine;
import net.syntaxdoc.model.RuleBase;
import net.syntaxdoc.model.RuleContent;

/** Everything the documentation comments in front of a declaration say about it. */
@AutoValue
public abstract class DocInfo {

  /** Describes a declaration without documentation comments. */
  public static final DocInfo EMPTY = builder().build();

  public abstract int importance();

  public abstract boolean inline();

  public abstract boolean nodoc();

  public abstract boolean noDiagram();

  public abstract boolean keepDiagramRecursive();

  @Nullable
  public abstract String cssClass();

  /** The display name set by {@code doc:name}. */
  @Nullable
  public abstract String name();

  public abstract ImmutableList<DocLine> documentation();

  /** The body set by {@code doc:content}. */
  @Nullable
  public abstract RuleContent content();

  public static Builder builder() {
    return new AutoValue_DocInfo.Builder()
        .importance(1)
        .inline(false)
        .nodoc(false)
        .noDiagram(false)
        .keepDiagramRecursive(false)
        .documentation(ImmutableList.of());
  }

  public abstract Builder toBuilder();

  /** Copies all metadata except {@link #content} into a rule under construction. */
  public void applyTo(RuleBase.Builder<?> rule) {
    rule.setDisplayName(name())
        .setImportance(importance())
        .setInline(inline())
        .setNodoc(nodoc())
        .setNoDiagram(noDiagram())
        .setKeepDiagramRecursive(keepDiagramRecursive())
        .setCssClass(cssClass())
        .setDocumentation(documentation());
  }

  /** Builder for {@link DocInfo}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder importance(int value);

    public abstract Builder inline(boolean value);

    public abstract Builder nodoc(boolean value);

    public abstract Builder noDiagram(boolean value);

    public abstract Builder keepDiagramRecursive(boolean value);

    public abstract Builder cssClass(@Nullable String value);

    public abstract Builder name(@Nullable String value);

    public abstract Builder documentation(List<DocLine> value);

    public abstract Builder content(@Nullable RuleContent value);

    public abstract DocInfo build();
  }
}
