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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Base class for lexer and parser rules.
 *
 * <p>A rule is created once by a loader and owned by exactly one {@link Model}. Besides its body it
 * carries the metadata set by documentation commands ({@code //@ doc:nodoc}, {@code
 * //@ doc:importance 2}, ...). Rules compare by identity.
 */
public abstract class RuleBase {

  private final String name;
  @Nullable private final String displayName;
  private final Model model;
  private final Position position;
  @Nullable private final RuleContent content;
  private final boolean nodoc;
  private final boolean noDiagram;
  private final boolean inline;
  private final boolean keepDiagramRecursive;
  @Nullable private final String cssClass;
  private final int importance;
  private final ImmutableList<DocLine> documentation;
  @Nullable private final Section section;

  RuleBase(Builder<?> builder) {
    this.name = builder.name;
    this.displayName = builder.displayName;
    this.model = builder.model;
    this.position = builder.position;
    this.content = builder.content;
    this.nodoc = builder.nodoc;
    this.noDiagram = builder.noDiagram;
    this.inline = builder.inline;
    this.keepDiagramRecursive = builder.keepDiagramRecursive;
    this.cssClass = builder.cssClass;
    this.importance = builder.importance;
    this.documentation = builder.documentation;
    this.section = builder.section;
  }

  public String getName() {
    return name;
  }

  /** Returns the name set by {@code doc:name}, or null. */
  @Nullable
  public String getDisplayName() {
    return displayName;
  }

  public Model getModel() {
    return model;
  }

  public Position getPosition() {
    return position;
  }

  /**
   * Returns the body of the rule, or null for tokens that are declared but never defined (such as
   * entries of an ANTLR {@code tokens} block without a {@code doc:content} command).
   */
  @Nullable
  public RuleContent getContent() {
    return content;
  }

  /** If set, generators emit nothing for this rule. */
  public boolean isNodoc() {
    return nodoc;
  }

  /** If set, generators document the rule without a diagram. */
  public boolean isNoDiagram() {
    return noDiagram;
  }

  /**
   * If set, the rule is not documented on its own; diagrams of rules that refer to it show its body
   * in place of the reference.
   */
  public boolean isInline() {
    return inline;
  }

  /** If set, the renderer does not turn recursive alternatives into loops. */
  public boolean isKeepDiagramRecursive() {
    return keepDiagramRecursive;
  }

  /** Returns the css class added to every diagram node that refers to this rule, or null. */
  @Nullable
  public String getCssClass() {
    return cssClass;
  }

  /** Returns the importance used to pick default choice branches. Zero means unimportant. */
  public int getImportance() {
    return importance;
  }

  public ImmutableList<DocLine> getDocumentation() {
    return documentation;
  }

  /** Returns the section header this rule belongs to, or null. */
  @Nullable
  public Section getSection() {
    return section;
  }

  /** Returns {@code "grammar.rule"}, the name under which this rule is cross-referenced. */
  public String getFullName() {
    return model.getName() + "." + name;
  }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder(name);
    if (content == null) {
      buf.append("\n  <implicit>");
    } else {
      List<RuleContent> alternatives =
          content instanceof Alternative alternative
              ? alternative.getChildren()
              : ImmutableList.of(content);
      for (int i = 0; i < alternatives.size(); i++) {
        buf.append(i == 0 ? "\n  : " : "\n  | ").append(alternatives.get(i));
      }
    }
    return buf.append("\n  ;").toString();
  }

  /** Collects the properties of a rule while its declaration is being loaded. */
  public abstract static class Builder<B extends Builder<B>> {
    private final Model model;
    private final String name;
    private final Position position;
    @Nullable private String displayName;
    @Nullable private RuleContent content;
    private boolean nodoc;
    private boolean noDiagram;
    private boolean inline;
    private boolean keepDiagramRecursive;
    @Nullable private String cssClass;
    private int importance = 1;
    private ImmutableList<DocLine> documentation = ImmutableList.of();
    @Nullable private Section section;

    Builder(Model model, String name, Position position) {
      this.model = Preconditions.checkNotNull(model);
      this.name = Preconditions.checkNotNull(name);
      this.position = Preconditions.checkNotNull(position);
    }

    abstract B self();

    @CanIgnoreReturnValue
    public B setDisplayName(@Nullable String displayName) {
      this.displayName = displayName;
      return self();
    }

    @CanIgnoreReturnValue
    public B setContent(@Nullable RuleContent content) {
      this.content = content;
      return self();
    }

    @Nullable
    public RuleContent getContent() {
      return content;
    }

    @CanIgnoreReturnValue
    public B setNodoc(boolean nodoc) {
      this.nodoc = nodoc;
      return self();
    }

    @CanIgnoreReturnValue
    public B setNoDiagram(boolean noDiagram) {
      this.noDiagram = noDiagram;
      return self();
    }

    @CanIgnoreReturnValue
    public B setInline(boolean inline) {
      this.inline = inline;
      return self();
    }

    @CanIgnoreReturnValue
    public B setKeepDiagramRecursive(boolean keepDiagramRecursive) {
      this.keepDiagramRecursive = keepDiagramRecursive;
      return self();
    }

    @CanIgnoreReturnValue
    public B setCssClass(@Nullable String cssClass) {
      this.cssClass = cssClass;
      return self();
    }

    @CanIgnoreReturnValue
    public B setImportance(int importance) {
      Preconditions.checkArgument(importance >= 0, "negative importance %s", importance);
      this.importance = importance;
      return self();
    }

    @CanIgnoreReturnValue
    public B setDocumentation(List<DocLine> documentation) {
      this.documentation = ImmutableList.copyOf(documentation);
      return self();
    }

    @CanIgnoreReturnValue
    public B setSection(@Nullable Section section) {
      this.section = section;
      return self();
    }
  }
}
