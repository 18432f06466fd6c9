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

import static java.util.stream.Collectors.joining;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;
import net.syntaxdoc.model.LineBreak;

/**
 * A node of a syntax diagram, independent of any layout engine.
 *
 * <p>Diagram trees are produced by {@link DiagramRenderer} from rule bodies and by {@link
 * DiagramLoader} from inline descriptions; they are consumed by an external text or SVG layout
 * engine, typically through {@link DiagramJson}.
 *
 * <p>{@link #toString} gives a compact notation, e.g. {@code Sequence(Terminal(a),
 * ZeroOrMore(NonTerminal(b)))}.
 */
public abstract class Element {

  /** Kinds of diagram element, one per concrete subclass. */
  public enum Type {
    SKIP,
    TERMINAL,
    NON_TERMINAL,
    COMMENT,
    SEQUENCE,
    STACK,
    CHOICE,
    OPTIONAL,
    ZERO_OR_MORE,
    ONE_OR_MORE,
    GROUP,
    BARRIER,
  }

  private static final Skip SKIP = new AutoValue_Element_Skip();

  Element() {} // only nested classes extend Element

  public abstract Type type();

  abstract void describe(StringBuilder buf);

  @Override
  public final String toString() {
    StringBuilder buf = new StringBuilder();
    describe(buf);
    return buf.toString();
  }

  // ==== Factories ====

  /** Returns the element that draws nothing: an empty path. */
  public static Skip skip() {
    return SKIP;
  }

  public static Terminal terminal(String text) {
    return terminal(text, null, null, /* textIsWeak= */ false);
  }

  public static Terminal terminal(
      String text, @Nullable String href, @Nullable String cssClass, boolean textIsWeak) {
    return new Terminal(text, href, cssClass, textIsWeak);
  }

  public static NonTerminal nonTerminal(String text) {
    return nonTerminal(text, null, null, /* textIsWeak= */ false);
  }

  public static NonTerminal nonTerminal(
      String text, @Nullable String href, @Nullable String cssClass, boolean textIsWeak) {
    return new NonTerminal(text, href, cssClass, textIsWeak);
  }

  public static Comment comment(String text) {
    return comment(text, null, null);
  }

  public static Comment comment(String text, @Nullable String href, @Nullable String cssClass) {
    return new Comment(text, href, cssClass);
  }

  /** Returns a sequence with {@link LineBreak#DEFAULT} between its items. */
  public static Sequence sequence(List<Element> items) {
    return sequence(
        items, Collections.nCopies(Math.max(0, items.size() - 1), LineBreak.DEFAULT));
  }

  public static Sequence sequence(Element... items) {
    return sequence(ImmutableList.copyOf(items));
  }

  public static Sequence sequence(List<Element> items, List<LineBreak> linebreaks) {
    Preconditions.checkArgument(
        linebreaks.size() == Math.max(0, items.size() - 1),
        "%s items need %s line breaks, got %s",
        items.size(),
        Math.max(0, items.size() - 1),
        linebreaks.size());
    return new AutoValue_Element_Sequence(
        ImmutableList.copyOf(items), ImmutableList.copyOf(linebreaks));
  }

  /** Returns a sequence whose items are laid out vertically, one per line. */
  public static Stack stack(List<Element> items) {
    return new AutoValue_Element_Stack(ImmutableList.copyOf(items));
  }

  public static Choice choice(int defaultIndex, List<Element> items) {
    Preconditions.checkArgument(!items.isEmpty(), "a choice needs at least one item");
    Preconditions.checkElementIndex(defaultIndex, items.size(), "default choice");
    return new AutoValue_Element_Choice(ImmutableList.copyOf(items), defaultIndex);
  }

  public static Choice choice(int defaultIndex, Element... items) {
    return choice(defaultIndex, ImmutableList.copyOf(items));
  }

  public static Optional optional(Element item, boolean skip) {
    return new AutoValue_Element_Optional(item, skip);
  }

  public static ZeroOrMore zeroOrMore(Element item) {
    return zeroOrMore(item, skip(), /* skip= */ false);
  }

  /**
   * Returns a loop that matches {@code item} zero or more times, passing through {@code repeat}
   * between iterations. If {@code skip} is set, the empty path is the main line of the diagram.
   */
  public static ZeroOrMore zeroOrMore(Element item, Element repeat, boolean skip) {
    return new AutoValue_Element_ZeroOrMore(item, repeat, skip);
  }

  public static OneOrMore oneOrMore(Element item) {
    return oneOrMore(item, skip());
  }

  public static OneOrMore oneOrMore(Element item, Element repeat) {
    return new AutoValue_Element_OneOrMore(item, repeat);
  }

  public static Group group(Element item, @Nullable String text) {
    return new AutoValue_Element_Group(item, text);
  }

  public static Barrier barrier(Element item) {
    return new AutoValue_Element_Barrier(item);
  }

  // ==== Element kinds ====

  /** The empty path. */
  @AutoValue
  public abstract static class Skip extends Element {
    @Override
    public Type type() {
      return Type.SKIP;
    }

    @Override
    void describe(StringBuilder buf) {
      buf.append("Skip");
    }
  }

  /**
   * Common part of the elements that draw a text box.
   *
   * <p>A weak text is a placeholder (typically the rule name); the host may replace it by the title
   * of the documentation entity the href resolves to.
   */
  public abstract static class TextElement extends Element {
    private final String text;
    @Nullable private final String href;
    @Nullable private final String cssClass;
    private final boolean textIsWeak;

    TextElement(
        String text, @Nullable String href, @Nullable String cssClass, boolean textIsWeak) {
      this.text = Preconditions.checkNotNull(text);
      this.href = href;
      this.cssClass = cssClass;
      this.textIsWeak = textIsWeak;
    }

    public String getText() {
      return text;
    }

    /** Returns the cross-reference target of the box, e.g. {@code "grammar.rule"}, or null. */
    @Nullable
    public String getHref() {
      return href;
    }

    @Nullable
    public String getCssClass() {
      return cssClass;
    }

    public boolean isTextWeak() {
      return textIsWeak;
    }

    @Override
    void describe(StringBuilder buf) {
      String name =
          switch (type()) {
            case TERMINAL -> "Terminal";
            case NON_TERMINAL -> "NonTerminal";
            default -> "Comment";
          };
      buf.append(name).append('(').append(text).append(')');
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof TextElement that
          && type() == that.type()
          && text.equals(that.text)
          && Objects.equals(href, that.href)
          && Objects.equals(cssClass, that.cssClass)
          && textIsWeak == that.textIsWeak;
    }

    @Override
    public int hashCode() {
      return Objects.hash(type(), text, href, cssClass, textIsWeak);
    }
  }

  /** A rounded box for a token or literal. */
  public static final class Terminal extends TextElement {
    private Terminal(
        String text, @Nullable String href, @Nullable String cssClass, boolean textIsWeak) {
      super(text, href, cssClass, textIsWeak);
    }

    @Override
    public Type type() {
      return Type.TERMINAL;
    }
  }

  /** A rectangular box for a parser rule. */
  public static final class NonTerminal extends TextElement {
    private NonTerminal(
        String text, @Nullable String href, @Nullable String cssClass, boolean textIsWeak) {
      super(text, href, cssClass, textIsWeak);
    }

    @Override
    public Type type() {
      return Type.NON_TERMINAL;
    }
  }

  /** Free text drawn on the path. */
  public static final class Comment extends TextElement {
    private Comment(String text, @Nullable String href, @Nullable String cssClass) {
      super(text, href, cssClass, /* textIsWeak= */ false);
    }

    @Override
    public Type type() {
      return Type.COMMENT;
    }
  }

  /** Items drawn one after another. */
  @AutoValue
  public abstract static class Sequence extends Element {
    public abstract ImmutableList<Element> getItems();

    public abstract ImmutableList<LineBreak> getLinebreaks();

    @Override
    public Type type() {
      return Type.SEQUENCE;
    }

    @Override
    void describe(StringBuilder buf) {
      describeAll(buf, "Sequence(", ", ", getItems());
    }
  }

  /** Items drawn one below another. */
  @AutoValue
  public abstract static class Stack extends Element {
    public abstract ImmutableList<Element> getItems();

    @Override
    public Type type() {
      return Type.STACK;
    }

    @Override
    void describe(StringBuilder buf) {
      describeAll(buf, "Stack(", ", ", getItems());
    }
  }

  /** A branch over several items; the default item is drawn on the main line. */
  @AutoValue
  public abstract static class Choice extends Element {
    public abstract ImmutableList<Element> getItems();

    public abstract int getDefaultIndex();

    @Override
    public Type type() {
      return Type.CHOICE;
    }

    @Override
    void describe(StringBuilder buf) {
      describeAll(buf, "Choice(default=" + getDefaultIndex() + ": ", " | ", getItems());
    }
  }

  /** An item that may be bypassed. */
  @AutoValue
  public abstract static class Optional extends Element {
    public abstract Element getItem();

    public abstract boolean isSkip();

    @Override
    public Type type() {
      return Type.OPTIONAL;
    }

    @Override
    void describe(StringBuilder buf) {
      buf.append(isSkip() ? "Optional[skip](" : "Optional(");
      getItem().describe(buf);
      buf.append(')');
    }
  }

  /** A loop over an item that may be bypassed entirely. */
  @AutoValue
  public abstract static class ZeroOrMore extends Element {
    public abstract Element getItem();

    public abstract Element getRepeat();

    public abstract boolean isSkip();

    @Override
    public Type type() {
      return Type.ZERO_OR_MORE;
    }

    @Override
    void describe(StringBuilder buf) {
      buf.append(isSkip() ? "ZeroOrMore[skip](" : "ZeroOrMore(");
      getItem().describe(buf);
      describeRepeat(buf, getRepeat());
      buf.append(')');
    }
  }

  /** A loop over an item that is passed at least once. */
  @AutoValue
  public abstract static class OneOrMore extends Element {
    public abstract Element getItem();

    public abstract Element getRepeat();

    @Override
    public Type type() {
      return Type.ONE_OR_MORE;
    }

    @Override
    void describe(StringBuilder buf) {
      buf.append("OneOrMore(");
      getItem().describe(buf);
      describeRepeat(buf, getRepeat());
      buf.append(')');
    }
  }

  /** An item framed by a box with an optional caption. */
  @AutoValue
  public abstract static class Group extends Element {
    public abstract Element getItem();

    @Nullable
    public abstract String getText();

    @Override
    public Type type() {
      return Type.GROUP;
    }

    @Override
    void describe(StringBuilder buf) {
      buf.append("Group(");
      getItem().describe(buf);
      if (getText() != null) {
        buf.append(", ").append(getText());
      }
      buf.append(')');
    }
  }

  /** An item the layout engine must not merge with its neighbours. */
  @AutoValue
  public abstract static class Barrier extends Element {
    public abstract Element getItem();

    @Override
    public Type type() {
      return Type.BARRIER;
    }

    @Override
    void describe(StringBuilder buf) {
      buf.append("Barrier(");
      getItem().describe(buf);
      buf.append(')');
    }
  }

  private static void describeAll(
      StringBuilder buf, String prefix, String separator, List<Element> items) {
    buf.append(prefix);
    buf.append(items.stream().map(Element::toString).collect(joining(separator)));
    buf.append(')');
  }

  private static void describeRepeat(StringBuilder buf, Element repeat) {
    if (repeat.type() != Type.SKIP) {
      buf.append(", repeat=");
      repeat.describe(buf);
    }
  }
}
