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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import net.syntaxdoc.model.Alternative;
import net.syntaxdoc.model.CachingRuleContentVisitor;
import net.syntaxdoc.model.CharSet;
import net.syntaxdoc.model.Doc;
import net.syntaxdoc.model.LexerRule;
import net.syntaxdoc.model.LineBreak;
import net.syntaxdoc.model.Literal;
import net.syntaxdoc.model.Negation;
import net.syntaxdoc.model.OnePlus;
import net.syntaxdoc.model.Range;
import net.syntaxdoc.model.Reference;
import net.syntaxdoc.model.RuleBase;
import net.syntaxdoc.model.RuleContent;
import net.syntaxdoc.model.Sequence;
import net.syntaxdoc.model.Wildcard;
import net.syntaxdoc.model.ZeroPlus;

/**
 * Converts rule bodies into syntax diagrams.
 *
 * <p>Besides the direct translation of every node kind, the renderer rewrites the body so that
 * diagrams stay compact:
 *
 * <ul>
 *   <li>recursive alternatives become loops: {@code e : e '+' t | t} is drawn as {@code t} followed
 *       by a loop, and {@code e : t '+' e | t} as a loop followed by {@code t};
 *   <li>alternatives share common leading and trailing elements: {@code x A | x B} is drawn as
 *       {@code x (A | B)}, and {@code A x | B x} as {@code (A | B) x};
 *   <li>a loop next to an unrolled copy of its body becomes a single one-or-more loop: {@code x y z
 *       (A B x y z)*} and {@code (x y z A B)* x y z} both become one loop over {@code x y z} that
 *       passes through {@code A B} between iterations.
 * </ul>
 *
 * <p>Empty branches never take part in recursion or factoring, and identical branches are drawn
 * once. A sequence that folds down to a single item is returned as that item, so callers can't
 * rely on a {@link Element.Sequence} wrapper around the diagram.
 *
 * <p>A renderer has no mutable state and may render any number of rules. Importance and element
 * caches live only for the duration of a single {@link #render} call.
 */
public final class DiagramRenderer {

  private final LiteralRendering literalRendering;
  private final boolean ccToDash;

  public DiagramRenderer(LiteralRendering literalRendering, boolean ccToDash) {
    this.literalRendering = Preconditions.checkNotNull(literalRendering);
    this.ccToDash = ccToDash;
  }

  /**
   * Renders the body of {@code rule}.
   *
   * @throws IllegalArgumentException if the rule has no body
   */
  public Element render(RuleBase rule) {
    return new Renderer().render(rule);
  }

  /** Rendering state of a single diagram. */
  private final class Renderer extends CachingRuleContentVisitor<Element> {

    // Rules being rendered. Inline rules on this path are not expanded again.
    private final Set<RuleBase> path = Sets.newIdentityHashSet();
    private final ImportanceProvider importanceProvider = new ImportanceProvider();

    Element render(RuleBase rule) {
      checkArgument(rule.getContent() != null, "rule %s has no body", rule.getName());
      path.add(rule);
      try {
        return foldRecursion(rule);
      } finally {
        path.remove(rule);
      }
    }

    // ==== Recursion folding ====

    private Element foldRecursion(RuleBase rule) {
      if (!(rule.getContent() instanceof Alternative alternative)
          || rule.isKeepDiagramRecursive()) {
        return visit(rule.getContent());
      }
      List<RuleContent> branches = alternative.getChildren();
      Set<Integer> leftRecursive = new HashSet<>();
      Set<Integer> rightRecursive = new HashSet<>();
      for (int i = 0; i < branches.size(); i++) {
        if (branches.get(i) instanceof Sequence sequence && !sequence.getChildren().isEmpty()) {
          List<RuleContent> children = sequence.getChildren();
          if (refersTo(children.get(0), rule)) {
            leftRecursive.add(i);
          } else if (refersTo(children.get(children.size() - 1), rule)) {
            rightRecursive.add(i);
          }
        }
      }

      boolean isLeftRecursive;
      if (!leftRecursive.isEmpty() && leftRecursive.size() >= rightRecursive.size()) {
        isLeftRecursive = true;
      } else if (!rightRecursive.isEmpty()) {
        isLeftRecursive = false;
      } else {
        return visit(factorAlternative(branches));
      }

      Set<Integer> recursiveIndices = isLeftRecursive ? leftRecursive : rightRecursive;
      List<RuleContent> recursive = new ArrayList<>();
      List<RuleContent> normal = new ArrayList<>();
      for (int i = 0; i < branches.size(); i++) {
        if (!recursiveIndices.contains(i)) {
          normal.add(branches.get(i));
          continue;
        }
        Sequence sequence = (Sequence) branches.get(i);
        List<RuleContent> children = sequence.getChildren();
        List<LineBreak> linebreaks = sequence.getLinebreaks();
        int n = children.size();
        recursive.add(
            isLeftRecursive
                ? Sequence.of(children.subList(1, n), linebreaks.subList(1, n - 1))
                : Sequence.of(children.subList(0, n - 1), linebreaks.subList(0, n - 2)));
      }

      RuleContent loop = ZeroPlus.of(factorAlternative(recursive));
      RuleContent rest = factorAlternative(normal);
      return visit(isLeftRecursive ? Sequence.of(rest, loop) : Sequence.of(loop, rest));
    }

    private boolean refersTo(RuleContent content, RuleBase rule) {
      return content instanceof Reference reference && reference.getReference() == rule;
    }

    // ==== Alternative factoring ====

    private RuleContent factorAlternative(List<RuleContent> children) {
      // Nodes are interned, so equal branches are the same object.
      children = new ArrayList<>(new LinkedHashSet<>(children));
      if (children.size() > 1) {
        children = factorEnds(children, /* leading= */ true);
      }
      if (children.size() > 1) {
        children = factorEnds(children, /* leading= */ false);
      }
      return Alternative.of(children);
    }

    // Groups branches by their first (or last) element. Every group of two or more branches is
    // replaced, at the position of its first branch, by the shared element followed (or preceded)
    // by the factored alternative of the remainders. Empty branches are never grouped.
    private List<RuleContent> factorEnds(List<RuleContent> children, boolean leading) {
      Map<RuleContent, List<Integer>> groups = new LinkedHashMap<>();
      boolean shared = false;
      for (int i = 0; i < children.size(); i++) {
        RuleContent end = end(children.get(i), leading);
        if (end == Sequence.EMPTY) {
          continue;
        }
        List<Integer> group = groups.computeIfAbsent(end, k -> new ArrayList<>());
        group.add(i);
        shared |= group.size() > 1;
      }
      if (!shared) {
        return children;
      }

      List<RuleContent> result = new ArrayList<>();
      for (int i = 0; i < children.size(); i++) {
        RuleContent end = end(children.get(i), leading);
        List<Integer> group = groups.get(end);
        if (group == null || group.size() == 1) {
          result.add(children.get(i));
          continue;
        }
        if (group.get(0) != i) {
          continue;
        }
        List<RuleContent> remainders = new ArrayList<>();
        for (int j : group) {
          remainders.add(stripEnd(children.get(j), leading));
        }
        RuleContent remainder = factorAlternative(remainders);
        result.add(leading ? Sequence.of(end, remainder) : Sequence.of(remainder, end));
      }
      return result;
    }

    private RuleContent end(RuleContent branch, boolean leading) {
      if (branch instanceof Sequence sequence && !sequence.getChildren().isEmpty()) {
        List<RuleContent> children = sequence.getChildren();
        return leading ? children.get(0) : children.get(children.size() - 1);
      }
      return branch;
    }

    private RuleContent stripEnd(RuleContent branch, boolean leading) {
      if (!(branch instanceof Sequence sequence) || sequence.getChildren().isEmpty()) {
        return Sequence.EMPTY;
      }
      List<RuleContent> children = sequence.getChildren();
      List<LineBreak> linebreaks = sequence.getLinebreaks();
      int n = children.size();
      return leading
          ? Sequence.of(children.subList(1, n), linebreaks.subList(1, n - 1))
          : Sequence.of(children.subList(0, n - 1), linebreaks.subList(0, n - 2));
    }

    // ==== Sequence folding ====

    @Override
    public Element visitSequence(Sequence node) {
      return foldSequence(Part.allOf(node.getChildren()), new ArrayList<>(node.getLinebreaks()));
    }

    private Element foldSequence(List<Part> seq, List<LineBreak> linebreaks) {
      if (seq.isEmpty()) {
        return Element.skip();
      }

      // x y z (A B x y z)* -> OneOrMore(x y z, repeat=A B)
      for (int i = seq.size() - 1; i >= 0; i--) {
        if (!(seq.get(i).content instanceof ZeroPlus star)) {
          continue;
        }
        List<RuleContent> nested = childrenOf(star.getChild());
        List<LineBreak> nestedLinebreaks = linebreaksOf(star.getChild());
        int n = nested.size();

        int seqStart = i - n;
        int nestedStart = 0;
        for (int j = n - 1; j >= 0; j--) {
          int k = i + j - n;
          if (k < 0 || seq.get(k).content != nested.get(j)) {
            seqStart = k + 1;
            nestedStart = j + 1;
            break;
          }
        }
        if (seqStart == i) {
          continue;
        }

        Element repeat =
            foldSequence(
                Part.allOf(nested.subList(0, nestedStart)),
                head(nestedLinebreaks, nestedStart - 1));
        Element main =
            foldSequence(
                Part.allOf(nested.subList(nestedStart, n)),
                tail(nestedLinebreaks, nestedStart));
        return foldSequence(
            replace(seq, seqStart, i + 1, Element.oneOrMore(main, repeat)),
            join(head(linebreaks, seqStart), tail(linebreaks, i)));
      }

      // (x y z A B)* x y z -> OneOrMore(x y z, repeat=A B)
      for (int i = 0; i < seq.size(); i++) {
        if (!(seq.get(i).content instanceof ZeroPlus star)) {
          continue;
        }
        List<RuleContent> nested = childrenOf(star.getChild());
        List<LineBreak> nestedLinebreaks = linebreaksOf(star.getChild());
        int n = nested.size();

        int seqEnd = i + n;
        int nestedEnd = n;
        for (int j = 0; j < n; j++) {
          int k = i + j + 1;
          if (k >= seq.size() || seq.get(k).content != nested.get(j)) {
            seqEnd = k - 1;
            nestedEnd = j;
            break;
          }
        }
        if (seqEnd == i) {
          continue;
        }

        Element main =
            foldSequence(
                Part.allOf(nested.subList(0, nestedEnd)), head(nestedLinebreaks, nestedEnd - 1));
        Element repeat =
            foldSequence(
                Part.allOf(nested.subList(nestedEnd, n)), tail(nestedLinebreaks, nestedEnd));
        return foldSequence(
            replace(seq, i, seqEnd + 1, Element.oneOrMore(main, repeat)),
            join(head(linebreaks, i), tail(linebreaks, seqEnd)));
      }

      List<Element> items = new ArrayList<>(seq.size());
      for (Part part : seq) {
        items.add(part.content != null ? visit(part.content) : part.element);
      }
      if (items.size() == 1) {
        return items.get(0);
      }
      return Element.sequence(items, linebreaks);
    }

    // ==== Leaves ====

    @Override
    public Element visitLiteral(Literal node) {
      return Element.terminal(unquote(node.getContent()), null, "literal", false);
    }

    @Override
    public Element visitRange(Range node) {
      return Element.terminal(node.toString(), null, "range", false);
    }

    @Override
    public Element visitCharSet(CharSet node) {
      return Element.terminal(node.getContent(), null, "charset", false);
    }

    @Override
    public Element visitWildcard(Wildcard node) {
      return Element.terminal(".", null, "wildcard", false);
    }

    @Override
    public Element visitNegation(Negation node) {
      return Element.terminal(node.toString(), null, "negation", false);
    }

    @Override
    public Element visitDoc(Doc node) {
      return Element.comment(node.getValue());
    }

    @Override
    public Element visitReference(Reference node) {
      RuleBase rule = node.getReference();
      if (rule == null) {
        // Dangling: guess from the spelling whether the name is a token.
        String name = node.getName();
        if (!name.isEmpty() && (Character.isUpperCase(name.charAt(0)) || name.startsWith("'"))) {
          String text = name.startsWith("'") && name.endsWith("'") ? unquote(name) : dash(name);
          return Element.terminal(text, null, null, true);
        }
        return Element.nonTerminal(dash(name), null, null, true);
      }
      if (rule.isInline() && rule.getContent() != null && !path.contains(rule)) {
        return render(rule);
      }
      String href = rule.getFullName();
      if (rule instanceof LexerRule lexerRule) {
        if (lexerRule.isLiteral() && literalRendering != LiteralRendering.NAME) {
          return Element.terminal(
              unquote(String.valueOf(rule.getContent())), href, rule.getCssClass(), false);
        }
        return Element.terminal(displayName(rule), href, rule.getCssClass(), true);
      }
      return Element.nonTerminal(displayName(rule), href, rule.getCssClass(), true);
    }

    @Override
    public Element visitZeroPlus(ZeroPlus node) {
      boolean skip = importanceProvider.visit(node.getChild()) == 0;
      return Element.zeroOrMore(visit(node.getChild()), Element.skip(), skip);
    }

    @Override
    public Element visitOnePlus(OnePlus node) {
      return Element.oneOrMore(visit(node.getChild()));
    }

    @Override
    public Element visitAlternative(Alternative node) {
      List<RuleContent> children = node.getChildren();
      int defaultIndex = 0;
      int maxImportance = Integer.MIN_VALUE;
      ImmutableList.Builder<Element> items = ImmutableList.builder();
      for (int i = 0; i < children.size(); i++) {
        int importance = importanceProvider.visit(children.get(i));
        if (importance > maxImportance) {
          maxImportance = importance;
          defaultIndex = i;
        }
        items.add(visit(children.get(i)));
      }
      return Element.choice(defaultIndex, items.build());
    }
  }

  private String displayName(RuleBase rule) {
    return rule.getDisplayName() != null ? rule.getDisplayName() : dash(rule.getName());
  }

  private String dash(String name) {
    return ccToDash ? NameFormatter.toDashCase(name) : name;
  }

  /**
   * Decodes a single-quoted literal and formats it per the literal rendering. Text that is not a
   * well-formed quoted literal is returned as is.
   */
  private String unquote(String text) {
    if (text.length() < 2 || !text.startsWith("'") || !text.endsWith("'")) {
      return text;
    }
    String decoded = decodeQuoted(text.substring(1, text.length() - 1));
    if (decoded == null) {
      return text;
    }
    return literalRendering == LiteralRendering.CONTENTS_UNQUOTED ? decoded : "'" + decoded + "'";
  }

  /** Processes the escapes of a quoted literal body; returns null if the body is malformed. */
  @Nullable
  static String decodeQuoted(String body) {
    StringBuilder buf = new StringBuilder(body.length());
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c == '\'' || c == '\n') {
        return null;
      }
      if (c != '\\') {
        buf.append(c);
        continue;
      }
      if (++i == body.length()) {
        return null;
      }
      char escape = body.charAt(i);
      switch (escape) {
        case 'n' -> buf.append('\n');
        case 't' -> buf.append('\t');
        case 'r' -> buf.append('\r');
        case 'b' -> buf.append('\b');
        case 'f' -> buf.append('\f');
        case '\\', '\'', '"' -> buf.append(escape);
        case 'u', 'x' -> {
          int digits = escape == 'u' ? 4 : 2;
          if (i + digits >= body.length()) {
            return null;
          }
          String hex = body.substring(i + 1, i + 1 + digits);
          try {
            buf.append((char) Integer.parseInt(hex, 16));
          } catch (NumberFormatException e) {
            return null;
          }
          i += digits;
        }
        default -> buf.append('\\').append(escape);
      }
    }
    return buf.toString();
  }

  // ==== Sequence folding helpers ====

  /** An item of a sequence being folded: rule content not rendered yet, or a finished element. */
  private static final class Part {
    @Nullable final RuleContent content;
    @Nullable final Element element;

    private Part(@Nullable RuleContent content, @Nullable Element element) {
      this.content = content;
      this.element = element;
    }

    static List<Part> allOf(List<RuleContent> contents) {
      List<Part> parts = new ArrayList<>(contents.size());
      for (RuleContent content : contents) {
        parts.add(new Part(content, null));
      }
      return parts;
    }
  }

  private static List<RuleContent> childrenOf(RuleContent content) {
    return content instanceof Sequence sequence
        ? sequence.getChildren()
        : ImmutableList.of(content);
  }

  private static List<LineBreak> linebreaksOf(RuleContent content) {
    return content instanceof Sequence sequence ? sequence.getLinebreaks() : ImmutableList.of();
  }

  private static List<Part> replace(List<Part> seq, int from, int to, Element element) {
    List<Part> result = new ArrayList<>(seq.subList(0, from));
    result.add(new Part(null, element));
    result.addAll(seq.subList(to, seq.size()));
    return result;
  }

  private static <T> List<T> head(List<T> list, int size) {
    return list.subList(0, Math.max(0, Math.min(size, list.size())));
  }

  private static <T> List<T> tail(List<T> list, int from) {
    return list.subList(Math.min(from, list.size()), list.size());
  }

  private static <T> List<T> join(List<T> first, List<T> second) {
    List<T> result = new ArrayList<>(first);
    result.addAll(second);
    return result;
  }
}
