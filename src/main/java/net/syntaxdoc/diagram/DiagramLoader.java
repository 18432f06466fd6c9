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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.syntaxdoc.model.LineBreak;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads free-standing diagram descriptions written in YAML (or JSON, which is valid YAML).
 *
 * <p>The description language:
 *
 * <ul>
 *   <li>{@code null} (or an empty document) is the empty path;
 *   <li>a string is a terminal;
 *   <li>a list is a sequence;
 *   <li>a mapping has exactly one element key, one of {@code terminal}, {@code non_terminal},
 *       {@code comment}, {@code sequence}, {@code stack}, {@code choice}, {@code optional}, {@code
 *       zero_or_more}, {@code one_or_more}, {@code group}, {@code barrier} or {@code skip}, plus
 *       attributes: {@code href}, {@code css_class} and {@code text_is_weak} for text boxes,
 *       {@code linebreaks} for sequences, {@code default} for choices, {@code skip} for optionals
 *       and loops, {@code repeat} for loops, {@code text} for groups.
 * </ul>
 *
 * <p>For example:
 *
 * <pre>
 * - terminal: "select"
 *   css_class: keyword
 * - one_or_more: {non_terminal: column, href: sql.column}
 *   repeat: ","
 * - optional: [where, {non_terminal: condition}]
 * </pre>
 */
public final class DiagramLoader {

  private static final ImmutableSet<String> ELEMENT_KEYS =
      ImmutableSet.of(
          "terminal",
          "non_terminal",
          "comment",
          "sequence",
          "stack",
          "choice",
          "optional",
          "zero_or_more",
          "one_or_more",
          "group",
          "barrier",
          "skip");

  private DiagramLoader() {}

  /** Parses a diagram description. */
  public static Element load(String description) throws DiagramLoadException {
    Object data;
    try {
      data = new Yaml(new SafeConstructor(new LoaderOptions())).load(description);
    } catch (MarkedYAMLException e) {
      int line = e.getProblemMark() == null ? 0 : e.getProblemMark().getLine() + 1;
      throw new DiagramLoadException(
          line, "can't parse syntax diagram description: " + e.getProblem(), e);
    } catch (YAMLException e) {
      throw new DiagramLoadException(
          0, "can't parse syntax diagram description: " + e.getMessage(), e);
    }
    return toElement(data);
  }

  private static Element toElement(@Nullable Object data) throws DiagramLoadException {
    if (data == null) {
      return Element.skip();
    }
    if (data instanceof String || data instanceof Number || data instanceof Boolean) {
      return Element.terminal(String.valueOf(data));
    }
    if (data instanceof List<?> list) {
      return Element.sequence(toElements(list));
    }
    if (data instanceof Map<?, ?> map) {
      return mapToElement(map);
    }
    throw new DiagramLoadException("unexpected %s in diagram description", describe(data));
  }

  private static Element mapToElement(Map<?, ?> map) throws DiagramLoadException {
    ImmutableSet<String> keys = stringKeys(map);
    Sets.SetView<String> elementKeys = Sets.intersection(keys, ELEMENT_KEYS);
    if (elementKeys.size() != 1) {
      throw new DiagramLoadException(
          "a diagram element needs exactly one of the keys %s, got %s", ELEMENT_KEYS, keys);
    }
    String kind = elementKeys.iterator().next();
    Object value = map.get(kind);
    switch (kind) {
      case "terminal" -> {
        checkAttributes(map, kind, "href", "css_class", "text_is_weak");
        return Element.terminal(
            text(value, kind),
            optionalText(map, "href"),
            optionalText(map, "css_class"),
            flag(map, "text_is_weak"));
      }
      case "non_terminal" -> {
        checkAttributes(map, kind, "href", "css_class", "text_is_weak");
        return Element.nonTerminal(
            text(value, kind),
            optionalText(map, "href"),
            optionalText(map, "css_class"),
            flag(map, "text_is_weak"));
      }
      case "comment" -> {
        checkAttributes(map, kind, "href", "css_class");
        return Element.comment(
            text(value, kind), optionalText(map, "href"), optionalText(map, "css_class"));
      }
      case "sequence" -> {
        checkAttributes(map, kind, "linebreaks");
        ImmutableList<Element> items = toElements(list(value, kind));
        if (!map.containsKey("linebreaks")) {
          return Element.sequence(items);
        }
        ImmutableList.Builder<LineBreak> linebreaks = ImmutableList.builder();
        for (Object linebreak : list(map.get("linebreaks"), "linebreaks")) {
          linebreaks.add(lineBreak(linebreak));
        }
        try {
          return Element.sequence(items, linebreaks.build());
        } catch (IllegalArgumentException e) {
          throw new DiagramLoadException(0, e.getMessage(), e);
        }
      }
      case "stack" -> {
        checkAttributes(map, kind);
        return Element.stack(toElements(list(value, kind)));
      }
      case "choice" -> {
        checkAttributes(map, kind, "default");
        ImmutableList<Element> items = toElements(list(value, kind));
        int defaultIndex = map.containsKey("default") ? integer(map.get("default"), "default") : 0;
        if (items.isEmpty() || defaultIndex < 0 || defaultIndex >= items.size()) {
          throw new DiagramLoadException(
              "choice default %s is out of range for %s items", defaultIndex, items.size());
        }
        return Element.choice(defaultIndex, items);
      }
      case "optional" -> {
        checkAttributes(map, kind, "skip");
        return Element.optional(toElement(value), flag(map, "skip"));
      }
      case "zero_or_more" -> {
        checkAttributes(map, kind, "repeat", "skip");
        return Element.zeroOrMore(
            toElement(value), toElement(map.get("repeat")), flag(map, "skip"));
      }
      case "one_or_more" -> {
        checkAttributes(map, kind, "repeat");
        return Element.oneOrMore(toElement(value), toElement(map.get("repeat")));
      }
      case "group" -> {
        checkAttributes(map, kind, "text");
        return Element.group(toElement(value), optionalText(map, "text"));
      }
      case "barrier" -> {
        checkAttributes(map, kind);
        return Element.barrier(toElement(value));
      }
      default -> {
        checkAttributes(map, kind);
        return Element.skip();
      }
    }
  }

  private static ImmutableList<Element> toElements(List<?> items)
      throws DiagramLoadException {
    ImmutableList.Builder<Element> result = ImmutableList.builder();
    for (Object item : items) {
      result.add(toElement(item));
    }
    return result.build();
  }

  private static ImmutableSet<String> stringKeys(Map<?, ?> map) throws DiagramLoadException {
    ImmutableSet.Builder<String> keys = ImmutableSet.builder();
    for (Object key : map.keySet()) {
      if (!(key instanceof String name)) {
        throw new DiagramLoadException("unexpected key %s in diagram description", key);
      }
      keys.add(name);
    }
    return keys.build();
  }

  private static void checkAttributes(Map<?, ?> map, String kind, String... allowed)
      throws DiagramLoadException {
    ImmutableSet<String> allowedKeys =
        ImmutableSet.<String>builder().add(kind).add(allowed).build();
    for (Object key : map.keySet()) {
      if (!allowedKeys.contains(key)) {
        throw new DiagramLoadException("unexpected attribute '%s' for %s", key, kind);
      }
    }
  }

  private static String text(@Nullable Object value, String key) throws DiagramLoadException {
    if (value instanceof String || value instanceof Number || value instanceof Boolean) {
      return String.valueOf(value);
    }
    throw new DiagramLoadException("'%s' must be a string, got %s", key, describe(value));
  }

  @Nullable
  private static String optionalText(Map<?, ?> map, String key) throws DiagramLoadException {
    Object value = map.get(key);
    return value == null ? null : text(value, key);
  }

  private static List<?> list(@Nullable Object value, String key) throws DiagramLoadException {
    if (value == null) {
      return ImmutableList.of();
    }
    if (value instanceof List<?> list) {
      return list;
    }
    throw new DiagramLoadException("'%s' must be a list, got %s", key, describe(value));
  }

  private static int integer(@Nullable Object value, String key) throws DiagramLoadException {
    if (value instanceof Integer i) {
      return i;
    }
    throw new DiagramLoadException("'%s' must be an integer, got %s", key, describe(value));
  }

  private static boolean flag(Map<?, ?> map, String key) throws DiagramLoadException {
    Object value = map.get(key);
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    throw new DiagramLoadException("'%s' must be a boolean, got %s", key, describe(value));
  }

  private static LineBreak lineBreak(@Nullable Object value) throws DiagramLoadException {
    if (value instanceof String name) {
      for (LineBreak linebreak : LineBreak.values()) {
        if (Ascii.toLowerCase(linebreak.name()).equals(Ascii.toLowerCase(name))) {
          return linebreak;
        }
      }
    }
    throw new DiagramLoadException(
        "invalid line break %s, expected hard, soft, default or no_break", describe(value));
  }

  private static String describe(@Nullable Object value) {
    return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
  }
}
