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
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import javax.annotation.Nullable;
import net.syntaxdoc.model.LineBreak;

/**
 * Writes diagram trees as JSON for an external layout engine.
 *
 * <p>The output uses the mapping form of the {@link DiagramLoader} description language, so a
 * written diagram can be read back.
 */
public final class DiagramJson {

  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  private DiagramJson() {}

  public static String toJson(Element element) {
    return GSON.toJson(toJsonTree(element));
  }

  public static JsonElement toJsonTree(Element element) {
    JsonObject json = new JsonObject();
    switch (element.type()) {
      case SKIP -> {
        return JsonNull.INSTANCE;
      }
      case TERMINAL, NON_TERMINAL, COMMENT -> {
        Element.TextElement text = (Element.TextElement) element;
        json.addProperty(key(element.type()), text.getText());
        addIfPresent(json, "href", text.getHref());
        addIfPresent(json, "css_class", text.getCssClass());
        if (text.isTextWeak()) {
          json.addProperty("text_is_weak", true);
        }
      }
      case SEQUENCE -> {
        Element.Sequence sequence = (Element.Sequence) element;
        json.add("sequence", array(sequence.getItems()));
        JsonArray linebreaks = new JsonArray();
        for (LineBreak linebreak : sequence.getLinebreaks()) {
          linebreaks.add(Ascii.toLowerCase(linebreak.name()));
        }
        json.add("linebreaks", linebreaks);
      }
      case STACK -> json.add("stack", array(((Element.Stack) element).getItems()));
      case CHOICE -> {
        Element.Choice choice = (Element.Choice) element;
        json.add("choice", array(choice.getItems()));
        json.addProperty("default", choice.getDefaultIndex());
      }
      case OPTIONAL -> {
        Element.Optional optional = (Element.Optional) element;
        json.add("optional", toJsonTree(optional.getItem()));
        json.addProperty("skip", optional.isSkip());
      }
      case ZERO_OR_MORE -> {
        Element.ZeroOrMore loop = (Element.ZeroOrMore) element;
        json.add("zero_or_more", toJsonTree(loop.getItem()));
        json.add("repeat", toJsonTree(loop.getRepeat()));
        json.addProperty("skip", loop.isSkip());
      }
      case ONE_OR_MORE -> {
        Element.OneOrMore loop = (Element.OneOrMore) element;
        json.add("one_or_more", toJsonTree(loop.getItem()));
        json.add("repeat", toJsonTree(loop.getRepeat()));
      }
      case GROUP -> {
        Element.Group group = (Element.Group) element;
        json.add("group", toJsonTree(group.getItem()));
        addIfPresent(json, "text", group.getText());
      }
      case BARRIER -> json.add("barrier", toJsonTree(((Element.Barrier) element).getItem()));
    }
    return json;
  }

  private static String key(Element.Type type) {
    return Ascii.toLowerCase(type.name());
  }

  private static JsonArray array(Iterable<Element> items) {
    JsonArray array = new JsonArray();
    for (Element item : items) {
      array.add(toJsonTree(item));
    }
    return array;
  }

  private static void addIfPresent(JsonObject json, String key, @Nullable String value) {
    if (value != null) {
      json.addProperty(key, value);
    }
  }
}
