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

package net.syntaxdoc.docgen;

import com.google.auto.value.AutoValue;
import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.nio.file.Path;
import java.util.List;
import javax.annotation.Nullable;
import net.syntaxdoc.diagram.DiagramJson;
import net.syntaxdoc.diagram.Element;
import net.syntaxdoc.diagram.EndClass;
import net.syntaxdoc.model.DocLine;
import net.syntaxdoc.model.LexerRule;
import net.syntaxdoc.model.RuleBase;
import net.syntaxdoc.model.Section;

/**
 * The documentation of one grammar, ready to be laid out by a documentation pipeline: grammar
 * docs, then section headers and rules in documentation order.
 */
@AutoValue
public abstract class GrammarDocumentation {

  private static final Gson GSON =
      new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();

  /** A section header or a documented rule. */
  public abstract static class Entry {
    Entry() {}
  }

  /** Documentation of a {@code ///} section, emitted before the first rule of the section. */
  @AutoValue
  public abstract static class SectionHeader extends Entry {
    public abstract Section section();

    static SectionHeader create(Section section) {
      return new AutoValue_GrammarDocumentation_SectionHeader(section);
    }
  }

  /** A documented rule. */
  @AutoValue
  public abstract static class RuleEntry extends Entry {
    public abstract RuleBase rule();

    /** The name other documents link to, {@code grammar.rule}. */
    public abstract String fullName();

    /** The name shown instead of the rule name, or null to show the rule name. */
    @Nullable
    public abstract String displayName();

    public abstract ImmutableList<DocLine> documentation();

    /** The rule's diagram, or null if no diagram is drawn. */
    @Nullable
    public abstract Element diagram();

    public abstract EndClass endClass();

    static RuleEntry create(
        RuleBase rule,
        @Nullable String displayName,
        @Nullable Element diagram,
        EndClass endClass) {
      return new AutoValue_GrammarDocumentation_RuleEntry(
          rule, rule.getFullName(), displayName, rule.getDocumentation(), diagram, endClass);
    }
  }

  public abstract String grammarName();

  public abstract Path path();

  public abstract ImmutableList<DocLine> grammarDocs();

  /** Names of the directly imported grammars. */
  public abstract ImmutableList<String> imports();

  public abstract ImmutableList<Entry> entries();

  static GrammarDocumentation create(
      String grammarName,
      Path path,
      List<DocLine> grammarDocs,
      List<String> imports,
      List<Entry> entries) {
    return new AutoValue_GrammarDocumentation(
        grammarName,
        path,
        ImmutableList.copyOf(grammarDocs),
        ImmutableList.copyOf(imports),
        ImmutableList.copyOf(entries));
  }

  /** Returns the documented rules, in order. */
  public ImmutableList<RuleEntry> rules() {
    return entries().stream()
        .filter(RuleEntry.class::isInstance)
        .map(RuleEntry.class::cast)
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the names that cross references may target: the grammar, then every rule. */
  public ImmutableList<String> xrefTargets() {
    ImmutableList.Builder<String> targets = ImmutableList.builder();
    targets.add(grammarName());
    for (RuleEntry rule : rules()) {
      targets.add(rule.fullName());
    }
    return targets.build();
  }

  public String toJson() {
    return GSON.toJson(toJsonTree());
  }

  public JsonObject toJsonTree() {
    JsonObject json = new JsonObject();
    json.addProperty("name", grammarName());
    json.addProperty("path", path().toString());
    json.add("docs", docs(grammarDocs()));
    JsonArray imports = new JsonArray();
    imports().forEach(imports::add);
    json.add("imports", imports);

    JsonArray entries = new JsonArray();
    for (Entry entry : entries()) {
      JsonObject item = new JsonObject();
      if (entry instanceof SectionHeader header) {
        item.add("section", docs(header.section().getDocs()));
      } else {
        RuleEntry rule = (RuleEntry) entry;
        item.addProperty("rule", rule.rule().getName());
        item.addProperty("full_name", rule.fullName());
        item.addProperty("kind", rule.rule() instanceof LexerRule ? "lexer" : "parser");
        if (rule.displayName() != null) {
          item.addProperty("display_name", rule.displayName());
        }
        item.add("docs", docs(rule.documentation()));
        if (rule.diagram() != null) {
          item.add("diagram", DiagramJson.toJsonTree(rule.diagram()));
          item.addProperty("end_class", Ascii.toLowerCase(rule.endClass().name()));
        }
      }
      entries.add(item);
    }
    json.add("entries", entries);

    JsonArray targets = new JsonArray();
    xrefTargets().forEach(targets::add);
    json.add("xref_targets", targets);
    return json;
  }

  private static JsonArray docs(List<DocLine> lines) {
    JsonArray array = new JsonArray();
    for (DocLine line : lines) {
      JsonObject item = new JsonObject();
      item.addProperty("line", line.line());
      item.addProperty("text", line.text());
      array.add(item);
    }
    return array;
  }
}
