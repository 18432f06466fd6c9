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
import javax.annotation.Nullable;
import net.syntaxdoc.diagram.LiteralRendering;
import net.syntaxdoc.model.LoadingOptions;

/**
 * Options controlling which rules of a grammar are documented, in which order, and how their
 * diagrams are drawn.
 *
 * <p>Options are immutable. A nested documentation block derives its options from the enclosing
 * block's with {@link #toBuilder}.
 */
@AutoValue
public abstract class DocumentationOptions {

  public static final DocumentationOptions DEFAULT = builder().build();

  /** How lexer rules and parser rules are interleaved. */
  public enum Grouping {
    MIXED,
    LEXER_FIRST,
    PARSER_FIRST;

    public static Grouping fromString(String value) {
      return parseEnum(Grouping.class, value);
    }

    @Override
    public String toString() {
      return dashed(this);
    }
  }

  /** The order of rules within a group. */
  public enum Ordering {
    BY_SOURCE,
    BY_NAME;

    public static Ordering fromString(String value) {
      return parseEnum(Ordering.class, value);
    }

    @Override
    public String toString() {
      return dashed(this);
    }
  }

  public abstract Grouping grouping();

  public abstract Ordering ordering();

  public abstract LiteralRendering literalRendering();

  public abstract boolean lexerRules();

  public abstract boolean parserRules();

  /** Whether lexer fragments are documented. */
  public abstract boolean fragments();

  /** Whether rules without documentation comments are documented. */
  public abstract boolean undocumented();

  /** Whether {@code ///} section headers are emitted. Only applies to source ordering. */
  public abstract boolean honorSections();

  public abstract boolean diagrams();

  /** Whether rule names are shown in dash-case, e.g. {@code SELECT_STMT} as {@code select-stmt}. */
  public abstract boolean ccToDash();

  /**
   * Whether the diagram of the root rule ends with {@link
   * net.syntaxdoc.diagram.EndClass#COMPLEX}.
   */
  public abstract boolean markRootRule();

  public abstract boolean bisonCCharLiterals();

  /**
   * Restricts documentation to the rules reachable from this rule. Written as {@code rule}, {@code
   * grammar.rule} or {@code path/to/grammar.g4 rule}.
   */
  @Nullable
  public abstract String rootRule();

  public LoadingOptions loadingOptions() {
    return LoadingOptions.builder().useCCharLiterals(bisonCCharLiterals()).build();
  }

  public static Builder builder() {
    return new AutoValue_DocumentationOptions.Builder()
        .grouping(Grouping.PARSER_FIRST)
        .ordering(Ordering.BY_SOURCE)
        .literalRendering(LiteralRendering.CONTENTS)
        .lexerRules(true)
        .parserRules(true)
        .fragments(false)
        .undocumented(false)
        .honorSections(true)
        .diagrams(true)
        .ccToDash(false)
        .markRootRule(true)
        .bisonCCharLiterals(true);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link DocumentationOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder grouping(Grouping value);

    public abstract Builder ordering(Ordering value);

    public abstract Builder literalRendering(LiteralRendering value);

    public abstract Builder lexerRules(boolean value);

    public abstract Builder parserRules(boolean value);

    public abstract Builder fragments(boolean value);

    public abstract Builder undocumented(boolean value);

    public abstract Builder honorSections(boolean value);

    public abstract Builder diagrams(boolean value);

    public abstract Builder ccToDash(boolean value);

    public abstract Builder markRootRule(boolean value);

    public abstract Builder bisonCCharLiterals(boolean value);

    public abstract Builder rootRule(@Nullable String value);

    public abstract DocumentationOptions build();
  }

  private static String dashed(Enum<?> value) {
    return Ascii.toLowerCase(value.name()).replace('_', '-');
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
    for (E constant : type.getEnumConstants()) {
      if (constant.toString().equals(value)) {
        return constant;
      }
    }
    throw new IllegalArgumentException(
        String.format("invalid %s '%s'", Ascii.toLowerCase(type.getSimpleName()), value));
  }
}
