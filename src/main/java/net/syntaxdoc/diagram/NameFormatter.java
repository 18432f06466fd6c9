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
import java.util.regex.Pattern;

/** Converts rule names for display. */
public final class NameFormatter {

  // A dash goes in place of an underscore, or at an inner position where:
  // case gets lower (XMLTag -> XML-Tag), a letter meets a non-letter (HTTP20 -> HTTP-20),
  // or a non-uppercase character meets an uppercase one (TagXML -> Tag-XML).
  private static final Pattern DASH_POSITION =
      Pattern.compile(
          "_|(?<=.)(?:(?<=[A-Z])(?=[A-Z][a-z])|(?<=[a-zA-Z])(?![a-zA-Z_])|(?<![A-Z_])(?=[A-Z]))"
              + "(?=.)");

  private NameFormatter() {}

  /**
   * Converts a {@code CamelCase} or {@code snake_case} identifier to {@code dash-case}. Assumes
   * ASCII input.
   */
  public static String toDashCase(String name) {
    return Ascii.toLowerCase(DASH_POSITION.matcher(name).replaceAll("-"));
  }
}
