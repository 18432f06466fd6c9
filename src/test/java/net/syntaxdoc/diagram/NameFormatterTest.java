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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link NameFormatter}. */
@RunWith(JUnit4.class)
public class NameFormatterTest {

  @Test
  public void testToDashCase() {
    assertThat(NameFormatter.toDashCase("simpleName")).isEqualTo("simple-name");
    assertThat(NameFormatter.toDashCase("XMLTag")).isEqualTo("xml-tag");
    assertThat(NameFormatter.toDashCase("TagXML")).isEqualTo("tag-xml");
    assertThat(NameFormatter.toDashCase("HTTP20")).isEqualTo("http-20");
    assertThat(NameFormatter.toDashCase("snake_case")).isEqualTo("snake-case");
    assertThat(NameFormatter.toDashCase("Tag_Name")).isEqualTo("tag-name");
    assertThat(NameFormatter.toDashCase("ID")).isEqualTo("id");
    assertThat(NameFormatter.toDashCase("x")).isEqualTo("x");
  }

  @Test
  public void testLiteralRenderingSpelling() {
    assertThat(LiteralRendering.fromString("contents-unquoted"))
        .isEqualTo(LiteralRendering.CONTENTS_UNQUOTED);
    assertThat(LiteralRendering.NAME.toString()).isEqualTo("name");
  }
}
