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

package net.syntaxdoc.events;

import static com.google.common.truth.Truth.assertThat;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.syntaxdoc.model.Position;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Diagnostic} and {@link CollectingDiagnosticHandler}. */
@RunWith(JUnit4.class)
public class DiagnosticTest {

  @Test
  public void testFormatting() {
    Diagnostic error = Diagnostic.error(Position.create(Path.of("/a/G.g4"), 12), "bad %s", "rule");
    assertThat(error.kind()).isEqualTo(Diagnostic.Kind.ERROR);
    assertThat(error.message()).isEqualTo("bad rule");
    assertThat(error.toString()).isEqualTo("/a/G.g4:12: bad rule");

    Diagnostic warning = Diagnostic.warning(null, "can't read %s", "x");
    assertThat(warning.kind()).isEqualTo(Diagnostic.Kind.WARNING);
    assertThat(warning.position()).isNull();
    assertThat(warning.toString()).isEqualTo("<no location>: can't read x");
  }

  @Test
  public void testCollectingHandler() {
    List<Diagnostic> forwarded = new ArrayList<>();
    CollectingDiagnosticHandler handler = new CollectingDiagnosticHandler(forwarded::add);
    assertThat(handler.hasErrors()).isFalse();

    handler.handle(Diagnostic.warning(null, "first"));
    assertThat(handler.hasErrors()).isFalse();
    handler.handle(Diagnostic.error(null, "second"));
    assertThat(handler.hasErrors()).isTrue();
    assertThat(handler.getMessages()).containsExactly("first", "second").inOrder();
    assertThat(forwarded).isEqualTo(handler.getDiagnostics());

    handler.clear();
    assertThat(handler.getDiagnostics()).isEmpty();
    assertThat(handler.hasErrors()).isFalse();
  }
}
