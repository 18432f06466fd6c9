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

import net.syntaxdoc.antlr4.Antlr4ModelProvider;
import net.syntaxdoc.bison.BisonModelProvider;
import net.syntaxdoc.events.DiagnosticHandler;
import net.syntaxdoc.model.ProviderRegistry;

/** Creates registries that know the grammar dialects supported out of the box. */
public final class BuiltinProviders {

  private BuiltinProviders() {}

  /** Returns a registry with the ANTLR4 and Bison providers, reporting to {@code handler}. */
  public static ProviderRegistry createRegistry(DiagnosticHandler handler) {
    ProviderRegistry registry = new ProviderRegistry();
    registry.register(new Antlr4ModelProvider(handler));
    registry.register(new BisonModelProvider(handler));
    return registry;
  }
}
