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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** Stores diagnostics in memory and optionally passes them on to another handler. */
public final class CollectingDiagnosticHandler implements DiagnosticHandler {

  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private final DiagnosticHandler delegate;

  public CollectingDiagnosticHandler() {
    this(diagnostic -> {});
  }

  public CollectingDiagnosticHandler(DiagnosticHandler delegate) {
    this.delegate = delegate;
  }

  @Override
  public synchronized void handle(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
    delegate.handle(diagnostic);
  }

  public synchronized ImmutableList<Diagnostic> getDiagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  public synchronized boolean hasErrors() {
    return diagnostics.stream().anyMatch(d -> d.kind() == Diagnostic.Kind.ERROR);
  }

  /** Returns the messages of all diagnostics, in the order they were reported. */
  public synchronized ImmutableList<String> getMessages() {
    return diagnostics.stream().map(Diagnostic::message).collect(ImmutableList.toImmutableList());
  }

  public synchronized void clear() {
    diagnostics.clear();
  }
}
