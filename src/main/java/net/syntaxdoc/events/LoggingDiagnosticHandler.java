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

import com.google.common.flogger.GoogleLogger;

/** Forwards diagnostics to the log. This is the handler used when none is given. */
public final class LoggingDiagnosticHandler implements DiagnosticHandler {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  public static final LoggingDiagnosticHandler INSTANCE = new LoggingDiagnosticHandler();

  private LoggingDiagnosticHandler() {}

  @Override
  public void handle(Diagnostic diagnostic) {
    switch (diagnostic.kind()) {
      case ERROR -> logger.atSevere().log("%s", diagnostic);
      case WARNING -> logger.atWarning().log("%s", diagnostic);
    }
  }
}
