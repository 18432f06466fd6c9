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

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.FormatMethod;
import javax.annotation.Nullable;
import net.syntaxdoc.model.Position;

/**
 * A problem found in untrusted input: grammar text, documentation comments, inline diagrams or
 * configuration. Diagnostics never abort processing; the offending construct is skipped.
 */
@AutoValue
public abstract class Diagnostic {

  /** Severity of a diagnostic. */
  public enum Kind {
    ERROR,
    WARNING,
  }

  public abstract Kind kind();

  /** Where the problem is, or null if it has no source location (e.g. a missing file). */
  @Nullable
  public abstract Position position();

  public abstract String message();

  public static Diagnostic create(Kind kind, @Nullable Position position, String message) {
    return new AutoValue_Diagnostic(kind, position, message);
  }

  @FormatMethod
  public static Diagnostic error(@Nullable Position position, String format, Object... args) {
    return create(Kind.ERROR, position, String.format(format, args));
  }

  @FormatMethod
  public static Diagnostic warning(@Nullable Position position, String format, Object... args) {
    return create(Kind.WARNING, position, String.format(format, args));
  }

  @Override
  public final String toString() {
    String location = position() == null ? "<no location>" : position().toString();
    return location + ": " + message();
  }
}
