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

package net.syntaxdoc.model;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;
import net.syntaxdoc.events.Diagnostic;
import net.syntaxdoc.events.DiagnosticHandler;

/**
 * Loads grammars of one dialect into {@link Model}s.
 *
 * <p>Loading never fails: a missing file or a grammar with syntax errors yields an empty (or
 * partially populated) model, and the problems are reported to the provider's {@link
 * DiagnosticHandler}. Models loaded from files are cached by absolute path, so loading the same
 * file twice returns the same instance.
 */
public abstract class ModelProvider {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final DiagnosticHandler diagnosticHandler;

  // Guarded by this.
  private final Map<Path, GrammarModel> modelsByPath = new HashMap<>();

  protected ModelProvider(DiagnosticHandler diagnosticHandler) {
    this.diagnosticHandler = diagnosticHandler;
  }

  /** Returns the file extensions of this dialect, including the leading period. */
  public abstract ImmutableSet<String> supportedExtensions();

  /**
   * Parses {@code text} and adds its declarations to {@code model}.
   *
   * @param firstLine the line number of the first line of {@code text} in {@code model}'s file
   */
  protected abstract void populate(
      GrammarModel model, String text, int firstLine, LoadingOptions options);

  public DiagnosticHandler getDiagnosticHandler() {
    return diagnosticHandler;
  }

  /** Returns whether this provider parses the given file. By default, checks the extension. */
  public boolean canHandle(Path path) {
    return supportedExtensions().contains(extension(path));
  }

  /**
   * Loads the grammar in {@code path}, or returns the model loaded earlier for the same file.
   *
   * <p>Loaders call this recursively for imported grammars; the model is cached before it is
   * populated, so cyclic imports terminate.
   */
  public synchronized Model fromFile(Path path, LoadingOptions options) {
    Path key = path.toAbsolutePath().normalize();
    GrammarModel model = modelsByPath.get(key);
    if (model != null) {
      return model;
    }
    model = GrammarModel.create(this, key, stem(key));
    modelsByPath.put(key, model);

    String text;
    try {
      text = MoreFiles.asCharSource(key, StandardCharsets.UTF_8).read();
    } catch (IOException e) {
      report(Diagnostic.error(null, "can't read grammar %s: %s", key, describe(e)));
      model.freeze();
      return model;
    }
    logger.atFine().log("loading %s", key);
    populate(model, text, 1, options);
    model.freeze();
    return model;
  }

  /**
   * Loads a grammar snippet embedded in another document. The result is not cached.
   *
   * @param documentPath the embedding document, used in positions
   * @param firstLine the line of the document at which the snippet starts
   */
  public Model fromText(String text, Path documentPath, int firstLine, LoadingOptions options) {
    GrammarModel model = GrammarModel.createInMemory(this, documentPath, "<in-memory>");
    populate(model, text, firstLine, options);
    model.freeze();
    return model;
  }

  /**
   * Loads a grammar by name, trying every supported extension in {@code basePath}.
   *
   * <p>Used to load a root rule declared in another grammar, e.g. to document only the tokens a
   * parser uses. Returns null and reports an error if no candidate file exists.
   */
  @Nullable
  public Model fromName(Path basePath, String name, LoadingOptions options) {
    ImmutableList<Path> candidates =
        supportedExtensions().stream()
            .sorted()
            .map(extension -> basePath.resolve(name + extension))
            .collect(ImmutableList.toImmutableList());
    for (Path candidate : candidates) {
      if (Files.isRegularFile(candidate)) {
        return fromFile(candidate, options);
      }
    }
    report(
        Diagnostic.error(
            null,
            "can't find grammar '%s': file not found\n  Tried files:\n    %s",
            name,
            Joiner.on("\n    ").join(candidates)));
    return null;
  }

  protected final void report(Diagnostic diagnostic) {
    diagnosticHandler.handle(diagnostic);
  }

  static String extension(Path path) {
    String fileName = path.getFileName() == null ? "" : path.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    return dot <= 0 ? "" : fileName.substring(dot);
  }

  static String stem(Path path) {
    String fileName = path.getFileName() == null ? "" : path.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    return dot <= 0 ? fileName : fileName.substring(0, dot);
  }

  private static String describe(IOException e) {
    return e instanceof NoSuchFileException ? "file not found" : e.getMessage();
  }
}
