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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * The dialect providers known to a documentation build. Populated once at startup, read-only
 * afterwards; the lock only guards against accidental concurrent use.
 */
public final class ProviderRegistry {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Object lock = new Object();
  private final List<ModelProvider> providers = new ArrayList<>();

  public void register(ModelProvider provider) {
    synchronized (lock) {
      providers.add(provider);
    }
    logger.atFine().log(
        "registered %s for %s",
        provider.getClass().getSimpleName(),
        provider.supportedExtensions());
  }

  public ImmutableList<ModelProvider> all() {
    synchronized (lock) {
      return ImmutableList.copyOf(providers);
    }
  }

  /** Returns the first registered provider that can parse {@code path}, or null. */
  @Nullable
  public ModelProvider find(Path path) {
    for (ModelProvider provider : all()) {
      if (provider.canHandle(path)) {
        return provider;
      }
    }
    return null;
  }
}
