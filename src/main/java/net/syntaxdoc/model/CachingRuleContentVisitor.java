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

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * A {@link RuleContentVisitor} that remembers the value computed for every node.
 *
 * <p>Since nodes are interned, the same node is often reachable from many parents; the cache is
 * keyed by node identity. Computed values must not depend on mutable visitor state, or that state
 * must be irrelevant to cached nodes.
 */
public abstract class CachingRuleContentVisitor<T> extends RuleContentVisitor<T> {

  private final Map<RuleContent, T> cache = new IdentityHashMap<>();

  @Override
  public T visit(RuleContent content) {
    // Not computeIfAbsent: visiting a node recursively visits (and caches) its children.
    T result = cache.get(content);
    if (result == null) {
      result = content.accept(this);
      cache.put(content, result);
    }
    return result;
  }
}
