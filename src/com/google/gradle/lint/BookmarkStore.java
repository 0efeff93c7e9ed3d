/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.gradle.lint;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.HashMap;
import java.util.Map;
import org.codehaus.groovy.ast.ASTNode;
import org.jspecify.annotations.Nullable;

/**
 * Nodes a rule remembers by label during one traversal, so that it can act on them once the whole
 * script has been seen. Each label keeps the {@link BookmarkPolicy} of its first write for the
 * lifetime of the store.
 */
public final class BookmarkStore {
  private final Map<String, ASTNode> nodes = new HashMap<>();
  private final Map<String, BookmarkPolicy> policies = new HashMap<>();

  /**
   * Writes a node under the label.
   *
   * @return true if the store now holds {@code node} under the label
   */
  public boolean put(String label, ASTNode node, BookmarkPolicy policy) {
    checkNotNull(node, "Cannot bookmark a null node under %s", label);
    BookmarkPolicy existing = policies.putIfAbsent(label, policy);
    checkState(
        existing == null || existing == policy,
        "Bookmark %s is %s and cannot be written as %s",
        label,
        existing,
        policy);
    if (policy == BookmarkPolicy.FIRST_WINS && nodes.containsKey(label)) {
      return false;
    }
    nodes.put(label, node);
    return true;
  }

  public @Nullable ASTNode get(String label) {
    return nodes.get(label);
  }

  public boolean contains(String label) {
    return nodes.containsKey(label);
  }

  /** Forgets every node but keeps the policy of each label. */
  public void clear() {
    nodes.clear();
  }
}
