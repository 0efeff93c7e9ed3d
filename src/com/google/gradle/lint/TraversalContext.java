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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.jspecify.annotations.Nullable;

/**
 * Where a single traversal currently is: which blocks are open and which named closures enclose
 * the current node. Owned by one {@link ScriptTraversal} and discarded with it.
 */
public final class TraversalContext {
  private final Map<BlockKind, Integer> depths = new EnumMap<>(BlockKind.class);
  private final Deque<MethodCallExpression> closureStack = new ArrayDeque<>();
  private final Set<MethodCallExpression> reportedPluginCalls = Sets.newIdentityHashSet();

  TraversalContext() {
    for (BlockKind kind : BlockKind.values()) {
      depths.put(kind, 0);
    }
  }

  public boolean isInBlock(BlockKind kind) {
    return depths.get(kind) > 0;
  }

  /** Whether the traversal is inside any of the blocks it recognizes. */
  public boolean isInRecognizedBlock() {
    for (int depth : depths.values()) {
      if (depth > 0) {
        return true;
      }
    }
    return false;
  }

  void enterBlock(BlockKind kind) {
    depths.merge(kind, 1, Integer::sum);
  }

  void exitBlock(BlockKind kind) {
    checkState(depths.get(kind) > 0, "Not inside a %s block", kind);
    depths.merge(kind, -1, Integer::sum);
  }

  /** Returns the innermost named closure, or null at top level. */
  public @Nullable MethodCallExpression parentClosure() {
    return closureStack.peek();
  }

  /** Returns the enclosing named closures, innermost first. */
  public ImmutableList<MethodCallExpression> closureStack() {
    return ImmutableList.copyOf(closureStack);
  }

  void pushClosure(MethodCallExpression call) {
    closureStack.push(call);
  }

  void popClosure() {
    closureStack.pop();
  }

  /**
   * Marks a call that is part of a plugin declaration chain already reported through its outermost
   * call.
   */
  void markReportedPluginCall(MethodCallExpression call) {
    reportedPluginCalls.add(call);
  }

  boolean isReportedPluginCall(MethodCallExpression call) {
    return reportedPluginCalls.contains(call);
  }
}
