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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.gradle.lint.refactoring.Anchor;
import com.google.gradle.lint.refactoring.ScriptEdit;
import java.util.ArrayList;
import java.util.List;
import org.codehaus.groovy.ast.ASTNode;
import org.jspecify.annotations.Nullable;

/**
 * A problem a rule found in a build script, along with the edits that correct it. Edits are
 * attached by the rule after the violation is created.
 */
public final class GradleViolation {
  private final String ruleName;
  private final String message;
  private final @Nullable Anchor location;
  private final @Nullable String sourceLine;
  private final boolean suppressed;
  private final List<ScriptEdit> edits = new ArrayList<>();

  GradleViolation(
      String ruleName,
      String message,
      @Nullable Anchor location,
      @Nullable String sourceLine,
      boolean suppressed) {
    this.ruleName = checkNotNull(ruleName);
    this.message = checkNotNull(message);
    this.location = location;
    this.sourceLine = sourceLine;
    this.suppressed = suppressed;
  }

  public String getRuleName() {
    return ruleName;
  }

  public String getMessage() {
    return message;
  }

  /** Returns the range of the offending node, or null for a violation of the script as a whole. */
  public @Nullable Anchor getLocation() {
    return location;
  }

  /** Returns the line the violation is reported at, or -1 if it has no location. */
  public int getLineNumber() {
    return location == null ? -1 : location.getStartLine();
  }

  /** Returns the code of the offending node, formatted for display. */
  public @Nullable String getSourceLine() {
    return sourceLine;
  }

  /** Whether the violation was raised inside a region where its rule is ignored. */
  public boolean isSuppressed() {
    return suppressed;
  }

  public ImmutableList<ScriptEdit> getEdits() {
    return ImmutableList.copyOf(edits);
  }

  public boolean isFixable() {
    return !edits.isEmpty();
  }

  /** Inserts text on the lines above the node, indented to the node's column. */
  @CanIgnoreReturnValue
  public GradleViolation insertBefore(ASTNode node, String text) {
    edits.add(ScriptEdit.insertBefore(Anchor.of(node), text));
    return this;
  }

  /** Inserts text on the lines below the node, indented to the node's column. */
  @CanIgnoreReturnValue
  public GradleViolation insertAfter(ASTNode node, String text) {
    edits.add(ScriptEdit.insertAfter(Anchor.of(node), text));
    return this;
  }

  /** Inserts text at the very beginning of the script. */
  @CanIgnoreReturnValue
  public GradleViolation insertAtDocumentStart(String text) {
    edits.add(ScriptEdit.insertAtDocumentStart(text));
    return this;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder().append(ruleName).append(": ").append(message);
    if (location != null) {
      sb.append(" at line ").append(location.getStartLine());
    }
    if (!edits.isEmpty()) {
      sb.append(" (").append(edits.size()).append(" edits)");
    }
    return sb.toString();
  }
}
