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

package com.google.gradle.lint.refactoring;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;
import java.util.Comparator;

/**
 * A block of text to insert next to an {@link Anchor} of the original script. Edits are always
 * expressed against the original text, never against the result of another edit.
 */
@AutoValue
@Immutable
public abstract class ScriptEdit implements Comparable<ScriptEdit> {
  /** Which side of the anchor the text goes to. */
  public enum Placement {
    INSERT_BEFORE,
    INSERT_AFTER
  }

  public static ScriptEdit insertBefore(Anchor anchor, String text) {
    return new AutoValue_ScriptEdit(anchor, Placement.INSERT_BEFORE, text);
  }

  public static ScriptEdit insertAfter(Anchor anchor, String text) {
    return new AutoValue_ScriptEdit(anchor, Placement.INSERT_AFTER, text);
  }

  /** Inserts the text ahead of the first line of the script, without indentation. */
  public static ScriptEdit insertAtDocumentStart(String text) {
    return new AutoValue_ScriptEdit(Anchor.documentStart(), Placement.INSERT_BEFORE, text);
  }

  public abstract Anchor getAnchor();

  public abstract Placement getPlacement();

  /** Returns the text to insert. It may span several lines. */
  public abstract String getText();

  /**
   * Returns the 0-based index in the original line list that the inserted lines are placed at.
   */
  public int getInsertionIndex() {
    Anchor anchor = getAnchor();
    if (anchor.isDocumentStart()) {
      return 0;
    }
    return getPlacement() == Placement.INSERT_BEFORE
        ? anchor.getStartLine() - 1
        : anchor.getEndLine();
  }

  @Override
  public final int compareTo(ScriptEdit x) {
    return APPLICATION_ORDER.compare(this, x);
  }

  // Text appended after a node belongs to that node, so at the same line it precedes text that is
  // prepended to the next node.
  private static final Comparator<ScriptEdit> APPLICATION_ORDER =
      Comparator.comparingInt(ScriptEdit::getInsertionIndex)
          .thenComparing(e -> e.getPlacement() == Placement.INSERT_BEFORE)
          .thenComparing(e -> e.getAnchor().toString())
          .thenComparing(ScriptEdit::getText);
}
