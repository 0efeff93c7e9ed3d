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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;
import org.codehaus.groovy.ast.ASTNode;

/**
 * A position in the original script that an edit is attached to. Either the source range of a
 * parsed node or the start of the document.
 */
@AutoValue
@Immutable
public abstract class Anchor {
  /** What the anchor points at. */
  public enum Kind {
    NODE,
    DOCUMENT_START
  }

  private static final Anchor DOCUMENT_START =
      new AutoValue_Anchor(Kind.DOCUMENT_START, 1, 1, 1, 1);

  /** Copies the source range of a node of the original parse. */
  public static Anchor of(ASTNode node) {
    checkArgument(
        node.getLineNumber() > 0 && node.getLastLineNumber() >= node.getLineNumber(),
        "Node has no source position: %s",
        node.getText());
    return create(
        node.getLineNumber(),
        node.getColumnNumber(),
        node.getLastLineNumber(),
        node.getLastColumnNumber());
  }

  public static Anchor create(int startLine, int startColumn, int endLine, int endColumn) {
    checkArgument(startLine > 0 && startColumn > 0, "Positions are 1-indexed");
    checkArgument(endLine >= startLine, "End line %s precedes start line %s", endLine, startLine);
    return new AutoValue_Anchor(Kind.NODE, startLine, startColumn, endLine, endColumn);
  }

  public static Anchor documentStart() {
    return DOCUMENT_START;
  }

  public abstract Kind getKind();

  public abstract int getStartLine();

  public abstract int getStartColumn();

  public abstract int getEndLine();

  public abstract int getEndColumn();

  public boolean isDocumentStart() {
    return getKind() == Kind.DOCUMENT_START;
  }

  /** Number of spaces that text inserted at this anchor is indented by. */
  int getIndentation() {
    return isDocumentStart() ? 0 : getStartColumn() - 1;
  }

  @Override
  public final String toString() {
    if (isDocumentStart()) {
      return "<document start>";
    }
    return getStartLine()
        + ":"
        + getStartColumn()
        + "-"
        + getEndLine()
        + ":"
        + getEndColumn();
  }
}
