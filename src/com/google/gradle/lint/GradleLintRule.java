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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.gradle.lint.refactoring.Anchor;
import java.util.logging.Logger;
import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.jspecify.annotations.Nullable;

/**
 * Base class for lint rules. A rule overrides the {@link BuildScriptCallback} methods for the
 * constructs it cares about, remembers locations with bookmarks, and raises violations through
 * {@link #addBuildLintViolation}. Remediation is attached to the returned violation as edits.
 *
 * <p>A rule instance lints one script at a time. Its bookmarks and violations are reset by every
 * call to {@link #applyTo}.
 */
public abstract class GradleLintRule implements BuildScriptCallback {
  private static final Logger logger = Logger.getLogger(GradleLintRule.class.getName());

  private final BookmarkStore bookmarks = new BookmarkStore();
  private final ViolationRecorder recorder = new ViolationRecorder();

  private @Nullable BuildScript script;
  private @Nullable BuildModel buildModel;
  private @Nullable TraversalContext context;

  /** The name rules are ignored by, as in {@code gradleLint.ignore('build-scan') { ... }}. */
  public abstract String getName();

  public abstract String getDescription();

  /**
   * Lints the script and returns the violations that were not suppressed.
   *
   * @param model what is known of the build beyond the script, or null if nothing is
   */
  public final ImmutableList<GradleViolation> applyTo(
      BuildScript script, @Nullable BuildModel model) {
    this.script = checkNotNull(script);
    this.buildModel = model;
    bookmarks.clear();
    recorder.reset();
    ScriptTraversal traversal = new ScriptTraversal(script, model, this, recorder);
    context = traversal.getContext();
    try {
      traversal.traverse();
    } finally {
      context = null;
    }
    ImmutableList<GradleViolation> violations = recorder.getViolations();
    logger.fine(getName() + " found " + violations.size() + " violations in " + script.getName());
    return violations;
  }

  /** Bookmarks the node under the label, replacing any node bookmarked before. */
  protected final void bookmark(String label, ASTNode node) {
    bookmarks.put(label, node, BookmarkPolicy.LAST_WINS);
  }

  /**
   * Bookmarks the node under the label unless a node is already bookmarked there.
   *
   * @return true if the node was bookmarked
   */
  @CanIgnoreReturnValue
  protected final boolean bookmarkFirst(String label, ASTNode node) {
    return bookmarks.put(label, node, BookmarkPolicy.FIRST_WINS);
  }

  protected final @Nullable ASTNode bookmark(String label) {
    return bookmarks.get(label);
  }

  /** Raises a violation of the script as a whole. */
  protected final GradleViolation addBuildLintViolation(String message) {
    return addBuildLintViolation(message, null);
  }

  /**
   * Raises a violation at the node. The violation is returned even when the rule is ignored at the
   * current location, in which case it is not reported.
   */
  protected final GradleViolation addBuildLintViolation(String message, @Nullable ASTNode node) {
    GradleViolation violation =
        new GradleViolation(
            getName(),
            message,
            node == null ? null : Anchor.of(node),
            getScript().getSnippet(node),
            recorder.isIgnored(getName()));
    recorder.record(violation);
    return violation;
  }

  /**
   * Unsupported. Violations must be raised through {@link #addBuildLintViolation} so that they
   * carry a message and can carry edits.
   */
  protected final void addViolation(ASTNode node) {
    throw new UnsupportedOperationException(
        "use addBuildLintViolation(String, ASTNode) to raise violations");
  }

  /**
   * Unsupported. Violations must be raised through {@link #addBuildLintViolation} so that they
   * can carry edits.
   */
  protected final void addViolation(ASTNode node, String message) {
    throw new UnsupportedOperationException(
        "use addBuildLintViolation(String, ASTNode) to raise violations");
  }

  protected final BuildScript getScript() {
    checkState(script != null, "%s is not linting a script", getName());
    return script;
  }

  protected final @Nullable BuildModel getBuildModel() {
    return buildModel;
  }

  /** Returns the Gradle version of the build, or null if it is not known. */
  protected final @Nullable ToolVersion getToolVersion() {
    return buildModel == null ? null : buildModel.getToolVersion();
  }

  /** Returns the innermost named closure around the construct being visited. */
  protected final @Nullable MethodCallExpression parentClosure() {
    return getContext().parentClosure();
  }

  protected final ImmutableList<MethodCallExpression> closureStack() {
    return getContext().closureStack();
  }

  protected final boolean isInBlock(BlockKind kind) {
    return getContext().isInBlock(kind);
  }

  private TraversalContext getContext() {
    checkState(context != null, "%s is not traversing a script", getName());
    return context;
  }
}
