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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.gradle.lint.refactoring.ApplyScriptEdits;
import com.google.gradle.lint.refactoring.ScriptEdit;
import java.io.File;
import java.io.IOException;
import org.jspecify.annotations.Nullable;

/**
 * Primary driver of a lint run. This class holds the script, runs rules over it, and turns the
 * violations they raise back into corrected script text.
 */
public final class GradleLintDriver {

  private final BuildScript script;
  private final @Nullable BuildModel buildModel;

  private GradleLintDriver(BuildScript script, @Nullable BuildModel buildModel) {
    this.script = script;
    this.buildModel = buildModel;
  }

  /** Runs a rule and returns the violations it raised. */
  public ImmutableList<GradleViolation> drive(GradleLintRule rule) {
    return rule.applyTo(script, buildModel);
  }

  /** Runs each rule in turn and returns the violations they raised, in rule order. */
  public ImmutableList<GradleViolation> drive(Iterable<? extends GradleLintRule> rules) {
    ImmutableList.Builder<GradleViolation> violations = ImmutableList.builder();
    for (GradleLintRule rule : rules) {
      violations.addAll(drive(rule));
    }
    return violations.build();
  }

  /**
   * Returns the script with the edits of the violations applied. A violation whose edits collide
   * with those of an earlier violation is left unfixed.
   */
  public String correct(Iterable<GradleViolation> violations) {
    return ApplyScriptEdits.applyEditGroups(editGroups(violations), script.getCode());
  }

  /** Rewrites the file with the edits of the violations applied. */
  public static void correctFile(File file, Iterable<GradleViolation> violations)
      throws IOException {
    ApplyScriptEdits.applyEditsToFile(
        file, ImmutableList.copyOf(Iterables.concat(editGroups(violations))));
  }

  private static ImmutableList<ImmutableList<ScriptEdit>> editGroups(
      Iterable<GradleViolation> violations) {
    ImmutableList.Builder<ImmutableList<ScriptEdit>> groups = ImmutableList.builder();
    for (GradleViolation violation : violations) {
      if (violation.isFixable()) {
        groups.add(violation.getEdits());
      }
    }
    return groups.build();
  }

  public BuildScript getScript() {
    return script;
  }

  public static class Builder {
    private @Nullable BuildScript script;
    private @Nullable BuildModel buildModel;

    public Builder() {}

    @CanIgnoreReturnValue
    public Builder addInputsFromCode(String code) {
      return addInputsFromCode(code, "build.gradle");
    }

    @CanIgnoreReturnValue
    public Builder addInputsFromCode(String code, String filename) {
      checkArgument(script == null, "A driver lints a single script");
      script = BuildScript.fromCode(filename, code);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addInputsFromFile(File file) throws IOException {
      checkArgument(script == null, "A driver lints a single script");
      script = BuildScript.fromFile(file);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setBuildModel(BuildModel buildModel) {
      this.buildModel = checkNotNull(buildModel);
      return this;
    }

    public GradleLintDriver build() {
      checkArgument(script != null, "No script to lint");
      return new GradleLintDriver(script, buildModel);
    }
  }
}
