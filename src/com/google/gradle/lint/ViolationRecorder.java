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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the violations one rule raises during one traversal, dropping those raised inside a
 * {@code gradleLint.ignore} region that covers the rule.
 */
public final class ViolationRecorder {

  /** The rules ignored in the current lexical region. */
  public record Suppression(boolean allRules, ImmutableSet<String> ruleNames) {
    public static final Suppression NONE = new Suppression(false, ImmutableSet.of());

    public static Suppression all() {
      return new Suppression(true, ImmutableSet.of());
    }

    public static Suppression of(Iterable<String> ruleNames) {
      ImmutableSet<String> names = ImmutableSet.copyOf(ruleNames);
      return names.isEmpty() ? all() : new Suppression(false, names);
    }

    public boolean covers(String ruleName) {
      return allRules || ruleNames.contains(ruleName);
    }
  }

  private final List<GradleViolation> violations = new ArrayList<>();
  private Suppression suppression = Suppression.NONE;

  /** Returns the suppression in effect so that it can be restored when a region ends. */
  Suppression enterSuppression(Suppression region) {
    Suppression previous = suppression;
    suppression = checkNotNull(region);
    return previous;
  }

  void exitSuppression(Suppression previous) {
    suppression = checkNotNull(previous);
  }

  boolean isIgnored(String ruleName) {
    return suppression.covers(ruleName);
  }

  /** Records the violation unless it is suppressed. */
  void record(GradleViolation violation) {
    if (!violation.isSuppressed()) {
      violations.add(violation);
    }
  }

  ImmutableList<GradleViolation> getViolations() {
    return ImmutableList.copyOf(violations);
  }

  void reset() {
    violations.clear();
    suppression = Suppression.NONE;
  }
}
