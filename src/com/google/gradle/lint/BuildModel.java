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

import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Read-only view of the project a build script belongs to. Lint rules run without one unless the
 * caller has a live project to offer; everything reached through it is best effort.
 *
 * <p>Implementations are not required to be thread-safe. A traversal reads the model from a
 * single thread.
 */
public interface BuildModel {

  /**
   * Returns the names of the configurations the project declares, or an empty set if they are
   * not known, in which case the default configuration names are assumed.
   */
  ImmutableSet<String> getConfigurationNames();

  /** Returns the version of the build tool running the script, or null if it is not known. */
  @Nullable ToolVersion getToolVersion();

  /**
   * Evaluates a script expression, such as {@code deps.guava}, against the project. Returns an
   * empty optional when the expression cannot be resolved. Any exception thrown is treated the
   * same way by callers.
   */
  Optional<Object> evaluate(String expression);
}
