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

import org.jspecify.annotations.Nullable;

/** Kinds of blocks whose nesting is tracked while a script is traversed. */
public enum BlockKind {
  BUILDSCRIPT("buildscript"),
  REPOSITORIES("repositories"),
  DEPENDENCIES("dependencies"),
  PLUGINS("plugins"),
  CONFIGURATIONS("configurations");

  private final String methodName;

  BlockKind(String methodName) {
    this.methodName = methodName;
  }

  /** Returns the name of the script method that opens this block. */
  public String getMethodName() {
    return methodName;
  }

  static @Nullable BlockKind forMethodName(String methodName) {
    for (BlockKind kind : values()) {
      if (kind.methodName.equals(methodName)) {
        return kind;
      }
    }
    return null;
  }
}
