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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import com.google.errorprone.annotations.Immutable;
import java.util.List;

/**
 * A build tool version such as {@code 2.1} or {@code 4.10-rc-1}. Versions compare by their
 * numeric components; a version with a qualifier sorts before the same version without one.
 */
@Immutable
public final class ToolVersion implements Comparable<ToolVersion> {
  private final String text;
  private final ImmutableList<Integer> components;
  private final boolean qualified;

  private ToolVersion(String text, ImmutableList<Integer> components, boolean qualified) {
    this.text = text;
    this.components = components;
    this.qualified = qualified;
  }

  public static ToolVersion parse(String text) {
    String trimmed = text.trim();
    int dash = trimmed.indexOf('-');
    String base = dash < 0 ? trimmed : trimmed.substring(0, dash);
    ImmutableList.Builder<Integer> components = ImmutableList.builder();
    for (String part : Splitter.on('.').split(base)) {
      Integer component = Ints.tryParse(part);
      checkArgument(component != null, "Not a version: %s", text);
      components.add(component);
    }
    return new ToolVersion(trimmed, components.build(), dash >= 0);
  }

  public boolean isNewerThan(ToolVersion other) {
    return compareTo(other) > 0;
  }

  @Override
  public int compareTo(ToolVersion other) {
    int length = Math.max(components.size(), other.components.size());
    for (int i = 0; i < length; i++) {
      int result = Integer.compare(component(components, i), component(other.components, i));
      if (result != 0) {
        return result;
      }
    }
    return Boolean.compare(other.qualified, qualified);
  }

  private static int component(List<Integer> components, int index) {
    return index < components.size() ? components.get(index) : 0;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ToolVersion && compareTo((ToolVersion) o) == 0;
  }

  @Override
  public int hashCode() {
    int end = components.size();
    while (end > 0 && components.get(end - 1) == 0) {
      end--;
    }
    return components.subList(0, end).hashCode() * 31 + Boolean.hashCode(qualified);
  }

  @Override
  public String toString() {
    return text;
  }
}
