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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class GradleDependencyTest {

  @Test
  public void testFullStringNotation() {
    GradleDependency dependency = GradleDependency.fromStringNotation("a:b:1.0:jdk8@jar");
    assertThat(dependency)
        .isEqualTo(
            new GradleDependency(
                "a", "b", "1.0", "jdk8", "jar", null, GradleDependency.Syntax.STRING_NOTATION));
    assertThat(dependency.toNotation()).isEqualTo("a:b:1.0:jdk8@jar");
  }

  @Test
  public void testNameOnlyStringNotation() {
    GradleDependency dependency = GradleDependency.fromStringNotation("b");
    assertThat(dependency.group()).isNull();
    assertThat(dependency.name()).isEqualTo("b");
    assertThat(dependency.version()).isNull();
    assertThat(dependency.toNotation()).isEqualTo("b");
  }

  @Test
  public void testGroupAndNameStringNotation() {
    GradleDependency dependency = GradleDependency.fromStringNotation("a:b");
    assertThat(dependency.group()).isEqualTo("a");
    assertThat(dependency.name()).isEqualTo("b");
    assertThat(dependency.toNotation()).isEqualTo("a:b");
  }

  @Test
  public void testExtensionWithoutVersion() {
    GradleDependency dependency = GradleDependency.fromStringNotation("a:b@zip");
    assertThat(dependency.ext()).isEqualTo("zip");
    assertThat(dependency.version()).isNull();
  }

  @Test
  public void testInvalidStringNotation() {
    assertThat(GradleDependency.fromStringNotation("")).isNull();
    assertThat(GradleDependency.fromStringNotation("a::1")).isNull();
  }

  @Test
  public void testMapNotation() {
    GradleDependency dependency =
        GradleDependency.fromMapNotation(
            ImmutableMap.of("group", "a", "name", "b", "version", "1.0"));
    assertThat(dependency.syntax()).isEqualTo(GradleDependency.Syntax.MAP_NOTATION);
    assertThat(dependency.toNotation()).isEqualTo("a:b:1.0");
  }
}
