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
public final class SimpleBuildModelTest {

  private final SimpleBuildModel model =
      SimpleBuildModel.builder()
          .addConfigurationNames("implementation", "api")
          .setToolVersion("6.8")
          .setProperty("guavaVersion", "33.0.0-jre")
          .setProperty("deps", ImmutableMap.of("junit", "junit:junit:4.13.2"))
          .build();

  @Test
  public void testConfigurationNamesAndVersion() {
    assertThat(model.getConfigurationNames()).containsExactly("implementation", "api").inOrder();
    assertThat(model.getToolVersion()).isEqualTo(ToolVersion.parse("6.8"));
  }

  @Test
  public void testEvaluatesPropertyPaths() {
    assertThat(model.evaluate("guavaVersion")).hasValue("33.0.0-jre");
    assertThat(model.evaluate("deps.junit")).hasValue("junit:junit:4.13.2");
    assertThat(model.evaluate("project.deps.junit")).hasValue("junit:junit:4.13.2");
  }

  @Test
  public void testUnresolvableExpressions() {
    assertThat(model.evaluate("deps.mockito")).isEmpty();
    assertThat(model.evaluate("guavaVersion.major")).isEmpty();
    assertThat(model.evaluate("deps['junit']")).isEmpty();
    assertThat(model.evaluate("\"a:b:${guavaVersion}\"")).isEmpty();
  }

  @Test
  public void testEmptyModel() {
    SimpleBuildModel empty = SimpleBuildModel.builder().build();
    assertThat(empty.getConfigurationNames()).isEmpty();
    assertThat(empty.getToolVersion()).isNull();
  }
}
