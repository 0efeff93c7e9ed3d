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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.codehaus.groovy.ast.stmt.ExpressionStatement;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ScriptTraversal}. */
@RunWith(JUnit4.class)
public final class ScriptTraversalTest {

  /** Records every callback as a line of text. */
  private static final class RecordingCallback implements BuildScriptCallback {
    final List<String> events = new ArrayList<>();
    final List<GradleDependency> dependencies = new ArrayList<>();

    @Override
    public void visitBuildscript(MethodCallExpression call) {
      events.add("buildscript");
    }

    @Override
    public void visitRepositories(MethodCallExpression call) {
      events.add("repositories");
    }

    @Override
    public void visitDependencies(MethodCallExpression call) {
      events.add("dependencies");
    }

    @Override
    public void visitPlugins(MethodCallExpression call) {
      events.add("plugins");
    }

    @Override
    public void visitApplyPlugin(MethodCallExpression call, String plugin) {
      events.add("apply " + plugin);
    }

    @Override
    public void visitGradlePlugin(MethodCallExpression call, String conf, GradlePlugin plugin) {
      events.add(conf + " " + plugin.id() + " " + plugin.version());
    }

    @Override
    public void visitGradleDependency(
        MethodCallExpression call, String conf, GradleDependency dependency) {
      dependencies.add(dependency);
      events.add(conf + " " + dependency.toNotation());
    }

    @Override
    public void visitTask(MethodCallExpression call, String name, Map<String, String> args) {
      events.add("task " + name + " " + args);
    }

    @Override
    public void visitConfigurationExclude(
        MethodCallExpression call, String conf, GradleDependency exclude) {
      events.add("exclude " + conf + " " + exclude.group() + " " + exclude.name());
    }

    @Override
    public void visitExtensionProperty(
        ExpressionStatement statement, String extension, String property, @Nullable String value) {
      events.add("property " + extension + "." + property + " " + value);
    }

    @Override
    public void visitScriptComplete(ModuleNode module) {
      events.add("complete");
    }
  }

  private static RecordingCallback traverse(String code, @Nullable BuildModel model) {
    RecordingCallback callback = new RecordingCallback();
    ScriptTraversal.traverse(
        BuildScript.fromCode("build.gradle", code), model, callback, new ViolationRecorder());
    return callback;
  }

  private static RecordingCallback traverse(String code) {
    return traverse(code, null);
  }

  @Test
  public void testBlocksAreReportedAfterTheirContents() {
    RecordingCallback callback =
        traverse(
            String.join(
                "\n",
                "buildscript {",
                "    repositories { jcenter() }",
                "    dependencies { classpath 'a:b:1' }",
                "}",
                "repositories { mavenCentral() }",
                "dependencies {",
                "    compile 'g:n:1'",
                "}"));
    assertThat(callback.events)
        .containsExactly(
            "repositories",
            "classpath a:b:1",
            "dependencies",
            "buildscript",
            "repositories",
            "compile g:n:1",
            "dependencies",
            "complete")
        .inOrder();
  }

  @Test
  public void testDependencySyntaxes() {
    RecordingCallback callback =
        traverse(
            String.join(
                "\n",
                "dependencies {",
                "    compile 'g:n:1'",
                "    testCompile group: 'junit', name: 'junit', version: '4.12'",
                "    runtime('r:t:2') { transitive = false }",
                "    compile \"g:interpolated:${version}\"",
                "}"));
    assertThat(callback.dependencies).hasSize(4);
    assertThat(callback.dependencies.get(0).syntax())
        .isEqualTo(GradleDependency.Syntax.STRING_NOTATION);
    assertThat(callback.dependencies.get(1))
        .isEqualTo(
            new GradleDependency(
                "junit", "junit", "4.12", null, null, null, GradleDependency.Syntax.MAP_NOTATION));
    assertThat(callback.dependencies.get(2).toNotation()).isEqualTo("r:t:2");
    assertThat(callback.dependencies.get(3).group()).isEqualTo("g");
    assertThat(callback.dependencies.get(3).name()).isEqualTo("interpolated");
  }

  @Test
  public void testUnknownConfigurationIsNotADependency() {
    RecordingCallback callback = traverse("dependencies {\n    implementation 'g:n:1'\n}");
    assertThat(callback.dependencies).isEmpty();
  }

  @Test
  public void testConfigurationNamesFromBuildModel() {
    BuildModel model = SimpleBuildModel.builder().addConfigurationNames("implementation").build();
    RecordingCallback callback =
        traverse("dependencies {\n    implementation 'g:n:1'\n    compile 'g:m:1'\n}", model);
    assertThat(callback.events).containsExactly("implementation g:n:1", "dependencies", "complete");
  }

  @Test
  public void testPropertyDependencyIsEvaluatedThroughBuildModel() {
    BuildModel model =
        SimpleBuildModel.builder()
            .setProperty("deps", Map.of("junit", "junit:junit:4.13.2"))
            .build();
    String code = "dependencies {\n    testCompile deps.junit\n}";

    RecordingCallback callback = traverse(code, model);
    assertThat(callback.dependencies)
        .containsExactly(
            new GradleDependency(
                "junit",
                "junit",
                "4.13.2",
                null,
                null,
                null,
                GradleDependency.Syntax.EVALUATED_ARBITRARY_CODE));

    assertThat(traverse(code).dependencies).isEmpty();
  }

  @Test
  public void testEvaluationFailureSkipsTheDeclaration() {
    BuildModel failing =
        new BuildModel() {
          @Override
          public ImmutableSet<String> getConfigurationNames() {
            return ImmutableSet.of();
          }

          @Override
          public @Nullable ToolVersion getToolVersion() {
            return null;
          }

          @Override
          public Optional<Object> evaluate(String expression) {
            throw new IllegalStateException("cannot evaluate " + expression);
          }
        };
    RecordingCallback callback =
        traverse("dependencies {\n    compile deps.guava\n    compile 'g:n:1'\n}", failing);
    assertThat(callback.events).containsExactly("compile g:n:1", "dependencies", "complete");
  }

  @Test
  public void testPluginDeclarations() {
    RecordingCallback callback =
        traverse(
            String.join(
                "\n",
                "plugins {",
                "    id 'java'",
                "    id 'nebula.lint' version '6.1.4'",
                "    id \"com.example\" version \"1.0\" apply false",
                "}"));
    assertThat(callback.events)
        .containsExactly(
            "id java null",
            "id nebula.lint 6.1.4",
            "id com.example 1.0",
            "plugins",
            "complete")
        .inOrder();
  }

  @Test
  public void testApplyPlugin() {
    RecordingCallback callback =
        traverse("apply plugin: 'java'\napply from: 'other.gradle'\napply plugin: 'groovy'");
    assertThat(callback.events)
        .containsExactly("apply java", "apply groovy", "complete")
        .inOrder();
  }

  @Test
  public void testTaskDeclarations() {
    RecordingCallback callback =
        traverse(
            String.join(
                "\n",
                "task t1",
                "task t2(type: Wrapper)",
                "task('t3') {}",
                "tasks.create('t4', Copy)",
                "tasks.create(name: 't5', type: Zip)",
                "task t6 {",
                "    description = 'sixth'",
                "}"));
    assertThat(callback.events)
        .containsExactly(
            "task t1 {}",
            "task t2 {type=Wrapper}",
            "task t3 {}",
            "task t4 {type=Copy}",
            "task t5 {name=t5, type=Zip}",
            "property t6.description sixth",
            "task t6 {}",
            "complete")
        .inOrder();
  }

  @Test
  public void testConfigurationExcludes() {
    RecordingCallback callback =
        traverse(
            String.join(
                "\n",
                "configurations {",
                "    compile.exclude group: 'a', module: 'b'",
                "    all*.exclude module: 'c'",
                "    other.exclude module: 'd'",
                "}"));
    assertThat(callback.events)
        .containsExactly("exclude compile a b", "exclude all null c", "complete")
        .inOrder();
  }

  @Test
  public void testExtensionProperties() {
    RecordingCallback callback =
        traverse(
            String.join(
                "\n",
                "nebula {",
                "    moduleOwner = 'me'",
                "    moduleEmail 'me@example.com'",
                "    team = teamName",
                "}",
                "nebula.project = 'lint'"));
    assertThat(callback.events)
        .containsExactly(
            "property nebula.moduleOwner me",
            "property nebula.moduleEmail me@example.com",
            "property nebula.team null",
            "property nebula.project lint",
            "complete")
        .inOrder();
  }

  @Test
  public void testStatementsInsideRecognizedBlocksAreNotExtensionProperties() {
    RecordingCallback callback =
        traverse(
            String.join(
                "\n",
                "subprojects {",
                "    dependencies {",
                "        compile 'g:n:1'",
                "    }",
                "}"));
    assertThat(callback.events)
        .containsExactly("compile g:n:1", "dependencies", "complete")
        .inOrder();
  }

  @Test
  public void testNestedBlocksAreFoundInsideOtherClosures() {
    RecordingCallback callback =
        traverse("allprojects {\n    apply plugin: 'java'\n    repositories { jcenter() }\n}");
    assertThat(callback.events)
        .containsExactly("repositories", "complete")
        .inOrder();
  }

  @Test
  public void testApplyPluginIsOnlyReportedAtTopLevel() {
    RecordingCallback callback =
        traverse(
            String.join(
                "\n",
                "subprojects {",
                "    apply plugin: 'groovy'",
                "}",
                "buildscript {",
                "    apply plugin: 'scala'",
                "}",
                "apply plugin: 'java'"));
    assertThat(callback.events).containsExactly("buildscript", "apply java", "complete").inOrder();
  }
}
