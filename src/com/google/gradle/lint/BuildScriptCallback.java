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

import java.util.Map;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.codehaus.groovy.ast.stmt.ExpressionStatement;
import org.jspecify.annotations.Nullable;

/**
 * Receives the build constructs {@link ScriptTraversal} recognizes, whatever syntax they were
 * written in. Every method does nothing by default, so an implementation only overrides the
 * constructs it is interested in.
 *
 * <p>Block callbacks fire after the contents of the block have been reported. Declarations fire as
 * they are reached.
 */
public interface BuildScriptCallback {

  /** {@code buildscript { ... }} */
  default void visitBuildscript(MethodCallExpression call) {}

  /** {@code repositories { ... }}, at top level or inside {@code buildscript}. */
  default void visitRepositories(MethodCallExpression call) {}

  /** {@code dependencies { ... }}, at top level or inside {@code buildscript}. */
  default void visitDependencies(MethodCallExpression call) {}

  /** {@code plugins { ... }} */
  default void visitPlugins(MethodCallExpression call) {}

  /** {@code apply plugin: 'java'} */
  default void visitApplyPlugin(MethodCallExpression call, String plugin) {}

  /**
   * {@code id 'nebula.lint' version '6.1.4'} inside a plugins block.
   *
   * @param call the outermost call of the declaration
   * @param conf the method that named the plugin, normally {@code id}
   */
  default void visitGradlePlugin(MethodCallExpression call, String conf, GradlePlugin plugin) {}

  /**
   * {@code compile 'a:b:1'} inside a dependencies block, or {@code classpath 'a:b:1'} inside a
   * buildscript block.
   *
   * @param conf the configuration the dependency is added to
   */
  default void visitGradleDependency(
      MethodCallExpression call, String conf, GradleDependency dependency) {}

  /**
   * {@code task t(type: Wrapper)}, {@code tasks.create('t')} and the other task declaration forms.
   *
   * @param args the named arguments of the declaration, such as {@code type}
   */
  default void visitTask(MethodCallExpression call, String name, Map<String, String> args) {}

  /** {@code compile.exclude group: 'a', module: 'b'} inside a configurations block. */
  default void visitConfigurationExclude(
      MethodCallExpression call, String conf, GradleDependency exclude) {}

  /**
   * {@code nebula { moduleOwner = 'me' }}, {@code nebula { moduleOwner 'me' }} or {@code
   * nebula.moduleOwner = 'me'}.
   *
   * @param value the value when it is a literal, otherwise null
   */
  default void visitExtensionProperty(
      ExpressionStatement statement, String extension, String property, @Nullable String value) {}

  /** Called once, after the whole script has been traversed. */
  default void visitScriptComplete(ModuleNode module) {}
}
