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

package com.google.gradle.lint.rules;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.gradle.lint.BlockKind;
import com.google.gradle.lint.GradleDependency;
import com.google.gradle.lint.GradleLintRule;
import com.google.gradle.lint.GradlePlugin;
import com.google.gradle.lint.GradleViolation;
import com.google.gradle.lint.ToolVersion;
import java.util.logging.Logger;
import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.ast.expr.MethodCallExpression;

/**
 * Checks that a build script applies a {@link RequiredPlugin}, and fixes scripts that do not by
 * adding the plugin in the style the script already uses:
 *
 * <ul>
 *   <li>a declaration at the top of an existing {@code plugins} block;
 *   <li>an {@code apply plugin:} statement above the existing ones, with the plugin's classpath
 *       dependency added to the {@code buildscript} block, or to a new one;
 *   <li>for scripts that name no plugins at all, a new {@code plugins} block, or on Gradle 2.1 and
 *       older, which has no plugins block, an {@code apply plugin:} statement.
 * </ul>
 */
public final class RequiredPluginRule extends GradleLintRule {
  private static final Logger logger = Logger.getLogger(RequiredPluginRule.class.getName());

  /** The newest Gradle version without support for the plugins block. */
  static final ToolVersion LAST_VERSION_WITHOUT_PLUGINS_BLOCK = ToolVersion.parse("2.1");

  static final String PLUGIN_FOUND_IN_PLUGINS_BLOCK = "pluginFoundInPluginsBlock";
  static final String PLUGIN_FOUND_ON_APPLY_PLUGIN = "pluginFoundOnApplyPlugin";
  static final String FIRST_PLUGIN_IN_PLUGINS_BLOCK = "firstPluginInPluginsBlock";
  static final String PLUGINS_BLOCK = "pluginsBlock";
  static final String FIRST_APPLY_PLUGIN = "firstApplyPlugin";
  static final String LAST_APPLY_PLUGIN = "lastApplyPlugin";
  static final String BUILDSCRIPT = "buildscript";
  static final String BUILDSCRIPT_REPOSITORIES = "buildscriptRepositories";
  static final String BUILDSCRIPT_DEPENDENCIES = "buildscriptDependencies";
  static final String FIRST_BUILDSCRIPT_DEPENDENCY = "firstBuildscriptDependency";
  static final String REQUIRED_DEPENDENCY = "requiredDependency";

  /** Where a new buildscript block resolves plugin classpath dependencies from. */
  static final String PLUGIN_REPOSITORY = "https://plugins.gradle.org/m2/";

  private final RequiredPlugin plugin;

  public RequiredPluginRule(RequiredPlugin plugin) {
    this.plugin = checkNotNull(plugin);
  }

  /** Returns the rule requiring the Gradle build scan plugin. */
  public static RequiredPluginRule buildScan() {
    return new RequiredPluginRule(RequiredPlugin.BUILD_SCAN);
  }

  @Override
  public String getName() {
    return plugin.getRuleName();
  }

  @Override
  public String getDescription() {
    return plugin.getDescription();
  }

  public RequiredPlugin getPlugin() {
    return plugin;
  }

  @Override
  public void visitApplyPlugin(MethodCallExpression call, String pluginId) {
    if (pluginId.equals(plugin.getPluginId())) {
      bookmarkFirst(PLUGIN_FOUND_ON_APPLY_PLUGIN, call);
    }
    bookmarkFirst(FIRST_APPLY_PLUGIN, call);
    bookmark(LAST_APPLY_PLUGIN, call);
  }

  @Override
  public void visitGradlePlugin(MethodCallExpression call, String conf, GradlePlugin declared) {
    if (declared.id().equals(plugin.getPluginId())) {
      bookmarkFirst(PLUGIN_FOUND_IN_PLUGINS_BLOCK, call);
    }
    bookmarkFirst(FIRST_PLUGIN_IN_PLUGINS_BLOCK, call);
  }

  @Override
  public void visitPlugins(MethodCallExpression call) {
    bookmarkFirst(PLUGINS_BLOCK, call);
  }

  @Override
  public void visitBuildscript(MethodCallExpression call) {
    bookmarkFirst(BUILDSCRIPT, call);
  }

  @Override
  public void visitRepositories(MethodCallExpression call) {
    if (isInBlock(BlockKind.BUILDSCRIPT)) {
      bookmarkFirst(BUILDSCRIPT_REPOSITORIES, call);
    }
  }

  @Override
  public void visitDependencies(MethodCallExpression call) {
    if (isInBlock(BlockKind.BUILDSCRIPT)) {
      bookmarkFirst(BUILDSCRIPT_DEPENDENCIES, call);
    }
  }

  @Override
  public void visitGradleDependency(
      MethodCallExpression call, String conf, GradleDependency dependency) {
    if (!conf.equals("classpath") || !isInBlock(BlockKind.BUILDSCRIPT)) {
      return;
    }
    if (dependency.toNotation().equals(plugin.getClasspathCoordinate())) {
      bookmarkFirst(REQUIRED_DEPENDENCY, call);
    }
    bookmarkFirst(FIRST_BUILDSCRIPT_DEPENDENCY, call);
  }

  @Override
  public void visitScriptComplete(ModuleNode module) {
    if (bookmark(PLUGIN_FOUND_IN_PLUGINS_BLOCK) != null
        || bookmark(PLUGIN_FOUND_ON_APPLY_PLUGIN) != null) {
      return;
    }
    GradleViolation violation = addBuildLintViolation(plugin.getMessage());

    ASTNode firstPluginInPluginsBlock = bookmark(FIRST_PLUGIN_IN_PLUGINS_BLOCK);
    ASTNode firstApplyPlugin = bookmark(FIRST_APPLY_PLUGIN);
    if (firstPluginInPluginsBlock != null) {
      fixPluginsBlock(violation, firstPluginInPluginsBlock);
    } else if (firstApplyPlugin != null) {
      fixApplyPluginStatements(violation, firstApplyPlugin);
    } else {
      fixScriptWithoutPlugins(violation);
    }
  }

  private void fixPluginsBlock(GradleViolation violation, ASTNode firstPluginInPluginsBlock) {
    ASTNode pluginsBlock = bookmark(PLUGINS_BLOCK);
    if (firstPluginInPluginsBlock.getLineNumber() > pluginsBlock.getLineNumber()) {
      violation.insertBefore(firstPluginInPluginsBlock, plugin.pluginDeclaration());
      if (!plugin.getSettingsTemplate().isEmpty()) {
        violation.insertAfter(pluginsBlock, plugin.getSettingsTemplate());
      }
      return;
    }
    // plugins { id 'java' } leaves no line inside the block, so a second block follows it.
    violation.insertAfter(pluginsBlock, withSettingsTemplate(pluginsBlockText()));
  }

  private void fixApplyPluginStatements(GradleViolation violation, ASTNode firstApplyPlugin) {
    String buildscript = fixBuildscriptDependencies(violation);
    violation.insertBefore(firstApplyPlugin, buildscript + plugin.applyStatement());
    if (!plugin.getSettingsTemplate().isEmpty()) {
      violation.insertAfter(bookmark(LAST_APPLY_PLUGIN), plugin.getSettingsTemplate());
    }
  }

  private void fixScriptWithoutPlugins(GradleViolation violation) {
    ToolVersion version = getToolVersion();
    String text;
    if (version == null || version.isNewerThan(LAST_VERSION_WITHOUT_PLUGINS_BLOCK)) {
      text = pluginsBlockText();
    } else {
      text = fixBuildscriptDependencies(violation) + plugin.applyStatement();
    }
    text = withSettingsTemplate(text);

    ASTNode buildscript = bookmark(BUILDSCRIPT);
    if (buildscript != null) {
      violation.insertAfter(buildscript, text);
    } else {
      violation.insertAtDocumentStart(text);
    }
  }

  private String pluginsBlockText() {
    return "plugins {\n    " + plugin.pluginDeclaration() + "\n}";
  }

  private String withSettingsTemplate(String text) {
    return plugin.getSettingsTemplate().isEmpty()
        ? text
        : text + "\n" + plugin.getSettingsTemplate();
  }

  /**
   * Adds the plugin's classpath dependency to the buildscript block. A script without a buildscript
   * block gets a new one, which is returned for the caller to insert ahead of its apply statement;
   * otherwise the returned text is empty.
   */
  private String fixBuildscriptDependencies(GradleViolation violation) {
    if (bookmark(REQUIRED_DEPENDENCY) != null) {
      return "";
    }
    ASTNode buildscript = bookmark(BUILDSCRIPT);
    if (buildscript == null) {
      return "buildscript {\n"
          + "    repositories {\n"
          + "        maven { url '" + PLUGIN_REPOSITORY + "' }\n"
          + "    }\n"
          + "    dependencies {\n"
          + "        " + plugin.classpathDeclaration() + "\n"
          + "    }\n"
          + "}\n";
    }

    ASTNode dependencies = bookmark(BUILDSCRIPT_DEPENDENCIES);
    ASTNode firstDependency = bookmark(FIRST_BUILDSCRIPT_DEPENDENCY);
    if (dependencies != null
        && firstDependency != null
        && firstDependency.getLineNumber() > dependencies.getLineNumber()
        && firstDependency.getLineNumber() <= dependencies.getLastLineNumber()) {
      violation.insertBefore(firstDependency, plugin.classpathDeclaration());
      return "";
    }

    // Lines inserted after the repositories block must still fall inside the buildscript block.
    ASTNode repositories = bookmark(BUILDSCRIPT_REPOSITORIES);
    if (repositories == null
        || repositories.getLastLineNumber() >= buildscript.getLastLineNumber()) {
      logger.fine(
          "No line in the buildscript block of "
              + getScript().getName()
              + " to add "
              + plugin.getClasspathCoordinate()
              + " at");
      return "";
    }
    violation.insertAfter(
        repositories, "dependencies {\n    " + plugin.classpathDeclaration() + "\n}");
    return "";
  }
}
