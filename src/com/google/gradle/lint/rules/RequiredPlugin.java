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

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/** A plugin that every build script must apply, and how to add it to a script that does not. */
@AutoValue
@Immutable
public abstract class RequiredPlugin {

  /** The Gradle build scan plugin. */
  public static final RequiredPlugin BUILD_SCAN =
      builder()
          .setRuleName("build-scan")
          .setDescription("build-scan plugin should be applied")
          .setPluginId("com.gradle.build-scan")
          .setPluginVersion("1.4")
          .setClasspathCoordinate("com.gradle:build-scan-plugin:1.4")
          .setMessage(
              "build-scan plugin is not applied. Go to: https://scans.gradle.com/get-started")
          .setSettingsTemplate(
              "\n"
                  + "//buildScan {\n"
                  + "//    licenseAgreementUrl = 'https://gradle.com/terms-of-service'\n"
                  + "//    licenseAgree = 'yes'\n"
                  + "//}")
          .build();

  public abstract String getRuleName();

  public abstract String getDescription();

  public abstract String getPluginId();

  public abstract String getPluginVersion();

  /** The buildscript classpath dependency that provides the plugin, as group:name:version. */
  public abstract String getClasspathCoordinate();

  public abstract String getMessage();

  /** Text added after the plugin declaration for the user to fill in, often commented out. */
  public abstract String getSettingsTemplate();

  public static Builder builder() {
    return new AutoValue_RequiredPlugin.Builder().setSettingsTemplate("");
  }

  /** {@code id '<id>' version '<version>'} */
  String pluginDeclaration() {
    return "id '" + getPluginId() + "' version '" + getPluginVersion() + "'";
  }

  /** {@code apply plugin: '<id>'} */
  String applyStatement() {
    return "apply plugin: '" + getPluginId() + "'";
  }

  /** {@code classpath '<coordinate>'} */
  String classpathDeclaration() {
    return "classpath '" + getClasspathCoordinate() + "'";
  }

  /** Builder for {@link RequiredPlugin}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setRuleName(String ruleName);

    public abstract Builder setDescription(String description);

    public abstract Builder setPluginId(String pluginId);

    public abstract Builder setPluginVersion(String pluginVersion);

    public abstract Builder setClasspathCoordinate(String classpathCoordinate);

    public abstract Builder setMessage(String message);

    public abstract Builder setSettingsTemplate(String settingsTemplate);

    public abstract RequiredPlugin build();
  }
}
