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
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * A module dependency as declared in a build script, or the module pattern of a configuration
 * exclude.
 */
public record GradleDependency(
    @Nullable String group,
    @Nullable String name,
    @Nullable String version,
    @Nullable String classifier,
    @Nullable String ext,
    @Nullable String conf,
    Syntax syntax) {

  /** How the dependency was written in the script. */
  public enum Syntax {
    /** {@code compile group: 'a', name: 'b', version: '1'} */
    MAP_NOTATION,
    /** {@code compile 'a:b:1'} */
    STRING_NOTATION,
    /** {@code compile deps.b}, resolved through the build model */
    EVALUATED_ARBITRARY_CODE
  }

  // group:name:version:classifier@ext, where only the name is required
  private static final Pattern STRING_NOTATION =
      Pattern.compile(
          "((?<group>[^:]+):)?(?<name>[^:@]+)"
              + "(:(?<version>[^@:]+)(:(?<classifier>[^@:]+))?)?(@(?<ext>.+))?");

  /** Builds a dependency from the named arguments of a declaration. */
  static GradleDependency fromMapNotation(Map<String, String> entries) {
    return new GradleDependency(
        entries.get("group"),
        entries.get("name"),
        entries.get("version"),
        entries.get("classifier"),
        entries.get("ext"),
        entries.get("conf"),
        Syntax.MAP_NOTATION);
  }

  /** Returns the parsed notation, or null if the text is not a dependency notation. */
  public static @Nullable GradleDependency fromStringNotation(String notation) {
    return fromStringNotation(notation, Syntax.STRING_NOTATION);
  }

  static @Nullable GradleDependency fromStringNotation(String notation, Syntax syntax) {
    Matcher matcher = STRING_NOTATION.matcher(notation);
    if (!matcher.matches()) {
      return null;
    }
    return new GradleDependency(
        matcher.group("group"),
        matcher.group("name"),
        matcher.group("version"),
        matcher.group("classifier"),
        matcher.group("ext"),
        null,
        syntax);
  }

  /** Renders the dependency in string notation, leaving out the parts that are absent. */
  public String toNotation() {
    StringBuilder sb = new StringBuilder();
    if (group != null) {
      sb.append(group);
    }
    sb.append(':').append(name == null ? "" : name);
    if (version != null) {
      sb.append(':').append(version);
    }
    if (classifier != null) {
      sb.append(':').append(classifier);
    }
    if (ext != null) {
      sb.append('@').append(ext);
    }
    return group == null ? sb.substring(1) : sb.toString();
  }
}
