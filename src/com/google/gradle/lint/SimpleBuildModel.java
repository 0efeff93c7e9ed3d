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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * A {@link BuildModel} backed by fixed values. Expressions are limited to dotted property paths,
 * such as {@code deps.guava}, resolved through nested maps of extra properties. Anything else is
 * unresolvable; no script code is ever executed.
 */
public final class SimpleBuildModel implements BuildModel {
  private static final Pattern PROPERTY_PATH =
      Pattern.compile("[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)*");
  private static final Splitter DOT_SPLITTER = Splitter.on('.');

  private final ImmutableSet<String> configurationNames;
  private final @Nullable ToolVersion toolVersion;
  private final ImmutableMap<String, Object> properties;

  private SimpleBuildModel(Builder builder) {
    this.configurationNames = builder.configurationNames.build();
    this.toolVersion = builder.toolVersion;
    this.properties = builder.properties.buildKeepingLast();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public ImmutableSet<String> getConfigurationNames() {
    return configurationNames;
  }

  @Override
  public @Nullable ToolVersion getToolVersion() {
    return toolVersion;
  }

  @Override
  public Optional<Object> evaluate(String expression) {
    String path = expression.trim();
    if (path.startsWith("project.")) {
      path = path.substring("project.".length());
    }
    if (!PROPERTY_PATH.matcher(path).matches()) {
      return Optional.empty();
    }
    Object current = properties;
    for (String segment : DOT_SPLITTER.split(path)) {
      if (!(current instanceof Map)) {
        return Optional.empty();
      }
      current = ((Map<?, ?>) current).get(segment);
    }
    return Optional.ofNullable(current);
  }

  /** Builder for {@link SimpleBuildModel}. */
  public static final class Builder {
    private final ImmutableSet.Builder<String> configurationNames = ImmutableSet.builder();
    private @Nullable ToolVersion toolVersion = null;
    private final ImmutableMap.Builder<String, Object> properties = ImmutableMap.builder();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder addConfigurationNames(String... names) {
      configurationNames.add(names);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addConfigurationNames(Iterable<String> names) {
      configurationNames.addAll(names);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setToolVersion(String version) {
      this.toolVersion = ToolVersion.parse(version);
      return this;
    }

    /**
     * Adds an extra property. Values that are maps are walked by the segments of a property path,
     * so {@code setProperty("deps", Map.of("guava", "com.google.guava:guava:33.0.0-jre"))} makes
     * {@code deps.guava} resolvable.
     */
    @CanIgnoreReturnValue
    public Builder setProperty(String name, Object value) {
      properties.put(name, checkNotNull(value));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setProperties(Map<String, ?> values) {
      values.forEach(this::setProperty);
      return this;
    }

    public SimpleBuildModel build() {
      return new SimpleBuildModel(this);
    }
  }

  @Override
  public String toString() {
    return "SimpleBuildModel{configurations="
        + configurationNames
        + ", toolVersion="
        + toolVersion
        + ", properties="
        + List.copyOf(properties.keySet())
        + "}";
  }
}
