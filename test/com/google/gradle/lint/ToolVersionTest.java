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
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ToolVersionTest {

  @Test
  public void testComparesNumerically() {
    assertThat(ToolVersion.parse("3.2").isNewerThan(ToolVersion.parse("2.1"))).isTrue();
    assertThat(ToolVersion.parse("2.10").isNewerThan(ToolVersion.parse("2.9"))).isTrue();
    assertThat(ToolVersion.parse("2.0").isNewerThan(ToolVersion.parse("2.1"))).isFalse();
    assertThat(ToolVersion.parse("2.1").isNewerThan(ToolVersion.parse("2.1"))).isFalse();
    assertThat(ToolVersion.parse("2.1.1").isNewerThan(ToolVersion.parse("2.1"))).isTrue();
  }

  @Test
  public void testMissingComponentsAreZero() {
    assertThat(ToolVersion.parse("2")).isEqualTo(ToolVersion.parse("2.0.0"));
    assertThat(ToolVersion.parse("2").hashCode()).isEqualTo(ToolVersion.parse("2.0.0").hashCode());
  }

  @Test
  public void testQualifiedVersionSortsBeforeRelease() {
    ToolVersion candidate = ToolVersion.parse("4.10-rc-1");
    assertThat(candidate).isLessThan(ToolVersion.parse("4.10"));
    assertThat(candidate).isGreaterThan(ToolVersion.parse("4.9"));
    assertThat(candidate.toString()).isEqualTo("4.10-rc-1");
  }

  @Test
  public void testRejectsNonNumericVersion() {
    assertThrows(IllegalArgumentException.class, () -> ToolVersion.parse("latest"));
  }
}
