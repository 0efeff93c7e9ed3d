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

import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BookmarkStoreTest {
  private final BookmarkStore store = new BookmarkStore();
  private final ConstantExpression first = new ConstantExpression("first");
  private final ConstantExpression second = new ConstantExpression("second");

  @Test
  public void testFirstWinsKeepsFirstNode() {
    assertThat(store.put("label", first, BookmarkPolicy.FIRST_WINS)).isTrue();
    assertThat(store.put("label", second, BookmarkPolicy.FIRST_WINS)).isFalse();
    assertThat(store.get("label")).isSameInstanceAs(first);
  }

  @Test
  public void testLastWinsKeepsLastNode() {
    store.put("label", first, BookmarkPolicy.LAST_WINS);
    assertThat(store.put("label", second, BookmarkPolicy.LAST_WINS)).isTrue();
    assertThat(store.get("label")).isSameInstanceAs(second);
  }

  @Test
  public void testMissingLabel() {
    assertThat(store.get("missing")).isNull();
    assertThat(store.contains("missing")).isFalse();
  }

  @Test
  public void testPolicyOfLabelCannotChange() {
    store.put("label", first, BookmarkPolicy.FIRST_WINS);
    assertThrows(
        IllegalStateException.class, () -> store.put("label", second, BookmarkPolicy.LAST_WINS));
  }

  @Test
  public void testClearForgetsNodesButNotPolicies() {
    store.put("label", first, BookmarkPolicy.FIRST_WINS);
    store.clear();

    assertThat(store.contains("label")).isFalse();
    assertThat(store.put("label", second, BookmarkPolicy.FIRST_WINS)).isTrue();
    assertThat(store.get("label")).isSameInstanceAs(second);
    assertThrows(
        IllegalStateException.class, () -> store.put("label", first, BookmarkPolicy.LAST_WINS));
  }
}
