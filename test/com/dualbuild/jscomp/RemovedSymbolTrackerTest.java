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

package com.dualbuild.jscomp;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link RemovedSymbolTracker}. */
@RunWith(JUnit4.class)
public final class RemovedSymbolTrackerTest {
  private final RemovedSymbolTracker tracker = new RemovedSymbolTracker();

  @Test
  public void testKeepsRemovalOrderWithoutDuplicates() {
    assertThat(tracker.trackDeclared("B")).isTrue();
    assertThat(tracker.trackDeclared("A")).isTrue();
    assertThat(tracker.trackDeclared("B")).isFalse();

    assertThat(tracker.getRemovedNames()).containsExactly("B", "A").inOrder();
    assertThat(tracker.isEmpty()).isFalse();
  }

  @Test
  public void testCriticalAndEmptyNamesAreNeverTracked() {
    assertThat(tracker.trackDeclared("View")).isFalse();
    assertThat(tracker.trackAlias("createElement")).isFalse();
    assertThat(tracker.trackDeclared("")).isFalse();

    assertThat(tracker.isEmpty()).isTrue();
    assertThat(tracker.contains("View")).isFalse();
  }

  @Test
  public void testAliasesDoNotSeedFurtherAliases() {
    tracker.trackDeclared("Secret");
    tracker.trackAlias("Alias");

    assertThat(tracker.contains("Alias")).isTrue();
    assertThat(tracker.isAliasSource("Secret")).isTrue();
    assertThat(tracker.isAliasSource("Alias")).isFalse();
  }

  @Test
  public void testTableEntries() {
    tracker.trackTableEntry("styles", "debugPanel");

    assertThat(tracker.containsTableEntry("styles", "debugPanel")).isTrue();
    assertThat(tracker.containsTableEntry("sheet", "debugPanel")).isFalse();
    assertThat(tracker.contains("debugPanel")).isFalse();
    assertThat(tracker.getRemovedNames()).containsExactly("styles.debugPanel");
    assertThat(RemovedSymbolTracker.tableEntryKey("a", "b")).isEqualTo("a.b");
  }
}
