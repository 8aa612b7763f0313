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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names whose declarations were pruned from one file, in the order they were removed.
 *
 * <p>Names only ever enter. Critical identifiers never do. Table entries are recorded under
 * {@code table.entry}. Names tracked because they alias a removed declaration do not seed further
 * aliases, so {@code const B = A; const C = B;} removes {@code B} but keeps {@code C}.
 */
final class RemovedSymbolTracker {
  private final Set<String> removed = new LinkedHashSet<>();
  private final Set<String> aliasSources = new HashSet<>();

  /**
   * Tracks a name whose own declaration was removed.
   *
   * @return whether the name was newly tracked
   */
  @CanIgnoreReturnValue
  boolean trackDeclared(String name) {
    if (!track(name)) {
      return false;
    }
    aliasSources.add(name);
    return true;
  }

  /**
   * Tracks a name removed because its initializer referenced a removed declaration.
   *
   * @return whether the name was newly tracked
   */
  @CanIgnoreReturnValue
  boolean trackAlias(String name) {
    return track(name);
  }

  /**
   * Tracks the entry {@code entry} of the table bound to {@code tableName}.
   *
   * @return whether the entry was newly tracked
   */
  @CanIgnoreReturnValue
  boolean trackTableEntry(String tableName, String entry) {
    return track(tableEntryKey(tableName, entry));
  }

  private boolean track(String name) {
    if (name.isEmpty() || CriticalSymbols.isCriticalIdentifier(name)) {
      return false;
    }
    return removed.add(name);
  }

  boolean contains(String name) {
    return removed.contains(name);
  }

  boolean containsTableEntry(String tableName, String entry) {
    return removed.contains(tableEntryKey(tableName, entry));
  }

  /** Whether a variable initialized with {@code name} should be removed along with it. */
  boolean isAliasSource(String name) {
    return aliasSources.contains(name);
  }

  boolean isEmpty() {
    return removed.isEmpty();
  }

  ImmutableList<String> getRemovedNames() {
    return ImmutableList.copyOf(removed);
  }

  static String tableEntryKey(String tableName, String entry) {
    return tableName + "." + entry;
  }

  @Override
  public String toString() {
    return "RemovedSymbolTracker" + removed;
  }
}
