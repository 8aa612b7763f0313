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

import static com.google.common.base.Preconditions.checkState;

import com.dualbuild.rhino.Node;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of pruning one file: the same tree, mutated in place, and the names whose
 * declarations were removed, in removal order. A failed file carries the error instead and its
 * tree must not be used.
 */
public final class PruneResult {
  private final Node root;
  private final ImmutableList<String> removedSymbols;
  private final int changeCount;
  private final @Nullable JSError error;

  private PruneResult(
      Node root, ImmutableList<String> removedSymbols, int changeCount, @Nullable JSError error) {
    this.root = root;
    this.removedSymbols = removedSymbols;
    this.changeCount = changeCount;
    this.error = error;
  }

  static PruneResult pruned(Node root, ImmutableList<String> removedSymbols, int changeCount) {
    return new PruneResult(root, removedSymbols, changeCount, null);
  }

  /** The tree was not looked at: internal build or ineligible file. */
  static PruneResult unchanged(Node root) {
    return new PruneResult(root, ImmutableList.of(), 0, null);
  }

  static PruneResult failed(Node root, JSError error) {
    return new PruneResult(root, ImmutableList.of(), 0, error);
  }

  public Node getRoot() {
    return root;
  }

  public ImmutableList<String> getRemovedSymbols() {
    return removedSymbols;
  }

  /** Number of nodes removed, replaced or rewritten. */
  public int getChangeCount() {
    return changeCount;
  }

  public boolean isSuccess() {
    return error == null;
  }

  public JSError getError() {
    checkState(error != null, "Pruning succeeded");
    return error;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("file", root.getSourceFileName())
        .add("removedSymbols", removedSymbols)
        .add("changeCount", changeCount)
        .add("error", error)
        .toString();
  }
}
