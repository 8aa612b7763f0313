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

import com.dualbuild.rhino.IR;
import com.dualbuild.rhino.Node;

/**
 * Patches the places that still mention removed code once it is gone, so that the remaining tree
 * binds no removed name.
 */
final class ReferenceRewriter {
  private final RemovedSymbolTracker tracker;

  ReferenceRewriter(RemovedSymbolTracker tracker) {
    this.tracker = tracker;
  }

  /** Whether {@code n} reads a removed name and must be replaced by {@code void 0}. */
  boolean isReferenceToRemoved(Node n) {
    if (!n.isName()) {
      return false;
    }
    String name = n.getString();
    return tracker.contains(name)
        && !CriticalSymbols.isCriticalIdentifier(name)
        && !NodeUtil.isBindingPosition(n)
        && !NodeUtil.isShadowedByParameter(n);
  }

  /** Whether {@code n} assigns to a removed name, as in {@code Secret = value}. */
  boolean isAssignmentToRemoved(Node n) {
    if (!n.isAssign() || !n.getFirstChild().isName()) {
      return false;
    }
    Node target = n.getFirstChild();
    String name = target.getString();
    return tracker.contains(name)
        && !CriticalSymbols.isCriticalIdentifier(name)
        && !NodeUtil.isShadowedByParameter(target);
  }

  /**
   * Drops an assignment to a removed name. An assignment statement is removed; an assignment used
   * as a value is replaced by that value.
   *
   * @return the node that now holds the position of the assignment
   */
  Node removeAssignment(Node assign) {
    checkState(isAssignmentToRemoved(assign), assign);
    Node parent = assign.getParent();
    if (parent.isExprResult()) {
      return NodeUtil.removeChild(parent.getParent(), parent);
    }
    Node value = assign.getLastChild().detach();
    assign.replaceWith(value);
    return value;
  }

  /**
   * Replaces a reference to a removed name with {@code void 0}.
   *
   * @return the replacement
   */
  Node rewriteReference(Node name) {
    checkState(isReferenceToRemoved(name), name);
    Node undefined = NodeUtil.newUndefinedNode(name);
    name.replaceWith(undefined);
    return undefined;
  }

  /**
   * Replaces {@code flag && markup} with {@code false}.
   *
   * @return the replacement
   */
  Node rewriteGuardedRender(Node and) {
    checkState(and.isAnd(), and);
    Node falseNode = IR.falseNode().srcref(and);
    and.replaceWith(falseNode);
    return falseNode;
  }

  /**
   * Replaces the content of a {@code {flag && markup}} slot with {@code null}, keeping the slot.
   *
   * @return the replacement
   */
  Node clearContainer(Node container) {
    checkState(container.isJsxExpressionContainer(), container);
    Node content = container.getFirstChild();
    if (content.isNull()) {
      return content;
    }
    Node renderNothing = IR.nullNode().srcref(content);
    content.replaceWith(renderNothing);
    return renderNothing;
  }
}
