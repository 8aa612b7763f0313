/*
 * Copyright 2004 The Closure Compiler Authors.
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

import com.dualbuild.rhino.Node;
import org.jspecify.annotations.Nullable;

/** NodeTraversal allows an iteration through the nodes in the parse tree. */
public class NodeTraversal {
  private final AbstractCompiler compiler;
  private final Callback callback;

  /** Contains the current node */
  private @Nullable Node currentNode;

  /** The current source file name */
  private @Nullable String sourceName;

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether the node and its children
     * should be traversed.
     *
     * <p>If this method returns true, the node will be visited by {@link #visit(NodeTraversal,
     * Node, Node)} in postorder and its children will be visited by both {@link
     * #shouldTraverse(NodeTraversal, Node, Node)} in preorder and by {@link #visit(NodeTraversal,
     * Node, Node)} in postorder.
     *
     * <p>If this method returns false, the node will not be visited by {@link #visit(NodeTraversal,
     * Node, Node)} and its children will neither be visited by {@link
     * #shouldTraverse(NodeTraversal, Node, Node)} nor {@link #visit(NodeTraversal, Node, Node)}.
     *
     * <p>Siblings are always visited left-to-right.
     *
     * <p>Implementations can have side-effects (e.g. modify the parse tree). Removing or replacing
     * the current node is legal; the removed node is not visited again. Removing or reordering
     * nodes above the current node may cause nodes to be visited twice or not at all.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     * @return whether the children of this node should be visited
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children). A node is visited in postorder iff {@link
     * #shouldTraverse(NodeTraversal, Node, Node)} returned true for its parent and itself.
     *
     * <p>Siblings are always visited left-to-right.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal nodeTraversal, Node n, @Nullable Node parent) {
      return true;
    }
  }

  /** Abstract callback to visit all nodes in preorder. */
  public abstract static class AbstractPreOrderCallback implements Callback {
    @Override
    public final void visit(NodeTraversal t, Node n, @Nullable Node parent) {}
  }

  /** Creates a node traversal using the specified callback interface. */
  public NodeTraversal(AbstractCompiler compiler, Callback cb) {
    this.compiler = compiler;
    this.callback = cb;
  }

  /** Traverses a parse tree recursively. */
  public static void traverse(AbstractCompiler compiler, Node root, Callback cb) {
    NodeTraversal t = new NodeTraversal(compiler, cb);
    t.traverse(root);
  }

  /** Traverses a parse tree recursively. */
  public void traverse(Node root) {
    try {
      Node script = root.getEnclosingScript();
      sourceName = script == null ? null : script.getSourceFileName();
      traverseBranch(root, root.getParent());
    } catch (Error | RuntimeException unexpectedException) {
      throwUnexpectedException(unexpectedException);
    }
  }

  private void throwUnexpectedException(Throwable unexpectedException) {
    // If there's an unexpected exception, try to get the
    // line number of the code that caused it.
    String message = unexpectedException.getMessage();

    if (currentNode != null) {
      message =
          unexpectedException.getClass().getSimpleName()
              + ": "
              + message
              + "\n  Node("
              + currentNode.getToken()
              + "): "
              + formatNodePosition(currentNode);
    }

    compiler.throwInternalError(message, unexpectedException);
  }

  private String formatNodePosition(Node n) {
    String sourceFileName = n.getSourceFileName();
    if (sourceFileName == null) {
      sourceFileName = sourceName;
    }
    return (sourceFileName == null ? "[source unknown]" : sourceFileName)
        + ":"
        + n.getLineno()
        + ":"
        + n.getCharno();
  }

  /** Traverses a branch. */
  private void traverseBranch(Node n, @Nullable Node parent) {
    currentNode = n;
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }
    if (n.getParent() != parent) {
      // The callback detached or replaced n, so there is nothing left to visit under it.
      return;
    }

    traverseChildren(n);

    currentNode = n;
    callback.visit(this, n, parent);
  }

  /** Traverses the children. */
  private void traverseChildren(Node n) {
    for (Node child = n.getFirstChild(); child != null; ) {
      // child could be replaced, in which case our child node
      // would no longer point to the true next
      Node next = child.getNext();
      traverseBranch(child, n);
      child = next;
    }
  }

  /** Reports a diagnostic (error or warning) */
  public void report(Node n, DiagnosticType diagnosticType, String... arguments) {
    JSError error = JSError.make(n, diagnosticType, arguments);
    compiler.report(error);
  }

  /** Records a change to the tree under {@code n}. */
  public void reportCodeChange(Node n) {
    compiler.reportChangeToEnclosingScope(n);
  }
}
