/*
 * Copyright 2008 The Closure Compiler Authors.
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
import static org.junit.Assert.assertThrows;

import com.dualbuild.jscomp.NodeTraversal.AbstractPostOrderCallback;
import com.dualbuild.jscomp.NodeTraversal.AbstractPreOrderCallback;
import com.dualbuild.rhino.IR;
import com.dualbuild.rhino.Node;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link NodeTraversal}. */
@RunWith(JUnit4.class)
public final class NodeTraversalTest {
  private final Compiler compiler = new Compiler(new PruneOptions());

  private static Node script() {
    return IR.script(
        IR.exprResult(IR.call(IR.name("a"), IR.name("b"))),
        IR.exprResult(IR.name("c")));
  }

  @Test
  public void testPreAndPostOrder() {
    List<String> pre = new ArrayList<>();
    List<String> post = new ArrayList<>();
    Node script = script();

    NodeTraversal.traverse(
        compiler,
        script,
        new AbstractPreOrderCallback() {
          @Override
          public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.isName()) {
              pre.add(n.getString());
            }
            return true;
          }
        });
    NodeTraversal.traverse(
        compiler,
        script,
        new AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            post.add(n.getToken().toString());
          }
        });

    assertThat(pre).containsExactly("a", "b", "c").inOrder();
    assertThat(post)
        .containsExactly("NAME", "NAME", "CALL", "EXPR_RESULT", "NAME", "EXPR_RESULT", "SCRIPT")
        .inOrder();
  }

  @Test
  public void testDetachedNodesAreNotEntered() {
    List<String> seen = new ArrayList<>();
    Node script = script();

    NodeTraversal.traverse(
        compiler,
        script,
        new AbstractPreOrderCallback() {
          @Override
          public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.isName()) {
              seen.add(n.getString());
            }
            if (n.isCall()) {
              n.replaceWith(IR.nullNode());
            }
            return true;
          }
        });

    assertThat(seen).containsExactly("c");
    assertThat(CodePrinter.toSource(script)).isEqualTo("null;\nc;");
  }

  @Test
  public void testExceptionsBecomeInternalErrors() {
    Node script = script();

    RuntimeException e =
        assertThrows(
            RuntimeException.class,
            () ->
                NodeTraversal.traverse(
                    compiler,
                    script,
                    new AbstractPostOrderCallback() {
                      @Override
                      public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
                        if (n.isCall()) {
                          throw new IllegalStateException("boom");
                        }
                      }
                    }));

    assertThat(e).hasMessageThat().contains("INTERNAL COMPILER ERROR");
    assertThat(e).hasMessageThat().contains("boom");
    assertThat(e).hasMessageThat().contains("Node(CALL)");
    assertThat(e).hasCauseThat().isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void testReportUsesNodePosition() {
    CollectingErrorManager errors = new CollectingErrorManager();
    Compiler reporting = new Compiler(new PruneOptions(), errors);
    Node script = script().setSourceFileName("a.tsx");
    script.getFirstChild().setLinenoCharno(3, 1);
    DiagnosticType type = DiagnosticType.warning("TEST_WARNING", "Saw {0}");

    NodeTraversal.traverse(
        reporting,
        script,
        new AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
            if (n.isExprResult() && n.getLineno() == 3) {
              t.report(n, type, "it");
            }
          }
        });

    assertThat(errors.getWarningCount()).isEqualTo(1);
    JSError warning = errors.getWarnings().get(0);
    assertThat(warning.format(CheckLevel.WARNING))
        .isEqualTo("a.tsx:3:1: WARNING - [TEST_WARNING] Saw it");
  }

  private static final class CollectingErrorManager extends BasicErrorManager {
    @Override
    public void println(CheckLevel level, JSError error) {}

    @Override
    protected void printSummary() {}
  }
}
