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
import static org.junit.Assert.assertThrows;

import com.dualbuild.rhino.IR;
import com.dualbuild.rhino.Node;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ReferenceRewriter}. */
@RunWith(JUnit4.class)
public final class ReferenceRewriterTest {
  private RemovedSymbolTracker tracker;
  private ReferenceRewriter rewriter;

  @Before
  public void setUp() {
    tracker = new RemovedSymbolTracker();
    tracker.trackDeclared("Secret");
    rewriter = new ReferenceRewriter(tracker);
  }

  @Test
  public void testReferenceBecomesUndefined() {
    Node reference = IR.name("Secret").setLinenoCharno(3, 8);
    Node call = IR.call(IR.name("show"), reference);

    assertThat(rewriter.isReferenceToRemoved(reference)).isTrue();
    Node replacement = rewriter.rewriteReference(reference);

    assertThat(CodePrinter.toSource(call)).isEqualTo("show(void 0)");
    assertThat(replacement.getLineno()).isEqualTo(3);
    assertThat(replacement.getFirstChild().getLineno()).isEqualTo(3);
  }

  @Test
  public void testBindingsAndOtherNamesAreNotReferences() {
    Node declarator = IR.name("Secret");
    IR.constNode(declarator, IR.number(1));
    Node param = IR.name("Secret");
    IR.paramList(param);
    Node target = IR.name("Secret");
    IR.assign(target, IR.number(1));
    Node other = IR.name("Public");
    IR.exprResult(other);

    assertThat(rewriter.isReferenceToRemoved(declarator)).isFalse();
    assertThat(rewriter.isReferenceToRemoved(param)).isFalse();
    assertThat(rewriter.isReferenceToRemoved(target)).isFalse();
    assertThat(rewriter.isReferenceToRemoved(other)).isFalse();
    assertThat(rewriter.isReferenceToRemoved(IR.string("Secret"))).isFalse();
    assertThrows(IllegalStateException.class, () -> rewriter.rewriteReference(declarator));
  }

  @Test
  public void testNameShadowedByParameterIsNotAReference() {
    Node shadowed = IR.name("Secret");
    IR.function(
        IR.name("show"),
        IR.paramList(IR.name("Secret")),
        IR.block(IR.returnNode(IR.call(IR.name("log"), shadowed))));
    Node outer = IR.name("Secret");
    IR.function(
        IR.name("render"), IR.paramList(IR.name("props")), IR.block(IR.returnNode(outer)));

    assertThat(rewriter.isReferenceToRemoved(shadowed)).isFalse();
    assertThat(rewriter.isReferenceToRemoved(outer)).isTrue();
  }

  @Test
  public void testAssignmentStatementIsRemoved() {
    Node assign = IR.assign(IR.name("Secret"), IR.number(2));
    Node script = IR.script(IR.exprResult(assign), IR.exprResult(IR.call(IR.name("done"))));

    assertThat(rewriter.isAssignmentToRemoved(assign)).isTrue();
    Node changed = rewriter.removeAssignment(assign);

    assertThat(changed).isSameInstanceAs(script);
    assertThat(CodePrinter.toSource(script)).isEqualTo("done();");
  }

  @Test
  public void testAssignmentValueIsKept() {
    Node assign = IR.assign(IR.name("Secret"), IR.call(IR.name("load")));
    Node call = IR.call(IR.name("show"), assign);

    Node value = rewriter.removeAssignment(assign);

    assertThat(value.isCall()).isTrue();
    assertThat(CodePrinter.toSource(call)).isEqualTo("show(load())");
  }

  @Test
  public void testOtherAssignmentsAreKept() {
    Node property = IR.assign(IR.getprop(IR.name("Secret"), "value"), IR.number(1));
    Node other = IR.assign(IR.name("Public"), IR.number(1));
    Node shadowed = IR.assign(IR.name("Secret"), IR.number(1));
    IR.function(
        IR.name("f"), IR.paramList(IR.name("Secret")), IR.block(IR.exprResult(shadowed)));

    assertThat(rewriter.isAssignmentToRemoved(property)).isFalse();
    assertThat(rewriter.isAssignmentToRemoved(other)).isFalse();
    assertThat(rewriter.isAssignmentToRemoved(shadowed)).isFalse();
    assertThat(rewriter.isAssignmentToRemoved(IR.name("Secret"))).isFalse();
    assertThrows(IllegalStateException.class, () -> rewriter.removeAssignment(other));
  }

  @Test
  public void testGuardedRenderBecomesFalse() {
    Node and = IR.and(IR.name("IS_EMPLOYEE_MODE"), IR.jsxSelfClosing("Secret"));
    Node container = IR.jsxExpressionContainer(and);

    rewriter.rewriteGuardedRender(and);

    assertThat(container.getFirstChild().isFalse()).isTrue();
  }

  @Test
  public void testClearContainer() {
    Node container =
        IR.jsxExpressionContainer(IR.and(IR.name("IS_EMPLOYEE_MODE"), IR.name("a")));
    IR.jsxElement(IR.jsxOpeningElement("View"), container);

    Node cleared = rewriter.clearContainer(container);

    assertThat(cleared.isNull()).isTrue();
    assertThat(container.getFirstChild()).isSameInstanceAs(cleared);
    assertThat(rewriter.clearContainer(container)).isSameInstanceAs(cleared);
  }
}
