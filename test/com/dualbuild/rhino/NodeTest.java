/*
 *
 * ***** BEGIN LICENSE BLOCK *****
 * Version: MPL 1.1/GPL 2.0
 *
 * The contents of this file are subject to the Mozilla Public License Version
 * 1.1 (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 * http://www.mozilla.org/MPL/
 *
 * Software distributed under the License is distributed on an "AS IS" basis,
 * WITHOUT WARRANTY OF ANY KIND, either express or implied. See the License
 * for the specific language governing rights and limitations under the
 * License.
 *
 * The Original Code is Rhino code, released
 * May 6, 1999.
 *
 * The Initial Developer of the Original Code is
 * Netscape Communications Corporation.
 * Portions created by the Initial Developer are Copyright (C) 1997-1999
 * the Initial Developer. All Rights Reserved.
 *
 * Contributor(s):
 *   Norris Boyd
 *   Roger Lawrence
 *   Mike McCabe
 *
 * Alternatively, the contents of this file may be used under the terms of
 * the GNU General Public License Version 2 or later (the "GPL"), in which
 * case the provisions of the GPL are applicable instead of those above. If
 * you wish to allow use of your version of this file only under the terms of
 * the GPL and not to allow others to use your version of this file under the
 * MPL, indicate your decision by deleting the provisions above and replacing
 * them with the notice and other provisions required by the GPL. If you do
 * not delete the provisions above, a recipient may use your version of this
 * file under either the MPL or the GPL.
 *
 * ***** END LICENSE BLOCK ***** */

package com.dualbuild.rhino;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NodeTest {

  @Test
  public void testLinenoCharnoPacking() {
    Node n = new Node(Token.NAME);
    assertThat(n.getLineno()).isEqualTo(-1);
    assertThat(n.getCharno()).isEqualTo(-1);

    n.setLinenoCharno(12, 4);
    assertThat(n.getLineno()).isEqualTo(12);
    assertThat(n.getCharno()).isEqualTo(4);

    n.setLinenoCharno(3, Node.MAX_COLUMN_NUMBER + 100);
    assertThat(n.getCharno()).isEqualTo(Node.MAX_COLUMN_NUMBER);

    n.setLinenoCharno(-1, 0);
    assertThat(n.getLineno()).isEqualTo(-1);
  }

  @Test
  public void testChildNavigation() {
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node c = IR.name("c");
    Node call = new Node(Token.CALL, a, b, c);

    assertThat(call.getFirstChild()).isSameInstanceAs(a);
    assertThat(call.getSecondChild()).isSameInstanceAs(b);
    assertThat(call.getLastChild()).isSameInstanceAs(c);
    assertThat(b.getNext()).isSameInstanceAs(c);
    assertThat(b.getPrevious()).isSameInstanceAs(a);
    assertThat(a.getPrevious()).isNull();
    assertThat(c.getNext()).isNull();
    assertThat(call.getChildCount()).isEqualTo(3);
    assertThat(call.getIndexOfChild(c)).isEqualTo(2);
    assertThat(call.getChildAtIndex(1)).isSameInstanceAs(b);
  }

  @Test
  public void testDetach() {
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node c = IR.name("c");
    Node call = new Node(Token.CALL, a, b, c);

    b.detach();
    assertThat(b.getParent()).isNull();
    assertThat(a.getNext()).isSameInstanceAs(c);
    assertThat(c.getPrevious()).isSameInstanceAs(a);

    c.detach();
    assertThat(call.getLastChild()).isSameInstanceAs(a);

    a.detach();
    assertThat(call.hasChildren()).isFalse();
  }

  @Test
  public void testReplaceWith() {
    Node a = IR.name("a").setLinenoCharno(5, 2);
    Node b = IR.name("b");
    Node not = IR.not(a);
    Node replacement = IR.name("x");

    a.replaceWith(replacement);

    assertThat(not.getOnlyChild()).isSameInstanceAs(replacement);
    assertThat(replacement.getLineno()).isEqualTo(5);
    assertThat(a.getParent()).isNull();

    Node and = IR.and(IR.name("p"), b);
    b.replaceWith(IR.falseNode());
    assertThat(and.getLastChild().isFalse()).isTrue();
    assertThat(and.getFirstChild().getNext()).isSameInstanceAs(and.getLastChild());
  }

  @Test
  public void testInsertBeforeAndAfter() {
    Node b = IR.exprResult(IR.name("b"));
    Node block = IR.block(b);
    Node a = IR.exprResult(IR.name("a"));
    Node c = IR.exprResult(IR.name("c"));

    a.insertBefore(b);
    c.insertAfter(b);

    assertThat(block.getFirstChild()).isSameInstanceAs(a);
    assertThat(block.getSecondChild()).isSameInstanceAs(b);
    assertThat(block.getLastChild()).isSameInstanceAs(c);
  }

  @Test
  public void testCannotAddAttachedChild() {
    Node a = IR.name("a");
    IR.not(a);
    assertThrows(IllegalArgumentException.class, () -> IR.not(a));
  }

  @Test
  public void testComments() {
    Comment marker = Comment.line(" @employee-code", 3);
    Node n = IR.exprResult(IR.name("a"));
    assertThat(n.hasAttachedComments()).isFalse();

    n.addLeadingComment(marker).addTrailingComment(Comment.block(" done ", 4));

    assertThat(n.getLeadingComments()).containsExactly(marker);
    assertThat(n.getTrailingComments()).hasSize(1);
    assertThat(n.hasAttachedComments()).isTrue();
    assertThat(marker.contains("@employee-code")).isTrue();
    assertThat(marker.hasLocation()).isTrue();
    assertThat(Comment.line("x", -1).hasLocation()).isFalse();
  }

  @Test
  public void testFileCommentsAndSourceNameBelongOnScript() {
    Node script = IR.script(IR.exprResult(IR.name("a")));
    assertThat(script.getFileComments()).isNull();

    script.setFileComments(ImmutableList.of(Comment.block("x", 1))).setSourceFileName("a.tsx");

    assertThat(script.getFileComments()).hasSize(1);
    assertThat(script.getFirstChild().getFirstChild().getSourceFileName()).isEqualTo("a.tsx");
    assertThrows(
        IllegalStateException.class, () -> IR.name("a").setSourceFileName("a.tsx"));
    assertThrows(
        IllegalStateException.class, () -> IR.block().setFileComments(ImmutableList.of()));
  }

  @Test
  public void testQualifiedName() {
    Node getprop = IR.getprop(IR.name("StyleSheet"), "create");
    assertThat(getprop.getQualifiedName()).isEqualTo("StyleSheet.create");
    assertThat(getprop.matchesQualifiedName("StyleSheet.create")).isTrue();
    assertThat(IR.getprop(IR.call(IR.name("f")), "x").getQualifiedName()).isNull();
    assertThat(IR.string("a").getQualifiedName()).isNull();
  }

  @Test
  public void testCloneTreeIsEquivalent() {
    Node original =
        IR.jsxElement(
            IR.jsxOpeningElement("View", IR.jsxAttribute("testID", IR.string("root"))),
            IR.jsxText("hi"));
    original.addLeadingComment(Comment.line(" note", 1));

    Node clone = original.cloneTree();

    assertThat(clone).isNotSameInstanceAs(original);
    assertThat(clone.isEquivalentTo(original)).isTrue();
    clone.getFirstChild().setString("Text");
    assertThat(clone.isEquivalentTo(original)).isFalse();
  }

  @Test
  public void testFlags() {
    Node opening = IR.jsxOpeningElement("View");
    assertThat(opening.isSelfClosing()).isFalse();
    opening.setSelfClosing(true);
    assertThat(opening.isSelfClosing()).isTrue();

    Node arrow = IR.arrowFunction(IR.paramList(), IR.block());
    assertThat(arrow.isArrowFunction()).isTrue();
    assertThat(IR.exportDefault(IR.name("a")).isDefaultExport()).isTrue();
    assertThat(IR.export(IR.constNode(IR.name("a"), IR.number(1))).isDefaultExport()).isFalse();
    assertThrows(IllegalStateException.class, () -> IR.name("a").setSelfClosing(true));
  }

  @Test
  public void testEnclosingScript() {
    Node name = IR.name("a");
    Node script = IR.script(IR.exprResult(name));

    assertThat(name.getEnclosingScript()).isSameInstanceAs(script);
    assertThat(script.getEnclosingScript()).isSameInstanceAs(script);
    assertThat(IR.name("b").getEnclosingScript()).isNull();
    assertThat(name.isDescendantOf(script)).isTrue();
  }

  @Test
  public void testToString() {
    assertThat(IR.name("a").setLinenoCharno(2, 3).toString()).isEqualTo("NAME a 2:3");
    assertThat(IR.number(1).toString()).isEqualTo("NUMBER 1.0");
    assertThat(IR.returnNode().toString()).isEqualTo("RETURN");
  }
}
