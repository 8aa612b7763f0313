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

import com.dualbuild.rhino.Comment.Style;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CommentTest {

  @Test
  public void testLineComment() {
    Comment comment = Comment.line(" @employee-code", 4);

    assertThat(comment.getStyle()).isEqualTo(Style.LINE);
    assertThat(comment.getCommentString()).isEqualTo(" @employee-code");
    assertThat(comment.getLineno()).isEqualTo(4);
    assertThat(comment.hasLocation()).isTrue();
    assertThat(comment.contains("@employee-code")).isTrue();
    assertThat(comment.contains("@internal")).isFalse();
    assertThat(comment.toString()).isEqualTo("// @employee-code @4:0");
  }

  @Test
  public void testBlockCommentWithoutLocation() {
    Comment comment = new Comment(Style.BLOCK, " note ", -1, -1);

    assertThat(comment.getStyle()).isEqualTo(Style.BLOCK);
    assertThat(comment.hasLocation()).isFalse();
    assertThat(comment.toString()).isEqualTo("/* note */");
  }

  @Test
  public void testEquality() {
    assertThat(Comment.block(" a ", 2)).isEqualTo(Comment.block(" a ", 2));
    assertThat(Comment.block(" a ", 2)).isNotEqualTo(Comment.line(" a ", 2));
    assertThat(Comment.block(" a ", 2)).isNotEqualTo(Comment.block(" a ", 3));
    assertThat(Comment.block(" a ", 2).hashCode()).isEqualTo(Comment.block(" a ", 2).hashCode());
  }
}
