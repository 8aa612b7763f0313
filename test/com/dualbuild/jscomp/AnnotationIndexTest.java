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

import com.dualbuild.rhino.Comment;
import com.dualbuild.rhino.IR;
import com.dualbuild.rhino.Node;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link AnnotationIndex}. */
@RunWith(JUnit4.class)
public final class AnnotationIndexTest {
  private static final String MARKER = PruneOptions.DEFAULT_ANNOTATION_MARKER;

  @Test
  public void testMarkerLineAndNextLineAreIndexed() {
    AnnotationIndex index =
        AnnotationIndex.forComments(
            ImmutableList.of(
                Comment.line(" " + MARKER, 4),
                Comment.block(" " + MARKER + " ", 14),
                Comment.line(" regular comment", 20)),
            MARKER);

    assertThat(index.getLines()).containsExactly(4, 5, 14, 15).inOrder();
    assertThat(index.contains(16)).isFalse();
    assertThat(index.contains(21)).isFalse();
  }

  @Test
  public void testCommentsWithoutLocationAreSkipped() {
    AnnotationIndex index =
        AnnotationIndex.forComments(ImmutableList.of(Comment.line(MARKER, -1)), MARKER);

    assertThat(index.isEmpty()).isTrue();
  }

  @Test
  public void testFileCommentsWinOverAttachedComments() {
    Node statement = IR.exprResult(IR.name("a"));
    statement.addLeadingComment(Comment.line(MARKER, 1));
    Node script = IR.script(statement);
    script.setFileComments(ImmutableList.of(Comment.block(MARKER, 9)));

    assertThat(AnnotationIndex.forScript(script, MARKER).getLines()).containsExactly(9, 10);
  }

  @Test
  public void testAttachedCommentsAreCollectedOnce() {
    Comment shared = Comment.line(MARKER, 3);
    Node first = IR.exprResult(IR.name("a")).addTrailingComment(shared);
    Node second = IR.exprResult(IR.name("b")).addLeadingComment(shared);
    Node nested = IR.jsxEmptyExpression();
    nested.addLeadingComment(Comment.block(MARKER, 7));
    Node script =
        IR.script(
            first,
            second,
            IR.exprResult(IR.jsxElement(IR.jsxOpeningElement("View"),
                IR.jsxExpressionContainer(nested))));

    assertThat(AnnotationIndex.forScript(script, MARKER).getLines())
        .containsExactly(3, 4, 7, 8)
        .inOrder();
  }

  @Test
  public void testOtherMarker() {
    AnnotationIndex index =
        AnnotationIndex.forComments(ImmutableList.of(Comment.line(MARKER, 2)), "@internal-only");

    assertThat(index.isEmpty()).isTrue();
  }
}
