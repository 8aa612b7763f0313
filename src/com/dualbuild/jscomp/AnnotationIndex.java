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

import com.dualbuild.rhino.Comment;
import com.dualbuild.rhino.Node;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The source lines of one file that hold an annotation comment, together with the line after each.
 *
 * <p>Built once per file, before anything is removed, and never updated.
 */
final class AnnotationIndex {
  private final ImmutableSortedSet<Integer> lines;

  private AnnotationIndex(ImmutableSortedSet<Integer> lines) {
    this.lines = lines;
  }

  /**
   * Indexes the comments of {@code script}: the file comment list when the parser recorded one,
   * otherwise every comment attached anywhere under the script.
   */
  static AnnotationIndex forScript(Node script, String marker) {
    checkState(script.isScript(), script);
    ImmutableList<Comment> fileComments = script.getFileComments();
    return forComments(fileComments != null ? fileComments : collectAttachedComments(script), marker);
  }

  static AnnotationIndex forComments(Iterable<Comment> comments, String marker) {
    ImmutableSortedSet.Builder<Integer> lines = ImmutableSortedSet.naturalOrder();
    for (Comment comment : comments) {
      if (comment.contains(marker) && comment.hasLocation()) {
        lines.add(comment.getLineno());
        lines.add(comment.getLineno() + 1);
      }
    }
    return new AnnotationIndex(lines.build());
  }

  private static Set<Comment> collectAttachedComments(Node root) {
    // A comment may be attached both after one node and before the next.
    Set<Comment> comments = new LinkedHashSet<>();
    collectAttachedComments(root, comments);
    return comments;
  }

  private static void collectAttachedComments(Node n, Set<Comment> comments) {
    comments.addAll(n.getLeadingComments());
    comments.addAll(n.getTrailingComments());
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      collectAttachedComments(child, comments);
    }
  }

  boolean contains(int line) {
    return lines.contains(line);
  }

  boolean isEmpty() {
    return lines.isEmpty();
  }

  ImmutableSortedSet<Integer> getLines() {
    return lines;
  }

  @Override
  public String toString() {
    return "AnnotationIndex" + lines;
  }
}
