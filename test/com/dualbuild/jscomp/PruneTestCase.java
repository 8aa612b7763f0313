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
import static com.google.common.truth.Truth.assertWithMessage;

import com.dualbuild.rhino.Comment;
import com.dualbuild.rhino.IR;
import com.dualbuild.rhino.Node;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;

/**
 * Base class for tests that prune trees built with {@link IR} and compare the printed result.
 *
 * <p>Unless disabled, every {@link #test} also prunes the result again and checks that nothing
 * further changes.
 */
public abstract class PruneTestCase {

  protected static final String MARKER = PruneOptions.DEFAULT_ANNOTATION_MARKER;

  protected static final String FILE_NAME = "Component.tsx";

  protected PruneOptions options;

  protected RecordingErrorManager errorManager;

  private boolean checkIdempotence = true;

  @Before
  public void setUp() throws Exception {
    options = new PruneOptions();
    errorManager = new RecordingErrorManager();
    checkIdempotence = true;
  }

  protected void disableIdempotenceCheck() {
    checkIdempotence = false;
  }

  protected Compiler createCompiler() {
    return new Compiler(options, errorManager);
  }

  protected PruneResult prune(Node script) {
    return createCompiler().prune(script);
  }

  /** Prunes {@code script} and checks that it prints as {@code expected}. */
  protected PruneResult test(Node script, String expected) {
    PruneResult result = prune(script);
    assertThat(result.isSuccess()).isTrue();
    assertThat(CodePrinter.toSource(script)).isEqualTo(expected);
    if (checkIdempotence) {
      PruneResult again = prune(script);
      assertWithMessage("changes made pruning a second time")
          .that(again.getChangeCount())
          .isEqualTo(0);
      assertThat(again.getRemovedSymbols()).isEmpty();
      assertThat(CodePrinter.toSource(script)).isEqualTo(expected);
    }
    return result;
  }

  /** Prunes {@code script} and checks that nothing changed. */
  protected PruneResult testSame(Node script) {
    PruneResult result = test(script, CodePrinter.toSource(script));
    assertThat(result.getChangeCount()).isEqualTo(0);
    assertThat(result.getRemovedSymbols()).isEmpty();
    return result;
  }

  protected static Node script(Node... statements) {
    return IR.script(statements).setSourceFileName(FILE_NAME);
  }

  /** Sets the line {@code n} starts on. */
  protected static Node at(int line, Node n) {
    return n.setLinenoCharno(line, 0);
  }

  /** Adds {@code // @employee-code} on the line above {@code n}. */
  protected static Node annotated(Node n) {
    int line = n.getLineno();
    return n.addLeadingComment(Comment.line(" " + MARKER, line < 0 ? -1 : line - 1));
  }

  /** Adds a {@code // @employee-code} comment on {@code line} in front of {@code n}. */
  protected static Node annotatedAt(int line, Node n) {
    return n.addLeadingComment(Comment.line(" " + MARKER, line));
  }

  /** Adds {@code // @employee-code} after {@code n}, on the same line. */
  protected static Node trailingAnnotated(Node n) {
    return n.addTrailingComment(Comment.line(" " + MARKER, n.getLineno()));
  }

  /** Adds {@code /* @employee-code *}{@code /} in front of {@code n}, on the same line. */
  protected static Node inlineAnnotated(Node n) {
    return n.addLeadingComment(Comment.block(" " + MARKER + " ", n.getLineno()));
  }

  /** Returns every NAME read or bound anywhere under {@code root}. */
  protected static List<String> namesIn(Node root) {
    List<String> names = new ArrayList<>();
    collectNames(root, names);
    return names;
  }

  private static void collectNames(Node n, List<String> names) {
    if (n.isName()) {
      names.add(n.getString());
    }
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      collectNames(child, names);
    }
  }

  /** Collects every report, whatever its level. */
  protected static final class RecordingErrorManager extends BasicErrorManager {
    final List<JSError> reported = new ArrayList<>();

    @Override
    public void report(CheckLevel level, JSError error) {
      reported.add(error);
      super.report(level, error);
    }

    List<String> reportedKeys() {
      List<String> keys = new ArrayList<>();
      for (JSError error : reported) {
        keys.add(error.type().key);
      }
      return keys;
    }

    @Override
    public void println(CheckLevel level, JSError error) {}

    @Override
    protected void printSummary() {}
  }
}
