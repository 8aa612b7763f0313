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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.lang.String.format;

import com.dualbuild.jscomp.NodeTraversal.AbstractPreOrderCallback;
import com.dualbuild.jscomp.NodeTraversal.Callback;
import com.dualbuild.jscomp.RemovalDecisions.RemovalReason;
import com.dualbuild.rhino.Node;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Compiler pass that removes annotated code for the restricted build.
 *
 * <p>Every SCRIPT is handled on its own, with a fresh annotation index and tracker:
 *
 * <ul>
 *   <li>Seeding: annotated imports, declarations, statements and style table entries are found on
 *       the untouched tree and their names tracked. Variables initialized from a removed
 *       declaration are added afterwards.
 *   <li>Pruning: what seeding found is removed, markup using removed code is removed, annotated
 *       guards are neutralized, assignments to removed names are dropped, and remaining references
 *       to removed names become {@code void 0}.
 *   <li>Reporting: the removed names are logged.
 * </ul>
 */
final class StripAnnotatedCode implements CompilerPass {

  static final DiagnosticType PROTECTED_ANNOTATION =
      DiagnosticType.disabled(
          "JSC_PROTECTED_ANNOTATION",
          "Annotation ignored on {0}: it would remove a protected framework symbol");

  private static final Logger logger = Logger.getLogger(StripAnnotatedCode.class.getName());

  /** Where the pass is in handling the current SCRIPT. */
  enum Phase {
    IDLE,
    SEEDING,
    PRUNING,
    REPORTING
  }

  private final AbstractCompiler compiler;
  private final PruneOptions options;

  private Phase phase = Phase.IDLE;
  private final ImmutableList.Builder<String> removedSymbols = ImmutableList.builder();
  private int changeCount = 0;

  StripAnnotatedCode(AbstractCompiler compiler) {
    this.compiler = compiler;
    this.options = compiler.getOptions();
  }

  @Override
  public void process(Node root) {
    checkState(phase == Phase.IDLE, "Pass re-entered while %s", phase);
    if (root.isRoot()) {
      for (Node script = root.getFirstChild(); script != null; script = script.getNext()) {
        new ScriptPruner(script).run();
      }
    } else {
      checkArgument(root.isScript(), "Expected a ROOT or a SCRIPT, found %s", root);
      new ScriptPruner(root).run();
    }
  }

  /** Returns every name removed so far, file by file, in removal order. */
  ImmutableList<String> getRemovedSymbols() {
    return removedSymbols.build();
  }

  /** Returns how many removals and rewrites were made. */
  int getChangeCount() {
    return changeCount;
  }

  Phase getPhase() {
    return phase;
  }

  /** State for a single SCRIPT, discarded when the SCRIPT is done. */
  private final class ScriptPruner {
    private final Node script;
    private final String fileName;
    private final AnnotationIndex annotationLines;
    private final RemovedSymbolTracker tracker = new RemovedSymbolTracker();
    private final RemovalDecisions decisions;
    private final ReferenceRewriter rewriter;

    /** Nodes seeding found on the untouched tree, removed when pruning reaches them. */
    private final Map<Node, RemovalReason> scheduled = new IdentityHashMap<>();

    /** Declarators initialized from a plain name, checked once seeding has tracked everything. */
    private final List<Node> aliasCandidates = new ArrayList<>();

    ScriptPruner(Node script) {
      checkArgument(script.isScript(), script);
      this.script = script;
      String sourceName = script.getSourceFileName();
      this.fileName = sourceName != null ? sourceName : "[source unknown]";
      this.annotationLines = AnnotationIndex.forScript(script, options.getAnnotationMarker());
      this.decisions =
          new RemovalDecisions(options, annotationLines, tracker, scheduled::containsKey);
      this.rewriter = new ReferenceRewriter(tracker);
    }

    void run() {
      logger.fine(format("Transforming %s", fileName));
      if (!annotationLines.isEmpty()) {
        logger.fine(format("Annotation marker found in %s", fileName));
      }

      phase = Phase.SEEDING;
      NodeTraversal.traverse(compiler, script, new FindRemovals());
      for (Node declarator : aliasCandidates) {
        if (decisions.decide(declarator) == RemovalReason.ALIAS_OF_REMOVED) {
          tracker.trackAlias(declarator.getString());
          scheduled.put(declarator, RemovalReason.ALIAS_OF_REMOVED);
        }
      }

      phase = Phase.PRUNING;
      NodeTraversal.traverse(compiler, script, new PruneAnnotatedCode());

      phase = Phase.REPORTING;
      if (!tracker.isEmpty()) {
        ImmutableList<String> names = tracker.getRemovedNames();
        logger.info(
            format(
                "Tree-shaking: removed annotated code from %s: %s",
                fileName, Joiner.on(", ").join(names)));
        removedSymbols.addAll(names);
      }
      phase = Phase.IDLE;
    }

    /** Finds annotated declarations and style entries, and tracks the names they declare. */
    private final class FindRemovals extends AbstractPreOrderCallback {
      @Override
      public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
        switch (n.getToken()) {
          case IMPORT:
            schedule(t, n);
            return false;
          case EXPORT:
          case VAR:
          case LET:
          case CONST:
          case FUNCTION:
          case CLASS:
          case EXPR_RESULT:
          case IF:
          case MEMBER_FIELD_DEF:
          case MEMBER_FUNCTION_DEF:
          case STRING_KEY:
            return !schedule(t, n);
          case CALL:
            if (decisions.isStyleTableCall(n)) {
              findRemovedStyles(n);
            }
            return true;
          case NAME:
            if (parent != null
                && parent.isNameDeclaration()
                && n.hasOneChild()
                && n.getFirstChild().isName()) {
              aliasCandidates.add(n);
            }
            return true;
          default:
            return true;
        }
      }

      /** Schedules {@code n} if it must go, and tracks its names. Returns whether it was. */
      private boolean schedule(NodeTraversal t, Node n) {
        RemovalReason reason = decisions.decide(n);
        if (reason == null) {
          if (decisions.hasIgnoredAnnotation(n)) {
            t.report(n, PROTECTED_ANNOTATION, describe(n));
          }
          return false;
        }
        scheduled.put(n, reason);
        switch (n.getToken()) {
          case MEMBER_FIELD_DEF:
          case MEMBER_FUNCTION_DEF:
            tracker.trackDeclared(n.getString());
            break;
          case STRING_KEY:
            // Style table entries were tracked with their table.
            break;
          default:
            for (String name : NodeUtil.getDeclaredNames(n)) {
              tracker.trackDeclared(name);
            }
            break;
        }
        return true;
      }

      private void findRemovedStyles(Node call) {
        String tableName = decisions.getStyleTableName(call);
        for (Node entry : call.getSecondChild().children()) {
          if (decisions.hasDirectAnnotation(entry)) {
            tracker.trackTableEntry(tableName, entry.getString());
          }
        }
      }
    }

    /**
     * Removes and rewrites, top down, so nothing under a removed node is looked at. Assignments to
     * removed names are dropped on the way back up, once their value has been rewritten.
     */
    private final class PruneAnnotatedCode implements Callback {
      @Override
      public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
        RemovalReason reason = scheduled.remove(n);
        if (reason != null) {
          logRemoval(n, reason);
          recordChange(t, NodeUtil.removeChild(parent, n));
          return false;
        }
        switch (n.getToken()) {
          case JSX_ELEMENT:
          case JSX_FRAGMENT:
            reason = decisions.decide(n);
            if (reason != null) {
              logRemoval(n, reason);
              recordChange(t, NodeUtil.removeMarkup(n));
              return false;
            }
            return true;
          case JSX_EXPRESSION_CONTAINER:
            if (decisions.isGuardedContainer(n) && !n.getFirstChild().isNull()) {
              logger.fine(format("Cleared guarded markup at %s", location(n)));
              recordChange(t, rewriter.clearContainer(n));
              return false;
            }
            return true;
          case AND:
            if (decisions.isGuardedRender(n)) {
              logger.fine(format("Replaced guarded markup with false at %s", location(n)));
              recordChange(t, rewriter.rewriteGuardedRender(n));
              return false;
            }
            return true;
          case NAME:
            if (rewriter.isReferenceToRemoved(n)) {
              logger.fine(format("Rewrote reference to %s at %s", n.getString(), location(n)));
              recordChange(t, rewriter.rewriteReference(n));
              return false;
            }
            return true;
          default:
            return true;
        }
      }

      @Override
      public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
        if (rewriter.isAssignmentToRemoved(n)) {
          logger.fine(
              format(
                  "Dropped assignment to %s at %s", n.getFirstChild().getString(), location(n)));
          recordChange(t, rewriter.removeAssignment(n));
        }
      }
    }

    private void recordChange(NodeTraversal t, Node changed) {
      changeCount++;
      t.reportCodeChange(changed);
    }

    private void logRemoval(Node n, RemovalReason reason) {
      logger.fine(format("Removed %s at %s (%s)", describe(n), location(n), reason));
    }

    private String location(Node n) {
      return fileName + ":" + n.getLineno();
    }
  }

  /** A short human-readable label for a removed or protected node. */
  static String describe(Node n) {
    switch (n.getToken()) {
      case IMPORT:
        return "import from " + NodeUtil.getImportModule(n);
      case JSX_ELEMENT:
        return "<" + n.getFirstChild().getString() + ">";
      case JSX_FRAGMENT:
        return "<>";
      case NAME:
      case MEMBER_FIELD_DEF:
      case MEMBER_FUNCTION_DEF:
      case STRING_KEY:
        return n.getString();
      default:
        ImmutableList<String> names = NodeUtil.getDeclaredNames(n);
        return names.isEmpty() ? n.getToken().toString() : Joiner.on(", ").join(names);
    }
  }
}
