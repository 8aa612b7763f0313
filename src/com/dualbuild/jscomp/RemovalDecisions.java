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

import com.dualbuild.rhino.Comment;
import com.dualbuild.rhino.Node;
import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Decides, node by node, whether annotated-code removal applies.
 *
 * <p>Declarations and plain statements go only when they carry the annotation themselves. Markup
 * elements additionally go when their opening tag is annotated, when their tag or a style they use
 * was removed, or when they start on an annotated line. The decisions read the tracker but never
 * change it.
 */
final class RemovalDecisions {

  /** Why a node is removed or rewritten. */
  enum RemovalReason {
    DIRECT_ANNOTATION("annotated"),
    PRECEDING_ANNOTATION("annotation on the previous statement"),
    OPENING_TAG_ANNOTATION("annotated opening tag"),
    REMOVED_TAG("tag was removed"),
    ANNOTATED_LINE("starts on an annotated line"),
    REMOVED_STYLE("uses a removed style"),
    ALIAS_OF_REMOVED("initialized from a removed name"),
    GUARDED_BY_REMOVED("annotated guard");

    private final String description;

    RemovalReason(String description) {
      this.description = description;
    }

    @Override
    public String toString() {
      return description;
    }
  }

  private static final String STYLE_ATTRIBUTE = "style";

  private final String marker;
  private final AnnotationIndex annotationLines;
  private final RemovedSymbolTracker tracker;
  private final ImmutableSet<String> modeFlagNames;
  private final ImmutableSet<String> styleTableFactories;
  private final String defaultStyleTableName;
  private final Predicate<Node> isScheduledForRemoval;

  RemovalDecisions(
      PruneOptions options, AnnotationIndex annotationLines, RemovedSymbolTracker tracker) {
    this(options, annotationLines, tracker, Predicates.alwaysFalse());
  }

  /**
   * @param isScheduledForRemoval statements already known to go; an import looks past them for the
   *     statement that will precede it once they are removed
   */
  RemovalDecisions(
      PruneOptions options,
      AnnotationIndex annotationLines,
      RemovedSymbolTracker tracker,
      Predicate<Node> isScheduledForRemoval) {
    this.isScheduledForRemoval = isScheduledForRemoval;
    this.marker = options.getAnnotationMarker();
    this.annotationLines = annotationLines;
    this.tracker = tracker;
    this.modeFlagNames = options.getModeFlagNames();
    this.styleTableFactories = options.getStyleTableFactories();
    this.defaultStyleTableName = options.getDefaultStyleTableName();
  }

  boolean shouldRemove(Node n) {
    return decide(n) != null;
  }

  /** Returns why {@code n} must be removed or rewritten, or null if it stays as it is. */
  @Nullable RemovalReason decide(Node n) {
    switch (n.getToken()) {
      case IMPORT:
        {
          RemovalReason reason = getImportAnnotation(n);
          return reason != null && !isProtected(n) ? reason : null;
        }
      case EXPORT:
      case VAR:
      case LET:
      case CONST:
      case FUNCTION:
      case CLASS:
        if (!isDeclarationStatement(n)) {
          return null;
        }
        return hasDirectAnnotation(n) && !isProtected(n) ? RemovalReason.DIRECT_ANNOTATION : null;
      case EXPR_RESULT:
      case IF:
      case MEMBER_FIELD_DEF:
      case MEMBER_FUNCTION_DEF:
      case STRING_KEY:
      case JSX_FRAGMENT:
        return hasDirectAnnotation(n) ? RemovalReason.DIRECT_ANNOTATION : null;
      case JSX_ELEMENT:
        return decideMarkup(n);
      case NAME:
        return isAliasOfRemoved(n) ? RemovalReason.ALIAS_OF_REMOVED : null;
      case AND:
        return isGuardedRender(n) ? RemovalReason.GUARDED_BY_REMOVED : null;
      default:
        return null;
    }
  }

  private static boolean isDeclarationStatement(Node n) {
    switch (n.getToken()) {
      case EXPORT:
        return true;
      case FUNCTION:
        return NodeUtil.isFunctionDeclaration(n);
      case CLASS:
        return NodeUtil.isClassDeclaration(n);
      default:
        return NodeUtil.isNameDeclarationStatement(n);
    }
  }

  /**
   * Whether {@code n} carries an annotation that is ignored because it would remove a protected
   * import or declaration.
   */
  boolean hasIgnoredAnnotation(Node n) {
    if (n.isImport()) {
      return getImportAnnotation(n) != null && isProtected(n);
    }
    switch (n.getToken()) {
      case EXPORT:
      case VAR:
      case LET:
      case CONST:
      case FUNCTION:
      case CLASS:
        return isDeclarationStatement(n) && hasDirectAnnotation(n) && isProtected(n);
      default:
        return false;
    }
  }

  /**
   * Whether removing {@code n} could remove a critical symbol: an import from a framework module or
   * of a critical identifier, or a declaration of a critical identifier.
   */
  static boolean isProtected(Node n) {
    if (n.isImport()) {
      return CriticalSymbols.isProtected(
          NodeUtil.getImportModule(n), NodeUtil.getImportedNames(n));
    }
    for (String name : NodeUtil.getDeclaredNames(n)) {
      if (CriticalSymbols.isCriticalIdentifier(name)) {
        return true;
      }
    }
    return false;
  }

  private @Nullable RemovalReason getImportAnnotation(Node importNode) {
    if (hasDirectAnnotation(importNode)) {
      return RemovalReason.DIRECT_ANNOTATION;
    }
    int line = importNode.getLineno();
    for (Node previous = importNode.getPrevious();
        previous != null;
        previous = previous.getPrevious()) {
      if (hasAnnotationOnPreviousLine(previous, line)) {
        return RemovalReason.PRECEDING_ANNOTATION;
      }
      if (!isScheduledForRemoval.apply(previous)) {
        break;
      }
    }
    return null;
  }

  /**
   * Whether {@code previous} carries an annotation on {@code line} or the line just above it. A
   * comment or an import without a location always counts.
   */
  private boolean hasAnnotationOnPreviousLine(Node previous, int line) {
    return isAnnotationNear(previous.getLeadingComments(), line)
        || isAnnotationNear(previous.getTrailingComments(), line);
  }

  private boolean isAnnotationNear(List<Comment> comments, int line) {
    for (Comment comment : comments) {
      if (!comment.contains(marker)) {
        continue;
      }
      if (line < 0 || !comment.hasLocation()) {
        return true;
      }
      int commentLine = comment.getLineno();
      if (commentLine == line || commentLine == line - 1) {
        return true;
      }
    }
    return false;
  }

  private @Nullable RemovalReason decideMarkup(Node element) {
    if (hasDirectAnnotation(element)) {
      return RemovalReason.DIRECT_ANNOTATION;
    }
    Node opening = element.getFirstChild();
    if (hasDirectAnnotation(opening)) {
      return RemovalReason.OPENING_TAG_ANNOTATION;
    }
    for (Node attribute : opening.children()) {
      if (hasDirectAnnotation(attribute)) {
        return RemovalReason.OPENING_TAG_ANNOTATION;
      }
    }
    if (tracker.contains(NodeUtil.getRootOfQualifiedName(opening.getString()))) {
      return RemovalReason.REMOVED_TAG;
    }
    int line = element.getLineno();
    if (line >= 0 && annotationLines.contains(line)) {
      return RemovalReason.ANNOTATED_LINE;
    }
    if (usesRemovedStyle(opening)) {
      return RemovalReason.REMOVED_STYLE;
    }
    return null;
  }

  /** Matches {@code style={table.entry}} and {@code style={[table.a, table.entry]}}. */
  private boolean usesRemovedStyle(Node opening) {
    for (Node attribute : opening.children()) {
      if (!attribute.getString().equals(STYLE_ATTRIBUTE)
          || !attribute.hasOneChild()
          || !attribute.getFirstChild().isJsxExpressionContainer()) {
        continue;
      }
      Node value = attribute.getFirstChild().getFirstChild();
      if (isRemovedStyleReference(value)) {
        return true;
      }
      if (value.isArrayLit()) {
        for (Node element : value.children()) {
          if (isRemovedStyleReference(element)) {
            return true;
          }
        }
      }
    }
    return false;
  }

  private boolean isRemovedStyleReference(Node n) {
    return n.isGetProp()
        && n.getFirstChild().isName()
        && tracker.containsTableEntry(n.getFirstChild().getString(), n.getString());
  }

  /** Rule for {@code const B = A} where the declaration of {@code A} was removed. */
  private boolean isAliasOfRemoved(Node declarator) {
    Node parent = declarator.getParent();
    if (parent == null || !parent.isNameDeclaration() || !declarator.hasOneChild()) {
      return false;
    }
    Node initializer = declarator.getFirstChild();
    return initializer.isName()
        && tracker.isAliasSource(initializer.getString())
        && !CriticalSymbols.isCriticalIdentifier(declarator.getString());
  }

  /** Whether {@code and} is an annotated {@code flag && ...} whose flag is a mode flag or removed. */
  boolean isGuardedRender(Node and) {
    return and.isAnd() && hasDirectAnnotation(and) && isRenderGuard(and.getFirstChild());
  }

  /**
   * Whether {@code container} is an annotated {@code {flag && ...}} markup slot whose content must
   * render nothing.
   */
  boolean isGuardedContainer(Node container) {
    if (!container.isJsxExpressionContainer() || !hasDirectAnnotation(container)) {
      return false;
    }
    Node expression = container.getFirstChild();
    return expression.isAnd() && isRenderGuard(expression.getFirstChild());
  }

  private boolean isRenderGuard(Node left) {
    if (!left.isName()) {
      return false;
    }
    String name = left.getString();
    return modeFlagNames.contains(name) || tracker.contains(name);
  }

  /** Whether {@code call} builds a style table, like {@code StyleSheet.create({...})}. */
  boolean isStyleTableCall(Node call) {
    if (!call.isCall()) {
      return false;
    }
    String callee = call.getFirstChild().getQualifiedName();
    return callee != null
        && styleTableFactories.contains(callee)
        && call.getSecondChild() != null
        && call.getSecondChild().isObjectLit();
  }

  /** Returns the name a style table call is bound to, or the default table name. */
  String getStyleTableName(Node call) {
    String name = NodeUtil.getBestLValueName(call);
    return name != null ? name : defaultStyleTableName;
  }

  /** Whether {@code n} itself has a leading or trailing comment holding the marker. */
  boolean hasDirectAnnotation(Node n) {
    return containsMarker(n.getLeadingComments()) || containsMarker(n.getTrailingComments());
  }

  private boolean containsMarker(List<Comment> comments) {
    for (Comment comment : comments) {
      if (comment.contains(marker)) {
        return true;
      }
    }
    return false;
  }
}
