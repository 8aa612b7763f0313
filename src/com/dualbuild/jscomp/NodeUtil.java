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

import static com.google.common.base.Preconditions.checkState;

import com.dualbuild.rhino.IR;
import com.dualbuild.rhino.Node;
import com.dualbuild.rhino.Token;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private static final Set<Token> IS_STATEMENT_PARENT =
      Sets.immutableEnumSet(Token.SCRIPT, Token.BLOCK);

  // Utility class; do not instantiate.
  private NodeUtil() {}

  /** Creates a node representing an undefined value, {@code void 0}. */
  public static Node newUndefinedNode(@Nullable Node srcReferenceNode) {
    Node node = IR.voidNode(IR.number(0));
    if (srcReferenceNode != null) {
      node.srcrefTree(srcReferenceNode);
    }
    return node;
  }

  /** @return Whether the node is used as a statement. */
  public static boolean isStatement(Node n) {
    return !n.isScript() && !n.isRoot() && n.hasParent() && isStatementParent(n.getParent());
  }

  public static boolean isStatementParent(Node parent) {
    // It is not possible to determine definitely if a node is a statement
    // or not if it is not part of the AST.  A FUNCTION node can be
    // either part of an expression or a statement.
    return IS_STATEMENT_PARENT.contains(parent.getToken());
  }

  /** Whether {@code n} sits where a declaration may: in a statement list or under an export. */
  static boolean isDeclarationPosition(Node n) {
    Node parent = n.getParent();
    return parent != null && (isStatementParent(parent) || parent.isExport());
  }

  /** Is this node a function declaration? A function declaration has a name and is a statement. */
  public static boolean isFunctionDeclaration(Node n) {
    return n.isFunction()
        && !n.isArrowFunction()
        && !n.getFirstChild().getString().isEmpty()
        && isDeclarationPosition(n);
  }

  /** Is this a class declaration, {@code class C {}}, in statement position? */
  public static boolean isClassDeclaration(Node n) {
    return n.isClass() && n.getFirstChild().isName() && isDeclarationPosition(n);
  }

  /** Is this the VAR, LET or CONST of a declaration statement? */
  public static boolean isNameDeclarationStatement(Node n) {
    return n.isNameDeclaration() && isDeclarationPosition(n);
  }

  /**
   * Returns the names introduced by a declaration statement: every declarator of a VAR, LET or
   * CONST, the name of a function or class declaration, the local names of an IMPORT, or those of
   * the declaration under an EXPORT.
   */
  public static ImmutableList<String> getDeclaredNames(Node n) {
    switch (n.getToken()) {
      case VAR:
      case LET:
      case CONST:
        {
          ImmutableList.Builder<String> names = ImmutableList.builder();
          for (Node declarator : n.children()) {
            names.add(declarator.getString());
          }
          return names.build();
        }
      case FUNCTION:
        return isFunctionDeclaration(n)
            ? ImmutableList.of(n.getFirstChild().getString())
            : ImmutableList.of();
      case CLASS:
        return n.getFirstChild().isName()
            ? ImmutableList.of(n.getFirstChild().getString())
            : ImmutableList.of();
      case IMPORT:
        return getImportedNames(n);
      case EXPORT:
        return getDeclaredNames(n.getFirstChild());
      default:
        return ImmutableList.of();
    }
  }

  /**
   * Returns the local binding names of an import: the default binding, each specifier's local
   * name, and the namespace name of {@code import * as ns}.
   */
  public static ImmutableList<String> getImportedNames(Node importNode) {
    checkState(importNode.isImport(), importNode);
    ImmutableList.Builder<String> names = ImmutableList.builder();
    Node defaultBinding = importNode.getFirstChild();
    if (defaultBinding.isName()) {
      names.add(defaultBinding.getString());
    }
    Node specs = importNode.getSecondChild();
    if (specs.isImportSpecs()) {
      for (Node spec : specs.children()) {
        names.add(spec.getLastChild().getString());
      }
    } else if (specs.isImportStar()) {
      names.add(specs.getString());
    }
    return names.build();
  }

  /** Returns the module string of an IMPORT. */
  public static String getImportModule(Node importNode) {
    checkState(importNode.isImport(), importNode);
    return importNode.getLastChild().getString();
  }

  /**
   * Whether this NAME binds a name rather than reading one: a declarator, an import binding, a
   * function or class name, a parameter, or the target of an assignment.
   */
  public static boolean isBindingPosition(Node name) {
    checkState(name.isName(), name);
    Node parent = name.getParent();
    if (parent == null) {
      return false;
    }
    switch (parent.getToken()) {
      case VAR:
      case LET:
      case CONST:
      case IMPORT_SPEC:
      case PARAM_LIST:
        return true;
      case IMPORT:
      case FUNCTION:
      case CLASS:
      case ASSIGN:
        return parent.getFirstChild() == name;
      default:
        return false;
    }
  }

  /** Whether a parameter of a function enclosing {@code name} declares the same name. */
  public static boolean isShadowedByParameter(Node name) {
    checkState(name.isName(), name);
    String string = name.getString();
    for (Node ancestor = name.getParent(); ancestor != null; ancestor = ancestor.getParent()) {
      if (!ancestor.isFunction()) {
        continue;
      }
      for (Node param : ancestor.getSecondChild().children()) {
        if (param.getString().equals(string)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Returns the name the value {@code n} is bound to: the declarator for {@code const x = n}, the
   * qualified target for {@code a.b = n}, or null.
   */
  public static @Nullable String getBestLValueName(Node n) {
    Node parent = n.getParent();
    if (parent == null) {
      return null;
    }
    if (parent.isName() && parent.getParent() != null && parent.getParent().isNameDeclaration()) {
      return parent.getString();
    } else if (parent.isAssign() && parent.getSecondChild() == n) {
      return parent.getFirstChild().getQualifiedName();
    }
    return null;
  }

  /** Returns the first segment of a possibly dotted name: {@code Foo} for {@code Foo.Bar}. */
  public static String getRootOfQualifiedName(String qName) {
    int dot = qName.indexOf('.');
    return dot == -1 ? qName : qName.substring(0, dot);
  }

  /**
   * Safely remove children while maintaining a valid node structure. In some cases, this is done by
   * removing the parent from the AST as well.
   *
   * @return the node that now holds the position of the removed subtree, for change reporting
   */
  public static Node removeChild(Node parent, Node node) {
    if (parent.isExport()) {
      // An EXPORT without its declaration is not valid; remove the whole statement.
      return removeChild(parent.getParent(), parent);
    } else if (isStatementParent(parent)
        || parent.isClassMembers()
        || parent.isObjectLit()
        || parent.isImportSpecs()
        || parent.isJsxOpeningElement()
        || parent.isJsxElement()
        || parent.isJsxFragment()) {
      node.detach();
      return parent;
    } else if (parent.isNameDeclaration()) {
      node.detach();
      if (!parent.hasChildren()) {
        // This would leave an empty VAR, remove the VAR itself.
        return removeChild(parent.getParent(), parent);
      }
      return parent;
    } else {
      throw new IllegalStateException("Cannot remove " + node + " from " + parent);
    }
  }

  /**
   * Removes a markup element or fragment. Inside markup it is detached; as an expression statement
   * the statement goes; anywhere else an expression is required, so it becomes {@code null}.
   *
   * @return the node that now holds the position of the removed subtree, for change reporting
   */
  public static Node removeMarkup(Node n) {
    checkState(n.isJsxElement() || n.isJsxFragment(), n);
    Node parent = n.getParent();
    if (parent.isJsxElement() || parent.isJsxFragment()) {
      n.detach();
      return parent;
    } else if (parent.isExprResult()) {
      return removeChild(parent.getParent(), parent);
    }
    Node renderNothing = IR.nullNode().srcref(n);
    n.replaceWith(renderNothing);
    return renderNothing;
  }
}
