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

import com.dualbuild.rhino.Node;
import com.dualbuild.rhino.Token;

/**
 * CodePrinter prints a tree back out as compact JavaScript with markup, one top-level statement per
 * line. Comments are not printed.
 */
public final class CodePrinter {

  // Operator precedence, higher binds tighter.
  private static final int PRECEDENCE_ASSIGN = 1;
  private static final int PRECEDENCE_HOOK = 2;
  private static final int PRECEDENCE_OR = 4;
  private static final int PRECEDENCE_AND = 5;
  private static final int PRECEDENCE_EQUALITY = 9;
  private static final int PRECEDENCE_ADD = 13;
  private static final int PRECEDENCE_UNARY = 15;
  private static final int PRECEDENCE_MEMBER = 17;
  private static final int PRECEDENCE_PRIMARY = 18;

  private final StringBuilder code = new StringBuilder(1024);

  private CodePrinter() {}

  /** Prints {@code n}: a ROOT, a SCRIPT, a statement or an expression. */
  public static String toSource(Node n) {
    CodePrinter printer = new CodePrinter();
    printer.add(n);
    return printer.code.toString();
  }

  private void add(Node n) {
    switch (n.getToken()) {
      case ROOT:
      case SCRIPT:
        addLines(n);
        return;
      case BLOCK:
        addBlock(n);
        return;
      case EMPTY:
        add(";");
        return;
      case EXPR_RESULT:
        addExpressionStatement(n.getFirstChild());
        return;
      case RETURN:
        add("return");
        if (n.hasChildren()) {
          add(" ");
          addExpr(n.getFirstChild(), 0);
        }
        add(";");
        return;
      case IF:
        add("if (");
        addExpr(n.getFirstChild(), 0);
        add(") ");
        add(n.getSecondChild());
        if (n.getChildCount() == 3) {
          add(" else ");
          add(n.getLastChild());
        }
        return;
      case VAR:
      case LET:
      case CONST:
        addNameDeclaration(n);
        add(";");
        return;
      case IMPORT:
        addImport(n);
        return;
      case EXPORT:
        addExport(n);
        return;
      case FUNCTION:
      case CLASS:
        // Declarations
        addExpr(n, 0);
        return;
      default:
        addExpr(n, 0);
    }
  }

  private void addLines(Node n) {
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      add(c);
      if (c.getNext() != null) {
        add("\n");
      }
    }
  }

  private void addBlock(Node n) {
    add("{");
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      add(c);
      if (c.getNext() != null) {
        add(" ");
      }
    }
    add("}");
  }

  private void addExpressionStatement(Node expr) {
    // Statements may not start with these.
    boolean needsParens = expr.isObjectLit() || (expr.isFunction() && !expr.isArrowFunction())
        || expr.isClass();
    if (needsParens) {
      add("(");
    }
    addExpr(expr, 0);
    if (needsParens) {
      add(")");
    }
    add(";");
  }

  private void addNameDeclaration(Node n) {
    add(n.getToken() == Token.VAR ? "var " : n.getToken() == Token.LET ? "let " : "const ");
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      add(c.getString());
      if (c.hasChildren()) {
        add(" = ");
        addExpr(c.getFirstChild(), PRECEDENCE_ASSIGN);
      }
      if (c.getNext() != null) {
        add(", ");
      }
    }
  }

  private void addImport(Node n) {
    add("import ");
    Node defaultBinding = n.getFirstChild();
    Node specs = n.getSecondChild();
    boolean hasBindings = false;
    if (defaultBinding.isName()) {
      add(defaultBinding.getString());
      hasBindings = true;
    }
    if (specs.isImportStar()) {
      add(hasBindings ? ", " : "");
      add("* as " + specs.getString());
      hasBindings = true;
    } else if (specs.isImportSpecs()) {
      add(hasBindings ? ", " : "");
      add("{");
      for (Node spec = specs.getFirstChild(); spec != null; spec = spec.getNext()) {
        String imported = spec.getFirstChild().getString();
        String local = spec.getLastChild().getString();
        add(imported.equals(local) ? imported : imported + " as " + local);
        if (spec.getNext() != null) {
          add(", ");
        }
      }
      add("}");
      hasBindings = true;
    }
    if (hasBindings) {
      add(" from ");
    }
    addString(n.getLastChild().getString());
    add(";");
  }

  private void addExport(Node n) {
    add(n.isDefaultExport() ? "export default " : "export ");
    Node c = n.getFirstChild();
    if (c.isFunction() || c.isClass() || c.isNameDeclaration()) {
      add(c);
    } else {
      addExpr(c, PRECEDENCE_ASSIGN);
      add(";");
    }
  }

  /** Adds an expression, in parentheses if it binds less tightly than {@code minPrecedence}. */
  private void addExpr(Node n, int minPrecedence) {
    boolean needsParens = precedence(n) < minPrecedence;
    if (needsParens) {
      add("(");
    }
    addExprUnwrapped(n);
    if (needsParens) {
      add(")");
    }
  }

  private void addExprUnwrapped(Node n) {
    switch (n.getToken()) {
      case NAME:
        add(n.getString());
        return;
      case STRINGLIT:
        addString(n.getString());
        return;
      case NUMBER:
        addNumber(n.getDouble());
        return;
      case TRUE:
        add("true");
        return;
      case FALSE:
        add("false");
        return;
      case NULL:
        add("null");
        return;
      case CALL:
        addExpr(n.getFirstChild(), PRECEDENCE_MEMBER);
        add("(");
        addList(n.getSecondChild());
        add(")");
        return;
      case GETPROP:
        addExpr(n.getFirstChild(), PRECEDENCE_MEMBER);
        add(".");
        add(n.getString());
        return;
      case OBJECTLIT:
        add("{");
        for (Node key = n.getFirstChild(); key != null; key = key.getNext()) {
          addPropertyName(key.getString());
          add(": ");
          addExpr(key.getFirstChild(), PRECEDENCE_ASSIGN);
          if (key.getNext() != null) {
            add(", ");
          }
        }
        add("}");
        return;
      case ARRAYLIT:
        add("[");
        addList(n.getFirstChild());
        add("]");
        return;
      case AND:
        addBinary(n, " && ", PRECEDENCE_AND);
        return;
      case OR:
        addBinary(n, " || ", PRECEDENCE_OR);
        return;
      case EQ:
        addBinary(n, " == ", PRECEDENCE_EQUALITY);
        return;
      case NE:
        addBinary(n, " != ", PRECEDENCE_EQUALITY);
        return;
      case SHEQ:
        addBinary(n, " === ", PRECEDENCE_EQUALITY);
        return;
      case SHNE:
        addBinary(n, " !== ", PRECEDENCE_EQUALITY);
        return;
      case ADD:
        addBinary(n, " + ", PRECEDENCE_ADD);
        return;
      case NOT:
        add("!");
        addExpr(n.getFirstChild(), PRECEDENCE_UNARY);
        return;
      case TYPEOF:
        add("typeof ");
        addExpr(n.getFirstChild(), PRECEDENCE_UNARY);
        return;
      case VOID:
        add("void ");
        addExpr(n.getFirstChild(), PRECEDENCE_UNARY);
        return;
      case HOOK:
        addExpr(n.getFirstChild(), PRECEDENCE_HOOK + 1);
        add(" ? ");
        addExpr(n.getSecondChild(), PRECEDENCE_ASSIGN);
        add(" : ");
        addExpr(n.getLastChild(), PRECEDENCE_ASSIGN);
        return;
      case ASSIGN:
        addExpr(n.getFirstChild(), PRECEDENCE_MEMBER);
        add(" = ");
        addExpr(n.getLastChild(), PRECEDENCE_ASSIGN);
        return;
      case FUNCTION:
        addFunction(n);
        return;
      case CLASS:
        addClass(n);
        return;
      case JSX_ELEMENT:
        addJsxElement(n);
        return;
      case JSX_FRAGMENT:
        add("<>");
        addJsxChildren(n.getFirstChild());
        add("</>");
        return;
      default:
        throw new IllegalStateException("Cannot print " + n.getToken());
    }
  }

  private void addBinary(Node n, String op, int precedence) {
    addExpr(n.getFirstChild(), precedence);
    add(op);
    addExpr(n.getLastChild(), precedence + 1);
  }

  private void addList(Node first) {
    for (Node c = first; c != null; c = c.getNext()) {
      addExpr(c, PRECEDENCE_ASSIGN);
      if (c.getNext() != null) {
        add(", ");
      }
    }
  }

  private void addFunction(Node n) {
    Node params = n.getSecondChild();
    Node body = n.getLastChild();
    if (n.isArrowFunction()) {
      add("(");
      addList(params.getFirstChild());
      add(") => ");
      if (body.isBlock()) {
        addBlock(body);
      } else {
        // An object literal body would read as a block.
        addExpr(body, body.isObjectLit() ? PRECEDENCE_PRIMARY + 1 : PRECEDENCE_ASSIGN);
      }
      return;
    }
    String name = n.getFirstChild().getString();
    add(name.isEmpty() ? "function(" : "function " + name + "(");
    addList(params.getFirstChild());
    add(") ");
    addBlock(body);
  }

  private void addClass(Node n) {
    add("class");
    if (n.getFirstChild().isName()) {
      add(" " + n.getFirstChild().getString());
    }
    if (!n.getSecondChild().isEmpty()) {
      add(" extends ");
      addExpr(n.getSecondChild(), PRECEDENCE_MEMBER);
    }
    add(" {");
    Node members = n.getLastChild();
    for (Node member = members.getFirstChild(); member != null; member = member.getNext()) {
      if (member.isStaticMember()) {
        add("static ");
      }
      add(member.getString());
      if (member.isMemberFunctionDef()) {
        Node function = member.getFirstChild();
        add("(");
        addList(function.getSecondChild().getFirstChild());
        add(") ");
        addBlock(function.getLastChild());
      } else {
        if (member.hasChildren()) {
          add(" = ");
          addExpr(member.getFirstChild(), PRECEDENCE_ASSIGN);
        }
        add(";");
      }
      if (member.getNext() != null) {
        add(" ");
      }
    }
    add("}");
  }

  private void addJsxElement(Node n) {
    Node opening = n.getFirstChild();
    add("<" + opening.getString());
    for (Node attribute = opening.getFirstChild();
        attribute != null;
        attribute = attribute.getNext()) {
      add(" " + attribute.getString());
      if (attribute.hasChildren()) {
        add("=");
        Node value = attribute.getFirstChild();
        if (value.isStringLit()) {
          add("\"" + value.getString() + "\"");
        } else {
          addJsxExpressionContainer(value);
        }
      }
    }
    if (opening.isSelfClosing()) {
      add("/>");
      return;
    }
    add(">");
    addJsxChildren(opening.getNext());
    add("</" + opening.getString() + ">");
  }

  private void addJsxChildren(Node first) {
    for (Node c = first; c != null; c = c.getNext()) {
      switch (c.getToken()) {
        case JSX_TEXT:
          add(c.getString());
          break;
        case JSX_EXPRESSION_CONTAINER:
          addJsxExpressionContainer(c);
          break;
        default:
          addExpr(c, 0);
      }
    }
  }

  private void addJsxExpressionContainer(Node n) {
    add("{");
    Node content = n.getFirstChild();
    if (!content.isJsxEmptyExpression()) {
      addExpr(content, PRECEDENCE_ASSIGN);
    }
    add("}");
  }

  private void addPropertyName(String key) {
    if (isIdentifier(key)) {
      add(key);
    } else {
      addString(key);
    }
  }

  private static boolean isIdentifier(String s) {
    if (s.isEmpty() || !Character.isJavaIdentifierStart(s.charAt(0))) {
      return false;
    }
    for (int i = 1; i < s.length(); i++) {
      if (!Character.isJavaIdentifierPart(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private void addString(String s) {
    code.append('\'');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\'':
          code.append("\\'");
          break;
        case '\\':
          code.append("\\\\");
          break;
        case '\n':
          code.append("\\n");
          break;
        default:
          code.append(c);
      }
    }
    code.append('\'');
  }

  private void addNumber(double x) {
    long value = (long) x;
    if (value == x && !(x == 0 && 1 / x < 0)) {
      code.append(value);
    } else {
      code.append(x);
    }
  }

  private void add(String s) {
    code.append(s);
  }

  private static int precedence(Node n) {
    switch (n.getToken()) {
      case ASSIGN:
        return PRECEDENCE_ASSIGN;
      case FUNCTION:
        return n.isArrowFunction() ? PRECEDENCE_ASSIGN : PRECEDENCE_PRIMARY;
      case HOOK:
        return PRECEDENCE_HOOK;
      case OR:
        return PRECEDENCE_OR;
      case AND:
        return PRECEDENCE_AND;
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
        return PRECEDENCE_EQUALITY;
      case ADD:
        return PRECEDENCE_ADD;
      case NOT:
      case TYPEOF:
      case VOID:
        return PRECEDENCE_UNARY;
      case CALL:
      case GETPROP:
        return PRECEDENCE_MEMBER;
      default:
        return PRECEDENCE_PRIMARY;
    }
  }
}
