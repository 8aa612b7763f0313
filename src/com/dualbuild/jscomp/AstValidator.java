/*
 * Copyright 2011 The Closure Compiler Authors.
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

/** This class walks the AST and validates that the structure is correct. */
public final class AstValidator implements CompilerPass {

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  private final ViolationHandler violationHandler;

  public AstValidator(ViolationHandler handler) {
    this.violationHandler = handler;
  }

  public AstValidator() {
    this(
        (message, n) -> {
          throw new IllegalStateException(
              message
                  + ". Reference node:\n"
                  + n.toStringTree()
                  + "\n Parent node:\n"
                  + ((n.getParent() != null) ? n.getParent().toStringTree() : " no parent "));
        });
  }

  @Override
  public void process(Node root) {
    if (root.isRoot()) {
      validateRoot(root);
    } else {
      validateScript(root);
    }
  }

  public void validateRoot(Node n) {
    validateNodeType(Token.ROOT, n);
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      validateScript(c);
    }
  }

  public void validateScript(Node n) {
    validateNodeType(Token.SCRIPT, n);
    validateStatements(n.getFirstChild());
  }

  private void validateStatements(Node n) {
    while (n != null) {
      validateStatement(n);
      n = n.getNext();
    }
  }

  public void validateStatement(Node n) {
    switch (n.getToken()) {
      case EMPTY:
        validateChildCount(n, 0);
        return;
      case BLOCK:
        validateStatements(n.getFirstChild());
        return;
      case EXPR_RESULT:
        validateChildCount(n, 1);
        validateExpression(n.getFirstChild());
        return;
      case RETURN:
        validateChildCountIn(n, 0, 1);
        if (n.hasChildren()) {
          validateExpression(n.getFirstChild());
        }
        return;
      case IF:
        validateIf(n);
        return;
      case VAR:
      case LET:
      case CONST:
        validateNameDeclaration(n);
        return;
      case FUNCTION:
        validateFunction(n, /* isDeclaration= */ true);
        return;
      case CLASS:
        validateClass(n);
        return;
      case IMPORT:
        validateImport(n);
        return;
      case EXPORT:
        validateExport(n);
        return;
      default:
        violation("Expected statement but was " + n.getToken() + ".", n);
    }
  }

  public void validateExpression(Node n) {
    switch (n.getToken()) {
      case NAME:
        validateName(n);
        return;
      case STRINGLIT:
      case NUMBER:
      case TRUE:
      case FALSE:
      case NULL:
        validateChildCount(n, 0);
        return;
      case CALL:
        validateMinimumChildCount(n, 1);
        for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
          validateExpression(c);
        }
        return;
      case GETPROP:
        validateChildCount(n, 1);
        validateExpression(n.getFirstChild());
        return;
      case OBJECTLIT:
        for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
          validateNodeType(Token.STRING_KEY, c);
          validateChildCount(c, 1);
          validateExpression(c.getFirstChild());
        }
        return;
      case ARRAYLIT:
        for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
          validateExpression(c);
        }
        return;
      case AND:
      case OR:
      case EQ:
      case NE:
      case SHEQ:
      case SHNE:
      case ADD:
        validateChildCount(n, 2);
        validateExpression(n.getFirstChild());
        validateExpression(n.getLastChild());
        return;
      case NOT:
      case TYPEOF:
      case VOID:
        validateChildCount(n, 1);
        validateExpression(n.getFirstChild());
        return;
      case HOOK:
        validateChildCount(n, 3);
        for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
          validateExpression(c);
        }
        return;
      case ASSIGN:
        validateChildCount(n, 2);
        if (!n.getFirstChild().isName() && !n.getFirstChild().isGetProp()) {
          violation("Invalid assignment target " + n.getFirstChild().getToken() + ".", n);
        }
        validateExpression(n.getFirstChild());
        validateExpression(n.getLastChild());
        return;
      case FUNCTION:
        validateFunction(n, /* isDeclaration= */ false);
        return;
      case CLASS:
        validateClass(n);
        return;
      case JSX_ELEMENT:
        validateJsxElement(n);
        return;
      case JSX_FRAGMENT:
        validateJsxChildren(n.getFirstChild());
        return;
      default:
        violation("Expected expression but was " + n.getToken() + ".", n);
    }
  }

  private void validateName(Node n) {
    validateNodeType(Token.NAME, n);
    validateChildCount(n, 0);
    validateNonEmptyString(n);
  }

  private void validateIf(Node n) {
    validateChildCountIn(n, 2, 3);
    validateExpression(n.getFirstChild());
    validateNodeType(Token.BLOCK, n.getSecondChild());
    validateStatement(n.getSecondChild());
    if (n.getChildCount() == 3) {
      validateNodeType(Token.BLOCK, n.getLastChild());
      validateStatement(n.getLastChild());
    }
  }

  private void validateNameDeclaration(Node n) {
    validateMinimumChildCount(n, 1);
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      validateNodeType(Token.NAME, c);
      validateNonEmptyString(c);
      validateChildCountIn(c, 0, 1);
      if (c.hasChildren()) {
        validateExpression(c.getFirstChild());
      }
    }
  }

  private void validateFunction(Node n, boolean isDeclaration) {
    validateNodeType(Token.FUNCTION, n);
    validateChildCount(n, 3);
    Node name = n.getFirstChild();
    validateNodeType(Token.NAME, name);
    if (isDeclaration) {
      validateNonEmptyString(name);
      if (n.isArrowFunction()) {
        violation("Arrow functions cannot be declarations.", n);
      }
    } else if (n.isArrowFunction() && !name.getString().isEmpty()) {
      violation("Arrow functions cannot have a name.", n);
    }
    Node params = n.getSecondChild();
    validateNodeType(Token.PARAM_LIST, params);
    for (Node c = params.getFirstChild(); c != null; c = c.getNext()) {
      validateName(c);
    }
    Node body = n.getLastChild();
    if (body.isBlock()) {
      validateStatement(body);
    } else if (n.isArrowFunction()) {
      validateExpression(body);
    } else {
      violation("Expected BLOCK as the function body but was " + body.getToken() + ".", body);
    }
  }

  private void validateClass(Node n) {
    validateNodeType(Token.CLASS, n);
    validateChildCount(n, 3);
    Node name = n.getFirstChild();
    if (!name.isEmpty()) {
      validateName(name);
    }
    Node superClass = n.getSecondChild();
    if (!superClass.isEmpty()) {
      validateExpression(superClass);
    }
    Node members = n.getLastChild();
    validateNodeType(Token.CLASS_MEMBERS, members);
    for (Node c = members.getFirstChild(); c != null; c = c.getNext()) {
      validateClassMember(c);
    }
  }

  private void validateClassMember(Node n) {
    switch (n.getToken()) {
      case MEMBER_FIELD_DEF:
        validateNonEmptyString(n);
        validateChildCountIn(n, 0, 1);
        if (n.hasChildren()) {
          validateExpression(n.getFirstChild());
        }
        return;
      case MEMBER_FUNCTION_DEF:
        validateNonEmptyString(n);
        validateChildCount(n, 1);
        validateFunction(n.getFirstChild(), /* isDeclaration= */ false);
        return;
      default:
        violation("Class contained member of invalid type " + n.getToken(), n);
    }
  }

  private void validateImport(Node n) {
    validateNodeType(Token.IMPORT, n);
    validateChildCount(n, 3);
    Node defaultBinding = n.getFirstChild();
    if (!defaultBinding.isEmpty()) {
      validateName(defaultBinding);
    }
    Node specs = n.getSecondChild();
    switch (specs.getToken()) {
      case EMPTY:
        break;
      case IMPORT_STAR:
        validateNonEmptyString(specs);
        break;
      case IMPORT_SPECS:
        for (Node c = specs.getFirstChild(); c != null; c = c.getNext()) {
          validateNodeType(Token.IMPORT_SPEC, c);
          validateChildCount(c, 2);
          validateName(c.getFirstChild());
          validateName(c.getLastChild());
        }
        break;
      default:
        violation("Expected import specs but was " + specs.getToken() + ".", specs);
    }
    validateNodeType(Token.STRINGLIT, n.getLastChild());
  }

  private void validateExport(Node n) {
    validateChildCount(n, 1);
    Node c = n.getFirstChild();
    switch (c.getToken()) {
      case VAR:
      case LET:
      case CONST:
        validateNameDeclaration(c);
        return;
      case FUNCTION:
        validateFunction(c, /* isDeclaration= */ !n.isDefaultExport());
        return;
      case CLASS:
        validateClass(c);
        return;
      default:
        if (!n.isDefaultExport()) {
          violation("Expected a declaration under export but was " + c.getToken() + ".", c);
          return;
        }
        validateExpression(c);
    }
  }

  private void validateJsxElement(Node n) {
    validateMinimumChildCount(n, 1);
    Node opening = n.getFirstChild();
    validateNodeType(Token.JSX_OPENING_ELEMENT, opening);
    validateNonEmptyString(opening);
    for (Node attribute = opening.getFirstChild();
        attribute != null;
        attribute = attribute.getNext()) {
      validateJsxAttribute(attribute);
    }
    if (opening.isSelfClosing() && n.getChildCount() > 1) {
      violation("Self-closing element has content.", n);
    }
    validateJsxChildren(opening.getNext());
  }

  private void validateJsxAttribute(Node n) {
    validateNodeType(Token.JSX_ATTRIBUTE, n);
    validateNonEmptyString(n);
    validateChildCountIn(n, 0, 1);
    if (!n.hasChildren()) {
      return;
    }
    Node value = n.getFirstChild();
    if (value.isStringLit()) {
      validateChildCount(value, 0);
    } else if (value.isJsxExpressionContainer()) {
      validateJsxExpressionContainer(value);
    } else {
      violation("Invalid attribute value " + value.getToken() + ".", value);
    }
  }

  private void validateJsxChildren(Node n) {
    while (n != null) {
      switch (n.getToken()) {
        case JSX_ELEMENT:
          validateJsxElement(n);
          break;
        case JSX_FRAGMENT:
          validateJsxChildren(n.getFirstChild());
          break;
        case JSX_TEXT:
          validateChildCount(n, 0);
          break;
        case JSX_EXPRESSION_CONTAINER:
          validateJsxExpressionContainer(n);
          break;
        default:
          violation("Markup cannot contain " + n.getToken() + ".", n);
      }
      n = n.getNext();
    }
  }

  private void validateJsxExpressionContainer(Node n) {
    validateChildCount(n, 1);
    Node content = n.getFirstChild();
    if (content.isJsxEmptyExpression()) {
      validateChildCount(content, 0);
    } else {
      validateExpression(content);
    }
  }

  private void violation(String message, Node n) {
    violationHandler.handleViolation(message, n);
  }

  private void validateNodeType(Token type, Node n) {
    if (n.getToken() != type) {
      violation("Expected " + type + " but was " + n.getToken(), n);
    }
  }

  private void validateNonEmptyString(Node n) {
    if (!n.isStringNode() || n.getString().isEmpty()) {
      violation("Expected non-empty string.", n);
    }
  }

  private void validateChildCount(Node n, int expected) {
    int count = n.getChildCount();
    if (expected != count) {
      violation("Expected " + expected + " children, but was " + count, n);
    }
  }

  private void validateChildCountIn(Node n, int min, int max) {
    if (max == min) {
      validateChildCount(n, min);
      return;
    }
    int count = n.getChildCount();
    if (count < min || count > max) {
      violation("Expected child count in [" + min + ", " + max + "], but was " + count, n);
    }
  }

  private void validateMinimumChildCount(Node n, int i) {
    if (n.getChildCount() < i) {
      violation("Expected at least " + i + " children, but was " + n.getChildCount(), n);
    }
  }
}
