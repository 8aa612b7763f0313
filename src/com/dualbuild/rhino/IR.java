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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.List;

/** An AST construction helper class */
public class IR {

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node root(Node... rootChildren) {
    Node root = new Node(Token.ROOT);
    for (Node child : rootChildren) {
      checkState(child.isScript(), child);
      root.addChildToBack(child);
    }
    return root;
  }

  public static Node script(Node... stmts) {
    Node script = new Node(Token.SCRIPT);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Script cannot contain %s", stmt.getToken());
      script.addChildToBack(stmt);
    }
    return script;
  }

  public static Node script(List<Node> stmts) {
    return script(stmts.toArray(new Node[0]));
  }

  public static Node block(Node... stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  // ==========================================================================
  // Modules

  /** {@code import defaultName from 'module'} */
  public static Node importDefault(String defaultName, String module) {
    return new Node(Token.IMPORT, name(defaultName), empty(), string(module));
  }

  /** {@code import {a, b as c} from 'module'}; pass specs built with {@link #importSpec}. */
  public static Node importNamed(String module, Node... specs) {
    return importNode(empty(), importSpecs(specs), string(module));
  }

  /** {@code import * as name from 'module'} */
  public static Node importStar(String localName, String module) {
    return importNode(empty(), Node.newString(Token.IMPORT_STAR, localName), string(module));
  }

  public static Node importNode(Node name, Node importSpecs, Node moduleIdentifier) {
    checkState(name.isName() || name.isEmpty(), name);
    checkState(
        importSpecs.isImportSpecs() || importSpecs.isImportStar() || importSpecs.isEmpty(),
        importSpecs);
    checkState(moduleIdentifier.isStringLit(), moduleIdentifier);
    return new Node(Token.IMPORT, name, importSpecs, moduleIdentifier);
  }

  public static Node importSpecs(Node... specs) {
    Node importSpecs = new Node(Token.IMPORT_SPECS);
    for (Node spec : specs) {
      checkState(spec.isImportSpec(), spec);
      importSpecs.addChildToBack(spec);
    }
    return importSpecs;
  }

  /** {@code {name}} */
  public static Node importSpec(String name) {
    return importSpec(name, name);
  }

  /** {@code {imported as local}} */
  public static Node importSpec(String imported, String local) {
    return new Node(Token.IMPORT_SPEC, name(imported), name(local));
  }

  public static Node export(Node declaration) {
    return new Node(Token.EXPORT, declaration);
  }

  public static Node exportDefault(Node declarationOrExpression) {
    Node export = new Node(Token.EXPORT, declarationOrExpression);
    export.setDefaultExport(true);
    return export;
  }

  // ==========================================================================
  // Declarations and statements

  public static Node var(Node lhs, Node value) {
    return declaration(lhs, value, Token.VAR);
  }

  public static Node let(Node lhs, Node value) {
    return declaration(lhs, value, Token.LET);
  }

  public static Node constNode(Node lhs, Node value) {
    return declaration(lhs, value, Token.CONST);
  }

  public static Node declaration(Node lhs, Token type) {
    checkState(lhs.isName(), lhs);
    checkArgument(type == Token.VAR || type == Token.LET || type == Token.CONST, type);
    return new Node(type, lhs);
  }

  public static Node declaration(Node lhs, Node value, Token type) {
    checkState(lhs.isName() && !lhs.hasChildren(), lhs);
    checkState(mayBeExpression(value), value);
    lhs.addChildToBack(value);
    return declaration(lhs, type);
  }

  /** Adds another declarator to an existing VAR, LET or CONST. */
  public static Node addDeclarator(Node declaration, Node lhs) {
    checkState(declaration.isNameDeclaration(), declaration);
    checkState(lhs.isName(), lhs);
    declaration.addChildToBack(lhs);
    return declaration;
  }

  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName());
    checkState(params.isParamList());
    checkState(body.isBlock());
    return new Node(Token.FUNCTION, name, params, body);
  }

  public static Node arrowFunction(Node params, Node body) {
    checkState(params.isParamList());
    checkState(body.isBlock() || mayBeExpression(body));
    Node func = new Node(Token.FUNCTION, name(""), params, body);
    func.setIsArrowFunction(true);
    return func;
  }

  public static Node paramList(Node... params) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (Node param : params) {
      checkState(param.isName());
      paramList.addChildToBack(param);
    }
    return paramList;
  }

  public static Node classNode(Node name, Node superClass, Node members) {
    checkState(name.isName() || name.isEmpty());
    checkState(mayBeExpression(superClass) || superClass.isEmpty());
    checkState(members.isClassMembers());
    return new Node(Token.CLASS, name, superClass, members);
  }

  public static Node classMembers(Node... members) {
    Node classMembers = new Node(Token.CLASS_MEMBERS);
    for (Node member : members) {
      checkState(member.isMemberFieldDef() || member.isMemberFunctionDef(), member);
      classMembers.addChildToBack(member);
    }
    return classMembers;
  }

  public static Node memberFieldDef(String name) {
    return Node.newString(Token.MEMBER_FIELD_DEF, name);
  }

  public static Node memberFieldDef(String name, Node value) {
    checkState(mayBeExpression(value), value);
    Node field = Node.newString(Token.MEMBER_FIELD_DEF, name);
    field.addChildToBack(value);
    return field;
  }

  public static Node memberFunctionDef(String name, Node function) {
    checkState(function.isFunction());
    Node member = Node.newString(Token.MEMBER_FUNCTION_DEF, name);
    member.addChildToBack(function);
    return member;
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.RETURN, expr);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    checkState(elseNode.isBlock());
    return new Node(Token.IF, cond, then, elseNode);
  }

  // ==========================================================================
  // Expressions

  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  public static Node string(String s) {
    return Node.newString(s);
  }

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  public static Node call(Node target, Node... args) {
    checkState(mayBeExpression(target));
    Node call = new Node(Token.CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node getprop(Node target, String prop) {
    checkState(mayBeExpression(target));
    Node getprop = Node.newString(Token.GETPROP, prop);
    getprop.addChildToBack(target);
    return getprop;
  }

  public static Node getprop(Node target, String prop, String... moreProps) {
    Node result = getprop(target, prop);
    for (String moreProp : moreProps) {
      result = getprop(result, moreProp);
    }
    return result;
  }

  public static Node objectlit(Node... propdefs) {
    Node objectlit = new Node(Token.OBJECTLIT);
    for (Node propdef : propdefs) {
      checkState(propdef.isStringKey(), propdef);
      objectlit.addChildToBack(propdef);
    }
    return objectlit;
  }

  public static Node stringKey(String s, Node value) {
    checkState(mayBeExpression(value), value);
    Node stringKey = Node.newString(Token.STRING_KEY, s);
    stringKey.addChildToBack(value);
    return stringKey;
  }

  public static Node arraylit(Node... exprs) {
    Node arraylit = new Node(Token.ARRAYLIT);
    for (Node expr : exprs) {
      checkState(mayBeExpression(expr), expr);
      arraylit.addChildToBack(expr);
    }
    return arraylit;
  }

  public static Node and(Node expr1, Node expr2) {
    return binaryOp(Token.AND, expr1, expr2);
  }

  public static Node or(Node expr1, Node expr2) {
    return binaryOp(Token.OR, expr1, expr2);
  }

  public static Node not(Node expr1) {
    return unaryOp(Token.NOT, expr1);
  }

  public static Node hook(Node cond, Node trueval, Node falseval) {
    checkState(mayBeExpression(cond));
    checkState(mayBeExpression(trueval));
    checkState(mayBeExpression(falseval));
    return new Node(Token.HOOK, cond, trueval, falseval);
  }

  public static Node assign(Node target, Node expr) {
    checkState(target.isName() || target.isGetProp(), target);
    checkState(mayBeExpression(expr));
    return new Node(Token.ASSIGN, target, expr);
  }

  public static Node shne(Node expr1, Node expr2) {
    return binaryOp(Token.SHNE, expr1, expr2);
  }

  public static Node add(Node expr1, Node expr2) {
    return binaryOp(Token.ADD, expr1, expr2);
  }

  public static Node typeof(Node expr1) {
    return unaryOp(Token.TYPEOF, expr1);
  }

  public static Node voidNode(Node expr1) {
    return unaryOp(Token.VOID, expr1);
  }

  private static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkState(mayBeExpression(expr1), expr1);
    checkState(mayBeExpression(expr2), expr2);
    return new Node(token, expr1, expr2);
  }

  private static Node unaryOp(Token token, Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(token, expr);
  }

  // ==========================================================================
  // JSX

  /** {@code <tag attributes.../>} */
  public static Node jsxSelfClosing(String tag, Node... attributes) {
    Node opening = jsxOpeningElement(tag, attributes);
    opening.setSelfClosing(true);
    return new Node(Token.JSX_ELEMENT, opening);
  }

  /** {@code <tag ...>children...</tag>} where {@code opening} comes from {@link #jsxOpeningElement}. */
  public static Node jsxElement(Node opening, Node... children) {
    checkState(opening.isJsxOpeningElement(), opening);
    Node element = new Node(Token.JSX_ELEMENT, opening);
    for (Node child : children) {
      checkState(mayBeJsxChild(child), "JSX element cannot contain %s", child.getToken());
      element.addChildToBack(child);
    }
    return element;
  }

  public static Node jsxOpeningElement(String tag, Node... attributes) {
    checkArgument(!tag.isEmpty());
    Node opening = Node.newString(Token.JSX_OPENING_ELEMENT, tag);
    for (Node attribute : attributes) {
      checkState(attribute.isJsxAttribute(), attribute);
      opening.addChildToBack(attribute);
    }
    return opening;
  }

  public static Node jsxFragment(Node... children) {
    Node fragment = new Node(Token.JSX_FRAGMENT);
    for (Node child : children) {
      checkState(mayBeJsxChild(child), "JSX fragment cannot contain %s", child.getToken());
      fragment.addChildToBack(child);
    }
    return fragment;
  }

  /** {@code name} with no value. */
  public static Node jsxAttribute(String name) {
    return Node.newString(Token.JSX_ATTRIBUTE, name);
  }

  /** {@code name="value"} or {@code name={expr}}. */
  public static Node jsxAttribute(String name, Node value) {
    checkState(value.isStringLit() || value.isJsxExpressionContainer(), value);
    Node attribute = Node.newString(Token.JSX_ATTRIBUTE, name);
    attribute.addChildToBack(value);
    return attribute;
  }

  public static Node jsxExpressionContainer(Node expr) {
    checkState(mayBeExpression(expr) || expr.isJsxEmptyExpression(), expr);
    return new Node(Token.JSX_EXPRESSION_CONTAINER, expr);
  }

  public static Node jsxEmptyExpression() {
    return new Node(Token.JSX_EMPTY_EXPRESSION);
  }

  public static Node jsxText(String text) {
    return Node.newString(Token.JSX_TEXT, text);
  }

  // ==========================================================================
  // Shape checks

  /** It isn't possible to always determine if a detached node is a expression, so just reject known statements. */
  public static boolean mayBeStatement(Node n) {
    switch (n.getToken()) {
      case EMPTY:
      case FUNCTION:
        // EMPTY and FUNCTION are used both in expression and statement
        // contexts
        return true;

      case BLOCK:
      case CLASS:
      case CONST:
      case EXPORT:
      case EXPR_RESULT:
      case IF:
      case IMPORT:
      case LET:
      case RETURN:
      case VAR:
        return true;

      default:
        return false;
    }
  }

  /** It isn't possible to always determine if a detached node is a expression, so just reject known statements. */
  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
      case CLASS:
        // FUNCTION and CLASS are used both in expression and statement
        // contexts.
        return true;

      case ADD:
      case AND:
      case ARRAYLIT:
      case ASSIGN:
      case CALL:
      case EQ:
      case FALSE:
      case GETPROP:
      case HOOK:
      case JSX_ELEMENT:
      case JSX_FRAGMENT:
      case NAME:
      case NE:
      case NOT:
      case NULL:
      case NUMBER:
      case OBJECTLIT:
      case OR:
      case SHEQ:
      case SHNE:
      case STRINGLIT:
      case TRUE:
      case TYPEOF:
      case VOID:
        return true;

      default:
        return false;
    }
  }

  public static boolean mayBeJsxChild(Node n) {
    switch (n.getToken()) {
      case JSX_ELEMENT:
      case JSX_FRAGMENT:
      case JSX_TEXT:
      case JSX_EXPRESSION_CONTAINER:
        return true;
      default:
        return false;
    }
  }
}
