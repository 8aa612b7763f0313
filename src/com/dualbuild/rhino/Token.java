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

/**
 * The node kinds of the source tree handed to the pruning passes.
 *
 * <p>This is the subset of JavaScript handled by the restricted-build passes plus the JSX markup
 * kinds. The expected children of each kind are documented next to it; {@code
 * com.dualbuild.jscomp.AstValidator} enforces them.
 */
public enum Token {
  ROOT, // Holds one or more SCRIPTs
  SCRIPT, // top-level node for entire script
  BLOCK, // statement block
  EMPTY,

  EXPR_RESULT, // expression statement
  RETURN,
  IF, // [condition, BLOCK, BLOCK?]

  VAR,
  LET, // block scoped vars
  CONST,

  FUNCTION, // [NAME, PARAM_LIST, BLOCK | expression]
  PARAM_LIST,

  CLASS, // [NAME | EMPTY, superclass | EMPTY, CLASS_MEMBERS]
  CLASS_MEMBERS, // class member container
  MEMBER_FIELD_DEF, // string name, optional value
  MEMBER_FUNCTION_DEF, // string name, [FUNCTION]

  IMPORT, // [NAME | EMPTY, IMPORT_SPECS | IMPORT_STAR | EMPTY, STRINGLIT]
  IMPORT_SPECS,
  IMPORT_SPEC, // [NAME imported, NAME local]
  IMPORT_STAR, // "* as name", string node holding the local name
  EXPORT, // [declaration | expression]

  NAME,
  STRINGLIT,
  NUMBER,
  TRUE,
  FALSE,
  NULL,

  CALL, // [callee, arguments...]
  GETPROP, // string property name, [receiver]
  OBJECTLIT, // object literal
  STRING_KEY, // object literal key, [value]
  ARRAYLIT, // array literal

  AND, // logical and (&&)
  OR, // logical or (||)
  NOT,
  HOOK, // conditional (?:)
  ASSIGN, // simple assignment  (=)
  EQ,
  NE,
  SHEQ, // shallow equality (===)
  SHNE, // shallow inequality (!==)
  ADD,
  TYPEOF,
  VOID, // void keyword

  // JSX
  JSX_ELEMENT, // [JSX_OPENING_ELEMENT, content...]
  JSX_OPENING_ELEMENT, // string tag name, [JSX_ATTRIBUTE...]
  JSX_ATTRIBUTE, // string attribute name, [STRINGLIT | JSX_EXPRESSION_CONTAINER]?
  JSX_EXPRESSION_CONTAINER, // [expression | JSX_EMPTY_EXPRESSION]
  JSX_EMPTY_EXPRESSION, // {} or {/* comment */}
  JSX_TEXT, // string node holding the raw text
  JSX_FRAGMENT; // <>content...</>
}
