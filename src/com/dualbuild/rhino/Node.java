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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import java.io.IOException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>Children are kept in a doubly linked sibling list: {@code first.previous} points at the last
 * child so appending is constant time, and the last child's {@code next} is null.
 */
public class Node {

  enum Prop {
    // Comments the parser attached before this node
    LEADING_COMMENTS,
    // Comments the parser attached after this node
    TRAILING_COMMENTS,
    // Every comment of the file, recorded on the SCRIPT
    FILE_COMMENTS,
    // The name of the file this SCRIPT was parsed from
    SOURCE_FILE,
    // Set on a JSX_OPENING_ELEMENT written as <Tag/>
    SELF_CLOSING,
    // Set on a FUNCTION written with =>
    ARROW_FUNCTION,
    // Set if class member definition is static
    STATIC_MEMBER,
    // Set on an EXPORT written as "export default"
    EXPORT_DEFAULT,
  }

  private static final EnumSet<Prop> PROPS_FOR_EQUALITY =
      EnumSet.of(Prop.SELF_CLOSING, Prop.ARROW_FUNCTION, Prop.STATIC_MEMBER, Prop.EXPORT_DEFAULT);

  private static final class NumberNode extends Node {

    private final double number;

    NumberNode(double number) {
      super(Token.NUMBER);
      this.number = number;
    }

    @Override
    boolean isEquivalentToShallow(Node node) {
      return super.isEquivalentToShallow(node) && this.number == ((NumberNode) node).number;
    }

    @Override
    Node cloneNodeImpl() {
      return new NumberNode(number);
    }
  }

  private static final class StringNode extends Node {

    private String str;

    StringNode(Token token, String str) {
      super(token);
      this.str = checkNotNull(str, "String node with null string: %s", token);
    }

    @Override
    boolean isEquivalentToShallow(Node node) {
      return super.isEquivalentToShallow(node) && this.str.equals(((StringNode) node).str);
    }

    @Override
    Node cloneNodeImpl() {
      return new StringNode(getToken(), str);
    }
  }

  private static final class PropListItem {
    final Prop propType;
    final Object value;
    final @Nullable PropListItem next;

    PropListItem(Prop propType, Object value, @Nullable PropListItem next) {
      this.propType = propType;
      this.value = value;
      this.next = next;
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  private Token token; // Type of the token of the node; NAME for example
  private @Nullable Node next; // next sibling, a linked list
  private @Nullable Node previous; // previous sibling, a circular linked list
  private @Nullable Node first; // first element of a linked list of children
  private @Nullable Node parent;
  // We get the first child as first and the last child as first.previous
  private @Nullable PropListItem propListHead;
  private int linenoCharno = -1;

  public Node(Token token) {
    this.token = token;
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public static Node newNumber(double number) {
    return new NumberNode(number);
  }

  public static Node newString(String str) {
    return new StringNode(Token.STRINGLIT, str);
  }

  public static Node newString(Token token, String str) {
    return new StringNode(token, str);
  }

  public final Token getToken() {
    return token;
  }

  // ==========================================================================
  // Children

  public final boolean hasChildren() {
    return first != null;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), "Expected exactly one child: %s", this);
    return first;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child
   */
  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  /**
   * Gets the index of a child, note that this is O(N) where N is the number of children.
   *
   * @param child The child
   * @return The index of the child
   */
  public final int getIndexOfChild(Node child) {
    Node n = first;
    int i = 0;
    while (n != null) {
      if (child == n) {
        return i;
      }

      n = n.next;
      i++;
    }
    return -1;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);

    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      // NOTE: child.next remains null
      child.previous = last;
      first.previous = child;
    }

    child.parent = this;
  }

  public final void insertAfter(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    final Node existingParent = existing.parent;
    final Node existingNext = existing.next;

    this.parent = existingParent;

    existing.next = this;
    this.previous = existing;

    if (existingNext == null) {
      existingParent.first.previous = this;
      // this.next remains null
    } else {
      existingNext.previous = this;
      this.next = existingNext;
    }
  }

  public final void insertBefore(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    final Node existingParent = existing.parent;
    final Node existingPrevious = existing.previous;

    this.parent = existingParent;

    this.next = existing;
    existing.previous = this;

    this.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = this;
      // existingPrevious.next remains null
    } else {
      // existingParent.first remains existing
      existingPrevious.next = this;
    }
  }

  /** Swaps `replacement` and its subtree into the position of `this`. */
  public final void replaceWith(Node replacement) {
    this.checkAttached();
    replacement.checkDetached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    replacement.srcrefIfMissing(this);

    // The sequence below also has to work when `this` is an only child, which can cause many of the
    // variables to point to the same object.

    this.parent = null;
    replacement.parent = existingParent;

    this.previous = null;
    if (existingPrevious == this) {
      // only child
      replacement.previous = replacement;
      existingParent.first = replacement;
      return;
    }
    replacement.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = replacement;
      // existingPrevious.next remains null
    } else {
      // existingParent.first is unchanged;
      existingPrevious.next = replacement;
    }

    if (existingNext == null) {
      // this.next remains null;
      existingParent.first.previous = replacement;
      // replacement.next remains null
    } else {
      this.next = null;
      existingNext.previous = replacement;
      replacement.next = existingNext;
    }
  }

  /** Removes this node from its parent, but retains its subtree. */
  @CanIgnoreReturnValue
  public final Node detach() {
    this.checkAttached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    // The sequence below also has to work when `this` is an only child or has a single sibling,
    // which can cause many of the variables to point to the same object.

    this.parent = null;

    if (existingNext == null) {
      // this.next remains null;
      existingParent.first.previous = existingPrevious;
    } else {
      this.next = null;
      existingNext.previous = existingPrevious;
    }

    this.previous = null;
    if (existingPrevious.next == null) {
      existingParent.first = existingNext;
      // existingPrevious.next remains null
    } else {
      // existingParent.first is unchanged;
      existingPrevious.next = existingNext;
    }

    return this;
  }

  private void checkAttached() {
    checkState(this.parent != null, "Has no parent: %s", this);
  }

  private void checkDetached() {
    checkState(this.parent == null, "Has parent: %s", this);
    checkState(this.next == null, "Has next: %s", this);
    checkState(this.previous == null, "Has previous: %s", this);
  }

  /**
   * Return an iterable object that iterates over this node's children. The iterator does not
   * support the optional operation {@link Iterator#remove()}.
   *
   * <p>Do not detach the current child while iterating; capture {@link #getNext()} first instead.
   */
  public final Iterable<Node> children() {
    if (first == null) {
      return Collections.emptySet();
    } else {
      final Node start = first;
      return () -> new SiblingNodeIterator(start);
    }
  }

  private static final class SiblingNodeIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingNodeIterator(Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = current.getNext();
      return n;
    }
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasParent() {
    return parent != null;
  }

  public final boolean isDescendantOf(Node node) {
    for (Node n = parent; n != null; n = n.parent) {
      if (n == node) {
        return true;
      }
    }
    return false;
  }

  /** Returns the nearest SCRIPT enclosing this node, or the node itself if it is one. */
  public final @Nullable Node getEnclosingScript() {
    Node n = this;
    while (n != null && !n.isScript()) {
      n = n.parent;
    }
    return n;
  }

  // ==========================================================================
  // Properties

  private @Nullable PropListItem lookupProperty(Prop prop) {
    for (PropListItem x = propListHead; x != null; x = x.next) {
      if (x.propType == prop) {
        return x;
      }
    }
    return null;
  }

  final @Nullable Object getProp(Prop prop) {
    PropListItem item = lookupProperty(prop);
    return item == null ? null : item.value;
  }

  final boolean getBooleanProp(Prop prop) {
    return Boolean.TRUE.equals(getProp(prop));
  }

  final void putProp(Prop prop, @Nullable Object value) {
    PropListItem head = removeProp(propListHead, prop);
    propListHead = value == null ? head : new PropListItem(prop, value, head);
  }

  final void putBooleanProp(Prop prop, boolean value) {
    putProp(prop, value ? Boolean.TRUE : null);
  }

  private static @Nullable PropListItem removeProp(@Nullable PropListItem item, Prop prop) {
    if (item == null) {
      return null;
    }
    if (item.propType == prop) {
      return item.next;
    }
    PropListItem rest = removeProp(item.next, prop);
    return rest == item.next ? item : new PropListItem(item.propType, item.value, rest);
  }

  // ==========================================================================
  // Comments

  @SuppressWarnings("unchecked")
  private ImmutableList<Comment> getComments(Prop prop) {
    Object comments = getProp(prop);
    return comments == null ? ImmutableList.of() : (ImmutableList<Comment>) comments;
  }

  private void addComment(Prop prop, Comment comment) {
    putProp(
        prop,
        ImmutableList.<Comment>builder().addAll(getComments(prop)).add(comment).build());
  }

  /** Comments the parser attached in front of this node. */
  public final ImmutableList<Comment> getLeadingComments() {
    return getComments(Prop.LEADING_COMMENTS);
  }

  /** Comments the parser attached after this node. */
  public final ImmutableList<Comment> getTrailingComments() {
    return getComments(Prop.TRAILING_COMMENTS);
  }

  @CanIgnoreReturnValue
  public final Node addLeadingComment(Comment comment) {
    addComment(Prop.LEADING_COMMENTS, checkNotNull(comment));
    return this;
  }

  @CanIgnoreReturnValue
  public final Node addTrailingComment(Comment comment) {
    addComment(Prop.TRAILING_COMMENTS, checkNotNull(comment));
    return this;
  }

  public final boolean hasAttachedComments() {
    return getProp(Prop.LEADING_COMMENTS) != null || getProp(Prop.TRAILING_COMMENTS) != null;
  }

  /**
   * Returns every comment of the file as recorded by the parser, or null if the parser did not
   * record them. Only meaningful on a SCRIPT.
   */
  @SuppressWarnings("unchecked")
  public final @Nullable ImmutableList<Comment> getFileComments() {
    return (ImmutableList<Comment>) getProp(Prop.FILE_COMMENTS);
  }

  @CanIgnoreReturnValue
  public final Node setFileComments(List<Comment> comments) {
    checkState(isScript(), "File comments belong on a SCRIPT: %s", this);
    putProp(Prop.FILE_COMMENTS, ImmutableList.copyOf(comments));
    return this;
  }

  // ==========================================================================
  // Flags

  public final boolean isSelfClosing() {
    return getBooleanProp(Prop.SELF_CLOSING);
  }

  public final void setSelfClosing(boolean value) {
    checkState(token == Token.JSX_OPENING_ELEMENT, this);
    putBooleanProp(Prop.SELF_CLOSING, value);
  }

  public final boolean isArrowFunction() {
    return getBooleanProp(Prop.ARROW_FUNCTION);
  }

  public final void setIsArrowFunction(boolean value) {
    checkState(isFunction(), this);
    putBooleanProp(Prop.ARROW_FUNCTION, value);
  }

  public final boolean isStaticMember() {
    return getBooleanProp(Prop.STATIC_MEMBER);
  }

  public final void setStaticMember(boolean value) {
    putBooleanProp(Prop.STATIC_MEMBER, value);
  }

  public final boolean isDefaultExport() {
    return getBooleanProp(Prop.EXPORT_DEFAULT);
  }

  public final void setDefaultExport(boolean value) {
    checkState(isExport(), this);
    putBooleanProp(Prop.EXPORT_DEFAULT, value);
  }

  // ==========================================================================
  // Values

  public final double getDouble() {
    checkState(this instanceof NumberNode, "Not a number node: %s", this);
    return ((NumberNode) this).number;
  }

  public final String getString() {
    checkState(this instanceof StringNode, "Not a string node: %s", this);
    return ((StringNode) this).str;
  }

  public final void setString(String str) {
    checkState(this instanceof StringNode, "Not a string node: %s", this);
    ((StringNode) this).str = checkNotNull(str);
  }

  public final boolean isStringNode() {
    return this instanceof StringNode;
  }

  /**
   * This function takes a set of GETPROP nodes and produces a string that is each property
   * separated by dots. If the node ultimately under the left sub-tree is not a simple name, this is
   * not a valid qualified name.
   *
   * @return a null if this is not a qualified name, or a dot-separated string of the name and
   *     properties.
   */
  public final @Nullable String getQualifiedName() {
    switch (token) {
      case NAME:
        String name = getString();
        return name.isEmpty() ? null : name;
      case GETPROP:
        String left = first == null ? null : first.getQualifiedName();
        return left == null ? null : left + "." + getString();
      default:
        return null;
    }
  }

  public final boolean matchesQualifiedName(String name) {
    return name.equals(getQualifiedName());
  }

  // ==========================================================================
  // Source position

  public final @Nullable String getSourceFileName() {
    Node script = getEnclosingScript();
    return script == null ? null : (String) script.getProp(Prop.SOURCE_FILE);
  }

  @CanIgnoreReturnValue
  public final Node setSourceFileName(String name) {
    checkState(isScript(), "Source file names belong on a SCRIPT: %s", this);
    putProp(Prop.SOURCE_FILE, name);
    return this;
  }

  /**
   * CHARNO_BITS represents how many of the lower-order bits of linenoCharno are reserved for
   * storing the column number. Bits above these store the line number.
   */
  private static final int CHARNO_BITS = 12;

  /** The maximum column number that can be represented. */
  public static final int MAX_COLUMN_NUMBER = (1 << CHARNO_BITS) - 1;

  public final int getLineno() {
    if (this.linenoCharno == -1) {
      return -1;
    } else {
      return this.linenoCharno >>> CHARNO_BITS;
    }
  }

  // Returns the 0-based column number
  public final int getCharno() {
    if (this.linenoCharno == -1) {
      return -1;
    } else {
      return this.linenoCharno & MAX_COLUMN_NUMBER;
    }
  }

  /**
   * Merges the line number and character number in one integer.
   *
   * <p>The charno takes the first 12 bits and the line number takes the rest. If the charno is
   * greater than (2^12)-1 it is adjusted to (2^12)-1
   */
  @CanIgnoreReturnValue
  public final Node setLinenoCharno(int lineno, int charno) {
    if (lineno < 0 || charno < 0) {
      this.linenoCharno = -1;
      return this;
    }

    if (charno > MAX_COLUMN_NUMBER) {
      charno = MAX_COLUMN_NUMBER;
    }
    this.linenoCharno = (lineno << CHARNO_BITS) | charno;

    return this;
  }

  /** Copy the source position from `other` onto `this`. */
  @CanIgnoreReturnValue
  public final Node srcref(Node other) {
    linenoCharno = other.linenoCharno;
    return this;
  }

  /** For all Nodes in the subtree of `this`, copy the source position from `other`. */
  @CanIgnoreReturnValue
  public final Node srcrefTree(Node other) {
    this.srcref(other);
    for (Node child = first; child != null; child = child.next) {
      child.srcrefTree(other);
    }
    return this;
  }

  /** Iff the source position is not set on `this`, copy it from `other`. */
  @CanIgnoreReturnValue
  public final Node srcrefIfMissing(Node other) {
    if (linenoCharno == -1) {
      linenoCharno = other.linenoCharno;
    }
    return this;
  }

  // ==========================================================================
  // Cloning and equivalence

  Node cloneNodeImpl() {
    return new Node(token);
  }

  /** Returns a detached clone of the Node, specifically excluding its children. */
  @CheckReturnValue
  public final Node cloneNode() {
    Node clone = cloneNodeImpl();
    clone.linenoCharno = this.linenoCharno;
    clone.propListHead = this.propListHead;
    return clone;
  }

  /** Returns a detached clone of the Node and all its children. */
  @CheckReturnValue
  public final Node cloneTree() {
    Node result = cloneNode();
    for (Node child = first; child != null; child = child.next) {
      result.addChildToBack(child.cloneTree());
    }
    return result;
  }

  boolean isEquivalentToShallow(Node node) {
    if (token != node.token || this.getClass() != node.getClass()) {
      return false;
    }
    for (Prop prop : PROPS_FOR_EQUALITY) {
      if (!Objects.equals(getProp(prop), node.getProp(prop))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns true if this node and its subtree have the same kinds, strings, numbers and flags as
   * {@code node}. Source positions and comments are ignored.
   */
  public final boolean isEquivalentTo(Node node) {
    if (!isEquivalentToShallow(node) || getChildCount() != node.getChildCount()) {
      return false;
    }
    for (Node n = first, m = node.first; n != null; n = n.next, m = m.next) {
      if (!n.isEquivalentTo(m)) {
        return false;
      }
    }
    return true;
  }

  // ==========================================================================
  // Debug output

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (this instanceof StringNode) {
      sb.append(' ');
      sb.append(getString());
    } else if (token == Token.NUMBER) {
      sb.append(' ');
      sb.append(getDouble());
    }
    int lineno = getLineno();
    if (lineno != -1) {
      sb.append(' ');
      sb.append(lineno);
      sb.append(':');
      sb.append(getCharno());
    }
    for (PropListItem x = propListHead; x != null; x = x.next) {
      if (x.propType == Prop.FILE_COMMENTS) {
        continue;
      }
      sb.append(" [");
      sb.append(Ascii.toLowerCase(String.valueOf(x.propType)));
      sb.append(": ");
      sb.append(x);
      sb.append(']');
    }
    return sb.toString();
  }

  @CheckReturnValue
  public final String toStringTree() {
    try {
      StringBuilder s = new StringBuilder();
      appendStringTree(s);
      return s.toString();
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
  }

  public final void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }

  // ==========================================================================
  // Token checks

  public final boolean isRoot() {
    return this.token == Token.ROOT;
  }

  public final boolean isScript() {
    return this.token == Token.SCRIPT;
  }

  public final boolean isBlock() {
    return this.token == Token.BLOCK;
  }

  public final boolean isEmpty() {
    return this.token == Token.EMPTY;
  }

  public final boolean isExprResult() {
    return this.token == Token.EXPR_RESULT;
  }

  public final boolean isVar() {
    return this.token == Token.VAR;
  }

  public final boolean isLet() {
    return this.token == Token.LET;
  }

  public final boolean isConst() {
    return this.token == Token.CONST;
  }

  /** Returns whether this is a VAR, LET or CONST. */
  public final boolean isNameDeclaration() {
    return isVar() || isLet() || isConst();
  }

  public final boolean isFunction() {
    return this.token == Token.FUNCTION;
  }

  public final boolean isParamList() {
    return this.token == Token.PARAM_LIST;
  }

  public final boolean isClass() {
    return this.token == Token.CLASS;
  }

  public final boolean isClassMembers() {
    return this.token == Token.CLASS_MEMBERS;
  }

  public final boolean isMemberFieldDef() {
    return this.token == Token.MEMBER_FIELD_DEF;
  }

  public final boolean isMemberFunctionDef() {
    return this.token == Token.MEMBER_FUNCTION_DEF;
  }

  public final boolean isImport() {
    return this.token == Token.IMPORT;
  }

  public final boolean isImportSpecs() {
    return this.token == Token.IMPORT_SPECS;
  }

  public final boolean isImportSpec() {
    return this.token == Token.IMPORT_SPEC;
  }

  public final boolean isImportStar() {
    return this.token == Token.IMPORT_STAR;
  }

  public final boolean isExport() {
    return this.token == Token.EXPORT;
  }

  public final boolean isName() {
    return this.token == Token.NAME;
  }

  public final boolean isStringLit() {
    return this.token == Token.STRINGLIT;
  }

  public final boolean isTrue() {
    return this.token == Token.TRUE;
  }

  public final boolean isFalse() {
    return this.token == Token.FALSE;
  }

  public final boolean isNull() {
    return this.token == Token.NULL;
  }

  public final boolean isCall() {
    return this.token == Token.CALL;
  }

  public final boolean isGetProp() {
    return this.token == Token.GETPROP;
  }

  public final boolean isObjectLit() {
    return this.token == Token.OBJECTLIT;
  }

  public final boolean isStringKey() {
    return this.token == Token.STRING_KEY;
  }

  public final boolean isArrayLit() {
    return this.token == Token.ARRAYLIT;
  }

  public final boolean isAnd() {
    return this.token == Token.AND;
  }

  public final boolean isAssign() {
    return this.token == Token.ASSIGN;
  }

  public final boolean isJsxElement() {
    return this.token == Token.JSX_ELEMENT;
  }

  public final boolean isJsxOpeningElement() {
    return this.token == Token.JSX_OPENING_ELEMENT;
  }

  public final boolean isJsxAttribute() {
    return this.token == Token.JSX_ATTRIBUTE;
  }

  public final boolean isJsxExpressionContainer() {
    return this.token == Token.JSX_EXPRESSION_CONTAINER;
  }

  public final boolean isJsxEmptyExpression() {
    return this.token == Token.JSX_EMPTY_EXPRESSION;
  }

  public final boolean isJsxFragment() {
    return this.token == Token.JSX_FRAGMENT;
  }
}
