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

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;
import java.util.Objects;

/** Minimal class holding information about a source comment's location and contents */
public final class Comment implements Serializable {
  private static final long serialVersionUID = 1L;

  /** How the comment was written in the source. */
  public enum Style {
    /** A {@code // ...} comment. */
    LINE,
    /** A {@code /* ... *}{@code /} comment. */
    BLOCK
  }

  private final Style style;
  private final String contents;
  private final int lineno;
  private final int charno;

  /**
   * @param style how the comment was written
   * @param contents the text between the comment delimiters
   * @param lineno one-indexed line the comment starts on, or -1 if unknown
   * @param charno zero-indexed column the comment starts on, or -1 if unknown
   */
  public Comment(Style style, String contents, int lineno, int charno) {
    this.style = checkNotNull(style);
    this.contents = checkNotNull(contents);
    this.lineno = lineno;
    this.charno = charno;
  }

  public static Comment line(String contents, int lineno) {
    return new Comment(Style.LINE, contents, lineno, 0);
  }

  public static Comment block(String contents, int lineno) {
    return new Comment(Style.BLOCK, contents, lineno, 0);
  }

  public Style getStyle() {
    return style;
  }

  public String getCommentString() {
    return contents;
  }

  /** Returns the line the comment starts on, or -1 when the parser gave no location. */
  public int getLineno() {
    return lineno;
  }

  public int getCharno() {
    return charno;
  }

  public boolean hasLocation() {
    return lineno >= 0;
  }

  public boolean contains(String token) {
    return contents.contains(token);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Comment)) {
      return false;
    }
    Comment that = (Comment) o;
    return style == that.style
        && lineno == that.lineno
        && charno == that.charno
        && contents.equals(that.contents);
  }

  @Override
  public int hashCode() {
    return Objects.hash(style, contents, lineno, charno);
  }

  @Override
  public String toString() {
    String text = style == Style.LINE ? "//" + contents : "/*" + contents + "*/";
    return lineno < 0 ? text : text + " @" + lineno + ":" + charno;
  }
}
