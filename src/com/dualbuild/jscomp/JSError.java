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

import static java.util.Objects.requireNonNull;

import com.dualbuild.rhino.Node;
import org.jspecify.annotations.Nullable;

/**
 * Compile error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source
 * @param lineno One-indexed line number of the error location.
 * @param charno Zero-indexed character number of the error location.
 * @param node Node where the warning occurred.
 * @param defaultLevel The default level, before the reporter overrides it.
 */
public record JSError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    @Nullable Node node,
    CheckLevel defaultLevel) {
  public JSError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates a JSError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static JSError make(DiagnosticType type, String... arguments) {
    return new JSError(type, type.format(arguments), null, -1, -1, null, type.level);
  }

  /**
   * Creates a JSError at a given source location
   *
   * @param sourceName The source file name
   * @param lineno Line number with source file, or -1 if unknown
   * @param charno Column number within line, or -1 for whole line.
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static JSError make(
      @Nullable String sourceName, int lineno, int charno, DiagnosticType type,
      String... arguments) {
    return new JSError(
        type, type.format(arguments), sourceName, lineno, charno, null, type.level);
  }

  /**
   * Creates a JSError from a file and Node position.
   *
   * @param n Determines the line and char position and source file name
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static JSError make(Node n, DiagnosticType type, String... arguments) {
    return new JSError(
        type,
        type.format(arguments),
        n.getSourceFileName(),
        n.getLineno(),
        n.getCharno(),
        n,
        type.level);
  }

  /** Formats this error as {@code file:line:col: LEVEL - [key] description}. */
  public String format(CheckLevel level) {
    StringBuilder sb = new StringBuilder();
    if (sourceName != null) {
      sb.append(sourceName);
      if (lineno > 0) {
        sb.append(':').append(lineno);
        if (charno >= 0) {
          sb.append(':').append(charno);
        }
      }
      sb.append(": ");
    }
    sb.append(level).append(" - [").append(type.key).append("] ").append(description);
    return sb.toString();
  }

  @Override
  public String toString() {
    return type.key + ". " + description + " at " + (sourceName == null ? "(unknown source)" : sourceName)
        + " line " + (lineno != -1 ? String.valueOf(lineno) : "(unknown line)")
        + " : " + (charno != -1 ? String.valueOf(charno) : "(unknown column)");
  }
}
