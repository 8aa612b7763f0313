/*
 * Copyright 2007 The Closure Compiler Authors.
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

import com.google.common.collect.ImmutableList;

/**
 * The error manager is in charge of storing, organizing and displaying errors and warnings
 * reported while pruning.
 */
public interface ErrorManager {

  /**
   * Reports an error. The errors will be displayed by {@link #generateReport()} at the discretion
   * of the implementation.
   *
   * @param level the level of the message being reported
   * @param error the error
   */
  void report(CheckLevel level, JSError error);

  /** Writes a report to an implementation-specific medium. */
  void generateReport();

  /** Gets the number of errors. */
  int getErrorCount();

  /** Gets the number of warnings. */
  int getWarningCount();

  /** Gets all errors. */
  ImmutableList<JSError> getErrors();

  /** Gets all warnings. */
  ImmutableList<JSError> getWarnings();

  /** Returns true if a file failed and its output must not be used. */
  default boolean hasHaltingErrors() {
    return getErrorCount() > 0;
  }
}
