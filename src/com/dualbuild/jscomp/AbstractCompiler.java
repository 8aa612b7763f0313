/*
 * Copyright 2009 The Closure Compiler Authors.
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

/**
 * An abstract class whose implementations run passes over source trees.
 *
 * <p>This is the surface passes see: the options, error reporting and change accounting.
 */
public abstract class AbstractCompiler {

  /** Gets the options the passes run with. */
  public abstract PruneOptions getOptions();

  /** Report an error or warning. */
  public abstract void report(JSError error);

  /** Gets the error manager. */
  public abstract ErrorManager getErrorManager();

  /**
   * Records that the tree under {@code n} was changed: a node removed, replaced or rewritten.
   */
  public abstract void reportChangeToEnclosingScope(Node n);

  /** Throws an internal error with the given message and cause. */
  abstract void throwInternalError(String msg, Throwable cause);
}
