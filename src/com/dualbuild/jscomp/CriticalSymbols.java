/*
 * Copyright 2026 The Closure Compiler Authors.
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

import com.google.common.collect.ImmutableSet;

/**
 * The framework modules and rendering primitives that annotated-code removal must never touch.
 *
 * <p>The tables are fixed: an annotation placed on one of these by mistake is ignored rather than
 * allowed to break the restricted build.
 */
public final class CriticalSymbols {

  static final ImmutableSet<String> CRITICAL_MODULES =
      ImmutableSet.of("react", "react-native", "react/jsx-runtime", "react/jsx-dev-runtime");

  static final ImmutableSet<String> CRITICAL_IDENTIFIERS =
      ImmutableSet.of(
          "StyleSheet",
          "View",
          "Text",
          "_jsx",
          "_jsxs",
          "_jsxDEV",
          "Fragment",
          "jsx",
          "jsxs",
          "createElement");

  private CriticalSymbols() {}

  /**
   * Whether an import of {@code importedNames} from {@code moduleName} is protected: the module is
   * a framework module, or any imported name is a critical identifier.
   */
  public static boolean isProtected(String moduleName, Iterable<String> importedNames) {
    if (isCriticalModule(moduleName)) {
      return true;
    }
    for (String name : importedNames) {
      if (isCriticalIdentifier(name)) {
        return true;
      }
    }
    return false;
  }

  public static boolean isCriticalModule(String moduleName) {
    return CRITICAL_MODULES.contains(moduleName);
  }

  public static boolean isCriticalIdentifier(String name) {
    return CRITICAL_IDENTIFIERS.contains(name);
  }
}
